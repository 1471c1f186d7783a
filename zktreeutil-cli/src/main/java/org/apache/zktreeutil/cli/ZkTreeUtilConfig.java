/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.zktreeutil.cli;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Properties;
import org.apache.zookeeper.client.ZKClientConfig;
import org.apache.zookeeper.server.quorum.QuorumPeerConfig.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of a zktreeutil run. Properties starting with {@code zktreeutil.}
 * are initialized from system properties and may be overridden by a
 * properties file.
 */
public class ZkTreeUtilConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ZkTreeUtilConfig.class);

    public static final String PREFIX = "zktreeutil.";
    public static final String SESSION_TIMEOUT = PREFIX + "session.timeout.ms";
    public static final String CONNECT_TIMEOUT = PREFIX + "connect.timeout.ms";
    public static final String WRITE_RETRIES = PREFIX + "write.retries";
    public static final String WRITE_RETRY_DELAY = PREFIX + "write.retry.delay.ms";
    public static final String CREATE_PARENTS = PREFIX + "create.parents";
    public static final String PRINT_MAX_DATA_BYTES = PREFIX + "print.max.data.bytes";
    public static final String PRINT_FORMAT = PREFIX + "print.format";
    public static final String CREATE_ACL = PREFIX + "create.acl";
    /** Authentication as scheme:credentials, added to every connection. */
    public static final String AUTH = PREFIX + "auth";

    public static final int DEFAULT_SESSION_TIMEOUT = 30000;
    public static final int DEFAULT_CONNECT_TIMEOUT = 15000;
    public static final int DEFAULT_WRITE_RETRIES = 3;
    public static final long DEFAULT_WRITE_RETRY_DELAY = 500L;
    public static final int DEFAULT_PRINT_MAX_DATA_BYTES = 1024;
    public static final String DEFAULT_PRINT_FORMAT = "auto";
    public static final String DEFAULT_CREATE_ACL = "open";

    private final Map<String, String> properties = new HashMap<>();
    private ZKClientConfig clientConfig;

    public ZkTreeUtilConfig() {
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) {
                properties.put(key, System.getProperty(key));
            }
        }
    }

    public String getProperty(String key) {
        return properties.get(key);
    }

    public String getProperty(String key, String defaultValue) {
        String value = properties.get(key);
        return (value == null) ? defaultValue : value;
    }

    public void setProperty(String key, String value) {
        if (null == key) {
            throw new IllegalArgumentException("property key is null.");
        }
        String oldValue = properties.put(key, value);
        if (null != oldValue && !oldValue.equals(value)) {
            LOG.debug("key {}'s value {} is replaced with new value {}", key, oldValue, value);
        }
    }

    /**
     * Add a properties file. Its properties override those already loaded.
     */
    public void addConfiguration(File configFile) throws ConfigException {
        LOG.info("Reading configuration from: {}", configFile.getAbsolutePath());
        if (!configFile.exists()) {
            throw new ConfigException(configFile.getAbsolutePath() + " file is missing");
        }
        Properties cfg = new Properties();
        try (InputStream in = new FileInputStream(configFile)) {
            cfg.load(in);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigException("Error while processing " + configFile.getAbsolutePath(), e);
        }
        for (Entry<Object, Object> entry : cfg.entrySet()) {
            setProperty(entry.getKey().toString().trim(), entry.getValue().toString().trim());
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getProperty(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    /**
     * @throws NumberFormatException when the value is invalid
     */
    public int getInt(String key, int defaultValue) {
        String value = getProperty(key);
        return value == null ? defaultValue : Integer.decode(value.trim());
    }

    /**
     * @throws NumberFormatException when the value is invalid
     */
    public long getLong(String key, long defaultValue) {
        String value = getProperty(key);
        return value == null ? defaultValue : Long.decode(value.trim());
    }

    /**
     * Check the settings zktreeutil reads: numbers must parse and be
     * non-negative, authentication must name a scheme.
     *
     * @throws ConfigException naming the first invalid setting
     */
    public void validate() throws ConfigException {
        checkNonNegative(SESSION_TIMEOUT, true);
        checkNonNegative(CONNECT_TIMEOUT, true);
        checkNonNegative(WRITE_RETRIES, true);
        checkNonNegative(WRITE_RETRY_DELAY, false);
        checkNonNegative(PRINT_MAX_DATA_BYTES, true);
        String auth = getAuth();
        if (auth != null && auth.indexOf(':') <= 0) {
            throw new ConfigException(AUTH + " must be given as scheme:credentials");
        }
    }

    private void checkNonNegative(String key, boolean isInt) throws ConfigException {
        long value;
        try {
            value = isInt ? getInt(key, 0) : getLong(key, 0);
        } catch (NumberFormatException e) {
            throw new ConfigException(key + " is not a valid number: " + getProperty(key), e);
        }
        if (value < 0) {
            throw new ConfigException(key + " must not be negative: " + value);
        }
    }

    public int getSessionTimeout() {
        return getInt(SESSION_TIMEOUT, DEFAULT_SESSION_TIMEOUT);
    }

    public int getConnectTimeout() {
        return getInt(CONNECT_TIMEOUT, DEFAULT_CONNECT_TIMEOUT);
    }

    public int getWriteRetries() {
        return getInt(WRITE_RETRIES, DEFAULT_WRITE_RETRIES);
    }

    public long getWriteRetryDelay() {
        return getLong(WRITE_RETRY_DELAY, DEFAULT_WRITE_RETRY_DELAY);
    }

    public boolean isCreateParents() {
        return getBoolean(CREATE_PARENTS, true);
    }

    public int getPrintMaxDataBytes() {
        return getInt(PRINT_MAX_DATA_BYTES, DEFAULT_PRINT_MAX_DATA_BYTES);
    }

    public String getPrintFormat() {
        return getProperty(PRINT_FORMAT, DEFAULT_PRINT_FORMAT);
    }

    public String getCreateAcl() {
        return getProperty(CREATE_ACL, DEFAULT_CREATE_ACL);
    }

    public String getAuth() {
        return getProperty(AUTH);
    }

    /**
     * @return ZooKeeper client settings, or null for the client's defaults
     */
    public ZKClientConfig getClientConfig() {
        return clientConfig;
    }

    public void setClientConfig(ZKClientConfig clientConfig) {
        this.clientConfig = clientConfig;
    }

}
