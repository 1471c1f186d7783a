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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.apache.zktreeutil.ZkTreeUtilTestCase;
import org.apache.zookeeper.server.quorum.QuorumPeerConfig.ConfigException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ZkTreeUtilConfigTest extends ZkTreeUtilTestCase {

    @AfterEach
    public void clearProperties() {
        System.clearProperty(ZkTreeUtilConfig.WRITE_RETRIES);
    }

    @Test
    public void testDefaults() {
        ZkTreeUtilConfig config = new ZkTreeUtilConfig();
        assertEquals(30000, config.getSessionTimeout());
        assertEquals(15000, config.getConnectTimeout());
        assertEquals(3, config.getWriteRetries());
        assertEquals(500L, config.getWriteRetryDelay());
        assertTrue(config.isCreateParents());
        assertEquals(1024, config.getPrintMaxDataBytes());
        assertEquals("auto", config.getPrintFormat());
        assertEquals("open", config.getCreateAcl());
        assertNull(config.getAuth());
        assertNull(config.getClientConfig());
    }

    @Test
    public void testSystemProperties() {
        System.setProperty(ZkTreeUtilConfig.WRITE_RETRIES, "7");
        assertEquals(7, new ZkTreeUtilConfig().getWriteRetries());
    }

    @Test
    public void testConfigurationFile(@TempDir Path dir) throws Exception {
        System.setProperty(ZkTreeUtilConfig.WRITE_RETRIES, "7");
        Path file = dir.resolve("zktreeutil.properties");
        Files.write(file, Arrays.asList(
            "zktreeutil.write.retries = 1",
            "zktreeutil.create.parents=false",
            "zktreeutil.write.retry.delay.ms=0x10"));

        ZkTreeUtilConfig config = new ZkTreeUtilConfig();
        config.addConfiguration(file.toFile());

        assertEquals(1, config.getWriteRetries());
        assertFalse(config.isCreateParents());
        assertEquals(16L, config.getWriteRetryDelay());
    }

    @Test
    public void testMissingFile(@TempDir Path dir) {
        File missing = dir.resolve("missing.properties").toFile();
        assertThrows(ConfigException.class, () -> new ZkTreeUtilConfig().addConfiguration(missing));
    }

    @Test
    public void testValidate() throws Exception {
        ZkTreeUtilConfig config = new ZkTreeUtilConfig();
        config.setProperty(ZkTreeUtilConfig.AUTH, "digest:user:pass");
        config.setProperty(ZkTreeUtilConfig.WRITE_RETRY_DELAY, "0");
        config.validate();

        config.setProperty(ZkTreeUtilConfig.WRITE_RETRIES, "-1");
        ConfigException e = assertThrows(ConfigException.class, config::validate);
        assertTrue(e.getMessage().contains(ZkTreeUtilConfig.WRITE_RETRIES));

        config.setProperty(ZkTreeUtilConfig.WRITE_RETRIES, "2");
        config.setProperty(ZkTreeUtilConfig.WRITE_RETRY_DELAY, "later");
        e = assertThrows(ConfigException.class, config::validate);
        assertTrue(e.getMessage().contains(ZkTreeUtilConfig.WRITE_RETRY_DELAY));

        config.setProperty(ZkTreeUtilConfig.WRITE_RETRY_DELAY, "10");
        config.setProperty(ZkTreeUtilConfig.AUTH, ":pass");
        assertThrows(ConfigException.class, config::validate);
    }

    @Test
    public void testInvalidNumber() {
        ZkTreeUtilConfig config = new ZkTreeUtilConfig();
        config.setProperty(ZkTreeUtilConfig.SESSION_TIMEOUT, "soon");
        assertThrows(NumberFormatException.class, config::getSessionTimeout);
        assertThrows(IllegalArgumentException.class, () -> config.setProperty(null, "x"));
    }

}
