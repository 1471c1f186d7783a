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

import org.apache.zktreeutil.common.PathUtils;

/**
 * A tree location given on the command line as
 * {@code host:port[,host:port...]/path}. Everything from the first slash on
 * is the path.
 */
public final class ZkLocation {

    private final String connectString;
    private final String path;

    public ZkLocation(String connectString, String path) {
        this.connectString = connectString;
        this.path = path;
    }

    /**
     * @throws IllegalArgumentException if the location has no hosts, no path
     *         or an invalid path
     */
    public static ZkLocation parse(String location) {
        int idx = location.indexOf('/');
        if (idx < 0) {
            throw new IllegalArgumentException("Location " + location + " has no path, expected host:port/path");
        }
        if (idx == 0) {
            throw new IllegalArgumentException("Location " + location + " has no hosts, expected host:port/path");
        }
        String path = location.substring(idx);
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        PathUtils.validatePath(path);
        return new ZkLocation(location.substring(0, idx), path);
    }

    public String getConnectString() {
        return connectString;
    }

    public String getPath() {
        return path;
    }

    @Override
    public String toString() {
        return connectString + path;
    }

}
