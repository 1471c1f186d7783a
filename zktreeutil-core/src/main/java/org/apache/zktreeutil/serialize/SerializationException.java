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

package org.apache.zktreeutil.serialize;

import java.io.IOException;

/**
 * A tree document or the sequence it is built from violates the format.
 */
@SuppressWarnings("serial")
public class SerializationException extends IOException {

    private final String path;

    public SerializationException(String message, String path) {
        super(message);
        this.path = path;
    }

    public SerializationException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * @return the path involved, null if unknown
     */
    public String getPath() {
        return path;
    }

}
