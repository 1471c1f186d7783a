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

package org.apache.zktreeutil.print;

import java.util.Locale;

/**
 * Turns the data of a znode into printable text.
 */
@FunctionalInterface
public interface DataFormatter {

    String format(byte[] data);

    /**
     * @param name one of plain, base64, hex or auto, case insensitive
     * @throws IllegalArgumentException for any other name
     */
    static DataFormatter forName(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
        case "plain":
            return PlainDataFormatter.INSTANCE;
        case "base64":
            return Base64DataFormatter.INSTANCE;
        case "hex":
            return HexDumpDataFormatter.INSTANCE;
        case "auto":
            return AutoDataFormatter.INSTANCE;
        default:
            throw new IllegalArgumentException("Unknown data format: " + name);
        }
    }

}
