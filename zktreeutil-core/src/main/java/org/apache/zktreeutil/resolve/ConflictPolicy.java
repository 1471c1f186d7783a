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

package org.apache.zktreeutil.resolve;

import org.apache.yetus.audience.InterfaceAudience;

/**
 * How to treat a node that already exists at the destination.
 */
@InterfaceAudience.Public
public enum ConflictPolicy {

    /** Leave existing nodes untouched. */
    NO_CLOBBER("no-clobber"),

    /** Ask for every existing node. */
    INTERACTIVE("interactive"),

    /** Replace the data of existing nodes without asking. */
    OVERWRITE("overwrite");

    private final String optionName;

    ConflictPolicy(String optionName) {
        this.optionName = optionName;
    }

    /**
     * @return the command line spelling of this policy, e.g. {@code no-clobber}
     */
    public String getOptionName() {
        return optionName;
    }

    /**
     * @throws IllegalArgumentException if no policy has the given option name
     */
    public static ConflictPolicy fromOptionName(String optionName) {
        for (ConflictPolicy policy : values()) {
            if (policy.optionName.equalsIgnoreCase(optionName)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown conflict policy: " + optionName);
    }

}
