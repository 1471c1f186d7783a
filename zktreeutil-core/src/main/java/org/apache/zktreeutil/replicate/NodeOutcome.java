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

package org.apache.zktreeutil.replicate;

/**
 * What happened to one source node during replication.
 */
public enum NodeOutcome {

    /** A new node was created at the destination. */
    CREATED,

    /** The data of an existing destination node was replaced. */
    UPDATED,

    /** The destination was left untouched. */
    SKIPPED,

    /** The node could not be read or written. */
    FAILED;

    public boolean isWrite() {
        return this == CREATED || this == UPDATED;
    }

}
