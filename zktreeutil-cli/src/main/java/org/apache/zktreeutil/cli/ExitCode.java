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

/**
 * Exit code values for zktreeutil.
 */
public enum ExitCode {

    /** Execution finished normally, possibly with skipped nodes. */
    EXECUTION_FINISHED(0),

    /** Unexpected errors like IO Exceptions. */
    UNEXPECTED_ERROR(1),

    /** Invalid arguments or configuration. */
    INVALID_INVOCATION(2),

    /** At least one node could not be read or written. */
    NODE_FAILURES(3),

    /** The root node is missing or could not be replicated, or the document file is malformed. */
    FATAL_FAILURE(4),

    /** Replication was aborted at the interactive prompt. */
    ABORTED(5);

    private final int value;

    ExitCode(final int newValue) {
        value = newValue;
    }

    public int getValue() {
        return value;
    }

}
