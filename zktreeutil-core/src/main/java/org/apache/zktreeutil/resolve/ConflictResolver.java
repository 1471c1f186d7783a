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

import java.util.Objects;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * Decides, for one node, whether to write it to the destination.
 * <p>
 * The decision depends only on the arguments and, for
 * {@link ConflictPolicy#INTERACTIVE}, on the prompt's answer.
 */
@InterfaceAudience.Public
public final class ConflictResolver {

    private ConflictResolver() {
    }

    /**
     * @param path destination path of the node, shown to the prompt
     * @param existsAtDestination whether the destination node is already there
     * @param policy the configured conflict policy
     * @param prompt asked only for INTERACTIVE conflicts, may be null otherwise
     * @return the action to take
     * @throws IllegalArgumentException if the policy is INTERACTIVE, the node
     *         exists and no prompt is given
     */
    public static ConflictAction decide(
        String path,
        boolean existsAtDestination,
        ConflictPolicy policy,
        ConflictPrompt prompt) {
        if (!existsAtDestination) {
            return ConflictAction.WRITE;
        }
        switch (policy) {
        case OVERWRITE:
            return ConflictAction.WRITE;
        case INTERACTIVE:
            if (prompt == null) {
                throw new IllegalArgumentException("Interactive conflict policy requires a prompt");
            }
            return toAction(Objects.requireNonNull(prompt.ask(path), "prompt answer"));
        case NO_CLOBBER:
        default:
            return ConflictAction.SKIP;
        }
    }

    private static ConflictAction toAction(ConflictPrompt.Answer answer) {
        switch (answer) {
        case WRITE:
            return ConflictAction.WRITE;
        case ABORT_ALL:
            return ConflictAction.ABORT;
        case SKIP:
        default:
            return ConflictAction.SKIP;
        }
    }

}
