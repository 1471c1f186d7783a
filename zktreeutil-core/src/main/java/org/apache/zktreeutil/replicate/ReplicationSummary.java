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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * Counts of what a replication run did. Aborted nodes are not counted.
 */
@InterfaceAudience.Public
public class ReplicationSummary {

    /**
     * A node that could not be replicated, and why.
     */
    public static final class NodeFailure {

        private final String sourcePath;
        private final String destinationPath;
        private final Exception cause;

        NodeFailure(String sourcePath, String destinationPath, Exception cause) {
            this.sourcePath = sourcePath;
            this.destinationPath = destinationPath;
            this.cause = cause;
        }

        public String getSourcePath() {
            return sourcePath;
        }

        /**
         * @return destination path, or null if the source node could not be read
         */
        public String getDestinationPath() {
            return destinationPath;
        }

        public Exception getCause() {
            return cause;
        }

        @Override
        public String toString() {
            return (destinationPath != null ? destinationPath : sourcePath) + ": " + cause.getMessage();
        }

    }

    private int created;
    private int updated;
    private int skipped;
    private final List<NodeFailure> failures = new ArrayList<>();
    private String abortedAt;

    void recordCreated() {
        created++;
    }

    void recordUpdated() {
        updated++;
    }

    void recordSkipped() {
        skipped++;
    }

    void recordFailure(String sourcePath, String destinationPath, Exception cause) {
        failures.add(new NodeFailure(sourcePath, destinationPath, cause));
    }

    void recordAbort(String destinationPath) {
        abortedAt = destinationPath;
    }

    /** Nodes whose data was written, created plus updated. */
    public int getWritten() {
        return created + updated;
    }

    public int getCreated() {
        return created;
    }

    public int getUpdated() {
        return updated;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getFailed() {
        return failures.size();
    }

    public List<NodeFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public boolean isAborted() {
        return abortedAt != null;
    }

    /**
     * @return destination path at which the run was aborted, or null
     */
    public String getAbortedAt() {
        return abortedAt;
    }

    public int getTotal() {
        return getWritten() + skipped + getFailed();
    }

    @Override
    public String toString() {
        return String.format("written=%d skipped=%d failed=%d", getWritten(), skipped, getFailed());
    }

}
