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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.zktreeutil.NodeIterator;
import org.apache.zktreeutil.ZNodeRecord;
import org.apache.zktreeutil.common.PathUtils;
import org.apache.zktreeutil.resolve.ConflictAction;
import org.apache.zktreeutil.resolve.ConflictPolicy;
import org.apache.zktreeutil.resolve.ConflictPrompt;
import org.apache.zktreeutil.resolve.ConflictResolver;
import org.apache.zktreeutil.store.NodeStore;
import org.apache.zktreeutil.store.NodeStoreException;
import org.apache.zktreeutil.walk.NodeVanishedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a pre-order sequence of nodes onto a destination store underneath
 * a destination root, one node at a time.
 * <p>
 * The first node of the sequence is the source root; it is written at the
 * destination root and every following node at the same relative position.
 * Only data is written, the destination assigns its own stats. Nothing is
 * ever deleted at the destination.
 * <p>
 * Failures to read or write a single node are recorded in the returned
 * {@link ReplicationSummary} and the run carries on. Retryable store errors
 * are retried by the {@link RetrySupport} first. A failure on the root node
 * ends the run with a {@link RootFailureException}.
 */
@InterfaceAudience.Public
public class Replicator {

    private static final Logger LOG = LoggerFactory.getLogger(Replicator.class);

    private final NodeStore destination;
    private final RetrySupport retrySupport;
    private final boolean createParents;
    private ReplicationListener listener = ReplicationListener.NOOP;

    public Replicator(NodeStore destination) {
        this(destination, new RetrySupport(), true);
    }

    /**
     * @param destination store to write to
     * @param retrySupport retries transient failures of single store calls
     * @param createParents create missing ancestors of the destination root
     */
    public Replicator(NodeStore destination, RetrySupport retrySupport, boolean createParents) {
        this.destination = destination;
        this.retrySupport = retrySupport;
        this.createParents = createParents;
    }

    public void setListener(ReplicationListener listener) {
        this.listener = listener == null ? ReplicationListener.NOOP : listener;
    }

    /**
     * Replicate the source sequence underneath {@code destinationRoot}.
     *
     * @param source pre-order sequence; its first node is the source root
     * @param destinationRoot path the source root is written to
     * @param policy what to do with nodes already present at the destination
     * @param prompt asked for conflicts under {@link ConflictPolicy#INTERACTIVE}
     * @return what was done, possibly cut short by an abort answer
     * @throws RootFailureException if the source root cannot be read or written
     */
    public ReplicationSummary replicate(
        NodeIterator source,
        String destinationRoot,
        ConflictPolicy policy,
        ConflictPrompt prompt) throws RootFailureException, InterruptedException {
        PathUtils.validatePath(destinationRoot);
        ReplicationSummary summary = new ReplicationSummary();
        String sourceRoot = null;
        // destination paths known not to exist; their subtrees cannot be written
        Set<String> missing = new HashSet<>();

        while (source.hasNext()) {
            ZNodeRecord record;
            try {
                record = source.next();
            } catch (NodeVanishedException e) {
                if (sourceRoot == null) {
                    throw new RootFailureException(e.getPath(), e);
                }
                LOG.warn("ZNode at {} vanished from the source, skipping it", e.getPath());
                summary.recordSkipped();
                listener.nodeProcessed(e.getPath(), null, NodeOutcome.SKIPPED);
                continue;
            } catch (NodeStoreException e) {
                if (sourceRoot == null) {
                    throw new RootFailureException(e.getPath(), e);
                }
                LOG.warn("Failed to read ZNode at {}: {}", e.getPath(), e.getMessage());
                summary.recordFailure(e.getPath(), null, e);
                listener.nodeProcessed(e.getPath(), null, NodeOutcome.FAILED);
                continue;
            }

            boolean isRoot = sourceRoot == null;
            if (isRoot) {
                sourceRoot = record.getPath();
                ensureParents(destinationRoot);
            }
            String destPath = PathUtils.rebase(sourceRoot, destinationRoot, record.getPath());

            if (!isRoot && missing.contains(PathUtils.getParent(destPath))) {
                LOG.warn("Not writing ZNode at {}, its parent could not be created", destPath);
                missing.add(destPath);
                summary.recordFailure(record.getPath(), destPath,
                    new NodeStoreException.NoNodeException(PathUtils.getParent(destPath)));
                listener.nodeProcessed(record.getPath(), destPath, NodeOutcome.FAILED);
                continue;
            }

            NodeOutcome outcome;
            try {
                outcome = apply(record, destPath, policy, prompt, missing);
            } catch (NodeStoreException e) {
                if (isRoot) {
                    throw new RootFailureException(destPath, e);
                }
                LOG.warn("Failed to write ZNode at {}: {}", destPath, e.getMessage());
                summary.recordFailure(record.getPath(), destPath, e);
                listener.nodeProcessed(record.getPath(), destPath, NodeOutcome.FAILED);
                continue;
            }

            if (outcome == null) {
                LOG.info("Replication aborted at {}", destPath);
                summary.recordAbort(destPath);
                return summary;
            }
            switch (outcome) {
            case CREATED:
                summary.recordCreated();
                break;
            case UPDATED:
                summary.recordUpdated();
                break;
            default:
                summary.recordSkipped();
                break;
            }
            listener.nodeProcessed(record.getPath(), destPath, outcome);
        }

        if (sourceRoot == null) {
            LOG.warn("No ZNodes to replicate to {}", destinationRoot);
        }
        return summary;
    }

    /**
     * Write one node according to the conflict policy.
     *
     * @return the outcome, or null if the run is to be aborted
     */
    private NodeOutcome apply(
        ZNodeRecord record,
        String destPath,
        ConflictPolicy policy,
        ConflictPrompt prompt,
        Set<String> missing) throws NodeStoreException, InterruptedException {
        boolean exists;
        try {
            exists = retrySupport.retryOperation(() -> destination.exists(destPath));
        } catch (NodeStoreException e) {
            missing.add(destPath);
            throw e;
        }

        ConflictAction action = ConflictResolver.decide(destPath, exists, policy, prompt);
        if (action == ConflictAction.WRITE && !exists) {
            AtomicInteger attempts = new AtomicInteger();
            try {
                LOG.info("Writing new ZNode at {}", destPath);
                retrySupport.retryOperation(() -> {
                    attempts.incrementAndGet();
                    destination.create(destPath, record.getData());
                    return null;
                });
                return NodeOutcome.CREATED;
            } catch (NodeStoreException.NodeExistsException e) {
                // an attempt that failed with a lost reply may have been applied
                if (attempts.get() > 1 && hasData(destPath, record.getData())) {
                    LOG.debug("ZNode at {} was created by an earlier attempt", destPath);
                    return NodeOutcome.CREATED;
                }
                LOG.debug("ZNode at {} was created concurrently", destPath);
                action = ConflictResolver.decide(destPath, true, policy, prompt);
            } catch (NodeStoreException e) {
                missing.add(destPath);
                throw e;
            }
        }

        switch (action) {
        case WRITE:
            LOG.debug("ZNode at {} already exists, overwriting its data", destPath);
            retrySupport.retryOperation(() -> {
                destination.setData(destPath, record.getData());
                return null;
            });
            return NodeOutcome.UPDATED;
        case ABORT:
            return null;
        case SKIP:
        default:
            LOG.debug("ZNode at {} already exists, skipping it", destPath);
            return NodeOutcome.SKIPPED;
        }
    }

    private boolean hasData(String path, byte[] data) throws NodeStoreException, InterruptedException {
        return Arrays.equals(data, retrySupport.retryOperation(() -> destination.getData(path)).getData());
    }

    private void ensureParents(String destinationRoot) throws RootFailureException, InterruptedException {
        if (!createParents) {
            return;
        }
        String parent = PathUtils.getParent(destinationRoot);
        if (parent == null || PathUtils.ROOT.equals(parent)) {
            return;
        }
        StringBuilder path = new StringBuilder();
        for (String part : parent.substring(1).split("/")) {
            path.append('/').append(part);
            String ancestor = path.toString();
            try {
                boolean exists = retrySupport.retryOperation(() -> destination.exists(ancestor));
                if (!exists) {
                    LOG.debug("Creating parent ZNode at {}", ancestor);
                    retrySupport.retryOperation(() -> {
                        destination.create(ancestor, new byte[0]);
                        return null;
                    });
                }
            } catch (NodeStoreException.NodeExistsException e) {
                LOG.debug("Parent ZNode at {} was created concurrently", ancestor);
            } catch (NodeStoreException e) {
                throw new RootFailureException(ancestor, e);
            }
        }
    }

}
