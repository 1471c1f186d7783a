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

package org.apache.zktreeutil.walk;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.zktreeutil.NodeIterator;
import org.apache.zktreeutil.ZNodeRecord;
import org.apache.zktreeutil.common.PathUtils;
import org.apache.zktreeutil.store.NodeData;
import org.apache.zktreeutil.store.NodeStore;
import org.apache.zktreeutil.store.NodeStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Depth-first, pre-order iterator over the subtree of a {@link NodeStore}.
 * <p>
 * Only the paths still to be visited are held in memory. Data and children
 * of a node are fetched when the node is about to be returned, and children
 * are visited in lexicographic order.
 * <p>
 * Note: the store may change during the walk. A node deleted after its
 * parent was listed is reported by {@link #next()} as a
 * {@link NodeVanishedException}; the walk then carries on with the next
 * pending node. Nodes created concurrently may or may not be seen.
 */
@InterfaceAudience.Public
public class TreeWalker implements NodeIterator {

    private static final Logger LOG = LoggerFactory.getLogger(TreeWalker.class);

    private final NodeStore store;
    private final Deque<String> pending = new ArrayDeque<>();

    private TreeWalker(NodeStore store, String rootPath) {
        this.store = store;
        pending.push(rootPath);
    }

    /**
     * Start a walk of the subtree rooted at {@code rootPath}.
     *
     * @param store a connected store to read from
     * @param rootPath path of the first node to return
     * @return iterator returning rootPath and then all of its descendants
     * @throws NodeStoreException.NoNodeException if rootPath does not exist
     * @throws IllegalArgumentException if rootPath is not a valid path
     */
    public static TreeWalker walk(NodeStore store, String rootPath) throws NodeStoreException, InterruptedException {
        PathUtils.validatePath(rootPath);
        if (!store.exists(rootPath)) {
            throw new NodeStoreException.NoNodeException(rootPath);
        }
        return new TreeWalker(store, rootPath);
    }

    @Override
    public boolean hasNext() {
        return !pending.isEmpty();
    }

    @Override
    public ZNodeRecord next() throws InterruptedException, NodeStoreException {
        if (!hasNext()) {
            throw new NoSuchElementException("No more nodes");
        }

        String path = pending.pop();
        LOG.debug("Processing ZNode located at {}", path);
        NodeData nodeData;
        List<String> children;
        try {
            nodeData = store.getData(path);
            children = store.listChildren(path);
        } catch (NodeStoreException.NoNodeException e) {
            throw new NodeVanishedException(path, e);
        }

        ZNodeRecord record = new ZNodeRecord(path, nodeData.getData(), nodeData.getStat(), children);
        List<String> sorted = record.getChildren();
        // push in reverse so the smallest name is visited first
        for (int i = sorted.size() - 1; i >= 0; i--) {
            pending.push(PathUtils.join(path, sorted.get(i)));
        }
        return record;
    }

}
