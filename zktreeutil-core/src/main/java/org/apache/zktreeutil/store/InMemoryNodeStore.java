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

package org.apache.zktreeutil.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.zktreeutil.ZNodeStat;
import org.apache.zktreeutil.common.PathUtils;

/**
 * A {@link NodeStore} holding its tree in memory.
 * <p>
 * Like a real ensemble it assigns zxids, versions and timestamps itself and
 * hands out children in insertion order, not sorted. All operations are
 * synchronized on the store.
 */
public class InMemoryNodeStore implements NodeStore {

    private static final class DataNode {

        byte[] data;
        long czxid;
        long mzxid;
        long ctime;
        long mtime;
        int version;
        int cversion;
        long ephemeralOwner;
        final Set<String> children = new LinkedHashSet<>();

        ZNodeStat toStat() {
            return new ZNodeStat(czxid, mzxid, ctime, mtime, version, cversion, 0,
                ephemeralOwner, data.length, children.size());
        }

    }

    private final Map<String, DataNode> nodes = new HashMap<>();
    private long lastZxid = 0;
    private boolean closed = false;

    public InMemoryNodeStore() {
        DataNode root = new DataNode();
        root.data = new byte[0];
        nodes.put(PathUtils.ROOT, root);
    }

    @Override
    public synchronized boolean exists(String path) throws NodeStoreException {
        checkPath(path);
        return nodes.containsKey(path);
    }

    @Override
    public synchronized NodeData getData(String path) throws NodeStoreException {
        DataNode n = getNode(path);
        return new NodeData(n.data.clone(), n.toStat());
    }

    @Override
    public synchronized List<String> listChildren(String path) throws NodeStoreException {
        return new ArrayList<>(getNode(path).children);
    }

    @Override
    public synchronized void create(String path, byte[] data) throws NodeStoreException {
        create(path, data, 0);
    }

    /**
     * Create a node owned by the given session; an owner of 0 means persistent.
     */
    public synchronized void create(String path, byte[] data, long ephemeralOwner) throws NodeStoreException {
        checkPath(path);
        if (PathUtils.ROOT.equals(path) || nodes.containsKey(path)) {
            throw new NodeStoreException.NodeExistsException(path);
        }
        DataNode parent = nodes.get(PathUtils.getParent(path));
        if (parent == null) {
            throw new NodeStoreException.NoNodeException(path);
        }
        if (parent.ephemeralOwner != 0) {
            throw new NodeStoreException.BadArgumentsException(path);
        }
        long zxid = ++lastZxid;
        long now = System.currentTimeMillis();
        DataNode child = new DataNode();
        child.data = data == null ? new byte[0] : data.clone();
        child.czxid = zxid;
        child.mzxid = zxid;
        child.ctime = now;
        child.mtime = now;
        child.ephemeralOwner = ephemeralOwner;
        parent.children.add(PathUtils.getName(path));
        parent.cversion++;
        nodes.put(path, child);
    }

    @Override
    public synchronized void setData(String path, byte[] data) throws NodeStoreException {
        DataNode n = getNode(path);
        n.data = data == null ? new byte[0] : data.clone();
        n.mzxid = ++lastZxid;
        n.mtime = System.currentTimeMillis();
        n.version++;
    }

    /**
     * Delete a node and its whole subtree.
     */
    public synchronized void delete(String path) throws NodeStoreException {
        DataNode n = getNode(path);
        if (PathUtils.ROOT.equals(path)) {
            throw new NodeStoreException.BadArgumentsException(path);
        }
        for (String child : new ArrayList<>(n.children)) {
            delete(PathUtils.join(path, child));
        }
        nodes.remove(path);
        DataNode parent = nodes.get(PathUtils.getParent(path));
        parent.children.remove(PathUtils.getName(path));
        parent.cversion++;
        lastZxid++;
    }

    /**
     * @return number of nodes, including the root
     */
    public synchronized int getNodeCount() {
        return nodes.size();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    private DataNode getNode(String path) throws NodeStoreException {
        checkPath(path);
        DataNode n = nodes.get(path);
        if (n == null) {
            throw new NodeStoreException.NoNodeException(path);
        }
        return n;
    }

    private void checkPath(String path) throws NodeStoreException {
        try {
            PathUtils.validatePath(path);
        } catch (IllegalArgumentException e) {
            throw new NodeStoreException.BadArgumentsException(path, e);
        }
    }

}
