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

package org.apache.zktreeutil.zookeeper;

import static java.nio.charset.StandardCharsets.UTF_8;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.WatchedEvent;
import org.apache.zookeeper.Watcher;
import org.apache.zookeeper.ZooDefs;
import org.apache.zookeeper.ZooKeeper;
import org.apache.zookeeper.client.ZKClientConfig;
import org.apache.zookeeper.data.ACL;
import org.apache.zookeeper.data.Stat;
import org.apache.zktreeutil.ZNodeStat;
import org.apache.zktreeutil.cli.ZkTreeUtilConfig;
import org.apache.zktreeutil.store.NodeData;
import org.apache.zktreeutil.store.NodeStore;
import org.apache.zktreeutil.store.NodeStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link NodeStore} on top of a ZooKeeper client session.
 * <p>
 * Nodes are created persistent with the configured ACL. No watches are set.
 */
public class ZooKeeperNodeStore implements NodeStore {

    private static final Logger LOG = LoggerFactory.getLogger(ZooKeeperNodeStore.class);

    private final ZooKeeper zk;
    private final List<ACL> acl;

    public ZooKeeperNodeStore(ZooKeeper zk, List<ACL> acl) {
        this.zk = zk;
        this.acl = acl;
    }

    /**
     * Connect to an ensemble and wait for the session to be established.
     *
     * @throws IOException if the session is not established within the
     *         configured connect timeout
     */
    public static ZooKeeperNodeStore connect(String connectString, ZkTreeUtilConfig config)
        throws IOException, InterruptedException {
        List<ACL> acl = toAcl(config.getCreateAcl());
        String auth = config.getAuth();
        int idx = auth == null ? -1 : auth.indexOf(':');
        if (auth != null && idx <= 0) {
            throw new IllegalArgumentException("Authentication must be given as scheme:credentials");
        }
        ZKClientConfig clientConfig = config.getClientConfig() != null ? config.getClientConfig() : new ZKClientConfig();
        CountDownLatch connectLatch = new CountDownLatch(1);

        LOG.debug("Connecting to {}", connectString);
        ZooKeeper zk = new ZooKeeper(connectString, config.getSessionTimeout(), new ConnectWatcher(connectLatch), clientConfig);
        if (!connectLatch.await(config.getConnectTimeout(), TimeUnit.MILLISECONDS)) {
            zk.close();
            throw new IOException("Cannot connect to " + connectString,
                KeeperException.create(KeeperException.Code.CONNECTIONLOSS));
        }

        if (auth != null) {
            zk.addAuthInfo(auth.substring(0, idx), auth.substring(idx + 1).getBytes(UTF_8));
        }
        return new ZooKeeperNodeStore(zk, acl);
    }

    /**
     * @param name open, creator or read
     * @throws IllegalArgumentException for any other name
     */
    public static List<ACL> toAcl(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
        case "open":
            return ZooDefs.Ids.OPEN_ACL_UNSAFE;
        case "creator":
            return ZooDefs.Ids.CREATOR_ALL_ACL;
        case "read":
            return ZooDefs.Ids.READ_ACL_UNSAFE;
        default:
            throw new IllegalArgumentException("Unknown ACL " + name + ", expected open, creator or read");
        }
    }

    @Override
    public boolean exists(String path) throws NodeStoreException, InterruptedException {
        try {
            return zk.exists(path, false) != null;
        } catch (KeeperException e) {
            throw translate(e, path);
        } catch (IllegalArgumentException e) {
            throw new NodeStoreException.BadArgumentsException(path, e);
        }
    }

    @Override
    public NodeData getData(String path) throws NodeStoreException, InterruptedException {
        Stat stat = new Stat();
        try {
            byte[] data = zk.getData(path, false, stat);
            return new NodeData(data, toStat(stat));
        } catch (KeeperException e) {
            throw translate(e, path);
        } catch (IllegalArgumentException e) {
            throw new NodeStoreException.BadArgumentsException(path, e);
        }
    }

    @Override
    public List<String> listChildren(String path) throws NodeStoreException, InterruptedException {
        try {
            return zk.getChildren(path, false);
        } catch (KeeperException e) {
            throw translate(e, path);
        } catch (IllegalArgumentException e) {
            throw new NodeStoreException.BadArgumentsException(path, e);
        }
    }

    @Override
    public void create(String path, byte[] data) throws NodeStoreException, InterruptedException {
        try {
            zk.create(path, data, acl, CreateMode.PERSISTENT);
        } catch (KeeperException e) {
            throw translate(e, path);
        } catch (IllegalArgumentException e) {
            throw new NodeStoreException.BadArgumentsException(path, e);
        }
    }

    @Override
    public void setData(String path, byte[] data) throws NodeStoreException, InterruptedException {
        try {
            zk.setData(path, data, -1);
        } catch (KeeperException e) {
            throw translate(e, path);
        } catch (IllegalArgumentException e) {
            throw new NodeStoreException.BadArgumentsException(path, e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            zk.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while closing session", e);
        }
    }

    static ZNodeStat toStat(Stat stat) {
        return new ZNodeStat(stat.getCzxid(), stat.getMzxid(), stat.getCtime(), stat.getMtime(),
            stat.getVersion(), stat.getCversion(), stat.getAversion(), stat.getEphemeralOwner(),
            stat.getDataLength(), stat.getNumChildren());
    }

    /**
     * Map a ZooKeeper error onto the store error with the same meaning,
     * keeping the original as the cause.
     */
    static NodeStoreException translate(KeeperException e, String path) {
        String p = e.getPath() != null ? e.getPath() : path;
        switch (e.code()) {
        case CONNECTIONLOSS:
            return NodeStoreException.create(NodeStoreException.Code.CONNECTIONLOSS, p, e);
        case OPERATIONTIMEOUT:
            return NodeStoreException.create(NodeStoreException.Code.OPERATIONTIMEOUT, p, e);
        case SESSIONEXPIRED:
            return NodeStoreException.create(NodeStoreException.Code.SESSIONEXPIRED, p, e);
        case NONODE:
            return NodeStoreException.create(NodeStoreException.Code.NONODE, p, e);
        case NODEEXISTS:
            return NodeStoreException.create(NodeStoreException.Code.NODEEXISTS, p, e);
        case NOAUTH:
            return NodeStoreException.create(NodeStoreException.Code.NOAUTH, p, e);
        case BADARGUMENTS:
            return NodeStoreException.create(NodeStoreException.Code.BADARGUMENTS, p, e);
        default:
            return NodeStoreException.create(NodeStoreException.Code.SYSTEMERROR, p, e);
        }
    }

    private static class ConnectWatcher implements Watcher {

        private final CountDownLatch connectLatch;

        ConnectWatcher(CountDownLatch connectLatch) {
            this.connectLatch = connectLatch;
        }

        @Override
        public void process(WatchedEvent event) {
            if (event.getType() == Event.EventType.None) {
                if (event.getState() == Event.KeeperState.SyncConnected) {
                    connectLatch.countDown();
                } else {
                    LOG.debug("Session state changed to {}", event.getState());
                }
            }
        }

    }

}
