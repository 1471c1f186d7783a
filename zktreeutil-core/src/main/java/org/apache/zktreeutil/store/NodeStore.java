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

import java.io.Closeable;
import java.util.List;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * The capabilities the tree tools need from a hierarchical store such as a
 * ZooKeeper ensemble.
 * <p>
 * A handle is connected when handed out and owned by a single tool run;
 * {@link #close()} releases the underlying connection. Implementations
 * translate their native failures into {@link NodeStoreException}s and keep
 * the native exception as the cause.
 */
@InterfaceAudience.Public
public interface NodeStore extends Closeable {

    /**
     * @return true if a node exists at the given path
     */
    boolean exists(String path) throws NodeStoreException, InterruptedException;

    /**
     * @return data and stat of the node
     * @throws NodeStoreException.NoNodeException if the node does not exist
     */
    NodeData getData(String path) throws NodeStoreException, InterruptedException;

    /**
     * @return names of the direct children of the node, in no particular order
     * @throws NodeStoreException.NoNodeException if the node does not exist
     */
    List<String> listChildren(String path) throws NodeStoreException, InterruptedException;

    /**
     * Create a persistent node.
     *
     * @throws NodeStoreException.NoNodeException if the parent does not exist
     * @throws NodeStoreException.NodeExistsException if the node already exists
     */
    void create(String path, byte[] data) throws NodeStoreException, InterruptedException;

    /**
     * Replace the data of an existing node, whatever its version.
     *
     * @throws NodeStoreException.NoNodeException if the node does not exist
     */
    void setData(String path, byte[] data) throws NodeStoreException, InterruptedException;

}
