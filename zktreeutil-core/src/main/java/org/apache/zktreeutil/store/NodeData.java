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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.apache.zktreeutil.ZNodeStat;

/**
 * Data and stat of a node, as returned by {@link NodeStore#getData(String)}.
 * The data array is not copied.
 */
public final class NodeData {

    private final byte[] data;
    private final ZNodeStat stat;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public NodeData(byte[] data, ZNodeStat stat) {
        this.data = data == null ? new byte[0] : data;
        this.stat = stat == null ? ZNodeStat.EMPTY : stat;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getData() {
        return data;
    }

    public ZNodeStat getStat() {
        return stat;
    }

}
