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

package org.apache.zktreeutil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.zktreeutil.common.PathUtils;

/**
 * A snapshot of one znode: its path, data, stat and the names of its
 * direct children.
 * <p>
 * Records are immutable. Child names are kept in lexicographic order so that
 * two reads of the same tree produce the same sequence regardless of the
 * order the store hands them out in.
 */
@InterfaceAudience.Public
public final class ZNodeRecord {

    private static final byte[] NO_DATA = new byte[0];

    private final String path;
    private final byte[] data;
    private final ZNodeStat stat;
    private final List<String> children;

    /**
     * @param path absolute path of the node
     * @param data node data, null is treated as empty
     * @param stat node metadata, null is treated as {@link ZNodeStat#EMPTY}
     * @param children names of the direct children, in any order
     * @throws IllegalArgumentException if the path is invalid
     */
    public ZNodeRecord(String path, byte[] data, ZNodeStat stat, List<String> children) {
        PathUtils.validatePath(path);
        this.path = path;
        this.data = data == null ? NO_DATA : data.clone();
        this.stat = stat == null ? ZNodeStat.EMPTY : stat;
        if (children == null || children.isEmpty()) {
            this.children = Collections.emptyList();
        } else {
            List<String> sorted = new ArrayList<>(children);
            Collections.sort(sorted);
            this.children = Collections.unmodifiableList(sorted);
        }
    }

    public String getPath() {
        return path;
    }

    /**
     * @return the last segment of the path, empty for the root
     */
    public String getName() {
        return PathUtils.getName(path);
    }

    /**
     * @return the parent path, or null if this is the root of the store
     */
    public String getParentPath() {
        return PathUtils.getParent(path);
    }

    /**
     * @return a copy of the node data, never null
     */
    public byte[] getData() {
        return data.clone();
    }

    public int getDataLength() {
        return data.length;
    }

    public ZNodeStat getStat() {
        return stat;
    }

    /**
     * @return unmodifiable, lexicographically ordered child names
     */
    public List<String> getChildren() {
        return children;
    }

    /**
     * @return a record identical to this one but located at {@code newPath}
     */
    public ZNodeRecord withPath(String newPath) {
        return new ZNodeRecord(newPath, data, stat, children);
    }

    /**
     * Compare path, data and children, ignoring the stat. This is the notion
     * of equality that matters when replaying a tree somewhere else.
     */
    public boolean contentEquals(ZNodeRecord other) {
        return other != null
            && path.equals(other.path)
            && Arrays.equals(data, other.data)
            && children.equals(other.children);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ZNodeRecord that = (ZNodeRecord) o;
        return contentEquals(that) && stat.equals(that.stat);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(path, stat, children);
        result = 31 * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public String toString() {
        return "ZNodeRecord{path=" + path + ", dataLength=" + data.length + ", children=" + children + "}";
    }

}
