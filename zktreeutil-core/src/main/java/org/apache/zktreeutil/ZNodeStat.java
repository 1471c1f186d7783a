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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Date;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * Structural metadata of a znode as reported by the store that holds it.
 * <p>
 * Every field is assigned by the server. The values are carried along for
 * display and export only; writes never send them back, the destination
 * assigns its own.
 */
@InterfaceAudience.Public
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"czxid", "mzxid", "ctime", "mtime", "version", "cversion", "aversion",
    "ephemeralOwner", "dataLength", "numChildren"})
public final class ZNodeStat {

    /** Metadata of a node whose stat is unknown, e.g. one read from a document without a stat. */
    public static final ZNodeStat EMPTY = new ZNodeStat(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    private final long czxid;
    private final long mzxid;
    private final long ctime;
    private final long mtime;
    private final int version;
    private final int cversion;
    private final int aversion;
    private final long ephemeralOwner;
    private final int dataLength;
    private final int numChildren;

    @JsonCreator
    public ZNodeStat(
        @JsonProperty("czxid") long czxid,
        @JsonProperty("mzxid") long mzxid,
        @JsonProperty("ctime") long ctime,
        @JsonProperty("mtime") long mtime,
        @JsonProperty("version") int version,
        @JsonProperty("cversion") int cversion,
        @JsonProperty("aversion") int aversion,
        @JsonProperty("ephemeralOwner") long ephemeralOwner,
        @JsonProperty("dataLength") int dataLength,
        @JsonProperty("numChildren") int numChildren) {
        this.czxid = czxid;
        this.mzxid = mzxid;
        this.ctime = ctime;
        this.mtime = mtime;
        this.version = version;
        this.cversion = cversion;
        this.aversion = aversion;
        this.ephemeralOwner = ephemeralOwner;
        this.dataLength = dataLength;
        this.numChildren = numChildren;
    }

    /** Zxid of the transaction that created the node. */
    public long getCzxid() {
        return czxid;
    }

    /** Zxid of the transaction that last modified the node's data. */
    public long getMzxid() {
        return mzxid;
    }

    public long getCtime() {
        return ctime;
    }

    public long getMtime() {
        return mtime;
    }

    /** Data version. */
    public int getVersion() {
        return version;
    }

    /** Child list version. */
    public int getCversion() {
        return cversion;
    }

    /** ACL version. */
    public int getAversion() {
        return aversion;
    }

    public long getEphemeralOwner() {
        return ephemeralOwner;
    }

    public int getDataLength() {
        return dataLength;
    }

    public int getNumChildren() {
        return numChildren;
    }

    /**
     * @return true if the node is bound to the lifetime of a client session
     */
    @JsonIgnore
    public boolean isEphemeral() {
        return ephemeralOwner != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ZNodeStat that = (ZNodeStat) o;
        return czxid == that.czxid
            && mzxid == that.mzxid
            && ctime == that.ctime
            && mtime == that.mtime
            && version == that.version
            && cversion == that.cversion
            && aversion == that.aversion
            && ephemeralOwner == that.ephemeralOwner
            && dataLength == that.dataLength
            && numChildren == that.numChildren;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(czxid);
        result = 31 * result + Long.hashCode(mzxid);
        result = 31 * result + Long.hashCode(ctime);
        result = 31 * result + Long.hashCode(mtime);
        result = 31 * result + version;
        result = 31 * result + cversion;
        result = 31 * result + aversion;
        result = 31 * result + Long.hashCode(ephemeralOwner);
        result = 31 * result + dataLength;
        result = 31 * result + numChildren;
        return result;
    }

    @Override
    public String toString() {
        return String.format("cZxid = %#016x, ctime = %s, mZxid = %#016x, mtime = %s, dataVersion = %d, "
                             + "cversion = %d, aclVersion = %d, ephemeralOwner = %#016x, dataLength = %d, numChildren = %d",
            czxid, new Date(ctime), mzxid, new Date(mtime), version,
            cversion, aversion, ephemeralOwner, dataLength, numChildren);
    }

}
