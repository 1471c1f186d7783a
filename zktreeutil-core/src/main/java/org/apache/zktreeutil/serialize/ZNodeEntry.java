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

package org.apache.zktreeutil.serialize;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;
import org.apache.zktreeutil.ZNodeStat;

/**
 * One node of a tree document: its name relative to the parent, its data
 * as base64 text, an informational stat and its child entries in order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "data", "stat", "children"})
public class ZNodeEntry {

    private String name;
    private String data;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private ZNodeStat stat;
    private List<ZNodeEntry> children = new ArrayList<>();

    public ZNodeEntry() {
    }

    public ZNodeEntry(String name, String data, ZNodeStat stat) {
        this.name = name;
        this.data = data;
        this.stat = stat;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return node data encoded as base64
     */
    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = data;
    }

    public ZNodeStat getStat() {
        return stat;
    }

    public void setStat(ZNodeStat stat) {
        this.stat = stat;
    }

    public List<ZNodeEntry> getChildren() {
        return children;
    }

    public void setChildren(List<ZNodeEntry> children) {
        this.children = children;
    }

}
