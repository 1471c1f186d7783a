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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Delegating store that fails chosen operations on chosen paths and counts
 * the calls it receives.
 */
public class FaultInjectingNodeStore implements NodeStore {

    public enum Op {
        EXISTS,
        GET_DATA,
        LIST_CHILDREN,
        CREATE,
        SET_DATA
    }

    private static final class Fault {

        final Op op;
        final String path;
        final NodeStoreException.Code code;
        final boolean afterApply;
        int remaining;

        Fault(Op op, String path, NodeStoreException.Code code, int times, boolean afterApply) {
            this.op = op;
            this.path = path;
            this.code = code;
            this.remaining = times;
            this.afterApply = afterApply;
        }

    }

    private final NodeStore delegate;
    private final List<Fault> faults = new ArrayList<>();
    private final List<String> calls = new ArrayList<>();

    public FaultInjectingNodeStore(NodeStore delegate) {
        this.delegate = delegate;
    }

    /**
     * Fail the next {@code times} calls of {@code op} on {@code path}.
     * A negative count fails every call.
     */
    public FaultInjectingNodeStore failOn(Op op, String path, NodeStoreException.Code code, int times) {
        faults.add(new Fault(op, path, code, times, false));
        return this;
    }

    /**
     * Like {@link #failOn}, but the call reaches the delegate before failing,
     * as when a reply is lost after the store applied the change.
     */
    public FaultInjectingNodeStore failAfter(Op op, String path, NodeStoreException.Code code, int times) {
        faults.add(new Fault(op, path, code, times, true));
        return this;
    }

    /**
     * @return calls received so far, as "OP path"
     */
    public List<String> getCalls() {
        return calls;
    }

    public int countCalls(Op op, String path) {
        int count = 0;
        for (String call : calls) {
            if (call.equals(op + " " + path)) {
                count++;
            }
        }
        return count;
    }

    private void before(Op op, String path) throws NodeStoreException {
        calls.add(op + " " + path);
        inject(op, path, false);
    }

    private void after(Op op, String path) throws NodeStoreException {
        inject(op, path, true);
    }

    private void inject(Op op, String path, boolean afterApply) throws NodeStoreException {
        for (Fault fault : faults) {
            if (fault.op == op && fault.path.equals(path) && fault.afterApply == afterApply && fault.remaining != 0) {
                if (fault.remaining > 0) {
                    fault.remaining--;
                }
                throw NodeStoreException.create(fault.code, path);
            }
        }
    }

    @Override
    public boolean exists(String path) throws NodeStoreException, InterruptedException {
        before(Op.EXISTS, path);
        return delegate.exists(path);
    }

    @Override
    public NodeData getData(String path) throws NodeStoreException, InterruptedException {
        before(Op.GET_DATA, path);
        return delegate.getData(path);
    }

    @Override
    public List<String> listChildren(String path) throws NodeStoreException, InterruptedException {
        before(Op.LIST_CHILDREN, path);
        return delegate.listChildren(path);
    }

    @Override
    public void create(String path, byte[] data) throws NodeStoreException, InterruptedException {
        before(Op.CREATE, path);
        delegate.create(path, data);
        after(Op.CREATE, path);
    }

    @Override
    public void setData(String path, byte[] data) throws NodeStoreException, InterruptedException {
        before(Op.SET_DATA, path);
        delegate.setData(path, data);
        after(Op.SET_DATA, path);
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }

}
