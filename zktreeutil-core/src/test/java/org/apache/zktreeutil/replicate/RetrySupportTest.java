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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.zktreeutil.ZkTreeUtilTestCase;
import org.apache.zktreeutil.store.NodeStoreException;
import org.junit.jupiter.api.Test;

public class RetrySupportTest extends ZkTreeUtilTestCase {

    /** Records delays instead of sleeping. */
    private static class RecordingRetrySupport extends RetrySupport {

        final List<Integer> delays = new ArrayList<>();

        RecordingRetrySupport(int retryCount) {
            super(retryCount, 10);
        }

        @Override
        protected void retryDelay(int attemptCount) {
            delays.add(attemptCount);
        }

    }

    @Test
    public void testSucceedsAfterTransientFailures() throws Exception {
        RecordingRetrySupport retry = new RecordingRetrySupport(3);
        AtomicInteger calls = new AtomicInteger();
        String result = retry.retryOperation(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new NodeStoreException.ConnectionLossException("/a");
            }
            return "done";
        });
        assertEquals("done", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(1, 2), retry.delays);
    }

    @Test
    public void testGivesUpAfterRetryCount() {
        RecordingRetrySupport retry = new RecordingRetrySupport(2);
        AtomicInteger calls = new AtomicInteger();
        assertThrows(NodeStoreException.OperationTimeoutException.class, () -> retry.retryOperation(() -> {
            calls.incrementAndGet();
            throw new NodeStoreException.OperationTimeoutException("/a");
        }));
        assertEquals(3, calls.get());
    }

    @Test
    public void testTerminalFailureIsNotRetried() {
        RecordingRetrySupport retry = new RecordingRetrySupport(5);
        AtomicInteger calls = new AtomicInteger();
        assertThrows(NodeStoreException.NoAuthException.class, () -> retry.retryOperation(() -> {
            calls.incrementAndGet();
            throw new NodeStoreException.NoAuthException("/a");
        }));
        assertEquals(1, calls.get());
        assertEquals(0, retry.delays.size());
    }

    @Test
    public void testLinearBackoff() throws Exception {
        RetrySupport retry = new RetrySupport(2, 5);
        AtomicInteger calls = new AtomicInteger();
        long start = System.nanoTime();
        retry.retryOperation(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new NodeStoreException.ConnectionLossException("/a");
            }
            return null;
        });
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertEquals(3, calls.get());
        // 1 * 5 + 2 * 5
        assertTrue(elapsedMs >= 15, "elapsed " + elapsedMs);
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RetrySupport(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new RetrySupport(0, -1));
    }

}
