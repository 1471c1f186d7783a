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

import org.apache.zktreeutil.store.NodeStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repeats store operations that failed with a retryable error, such as a
 * connection loss, a bounded number of times with a linearly growing delay.
 */
public class RetrySupport {

    private static final Logger LOG = LoggerFactory.getLogger(RetrySupport.class);

    public static final int DEFAULT_RETRY_COUNT = 3;
    public static final long DEFAULT_RETRY_DELAY = 500L;

    private final int retryCount;
    private final long retryDelay;

    public RetrySupport() {
        this(DEFAULT_RETRY_COUNT, DEFAULT_RETRY_DELAY);
    }

    /**
     * @param retryCount number of attempts after the first one
     * @param retryDelay base delay in milliseconds; attempt n waits n * retryDelay
     */
    public RetrySupport(int retryCount, long retryDelay) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
        if (retryDelay < 0) {
            throw new IllegalArgumentException("retryDelay must be >= 0");
        }
        this.retryCount = retryCount;
        this.retryDelay = retryDelay;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public long getRetryDelay() {
        return retryDelay;
    }

    /**
     * Perform the given operation, retrying if it fails with a retryable error.
     *
     * @return the operation's result
     * @throws NodeStoreException the first non-retryable error, or the last
     *         retryable one once the attempts are used up
     */
    public <T> T retryOperation(StoreOperation<T> operation) throws NodeStoreException, InterruptedException {
        for (int i = 0; ; i++) {
            try {
                return operation.execute();
            } catch (NodeStoreException e) {
                if (!e.isRetryable() || i >= retryCount) {
                    throw e;
                }
                LOG.debug("Attempt {} failed with {}. Retrying...", i, e.code());
                retryDelay(i + 1);
            }
        }
    }

    /**
     * Performs a retry delay for the given attempt.
     *
     * @param attemptCount the number of the attempt about to be made
     */
    protected void retryDelay(int attemptCount) throws InterruptedException {
        if (attemptCount > 0 && retryDelay > 0) {
            Thread.sleep(attemptCount * retryDelay);
        }
    }

}
