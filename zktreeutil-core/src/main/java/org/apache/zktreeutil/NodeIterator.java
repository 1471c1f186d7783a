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

import java.util.NoSuchElementException;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.zktreeutil.store.NodeStoreException;

/**
 * A pull-based, pre-order sequence of {@link ZNodeRecord}s.
 * <p>
 * A parent is always returned before any of its descendants. Producing the
 * next element may block on I/O. A failure of {@link #next()} concerns only
 * the element being produced: the iterator remains usable and the caller can
 * decide to continue with the following element or stop. The sequence cannot
 * be restarted.
 */
@InterfaceAudience.Public
public interface NodeIterator {

    /**
     * Returns true if the iteration has more elements.
     *
     * @return true if the iteration has more elements, false otherwise
     */
    boolean hasNext();

    /**
     * Returns the next record in the iteration.
     *
     * @return the next record
     * @throws InterruptedException if the thread is interrupted
     * @throws NodeStoreException if the record could not be read; the
     *         failed node's subtree is dropped from the iteration
     * @throws NoSuchElementException if the iteration has no more elements
     */
    ZNodeRecord next() throws InterruptedException, NodeStoreException, NoSuchElementException;

}
