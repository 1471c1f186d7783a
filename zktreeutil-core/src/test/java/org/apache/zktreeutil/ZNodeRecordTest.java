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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ZNodeRecordTest extends ZkTreeUtilTestCase {

    private static final ZNodeStat STAT = new ZNodeStat(1, 2, 3, 4, 5, 6, 7, 0, 1, 2);

    @Test
    public void testChildrenAreSorted() {
        ZNodeRecord record = new ZNodeRecord("/a", null, null, Arrays.asList("c", "a", "b"));
        assertEquals(Arrays.asList("a", "b", "c"), record.getChildren());
        assertThrows(UnsupportedOperationException.class, () -> record.getChildren().add("d"));
    }

    @Test
    public void testDefaults() {
        ZNodeRecord record = new ZNodeRecord("/a", null, null, null);
        assertEquals(0, record.getDataLength());
        assertSame(ZNodeStat.EMPTY, record.getStat());
        assertTrue(record.getChildren().isEmpty());
    }

    @Test
    public void testDataIsCopied() {
        byte[] data = "x".getBytes(UTF_8);
        List<String> children = new ArrayList<>(Arrays.asList("b"));
        ZNodeRecord record = new ZNodeRecord("/a", data, STAT, children);
        data[0] = 'z';
        children.add("c");
        record.getData()[0] = 'q';
        assertArrayEquals("x".getBytes(UTF_8), record.getData());
        assertEquals(Arrays.asList("b"), record.getChildren());
    }

    @Test
    public void testNameAndParent() {
        ZNodeRecord record = new ZNodeRecord("/a/b", null, null, null);
        assertEquals("b", record.getName());
        assertEquals("/a", record.getParentPath());
        assertNull(new ZNodeRecord("/", null, null, null).getParentPath());
    }

    @Test
    public void testInvalidPath() {
        assertThrows(IllegalArgumentException.class, () -> new ZNodeRecord("a/b", null, null, null));
    }

    @Test
    public void testContentEqualsIgnoresStat() {
        ZNodeRecord one = new ZNodeRecord("/a", "x".getBytes(UTF_8), STAT, Arrays.asList("b"));
        ZNodeRecord two = new ZNodeRecord("/a", "x".getBytes(UTF_8), ZNodeStat.EMPTY, Arrays.asList("b"));
        assertTrue(one.contentEquals(two));
        assertNotEquals(one, two);
        assertFalse(one.contentEquals(one.withPath("/z")));
        assertTrue(one.withPath("/z").contentEquals(two.withPath("/z")));
    }

    @Test
    public void testEphemeral() {
        assertFalse(STAT.isEphemeral());
        assertTrue(new ZNodeStat(1, 2, 3, 4, 5, 6, 7, 0x1234L, 1, 0).isEphemeral());
    }

}
