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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.apache.zktreeutil.store.TestTrees.drain;
import static org.apache.zktreeutil.store.TestTrees.iterate;
import static org.apache.zktreeutil.store.TestTrees.paths;
import static org.apache.zktreeutil.store.TestTrees.record;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.zktreeutil.ZNodeRecord;
import org.apache.zktreeutil.ZkTreeUtilTestCase;
import org.apache.zktreeutil.common.PathUtils;
import org.apache.zktreeutil.store.FaultInjectingNodeStore;
import org.apache.zktreeutil.store.FaultInjectingNodeStore.Op;
import org.apache.zktreeutil.store.NodeStoreException;
import org.apache.zktreeutil.store.TestTrees;
import org.apache.zktreeutil.walk.TreeWalker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TreeSerializerTest extends ZkTreeUtilTestCase {

    private final TreeSerializer serializer = new TreeSerializer();

    @Test
    public void testRoundTrip() throws Exception {
        List<ZNodeRecord> walked = drain(TreeWalker.walk(TestTrees.mixedTree(), "/app"));
        ZNodeDocument document = serializer.toDocument(TreeWalker.walk(TestTrees.mixedTree(), "/app"));
        List<ZNodeRecord> restored = drain(serializer.fromDocument(document));

        assertEquals(walked.size(), restored.size());
        for (int i = 0; i < walked.size(); i++) {
            assertTrue(walked.get(i).contentEquals(restored.get(i)), walked.get(i).getPath());
            assertEquals(walked.get(i).getStat(), restored.get(i).getStat());
        }
    }

    @Test
    public void testRoundTripThroughJson() throws Exception {
        ZNodeDocument document = serializer.toDocument(TreeWalker.walk(TestTrees.mixedTree(), "/app"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        serializer.write(document, out);
        String json = new String(out.toByteArray(), UTF_8);
        assertThat(json, containsString("\"rootPath\" : \"/app\""));
        assertThat(json, containsString("\"data\" : \"cm9vdA==\""));

        ZNodeDocument read = serializer.read(new ByteArrayInputStream(out.toByteArray()));
        assertThat(paths(drain(serializer.fromDocument(read))), contains(
            "/app", "/app/alpha", "/app/alpha/1", "/app/alpha/2", "/app/mid", "/app/zeta"));
    }

    @Test
    public void testExportThenImportElsewhere() throws Exception {
        ZNodeDocument document = serializer.toDocument(TreeWalker.walk(TestTrees.exampleTree(), "/a"));
        assertEquals("/a", document.getRootPath());
        assertEquals("a", document.getRoot().getName());
        assertEquals(1, document.getRoot().getChildren().size());

        List<ZNodeRecord> records = drain(serializer.fromDocument(document, "/q"));
        assertThat(paths(records), contains("/q", "/q/b"));
        assertArrayEquals("x".getBytes(UTF_8), records.get(0).getData());
        assertArrayEquals("y".getBytes(UTF_8), records.get(1).getData());
        assertEquals(Arrays.asList("b"), records.get(0).getChildren());
    }

    @Test
    public void testChildrenAreYieldedInNameOrder() throws Exception {
        ZNodeEntry root = new ZNodeEntry("r", "", null);
        root.getChildren().add(new ZNodeEntry("z", "", null));
        root.getChildren().add(new ZNodeEntry("m", "", null));
        root.getChildren().add(new ZNodeEntry("a", "", null));
        ZNodeDocument document = new ZNodeDocument(TreeSerializer.FORMAT_VERSION, "/r", root);

        List<ZNodeRecord> records = drain(serializer.fromDocument(document));
        assertThat(paths(records), contains("/r", "/r/a", "/r/m", "/r/z"));
        List<String> yielded = new ArrayList<>();
        for (ZNodeRecord record : records.subList(1, records.size())) {
            yielded.add(PathUtils.getName(record.getPath()));
        }
        assertEquals(records.get(0).getChildren(), yielded);
    }

    @Test
    public void testBinaryData() throws Exception {
        byte[] data = new byte[256];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }
        ZNodeDocument document = serializer.toDocument(iterate(new ZNodeRecord("/bin", data, null, null)));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        serializer.write(document, out);
        ZNodeDocument read = serializer.read(new ByteArrayInputStream(out.toByteArray()));
        assertArrayEquals(data, serializer.fromDocument(read).next().getData());
    }

    @Test
    public void testMalformedSequences() {
        assertMalformedSequence("/a/b/c", record("/a", ""), record("/a/b/c", ""));
        assertMalformedSequence("/b", record("/a", ""), record("/b", ""));
        assertMalformedSequence("/ab", record("/a", ""), record("/ab", ""));
        assertMalformedSequence("/a", record("/a", ""), record("/a", ""));
        assertMalformedSequence("/a/b", record("/a", ""), record("/a/b", ""), record("/a/b", ""));
        assertMalformedSequence("/a/b/x",
            record("/a", ""), record("/a/b", ""), record("/a/c", ""), record("/a/b/x", ""));
        assertMalformedSequence(null);
    }

    private void assertMalformedSequence(String path, ZNodeRecord... records) {
        MalformedSequenceException e = assertThrows(MalformedSequenceException.class,
            () -> serializer.toDocument(iterate(records)));
        assertEquals(path, e.getPath());
    }

    @Test
    public void testDeepSequence() throws Exception {
        ZNodeDocument document = serializer.toDocument(iterate(
            record("/a", "1"), record("/a/b", "2"), record("/a/b/c", "3"), record("/a/d", "4")));
        assertEquals(2, document.getRoot().getChildren().size());
        assertEquals("c", document.getRoot().getChildren().get(0).getChildren().get(0).getName());
    }

    @Test
    public void testFirstNodeFailureIsThrown() throws Exception {
        FaultInjectingNodeStore store = new FaultInjectingNodeStore(TestTrees.exampleTree())
            .failOn(Op.GET_DATA, "/a", NodeStoreException.Code.NOAUTH, 1);
        assertThrows(NodeStoreException.NoAuthException.class,
            () -> serializer.toDocument(TreeWalker.walk(store, "/a")));
    }

    @Test
    public void testLaterNodeFailureIsReported() throws Exception {
        FaultInjectingNodeStore store = new FaultInjectingNodeStore(TestTrees.mixedTree())
            .failOn(Op.LIST_CHILDREN, "/app/alpha", NodeStoreException.Code.NOAUTH, 1);
        List<NodeStoreException> failures = new ArrayList<>();
        ZNodeDocument document = serializer.toDocument(TreeWalker.walk(store, "/app"), failures::add);

        assertEquals(1, failures.size());
        assertEquals("/app/alpha", failures.get(0).getPath());
        assertThat(paths(drain(serializer.fromDocument(document))), contains("/app", "/app/mid", "/app/zeta"));
    }

    @Test
    public void testMalformedDocuments() {
        assertMalformed("{\"version\":2,\"rootPath\":\"/a\",\"root\":{\"name\":\"a\",\"data\":\"\"}}");
        assertMalformed("{\"rootPath\":\"/a\",\"root\":{\"name\":\"a\",\"data\":\"\"}}");
        assertMalformed("{\"version\":1,\"root\":{\"name\":\"a\",\"data\":\"\"}}");
        assertMalformed("{\"version\":1,\"rootPath\":\"a\",\"root\":{\"name\":\"a\",\"data\":\"\"}}");
        assertMalformed("{\"version\":1,\"rootPath\":\"/a\"}");
        assertMalformed("{\"version\":1,\"rootPath\":\"/a\",\"root\":{\"name\":\"a\"}}");
        assertMalformed("{\"version\":1,\"rootPath\":\"/a\",\"root\":{\"name\":\"a\",\"data\":\"!!\"}}");
        assertMalformed("{\"version\":1,\"rootPath\":\"/a\",\"root\":{\"name\":\"a\",\"data\":\"\","
            + "\"children\":[{\"name\":\"b/c\",\"data\":\"\"}]}}");
        assertMalformed("{\"version\":1,\"rootPath\":\"/a\",\"root\":{\"name\":\"a\",\"data\":\"\","
            + "\"children\":[{\"data\":\"\"}]}}");
        assertMalformed("{\"version\":1,\"rootPath\":\"/a\",\"root\":{\"name\":\"a\",\"data\":\"\","
            + "\"children\":[{\"name\":\"b\",\"data\":\"\"},{\"name\":\"b\",\"data\":\"\"}]}}");
        assertMalformed("{\"version\":1,\"rootPath\":\"/a\",\"root\":{\"name\":\"a\",\"data\":\"\","
            + "\"children\":[{\"name\":\"b\",\"data\":\"\",\"children\":[{\"name\":\"c\",\"data\":\"%%\"}]}]}}");
        assertMalformed("{\"version\":1,");
        assertMalformed("not json");
    }

    private void assertMalformed(String json) {
        assertThrows(MalformedDocumentException.class, () -> {
            ZNodeDocument document = serializer.read(new ByteArrayInputStream(json.getBytes(UTF_8)));
            serializer.fromDocument(document);
        }, json);
    }

    @Test
    public void testUnknownFieldsAreIgnored() throws Exception {
        String json = "{\"version\":1,\"rootPath\":\"/a\",\"comment\":\"hi\","
            + "\"root\":{\"name\":\"a\",\"data\":\"eA==\",\"extra\":true}}";
        ZNodeDocument document = serializer.read(new ByteArrayInputStream(json.getBytes(UTF_8)));
        ZNodeRecord record = serializer.fromDocument(document).next();
        assertArrayEquals("x".getBytes(UTF_8), record.getData());
    }

    @Test
    public void testInvalidRelocation() throws Exception {
        ZNodeDocument document = serializer.toDocument(TreeWalker.walk(TestTrees.exampleTree(), "/a"));
        assertThrows(MalformedDocumentException.class, () -> serializer.fromDocument(document, "q"));
        assertThrows(MalformedDocumentException.class, () -> serializer.fromDocument(null));
    }

    @Test
    public void testFiles(@TempDir Path dir) throws Exception {
        ZNodeDocument document = serializer.toDocument(TreeWalker.walk(TestTrees.exampleTree(), "/a"));
        Path file = dir.resolve("tree.json");
        serializer.writeFile(document, file, false);
        assertTrue(Files.size(file) > 0);

        IOException e = assertThrows(IOException.class, () -> serializer.writeFile(document, file, false));
        assertThat(e.getMessage(), containsString("already exists"));
        serializer.writeFile(document, file, true);

        ZNodeDocument read = serializer.readFile(file);
        assertNotNull(read.getRoot());
        assertThat(paths(drain(serializer.fromDocument(read))), contains("/a", "/a/b"));
    }

}
