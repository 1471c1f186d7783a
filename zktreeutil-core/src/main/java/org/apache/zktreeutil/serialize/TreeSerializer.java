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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Consumer;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.zktreeutil.NodeIterator;
import org.apache.zktreeutil.ZNodeRecord;
import org.apache.zktreeutil.common.PathUtils;
import org.apache.zktreeutil.store.NodeStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between pre-order sequences of {@link ZNodeRecord}s and nested
 * {@link ZNodeDocument}s, and reads and writes documents as UTF-8 JSON.
 * <p>
 * Converting a walk to a document and back yields the same paths, data
 * and children in the same order. Nodes read from a document always list
 * siblings in name order, which is also the order of
 * {@link ZNodeRecord#getChildren()}. Stats are kept in the document for
 * reference only.
 */
@InterfaceAudience.Public
public class TreeSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(TreeSerializer.class);

    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper;

    public TreeSerializer() {
        mapper = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
            .build();
    }

    /**
     * Same as {@link #toDocument(NodeIterator, Consumer)}, logging nodes that
     * could not be read.
     */
    public ZNodeDocument toDocument(NodeIterator nodes)
        throws MalformedSequenceException, NodeStoreException, InterruptedException {
        return toDocument(nodes, e -> LOG.warn("Skipping ZNode at {}: {}", e.getPath(), e.getMessage()));
    }

    /**
     * Nest a pre-order sequence into a document. The first record is the
     * document root; every following record must be a child of the most
     * recent record one level up.
     *
     * @param nodes sequence to consume
     * @param onNodeFailure receives failures to read a node other than the
     *        first; the node and its subtree are left out of the document
     * @throws MalformedSequenceException if the sequence is empty or not
     *         parent-first pre-order
     * @throws NodeStoreException if the first node cannot be read
     */
    public ZNodeDocument toDocument(NodeIterator nodes, Consumer<NodeStoreException> onNodeFailure)
        throws MalformedSequenceException, NodeStoreException, InterruptedException {
        ZNodeDocument document = null;
        // most recently seen node at each depth, deepest on top
        Deque<Frame> ancestors = new ArrayDeque<>();

        while (nodes.hasNext()) {
            ZNodeRecord record;
            try {
                record = nodes.next();
            } catch (NodeStoreException e) {
                if (document == null) {
                    throw e;
                }
                onNodeFailure.accept(e);
                continue;
            }

            ZNodeEntry entry = toEntry(record);
            if (document == null) {
                document = new ZNodeDocument(FORMAT_VERSION, record.getPath(), entry);
                ancestors.push(new Frame(record.getPath(), entry));
                continue;
            }

            String path = record.getPath();
            if (path.equals(document.getRootPath()) || !PathUtils.isSameOrDescendant(document.getRootPath(), path)) {
                throw new MalformedSequenceException(
                    "ZNode " + path + " is not a descendant of " + document.getRootPath(), path);
            }
            int depth = PathUtils.getDepth(path);
            while (!ancestors.isEmpty() && PathUtils.getDepth(ancestors.peek().path) >= depth) {
                ancestors.pop();
            }
            Frame parent = ancestors.peek();
            if (parent == null || !parent.path.equals(record.getParentPath())) {
                throw new MalformedSequenceException(
                    "ZNode " + path + " does not follow its parent " + record.getParentPath(), path);
            }
            if (!parent.childNames.add(record.getName())) {
                throw new MalformedSequenceException("ZNode " + path + " appears twice", path);
            }
            parent.entry.getChildren().add(entry);
            ancestors.push(new Frame(path, entry));
        }

        if (document == null) {
            throw new MalformedSequenceException("No ZNodes to serialize", null);
        }
        return document;
    }

    /**
     * Validate a document and return its nodes in pre-order, children in
     * name order. The root entry is located at the document's root
     * path, every other entry at its parent's path plus its name.
     *
     * @throws MalformedDocumentException if required fields are missing or
     *         data cannot be decoded; nothing is returned in that case
     */
    public NodeIterator fromDocument(ZNodeDocument document) throws MalformedDocumentException {
        return fromDocument(document, null);
    }

    /**
     * Same as {@link #fromDocument(ZNodeDocument)} but locating the root
     * entry at {@code rootPath} instead of the document's own root path.
     */
    public NodeIterator fromDocument(ZNodeDocument document, String rootPath) throws MalformedDocumentException {
        if (document == null) {
            throw new MalformedDocumentException("Document is empty", null);
        }
        if (document.getVersion() != FORMAT_VERSION) {
            throw new MalformedDocumentException("Unsupported document version " + document.getVersion(), null);
        }
        String root = rootPath != null ? rootPath : document.getRootPath();
        if (root == null) {
            throw new MalformedDocumentException("Document has no rootPath", null);
        }
        try {
            PathUtils.validatePath(root);
        } catch (IllegalArgumentException e) {
            throw new MalformedDocumentException(e.getMessage(), root, e);
        }
        if (document.getRoot() == null) {
            throw new MalformedDocumentException("Document has no root entry", root);
        }
        validate(document.getRoot(), root, true);
        return new DocumentIterator(root, document.getRoot());
    }

    public void write(ZNodeDocument document, OutputStream out) throws IOException {
        mapper.writeValue(out, document);
        out.write('\n');
        out.flush();
    }

    /**
     * Write the document to a new file.
     *
     * @param overwrite replace the file if it exists
     */
    public void writeFile(ZNodeDocument document, Path file, boolean overwrite) throws IOException {
        if (!overwrite && Files.exists(file)) {
            throw new IOException("File " + file + " already exists");
        }
        try (OutputStream out = Files.newOutputStream(file)) {
            write(document, out);
        }
        LOG.debug("Wrote ZNodes under {} to {}", document.getRootPath(), file);
    }

    public ZNodeDocument read(InputStream in) throws IOException {
        try {
            return mapper.readValue(in, ZNodeDocument.class);
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException("Cannot parse document: " + e.getOriginalMessage(), null, e);
        }
    }

    public ZNodeDocument readFile(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    private static ZNodeEntry toEntry(ZNodeRecord record) {
        return new ZNodeEntry(record.getName(), Base64.getEncoder().encodeToString(record.getData()), record.getStat());
    }

    private static void validate(ZNodeEntry entry, String path, boolean isRoot) throws MalformedDocumentException {
        if (entry.getName() == null) {
            throw new MalformedDocumentException("Entry has no name", path);
        }
        if (!isRoot) {
            try {
                PathUtils.validateName(entry.getName());
            } catch (IllegalArgumentException e) {
                throw new MalformedDocumentException(e.getMessage(), path, e);
            }
        }
        decode(entry, path);
        if (entry.getChildren() == null) {
            return;
        }
        Set<String> names = new HashSet<>();
        for (ZNodeEntry child : entry.getChildren()) {
            if (child == null) {
                throw new MalformedDocumentException("Null child entry", path);
            }
            String childPath = child.getName() == null ? path : PathUtils.join(path, child.getName());
            validate(child, childPath, false);
            if (!names.add(child.getName())) {
                throw new MalformedDocumentException("Duplicate child " + child.getName(), path);
            }
        }
    }

    private static byte[] decode(ZNodeEntry entry, String path) throws MalformedDocumentException {
        if (entry.getData() == null) {
            throw new MalformedDocumentException("Entry has no data", path);
        }
        try {
            return Base64.getDecoder().decode(entry.getData());
        } catch (IllegalArgumentException e) {
            throw new MalformedDocumentException("Data is not valid base64: " + e.getMessage(), path, e);
        }
    }

    private static final class Frame {

        final String path;
        final ZNodeEntry entry;
        final Set<String> childNames = new HashSet<>();

        Frame(String path, ZNodeEntry entry) {
            this.path = path;
            this.entry = entry;
        }

    }

    /**
     * Pre-order iteration over an already validated document.
     */
    private static final class DocumentIterator implements NodeIterator {

        private final Deque<Frame> pending = new ArrayDeque<>();

        DocumentIterator(String rootPath, ZNodeEntry root) {
            pending.push(new Frame(rootPath, root));
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public ZNodeRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more nodes");
            }
            Frame frame = pending.pop();
            List<ZNodeEntry> children = frame.entry.getChildren() == null
                ? new ArrayList<>()
                : new ArrayList<>(frame.entry.getChildren());
            // same sibling order as a walk, whatever the order in the document
            children.sort(Comparator.comparing(ZNodeEntry::getName));
            List<String> names = new ArrayList<>(children.size());
            for (int i = children.size() - 1; i >= 0; i--) {
                ZNodeEntry child = children.get(i);
                names.add(child.getName());
                pending.push(new Frame(PathUtils.join(frame.path, child.getName()), child));
            }
            byte[] data = Base64.getDecoder().decode(frame.entry.getData());
            return new ZNodeRecord(frame.path, data, frame.entry.getStat(), names);
        }

    }

}
