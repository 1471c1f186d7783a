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

package org.apache.zktreeutil.print;

import static java.nio.charset.StandardCharsets.UTF_8;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Date;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.zktreeutil.NodeIterator;
import org.apache.zktreeutil.ZNodeRecord;
import org.apache.zktreeutil.ZNodeStat;
import org.apache.zktreeutil.common.PathUtils;
import org.apache.zktreeutil.store.NodeStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints a pre-order sequence of znodes as an indented listing, two spaces
 * per level below the first node.
 */
@InterfaceAudience.Public
public class TreePrinter {

    private static final Logger LOG = LoggerFactory.getLogger(TreePrinter.class);

    public static final int DEFAULT_MAX_DATA_BYTES = 1024;

    private final DataFormatter formatter;
    private final int maxDataBytes;
    private final boolean printStat;

    public TreePrinter() {
        this(AutoDataFormatter.INSTANCE, DEFAULT_MAX_DATA_BYTES, true);
    }

    /**
     * @param formatter renders node data
     * @param maxDataBytes data longer than this is replaced by a placeholder
     * @param printStat whether to print the stat fields of every node
     */
    public TreePrinter(DataFormatter formatter, int maxDataBytes, boolean printStat) {
        this.formatter = formatter;
        this.maxDataBytes = maxDataBytes;
        this.printStat = printStat;
    }

    /**
     * Print every node of the sequence. Nodes that cannot be read are printed
     * as a single error line and left out.
     *
     * @return number of nodes that could not be read
     * @throws NodeStoreException if the first node cannot be read
     */
    public int print(NodeIterator nodes, PrintStream out) throws NodeStoreException, InterruptedException {
        int rootDepth = -1;
        int failed = 0;
        while (nodes.hasNext()) {
            ZNodeRecord record;
            try {
                record = nodes.next();
            } catch (NodeStoreException e) {
                if (rootDepth < 0) {
                    throw e;
                }
                LOG.warn("Cannot print ZNode at {}: {}", e.getPath(), e.getMessage());
                out.println(indent(PathUtils.getDepth(e.getPath()) - rootDepth) + e.getPath() + " (" + e.getMessage() + ")");
                failed++;
                continue;
            }
            if (rootDepth < 0) {
                rootDepth = PathUtils.getDepth(record.getPath());
            }
            printNode(record, indent(PathUtils.getDepth(record.getPath()) - rootDepth), out);
        }
        out.flush();
        return failed;
    }

    /**
     * Same as {@link #print(NodeIterator, PrintStream)}, returning the text.
     */
    public String render(NodeIterator nodes) throws NodeStoreException, InterruptedException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(buf, false, UTF_8)) {
            print(nodes, out);
        }
        return new String(buf.toByteArray(), UTF_8);
    }

    private void printNode(ZNodeRecord record, String indent, PrintStream out) {
        out.println(indent + record.getPath());
        String fieldIndent = indent + "  ";
        ZNodeStat stat = record.getStat();
        if (stat.isEphemeral()) {
            out.println(fieldIndent + "ephemeral");
        }
        if (printStat) {
            printHex(out, fieldIndent, "cZxid", stat.getCzxid());
            out.println(fieldIndent + "ctime = " + new Date(stat.getCtime()));
            printHex(out, fieldIndent, "mZxid", stat.getMzxid());
            out.println(fieldIndent + "mtime = " + new Date(stat.getMtime()));
            out.println(fieldIndent + "cversion = " + stat.getCversion());
            out.println(fieldIndent + "dataVersion = " + stat.getVersion());
            out.println(fieldIndent + "aclVersion = " + stat.getAversion());
            printHex(out, fieldIndent, "ephemeralOwner", stat.getEphemeralOwner());
            out.println(fieldIndent + "numChildren = " + record.getChildren().size());
        }
        out.println(fieldIndent + "dataLength = " + record.getDataLength());
        out.println(fieldIndent + "data = " + formatData(record.getData(), fieldIndent));
    }

    String formatData(byte[] data, String indent) {
        if (data.length == 0) {
            return "(empty)";
        }
        if (data.length > maxDataBytes) {
            return String.format("(%d bytes, not shown)", data.length);
        }
        String text = formatter.format(data);
        if (text.endsWith("\n")) {
            text = text.substring(0, text.length() - 1);
        }
        // continuation lines line up underneath the field name
        return text.replace("\n", "\n" + indent + "  ");
    }

    private static void printHex(PrintStream out, String indent, String name, long value) {
        out.println(String.format("%s%s = %#016x", indent, name, value));
    }

    private static String indent(int depth) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        return sb.toString();
    }

}
