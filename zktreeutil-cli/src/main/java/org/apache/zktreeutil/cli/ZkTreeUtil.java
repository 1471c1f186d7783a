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

package org.apache.zktreeutil.cli;

import static java.nio.charset.StandardCharsets.UTF_8;
import ch.qos.logback.classic.Level;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.zookeeper.client.ZKClientConfig;
import org.apache.zookeeper.server.quorum.QuorumPeerConfig.ConfigException;
import org.apache.zktreeutil.NodeIterator;
import org.apache.zktreeutil.print.DataFormatter;
import org.apache.zktreeutil.print.TreePrinter;
import org.apache.zktreeutil.replicate.ReplicationSummary;
import org.apache.zktreeutil.replicate.Replicator;
import org.apache.zktreeutil.replicate.RetrySupport;
import org.apache.zktreeutil.replicate.RootFailureException;
import org.apache.zktreeutil.resolve.ConflictPolicy;
import org.apache.zktreeutil.resolve.ConflictPrompt;
import org.apache.zktreeutil.serialize.SerializationException;
import org.apache.zktreeutil.serialize.TreeSerializer;
import org.apache.zktreeutil.serialize.ZNodeDocument;
import org.apache.zktreeutil.store.NodeStore;
import org.apache.zktreeutil.store.NodeStoreException;
import org.apache.zktreeutil.util.ServiceUtils;
import org.apache.zktreeutil.walk.TreeWalker;
import org.apache.zktreeutil.zookeeper.ZooKeeperNodeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line tool to print, copy, export and import ZooKeeper subtrees.
 */
public class ZkTreeUtil {

    private static final Logger LOG = LoggerFactory.getLogger(ZkTreeUtil.class);

    private static final String USAGE = "zktreeutil [-p | -c | -x | -i] [options] SRC [DST]";

    static class ZkTreeUtilException extends Exception {

        private static final long serialVersionUID = 1L;
        private final int exitCode;

        ZkTreeUtilException(ExitCode exitCode, String message, Object... params) {
            super(String.format(message, params));
            this.exitCode = exitCode.getValue();
        }

        int getExitCode() {
            return exitCode;
        }

    }

    static class ZkTreeUtilParseException extends ZkTreeUtilException {

        private static final long serialVersionUID = 1L;

        ZkTreeUtilParseException(String message, Object... params) {
            super(ExitCode.INVALID_INVOCATION, message, params);
        }

    }

    enum Action {
        PRINT,
        COPY,
        EXPORT,
        IMPORT
    }

    private final NodeStoreFactory storeFactory;
    private final InputStream in;
    private final PrintStream out;
    private final TreeSerializer serializer = new TreeSerializer();

    public ZkTreeUtil() {
        this(NodeStoreFactory.ZOOKEEPER, System.in, System.out);
    }

    public ZkTreeUtil(NodeStoreFactory storeFactory, InputStream in, PrintStream out) {
        this.storeFactory = storeFactory;
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new ZkTreeUtil().run(args);
        ServiceUtils.requestSystemExit(exitCode);
    }

    /**
     * Run the tool.
     *
     * @return the process exit code
     * @see ExitCode
     */
    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cl;
        try {
            cl = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printHelp(options, System.err);
            return ExitCode.INVALID_INVOCATION.getValue();
        }
        if (cl.hasOption("help")) {
            printHelp(options, out);
            return ExitCode.EXECUTION_FINISHED.getValue();
        }
        if (cl.hasOption("verbose")) {
            enableDebugLogging();
        }

        Action action = getAction(cl);
        try {
            ZkTreeUtilConfig config = buildConfig(cl);
            LOG.info("Running action: {}", action);
            ExitCode exitCode = execute(action, cl, config);
            LOG.info("Completed action: {}", action);
            return exitCode.getValue();
        } catch (ZkTreeUtilParseException e) {
            System.err.println(e.getMessage());
            printHelp(options, System.err);
            return e.getExitCode();
        } catch (ZkTreeUtilException e) {
            LOG.error(e.getMessage());
            return e.getExitCode();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Interrupted while running action {}", action);
            return ExitCode.UNEXPECTED_ERROR.getValue();
        } catch (IOException | RuntimeException e) {
            LOG.error("Unexpected error while running action {}", action, e);
            return ExitCode.UNEXPECTED_ERROR.getValue();
        }
    }

    static Options buildOptions() {
        Options options = new Options();

        OptionGroup actions = new OptionGroup();
        actions.addOption(new Option("p", "print", false, "Print the subtree at SRC (default)"));
        actions.addOption(new Option("c", "copy", false, "Copy the subtree at SRC to DST"));
        actions.addOption(new Option("x", "export", false, "Export the subtree at SRC to --file"));
        actions.addOption(new Option("i", "import", false, "Import --file into the subtree at DST"));
        options.addOptionGroup(actions);

        OptionGroup resolution = new OptionGroup();
        resolution.addOption(new Option(null, ConflictPolicy.NO_CLOBBER.getOptionName(), false,
            "Leave existing destination nodes untouched (default)"));
        resolution.addOption(new Option(null, ConflictPolicy.INTERACTIVE.getOptionName(), false,
            "Ask before overwriting an existing destination node"));
        resolution.addOption(new Option(null, ConflictPolicy.OVERWRITE.getOptionName(), false,
            "Overwrite the data of existing destination nodes"));
        options.addOptionGroup(resolution);

        options.addOption(new Option("f", "file", true, "Document file to export to or import from"));
        options.addOption(new Option(null, "force", false, "Overwrite an existing export file"));
        options.addOption(new Option(null, "format", true, "Data format for print: plain, base64, hex or auto"));
        options.addOption(new Option(null, "config", true, "Properties file with zktreeutil settings"));
        options.addOption(new Option(null, "client-configuration", true, "ZooKeeper client properties file"));
        options.addOption(new Option(null, "auth", true, "Authentication as scheme:credentials"));
        options.addOption(new Option("v", "verbose", false, "Log every node processed"));
        options.addOption(new Option("h", "help", false, "Print help message"));
        return options;
    }

    private static void printHelp(Options options, PrintStream stream) {
        HelpFormatter help = new HelpFormatter();
        PrintWriter writer = new PrintWriter(stream);
        help.printHelp(writer, 120, USAGE, "", options, 2, 4, "Locations are host:port[,host:port...]/path");
        writer.flush();
    }

    static Action getAction(CommandLine cl) {
        if (cl.hasOption("copy")) {
            return Action.COPY;
        } else if (cl.hasOption("export")) {
            return Action.EXPORT;
        } else if (cl.hasOption("import")) {
            return Action.IMPORT;
        }
        return Action.PRINT;
    }

    static ConflictPolicy getPolicy(CommandLine cl) {
        for (ConflictPolicy policy : ConflictPolicy.values()) {
            if (cl.hasOption(policy.getOptionName())) {
                return policy;
            }
        }
        return ConflictPolicy.NO_CLOBBER;
    }

    private static ZkTreeUtilConfig buildConfig(CommandLine cl) throws ZkTreeUtilException {
        ZkTreeUtilConfig config = new ZkTreeUtilConfig();
        try {
            if (cl.hasOption("config")) {
                config.addConfiguration(new File(cl.getOptionValue("config")));
            }
            if (cl.hasOption("client-configuration")) {
                config.setClientConfig(new ZKClientConfig(cl.getOptionValue("client-configuration")));
            }
            if (cl.hasOption("format")) {
                config.setProperty(ZkTreeUtilConfig.PRINT_FORMAT, cl.getOptionValue("format"));
            }
            if (cl.hasOption("auth")) {
                config.setProperty(ZkTreeUtilConfig.AUTH, cl.getOptionValue("auth"));
            }
            config.validate();
            ZooKeeperNodeStore.toAcl(config.getCreateAcl());
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ZkTreeUtilParseException("Invalid configuration: %s", e.getMessage());
        }
        return config;
    }

    private ExitCode execute(Action action, CommandLine cl, ZkTreeUtilConfig config)
        throws ZkTreeUtilException, IOException, InterruptedException {
        String[] args = cl.getArgs();
        boolean hasFile = cl.hasOption("file");
        if (cl.hasOption("force") && action != Action.EXPORT) {
            throw new ZkTreeUtilParseException("--force is only valid with --export");
        }
        if (cl.hasOption("format") && action != Action.PRINT) {
            throw new ZkTreeUtilParseException("--format is only valid with --print");
        }
        boolean hasPolicy = false;
        for (ConflictPolicy policy : ConflictPolicy.values()) {
            hasPolicy |= cl.hasOption(policy.getOptionName());
        }
        if (hasPolicy && (action == Action.PRINT || action == Action.EXPORT)) {
            throw new ZkTreeUtilParseException("Conflict resolution options are only valid with --copy and --import");
        }

        switch (action) {
        case COPY:
            if (hasFile) {
                throw new ZkTreeUtilParseException("--file is not valid with --copy");
            }
            checkArgCount(args, 2, "--copy requires SRC and DST");
            return copy(location(args[0]), location(args[1]), getPolicy(cl), config);
        case EXPORT:
            if (!hasFile) {
                throw new ZkTreeUtilParseException("--export requires --file");
            }
            checkArgCount(args, 1, "--export requires SRC");
            return export(location(args[0]), Paths.get(cl.getOptionValue("file")), cl.hasOption("force"), config);
        case IMPORT:
            if (!hasFile) {
                throw new ZkTreeUtilParseException("--import requires --file");
            }
            checkArgCount(args, 1, "--import requires DST");
            return importFile(Paths.get(cl.getOptionValue("file")), location(args[0]), getPolicy(cl), config);
        case PRINT:
        default:
            if (hasFile) {
                throw new ZkTreeUtilParseException("--file is not valid with --print");
            }
            checkArgCount(args, 1, "--print requires SRC");
            return print(location(args[0]), config);
        }
    }

    private ExitCode print(ZkLocation source, ZkTreeUtilConfig config)
        throws ZkTreeUtilException, IOException, InterruptedException {
        DataFormatter formatter;
        try {
            formatter = DataFormatter.forName(config.getPrintFormat());
        } catch (IllegalArgumentException e) {
            throw new ZkTreeUtilParseException("%s", e.getMessage());
        }
        TreePrinter printer = new TreePrinter(formatter, config.getPrintMaxDataBytes(), true);
        try (NodeStore store = open(source, config)) {
            int failed = printer.print(walk(store, source), out);
            return failed > 0 ? ExitCode.NODE_FAILURES : ExitCode.EXECUTION_FINISHED;
        } catch (NodeStoreException e) {
            throw new ZkTreeUtilException(ExitCode.FATAL_FAILURE, "Cannot print %s: %s", source, e.getMessage());
        }
    }

    private ExitCode export(ZkLocation source, Path file, boolean force, ZkTreeUtilConfig config)
        throws ZkTreeUtilException, IOException, InterruptedException {
        if (!force && Files.exists(file)) {
            throw new ZkTreeUtilException(ExitCode.FATAL_FAILURE, "File %s already exists, use --force to overwrite it", file);
        }
        AtomicInteger failed = new AtomicInteger();
        ZNodeDocument document;
        try (NodeStore store = open(source, config)) {
            document = serializer.toDocument(walk(store, source), e -> {
                LOG.warn("Skipping ZNode at {}: {}", e.getPath(), e.getMessage());
                failed.incrementAndGet();
            });
        } catch (NodeStoreException | SerializationException e) {
            throw new ZkTreeUtilException(ExitCode.FATAL_FAILURE, "Cannot export %s: %s", source, e.getMessage());
        }
        serializer.writeFile(document, file, force);
        LOG.info("Exported {} to {}", source, file);
        return failed.get() > 0 ? ExitCode.NODE_FAILURES : ExitCode.EXECUTION_FINISHED;
    }

    private ExitCode importFile(Path file, ZkLocation destination, ConflictPolicy policy, ZkTreeUtilConfig config)
        throws ZkTreeUtilException, IOException, InterruptedException {
        NodeIterator nodes;
        try {
            nodes = serializer.fromDocument(serializer.readFile(file));
        } catch (IOException e) {
            throw new ZkTreeUtilException(ExitCode.FATAL_FAILURE, "Cannot import %s: %s", file, e.getMessage());
        }
        try (NodeStore store = open(destination, config)) {
            return replicate(nodes, store, destination, policy, config);
        }
    }

    private ExitCode copy(ZkLocation source, ZkLocation destination, ConflictPolicy policy, ZkTreeUtilConfig config)
        throws ZkTreeUtilException, IOException, InterruptedException {
        try (NodeStore sourceStore = open(source, config);
             NodeStore destinationStore = open(destination, config)) {
            NodeIterator nodes;
            try {
                nodes = walk(sourceStore, source);
            } catch (NodeStoreException e) {
                throw new ZkTreeUtilException(ExitCode.FATAL_FAILURE, "Cannot copy %s: %s", source, e.getMessage());
            }
            return replicate(nodes, destinationStore, destination, policy, config);
        }
    }

    private ExitCode replicate(
        NodeIterator nodes,
        NodeStore store,
        ZkLocation destination,
        ConflictPolicy policy,
        ZkTreeUtilConfig config) throws ZkTreeUtilException, InterruptedException {
        RetrySupport retrySupport = new RetrySupport(config.getWriteRetries(), config.getWriteRetryDelay());
        Replicator replicator = new Replicator(store, retrySupport, config.isCreateParents());
        ConflictPrompt prompt = policy == ConflictPolicy.INTERACTIVE
            ? new ConsolePrompt(new BufferedReader(new InputStreamReader(in, UTF_8)), out)
            : null;

        ReplicationSummary summary;
        try {
            summary = replicator.replicate(nodes, destination.getPath(), policy, prompt);
        } catch (RootFailureException e) {
            throw new ZkTreeUtilException(ExitCode.FATAL_FAILURE, "%s", e.getMessage());
        }
        out.println(summary);
        if (summary.isAborted()) {
            LOG.info("Aborted at {}", summary.getAbortedAt());
            return ExitCode.ABORTED;
        }
        return summary.getFailed() > 0 ? ExitCode.NODE_FAILURES : ExitCode.EXECUTION_FINISHED;
    }

    private static TreeWalker walk(NodeStore store, ZkLocation location) throws NodeStoreException, InterruptedException {
        return TreeWalker.walk(store, location.getPath());
    }

    private NodeStore open(ZkLocation location, ZkTreeUtilConfig config) throws ZkTreeUtilException, InterruptedException {
        try {
            return storeFactory.open(location.getConnectString(), config);
        } catch (IOException e) {
            throw new ZkTreeUtilException(ExitCode.FATAL_FAILURE, "Cannot connect to %s: %s",
                location.getConnectString(), e.getMessage());
        }
    }

    private static ZkLocation location(String arg) throws ZkTreeUtilParseException {
        try {
            return ZkLocation.parse(arg);
        } catch (IllegalArgumentException e) {
            throw new ZkTreeUtilParseException("%s", e.getMessage());
        }
    }

    private static void checkArgCount(String[] args, int expected, String message) throws ZkTreeUtilParseException {
        if (args.length != expected) {
            throw new ZkTreeUtilParseException(message);
        }
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }

}
