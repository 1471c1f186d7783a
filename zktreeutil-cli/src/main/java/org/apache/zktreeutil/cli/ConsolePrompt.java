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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import org.apache.zktreeutil.resolve.ConflictPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks about conflicting nodes on the console until a valid answer is given.
 * End of input counts as aborting.
 */
public class ConsolePrompt implements ConflictPrompt {

    private static final Logger LOG = LoggerFactory.getLogger(ConsolePrompt.class);

    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePrompt(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public Answer ask(String path) {
        while (true) {
            out.printf("ZNode at %s already exists at destination. Overwrite? (y/n/a) ", path);
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read answer for " + path, e);
            }
            if (line == null) {
                out.println();
                LOG.debug("End of input at prompt for {}, aborting", path);
                return Answer.ABORT_ALL;
            }
            Answer answer = toAnswer(line);
            if (answer != null) {
                LOG.debug("Answer for {}: {}", path, answer);
                return answer;
            }
            out.println("Please answer y (overwrite), n (skip) or a (abort).");
        }
    }

    private static Answer toAnswer(String line) {
        switch (line.trim().toLowerCase(Locale.ROOT)) {
        case "y":
        case "yes":
            return Answer.WRITE;
        case "n":
        case "no":
            return Answer.SKIP;
        case "a":
        case "abort":
            return Answer.ABORT_ALL;
        default:
            return null;
        }
    }

}
