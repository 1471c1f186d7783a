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

package org.apache.zktreeutil.util;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;
import java.util.function.Consumer;
import org.apache.zktreeutil.cli.ExitCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ends the zktreeutil process. Tests replace the exit procedure so that
 * running the tool does not stop the JVM.
 */
public abstract class ServiceUtils {

    private static final Logger LOG = LoggerFactory.getLogger(ServiceUtils.class);

    private ServiceUtils() {
    }

    /**
     * Flushes the tool's output and exits the JVM.
     */
    @SuppressFBWarnings("DM_EXIT")
    public static final Consumer<Integer> SYSTEM_EXIT = (code) -> {
        System.out.flush();
        LOG.debug("Exiting with code {}", code);
        System.exit(code);
    };

    /**
     * Only logs the exit code.
     */
    public static final Consumer<Integer> LOG_ONLY = (code) -> {
        LOG.info("zktreeutil would exit with code {}, System.exit is disabled", code);
    };

    private static volatile Consumer<Integer> systemExitProcedure = SYSTEM_EXIT;

    public static void setSystemExitProcedure(Consumer<Integer> systemExitProcedure) {
        ServiceUtils.systemExitProcedure = Objects.requireNonNull(systemExitProcedure);
    }

    /**
     * @param code one of the {@link ExitCode} values
     */
    public static void requestSystemExit(int code) {
        systemExitProcedure.accept(code);
    }

}
