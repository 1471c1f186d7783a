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

package org.apache.zktreeutil.store;

import org.apache.yetus.audience.InterfaceAudience;

/**
 * Failure reported by a {@link NodeStore}.
 * <p>
 * All non-specific store exceptions should be constructed via
 * {@link #create(Code, String)} so that codes and exception types stay
 * consistent. If the code is known, construct the special purpose exception
 * directly.
 */
@SuppressWarnings("serial")
@InterfaceAudience.Public
public abstract class NodeStoreException extends Exception {

    /**
     * Error codes of a store operation.
     */
    @InterfaceAudience.Public
    public enum Code {
        /** The connection to the store was lost; the operation may or may not have been applied. */
        CONNECTIONLOSS(true, "ConnectionLoss"),
        /** The operation timed out. */
        OPERATIONTIMEOUT(true, "OperationTimeout"),
        /** The session has expired; retrying on the same handle cannot succeed. */
        SESSIONEXPIRED(false, "Session expired"),
        /** Node does not exist. */
        NONODE(false, "NoNode"),
        /** The node already exists. */
        NODEEXISTS(false, "NodeExists"),
        /** Not authorized to perform the operation. */
        NOAUTH(false, "NoAuth"),
        /** Invalid arguments, e.g. ephemeral parents or malformed paths. */
        BADARGUMENTS(false, "BadArguments"),
        /** Any other failure inside the store. */
        SYSTEMERROR(false, "SystemError");

        private final boolean retryable;
        private final String message;

        Code(boolean retryable, String message) {
            this.retryable = retryable;
            this.message = message;
        }

        /**
         * @return true if repeating the same operation may succeed
         */
        public boolean isRetryable() {
            return retryable;
        }

        public String getMessage() {
            return message;
        }
    }

    private final Code code;
    private final String path;

    protected NodeStoreException(Code code, String path) {
        this.code = code;
        this.path = path;
    }

    protected NodeStoreException(Code code, String path, Throwable cause) {
        super(cause);
        this.code = code;
        this.path = path;
    }

    /**
     * Create the exception type matching the given code.
     *
     * @param code the error code
     * @param path the path being operated on, may be null
     * @return the specialized exception, presumably to be thrown by the caller
     */
    public static NodeStoreException create(Code code, String path) {
        return create(code, path, null);
    }

    /**
     * Same as {@link #create(Code, String)}, keeping the store specific exception as the cause.
     */
    public static NodeStoreException create(Code code, String path, Throwable cause) {
        switch (code) {
        case CONNECTIONLOSS:
            return new ConnectionLossException(path, cause);
        case OPERATIONTIMEOUT:
            return new OperationTimeoutException(path, cause);
        case SESSIONEXPIRED:
            return new SessionExpiredException(path, cause);
        case NONODE:
            return new NoNodeException(path, cause);
        case NODEEXISTS:
            return new NodeExistsException(path, cause);
        case NOAUTH:
            return new NoAuthException(path, cause);
        case BADARGUMENTS:
            return new BadArgumentsException(path, cause);
        case SYSTEMERROR:
        default:
            return new SystemErrorException(path, cause);
        }
    }

    public Code code() {
        return code;
    }

    /**
     * @return the path associated with this error, null if none
     */
    public String getPath() {
        return path;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    @Override
    public String getMessage() {
        if (path == null || path.isEmpty()) {
            return "StoreErrorCode = " + code.getMessage();
        }
        return "StoreErrorCode = " + code.getMessage() + " for " + path;
    }

    /**
     * @see Code#CONNECTIONLOSS
     */
    public static class ConnectionLossException extends NodeStoreException {
        public ConnectionLossException(String path) {
            super(Code.CONNECTIONLOSS, path);
        }
        public ConnectionLossException(String path, Throwable cause) {
            super(Code.CONNECTIONLOSS, path, cause);
        }
    }

    /**
     * @see Code#OPERATIONTIMEOUT
     */
    public static class OperationTimeoutException extends NodeStoreException {
        public OperationTimeoutException(String path) {
            super(Code.OPERATIONTIMEOUT, path);
        }
        public OperationTimeoutException(String path, Throwable cause) {
            super(Code.OPERATIONTIMEOUT, path, cause);
        }
    }

    /**
     * @see Code#SESSIONEXPIRED
     */
    public static class SessionExpiredException extends NodeStoreException {
        public SessionExpiredException(String path) {
            super(Code.SESSIONEXPIRED, path);
        }
        public SessionExpiredException(String path, Throwable cause) {
            super(Code.SESSIONEXPIRED, path, cause);
        }
    }

    /**
     * @see Code#NONODE
     */
    public static class NoNodeException extends NodeStoreException {
        public NoNodeException(String path) {
            super(Code.NONODE, path);
        }
        public NoNodeException(String path, Throwable cause) {
            super(Code.NONODE, path, cause);
        }
    }

    /**
     * @see Code#NODEEXISTS
     */
    public static class NodeExistsException extends NodeStoreException {
        public NodeExistsException(String path) {
            super(Code.NODEEXISTS, path);
        }
        public NodeExistsException(String path, Throwable cause) {
            super(Code.NODEEXISTS, path, cause);
        }
    }

    /**
     * @see Code#NOAUTH
     */
    public static class NoAuthException extends NodeStoreException {
        public NoAuthException(String path) {
            super(Code.NOAUTH, path);
        }
        public NoAuthException(String path, Throwable cause) {
            super(Code.NOAUTH, path, cause);
        }
    }

    /**
     * @see Code#BADARGUMENTS
     */
    public static class BadArgumentsException extends NodeStoreException {
        public BadArgumentsException(String path) {
            super(Code.BADARGUMENTS, path);
        }
        public BadArgumentsException(String path, Throwable cause) {
            super(Code.BADARGUMENTS, path, cause);
        }
    }

    /**
     * @see Code#SYSTEMERROR
     */
    public static class SystemErrorException extends NodeStoreException {
        public SystemErrorException(String path) {
            super(Code.SYSTEMERROR, path);
        }
        public SystemErrorException(String path, Throwable cause) {
            super(Code.SYSTEMERROR, path, cause);
        }
    }

}
