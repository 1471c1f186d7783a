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

package org.apache.zktreeutil.common;

/**
 * Path related utilities
 */
public class PathUtils {

    public static final String ROOT = "/";

    private PathUtils() {
    }

    /**
     * Validate the provided znode path string
     * @param path znode path string
     * @throws IllegalArgumentException if the path is invalid
     */
    public static void validatePath(String path) throws IllegalArgumentException {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        if (path.length() == 0) {
            throw new IllegalArgumentException("Path length must be > 0");
        }
        if (path.charAt(0) != '/') {
            throw new IllegalArgumentException("Path must start with / character");
        }
        if (path.length() == 1) { // done checking - it's the root
            return;
        }
        if (path.charAt(path.length() - 1) == '/') {
            throw new IllegalArgumentException("Path must not end with / character");
        }

        String reason = null;
        char lastc = '/';
        char[] chars = path.toCharArray();
        char c;
        for (int i = 1; i < chars.length; lastc = chars[i], i++) {
            c = chars[i];

            if (c == 0) {
                reason = "null character not allowed @" + i;
                break;
            } else if (c == '/' && lastc == '/') {
                reason = "empty node name specified @" + i;
                break;
            } else if (c == '.' && lastc == '.') {
                if (chars[i - 2] == '/' && ((i + 1 == chars.length) || chars[i + 1] == '/')) {
                    reason = "relative paths not allowed @" + i;
                    break;
                }
            } else if (c == '.') {
                if (chars[i - 1] == '/' && ((i + 1 == chars.length) || chars[i + 1] == '/')) {
                    reason = "relative paths not allowed @" + i;
                    break;
                }
            } else if (c > '\u0000' && c <= '\u001f'
                       || c >= '\u007f' && c <= '\u009F'
                       || c >= '\ud800' && c <= '\uf8ff'
                       || c >= '\ufff0' && c <= '\uffff') {
                reason = "invalid character @" + i;
                break;
            }
        }

        if (reason != null) {
            throw new IllegalArgumentException("Invalid path string \"" + path + "\" caused by " + reason);
        }
    }

    /**
     * Validate a single path segment, i.e. the name of a child node.
     *
     * @throws IllegalArgumentException if the name is empty, contains a '/'
     *         or would not form a valid path
     */
    public static void validateName(String name) throws IllegalArgumentException {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Node name cannot be empty");
        }
        if (name.indexOf('/') >= 0) {
            throw new IllegalArgumentException("Node name \"" + name + "\" must not contain / character");
        }
        validatePath(ROOT + name);
    }

    /**
     * Join paths by appending relative path(s) to the base path. Leading and
     * trailing slashes of the relative parts are ignored.
     */
    public static String join(String basePath, String... relativePaths) {
        StringBuilder sb = new StringBuilder(stripTrailingSlashes(basePath));
        for (String relativePath : relativePaths) {
            String part = stripSlashes(relativePath);
            if (part.isEmpty()) {
                continue;
            }
            sb.append('/').append(part);
        }
        return sb.length() == 0 ? ROOT : sb.toString();
    }

    /**
     * @return the parent of the given path, or null for the root
     */
    public static String getParent(String path) {
        if (ROOT.equals(path)) {
            return null;
        }
        int idx = path.lastIndexOf('/');
        return idx == 0 ? ROOT : path.substring(0, idx);
    }

    /**
     * @return the last segment of the path; the empty string for the root
     */
    public static String getName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /**
     * @return number of segments in the path; 0 for the root
     */
    public static int getDepth(String path) {
        if (ROOT.equals(path)) {
            return 0;
        }
        int depth = 0;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }

    /**
     * @return true if path equals ancestor or lies underneath it
     */
    public static boolean isSameOrDescendant(String ancestor, String path) {
        if (ROOT.equals(ancestor)) {
            return path.startsWith(ROOT);
        }
        return path.equals(ancestor) || path.startsWith(ancestor + "/");
    }

    /**
     * Substitute the {@code fromRoot} prefix of {@code path} by {@code toRoot}.
     *
     * @throws IllegalArgumentException if path is not fromRoot or one of its descendants
     */
    public static String rebase(String fromRoot, String toRoot, String path) {
        if (!isSameOrDescendant(fromRoot, path)) {
            throw new IllegalArgumentException("Path " + path + " is not under " + fromRoot);
        }
        String relative = path.substring(ROOT.equals(fromRoot) ? 0 : fromRoot.length());
        return join(toRoot, relative);
    }

    private static String stripTrailingSlashes(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(0, end);
    }

    private static String stripSlashes(String path) {
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            start++;
        }
        return stripTrailingSlashes(path.substring(start));
    }

}
