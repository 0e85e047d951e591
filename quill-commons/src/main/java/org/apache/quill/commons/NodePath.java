/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.quill.commons;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

/**
 * An immutable location inside a document tree, made of an ordered list of
 * segments. The canonical string form follows the JSON Pointer conventions:
 * segments are separated by {@code /}, a literal {@code ~} is written as
 * {@code ~0} and a literal {@code /} as {@code ~1}. The root path has no
 * segments and renders as {@code "/"}.
 * <p>
 * Two paths are equal iff their segment sequences are equal.
 */
public final class NodePath implements Iterable<String> {

    public static final String ROOT_PATH = "/";

    public static final NodePath ROOT = new NodePath(ImmutableList.<String>of());

    private final ImmutableList<String> segments;

    private String string;

    private NodePath(ImmutableList<String> segments) {
        this.segments = segments;
    }

    /**
     * Parse the canonical string form of a path. Both {@code ""} and
     * {@code "/"} denote the root.
     *
     * @param path the path string
     * @return the parsed path
     * @throws IllegalArgumentException if the path is not absolute, contains
     *         an empty segment or an invalid escape sequence
     */
    @NotNull
    public static NodePath parse(@NotNull String path) {
        checkNotNull(path);
        if (path.isEmpty() || ROOT_PATH.equals(path)) {
            return ROOT;
        }
        checkArgument(path.charAt(0) == '/', "Invalid path [%s]: not absolute", path);

        ImmutableList.Builder<String> builder = ImmutableList.builder();
        int pos = 1;
        while (pos <= path.length()) {
            int end = path.indexOf('/', pos);
            if (end < 0) {
                end = path.length();
            }
            checkArgument(end > pos, "Invalid path [%s]: empty segment", path);
            builder.add(unescape(path, path.substring(pos, end)));
            pos = end + 1;
        }
        NodePath result = new NodePath(builder.build());
        result.string = path;
        return result;
    }

    /**
     * Create a path from its (unescaped) segments.
     */
    @NotNull
    public static NodePath of(@NotNull String... segments) {
        return of(ImmutableList.copyOf(segments));
    }

    @NotNull
    public static NodePath of(@NotNull List<String> segments) {
        if (segments.isEmpty()) {
            return ROOT;
        }
        for (String segment : segments) {
            checkArgument(!segment.isEmpty(), "Empty path segment in %s", segments);
        }
        return new NodePath(ImmutableList.copyOf(segments));
    }

    /**
     * @return a new path with the given segment appended
     */
    @NotNull
    public NodePath append(@NotNull String segment) {
        checkArgument(!checkNotNull(segment).isEmpty(), "Empty path segment");
        return new NodePath(ImmutableList.<String>builder()
                .addAll(segments).add(segment).build());
    }

    /**
     * Get the parent of this path. The parent of the root path is the root
     * path.
     */
    @NotNull
    public NodePath getParent() {
        return getAncestor(1);
    }

    /**
     * Get the nth ancestor of this path. If {@code nth <= 0} this path is
     * returned as is; ancestors above the root are the root.
     */
    @NotNull
    public NodePath getAncestor(int nth) {
        if (nth <= 0) {
            return this;
        }
        if (nth >= segments.size()) {
            return ROOT;
        }
        return new NodePath(segments.subList(0, segments.size() - nth));
    }

    /**
     * The last segment of this path, or the empty string for the root.
     */
    @NotNull
    public String getName() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /**
     * Number of segments. The root path has depth zero.
     */
    public int getDepth() {
        return segments.size();
    }

    @NotNull
    public String getSegment(int index) {
        return segments.get(index);
    }

    @NotNull
    public List<String> getSegments() {
        return segments;
    }

    /**
     * Whether this path is a proper ancestor of {@code other}.
     */
    public boolean isAncestorOf(@NotNull NodePath other) {
        return other.segments.size() > segments.size()
                && other.segments.subList(0, segments.size()).equals(segments);
    }

    @Override
    public Iterator<String> iterator() {
        return segments.iterator();
    }

    //------------------------------------------------------------< Object >--

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other instanceof NodePath) {
            return segments.equals(((NodePath) other).segments);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        if (string == null) {
            if (segments.isEmpty()) {
                string = ROOT_PATH;
            } else {
                StringBuilder buff = new StringBuilder();
                for (String segment : segments) {
                    buff.append('/');
                    escape(segment, buff);
                }
                string = buff.toString();
            }
        }
        return string;
    }

    //-----------------------------------------------------------< private >--

    private static void escape(String segment, StringBuilder buff) {
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == '~') {
                buff.append("~0");
            } else if (c == '/') {
                buff.append("~1");
            } else {
                buff.append(c);
            }
        }
    }

    private static String unescape(String path, String segment) {
        if (segment.indexOf('~') < 0) {
            return segment;
        }
        StringBuilder buff = new StringBuilder(segment.length());
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c != '~') {
                buff.append(c);
                continue;
            }
            checkArgument(i + 1 < segment.length(), "Invalid path [%s]: dangling '~'", path);
            char next = segment.charAt(++i);
            if (next == '0') {
                buff.append('~');
            } else if (next == '1') {
                buff.append('/');
            } else {
                throw new IllegalArgumentException(
                        "Invalid path [" + path + "]: bad escape '~" + next + "'");
            }
        }
        return buff.toString();
    }
}
