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
package org.apache.quill.command;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Locale;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.quill.api.Command;
import org.apache.quill.api.NodeKind;
import org.apache.quill.commons.NodePath;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Factory for the commands used by the editor forms. Commands that need
 * intermediate structure (e.g. the {@code paths} container before a path
 * item) are built as a {@link CompositeCommand} that first ensures the
 * structure and then applies the change, so undo removes it again in
 * reverse order.
 */
public final class Commands {

    public static final String PATHS = "paths";

    public static final String COMPONENTS = "components";

    public static final String SCHEMAS = "schemas";

    public static final String RESPONSES = "responses";

    public static final Set<String> HTTP_METHODS = ImmutableSet.of(
            "get", "put", "post", "delete", "options", "head", "patch", "trace");

    private static final NodePath PATHS_PATH = NodePath.of(PATHS);

    private static final NodePath SCHEMAS_PATH = NodePath.of(COMPONENTS, SCHEMAS);

    private Commands() {
    }

    @NotNull
    public static Command setProperty(@NotNull NodePath path, @NotNull String property, @Nullable Object value) {
        return new ChangePropertyCommand(path, property, value);
    }

    /**
     * Ensure a child exists and set one of its properties.
     */
    @NotNull
    public static Command ensureAndSet(@NotNull NodePath parentPath, @NotNull String childName,
                                       @NotNull NodeKind childKind, @NotNull String property,
                                       @Nullable Object value) {
        return new CompositeCommand(ImmutableList.of(
                new EnsureChildNodeCommand(parentPath, childName, childKind),
                new ChangePropertyCommand(parentPath.append(childName), property, value)),
                "Set " + childName + "." + property);
    }

    /**
     * Create a path item, e.g. {@code /pets/{id}}. A missing leading slash
     * is added.
     */
    @NotNull
    public static Command createPath(@NotNull String pathName) {
        String name = normalizePathName(pathName);
        return new CompositeCommand(ImmutableList.of(
                new EnsureChildNodeCommand(NodePath.ROOT, PATHS, NodeKind.PATHS),
                new AddNodeCommand(PATHS_PATH, name, NodeKind.PATH_ITEM)),
                "Create path " + name);
    }

    /**
     * Create an operation of a path item, creating the path item if needed.
     */
    @NotNull
    public static Command createOperation(@NotNull String pathName, @NotNull String method) {
        String name = normalizePathName(pathName);
        String verb = normalizeMethod(method);
        return new CompositeCommand(ImmutableList.of(
                new EnsureChildNodeCommand(NodePath.ROOT, PATHS, NodeKind.PATHS),
                new EnsureChildNodeCommand(PATHS_PATH, name, NodeKind.PATH_ITEM),
                new AddNodeCommand(PATHS_PATH.append(name), verb, NodeKind.OPERATION)),
                "Create operation " + verb + " " + name);
    }

    /**
     * Add a response to an existing operation.
     */
    @NotNull
    public static Command addResponse(@NotNull String pathName, @NotNull String method, @NotNull String code) {
        NodePath operation = operationPath(pathName, method);
        checkArgument(!checkNotNull(code).isEmpty(), "Empty response code");
        return new CompositeCommand(ImmutableList.of(
                new EnsureChildNodeCommand(operation, RESPONSES, NodeKind.RESPONSES),
                new AddNodeCommand(operation.append(RESPONSES), code, NodeKind.RESPONSE)),
                "Add response " + code);
    }

    /**
     * Create a schema definition under {@code /components/schemas}.
     */
    @NotNull
    public static Command createSchema(@NotNull String name) {
        checkArgument(!checkNotNull(name).isEmpty(), "Empty schema name");
        return new CompositeCommand(ImmutableList.of(
                new EnsureChildNodeCommand(NodePath.ROOT, COMPONENTS, NodeKind.COMPONENTS),
                new EnsureChildNodeCommand(NodePath.of(COMPONENTS), SCHEMAS, NodeKind.GENERIC),
                new AddNodeCommand(SCHEMAS_PATH, name, NodeKind.SCHEMA)),
                "Create schema " + name);
    }

    @NotNull
    public static Command deleteNode(@NotNull NodePath path) {
        return new DeleteNodeCommand(path);
    }

    @NotNull
    public static Command renameNode(@NotNull NodePath path, @NotNull String newName) {
        return new RenameNodeCommand(path, newName);
    }

    @NotNull
    public static NodePath pathItemPath(@NotNull String pathName) {
        return PATHS_PATH.append(normalizePathName(pathName));
    }

    @NotNull
    public static NodePath operationPath(@NotNull String pathName, @NotNull String method) {
        return pathItemPath(pathName).append(normalizeMethod(method));
    }

    @NotNull
    public static NodePath schemaPath(@NotNull String name) {
        return SCHEMAS_PATH.append(name);
    }

    private static String normalizePathName(String pathName) {
        checkArgument(!checkNotNull(pathName).isEmpty(), "Empty path name");
        return pathName.startsWith("/") ? pathName : "/" + pathName;
    }

    private static String normalizeMethod(String method) {
        String verb = checkNotNull(method).toLowerCase(Locale.ENGLISH);
        checkArgument(HTTP_METHODS.contains(verb), "Unsupported HTTP method %s", method);
        return verb;
    }
}
