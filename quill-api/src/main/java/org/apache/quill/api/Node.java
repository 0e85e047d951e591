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
package org.apache.quill.api;

import java.util.List;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@code Node} is an addressable element of a {@link Document}. Nodes form
 * a tree: each node except the document root has exactly one parent and is
 * known to that parent under its {@link #getName() name}. Children and
 * properties are ordered.
 * <p>
 * Nodes are owned by their document. The parent link is navigational only:
 * removing a node from its parent disconnects it, after which
 * {@link #getParent()} returns {@code null} and the node must no longer be
 * modified.
 *
 * <h3>Property values</h3>
 * Property values are {@code String}, {@code Number}, {@code Boolean} or
 * {@code List} instances of those. Setting a property to {@code null} removes
 * it.
 */
public interface Node {

    /**
     * @return the structural kind of this node
     */
    @NotNull
    NodeKind getKind();

    /**
     * @return the name of this node in its parent, or the empty string for
     *         the document root
     */
    @NotNull
    String getName();

    /**
     * @return the parent of this node, or {@code null} for the root and for
     *         disconnected nodes
     */
    @Nullable
    Node getParent();

    /**
     * @return {@code true} iff this node is the root of its document
     */
    boolean isRoot();

    /**
     * @return {@code true} iff a child of the given name exists
     */
    boolean hasChild(@NotNull String name);

    /**
     * @return the child of the given name or {@code null} if none exists
     */
    @Nullable
    Node getChild(@NotNull String name);

    /**
     * @return the names of all children in their order
     */
    @NotNull
    List<String> getChildNames();

    /**
     * @return all children in their order
     */
    @NotNull
    Iterable<Node> getChildren();

    /**
     * Append a new child.
     *
     * @param name name of the child
     * @param kind kind of the child
     * @return the new child
     * @throws IllegalArgumentException if a child of that name already exists
     */
    @NotNull
    Node addChild(@NotNull String name, @NotNull NodeKind kind);

    /**
     * Insert a new child at the given position. A position beyond the last
     * child appends.
     *
     * @throws IllegalArgumentException if a child of that name already exists
     *         or the position is negative
     */
    @NotNull
    Node addChild(@NotNull String name, @NotNull NodeKind kind, int position);

    /**
     * Remove the child of the given name, disconnecting it and its subtree.
     *
     * @return {@code true} if the child existed
     */
    boolean removeChild(@NotNull String name);

    /**
     * Rename a child keeping its position.
     *
     * @return {@code true} if the child existed and was renamed
     * @throws IllegalArgumentException if a child named {@code newName}
     *         already exists
     */
    boolean renameChild(@NotNull String name, @NotNull String newName);

    /**
     * @return position of the named child or {@code -1} if there is none
     */
    int getChildPosition(@NotNull String name);

    boolean hasProperty(@NotNull String name);

    /**
     * @return the value of the property or {@code null} if it is not set
     */
    @Nullable
    Object getProperty(@NotNull String name);

    /**
     * @return the names of all properties in their order
     */
    @NotNull
    Set<String> getPropertyNames();

    /**
     * Set a property, or remove it if {@code value} is {@code null}.
     *
     * @return the previous value or {@code null}
     */
    @Nullable
    Object setProperty(@NotNull String name, @Nullable Object value);
}
