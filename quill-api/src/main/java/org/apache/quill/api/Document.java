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

import org.apache.quill.commons.NodePath;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The root node of an editable document tree. In addition to being a
 * {@link Node} of kind {@link NodeKind#DOCUMENT}, a document provides path
 * based addressing for all nodes it contains.
 */
public interface Document extends Node {

    /**
     * Resolve a path exactly.
     *
     * @param path the path to resolve
     * @return the node at {@code path} or {@code null} if any segment of the
     *         path does not exist
     */
    @Nullable
    Node resolve(@NotNull NodePath path);

    /**
     * Reverse addressing: compute the path of a node of this document.
     *
     * @param node a node connected to this document
     * @return the path of {@code node}
     * @throws IllegalArgumentException if {@code node} is not connected to
     *         this document
     */
    @NotNull
    NodePath getPath(@NotNull Node node);

    /**
     * Partial path traversal. The visitor is called for the document itself
     * and then for each node along {@code path} that exists, top down. The
     * traversal stops at the first segment that does not resolve, or as soon
     * as the visitor reports {@link NodeVisitor#isDone() done}.
     *
     * @param path the path to traverse
     * @param visitor the visitor to call
     */
    void visitPath(@NotNull NodePath path, @NotNull NodeVisitor visitor);

    /**
     * Upward traversal. The visitor is called for {@code node} and then for
     * each of its ancestors up to and including the document. The traversal
     * stops as soon as the visitor reports {@link NodeVisitor#isDone() done}.
     *
     * @param node start node
     * @param visitor the visitor to call
     */
    void visitUp(@NotNull Node node, @NotNull NodeVisitor visitor);
}
