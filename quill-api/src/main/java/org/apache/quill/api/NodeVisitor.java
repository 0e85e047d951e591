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

import org.jetbrains.annotations.NotNull;

/**
 * Callback for tree traversals. {@link #visit(Node, NodeVisitor)} dispatches
 * on the {@link NodeKind} of each visited node to the matching callback;
 * kinds without a dedicated callback go to {@link #visitNode(Node)}.
 *
 * @see DefaultNodeVisitor
 * @see Document#visitPath(org.apache.quill.commons.NodePath, NodeVisitor)
 * @see Document#visitUp(Node, NodeVisitor)
 */
public interface NodeVisitor {

    void visitDocument(@NotNull Node document);

    void visitPathItem(@NotNull Node pathItem);

    void visitOperation(@NotNull Node operation);

    void visitSchema(@NotNull Node schema);

    void visitResponse(@NotNull Node response);

    void visitNode(@NotNull Node node);

    /**
     * A traversal stops once this returns {@code true}.
     */
    default boolean isDone() {
        return false;
    }

    /**
     * Call the callback of {@code visitor} that matches the kind of
     * {@code node}.
     */
    static void visit(@NotNull Node node, @NotNull NodeVisitor visitor) {
        switch (node.getKind()) {
            case DOCUMENT:
                visitor.visitDocument(node);
                break;
            case PATH_ITEM:
                visitor.visitPathItem(node);
                break;
            case OPERATION:
                visitor.visitOperation(node);
                break;
            case SCHEMA:
                visitor.visitSchema(node);
                break;
            case RESPONSE:
                visitor.visitResponse(node);
                break;
            case INFO:
            case CONTACT:
            case LICENSE:
            case SERVER:
            case PATHS:
            case PARAMETER:
            case REQUEST_BODY:
            case RESPONSES:
            case HEADER:
            case MEDIA_TYPE:
            case COMPONENTS:
            case SECURITY_SCHEME:
            case TAG:
            case EXTENSION:
            case GENERIC:
                visitor.visitNode(node);
                break;
            default:
                throw new IllegalStateException("Unknown node kind " + node.getKind());
        }
    }
}
