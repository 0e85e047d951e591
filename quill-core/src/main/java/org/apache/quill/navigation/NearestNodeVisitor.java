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
package org.apache.quill.navigation;

import org.apache.quill.api.Node;
import org.apache.quill.api.NodeVisitor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Remembers the last node visited by a path traversal, which is the deepest
 * node along the path that exists.
 */
class NearestNodeVisitor implements NodeVisitor {

    private Node nearest;

    @Override
    public void visitDocument(@NotNull Node document) {
        nearest = document;
    }

    @Override
    public void visitPathItem(@NotNull Node pathItem) {
        nearest = pathItem;
    }

    @Override
    public void visitOperation(@NotNull Node operation) {
        nearest = operation;
    }

    @Override
    public void visitSchema(@NotNull Node schema) {
        nearest = schema;
    }

    @Override
    public void visitResponse(@NotNull Node response) {
        nearest = response;
    }

    @Override
    public void visitNode(@NotNull Node node) {
        nearest = node;
    }

    @Nullable
    Node getNearest() {
        return nearest;
    }
}
