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
package org.apache.quill.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import com.google.common.collect.Lists;
import org.apache.quill.api.Document;
import org.apache.quill.api.Node;
import org.apache.quill.api.NodeKind;
import org.apache.quill.api.NodeVisitor;
import org.apache.quill.commons.NodePath;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * In-memory {@link Document}: the root {@link MemoryNode} of a tree.
 */
public class MemoryDocument extends MemoryNode implements Document {

    public MemoryDocument() {
        super(null, "", NodeKind.DOCUMENT);
    }

    @Override
    public boolean isRoot() {
        return true;
    }

    @Nullable
    @Override
    public Node resolve(@NotNull NodePath path) {
        Node node = this;
        for (String segment : checkNotNull(path)) {
            node = node.getChild(segment);
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    @NotNull
    @Override
    public NodePath getPath(@NotNull Node node) {
        List<String> names = Lists.newArrayList();
        Node current = checkNotNull(node);
        while (current != this) {
            Node parent = current.getParent();
            checkArgument(parent != null, "Node %s is not connected to this document", node);
            names.add(current.getName());
            current = parent;
        }
        return NodePath.of(Lists.reverse(names));
    }

    @Override
    public void visitPath(@NotNull NodePath path, @NotNull NodeVisitor visitor) {
        checkNotNull(visitor);
        Node node = this;
        NodeVisitor.visit(node, visitor);
        for (String segment : checkNotNull(path)) {
            if (visitor.isDone()) {
                return;
            }
            node = node.getChild(segment);
            if (node == null) {
                return;
            }
            NodeVisitor.visit(node, visitor);
        }
    }

    @Override
    public void visitUp(@NotNull Node node, @NotNull NodeVisitor visitor) {
        checkNotNull(visitor);
        Node current = checkNotNull(node);
        while (current != null && !visitor.isDone()) {
            NodeVisitor.visit(current, visitor);
            current = current.getParent();
        }
    }

    @Override
    public String toString() {
        return "MemoryDocument";
    }
}
