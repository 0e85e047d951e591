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

import org.apache.quill.api.CommandExecutionException;
import org.apache.quill.api.Document;
import org.apache.quill.api.Node;
import org.apache.quill.commons.NodePath;
import org.apache.quill.model.NodeSnapshot;
import org.jetbrains.annotations.NotNull;

/**
 * Deletes the node at a path together with its subtree. Undo puts a copy of
 * the deleted subtree back at its original position. Deleting a node that
 * does not exist does nothing.
 */
public class DeleteNodeCommand extends AbstractCommand {

    private final NodePath path;

    private NodeSnapshot snapshot;

    private int position;

    public DeleteNodeCommand(@NotNull NodePath path) {
        this.path = checkNotNull(path);
        checkArgument(!path.isRoot(), "Cannot delete the document root");
    }

    @Override
    public void execute(@NotNull Document document) {
        snapshot = null;
        Node node = document.resolve(path);
        if (node == null) {
            return;
        }
        Node parent = node.getParent();
        snapshot = NodeSnapshot.of(node);
        position = parent.getChildPosition(path.getName());
        parent.removeChild(path.getName());
    }

    @Override
    public void undo(@NotNull Document document) throws CommandExecutionException {
        if (snapshot != null) {
            snapshot.restore(resolveNode(document, path.getParent()), path.getName(), position);
        }
    }

    @NotNull
    public NodePath getPath() {
        return path;
    }

    @Override
    public String toString() {
        return getType() + " " + path;
    }
}
