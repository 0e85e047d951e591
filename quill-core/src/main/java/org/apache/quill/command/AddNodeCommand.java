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
import org.apache.quill.api.NodeKind;
import org.apache.quill.commons.NodePath;
import org.jetbrains.annotations.NotNull;

/**
 * Adds a new child node. The parent must exist. If a child of the same name
 * is already present the command does nothing, and neither does its undo.
 */
public class AddNodeCommand extends AbstractCommand {

    private final NodePath parentPath;

    private final String name;

    private final NodeKind kind;

    private final int position;

    private boolean created;

    /**
     * @param position position among the siblings, {@code -1} to append
     */
    public AddNodeCommand(@NotNull NodePath parentPath, @NotNull String name,
                          @NotNull NodeKind kind, int position) {
        this.parentPath = checkNotNull(parentPath);
        this.name = checkNotNull(name);
        this.kind = checkNotNull(kind);
        this.position = position;
        checkArgument(!name.isEmpty(), "Empty node name");
        checkArgument(position >= -1, "Invalid position %s", position);
    }

    public AddNodeCommand(@NotNull NodePath parentPath, @NotNull String name, @NotNull NodeKind kind) {
        this(parentPath, name, kind, -1);
    }

    @Override
    public void execute(@NotNull Document document) throws CommandExecutionException {
        created = false;
        Node parent = resolveNode(document, parentPath);
        if (parent.hasChild(name)) {
            return;
        }
        if (position < 0) {
            parent.addChild(name, kind);
        } else {
            parent.addChild(name, kind, position);
        }
        created = true;
    }

    @Override
    public void undo(@NotNull Document document) throws CommandExecutionException {
        if (created) {
            resolveNode(document, parentPath).removeChild(name);
        }
    }

    @NotNull
    public NodePath getNodePath() {
        return parentPath.append(name);
    }

    public boolean isCreated() {
        return created;
    }

    @Override
    public String toString() {
        return getType() + " " + getNodePath();
    }
}
