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
import static org.apache.quill.api.CommandExecutionException.STATE;

import org.apache.quill.api.CommandExecutionException;
import org.apache.quill.api.Document;
import org.apache.quill.api.Node;
import org.apache.quill.commons.NodePath;
import org.jetbrains.annotations.NotNull;

/**
 * Renames a node keeping its position among its siblings, e.g. a path item
 * or a schema.
 */
public class RenameNodeCommand extends AbstractCommand {

    private final NodePath path;

    private final String newName;

    public RenameNodeCommand(@NotNull NodePath path, @NotNull String newName) {
        this.path = checkNotNull(path);
        this.newName = checkNotNull(newName);
        checkArgument(!path.isRoot(), "Cannot rename the document root");
        checkArgument(!newName.isEmpty(), "Empty node name");
    }

    @Override
    public void execute(@NotNull Document document) throws CommandExecutionException {
        rename(document, path.getName(), newName);
    }

    @Override
    public void undo(@NotNull Document document) throws CommandExecutionException {
        rename(document, newName, path.getName());
    }

    @NotNull
    public NodePath getRenamedPath() {
        return path.getParent().append(newName);
    }

    @Override
    public String toString() {
        return getType() + " " + path + " -> " + newName;
    }

    private void rename(Document document, String from, String to) throws CommandExecutionException {
        Node parent = resolveNode(document, path.getParent());
        if (!parent.hasChild(from)) {
            throw new CommandExecutionException(STATE, 1, "Node not found " + path.getParent().append(from));
        }
        if (!from.equals(to) && parent.hasChild(to)) {
            throw new CommandExecutionException(STATE, 2, "Node already exists " + path.getParent().append(to));
        }
        parent.renameChild(from, to);
    }
}
