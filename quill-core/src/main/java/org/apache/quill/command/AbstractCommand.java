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

import static org.apache.quill.api.CommandExecutionException.STATE;

import org.apache.quill.api.Command;
import org.apache.quill.api.CommandExecutionException;
import org.apache.quill.api.Document;
import org.apache.quill.api.Node;
import org.apache.quill.api.SelectionEvent;
import org.apache.quill.commons.NodePath;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base class for commands that keeps track of the selection captured when
 * the command was first executed.
 */
public abstract class AbstractCommand implements Command {

    private SelectionEvent selectionEvent;

    @NotNull
    @Override
    public String getType() {
        return getClass().getSimpleName();
    }

    @Nullable
    @Override
    public SelectionEvent getSelectionEvent() {
        return selectionEvent;
    }

    @Override
    public void setSelectionEvent(@Nullable SelectionEvent selectionEvent) {
        this.selectionEvent = selectionEvent;
    }

    @Override
    public String toString() {
        return getType();
    }

    /**
     * Resolve {@code path} exactly.
     *
     * @throws CommandExecutionException of type {@code STATE} if there is no
     *         node at {@code path}
     */
    @NotNull
    protected static Node resolveNode(@NotNull Document document, @NotNull NodePath path)
            throws CommandExecutionException {
        Node node = document.resolve(path);
        if (node == null) {
            throw new CommandExecutionException(STATE, 1, "Node not found " + path);
        }
        return node;
    }
}
