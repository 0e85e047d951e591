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
import org.jetbrains.annotations.Nullable;

/**
 * A reversible mutation of a {@link Document}.
 * <p>
 * Commands are replayed by the undo/redo protocol: after
 * {@code execute(d); undo(d); execute(d)} the document must be in the same
 * state as after a single {@code execute(d)}. Implementations therefore
 * capture whatever they need for {@link #undo(Document)} during each
 * {@link #execute(Document)} and never rely on node references obtained by
 * an earlier execution.
 * <p>
 * A command also carries the {@link SelectionEvent} that was current when
 * it was first executed, which undo and redo use to restore the user's
 * focus.
 */
public interface Command {

    /**
     * @return a short name for the kind of mutation, used for logging and
     *         history labels
     */
    @NotNull
    String getType();

    /**
     * Apply the mutation.
     *
     * @param document the document to modify
     * @throws CommandExecutionException if the mutation cannot be applied
     */
    void execute(@NotNull Document document) throws CommandExecutionException;

    /**
     * Revert the mutation applied by the last {@link #execute(Document)}.
     *
     * @param document the document to modify
     * @throws CommandExecutionException if the mutation cannot be reverted
     */
    void undo(@NotNull Document document) throws CommandExecutionException;

    /**
     * @return the selection captured when this command was first executed,
     *         or {@code null} if nothing was selected
     */
    @Nullable
    SelectionEvent getSelectionEvent();

    void setSelectionEvent(@Nullable SelectionEvent selectionEvent);
}
