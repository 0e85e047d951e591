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
package org.apache.quill.engine;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

import org.apache.quill.api.Command;
import org.apache.quill.api.CommandExecutionException;
import org.apache.quill.api.Document;
import org.apache.quill.api.DocumentObserver;
import org.apache.quill.api.NoDocumentException;
import org.apache.quill.api.Registration;
import org.apache.quill.api.SelectionEvent;
import org.apache.quill.history.CommandHistory;
import org.apache.quill.history.CommandHistoryEntry;
import org.apache.quill.selection.SelectionController;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes, undoes and redoes {@link Command}s against the current document
 * while keeping the {@link CommandHistory} and the selection consistent.
 * <p>
 * <ul>
 *     <li>{@link #execute(Command, String)} attaches the current selection
 *     to the command unless it already carries one, applies it and records
 *     it in the history, which discards everything that could be
 *     redone.</li>
 *     <li>{@link #undo()} reverts the most recent command and {@link #redo()}
 *     applies the most recently undone one again. Both restore the selection
 *     that was current when the command was first executed and ask for it to
 *     be highlighted.</li>
 *     <li>Undo and redo on an empty stack are no-ops returning
 *     {@code false}.</li>
 * </ul>
 * After every successful change the document version is increased and all
 * {@link DocumentObserver}s are notified synchronously. Neither observers
 * nor selection listeners triggered by a change may call back into the
 * engine to change the document; such calls fail with an
 * {@code IllegalStateException}. A command that fails to execute is left
 * without a selection event.
 * <p>
 * If a command fails, the history is left as it was before the attempt: a
 * failed execution is not recorded, and an entry whose undo or redo fails
 * goes back to the stack it was taken from. The failure is propagated to the
 * caller.
 * <p>
 * {@code execute}, {@code undo} and {@code redo} are serialized on this
 * instance.
 */
public class CommandEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CommandEngine.class);

    private final Supplier<Document> documentSupplier;

    private final CommandHistory history;

    private final SelectionController selection;

    private final List<DocumentObserver> observers = new CopyOnWriteArrayList<>();

    private volatile long version;

    /**
     * Set while a change is applied, up to and including the selection
     * restore and the notification of observers.
     */
    private boolean busy;

    /**
     * @param documentSupplier provides the current document, or {@code null}
     *        if none is loaded
     * @param history the history to record commands in
     * @param selection the selection to capture and restore
     */
    public CommandEngine(@NotNull Supplier<Document> documentSupplier,
                         @NotNull CommandHistory history,
                         @NotNull SelectionController selection) {
        this.documentSupplier = checkNotNull(documentSupplier);
        this.history = checkNotNull(history);
        this.selection = checkNotNull(selection);
    }

    /**
     * Same as {@code execute(command, command.getType())}.
     */
    public void execute(@NotNull Command command) throws CommandExecutionException {
        execute(command, command.getType());
    }

    /**
     * Execute a new command and record it for undo.
     *
     * @param command the command to execute
     * @param description label of the history entry
     * @throws CommandExecutionException if the command fails, in which case
     *         nothing is recorded
     * @throws NoDocumentException if no document is loaded
     */
    public synchronized void execute(@NotNull Command command, @NotNull String description)
            throws CommandExecutionException {
        checkNotNull(command);
        checkNotNull(description);
        checkNotBusy();
        Document document = requireDocument();

        SelectionEvent captured = command.getSelectionEvent() == null
                ? selection.createSelectionEvent()
                : null;
        LOG.debug("Executing {}: {}", command.getType(), description);
        busy = true;
        try {
            command.execute(document);
            if (captured != null) {
                command.setSelectionEvent(captured);
            }
            history.push(command, description);
            documentChanged(document);
        } finally {
            busy = false;
        }
    }

    /**
     * Revert the most recently executed or redone command.
     *
     * @return {@code false} if there was nothing to undo
     * @throws CommandExecutionException if reverting fails, in which case the
     *         command stays on the undo stack
     * @throws NoDocumentException if there is something to undo but no
     *         document is loaded
     */
    public synchronized boolean undo() throws CommandExecutionException {
        checkNotBusy();
        if (!history.canUndo()) {
            LOG.debug("Nothing to undo");
            return false;
        }
        Document document = requireDocument();

        CommandHistoryEntry entry = history.popUndo();
        LOG.debug("Undoing {}", entry);
        busy = true;
        try {
            try {
                entry.getCommand().undo(document);
            } catch (CommandExecutionException | RuntimeException e) {
                history.pushUndoWithoutClearingRedo(entry);
                LOG.warn("Failed to undo {}. The command remains on the undo stack", entry.getDescription(), e);
                throw e;
            }
            history.pushRedo(entry);
            restoreSelection(entry);
            documentChanged(document);
        } finally {
            busy = false;
        }
        return true;
    }

    /**
     * Apply the most recently undone command again.
     *
     * @return {@code false} if there was nothing to redo
     * @throws CommandExecutionException if applying fails, in which case the
     *         command stays on the redo stack
     * @throws NoDocumentException if there is something to redo but no
     *         document is loaded
     */
    public synchronized boolean redo() throws CommandExecutionException {
        checkNotBusy();
        if (!history.canRedo()) {
            LOG.debug("Nothing to redo");
            return false;
        }
        Document document = requireDocument();

        CommandHistoryEntry entry = history.popRedo();
        LOG.debug("Redoing {}", entry);
        busy = true;
        try {
            try {
                entry.getCommand().execute(document);
            } catch (CommandExecutionException | RuntimeException e) {
                history.pushRedo(entry);
                LOG.warn("Failed to redo {}. The command remains on the redo stack", entry.getDescription(), e);
                throw e;
            }
            history.pushUndoWithoutClearingRedo(entry);
            restoreSelection(entry);
            documentChanged(document);
        } finally {
            busy = false;
        }
        return true;
    }

    /**
     * Discard all history.
     */
    public synchronized void reset() {
        checkNotBusy();
        LOG.debug("Resetting history {}", history);
        history.reset();
    }

    /**
     * Discard all history because the current document was replaced, and
     * tell observers about the new document.
     *
     * @param document the new document or {@code null} if it was closed
     */
    public synchronized void documentReplaced(@Nullable Document document) {
        reset();
        if (document == null) {
            version++;
            return;
        }
        busy = true;
        try {
            documentChanged(document);
        } finally {
            busy = false;
        }
    }

    public synchronized boolean canUndo() {
        return history.canUndo();
    }

    public synchronized boolean canRedo() {
        return history.canRedo();
    }

    public synchronized int getUndoCount() {
        return history.getUndoCount();
    }

    public synchronized int getRedoCount() {
        return history.getRedoCount();
    }

    /**
     * @see CommandHistory#getEvictedCount()
     */
    public synchronized long getEvictedCount() {
        return history.getEvictedCount();
    }

    /**
     * @return the entry {@link #undo()} would revert, or {@code null}
     */
    @Nullable
    public synchronized CommandHistoryEntry peekUndo() {
        return history.peekUndo();
    }

    /**
     * @return the entry {@link #redo()} would apply, or {@code null}
     */
    @Nullable
    public synchronized CommandHistoryEntry peekRedo() {
        return history.peekRedo();
    }

    /**
     * @return a counter that increases with every change of the document
     */
    public long getVersion() {
        return version;
    }

    @NotNull
    public Registration addObserver(@NotNull final DocumentObserver observer) {
        observers.add(checkNotNull(observer));
        return new Registration() {
            @Override
            public void unregister() {
                observers.remove(observer);
            }
        };
    }

    //-----------------------------------------------------------< private >---

    private Document requireDocument() {
        Document document = documentSupplier.get();
        if (document == null) {
            throw new NoDocumentException("No document loaded");
        }
        return document;
    }

    private void checkNotBusy() {
        checkState(!busy, "Cannot change the document while another change is in progress");
    }

    private void restoreSelection(CommandHistoryEntry entry) {
        SelectionEvent event = entry.getCommand().getSelectionEvent();
        if (event != null) {
            selection.selectFromEvent(event, true);
        }
    }

    private void documentChanged(Document document) {
        long current = ++version;
        for (DocumentObserver observer : observers) {
            observer.documentChanged(document, current);
        }
    }
}
