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
package org.apache.quill.session;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.apache.quill.api.Command;
import org.apache.quill.api.CommandExecutionException;
import org.apache.quill.api.Document;
import org.apache.quill.api.DocumentObserver;
import org.apache.quill.api.NoDocumentException;
import org.apache.quill.api.Node;
import org.apache.quill.api.Registration;
import org.apache.quill.api.SelectionListener;
import org.apache.quill.api.SelectionState;
import org.apache.quill.commons.NodePath;
import org.apache.quill.commons.time.Clock;
import org.apache.quill.engine.CommandEngine;
import org.apache.quill.history.CommandHistory;
import org.apache.quill.history.CommandHistoryEntry;
import org.apache.quill.navigation.NavigationResolver;
import org.apache.quill.selection.SelectionController;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One editing session: the current document together with its
 * {@link CommandEngine}, its {@link SelectionController} and dirty tracking.
 * This is the entry point for a user interface.
 * <pre>
 *     EditorSession session = EditorSession.builder().withMaxUndoSize(50).create();
 *     session.loadDocument(document);
 *     session.select(NodePath.parse("/info"));
 *     session.executeCommand(Commands.setProperty(NodePath.parse("/info"), "title", "Pets"), "Change title");
 *     session.undo();
 * </pre>
 */
public class EditorSession {

    private static final Logger LOG = LoggerFactory.getLogger(EditorSession.class);

    private final CommandEngine engine;

    private final SelectionController selection;

    private volatile Document document;

    /**
     * Top of the undo stack when the document was last saved or loaded.
     */
    private volatile CommandHistoryEntry cleanEntry;

    /**
     * Evicted history entries when the document was last saved or loaded.
     * With an empty undo stack at that point, this tells a clean state
     * apart from one reached by undoing past evicted changes.
     */
    private volatile long cleanEvictions;

    public EditorSession() {
        this(new CommandHistory(), new NavigationResolver());
    }

    EditorSession(@NotNull CommandHistory history, @NotNull NavigationResolver navigationResolver) {
        this.selection = new SelectionController(this::getDocument, navigationResolver);
        this.engine = new CommandEngine(this::getDocument, history, selection);
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    //----------------------------------------------------------< document >---

    /**
     * Start editing {@code document}. Discards history and selection of the
     * previous document and notifies document observers.
     */
    public synchronized void loadDocument(@NotNull Document document) {
        checkNotNull(document);
        LOG.debug("Loading document {}", document);
        this.document = document;
        selection.reset();
        engine.documentReplaced(document);
        cleanEntry = null;
        cleanEvictions = engine.getEvictedCount();
    }

    /**
     * Stop editing the current document. Discards history and selection.
     */
    public synchronized void closeDocument() {
        LOG.debug("Closing document {}", document);
        this.document = null;
        selection.reset();
        engine.documentReplaced(null);
        cleanEntry = null;
        cleanEvictions = engine.getEvictedCount();
    }

    /**
     * @return the current document or {@code null} if none is loaded
     */
    @Nullable
    public Document getDocument() {
        return document;
    }

    /**
     * @return {@code true} if the document differs from the state it was
     *         loaded in or last {@link #markClean() marked clean}
     */
    public boolean isDirty() {
        if (document == null) {
            return false;
        }
        CommandHistoryEntry top = engine.peekUndo();
        if (top != cleanEntry) {
            return true;
        }
        return top == null && engine.getEvictedCount() != cleanEvictions;
    }

    /**
     * Record the current state as clean, typically after saving.
     */
    public synchronized void markClean() {
        cleanEntry = engine.peekUndo();
        cleanEvictions = engine.getEvictedCount();
    }

    public long getVersion() {
        return engine.getVersion();
    }

    @NotNull
    public Registration addDocumentObserver(@NotNull DocumentObserver observer) {
        return engine.addObserver(observer);
    }

    //----------------------------------------------------------< commands >---

    public void executeCommand(@NotNull Command command) throws CommandExecutionException {
        engine.execute(command);
    }

    /**
     * @see CommandEngine#execute(Command, String)
     */
    public void executeCommand(@NotNull Command command, @NotNull String description)
            throws CommandExecutionException {
        engine.execute(command, description);
    }

    /**
     * @see CommandEngine#undo()
     */
    public boolean undo() throws CommandExecutionException {
        return engine.undo();
    }

    /**
     * @see CommandEngine#redo()
     */
    public boolean redo() throws CommandExecutionException {
        return engine.redo();
    }

    public boolean canUndo() {
        return engine.canUndo();
    }

    public boolean canRedo() {
        return engine.canRedo();
    }

    /**
     * @return label of the command {@link #undo()} would revert, or
     *         {@code null} if there is none
     */
    @Nullable
    public String getUndoDescription() {
        CommandHistoryEntry entry = engine.peekUndo();
        return entry == null ? null : entry.getDescription();
    }

    /**
     * @return label of the command {@link #redo()} would apply, or
     *         {@code null} if there is none
     */
    @Nullable
    public String getRedoDescription() {
        CommandHistoryEntry entry = engine.peekRedo();
        return entry == null ? null : entry.getDescription();
    }

    //---------------------------------------------------------< selection >---

    public void select(@NotNull NodePath path) {
        selection.select(path);
    }

    public void select(@NotNull NodePath path, @Nullable String propertyName, boolean highlight) {
        selection.select(path, propertyName, highlight);
    }

    public void select(@NotNull Node node) {
        selection.select(node);
    }

    public void select(@NotNull Node node, @Nullable String propertyName, boolean highlight) {
        selection.select(node, propertyName, highlight);
    }

    public void selectRoot() {
        selection.selectRoot();
    }

    public void clearSelection() {
        selection.clearSelection();
    }

    public void highlightCurrent() {
        selection.highlightCurrent();
    }

    public void clearHighlight() {
        selection.clearHighlight();
    }

    @NotNull
    public SelectionState getSelection() {
        return selection.getState();
    }

    @NotNull
    public Registration addSelectionListener(@NotNull SelectionListener listener) {
        return selection.addListener(listener);
    }

    //------------------------------------------------------------< access >---

    @NotNull
    public CommandEngine getEngine() {
        return engine;
    }

    @NotNull
    public SelectionController getSelectionController() {
        return selection;
    }

    /**
     * @throws NoDocumentException if no document is loaded
     */
    @NotNull
    public Document requireDocument() {
        Document current = document;
        if (current == null) {
            throw new NoDocumentException("No document loaded");
        }
        return current;
    }

    /**
     * Builder for sessions that do not use the defaults.
     */
    public static final class Builder {

        private Integer maxUndoSize;

        private Clock clock = Clock.SIMPLE;

        private NavigationResolver navigationResolver = new NavigationResolver();

        private Builder() {
        }

        /**
         * Bound the undo stack. Defaults to the
         * {@value CommandHistory#MAX_UNDO_SIZE_PROPERTY} system property.
         */
        @NotNull
        public Builder withMaxUndoSize(int maxUndoSize) {
            checkArgument(maxUndoSize > 0, "maxUndoSize must be positive: %s", maxUndoSize);
            this.maxUndoSize = maxUndoSize;
            return this;
        }

        /**
         * Clock for history timestamps.
         */
        @NotNull
        public Builder with(@NotNull Clock clock) {
            this.clock = checkNotNull(clock);
            return this;
        }

        @NotNull
        public Builder with(@NotNull NavigationResolver navigationResolver) {
            this.navigationResolver = checkNotNull(navigationResolver);
            return this;
        }

        @NotNull
        public EditorSession create() {
            int size = maxUndoSize == null ? CommandHistory.configuredMaxUndoSize() : maxUndoSize;
            return new EditorSession(new CommandHistory(size, clock), navigationResolver);
        }
    }
}
