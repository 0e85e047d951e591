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

import static org.apache.quill.DocumentFixtures.INFO;
import static org.apache.quill.DocumentFixtures.PET;
import static org.apache.quill.DocumentFixtures.PETS;
import static org.apache.quill.DocumentFixtures.createPetstore;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.google.common.collect.Lists;
import org.apache.quill.api.Command;
import org.apache.quill.api.CommandExecutionException;
import org.apache.quill.api.Document;
import org.apache.quill.api.DocumentObserver;
import org.apache.quill.api.NoDocumentException;
import org.apache.quill.api.NodeKind;
import org.apache.quill.api.Registration;
import org.apache.quill.api.SelectionEvent;
import org.apache.quill.api.SelectionListener;
import org.apache.quill.api.SelectionState;
import org.apache.quill.command.ChangePropertyCommand;
import org.apache.quill.command.Commands;
import org.apache.quill.command.EnsureChildNodeCommand;
import org.apache.quill.commons.NodePath;
import org.apache.quill.commons.time.Clock;
import org.apache.quill.history.CommandHistory;
import org.apache.quill.model.MemoryDocument;
import org.apache.quill.model.NodeSnapshot;
import org.apache.quill.navigation.NavigationResolver;
import org.apache.quill.selection.SelectionController;
import org.jetbrains.annotations.NotNull;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

public class CommandEngineTest {

    private static final int MAX_UNDO_SIZE = 3;

    private MemoryDocument document;

    private SelectionController selection;

    private CommandEngine engine;

    @Before
    public void setUp() {
        document = createPetstore();
        selection = new SelectionController(() -> document, new NavigationResolver());
        engine = new CommandEngine(() -> document,
                new CommandHistory(MAX_UNDO_SIZE, new Clock.Virtual()), selection);
    }

    private static Command setTitle(String title) {
        return new ChangePropertyCommand(INFO, "title", title);
    }

    private Object title() {
        return document.resolve(INFO).getProperty("title");
    }

    @Test
    public void redoReplaysLastCommand() throws CommandExecutionException {
        engine.execute(setTitle("A"));
        engine.execute(Commands.createSchema("Order"));
        NodeSnapshot afterLast = NodeSnapshot.of(document);

        assertTrue(engine.undo());
        assertNull(document.resolve(Commands.schemaPath("Order")));
        assertTrue(engine.redo());
        assertEquals(afterLast, NodeSnapshot.of(document));
        assertEquals(2, engine.getUndoCount());
        assertEquals(0, engine.getRedoCount());
    }

    @Test
    public void executeClearsRedo() throws CommandExecutionException {
        engine.execute(setTitle("A"));
        engine.execute(setTitle("B"));
        engine.undo();
        engine.undo();
        assertTrue(engine.canRedo());

        engine.execute(setTitle("C"));
        assertFalse(engine.canRedo());
        assertFalse(engine.redo());
        assertEquals("C", title());
    }

    @Test
    public void evictsOldestCommands() throws CommandExecutionException {
        for (int i = 0; i < MAX_UNDO_SIZE + 2; i++) {
            engine.execute(setTitle("t" + i), "Title " + i);
        }
        assertEquals(MAX_UNDO_SIZE, engine.getUndoCount());
        assertEquals("Title 4", engine.peekUndo().getDescription());

        assertTrue(engine.undo());
        assertEquals("t3", title());
        assertTrue(engine.undo());
        assertEquals("t2", title());
        assertTrue(engine.undo());
        assertEquals("t1", title());
        assertFalse(engine.undo());
        assertEquals("t1", title());
    }

    @Test
    public void undoAndRedoRestoreSelection() throws CommandExecutionException {
        selection.select(PET, "type", false);
        SelectionState before = selection.getState();
        engine.execute(new ChangePropertyCommand(PET, "type", "string"));

        selection.select(PETS);
        assertTrue(engine.undo());
        assertTrue(selection.getState().isHighlightSelection());
        assertEquals(before, selection.getState().withHighlight(false));

        selection.select(NodePath.ROOT);
        assertTrue(engine.redo());
        assertTrue(selection.getState().isHighlightSelection());
        assertEquals(before, selection.getState().withHighlight(false));
    }

    @Test
    public void undoOfDeletionSelectsRestoredNode() throws CommandExecutionException {
        selection.select(PET);
        engine.execute(Commands.deleteNode(PET));
        assertTrue(engine.undo());
        assertSame(document.resolve(PET), selection.getState().getSelectedNode());
        assertEquals(PET, selection.getState().getSelectedPath());
    }

    @Test
    public void existingSelectionEventIsKept() throws CommandExecutionException {
        SelectionEvent event = new SelectionEvent(PETS);
        Command command = setTitle("A");
        command.setSelectionEvent(event);
        selection.select(PET);
        engine.execute(command);
        assertSame(event, command.getSelectionEvent());
    }

    @Test
    public void failedExecuteLeavesSelectionEventUnset() throws CommandExecutionException {
        NodePath servers = NodePath.of("servers");
        Command command = new ChangePropertyCommand(servers, "url", "https://petstore.example.com");
        selection.select(PET);
        try {
            engine.execute(command);
            fail("Expected CommandExecutionException");
        } catch (CommandExecutionException expected) {
        }
        assertNull(command.getSelectionEvent());

        engine.execute(new EnsureChildNodeCommand(NodePath.ROOT, "servers", NodeKind.GENERIC));
        selection.select(PETS);
        engine.execute(command);
        assertEquals(new SelectionEvent(PETS, document.resolve(PETS), null), command.getSelectionEvent());

        selection.select(NodePath.ROOT);
        assertTrue(engine.undo());
        assertEquals(PETS, selection.getState().getSelectedPath());
    }

    @Test
    public void emptyStacksAreNoOps() throws CommandExecutionException {
        selection.select(PET);
        SelectionState state = selection.getState();
        NodeSnapshot snapshot = NodeSnapshot.of(document);

        assertFalse(engine.undo());
        assertFalse(engine.redo());
        assertSame(state, selection.getState());
        assertEquals(snapshot, NodeSnapshot.of(document));
        assertEquals(0, engine.getVersion());
    }

    @Test
    public void failedExecuteIsNotRecorded() {
        try {
            engine.execute(new ChangePropertyCommand(NodePath.of("servers"), "url", "x"));
            fail("Expected CommandExecutionException");
        } catch (CommandExecutionException e) {
            assertTrue(e.isStateViolation());
        }
        assertFalse(engine.canUndo());
        assertEquals(0, engine.getVersion());
    }

    @Test
    public void failedUndoKeepsEntry() throws CommandExecutionException {
        Command command = mock(Command.class);
        when(command.getType()).thenReturn("Broken");
        CommandExecutionException failure = new CommandExecutionException(
                CommandExecutionException.UNDO, 1, "cannot undo");
        doThrow(failure).when(command).undo(any(Document.class));
        engine.execute(command, "Broken command");

        Logger logger = (Logger) LoggerFactory.getLogger(CommandEngine.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            engine.undo();
            fail("Expected CommandExecutionException");
        } catch (CommandExecutionException e) {
            assertSame(failure, e);
        } finally {
            logger.detachAppender(appender);
        }
        assertEquals(1, engine.getUndoCount());
        assertEquals(0, engine.getRedoCount());
        assertEquals("Broken command", engine.peekUndo().getDescription());

        List<ILoggingEvent> warnings = Lists.newArrayList();
        for (ILoggingEvent event : appender.list) {
            if (event.getLevel() == Level.WARN) {
                warnings.add(event);
            }
        }
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).getFormattedMessage().contains("Broken command"));
    }

    @Test
    public void failedRedoKeepsEntry() throws CommandExecutionException {
        Command command = mock(Command.class);
        when(command.getType()).thenReturn("Flaky");
        engine.execute(command);
        engine.undo();

        doThrow(new IllegalStateException("gone")).when(command).execute(any(Document.class));
        try {
            engine.redo();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException expected) {
        }
        assertEquals(0, engine.getUndoCount());
        assertEquals(1, engine.getRedoCount());
    }

    @Test
    public void noDocument() throws CommandExecutionException {
        document = null;
        try {
            engine.execute(setTitle("A"));
            fail("Expected NoDocumentException");
        } catch (NoDocumentException expected) {
        }
        assertFalse(engine.undo());
        assertFalse(engine.redo());
    }

    @Test
    public void observersSeeVersions() throws CommandExecutionException {
        final List<Long> versions = Lists.newArrayList();
        Registration registration = engine.addObserver(new DocumentObserver() {
            @Override
            public void documentChanged(@NotNull Document changed, long version) {
                assertSame(document, changed);
                versions.add(version);
            }
        });
        engine.execute(setTitle("A"));
        engine.undo();
        engine.redo();
        engine.undo();
        engine.undo();
        assertEquals(Lists.newArrayList(1L, 2L, 3L, 4L), versions);

        registration.unregister();
        engine.redo();
        assertEquals(4, versions.size());
        assertEquals(5, engine.getVersion());
    }

    @Test
    public void observersMustNotReenter() throws CommandExecutionException {
        final List<Exception> failures = Lists.newArrayList();
        engine.addObserver(new DocumentObserver() {
            @Override
            public void documentChanged(@NotNull Document changed, long version) {
                try {
                    engine.undo();
                } catch (Exception e) {
                    failures.add(e);
                }
            }
        });
        engine.execute(setTitle("A"));
        assertEquals(1, failures.size());
        assertTrue(failures.get(0) instanceof IllegalStateException);
        assertEquals("A", title());
        assertEquals(1, engine.getUndoCount());
    }

    @Test
    public void selectionListenersMustNotReenter() throws CommandExecutionException {
        final List<Exception> failures = Lists.newArrayList();
        selection.addListener(new SelectionListener() {
            @Override
            public void selectionChanged(@NotNull SelectionState before, @NotNull SelectionState after) {
                if (after.isHighlightSelection()) {
                    try {
                        engine.execute(setTitle("X"));
                    } catch (Exception e) {
                        failures.add(e);
                    }
                }
            }
        });
        selection.select(PET);
        engine.execute(setTitle("A"));
        selection.select(PETS);

        assertTrue(engine.undo());
        assertEquals(1, failures.size());
        assertTrue(failures.get(0) instanceof IllegalStateException);
        assertEquals("Petstore", title());
        assertEquals(0, engine.getUndoCount());
        assertEquals(1, engine.getRedoCount());

        assertTrue(engine.redo());
        assertEquals(2, failures.size());
        assertEquals("A", title());
        assertEquals(1, engine.getUndoCount());
        assertEquals(0, engine.getRedoCount());
    }

    @Test
    public void reset() throws CommandExecutionException {
        engine.execute(setTitle("A"));
        engine.execute(setTitle("B"));
        engine.undo();
        engine.reset();
        assertFalse(engine.canUndo());
        assertFalse(engine.canRedo());
    }

    @Test
    public void commandSeesCapturedSelection() throws CommandExecutionException {
        Command command = mock(Command.class);
        when(command.getType()).thenReturn("Mock");
        selection.select(PET);
        engine.execute(command);
        verify(command).setSelectionEvent(new SelectionEvent(PET, document.resolve(PET), null));
    }
}
