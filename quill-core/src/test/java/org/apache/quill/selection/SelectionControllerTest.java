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
package org.apache.quill.selection;

import static org.apache.quill.DocumentFixtures.GET_PETS;
import static org.apache.quill.DocumentFixtures.PET;
import static org.apache.quill.DocumentFixtures.PETS;
import static org.apache.quill.DocumentFixtures.PET_NAME;
import static org.apache.quill.DocumentFixtures.createPetstore;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import com.google.common.collect.Lists;
import org.apache.quill.api.NoDocumentException;
import org.apache.quill.api.Node;
import org.apache.quill.api.NodeKind;
import org.apache.quill.api.Registration;
import org.apache.quill.api.SelectionEvent;
import org.apache.quill.api.SelectionListener;
import org.apache.quill.api.SelectionState;
import org.apache.quill.api.UnresolvableSelectionException;
import org.apache.quill.commons.NodePath;
import org.apache.quill.model.MemoryDocument;
import org.apache.quill.navigation.NavigationResolver;
import org.jetbrains.annotations.NotNull;
import org.junit.Before;
import org.junit.Test;

public class SelectionControllerTest {

    private MemoryDocument document;

    private SelectionController selection;

    private final List<SelectionState> changes = Lists.newArrayList();

    @Before
    public void setUp() {
        document = createPetstore();
        selection = new SelectionController(() -> document, new NavigationResolver());
        selection.addListener(new SelectionListener() {
            @Override
            public void selectionChanged(@NotNull SelectionState before, @NotNull SelectionState after) {
                changes.add(after);
            }
        });
    }

    @Test
    public void selectPath() {
        NodePath path = NodePath.parse("/components/schemas/Pet/properties/name");
        selection.select(path, "type", false);

        SelectionState state = selection.getState();
        assertEquals(path, state.getSelectedPath());
        assertSame(document.resolve(PET_NAME), state.getSelectedNode());
        assertEquals("type", state.getSelectedPropertyName());
        assertSame(document.resolve(PET), state.getNavigationObject());
        assertEquals("schema", state.getNavigationObjectType());
        assertFalse(state.isHighlightSelection());
        assertEquals(1, changes.size());
    }

    @Test
    public void selectNode() {
        Node operation = document.resolve(GET_PETS);
        selection.select(operation);

        SelectionState state = selection.getState();
        assertEquals(GET_PETS, state.getSelectedPath());
        assertSame(operation, document.resolve(state.getSelectedPath()));
        assertSame(document.resolve(PETS), state.getNavigationObject());
        assertNull(state.getSelectedPropertyName());
    }

    @Test
    public void highlightIsASeparateChange() {
        selection.select(GET_PETS, null, true);
        assertEquals(2, changes.size());
        assertFalse(changes.get(0).isHighlightSelection());
        assertTrue(changes.get(1).isHighlightSelection());
        assertEquals(changes.get(0), changes.get(1).withHighlight(false));

        selection.clearHighlight();
        assertFalse(selection.getState().isHighlightSelection());

        changes.clear();
        selection.highlightCurrent();
        assertEquals(1, changes.size());
        assertTrue(selection.getState().isHighlightSelection());

        // already highlighted, so listeners see it dropped and raised again
        selection.highlightCurrent();
        assertEquals(3, changes.size());
        assertFalse(changes.get(1).isHighlightSelection());
    }

    @Test
    public void unresolvablePath() {
        NodePath missing = PETS.append("post");
        try {
            selection.select(missing);
            fail("Expected UnresolvableSelectionException");
        } catch (UnresolvableSelectionException e) {
            assertEquals(missing, e.getPath());
        }
        assertTrue(selection.getState().isEmpty());
        assertTrue(changes.isEmpty());
    }

    @Test(expected = UnresolvableSelectionException.class)
    public void foreignNode() {
        selection.select(createPetstore().getChild("info"));
    }

    @Test
    public void selectRoot() {
        selection.selectRoot();
        SelectionState state = selection.getState();
        assertEquals(NodePath.ROOT, state.getSelectedPath());
        assertSame(document, state.getSelectedNode());
        assertSame(document, state.getNavigationObject());
        assertEquals("info", state.getNavigationObjectType());
    }

    @Test
    public void clearAndReset() {
        selection.select(PET);
        assertEquals(new SelectionEvent(PET, document.resolve(PET), null), selection.createSelectionEvent());

        selection.clearSelection();
        assertSame(SelectionState.EMPTY, selection.getState());
        assertNull(selection.createSelectionEvent());

        selection.select(PET);
        selection.reset();
        assertTrue(selection.getState().isEmpty());

        changes.clear();
        selection.highlightCurrent();
        selection.clearSelection();
        assertTrue(changes.isEmpty());
    }

    @Test
    public void selectFromEventResolvesCurrentNode() {
        selection.select(PET, "type", false);
        SelectionEvent event = selection.createSelectionEvent();
        selection.clearSelection();

        Node schemas = document.resolve(PET.getParent());
        schemas.removeChild("Pet");
        Node recreated = schemas.addChild("Pet", NodeKind.SCHEMA);

        selection.selectFromEvent(event, true);
        SelectionState state = selection.getState();
        assertSame(recreated, state.getSelectedNode());
        assertEquals("type", state.getSelectedPropertyName());
        assertTrue(state.isHighlightSelection());
    }

    @Test
    public void selectFromEventFallsBackToNearestExisting() {
        selection.selectFromEvent(new SelectionEvent(PET_NAME.append("format")), false);
        SelectionState state = selection.getState();
        assertEquals(PET_NAME.append("format"), state.getSelectedPath());
        assertNull(state.getSelectedNode());
        assertSame(document.resolve(PET), state.getNavigationObject());
        assertEquals("schema", state.getNavigationObjectType());
    }

    @Test
    public void unregisterListener() {
        final List<SelectionState> seen = Lists.newArrayList();
        Registration registration = selection.addListener(new SelectionListener() {
            @Override
            public void selectionChanged(@NotNull SelectionState before, @NotNull SelectionState after) {
                seen.add(before);
            }
        });
        selection.select(PET);
        registration.unregister();
        registration.unregister();
        selection.select(PETS);
        assertEquals(1, seen.size());
        assertSame(SelectionState.EMPTY, seen.get(0));
    }

    @Test(expected = NoDocumentException.class)
    public void noDocument() {
        document = null;
        selection.select(PET);
    }

    @Test
    public void noDocumentForEvent() {
        MemoryDocument current = document;
        document = null;
        try {
            selection.selectFromEvent(new SelectionEvent(PET), false);
            fail("Expected NoDocumentException");
        } catch (NoDocumentException expected) {
        }
        document = current;
    }
}
