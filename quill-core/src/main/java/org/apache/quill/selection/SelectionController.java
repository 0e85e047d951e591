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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

import org.apache.quill.api.Document;
import org.apache.quill.api.NoDocumentException;
import org.apache.quill.api.Node;
import org.apache.quill.api.Registration;
import org.apache.quill.api.SelectionEvent;
import org.apache.quill.api.SelectionListener;
import org.apache.quill.api.SelectionState;
import org.apache.quill.api.UnresolvableSelectionException;
import org.apache.quill.commons.NodePath;
import org.apache.quill.navigation.NavigationObject;
import org.apache.quill.navigation.NavigationResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single source of truth for what is selected in the current document.
 * <p>
 * Every selection computes the navigation object of the selected node with
 * the {@link NavigationResolver}. A selection that asks for highlighting is
 * committed in two steps: first without and then with the highlight flag,
 * so listeners see the highlight request as a change of its own.
 * <p>
 * Listeners are called synchronously on the calling thread for every state
 * change.
 */
public class SelectionController {

    private static final Logger LOG = LoggerFactory.getLogger(SelectionController.class);

    private final Supplier<Document> documentSupplier;

    private final NavigationResolver navigationResolver;

    private final List<SelectionListener> listeners = new CopyOnWriteArrayList<>();

    private volatile SelectionState state = SelectionState.EMPTY;

    /**
     * @param documentSupplier provides the current document, or {@code null}
     *        if none is loaded
     * @param navigationResolver resolves navigation objects of selected nodes
     */
    public SelectionController(@NotNull Supplier<Document> documentSupplier,
                               @NotNull NavigationResolver navigationResolver) {
        this.documentSupplier = checkNotNull(documentSupplier);
        this.navigationResolver = checkNotNull(navigationResolver);
    }

    @NotNull
    public SelectionState getState() {
        return state;
    }

    @NotNull
    public Registration addListener(@NotNull final SelectionListener listener) {
        listeners.add(checkNotNull(listener));
        return new Registration() {
            @Override
            public void unregister() {
                listeners.remove(listener);
            }
        };
    }

    //------------------------------------------------------------< select >---

    public void select(@NotNull NodePath path) {
        select(path, null, false);
    }

    /**
     * Select the node at {@code path}.
     *
     * @param path the exact path of the node to select
     * @param propertyName optional property of the node to select
     * @param highlight whether the UI should draw attention to the selection
     * @throws UnresolvableSelectionException if {@code path} does not resolve
     * @throws NoDocumentException if no document is loaded
     */
    public synchronized void select(@NotNull NodePath path, @Nullable String propertyName, boolean highlight) {
        checkNotNull(path);
        Document document = requireDocument();
        Node node = document.resolve(path);
        if (node == null) {
            throw new UnresolvableSelectionException(
                    "Cannot select " + path + ": no such node", path);
        }
        commit(document, path, node, propertyName, highlight);
    }

    public void select(@NotNull Node node) {
        select(node, null, false);
    }

    /**
     * Select {@code node}.
     *
     * @param node a node of the current document
     * @param propertyName optional property of the node to select
     * @param highlight whether the UI should draw attention to the selection
     * @throws UnresolvableSelectionException if {@code node} is not part of
     *         the current document
     * @throws NoDocumentException if no document is loaded
     */
    public synchronized void select(@NotNull Node node, @Nullable String propertyName, boolean highlight) {
        checkNotNull(node);
        Document document = requireDocument();
        NodePath path;
        try {
            path = document.getPath(node);
        } catch (IllegalArgumentException e) {
            throw new UnresolvableSelectionException(
                    "Cannot select " + node + ": not part of the current document", e);
        }
        commit(document, path, node, propertyName, highlight);
    }

    /**
     * Restore a selection captured earlier. If the captured path still
     * resolves, the node it resolves to now is selected. Otherwise the
     * captured path is kept without a node and navigation falls back to the
     * nearest node along the path that exists.
     *
     * @param event the captured selection
     * @param highlight whether the UI should draw attention to the selection
     * @throws NoDocumentException if no document is loaded
     */
    public synchronized void selectFromEvent(@NotNull SelectionEvent event, boolean highlight) {
        checkNotNull(event);
        Document document = requireDocument();
        NodePath path = event.getPath();
        Node node = document.resolve(path);
        if (node != null) {
            commit(document, path, node, event.getPropertyName(), highlight);
            return;
        }

        Node nearest = navigationResolver.resolveNearestExisting(path, document);
        LOG.debug("Selected path {} does not exist, navigating to {}", path, nearest);
        NavigationObject navigation = navigationResolver.resolveNavigationObject(
                nearest == null ? document : nearest, document);
        update(new SelectionState(path, null, event.getPropertyName(),
                navigation.getObject(), navigation.getType(), false));
        if (highlight) {
            update(state.withHighlight(true));
        }
    }

    /**
     * @return the current selection as an event, or {@code null} if nothing
     *         is selected
     */
    @Nullable
    public SelectionEvent createSelectionEvent() {
        return state.toSelectionEvent();
    }

    /**
     * Select the document itself.
     *
     * @throws NoDocumentException if no document is loaded
     */
    public void selectRoot() {
        select(requireDocument(), null, false);
    }

    /**
     * Ask the UI to highlight the current selection again. Has no effect if
     * nothing is selected.
     */
    public synchronized void highlightCurrent() {
        if (!state.isEmpty()) {
            update(state.withHighlight(false));
            update(state.withHighlight(true));
        }
    }

    /**
     * Acknowledge a highlight request. Called by the UI once it presented
     * the highlight.
     */
    public synchronized void clearHighlight() {
        update(state.withHighlight(false));
    }

    public synchronized void clearSelection() {
        update(SelectionState.EMPTY);
    }

    /**
     * Forget the selection, e.g. because another document was loaded.
     */
    public void reset() {
        clearSelection();
    }

    @Override
    public String toString() {
        return "SelectionController[" + state + "]";
    }

    //-----------------------------------------------------------< private >---

    private Document requireDocument() {
        Document document = documentSupplier.get();
        if (document == null) {
            throw new NoDocumentException("No document loaded");
        }
        return document;
    }

    private void commit(Document document, NodePath path, Node node,
                        @Nullable String propertyName, boolean highlight) {
        NavigationObject navigation = navigationResolver.resolveNavigationObject(node, document);
        update(new SelectionState(path, node, propertyName,
                navigation.getObject(), navigation.getType(), false));
        if (highlight) {
            update(state.withHighlight(true));
        }
    }

    private void update(SelectionState after) {
        SelectionState before = state;
        if (before.equals(after)) {
            return;
        }
        state = after;
        LOG.trace("Selection changed to {}", after);
        for (SelectionListener listener : listeners) {
            listener.selectionChanged(before, after);
        }
    }
}
