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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import org.apache.quill.commons.NodePath;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable view of what is currently selected in an editor.
 * <p>
 * Besides the selected path, node and property, the state holds the
 * <em>navigation object</em>: the coarse grained ancestor of the selection
 * (a path item, schema, response or the document itself) that decides which
 * view is shown, together with its type tag. The highlight flag asks the UI
 * to draw attention to the selection once; the UI clears it after
 * presenting.
 */
public final class SelectionState {

    /**
     * Nothing selected.
     */
    public static final SelectionState EMPTY = new SelectionState(null, null, null, null, null, false);

    private final NodePath selectedPath;

    private final Node selectedNode;

    private final String selectedPropertyName;

    private final Node navigationObject;

    private final String navigationObjectType;

    private final boolean highlightSelection;

    public SelectionState(@Nullable NodePath selectedPath, @Nullable Node selectedNode,
                          @Nullable String selectedPropertyName, @Nullable Node navigationObject,
                          @Nullable String navigationObjectType, boolean highlightSelection) {
        this.selectedPath = selectedPath;
        this.selectedNode = selectedNode;
        this.selectedPropertyName = selectedPropertyName;
        this.navigationObject = navigationObject;
        this.navigationObjectType = navigationObjectType;
        this.highlightSelection = highlightSelection;
    }

    @Nullable
    public NodePath getSelectedPath() {
        return selectedPath;
    }

    @Nullable
    public Node getSelectedNode() {
        return selectedNode;
    }

    @Nullable
    public String getSelectedPropertyName() {
        return selectedPropertyName;
    }

    @Nullable
    public Node getNavigationObject() {
        return navigationObject;
    }

    @Nullable
    public String getNavigationObjectType() {
        return navigationObjectType;
    }

    public boolean isHighlightSelection() {
        return highlightSelection;
    }

    public boolean isEmpty() {
        return selectedPath == null;
    }

    /**
     * @return a copy of this state with the given highlight flag
     */
    @NotNull
    public SelectionState withHighlight(boolean highlight) {
        if (highlight == highlightSelection) {
            return this;
        }
        return new SelectionState(selectedPath, selectedNode, selectedPropertyName,
                navigationObject, navigationObjectType, highlight);
    }

    /**
     * @return the selection part of this state as an event, or {@code null}
     *         if nothing is selected
     */
    @Nullable
    public SelectionEvent toSelectionEvent() {
        if (selectedPath == null) {
            return null;
        }
        return new SelectionEvent(selectedPath, selectedNode, selectedPropertyName);
    }

    /**
     * Nodes are compared by identity.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other instanceof SelectionState) {
            SelectionState that = (SelectionState) other;
            return Objects.equal(selectedPath, that.selectedPath)
                    && selectedNode == that.selectedNode
                    && Objects.equal(selectedPropertyName, that.selectedPropertyName)
                    && navigationObject == that.navigationObject
                    && Objects.equal(navigationObjectType, that.navigationObjectType)
                    && highlightSelection == that.highlightSelection;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(selectedPath, selectedPropertyName, navigationObjectType, highlightSelection);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("selectedPath", selectedPath)
                .add("selectedPropertyName", selectedPropertyName)
                .add("navigationObjectType", navigationObjectType)
                .add("highlightSelection", highlightSelection)
                .toString();
    }
}
