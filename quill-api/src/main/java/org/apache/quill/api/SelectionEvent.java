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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import org.apache.quill.commons.NodePath;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable snapshot of a selection: the selected path, the node it
 * resolved to at the time and an optional property name for a finer grained
 * selection inside that node.
 */
public final class SelectionEvent {

    private final NodePath path;

    private final Node node;

    private final String propertyName;

    public SelectionEvent(@NotNull NodePath path, @Nullable Node node, @Nullable String propertyName) {
        this.path = checkNotNull(path);
        this.node = node;
        this.propertyName = propertyName;
    }

    public SelectionEvent(@NotNull NodePath path) {
        this(path, null, null);
    }

    @NotNull
    public NodePath getPath() {
        return path;
    }

    @Nullable
    public Node getNode() {
        return node;
    }

    @Nullable
    public String getPropertyName() {
        return propertyName;
    }

    /**
     * Nodes are compared by identity.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other instanceof SelectionEvent) {
            SelectionEvent that = (SelectionEvent) other;
            return path.equals(that.path)
                    && node == that.node
                    && Objects.equal(propertyName, that.propertyName);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(path, propertyName);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("path", path)
                .add("propertyName", propertyName)
                .toString();
    }
}
