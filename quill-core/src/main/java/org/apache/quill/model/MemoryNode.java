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
package org.apache.quill.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.quill.api.Node;
import org.apache.quill.api.NodeKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * In-memory {@link Node} implementation. Children and properties keep their
 * insertion order.
 */
public class MemoryNode implements Node {

    private final NodeKind kind;

    private final List<MemoryNode> children = Lists.newArrayList();

    private final Map<String, Object> properties = Maps.newLinkedHashMap();

    /**
     * Parent of this node, {@code null} for the root and once disconnected.
     */
    private MemoryNode parent;

    private String name;

    protected MemoryNode(@Nullable MemoryNode parent, @NotNull String name, @NotNull NodeKind kind) {
        this.parent = parent;
        this.name = checkNotNull(name);
        this.kind = checkNotNull(kind);
    }

    //------------------------------------------------------------< Node >---

    @NotNull
    @Override
    public NodeKind getKind() {
        return kind;
    }

    @NotNull
    @Override
    public String getName() {
        return name;
    }

    @Nullable
    @Override
    public MemoryNode getParent() {
        return parent;
    }

    @Override
    public boolean isRoot() {
        return false;
    }

    @Override
    public boolean hasChild(@NotNull String name) {
        return getChild(name) != null;
    }

    @Nullable
    @Override
    public MemoryNode getChild(@NotNull String name) {
        int position = getChildPosition(name);
        return position < 0 ? null : children.get(position);
    }

    @NotNull
    @Override
    public List<String> getChildNames() {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (MemoryNode child : children) {
            names.add(child.name);
        }
        return names.build();
    }

    @NotNull
    @Override
    public Iterable<Node> getChildren() {
        return ImmutableList.<Node>copyOf(children);
    }

    @NotNull
    @Override
    public MemoryNode addChild(@NotNull String name, @NotNull NodeKind kind) {
        return addChild(name, kind, children.size());
    }

    @NotNull
    @Override
    public MemoryNode addChild(@NotNull String name, @NotNull NodeKind kind, int position) {
        checkConnected();
        checkArgument(!checkNotNull(name).isEmpty(), "Empty child name");
        checkArgument(kind != NodeKind.DOCUMENT, "A document cannot be added as a child");
        checkArgument(position >= 0, "Negative position %s", position);
        checkArgument(!hasChild(name), "Child %s already exists", name);

        MemoryNode child = new MemoryNode(this, name, kind);
        children.add(Math.min(position, children.size()), child);
        return child;
    }

    @Override
    public boolean removeChild(@NotNull String name) {
        checkConnected();
        int position = getChildPosition(name);
        if (position < 0) {
            return false;
        }
        MemoryNode child = children.remove(position);
        child.parent = null;
        return true;
    }

    @Override
    public boolean renameChild(@NotNull String name, @NotNull String newName) {
        checkConnected();
        checkArgument(!checkNotNull(newName).isEmpty(), "Empty child name");
        MemoryNode child = getChild(name);
        if (child == null) {
            return false;
        }
        if (name.equals(newName)) {
            return true;
        }
        checkArgument(!hasChild(newName), "Child %s already exists", newName);
        child.name = newName;
        return true;
    }

    @Override
    public int getChildPosition(@NotNull String name) {
        checkNotNull(name);
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).name.equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean hasProperty(@NotNull String name) {
        return properties.containsKey(checkNotNull(name));
    }

    @Nullable
    @Override
    public Object getProperty(@NotNull String name) {
        return properties.get(checkNotNull(name));
    }

    @NotNull
    @Override
    public Set<String> getPropertyNames() {
        return Collections.unmodifiableSet(properties.keySet());
    }

    @Nullable
    @Override
    public Object setProperty(@NotNull String name, @Nullable Object value) {
        checkConnected();
        checkNotNull(name);
        if (value == null) {
            return properties.remove(name);
        }
        return properties.put(name, checkValue(value));
    }

    //------------------------------------------------------------< Object >---

    @Override
    public String toString() {
        return kind + " " + (parent == null && !isRoot() ? "(disconnected) " : "") + name;
    }

    //-----------------------------------------------------------< private >---

    private void checkConnected() {
        checkState(parent != null || isRoot(), "Node %s is disconnected", name);
    }

    private static Object checkValue(Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            for (Object element : list) {
                checkArgument(element instanceof String || element instanceof Number
                        || element instanceof Boolean, "Unsupported list element %s", element);
            }
            return ImmutableList.copyOf(list);
        }
        throw new IllegalArgumentException("Unsupported property value " + value);
    }
}
