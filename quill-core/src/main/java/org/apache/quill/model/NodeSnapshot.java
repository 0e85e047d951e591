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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.apache.quill.api.Node;
import org.apache.quill.api.NodeKind;
import org.jetbrains.annotations.NotNull;

/**
 * Immutable deep copy of a subtree: kind, properties and children of a node
 * at the time the snapshot was taken. Used to bring back removed content.
 * <p>
 * Two snapshots are equal if they describe equal subtrees, which makes
 * snapshots handy for comparing document states.
 */
public final class NodeSnapshot {

    private final NodeKind kind;

    private final ImmutableMap<String, Object> properties;

    private final ImmutableList<Map.Entry<String, NodeSnapshot>> children;

    private NodeSnapshot(NodeKind kind, ImmutableMap<String, Object> properties,
                         ImmutableList<Map.Entry<String, NodeSnapshot>> children) {
        this.kind = kind;
        this.properties = properties;
        this.children = children;
    }

    /**
     * Take a snapshot of {@code node} and its whole subtree.
     */
    @NotNull
    public static NodeSnapshot of(@NotNull Node node) {
        checkNotNull(node);
        ImmutableMap.Builder<String, Object> properties = ImmutableMap.builder();
        for (String name : node.getPropertyNames()) {
            properties.put(name, node.getProperty(name));
        }
        ImmutableList.Builder<Map.Entry<String, NodeSnapshot>> children = ImmutableList.builder();
        for (Node child : node.getChildren()) {
            children.add(Maps.immutableEntry(child.getName(), of(child)));
        }
        return new NodeSnapshot(node.getKind(), properties.build(), children.build());
    }

    @NotNull
    public NodeKind getKind() {
        return kind;
    }

    @NotNull
    public Map<String, Object> getProperties() {
        return properties;
    }

    /**
     * Recreate the snapshot as a new child of {@code parent}.
     *
     * @param parent the node to add the child to
     * @param name the name of the new child
     * @param position the position of the new child
     * @return the new child
     * @throws IllegalArgumentException if {@code parent} already has a child
     *         of that name
     */
    @NotNull
    public Node restore(@NotNull Node parent, @NotNull String name, int position) {
        Node node = parent.addChild(name, kind, position);
        restoreContent(node);
        return node;
    }

    private void restoreContent(Node node) {
        for (Map.Entry<String, Object> property : properties.entrySet()) {
            node.setProperty(property.getKey(), property.getValue());
        }
        for (Map.Entry<String, NodeSnapshot> child : children) {
            Node restored = node.addChild(child.getKey(), child.getValue().kind);
            child.getValue().restoreContent(restored);
        }
    }

    //------------------------------------------------------------< Object >---

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other instanceof NodeSnapshot) {
            NodeSnapshot that = (NodeSnapshot) other;
            return kind == that.kind
                    && properties.equals(that.properties)
                    && children.equals(that.children);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * kind.hashCode() + properties.hashCode()) + children.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("kind", kind)
                .add("properties", properties)
                .add("children", children)
                .toString();
    }
}
