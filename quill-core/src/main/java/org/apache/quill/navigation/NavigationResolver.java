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
package org.apache.quill.navigation;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.EnumSet;
import java.util.Set;

import com.google.common.collect.Sets;
import org.apache.quill.api.Document;
import org.apache.quill.api.Node;
import org.apache.quill.api.NodeKind;
import org.apache.quill.commons.NodePath;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Tree traversals that map fine grained node references to the nodes an
 * editor navigates by.
 * <ul>
 *     <li>{@link #resolveNavigationObject(Node, Document)} walks up from a
 *     node to its nearest navigable ancestor (by default a path item, schema
 *     or response) and falls back to the document, typed {@code "info"}.</li>
 *     <li>{@link #resolveNearestExisting(NodePath, Document)} and
 *     {@link #resolveNearestOperation(NodePath, Document)} walk down a path
 *     that may not fully exist yet.</li>
 * </ul>
 * Instances are immutable and can be shared.
 */
public class NavigationResolver {

    /**
     * Type of the navigation object for selections that have no navigable
     * ancestor.
     */
    public static final String ROOT_NAVIGATION_TYPE = NodeKind.INFO.getTag();

    public static final Set<NodeKind> DEFAULT_NAVIGABLE_KINDS =
            Sets.immutableEnumSet(NodeKind.PATH_ITEM, NodeKind.SCHEMA, NodeKind.RESPONSE);

    private final Set<NodeKind> navigableKinds;

    public NavigationResolver() {
        this(DEFAULT_NAVIGABLE_KINDS);
    }

    /**
     * @param navigableKinds the kinds of nodes that qualify as navigation
     *        objects
     */
    public NavigationResolver(@NotNull Set<NodeKind> navigableKinds) {
        checkArgument(!checkNotNull(navigableKinds).contains(NodeKind.DOCUMENT),
                "The document is always navigable");
        this.navigableKinds = Sets.immutableEnumSet(navigableKinds);
    }

    /**
     * Convenience factory for a resolver that also navigates to the given
     * kinds in addition to the default ones.
     */
    @NotNull
    public static NavigationResolver withAdditionalKinds(@NotNull NodeKind... kinds) {
        EnumSet<NodeKind> all = EnumSet.copyOf(DEFAULT_NAVIGABLE_KINDS);
        for (NodeKind kind : kinds) {
            all.add(checkNotNull(kind));
        }
        return new NavigationResolver(all);
    }

    @NotNull
    public Set<NodeKind> getNavigableKinds() {
        return navigableKinds;
    }

    /**
     * Find the navigation object for {@code node}: {@code node} itself or the
     * nearest of its ancestors whose kind is navigable. The root and nodes
     * without a navigable ancestor map to the document with type
     * {@link #ROOT_NAVIGATION_TYPE}.
     *
     * @param node the selected node
     * @param document the document containing {@code node}
     * @return the navigation object, never {@code null}
     */
    @NotNull
    public NavigationObject resolveNavigationObject(@NotNull Node node, @NotNull Document document) {
        checkNotNull(node);
        checkNotNull(document);
        if (node == document) {
            return new NavigationObject(document, ROOT_NAVIGATION_TYPE);
        }
        NavigationObjectResolverVisitor visitor = new NavigationObjectResolverVisitor(navigableKinds);
        document.visitUp(node, visitor);
        Node found = visitor.getNavigationObject();
        if (found == null) {
            return new NavigationObject(document, ROOT_NAVIGATION_TYPE);
        }
        return new NavigationObject(found, found.getKind().getTag());
    }

    /**
     * Find the deepest node along {@code path} that exists.
     *
     * @return the node at {@code path} if it exists, otherwise the last node
     *         that resolved; {@code null} only if not even the document was
     *         visited
     */
    @Nullable
    public Node resolveNearestExisting(@NotNull NodePath path, @NotNull Document document) {
        NearestNodeVisitor visitor = new NearestNodeVisitor();
        document.visitPath(checkNotNull(path), visitor);
        return visitor.getNearest();
    }

    /**
     * Find the first operation along {@code path}, top down.
     *
     * @return the operation or {@code null} if the existing part of
     *         {@code path} does not pass through one
     */
    @Nullable
    public Node resolveNearestOperation(@NotNull NodePath path, @NotNull Document document) {
        NearestOperationVisitor visitor = new NearestOperationVisitor();
        document.visitPath(checkNotNull(path), visitor);
        return visitor.getOperation();
    }
}
