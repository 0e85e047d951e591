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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Set;

import com.google.common.collect.Sets;
import org.apache.quill.api.DefaultNodeVisitor;
import org.apache.quill.api.Node;
import org.apache.quill.api.NodeKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Finds the first visited node of a navigable kind. Used with an upward
 * traversal this yields the nearest navigable ancestor: the visitor is done
 * as soon as it has a match, so farther ancestors are never considered.
 */
class NavigationObjectResolverVisitor extends DefaultNodeVisitor {

    private final Set<NodeKind> navigableKinds;

    private Node navigationObject;

    NavigationObjectResolverVisitor(@NotNull Set<NodeKind> navigableKinds) {
        this.navigableKinds = Sets.immutableEnumSet(checkNotNull(navigableKinds));
    }

    @Override
    public void visitPathItem(@NotNull Node pathItem) {
        offer(pathItem);
    }

    @Override
    public void visitOperation(@NotNull Node operation) {
        offer(operation);
    }

    @Override
    public void visitSchema(@NotNull Node schema) {
        offer(schema);
    }

    @Override
    public void visitResponse(@NotNull Node response) {
        offer(response);
    }

    @Override
    public void visitNode(@NotNull Node node) {
        offer(node);
    }

    @Override
    public boolean isDone() {
        return navigationObject != null;
    }

    @Nullable
    Node getNavigationObject() {
        return navigationObject;
    }

    private void offer(Node node) {
        if (navigationObject == null && navigableKinds.contains(node.getKind())) {
            navigationObject = node;
        }
    }
}
