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
package org.apache.quill.command;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.apache.quill.api.CommandExecutionException;
import org.apache.quill.api.Document;
import org.apache.quill.api.Node;
import org.apache.quill.api.NodeKind;
import org.apache.quill.commons.NodePath;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes sure a child node exists, creating it if necessary. Nothing happens
 * if the child is already present or if the parent does not exist. Undo
 * removes the child only if this command created it.
 */
public class EnsureChildNodeCommand extends AbstractCommand {

    private static final Logger LOG = LoggerFactory.getLogger(EnsureChildNodeCommand.class);

    private final NodePath parentPath;

    private final String childName;

    private final NodeKind childKind;

    private boolean created;

    public EnsureChildNodeCommand(@NotNull NodePath parentPath, @NotNull String childName,
                                  @NotNull NodeKind childKind) {
        this.parentPath = checkNotNull(parentPath);
        this.childName = checkNotNull(childName);
        this.childKind = checkNotNull(childKind);
        checkArgument(!childName.isEmpty(), "Empty child name");
    }

    @Override
    public void execute(@NotNull Document document) {
        created = false;
        Node parent = document.resolve(parentPath);
        if (parent == null) {
            LOG.debug("Parent {} of {} does not exist", parentPath, childName);
            return;
        }
        if (!parent.hasChild(childName)) {
            parent.addChild(childName, childKind);
            created = true;
        }
    }

    @Override
    public void undo(@NotNull Document document) throws CommandExecutionException {
        if (created) {
            resolveNode(document, parentPath).removeChild(childName);
        }
    }

    @NotNull
    public NodePath getChildPath() {
        return parentPath.append(childName);
    }

    @Override
    public String toString() {
        return getType() + " " + getChildPath();
    }
}
