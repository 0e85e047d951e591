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

import static com.google.common.base.Preconditions.checkNotNull;

import org.apache.quill.api.CommandExecutionException;
import org.apache.quill.api.Document;
import org.apache.quill.commons.NodePath;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Sets a property of the node at a path, or removes it when the new value
 * is {@code null}. Undo restores the previous value, or the absence of the
 * property.
 */
public class ChangePropertyCommand extends AbstractCommand {

    private final NodePath path;

    private final String property;

    private final Object newValue;

    private Object oldValue;

    public ChangePropertyCommand(@NotNull NodePath path, @NotNull String property, @Nullable Object newValue) {
        this.path = checkNotNull(path);
        this.property = checkNotNull(property);
        this.newValue = newValue;
    }

    @Override
    public void execute(@NotNull Document document) throws CommandExecutionException {
        oldValue = resolveNode(document, path).setProperty(property, newValue);
    }

    @Override
    public void undo(@NotNull Document document) throws CommandExecutionException {
        resolveNode(document, path).setProperty(property, oldValue);
    }

    @NotNull
    public NodePath getPath() {
        return path;
    }

    @NotNull
    public String getProperty() {
        return property;
    }

    @Nullable
    public Object getNewValue() {
        return newValue;
    }

    @Override
    public String toString() {
        return getType() + " " + path + "#" + property;
    }
}
