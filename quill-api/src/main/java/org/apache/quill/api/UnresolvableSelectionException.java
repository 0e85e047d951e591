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

import org.apache.quill.commons.NodePath;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a selection target cannot be resolved to a node or a path of
 * the current document.
 */
public class UnresolvableSelectionException extends IllegalArgumentException {

    private static final long serialVersionUID = 4920370180253340437L;

    private final NodePath path;

    public UnresolvableSelectionException(String message, @Nullable NodePath path) {
        super(message);
        this.path = path;
    }

    public UnresolvableSelectionException(String message, Throwable cause) {
        super(message, cause);
        this.path = null;
    }

    /**
     * @return the path that failed to resolve, if known
     */
    @Nullable
    public NodePath getPath() {
        return path;
    }
}
