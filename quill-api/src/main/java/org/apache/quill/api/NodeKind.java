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

import org.jetbrains.annotations.NotNull;

/**
 * The structural kind of a {@link Node}. Every node of a document carries
 * exactly one kind, which is what visitors dispatch on.
 */
public enum NodeKind {

    DOCUMENT("document"),
    INFO("info"),
    CONTACT("contact"),
    LICENSE("license"),
    SERVER("server"),
    PATHS("paths"),
    PATH_ITEM("pathItem"),
    OPERATION("operation"),
    PARAMETER("parameter"),
    REQUEST_BODY("requestBody"),
    RESPONSES("responses"),
    RESPONSE("response"),
    HEADER("header"),
    MEDIA_TYPE("mediaType"),
    COMPONENTS("components"),
    SCHEMA("schema"),
    SECURITY_SCHEME("securityScheme"),
    TAG("tag"),
    EXTENSION("extension"),

    /**
     * Any structural node without a more specific kind, e.g. a map or
     * list container.
     */
    GENERIC("node");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    /**
     * @return the short tag of this kind as exposed to the UI, e.g.
     *         {@code "pathItem"} or {@code "schema"}
     */
    @NotNull
    public String getTag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
