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

import com.google.common.base.MoreObjects;
import org.apache.quill.api.Node;
import org.jetbrains.annotations.NotNull;

/**
 * The coarse grained node chosen to represent a selection, together with
 * the type tag used to pick the view that shows it.
 */
public final class NavigationObject {

    private final Node object;

    private final String type;

    public NavigationObject(@NotNull Node object, @NotNull String type) {
        this.object = checkNotNull(object);
        this.type = checkNotNull(type);
    }

    @NotNull
    public Node getObject() {
        return object;
    }

    @NotNull
    public String getType() {
        return type;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other instanceof NavigationObject) {
            NavigationObject that = (NavigationObject) other;
            return object == that.object && type.equals(that.type);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("object", object)
                .add("type", type)
                .toString();
    }
}
