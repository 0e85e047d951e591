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
package org.apache.quill.history;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import org.apache.quill.api.Command;
import org.jetbrains.annotations.NotNull;

/**
 * An executed command as recorded in the {@link CommandHistory}.
 */
public final class CommandHistoryEntry {

    private final Command command;

    private final String description;

    private final long timestamp;

    public CommandHistoryEntry(@NotNull Command command, @NotNull String description, long timestamp) {
        this.command = checkNotNull(command);
        this.description = checkNotNull(description);
        this.timestamp = timestamp;
    }

    @NotNull
    public Command getCommand() {
        return command;
    }

    /**
     * @return a human readable label, e.g. for an "Undo ..." menu item
     */
    @NotNull
    public String getDescription() {
        return description;
    }

    /**
     * @return time of the original execution in milliseconds since the epoch
     */
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("command", command.getType())
                .add("description", description)
                .add("timestamp", timestamp)
                .toString();
    }
}
