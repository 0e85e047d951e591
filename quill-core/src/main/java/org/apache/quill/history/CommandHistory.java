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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.quill.api.Command;
import org.apache.quill.commons.properties.SystemPropertySupplier;
import org.apache.quill.commons.time.Clock;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The undo and redo stacks of an editing session.
 * <p>
 * The undo stack is bounded: when a new entry makes it exceed
 * {@link #getMaxUndoSize()}, the oldest entry is discarded. Pushing a newly
 * executed command always empties the redo stack, which keeps the history
 * linear. Undo and redo move entries between the two stacks through
 * {@link #pushRedo(CommandHistoryEntry)} and
 * {@link #pushUndoWithoutClearingRedo(CommandHistoryEntry)}.
 * <p>
 * This class is not thread-safe.
 */
public class CommandHistory {

    private static final Logger LOG = LoggerFactory.getLogger(CommandHistory.class);

    public static final String MAX_UNDO_SIZE_PROPERTY = "quill.history.maxUndoSize";

    public static final int DEFAULT_MAX_UNDO_SIZE = 100;

    private final Deque<CommandHistoryEntry> undoStack = new ArrayDeque<>();

    private final Deque<CommandHistoryEntry> redoStack = new ArrayDeque<>();

    private final int maxUndoSize;

    private final Clock clock;

    /**
     * Number of entries discarded from the bottom of the undo stack.
     */
    private long evictedCount;

    /**
     * Create a history bounded by the {@code quill.history.maxUndoSize}
     * system property.
     */
    public CommandHistory() {
        this(configuredMaxUndoSize(), Clock.SIMPLE);
    }

    public CommandHistory(int maxUndoSize, @NotNull Clock clock) {
        checkArgument(maxUndoSize > 0, "maxUndoSize must be positive: %s", maxUndoSize);
        this.maxUndoSize = maxUndoSize;
        this.clock = checkNotNull(clock);
    }

    /**
     * @return the undo stack bound configured by the
     *         {@value #MAX_UNDO_SIZE_PROPERTY} system property
     */
    public static int configuredMaxUndoSize() {
        return SystemPropertySupplier.create(MAX_UNDO_SIZE_PROPERTY, DEFAULT_MAX_UNDO_SIZE)
                .loggingTo(LOG)
                .validateWith(size -> size > 0)
                .get();
    }

    /**
     * Record a newly executed command.
     *
     * @return the new entry
     * @see #push(CommandHistoryEntry)
     */
    @NotNull
    public CommandHistoryEntry push(@NotNull Command command, @NotNull String description) {
        CommandHistoryEntry entry = new CommandHistoryEntry(command, description, clock.getTimeMonotonic());
        push(entry);
        return entry;
    }

    /**
     * Append a newly executed entry to the undo stack, discarding the oldest
     * entry if the stack exceeds its bound, and empty the redo stack.
     */
    public void push(@NotNull CommandHistoryEntry entry) {
        undoStack.addLast(checkNotNull(entry));
        if (undoStack.size() > maxUndoSize) {
            CommandHistoryEntry evicted = undoStack.removeFirst();
            evictedCount++;
            LOG.debug("Undo history full, discarding {}", evicted);
        }
        redoStack.clear();
    }

    /**
     * Append an entry to the undo stack without touching the redo stack.
     * Used by redo.
     */
    public void pushUndoWithoutClearingRedo(@NotNull CommandHistoryEntry entry) {
        undoStack.addLast(checkNotNull(entry));
        if (undoStack.size() > maxUndoSize) {
            undoStack.removeFirst();
            evictedCount++;
        }
    }

    /**
     * Append an entry to the redo stack. Used by undo.
     */
    public void pushRedo(@NotNull CommandHistoryEntry entry) {
        redoStack.addLast(checkNotNull(entry));
    }

    /**
     * @return the most recent undo entry, or {@code null} if there is none
     */
    @Nullable
    public CommandHistoryEntry popUndo() {
        return undoStack.pollLast();
    }

    /**
     * @return the most recent redo entry, or {@code null} if there is none
     */
    @Nullable
    public CommandHistoryEntry popRedo() {
        return redoStack.pollLast();
    }

    @Nullable
    public CommandHistoryEntry peekUndo() {
        return undoStack.peekLast();
    }

    @Nullable
    public CommandHistoryEntry peekRedo() {
        return redoStack.peekLast();
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int getUndoCount() {
        return undoStack.size();
    }

    public int getRedoCount() {
        return redoStack.size();
    }

    public int getMaxUndoSize() {
        return maxUndoSize;
    }

    /**
     * @return the number of entries discarded so far because the undo stack
     *         exceeded its bound. The counter is not affected by
     *         {@link #reset()}.
     */
    public long getEvictedCount() {
        return evictedCount;
    }

    /**
     * @return the undo entries, oldest first
     */
    @NotNull
    public List<CommandHistoryEntry> getUndoEntries() {
        return ImmutableList.copyOf(undoStack);
    }

    /**
     * @return the redo entries, oldest first
     */
    @NotNull
    public List<CommandHistoryEntry> getRedoEntries() {
        return ImmutableList.copyOf(redoStack);
    }

    /**
     * Discard all history.
     */
    public void reset() {
        undoStack.clear();
        redoStack.clear();
    }

    @Override
    public String toString() {
        return "CommandHistory[undo=" + undoStack.size() + ", redo=" + redoStack.size()
                + ", max=" + maxUndoSize + "]";
    }
}
