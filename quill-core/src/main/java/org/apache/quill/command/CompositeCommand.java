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

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.quill.api.Command;
import org.apache.quill.api.CommandExecutionException;
import org.apache.quill.api.Document;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composite command. Maintains a list of component commands that are undone
 * and redone as a single unit. Components are executed in list order and
 * undone in reverse order, so later components may depend on structure
 * created by earlier ones.
 * <p>
 * If a component fails during {@link #execute(Document)}, the components
 * executed so far are undone in reverse order before the failure is
 * propagated, leaving the document as it was.
 */
public class CompositeCommand extends AbstractCommand {

    private static final Logger LOG = LoggerFactory.getLogger(CompositeCommand.class);

    private final List<Command> commands;

    private final String description;

    public CompositeCommand(@NotNull List<? extends Command> commands, @NotNull String description) {
        this.commands = ImmutableList.copyOf(commands);
        this.description = checkNotNull(description);
    }

    public CompositeCommand(@NotNull List<? extends Command> commands) {
        this(commands, "CompositeCommand");
    }

    public CompositeCommand(Command... commands) {
        this(ImmutableList.copyOf(commands));
    }

    @NotNull
    @Override
    public String getType() {
        return description;
    }

    @Override
    public void execute(@NotNull Document document) throws CommandExecutionException {
        int executed = 0;
        try {
            for (Command command : commands) {
                command.execute(document);
                executed++;
            }
        } catch (CommandExecutionException | RuntimeException e) {
            LOG.debug("{} failed at component {}, rolling back", description, executed);
            rollback(document, executed, e);
            throw e;
        }
    }

    @Override
    public void undo(@NotNull Document document) throws CommandExecutionException {
        for (int i = commands.size() - 1; i >= 0; i--) {
            commands.get(i).undo(document);
        }
    }

    public int getCommandCount() {
        return commands.size();
    }

    @NotNull
    public List<Command> getCommands() {
        return commands;
    }

    private void rollback(Document document, int executed, Exception failure) {
        for (int i = executed - 1; i >= 0; i--) {
            try {
                commands.get(i).undo(document);
            } catch (CommandExecutionException | RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
    }
}
