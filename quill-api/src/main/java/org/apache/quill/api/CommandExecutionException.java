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

import static java.lang.String.format;

/**
 * Main exception thrown by {@link Command} implementations indicating that
 * a mutation could not be applied or reverted.
 */
public class CommandExecutionException extends Exception {

    /**
     * Source name for exceptions thrown by components of this project.
     */
    public static final String QUILL = "Quill";

    /**
     * Type name for failures while applying a command.
     */
    public static final String EXECUTE = "Execute";

    /**
     * Type name for failures while reverting a command.
     */
    public static final String UNDO = "Undo";

    /**
     * Type name for failures while re-applying an undone command.
     */
    public static final String REDO = "Redo";

    /**
     * Type name for failures caused by the document not being in the state
     * a command expects, e.g. a missing node.
     */
    public static final String STATE = "State";

    private static final long serialVersionUID = -6270435213385384587L;

    private final String source;

    private final String type;

    private final int code;

    public CommandExecutionException(
            String source, String type, int code, String message, Throwable cause) {
        super(format("%s%s%04d: %s", source, type, code, message), cause);
        this.source = source;
        this.type = type;
        this.code = code;
    }

    public CommandExecutionException(String type, int code, String message, Throwable cause) {
        this(QUILL, type, code, message, cause);
    }

    public CommandExecutionException(String type, int code, String message) {
        this(type, code, message, null);
    }

    /**
     * Checks whether this exception is of the given type.
     *
     * @param type type name
     * @return {@code true} iff this exception is of the given type
     */
    public boolean isOfType(String type) {
        return this.type.equals(type);
    }

    /**
     * Checks whether the command failed because the document was not in
     * the expected state.
     */
    public boolean isStateViolation() {
        return isOfType(STATE);
    }

    public String getSource() {
        return source;
    }

    public String getType() {
        return type;
    }

    /**
     * Returns the type-specific error code of this exception.
     */
    public int getCode() {
        return code;
    }
}
