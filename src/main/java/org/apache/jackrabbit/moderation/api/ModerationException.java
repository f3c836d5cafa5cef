/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.moderation.api;

import static java.lang.String.format;

/**
 * Main exception thrown by the moderation workflow indicating that an
 * operation was rejected. No change of a rejected operation is ever visible.
 */
public class ModerationException extends Exception {

    /**
     * Source name for exceptions thrown by the moderation engine.
     */
    public static final String MODERATION = "Moderation";

    /**
     * Type name for access violation (i.e. permission denied) errors.
     */
    public static final String ACCESS = "Access";

    /**
     * Type name for transitions that are not legal from the current state.
     */
    public static final String STATE = "State";

    /**
     * Type name for references to absent nodes.
     */
    public static final String NOT_FOUND = "NotFound";

    /**
     * Type name for constraint violations detected while committing.
     */
    public static final String CONSTRAINT = "Constraint";

    /** Serial version UID */
    private static final long serialVersionUID = -3184751065927460981L;

    private final String source;

    private final String type;

    private final int code;

    public ModerationException(
            String source, String type, int code, String message,
            Throwable cause) {
        super(format("%s%s%04d: %s", source, type, code, message), cause);
        this.source = source;
        this.type = type;
        this.code = code;
    }

    public ModerationException(
            String type, int code, String message, Throwable cause) {
        this(MODERATION, type, code, message, cause);
    }

    public ModerationException(String type, int code, String message) {
        this(type, code, message, null);
    }

    public static ModerationException permissionDenied(String message) {
        return new ModerationException(ACCESS, 1, message);
    }

    public static ModerationException invalidStateTransition(String message) {
        return new ModerationException(STATE, 1, message);
    }

    public static ModerationException notFound(String nodeId) {
        return new ModerationException(NOT_FOUND, 1, "No such node: " + nodeId);
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

    public boolean isAccessViolation() {
        return isOfType(ACCESS);
    }

    public boolean isInvalidStateTransition() {
        return isOfType(STATE);
    }

    public boolean isNotFound() {
        return isOfType(NOT_FOUND);
    }

    public boolean isConstraintViolation() {
        return isOfType(CONSTRAINT);
    }

    public String getSource() {
        return source;
    }

    public String getType() {
        return type;
    }

    /**
     * Returns the type-specific error code of this exception.
     *
     * @return error code
     */
    public int getCode() {
        return code;
    }

}
