/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.mothertree.api;

/**
 * Machine readable reason of a failed edit. The {@link #name() name} is
 * stable and is what transport layers report to clients.
 */
public enum Reason {

    NODE_NOT_FOUND(Severity.NOT_FOUND, 1, "No clause with the given id"),

    MOTHER_NOT_CLAUSE(Severity.REJECTED, 10, "New mother is not a clause"),

    MOTHER_ID_NOT_SMALLER(Severity.REJECTED, 11, "New mother must precede the child"),

    CONTAINER_MISMATCH(Severity.REJECTED, 12, "Child and new mother are in different containers"),

    SAME_NODE(Severity.REJECTED, 13, "A clause cannot be its own mother"),

    CYCLE(Severity.REJECTED, 14, "New mother is a descendant of the child"),

    DEPTH_LIMIT(Severity.REJECTED, 15, "Maximum tree depth exceeded"),

    ROOTIFY_DISABLED(Severity.REJECTED, 16, "Detaching clauses is disabled"),

    NO_HISTORY(Severity.NO_HISTORY, 20, "Nothing to undo or redo");

    /**
     * Broad classes of failures. All of them leave the editor unchanged and
     * can be recovered from by retrying with different input.
     */
    public enum Severity {

        NOT_FOUND("NotFound"),

        REJECTED("Rejected"),

        NO_HISTORY("History");

        private final String type;

        Severity(String type) {
            this.type = type;
        }

        /**
         * Type name used in exception messages.
         */
        public String getType() {
            return type;
        }
    }

    private final Severity severity;

    private final int code;

    private final String description;

    Reason(Severity severity, int code, String description) {
        this.severity = severity;
        this.code = code;
        this.description = description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public int getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
