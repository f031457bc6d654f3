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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.String.format;

import org.jetbrains.annotations.NotNull;

/**
 * Main exception thrown when a mother edit is refused. The editor state is
 * never modified by an edit that fails with this exception.
 */
public class MotherEditException extends Exception {

    /**
     * Source name for exceptions thrown by the editor.
     */
    public static final String MOTHER = "Mother";

    private static final long serialVersionUID = 4471307329655823510L;

    private final Reason reason;

    public MotherEditException(@NotNull Reason reason, String message, Throwable cause) {
        super(format("%s%s%04d: %s", MOTHER, reason.getSeverity().getType(),
                reason.getCode(), message), cause);
        this.reason = checkNotNull(reason);
    }

    public MotherEditException(@NotNull Reason reason, String message) {
        this(reason, message, null);
    }

    public MotherEditException(@NotNull Reason reason) {
        this(reason, reason.getDescription());
    }

    @NotNull
    public Reason getReason() {
        return reason;
    }

    @NotNull
    public Reason.Severity getSeverity() {
        return reason.getSeverity();
    }

    /**
     * Checks whether this exception reports a missing clause.
     *
     * @return {@code true} iff a referenced clause does not exist
     */
    public boolean isNotFound() {
        return reason.getSeverity() == Reason.Severity.NOT_FOUND;
    }

    /**
     * Checks whether the edit was refused by a structural invariant or by
     * configuration.
     *
     * @return {@code true} iff the edit was rejected
     */
    public boolean isRejected() {
        return reason.getSeverity() == Reason.Severity.REJECTED;
    }
}
