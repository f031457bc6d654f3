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
import static com.google.common.base.Preconditions.checkState;

import java.util.function.Function;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of an editor operation: either a value or the {@link Reason} the
 * operation was refused for.
 *
 * @param <T> type of the success value
 */
public final class EditResult<T> {

    private final T value;

    private final Reason reason;

    private EditResult(@Nullable T value, @Nullable Reason reason) {
        this.value = value;
        this.reason = reason;
    }

    @NotNull
    public static <T> EditResult<T> success(@NotNull T value) {
        return new EditResult<T>(checkNotNull(value), null);
    }

    @NotNull
    public static <T> EditResult<T> failure(@NotNull Reason reason) {
        return new EditResult<T>(null, checkNotNull(reason));
    }

    @NotNull
    public static <T> EditResult<T> failure(@NotNull MotherEditException e) {
        return failure(e.getReason());
    }

    public boolean isSuccess() {
        return reason == null;
    }

    /**
     * @return the success value
     * @throws IllegalStateException if this result is a failure
     */
    @NotNull
    public T get() {
        checkState(reason == null, "Edit failed: %s", reason);
        return value;
    }

    /**
     * @return the failure reason
     * @throws IllegalStateException if this result is a success
     */
    @NotNull
    public Reason getReason() {
        checkState(reason != null, "Edit succeeded");
        return reason;
    }

    /**
     * Maps both branches to a common type. Exactly one of the two functions
     * is applied.
     */
    public <R> R fold(@NotNull Function<? super T, ? extends R> onSuccess,
                      @NotNull Function<Reason, ? extends R> onFailure) {
        return reason == null ? onSuccess.apply(value) : onFailure.apply(reason);
    }

    @Override
    public String toString() {
        return reason == null ? "EditResult{ok: " + value + "}" : "EditResult{" + reason + "}";
    }
}
