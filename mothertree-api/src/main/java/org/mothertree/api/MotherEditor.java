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

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point for reading and editing the mother relation of a corpus.
 * <p>
 * An editor holds the process-lifetime edit state of one corpus. It is not
 * thread-safe: callers serving concurrent clients must serialise access so
 * that at most one operation is in flight at a time. Failing operations
 * never change the editor state.
 */
public interface MotherEditor {

    /**
     * Projects the effective tree.
     *
     * @param scope {@code Book[.chapter[.verse[-verse]]]}, or {@code null}
     *              for the whole corpus. An unparseable scope yields an
     *              empty view.
     * @return the projected view, never {@code null}
     */
    @NotNull
    TreeView getTree(@Nullable String scope);

    /**
     * Makes {@code newMother} the mother of {@code child}.
     */
    @NotNull
    EditResult<EdgeUpdate> reparent(int child, int newMother);

    /**
     * Detaches {@code child} so that it becomes a root.
     */
    @NotNull
    EditResult<EdgeUpdate> rootify(int child);

    /**
     * Applies all operations or none of them.
     *
     * @return the whole-corpus view after the batch, or the reason of the
     *         first failing operation
     */
    @NotNull
    EditResult<TreeView> reparentBatch(@NotNull List<BatchOperation> operations);

    /**
     * Reverts the most recent edit, or fails with {@link Reason#NO_HISTORY}.
     */
    @NotNull
    EditResult<EdgeUpdate> undo();

    /**
     * Re-applies the most recently undone edit, or fails with
     * {@link Reason#NO_HISTORY}.
     */
    @NotNull
    EditResult<EdgeUpdate> redo();

    /**
     * Discards all edits and the whole history.
     *
     * @return the new version
     */
    @NotNull
    String reset();

    /**
     * @return the current version token
     */
    @NotNull
    String getVersion();
}
