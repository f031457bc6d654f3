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
package org.mothertree.plugins.overlay;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Linear undo/redo history of an {@link OverlayStore}. Both stacks are
 * unbounded.
 * <p>
 * Every commit adds exactly one record to the undo stack and empties the
 * redo stack. Undo and redo move exactly one record from one stack to the
 * other.
 */
public class EditHistory {

    private final Deque<HistoryRecord> undo;

    private final Deque<HistoryRecord> redo;

    public EditHistory() {
        this(ImmutableList.<HistoryRecord>of(), ImmutableList.<HistoryRecord>of());
    }

    /**
     * Creates a history from stack contents, most recent record first.
     */
    EditHistory(@NotNull List<HistoryRecord> undo, @NotNull List<HistoryRecord> redo) {
        this.undo = new ArrayDeque<HistoryRecord>(undo);
        this.redo = new ArrayDeque<HistoryRecord>(redo);
    }

    /**
     * Records a fresh commit.
     */
    public void record(@NotNull HistoryRecord record) {
        undo.push(checkNotNull(record));
        redo.clear();
    }

    /**
     * Moves the most recent record from the undo to the redo stack.
     *
     * @return the moved record or {@code null} if there is nothing to undo
     */
    @Nullable
    public HistoryRecord undo() {
        HistoryRecord record = undo.poll();
        if (record != null) {
            redo.push(record);
        }
        return record;
    }

    /**
     * Moves the most recently undone record back to the undo stack.
     *
     * @return the moved record or {@code null} if there is nothing to redo
     */
    @Nullable
    public HistoryRecord redo() {
        HistoryRecord record = redo.poll();
        if (record != null) {
            undo.push(record);
        }
        return record;
    }

    public int getUndoDepth() {
        return undo.size();
    }

    public int getRedoDepth() {
        return redo.size();
    }

    /**
     * @return a copy of the undo stack, most recent record first
     */
    @NotNull
    public List<HistoryRecord> getUndoRecords() {
        return ImmutableList.copyOf(undo);
    }

    /**
     * @return a copy of the redo stack, most recently undone record first
     */
    @NotNull
    public List<HistoryRecord> getRedoRecords() {
        return ImmutableList.copyOf(redo);
    }

    public void clear() {
        undo.clear();
        redo.clear();
    }

    @Override
    public String toString() {
        return "EditHistory{undo=" + undo.size() + ", redo=" + redo.size() + "}";
    }
}
