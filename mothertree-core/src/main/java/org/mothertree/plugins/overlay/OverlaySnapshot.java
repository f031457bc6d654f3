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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * Independent copy of the complete mutable state of an
 * {@link OverlayStore}: overlay, both history stacks and the revision.
 * Obtained from {@link OverlayStore#snapshot()} and handed back to
 * {@link OverlayStore#restore(OverlaySnapshot)}.
 */
public final class OverlaySnapshot {

    private final Map<Integer, Integer> overlay;

    private final List<HistoryRecord> undo;

    private final List<HistoryRecord> redo;

    private final Revision revision;

    OverlaySnapshot(Map<Integer, Integer> overlay, EditHistory history, Revision revision) {
        // overlay values may be null, which rules out ImmutableMap
        this.overlay = Collections.unmodifiableMap(new HashMap<Integer, Integer>(overlay));
        this.undo = history.getUndoRecords();
        this.redo = history.getRedoRecords();
        this.revision = revision;
    }

    @NotNull
    public Map<Integer, Integer> getOverlay() {
        return overlay;
    }

    @NotNull
    public List<HistoryRecord> getUndoRecords() {
        return undo;
    }

    @NotNull
    public List<HistoryRecord> getRedoRecords() {
        return redo;
    }

    @NotNull
    public Revision getRevision() {
        return revision;
    }

    EditHistory toHistory() {
        return new EditHistory(undo, redo);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof OverlaySnapshot)) {
            return false;
        }
        OverlaySnapshot that = (OverlaySnapshot) other;
        return overlay.equals(that.overlay)
                && undo.equals(that.undo)
                && redo.equals(that.redo)
                && revision.equals(that.revision);
    }

    @Override
    public int hashCode() {
        return revision.hashCode();
    }

    @Override
    public String toString() {
        return "OverlaySnapshot{" + revision + ", overlay=" + overlay
                + ", undo=" + undo.size() + ", redo=" + redo.size() + "}";
    }
}
