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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.mothertree.api.ClauseNode;
import org.mothertree.api.Edge;
import org.mothertree.api.EdgeSource;
import org.mothertree.spi.corpus.CorpusSnapshot;
import org.mothertree.stats.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sparse overlay of user edits on top of the original mother links of a
 * {@link CorpusSnapshot}, together with the edit history and the current
 * revision. This is the single source of truth for the effective mother of
 * every clause.
 * <p>
 * The overlay is kept minimal: a clause has an entry iff its effective
 * mother differs from its original one.
 * <p>
 * Instances are not thread-safe and are meant to be used by a single
 * writer. Mutations are not validated here; see
 * {@link org.mothertree.plugins.validation.MutationValidator}.
 */
public class OverlayStore {

    private static final Logger LOG = LoggerFactory.getLogger(OverlayStore.class);

    private final CorpusSnapshot corpus;

    private final Clock clock;

    /** child -> effective mother, {@code null} values mark detached clauses */
    private Map<Integer, Integer> overlay = new HashMap<Integer, Integer>();

    private EditHistory history = new EditHistory();

    private Revision revision;

    public OverlayStore(@NotNull CorpusSnapshot corpus, @NotNull Clock clock) {
        this.corpus = checkNotNull(corpus);
        this.clock = checkNotNull(clock);
        this.revision = Revision.next(clock, null);
    }

    public OverlayStore(@NotNull CorpusSnapshot corpus) {
        this(corpus, Clock.SIMPLE);
    }

    @NotNull
    public CorpusSnapshot getCorpus() {
        return corpus;
    }

    /**
     * @param id clause id
     * @return the overlay value if the clause was edited, its original
     *         mother otherwise
     */
    @Nullable
    public Integer getEffectiveMother(int id) {
        if (overlay.containsKey(id)) {
            return overlay.get(id);
        }
        return corpus.getOriginalMother(id);
    }

    /**
     * @return {@code true} iff the clause has an active overlay entry
     */
    public boolean isEdited(int id) {
        return overlay.containsKey(id);
    }

    @NotNull
    public EdgeSource getSource(int id) {
        return EdgeSource.of(isEdited(id));
    }

    /**
     * @return the current effective edge of a clause
     */
    @NotNull
    public Edge getEdge(int id) {
        return new Edge(id, getEffectiveMother(id), getSource(id));
    }

    /**
     * @return a read-only copy of the overlay
     */
    @NotNull
    public Map<Integer, Integer> getOverlay() {
        return Collections.unmodifiableMap(new HashMap<Integer, Integer>(overlay));
    }

    /**
     * @return the effective mother of every clause, in document order
     */
    @NotNull
    public Map<Integer, Integer> getEffectiveMothers() {
        Map<Integer, Integer> mothers = new LinkedHashMap<Integer, Integer>();
        for (ClauseNode node : corpus.getNodes()) {
            mothers.put(node.getId(), getEffectiveMother(node.getId()));
        }
        return mothers;
    }

    /**
     * Builds a fresh index from effective mother to its children. The
     * children of each mother are in document order.
     */
    @NotNull
    public ListMultimap<Integer, Integer> getChildren() {
        ListMultimap<Integer, Integer> children = ArrayListMultimap.create();
        for (ClauseNode node : corpus.getNodes()) {
            Integer mother = getEffectiveMother(node.getId());
            if (mother != null) {
                children.put(mother, node.getId());
            }
        }
        return children;
    }

    /**
     * Commits a new effective mother without any validation, records the
     * change in the history and creates a new revision.
     *
     * @param child the clause to change
     * @param newMother the new mother, or {@code null} to detach the clause
     * @return the recorded change
     */
    @NotNull
    public HistoryRecord setMother(int child, @Nullable Integer newMother) {
        HistoryRecord record = new HistoryRecord(child, getEffectiveMother(child), newMother);
        apply(child, newMother);
        history.record(record);
        LOG.debug("Committed {} at {}", record, revision);
        return record;
    }

    /**
     * Reverts the most recent change.
     *
     * @return the restored edge, or {@code null} if there is no history
     */
    @Nullable
    public Edge undo() {
        HistoryRecord record = history.undo();
        if (record == null) {
            return null;
        }
        apply(record.getChild(), record.getPrevious());
        LOG.debug("Undone {} at {}", record, revision);
        return getEdge(record.getChild());
    }

    /**
     * Re-applies the most recently undone change.
     *
     * @return the re-applied edge, or {@code null} if there is nothing to
     *         redo
     */
    @Nullable
    public Edge redo() {
        HistoryRecord record = history.redo();
        if (record == null) {
            return null;
        }
        apply(record.getChild(), record.getNext());
        LOG.debug("Redone {} at {}", record, revision);
        return getEdge(record.getChild());
    }

    /**
     * Discards all edits and the whole history.
     */
    public void reset() {
        overlay = new HashMap<Integer, Integer>();
        history.clear();
        revision = Revision.next(clock, revision);
        LOG.debug("Reset to original tree at {}", revision);
    }

    /**
     * @return an independent copy of the complete mutable state
     */
    @NotNull
    public OverlaySnapshot snapshot() {
        return new OverlaySnapshot(overlay, history, revision);
    }

    /**
     * Replaces the complete mutable state with the given snapshot. The
     * snapshot itself stays untouched and can be restored again.
     */
    public void restore(@NotNull OverlaySnapshot snapshot) {
        checkNotNull(snapshot);
        overlay = new HashMap<Integer, Integer>(snapshot.getOverlay());
        history = snapshot.toHistory();
        revision = snapshot.getRevision();
        LOG.debug("Restored {}", snapshot);
    }

    @NotNull
    public Revision getRevision() {
        return revision;
    }

    @NotNull
    public String getVersion() {
        return revision.toString();
    }

    public int getUndoDepth() {
        return history.getUndoDepth();
    }

    public int getRedoDepth() {
        return history.getRedoDepth();
    }

    /**
     * @return a copy of the undo stack, most recent change first
     */
    @NotNull
    public List<HistoryRecord> getUndoRecords() {
        return history.getUndoRecords();
    }

    /**
     * @return a copy of the redo stack, most recently undone change first
     */
    @NotNull
    public List<HistoryRecord> getRedoRecords() {
        return history.getRedoRecords();
    }

    @Override
    public String toString() {
        return "OverlayStore{" + revision + ", edits=" + overlay.size() + ", " + history + "}";
    }

    //------------------------------------------------------------< private >--

    private void apply(int child, @Nullable Integer mother) {
        if (Objects.equals(mother, corpus.getOriginalMother(child))) {
            overlay.remove(child);
        } else {
            overlay.put(child, mother);
        }
        revision = Revision.next(clock, revision);
    }
}
