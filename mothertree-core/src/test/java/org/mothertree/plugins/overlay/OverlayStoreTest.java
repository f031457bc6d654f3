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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mothertree.fixture.GenesisCorpus.V2_FIRST;
import static org.mothertree.fixture.GenesisCorpus.V2_ROOT;
import static org.mothertree.fixture.GenesisCorpus.V2_SECOND;
import static org.mothertree.fixture.GenesisCorpus.V4_FIRST;
import static org.mothertree.fixture.GenesisCorpus.V4_MIDDLE;
import static org.mothertree.fixture.GenesisCorpus.V4_SECOND;
import static org.mothertree.fixture.GenesisCorpus.V5_CHILD;

import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.Before;
import org.junit.Test;
import org.mothertree.api.Edge;
import org.mothertree.api.EdgeSource;
import org.mothertree.fixture.GenesisCorpus;
import org.mothertree.stats.Clock;

public class OverlayStoreTest {

    private Clock.Virtual clock;

    private OverlayStore store;

    @Before
    public void before() {
        clock = new Clock.Virtual();
        store = new OverlayStore(GenesisCorpus.create(), clock);
    }

    @Test
    public void initialState() {
        assertTrue(store.getOverlay().isEmpty());
        assertEquals("r0-0", store.getVersion());
        assertEquals(Integer.valueOf(V2_ROOT), store.getEffectiveMother(V2_FIRST));
        assertEquals(new Edge(V2_FIRST, V2_ROOT, EdgeSource.ORIGINAL), store.getEdge(V2_FIRST));
        assertEquals(GenesisCorpus.SIZE, store.getEffectiveMothers().size());
    }

    @Test
    public void setMother() {
        HistoryRecord record = store.setMother(V2_SECOND, V2_FIRST);
        assertEquals(new HistoryRecord(V2_SECOND, V2_ROOT, V2_FIRST), record);
        assertEquals(ImmutableMap.of(V2_SECOND, V2_FIRST), store.getOverlay());
        assertTrue(store.isEdited(V2_SECOND));
        assertEquals(new Edge(V2_SECOND, V2_FIRST, EdgeSource.USER), store.getEdge(V2_SECOND));
        assertEquals("r0-1", store.getVersion());
        assertEquals(ImmutableList.of(record), store.getUndoRecords());
    }

    @Test
    public void detach() {
        store.setMother(V2_FIRST, null);
        assertNull(store.getEffectiveMother(V2_FIRST));
        assertTrue(store.isEdited(V2_FIRST));
        assertEquals(EdgeSource.USER, store.getSource(V2_FIRST));
        Map<Integer, Integer> overlay = store.getOverlay();
        assertTrue(overlay.containsKey(V2_FIRST));
        assertNull(overlay.get(V2_FIRST));
    }

    @Test
    public void restoringOriginalRemovesOverlayEntry() {
        store.setMother(V2_SECOND, V2_FIRST);
        store.setMother(V2_SECOND, V2_ROOT);
        assertFalse(store.isEdited(V2_SECOND));
        assertTrue(store.getOverlay().isEmpty());
        assertEquals(EdgeSource.ORIGINAL, store.getSource(V2_SECOND));
        assertEquals(2, store.getUndoDepth());
    }

    @Test
    public void undoRedo() {
        String initial = store.getVersion();
        store.setMother(V2_SECOND, V2_FIRST);

        Edge undone = store.undo();
        assertEquals(new Edge(V2_SECOND, V2_ROOT, EdgeSource.ORIGINAL), undone);
        assertTrue(store.getOverlay().isEmpty());
        assertNotEquals(initial, store.getVersion());
        assertEquals(1, store.getRedoDepth());

        Edge redone = store.redo();
        assertEquals(new Edge(V2_SECOND, V2_FIRST, EdgeSource.USER), redone);
        assertEquals(0, store.getRedoDepth());
        assertNull(store.redo());
    }

    @Test
    public void undoWithoutHistory() {
        String version = store.getVersion();
        assertNull(store.undo());
        assertNull(store.redo());
        assertEquals(version, store.getVersion());
    }

    @Test
    public void children() {
        assertEquals(ImmutableList.of(V4_FIRST, V4_SECOND, V5_CHILD),
                store.getChildren().get(V4_MIDDLE));
        store.setMother(V4_SECOND, null);
        assertEquals(ImmutableList.of(V4_FIRST, V5_CHILD), store.getChildren().get(V4_MIDDLE));
    }

    @Test
    public void snapshotAndRestore() {
        store.setMother(V2_SECOND, V2_FIRST);
        OverlaySnapshot snapshot = store.snapshot();

        store.setMother(V4_SECOND, null);
        store.undo();
        store.undo();
        assertTrue(store.getOverlay().isEmpty());

        store.restore(snapshot);
        assertEquals(snapshot.getOverlay(), store.getOverlay());
        assertEquals(snapshot.getRevision(), store.getRevision());
        assertEquals(1, store.getUndoDepth());
        assertEquals(0, store.getRedoDepth());

        // restoring does not consume the snapshot
        store.setMother(V4_SECOND, null);
        store.restore(snapshot);
        assertEquals(ImmutableMap.of(V2_SECOND, V2_FIRST), store.getOverlay());
    }

    @Test
    public void snapshotIsIndependent() {
        OverlaySnapshot snapshot = store.snapshot();
        store.setMother(V2_SECOND, V2_FIRST);
        assertTrue(snapshot.getOverlay().isEmpty());
        assertTrue(snapshot.getUndoRecords().isEmpty());
    }

    @Test
    public void reset() {
        store.setMother(V2_SECOND, V2_FIRST);
        store.setMother(V4_SECOND, null);
        store.undo();
        String before = store.getVersion();

        store.reset();
        assertTrue(store.getOverlay().isEmpty());
        assertEquals(0, store.getUndoDepth());
        assertEquals(0, store.getRedoDepth());
        assertNotEquals(before, store.getVersion());
    }

    @Test
    public void resetKeepsSnapshotHistory() {
        store.setMother(V2_SECOND, V2_FIRST);
        store.setMother(V4_SECOND, null);
        store.undo();
        OverlaySnapshot snapshot = store.snapshot();

        store.reset();
        assertEquals(1, snapshot.getUndoRecords().size());
        assertEquals(1, snapshot.getRedoRecords().size());

        store.restore(snapshot);
        assertEquals(1, store.getUndoDepth());
        assertEquals(1, store.getRedoDepth());
        assertEquals(Integer.valueOf(V2_FIRST), store.getEffectiveMother(V2_SECOND));
        store.reset();
        assertEquals(1, snapshot.getUndoRecords().size());
    }

    @Test
    public void versionFollowsClock() {
        clock.advance(0x20);
        store.setMother(V2_SECOND, V2_FIRST);
        assertEquals("r20-0", store.getVersion());
        store.setMother(V2_FIRST, null);
        assertEquals("r20-1", store.getVersion());
    }
}
