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
package org.mothertree.plugins.batch;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mothertree.api.BatchOperation.reparent;
import static org.mothertree.api.BatchOperation.rootify;
import static org.mothertree.fixture.GenesisCorpus.V2_FIRST;
import static org.mothertree.fixture.GenesisCorpus.V2_ROOT;
import static org.mothertree.fixture.GenesisCorpus.V2_SECOND;
import static org.mothertree.fixture.GenesisCorpus.V3_CHILD;
import static org.mothertree.fixture.GenesisCorpus.V4_MIDDLE;
import static org.mothertree.fixture.GenesisCorpus.V4_SECOND;
import static org.mothertree.fixture.GenesisCorpus.V5_ROOT;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import ch.qos.logback.classic.Level;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mothertree.api.BatchOperation;
import org.mothertree.api.MotherEditException;
import org.mothertree.api.Reason;
import org.mothertree.fixture.GenesisCorpus;
import org.mothertree.junit.LogCustomizer;
import org.mothertree.plugins.overlay.HistoryRecord;
import org.mothertree.plugins.overlay.OverlayStore;
import org.mothertree.plugins.validation.MutationValidator;
import org.mothertree.spi.config.MotherTreeConfiguration;
import org.mothertree.stats.Clock;

public class BatchCoordinatorTest {

    private final LogCustomizer logs = LogCustomizer.forLogger(BatchCoordinator.class)
            .enable(Level.INFO).contains("Rolled back").create();

    private OverlayStore store;

    private BatchCoordinator coordinator;

    @Before
    public void before() {
        logs.starting();
        store = new OverlayStore(GenesisCorpus.create(), new Clock.Virtual());
        coordinator = newCoordinator(MotherTreeConfiguration.DEFAULT);
    }

    @After
    public void after() {
        logs.finished();
    }

    @Test
    public void single() throws MotherEditException {
        HistoryRecord record = coordinator.apply(reparent(V2_SECOND, V2_FIRST));
        assertEquals(new HistoryRecord(V2_SECOND, V2_ROOT, V2_FIRST), record);
        assertEquals(Integer.valueOf(V2_FIRST), store.getEffectiveMother(V2_SECOND));
    }

    @Test
    public void singleRootify() throws MotherEditException {
        coordinator.apply(rootify(V2_FIRST));
        assertNull(store.getEffectiveMother(V2_FIRST));
    }

    @Test
    public void batch() throws MotherEditException {
        coordinator.applyBatch(ImmutableList.of(
                reparent(V2_SECOND, V2_FIRST),
                rootify(V3_CHILD)));
        assertEquals(2, store.getOverlay().size());
        assertEquals(2, store.getUndoDepth());
        assertEquals("r0-2", store.getVersion());
        assertTrue(logs.getLogs().isEmpty());
    }

    @Test
    public void emptyBatch() throws MotherEditException {
        String version = store.getVersion();
        coordinator.applyBatch(ImmutableList.<BatchOperation>of());
        assertEquals(version, store.getVersion());
        assertEquals(0, store.getUndoDepth());
    }

    @Test
    public void rollback() throws MotherEditException {
        coordinator.apply(rootify(V4_SECOND));
        String version = store.getVersion();
        List<BatchOperation> ops = ImmutableList.of(
                reparent(V2_SECOND, V2_FIRST),
                rootify(V3_CHILD),
                reparent(V2_FIRST, V2_SECOND));
        try {
            coordinator.applyBatch(ops);
            fail("Batch must fail");
        } catch (MotherEditException e) {
            assertEquals(Reason.MOTHER_ID_NOT_SMALLER, e.getReason());
        }
        assertEquals(Collections.<Integer, Integer>singletonMap(V4_SECOND, null), store.getOverlay());
        assertEquals(version, store.getVersion());
        assertEquals(1, store.getUndoDepth());
        assertEquals(ImmutableList.of("Rolled back batch of 3 operations, operation 3 ("
                + ops.get(2) + ") failed"), logs.getLogs());
    }

    @Test
    public void rollbackKeepsRedoStack() throws MotherEditException {
        coordinator.apply(reparent(V2_SECOND, V2_FIRST));
        store.undo();
        try {
            coordinator.applyBatch(ImmutableList.of(rootify(V3_CHILD), reparent(1, V2_ROOT)));
            fail("Batch must fail");
        } catch (MotherEditException e) {
            assertEquals(Reason.NODE_NOT_FOUND, e.getReason());
        }
        assertEquals(1, store.getRedoDepth());
        assertTrue(store.getOverlay().isEmpty());
    }

    @Test
    public void operationsSeePreviousOperations() throws MotherEditException {
        coordinator = newCoordinator(MotherTreeConfiguration.builder().maxDepth(3).build());
        // V5_ROOT under V4_SECOND is too deep until V4_MIDDLE is detached
        try {
            coordinator.applyBatch(ImmutableList.of(
                    reparent(V5_ROOT, V4_SECOND),
                    rootify(V4_MIDDLE)));
            fail("Batch must fail");
        } catch (MotherEditException e) {
            assertEquals(Reason.DEPTH_LIMIT, e.getReason());
        }
        coordinator.applyBatch(ImmutableList.of(
                rootify(V4_MIDDLE),
                reparent(V5_ROOT, V4_SECOND)));
        assertEquals(Integer.valueOf(V4_SECOND), store.getEffectiveMother(V5_ROOT));
    }

    private BatchCoordinator newCoordinator(MotherTreeConfiguration config) {
        return new BatchCoordinator(store, new MutationValidator(store, config));
    }
}
