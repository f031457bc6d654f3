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
package org.mothertree.plugins.memory;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mothertree.fixture.GenesisCorpus.clause;

import java.util.List;

import com.google.common.collect.ImmutableList;

import ch.qos.logback.classic.Level;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mothertree.api.ClauseNode;
import org.mothertree.fixture.GenesisCorpus;
import org.mothertree.junit.LogCustomizer;

public class MemoryCorpusSnapshotTest {

    private final LogCustomizer logs = LogCustomizer.forLogger(MemoryCorpusSnapshot.class)
            .enable(Level.WARN).filter(Level.WARN).create();

    @Before
    public void before() {
        logs.starting();
    }

    @After
    public void after() {
        logs.finished();
    }

    @Test
    public void documentOrder() {
        MemoryCorpusSnapshot corpus = MemoryCorpusSnapshot.builder()
                .add(clause(30, 2, 20, 25, 10, "x", "y", "z"))
                .add(clause(10, 1, 1, 5, null, "x", "y", "z"))
                .add(clause(20, 1, 6, 19, 10, "x", "y", "z"))
                .build();
        List<ClauseNode> nodes = corpus.getNodes();
        assertEquals(3, corpus.size());
        assertEquals(10, nodes.get(0).getId());
        assertEquals(20, nodes.get(1).getId());
        assertEquals(30, nodes.get(2).getId());
    }

    @Test
    public void lookup() {
        MemoryCorpusSnapshot corpus = GenesisCorpus.create();
        assertEquals(GenesisCorpus.SIZE, corpus.size());
        assertTrue(corpus.hasNode(GenesisCorpus.V2_FIRST));
        assertFalse(corpus.hasNode(1));
        assertNull(corpus.getNode(1));
        assertNull(corpus.getOriginalMother(1));
        assertNull(corpus.getOriginalMother(GenesisCorpus.V1_ROOT));
        assertEquals(Integer.valueOf(GenesisCorpus.V2_ROOT),
                corpus.getOriginalMother(GenesisCorpus.V2_FIRST));
        assertEquals(ImmutableList.of(GenesisCorpus.BOOK), corpus.getBookNames());
    }

    @Test
    public void booksInFirstSeenOrder() {
        MemoryCorpusSnapshot corpus = MemoryCorpusSnapshot.builder()
                .add(ClauseNode.builder(1).slots(1, 1).section("Genesis", 50, 26).build())
                .add(ClauseNode.builder(2).slots(2, 2).section("Exodus", 1, 1).build())
                .add(ClauseNode.builder(3).slots(3, 3).section("Exodus", 1, 2).build())
                .build();
        assertEquals(ImmutableList.of("Genesis", "Exodus"), corpus.getBookNames());
    }

    @Test
    public void idsOutOfDocumentOrder() {
        MemoryCorpusSnapshot.Builder builder = MemoryCorpusSnapshot.builder()
                .add(clause(10, 1, 50, 55, null, "x", "y", "z"))
                .add(clause(20, 1, 1, 5, null, "x", "y", "z"));
        try {
            builder.build();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("not in document order"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void duplicateId() {
        MemoryCorpusSnapshot.builder()
                .add(clause(10, 1, 1, 5, null, "x", "y", "z"))
                .add(clause(10, 1, 6, 8, null, "x", "y", "z"));
    }

    @Test
    public void danglingMotherIsReported() {
        MemoryCorpusSnapshot corpus = MemoryCorpusSnapshot.builder()
                .add(clause(10, 1, 1, 5, 3, "x", "y", "z"))
                .build();
        assertEquals(Integer.valueOf(3), corpus.getOriginalMother(10));
        assertEquals(ImmutableList.of("Clause 10 refers to unknown mother 3"), logs.getLogs());
    }
}
