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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.mothertree.api.ClauseNode;
import org.mothertree.spi.corpus.CorpusSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Basic in-memory corpus snapshot. Corpus providers hand their clauses to a
 * {@link Builder}, which checks the document order precondition once.
 */
public class MemoryCorpusSnapshot implements CorpusSnapshot {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryCorpusSnapshot.class);

    static final Comparator<ClauseNode> DOCUMENT_ORDER =
            Comparator.comparingInt(ClauseNode::getSlotsStart).thenComparingInt(ClauseNode::getId);

    private final Map<Integer, ClauseNode> nodes;

    private final List<ClauseNode> ordered;

    private final List<String> books;

    private MemoryCorpusSnapshot(List<ClauseNode> ordered, List<String> books) {
        ImmutableMap.Builder<Integer, ClauseNode> byId = ImmutableMap.builder();
        for (ClauseNode node : ordered) {
            byId.put(node.getId(), node);
        }
        this.nodes = byId.build();
        this.ordered = ImmutableList.copyOf(ordered);
        this.books = ImmutableList.copyOf(books);
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    @Override
    public ClauseNode getNode(int id) {
        return nodes.get(id);
    }

    @Override
    public boolean hasNode(int id) {
        return nodes.containsKey(id);
    }

    @Nullable
    @Override
    public Integer getOriginalMother(int id) {
        ClauseNode node = nodes.get(id);
        return node == null ? null : node.getOriginalMother();
    }

    @NotNull
    @Override
    public List<ClauseNode> getNodes() {
        return ordered;
    }

    @NotNull
    @Override
    public List<String> getBookNames() {
        return books;
    }

    @Override
    public int size() {
        return ordered.size();
    }

    @Override
    public String toString() {
        return "MemoryCorpusSnapshot{" + ordered.size() + " clauses, books=" + books + "}";
    }

    //-----------------------------------------------------------< Builder >--

    public static class Builder {

        private final Map<Integer, ClauseNode> nodes = Maps.newLinkedHashMap();

        private Builder() {
        }

        /**
         * Adds a clause.
         *
         * @throws IllegalStateException if a clause with the same id was
         *         already added
         */
        public Builder add(@NotNull ClauseNode node) {
            checkNotNull(node);
            ClauseNode existing = nodes.put(node.getId(), node);
            checkState(existing == null, "Duplicate clause id %s", node.getId());
            return this;
        }

        public Builder addAll(@NotNull Iterable<ClauseNode> nodes) {
            for (ClauseNode node : nodes) {
                add(node);
            }
            return this;
        }

        /**
         * Builds the snapshot.
         *
         * @throws IllegalStateException if clause ids do not increase with
         *         the position of the clauses in the text
         */
        @NotNull
        public MemoryCorpusSnapshot build() {
            List<ClauseNode> ordered = Lists.newArrayList(nodes.values());
            ordered.sort(DOCUMENT_ORDER);

            ClauseNode previous = null;
            Set<String> books = new LinkedHashSet<>();
            for (ClauseNode node : ordered) {
                if (previous != null) {
                    checkState(previous.getId() < node.getId(),
                            "Clause ids are not in document order: %s (slot %s) precedes %s (slot %s)",
                            previous.getId(), previous.getSlotsStart(),
                            node.getId(), node.getSlotsStart());
                }
                Integer mother = node.getOriginalMother();
                if (mother != null && !nodes.containsKey(mother)) {
                    LOG.warn("Clause {} refers to unknown mother {}", node.getId(), mother);
                }
                books.add(node.getBook());
                previous = node;
            }
            LOG.debug("Loaded {} clauses in {} books", ordered.size(), books.size());
            return new MemoryCorpusSnapshot(ordered, Lists.newArrayList(books));
        }
    }
}
