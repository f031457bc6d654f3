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
package org.mothertree.plugins.tree;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.mothertree.api.ClauseNode;
import org.mothertree.plugins.overlay.OverlayStore;
import org.mothertree.spi.corpus.CorpusSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the effective tree, optionally narrowed to a {@link Scope}.
 * <p>
 * A scoped projection is expanded with context so that it renders as a
 * connected tree: first every ancestor of an in-scope clause is added,
 * then every sibling (same effective mother) of any clause present at that
 * point. Siblings are not expanded further and roots do not pull in other
 * roots.
 * <p>
 * Projection is a query and never fails: an unparseable scope yields
 * {@link EffectiveTree#EMPTY}. Every edge of a projected tree points to a
 * clause of that tree or is a root edge.
 */
public class TreeProjector {

    private static final Logger LOG = LoggerFactory.getLogger(TreeProjector.class);

    private final OverlayStore store;

    private final CorpusSnapshot corpus;

    public TreeProjector(@NotNull OverlayStore store) {
        this.store = checkNotNull(store);
        this.corpus = store.getCorpus();
    }

    /**
     * @param scope scope expression, or {@code null} or empty for the whole
     *              corpus
     * @return the projected tree
     */
    @NotNull
    public EffectiveTree project(@Nullable String scope) {
        if (scope == null || scope.isEmpty()) {
            return projectAll();
        }
        Scope parsed;
        try {
            parsed = Scope.parse(scope, corpus.getBookNames());
        } catch (IllegalArgumentException e) {
            LOG.debug("Ignoring unparseable scope '{}': {}", scope, e.getMessage());
            return EffectiveTree.EMPTY;
        }
        return project(parsed);
    }

    @NotNull
    public EffectiveTree project(@NotNull Scope scope) {
        Set<Integer> inScope = Sets.newHashSet();
        for (ClauseNode node : corpus.getNodes()) {
            if (scope.matches(node)) {
                inScope.add(node.getId());
            }
        }
        if (inScope.isEmpty()) {
            return EffectiveTree.EMPTY;
        }

        Map<Integer, Integer> mothers = store.getEffectiveMothers();
        Set<Integer> included = Sets.newHashSet(inScope);
        addAncestors(included, mothers);
        addSiblings(included, mothers, store.getChildren());

        List<ClauseNode> nodes = Lists.newArrayList();
        for (ClauseNode node : corpus.getNodes()) {
            if (included.contains(node.getId())) {
                nodes.add(node);
            }
        }
        LOG.debug("Projected scope {} to {} clauses ({} in scope)",
                scope, nodes.size(), inScope.size());
        return build(nodes, inScope, mothers);
    }

    private EffectiveTree projectAll() {
        List<ClauseNode> nodes = corpus.getNodes();
        Set<Integer> ids = Sets.newHashSetWithExpectedSize(nodes.size());
        for (ClauseNode node : nodes) {
            ids.add(node.getId());
        }
        return build(nodes, ids, store.getEffectiveMothers());
    }

    /**
     * Walks up from every clause in {@code included} until a root or an
     * already included clause is reached. Mothers missing from the corpus
     * are skipped.
     */
    private void addAncestors(Set<Integer> included, Map<Integer, Integer> mothers) {
        Deque<Integer> queue = new ArrayDeque<Integer>(included);
        while (!queue.isEmpty()) {
            Integer mother = mothers.get(queue.pop());
            if (mother != null && !included.contains(mother) && corpus.hasNode(mother)) {
                included.add(mother);
                queue.push(mother);
            }
        }
    }

    private static void addSiblings(Set<Integer> included, Map<Integer, Integer> mothers,
                                    ListMultimap<Integer, Integer> children) {
        for (Integer id : Lists.newArrayList(included)) {
            Integer mother = mothers.get(id);
            // siblings share the raw mother id, even one missing from the corpus
            if (mother != null) {
                included.addAll(children.get(mother));
            }
        }
    }

    private EffectiveTree build(List<ClauseNode> nodes, Set<Integer> inScope,
                                Map<Integer, Integer> allMothers) {
        ImmutableMap.Builder<Integer, ClauseNode> byId = ImmutableMap.builder();
        Map<Integer, Integer> mothers = new LinkedHashMap<Integer, Integer>();
        ImmutableSet.Builder<Integer> edited = ImmutableSet.builder();
        for (ClauseNode node : nodes) {
            int id = node.getId();
            byId.put(id, node);
            // mothers missing from the corpus project as roots
            Integer mother = allMothers.get(id);
            mothers.put(id, mother != null && corpus.hasNode(mother) ? mother : null);
            if (store.isEdited(id)) {
                edited.add(id);
            }
        }
        return new EffectiveTree(byId.build(), Collections.unmodifiableMap(mothers),
                ImmutableSet.copyOf(inScope), edited.build());
    }
}
