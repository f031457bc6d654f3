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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.mothertree.api.ClauseNode;
import org.mothertree.api.Edge;
import org.mothertree.api.EdgeSource;

/**
 * Result of a projection: the clauses to show, which of them are in scope,
 * and their effective mothers. All collections are in document order.
 */
public final class EffectiveTree {

    public static final EffectiveTree EMPTY = new EffectiveTree(
            ImmutableMap.<Integer, ClauseNode>of(), Collections.<Integer, Integer>emptyMap(),
            ImmutableSet.<Integer>of(), ImmutableSet.<Integer>of());

    private final Map<Integer, ClauseNode> nodes;

    /** may contain {@code null} values for roots */
    private final Map<Integer, Integer> mothers;

    private final Set<Integer> inScope;

    private final Set<Integer> edited;

    private final ListMultimap<Integer, ClauseNode> children;

    EffectiveTree(Map<Integer, ClauseNode> nodes, Map<Integer, Integer> mothers,
                  Set<Integer> inScope, Set<Integer> edited) {
        this.nodes = nodes;
        this.mothers = mothers;
        this.inScope = inScope;
        this.edited = edited;
        ImmutableListMultimap.Builder<Integer, ClauseNode> index = ImmutableListMultimap.builder();
        for (Map.Entry<Integer, Integer> e : mothers.entrySet()) {
            if (e.getValue() != null) {
                index.put(e.getValue(), nodes.get(e.getKey()));
            }
        }
        this.children = index.build();
    }

    @NotNull
    public List<ClauseNode> getNodes() {
        return ImmutableList.copyOf(nodes.values());
    }

    @Nullable
    public ClauseNode getNode(int id) {
        return nodes.get(id);
    }

    public boolean contains(int id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public boolean isInScope(int id) {
        return inScope.contains(id);
    }

    @NotNull
    public Set<Integer> getInScopeIds() {
        return inScope;
    }

    /**
     * @return the effective mother of a clause of this tree
     */
    @Nullable
    public Integer getMother(int id) {
        return mothers.get(id);
    }

    /**
     * @return one edge per clause of this tree, ordered by the source clause
     */
    @NotNull
    public List<Edge> getEdges() {
        List<Edge> edges = Lists.newArrayListWithCapacity(mothers.size());
        for (Map.Entry<Integer, Integer> e : mothers.entrySet()) {
            int from = e.getKey();
            edges.add(new Edge(from, e.getValue(), EdgeSource.of(edited.contains(from))));
        }
        return edges;
    }

    /**
     * @return the children of {@code id} that are part of this tree
     */
    @NotNull
    public List<ClauseNode> getChildren(int id) {
        return children.get(id);
    }

    @Override
    public String toString() {
        return "EffectiveTree{nodes=" + nodes.keySet() + ", inScope=" + inScope + "}";
    }
}
