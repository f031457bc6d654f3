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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Read-only presentation of a (possibly scoped) effective tree. Nodes and
 * edges are in document order.
 */
public final class TreeView {

    private final List<Node> nodes;

    private final List<Edge> edges;

    private final String scope;

    private final String version;

    public TreeView(@NotNull List<Node> nodes, @NotNull List<Edge> edges,
                    @Nullable String scope, @NotNull String version) {
        this.nodes = ImmutableList.copyOf(nodes);
        this.edges = ImmutableList.copyOf(edges);
        this.scope = scope;
        this.version = checkNotNull(version);
    }

    @NotNull
    public List<Node> getNodes() {
        return nodes;
    }

    @NotNull
    public List<Edge> getEdges() {
        return edges;
    }

    /**
     * The scope this view was requested for, or {@code null} for the whole
     * corpus.
     */
    @Nullable
    public String getScope() {
        return scope;
    }

    @NotNull
    public String getVersion() {
        return version;
    }

    @Nullable
    public Node getNode(int id) {
        for (Node node : nodes) {
            if (node.getId() == id) {
                return node;
            }
        }
        return null;
    }

    @Nullable
    public Edge getEdge(int from) {
        for (Edge edge : edges) {
            if (edge.getFrom() == from) {
                return edge;
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public String toString() {
        return "TreeView{scope=" + scope + ", nodes=" + nodes.size()
                + ", edges=" + edges.size() + ", version=" + version + "}";
    }

    /**
     * A clause as shown in a view.
     */
    public static final class Node {

        private final ClauseNode clause;

        private final boolean inScope;

        private final List<ClauseNode> children;

        public Node(@NotNull ClauseNode clause, boolean inScope, @NotNull List<ClauseNode> children) {
            this.clause = checkNotNull(clause);
            this.inScope = inScope;
            this.children = ImmutableList.copyOf(children);
        }

        public int getId() {
            return clause.getId();
        }

        @NotNull
        public ClauseNode getClause() {
            return clause;
        }

        /**
         * {@code false} for clauses that are only shown as context (ancestors
         * and their siblings).
         */
        public boolean isInScope() {
            return inScope;
        }

        public boolean isDraggable() {
            return clause.isClause();
        }

        /**
         * Effective children of this clause that are part of the view.
         */
        @NotNull
        public List<ClauseNode> getChildren() {
            return children;
        }

        @Override
        public String toString() {
            return clause + (inScope ? "" : " (context)");
        }
    }
}
