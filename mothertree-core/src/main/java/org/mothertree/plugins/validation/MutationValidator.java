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
package org.mothertree.plugins.validation;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.mothertree.api.Reason.CONTAINER_MISMATCH;
import static org.mothertree.api.Reason.CYCLE;
import static org.mothertree.api.Reason.DEPTH_LIMIT;
import static org.mothertree.api.Reason.MOTHER_ID_NOT_SMALLER;
import static org.mothertree.api.Reason.MOTHER_NOT_CLAUSE;
import static org.mothertree.api.Reason.NODE_NOT_FOUND;
import static org.mothertree.api.Reason.ROOTIFY_DISABLED;
import static org.mothertree.api.Reason.SAME_NODE;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.Sets;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.mothertree.api.ClauseNode;
import org.mothertree.api.MotherEditException;
import org.mothertree.plugins.overlay.OverlayStore;
import org.mothertree.spi.config.MotherTreeConfiguration;
import org.mothertree.spi.corpus.CorpusSnapshot;

/**
 * Checks a proposed mutation against the structural invariants of the
 * effective tree. Checks run in a fixed order and the first failing one
 * determines the reported reason. The validator only reads the store.
 * <p>
 * A new mother must precede its child in the text, which the corpus
 * expresses as a smaller id. Consequently a clause can only have ancestors
 * with smaller ids, and the explicit cycle check only matters for trees
 * that already deviate from that shape.
 */
public class MutationValidator {

    private final OverlayStore store;

    private final CorpusSnapshot corpus;

    private final MotherTreeConfiguration config;

    public MutationValidator(@NotNull OverlayStore store, @NotNull MotherTreeConfiguration config) {
        this.store = checkNotNull(store);
        this.corpus = store.getCorpus();
        this.config = checkNotNull(config);
    }

    /**
     * Validates making {@code newMother} the mother of {@code child}.
     *
     * @throws MotherEditException if the mutation is not allowed
     */
    public void validateReparent(int child, int newMother) throws MotherEditException {
        ClauseNode childNode = requireNode(child);
        ClauseNode motherNode = requireNode(newMother);
        if (!motherNode.isClause()) {
            throw new MotherEditException(MOTHER_NOT_CLAUSE,
                    "Mother candidate " + newMother + " is a " + motherNode.getKind());
        }
        if (newMother >= child) {
            throw new MotherEditException(MOTHER_ID_NOT_SMALLER,
                    "Mother " + newMother + " does not precede clause " + child);
        }
        if (config.isContainerEnforced()
                && !childNode.getContainerId().equals(motherNode.getContainerId())) {
            throw new MotherEditException(CONTAINER_MISMATCH,
                    "Clause " + child + " is in " + childNode.getContainerId()
                    + " but mother " + newMother + " is in " + motherNode.getContainerId());
        }
        if (child == newMother) {
            throw new MotherEditException(SAME_NODE, "Clause " + child + " cannot be its own mother");
        }
        if (getDescendants(child).contains(newMother)) {
            throw new MotherEditException(CYCLE,
                    "Mother " + newMother + " is a descendant of clause " + child);
        }
        checkDepth(newMother);
    }

    /**
     * Validates detaching {@code child} so that it becomes a root.
     *
     * @throws MotherEditException if the mutation is not allowed
     */
    public void validateRootify(int child) throws MotherEditException {
        requireNode(child);
        if (!config.isRootifyAllowed()) {
            throw new MotherEditException(ROOTIFY_DISABLED);
        }
        checkDepth(null);
    }

    /**
     * Computes all descendants of a clause under the current effective tree.
     *
     * @param id clause id
     * @return the descendants, not including {@code id} itself unless the
     *         tree contains a cycle through it
     */
    @NotNull
    public Set<Integer> getDescendants(int id) {
        ListMultimap<Integer, Integer> children = store.getChildren();
        Set<Integer> descendants = Sets.newHashSet();
        Deque<Integer> stack = new ArrayDeque<Integer>();
        stack.push(id);
        while (!stack.isEmpty()) {
            for (Integer c : children.get(stack.pop())) {
                if (descendants.add(c)) {
                    stack.push(c);
                }
            }
        }
        return descendants;
    }

    //------------------------------------------------------------< private >--

    private ClauseNode requireNode(int id) throws MotherEditException {
        ClauseNode node = corpus.getNode(id);
        if (node == null) {
            throw new MotherEditException(NODE_NOT_FOUND, "No clause with id " + id);
        }
        return node;
    }

    /**
     * Counts the clauses on the path from a root down to the child when
     * attached to {@code newMother}, the child included.
     */
    private void checkDepth(@Nullable Integer newMother) throws MotherEditException {
        Integer maxDepth = config.getMaxDepth();
        if (maxDepth == null) {
            return;
        }
        int depth = 0;
        Integer current = newMother;
        while (current != null) {
            depth++;
            if (depth > maxDepth) {
                throw new MotherEditException(DEPTH_LIMIT, "Maximum depth " + maxDepth + " exceeded");
            }
            current = store.getEffectiveMother(current);
        }
        if (depth + 1 > maxDepth) {
            throw new MotherEditException(DEPTH_LIMIT, "Maximum depth " + maxDepth + " exceeded");
        }
    }
}
