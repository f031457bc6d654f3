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
package org.mothertree.core;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.mothertree.api.BatchOperation;
import org.mothertree.api.ClauseNode;
import org.mothertree.api.Edge;
import org.mothertree.api.EdgeUpdate;
import org.mothertree.api.EditResult;
import org.mothertree.api.MotherEditException;
import org.mothertree.api.MotherEditor;
import org.mothertree.api.Reason;
import org.mothertree.api.TreeView;
import org.mothertree.plugins.batch.BatchCoordinator;
import org.mothertree.plugins.overlay.OverlayStore;
import org.mothertree.plugins.tree.EffectiveTree;
import org.mothertree.plugins.tree.TreeProjector;
import org.mothertree.plugins.validation.MutationValidator;
import org.mothertree.spi.config.MotherTreeConfiguration;
import org.mothertree.spi.corpus.CorpusSnapshot;
import org.mothertree.stats.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link MotherEditor} wiring an {@link OverlayStore} with its
 * projector, validator and batch coordinator.
 * <p>
 * Each instance owns its edit state for its whole lifetime. Create one
 * editor per corpus and share it between callers that serialise access.
 */
public class MotherEditorImpl implements MotherEditor {

    private static final Logger LOG = LoggerFactory.getLogger(MotherEditorImpl.class);

    private final OverlayStore store;

    private final TreeProjector projector;

    private final BatchCoordinator coordinator;

    public MotherEditorImpl(@NotNull CorpusSnapshot corpus,
                            @NotNull MotherTreeConfiguration config,
                            @NotNull Clock clock) {
        this.store = new OverlayStore(corpus, clock);
        this.projector = new TreeProjector(store);
        this.coordinator = new BatchCoordinator(store, new MutationValidator(store, checkNotNull(config)));
        LOG.info("Created mother editor for {} clauses with {}", corpus.size(), config);
    }

    public MotherEditorImpl(@NotNull CorpusSnapshot corpus, @NotNull MotherTreeConfiguration config) {
        this(corpus, config, Clock.SIMPLE);
    }

    public MotherEditorImpl(@NotNull CorpusSnapshot corpus) {
        this(corpus, MotherTreeConfiguration.DEFAULT);
    }

    @NotNull
    @Override
    public TreeView getTree(@Nullable String scope) {
        return toView(projector.project(scope), scope);
    }

    @NotNull
    @Override
    public EditResult<EdgeUpdate> reparent(int child, int newMother) {
        return commit(BatchOperation.reparent(child, newMother));
    }

    @NotNull
    @Override
    public EditResult<EdgeUpdate> rootify(int child) {
        return commit(BatchOperation.rootify(child));
    }

    @NotNull
    @Override
    public EditResult<TreeView> reparentBatch(@NotNull List<BatchOperation> operations) {
        List<BatchOperation> ops = ImmutableList.copyOf(operations);
        try {
            coordinator.applyBatch(ops);
        } catch (MotherEditException e) {
            LOG.debug("Batch refused: {}", e.getMessage());
            return EditResult.failure(e);
        }
        return EditResult.success(getTree(null));
    }

    @NotNull
    @Override
    public EditResult<EdgeUpdate> undo() {
        return toUpdate(store.undo());
    }

    @NotNull
    @Override
    public EditResult<EdgeUpdate> redo() {
        return toUpdate(store.redo());
    }

    @NotNull
    @Override
    public String reset() {
        store.reset();
        return store.getVersion();
    }

    @NotNull
    @Override
    public String getVersion() {
        return store.getVersion();
    }

    /**
     * The store backing this editor, for callers that need direct access to
     * the overlay or history.
     */
    @NotNull
    public OverlayStore getStore() {
        return store;
    }

    //------------------------------------------------------------< private >--

    private EditResult<EdgeUpdate> commit(BatchOperation operation) {
        try {
            coordinator.apply(operation);
        } catch (MotherEditException e) {
            LOG.debug("Edit {} refused: {}", operation, e.getMessage());
            return EditResult.failure(e);
        }
        Edge edge = store.getEdge(operation.getChild());
        return EditResult.success(new EdgeUpdate(edge, store.getVersion()));
    }

    private EditResult<EdgeUpdate> toUpdate(@Nullable Edge edge) {
        if (edge == null) {
            return EditResult.failure(Reason.NO_HISTORY);
        }
        return EditResult.success(new EdgeUpdate(edge, store.getVersion()));
    }

    private TreeView toView(EffectiveTree tree, @Nullable String scope) {
        List<TreeView.Node> nodes = Lists.newArrayListWithCapacity(tree.size());
        for (ClauseNode node : tree.getNodes()) {
            nodes.add(new TreeView.Node(node, tree.isInScope(node.getId()),
                    tree.getChildren(node.getId())));
        }
        return new TreeView(nodes, tree.getEdges(), scope, store.getVersion());
    }
}
