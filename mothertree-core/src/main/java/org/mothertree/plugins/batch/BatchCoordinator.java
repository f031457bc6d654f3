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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.mothertree.api.BatchOperation;
import org.mothertree.api.MotherEditException;
import org.mothertree.plugins.overlay.HistoryRecord;
import org.mothertree.plugins.overlay.OverlaySnapshot;
import org.mothertree.plugins.overlay.OverlayStore;
import org.mothertree.plugins.validation.MutationValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates and commits mother edits, either one at a time or as an
 * all-or-nothing batch.
 * <p>
 * Operations of a batch are validated sequentially: each one sees the
 * effects of the operations before it. The first failure restores the
 * state captured before the batch, so partial batches are never
 * observable.
 */
public class BatchCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(BatchCoordinator.class);

    private final OverlayStore store;

    private final MutationValidator validator;

    public BatchCoordinator(@NotNull OverlayStore store, @NotNull MutationValidator validator) {
        this.store = checkNotNull(store);
        this.validator = checkNotNull(validator);
    }

    /**
     * Validates and commits a single operation. Operations with a
     * {@code null} mother are validated as rootify, all others as reparent.
     *
     * @return the committed change
     * @throws MotherEditException if validation fails; nothing is committed
     */
    @NotNull
    public HistoryRecord apply(@NotNull BatchOperation operation) throws MotherEditException {
        Integer newMother = operation.getNewMother();
        if (newMother == null) {
            validator.validateRootify(operation.getChild());
        } else {
            validator.validateReparent(operation.getChild(), newMother);
        }
        return store.setMother(operation.getChild(), newMother);
    }

    /**
     * Applies all operations in order, or none of them.
     *
     * @param operations the operations to apply
     * @throws MotherEditException the error of the first failing operation,
     *         after all effects of the batch have been rolled back
     */
    public void applyBatch(@NotNull List<BatchOperation> operations) throws MotherEditException {
        checkNotNull(operations);
        OverlaySnapshot snapshot = store.snapshot();
        boolean success = false;
        int index = 0;
        try {
            for (BatchOperation operation : operations) {
                apply(operation);
                index++;
            }
            success = true;
        } finally {
            if (!success) {
                store.restore(snapshot);
                LOG.info("Rolled back batch of {} operations, operation {} ({}) failed",
                        operations.size(), index + 1, operations.get(index));
            }
        }
        LOG.debug("Applied batch of {} operations at {}", operations.size(), store.getRevision());
    }
}
