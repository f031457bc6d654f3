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

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * One step of a batch edit. A {@code null} new mother detaches the child.
 */
public final class BatchOperation {

    private final int child;

    private final Integer newMother;

    private BatchOperation(int child, @Nullable Integer newMother) {
        this.child = child;
        this.newMother = newMother;
    }

    public static BatchOperation reparent(int child, int newMother) {
        return new BatchOperation(child, newMother);
    }

    public static BatchOperation rootify(int child) {
        return new BatchOperation(child, null);
    }

    public static BatchOperation of(int child, @Nullable Integer newMother) {
        return new BatchOperation(child, newMother);
    }

    public int getChild() {
        return child;
    }

    @Nullable
    public Integer getNewMother() {
        return newMother;
    }

    public boolean isRootify() {
        return newMother == null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BatchOperation)) {
            return false;
        }
        BatchOperation that = (BatchOperation) other;
        return child == that.child && Objects.equals(newMother, that.newMother);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, newMother);
    }

    @Override
    public String toString() {
        return child + " -> " + newMother;
    }
}
