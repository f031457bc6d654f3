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
package org.mothertree.plugins.overlay;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * A committed change of the effective mother of one clause.
 */
public final class HistoryRecord {

    private final int child;

    private final Integer previous;

    private final Integer next;

    public HistoryRecord(int child, @Nullable Integer previous, @Nullable Integer next) {
        this.child = child;
        this.previous = previous;
        this.next = next;
    }

    public int getChild() {
        return child;
    }

    /**
     * @return the effective mother before the change
     */
    @Nullable
    public Integer getPrevious() {
        return previous;
    }

    /**
     * @return the effective mother after the change
     */
    @Nullable
    public Integer getNext() {
        return next;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof HistoryRecord)) {
            return false;
        }
        HistoryRecord that = (HistoryRecord) other;
        return child == that.child
                && Objects.equals(previous, that.previous)
                && Objects.equals(next, that.next);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, previous, next);
    }

    @Override
    public String toString() {
        return child + ": " + previous + " -> " + next;
    }
}
