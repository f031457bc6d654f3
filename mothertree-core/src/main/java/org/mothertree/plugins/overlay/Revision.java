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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.mothertree.stats.Clock;

/**
 * Version token of an overlay store. The string form is
 * {@code r<timestamp>-<counter>} with both parts in hex, the counter
 * disambiguating revisions created within the same millisecond.
 */
public final class Revision {

    private final long timestamp;

    private final int counter;

    Revision(long timestamp, int counter) {
        this.timestamp = timestamp;
        this.counter = counter;
    }

    /**
     * Creates the revision following {@code previous}. The result is always
     * newer than {@code previous}, even if the clock went backwards.
     *
     * @param clock the clock to read the timestamp from
     * @param previous the current revision, or {@code null} for the first one
     * @return a new revision
     */
    @NotNull
    static Revision next(@NotNull Clock clock, @Nullable Revision previous) {
        long timestamp = checkNotNull(clock).getTimeMonotonic();
        if (previous == null) {
            return new Revision(timestamp, 0);
        }
        if (timestamp <= previous.timestamp) {
            return new Revision(previous.timestamp, previous.counter + 1);
        }
        return new Revision(timestamp, 0);
    }

    public long getTimestamp() {
        return timestamp;
    }

    public int getCounter() {
        return counter;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Revision)) {
            return false;
        }
        Revision that = (Revision) other;
        return timestamp == that.timestamp && counter == that.counter;
    }

    @Override
    public int hashCode() {
        return (int) (timestamp ^ (timestamp >>> 32)) ^ counter;
    }

    @Override
    public String toString() {
        return "r" + Long.toHexString(timestamp) + "-" + Integer.toHexString(counter);
    }
}
