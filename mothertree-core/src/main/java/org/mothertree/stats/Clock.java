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
package org.mothertree.stats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of millisecond timestamps for version tokens. Editors take a clock
 * at construction so that tests can run against a {@link Virtual} one.
 */
public abstract class Clock {

    private long monotonic = 0;

    /**
     * Returns the current time in milliseconds since the epoch.
     *
     * @see System#currentTimeMillis()
     * @return current time in milliseconds since the epoch
     */
    public abstract long getTime();

    /**
     * Returns a monotonically increasing timestamp based on the current time.
     * A call to this method will always return a value that is greater than
     * or equal to a value returned by any previous call, even when the
     * system time is adjusted backwards.
     *
     * @return monotonically increasing timestamp
     */
    public synchronized long getTimeMonotonic() {
        long now = getTime();
        if (now > monotonic) {
            monotonic = now;
        } else {
            now = monotonic;
        }
        return now;
    }

    /**
     * Simple clock implementation based on {@link System#currentTimeMillis()}.
     */
    public static final Clock SIMPLE = new Clock() {
        @Override
        public long getTime() {
            return System.currentTimeMillis();
        }

        @Override
        public String toString() {
            return "Clock.SIMPLE";
        }
    };

    /**
     * A virtual clock that has no connection to the actual system time.
     * Instead the clock maintains an internal counter that is only moved
     * by {@link #advance(long)}, so that several edits can share the same
     * millisecond.
     */
    public static class Virtual extends Clock {

        private final AtomicLong time;

        public Virtual() {
            this(0);
        }

        public Virtual(long start) {
            this.time = new AtomicLong(start);
        }

        @Override
        public long getTime() {
            return time.get();
        }

        public void advance(long millis) {
            time.addAndGet(millis);
        }

        public void set(long millis) {
            time.set(millis);
        }

        @Override
        public String toString() {
            return "Clock.Virtual";
        }
    }
}
