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

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Effective mother link of a single clause. A {@code null} target marks a
 * root.
 */
public final class Edge {

    private final int from;

    private final Integer to;

    private final EdgeSource source;

    public Edge(int from, @Nullable Integer to, @NotNull EdgeSource source) {
        this.from = from;
        this.to = to;
        this.source = checkNotNull(source);
    }

    public int getFrom() {
        return from;
    }

    @Nullable
    public Integer getTo() {
        return to;
    }

    public boolean isRoot() {
        return to == null;
    }

    @NotNull
    public EdgeSource getSource() {
        return source;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Edge)) {
            return false;
        }
        Edge that = (Edge) other;
        return from == that.from
                && Objects.equals(to, that.to)
                && source == that.source;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, source);
    }

    @Override
    public String toString() {
        return from + " -> " + to + " (" + source + ")";
    }
}
