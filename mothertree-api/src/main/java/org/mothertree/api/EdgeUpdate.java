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

import org.jetbrains.annotations.NotNull;

/**
 * The edge affected by a successful edit, undo or redo, together with the
 * version of the editor right after the change.
 */
public final class EdgeUpdate {

    private final Edge edge;

    private final String version;

    public EdgeUpdate(@NotNull Edge edge, @NotNull String version) {
        this.edge = checkNotNull(edge);
        this.version = checkNotNull(version);
    }

    @NotNull
    public Edge getEdge() {
        return edge;
    }

    @NotNull
    public String getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return edge + " @ " + version;
    }
}
