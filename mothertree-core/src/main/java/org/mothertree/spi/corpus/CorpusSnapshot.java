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
package org.mothertree.spi.corpus;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.mothertree.api.ClauseNode;

/**
 * Read-only base corpus the editor works on. A snapshot is loaded once and
 * must not change for the lifetime of the editors using it.
 * <p>
 * Implementations guarantee that clause ids increase with document order:
 * the editor relies on this to refuse edits that would attach a clause to
 * a later one, which in turn keeps cycle detection sufficient.
 */
public interface CorpusSnapshot {

    /**
     * @param id clause id
     * @return the clause or {@code null} if there is none with that id
     */
    @Nullable
    ClauseNode getNode(int id);

    boolean hasNode(int id);

    /**
     * Original mother of a clause as delivered by the corpus.
     *
     * @param id clause id
     * @return the mother id or {@code null} for roots and unknown clauses
     */
    @Nullable
    Integer getOriginalMother(int id);

    /**
     * @return all clauses sorted by their first slot
     */
    @NotNull
    List<ClauseNode> getNodes();

    /**
     * @return the distinct book names in corpus order
     */
    @NotNull
    List<String> getBookNames();

    int size();
}
