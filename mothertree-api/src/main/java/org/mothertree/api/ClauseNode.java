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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable clause of the base corpus together with its original mother
 * link. Instances are supplied once by the corpus provider and never change.
 * <p>
 * The identifier doubles as document position: a clause with a smaller id
 * appears earlier in the text. Linguistic tags are carried opaquely, the
 * editor never interprets them.
 */
public final class ClauseNode {

    /**
     * Kind of every node handled by the editor.
     */
    public static final String CLAUSE = "clause";

    /** Tag names with a dedicated accessor. */
    public static final String TYP = "typ";
    public static final String RELA = "rela";
    public static final String CODE = "code";
    public static final String TXT = "txt";
    public static final String DOMAIN = "domain";
    public static final String INSTRUCTION = "instruction";

    private final int id;
    private final int slotsStart;
    private final int slotsEnd;
    private final String label;
    private final String containerId;
    private final Integer originalMother;
    private final String book;
    private final int chapter;
    private final int verse;
    private final String kind;
    private final Map<String, String> tags;
    private final List<String> coreFunctions;
    private final String reference;

    private ClauseNode(Builder builder) {
        this.id = builder.id;
        this.slotsStart = builder.slotsStart;
        this.slotsEnd = builder.slotsEnd;
        this.label = builder.label;
        this.containerId = builder.containerId;
        this.originalMother = builder.originalMother;
        this.book = builder.book;
        this.chapter = builder.chapter;
        this.verse = builder.verse;
        this.kind = builder.kind;
        this.tags = ImmutableMap.copyOf(builder.tags);
        this.coreFunctions = ImmutableList.copyOf(builder.coreFunctions);
        this.reference = builder.reference;
    }

    @NotNull
    public static Builder builder(int id) {
        return new Builder(id);
    }

    public int getId() {
        return id;
    }

    public int getSlotsStart() {
        return slotsStart;
    }

    public int getSlotsEnd() {
        return slotsEnd;
    }

    /**
     * Number of slots covered by this clause, or {@code 0} if the provider
     * did not report an end slot.
     */
    public int getSlotCount() {
        if (slotsEnd <= 0) {
            return 0;
        }
        return Math.max(1, slotsEnd - slotsStart + 1);
    }

    @NotNull
    public String getLabel() {
        return label;
    }

    @NotNull
    public String getContainerId() {
        return containerId;
    }

    @Nullable
    public Integer getOriginalMother() {
        return originalMother;
    }

    @NotNull
    public String getBook() {
        return book;
    }

    public int getChapter() {
        return chapter;
    }

    public int getVerse() {
        return verse;
    }

    @NotNull
    public String getKind() {
        return kind;
    }

    public boolean isClause() {
        return CLAUSE.equals(kind);
    }

    /**
     * All linguistic tags of this clause. Absent tags are not contained.
     */
    @NotNull
    public Map<String, String> getTags() {
        return tags;
    }

    @Nullable
    public String getTag(@NotNull String name) {
        return tags.get(name);
    }

    @Nullable
    public String getTyp() {
        return tags.get(TYP);
    }

    @Nullable
    public String getRela() {
        return tags.get(RELA);
    }

    @Nullable
    public String getCode() {
        return tags.get(CODE);
    }

    @NotNull
    public List<String> getCoreFunctions() {
        return coreFunctions;
    }

    @NotNull
    public String getReference() {
        return reference;
    }

    //------------------------------------------------------------< Object >--

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ClauseNode)) {
            return false;
        }
        ClauseNode that = (ClauseNode) other;
        return id == that.id
                && slotsStart == that.slotsStart
                && slotsEnd == that.slotsEnd
                && chapter == that.chapter
                && verse == that.verse
                && Objects.equals(originalMother, that.originalMother)
                && label.equals(that.label)
                && containerId.equals(that.containerId)
                && book.equals(that.book)
                && kind.equals(that.kind)
                && tags.equals(that.tags)
                && coreFunctions.equals(that.coreFunctions)
                && reference.equals(that.reference);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return "Clause{" + id + " " + containerId + ", mother=" + originalMother + "}";
    }

    //-----------------------------------------------------------< Builder >--

    public static final class Builder {

        private final int id;
        private int slotsStart;
        private int slotsEnd;
        private String label = "";
        private String containerId = "";
        private Integer originalMother;
        private String book = "";
        private int chapter;
        private int verse;
        private String kind = CLAUSE;
        private final Map<String, String> tags = new LinkedHashMap<>();
        private List<String> coreFunctions = ImmutableList.of();
        private String reference = "";

        private Builder(int id) {
            this.id = id;
        }

        public Builder slots(int start, int end) {
            checkArgument(end == 0 || end >= start,
                    "Slot range of clause %s is reversed: %s-%s", id, start, end);
            this.slotsStart = start;
            this.slotsEnd = end;
            return this;
        }

        public Builder label(@NotNull String label) {
            this.label = checkNotNull(label);
            return this;
        }

        public Builder container(@NotNull String containerId) {
            this.containerId = checkNotNull(containerId);
            return this;
        }

        public Builder mother(@Nullable Integer originalMother) {
            this.originalMother = originalMother;
            return this;
        }

        public Builder section(@NotNull String book, int chapter, int verse) {
            this.book = checkNotNull(book);
            this.chapter = chapter;
            this.verse = verse;
            return this;
        }

        public Builder kind(@NotNull String kind) {
            this.kind = checkNotNull(kind);
            return this;
        }

        /**
         * Sets a linguistic tag. {@code null} or empty values are dropped,
         * the same way the corpus reports missing features.
         */
        public Builder tag(@NotNull String name, @Nullable String value) {
            checkNotNull(name);
            if (value == null || value.isEmpty()) {
                tags.remove(name);
            } else {
                tags.put(name, value);
            }
            return this;
        }

        public Builder coreFunctions(@NotNull List<String> functions) {
            this.coreFunctions = ImmutableList.copyOf(functions);
            return this;
        }

        public Builder reference(@NotNull String reference) {
            this.reference = checkNotNull(reference);
            return this;
        }

        @NotNull
        public ClauseNode build() {
            return new ClauseNode(this);
        }
    }
}
