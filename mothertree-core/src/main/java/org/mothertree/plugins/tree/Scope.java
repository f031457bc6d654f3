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
package org.mothertree.plugins.tree;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.mothertree.api.ClauseNode;

/**
 * Book/chapter/verse filter of the form {@code Book[.chapter[.verse[-verse]]]}.
 * Omitted parts match everything; verse ranges are inclusive.
 * <p>
 * The book part is matched against the book names of the corpus ignoring
 * case, underscores, blanks and dots. A unique prefix is enough, so
 * {@code Gen.1.4} selects verse 4 of the first chapter of Genesis.
 */
public final class Scope {

    private final String book;

    private final Integer chapter;

    private final Integer verseStart;

    private final Integer verseEnd;

    Scope(@NotNull String book, @Nullable Integer chapter,
          @Nullable Integer verseStart, @Nullable Integer verseEnd) {
        this.book = checkNotNull(book);
        this.chapter = chapter;
        this.verseStart = verseStart;
        this.verseEnd = verseEnd;
    }

    /**
     * Parses a scope expression.
     *
     * @param scope the expression
     * @param books book names of the corpus
     * @return the parsed scope
     * @throws IllegalArgumentException if the expression is blank, names an
     *         unknown or ambiguous book or has malformed numbers
     */
    @NotNull
    public static Scope parse(@NotNull String scope, @NotNull List<String> books) {
        String trimmed = scope.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("empty scope");
        }
        String[] parts = trimmed.split("\\.", -1);
        String book = resolveBook(parts[0], books);
        if (book == null) {
            throw new IllegalArgumentException("unknown book: " + parts[0]);
        }

        Integer chapter = null;
        Integer verseStart = null;
        Integer verseEnd = null;

        if (parts.length >= 2 && !parts[1].isEmpty()) {
            chapter = parseNumber(parts[1], "invalid chapter");
        }
        if (parts.length >= 3 && !parts[2].isEmpty()) {
            String verses = parts[2];
            int dash = verses.indexOf('-');
            if (dash >= 0) {
                verseStart = parseNumber(verses.substring(0, dash), "invalid verse range");
                verseEnd = parseNumber(verses.substring(dash + 1), "invalid verse range");
                if (verseEnd < verseStart) {
                    throw new IllegalArgumentException("invalid verse range ordering: " + verses);
                }
            } else {
                verseStart = parseNumber(verses, "invalid verse");
                verseEnd = verseStart;
            }
        }
        return new Scope(book, chapter, verseStart, verseEnd);
    }

    /**
     * Resolves a book token against the given names. An exact match wins,
     * otherwise the token must be a prefix of exactly one book.
     *
     * @return the book name or {@code null} if none or several books match
     */
    @Nullable
    static String resolveBook(@NotNull String token, @NotNull List<String> books) {
        String key = normalize(token);
        Set<String> matches = new LinkedHashSet<String>();
        for (String book : books) {
            String normalized = normalize(book);
            if (normalized.equals(key)) {
                return book;
            }
            if (normalized.startsWith(key)) {
                matches.add(book);
            }
        }
        return matches.size() == 1 ? matches.iterator().next() : null;
    }

    static String normalize(String value) {
        return value.replace("_", "").replace(" ", "").replace(".", "").toLowerCase();
    }

    private static int parseNumber(String value, String message) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(message + ": " + value, e);
        }
    }

    public boolean matches(@NotNull ClauseNode node) {
        if (!book.equals(node.getBook())) {
            return false;
        }
        if (chapter != null && chapter != node.getChapter()) {
            return false;
        }
        if (verseStart != null) {
            return verseStart <= node.getVerse() && node.getVerse() <= verseEnd;
        }
        return true;
    }

    @NotNull
    public String getBook() {
        return book;
    }

    @Nullable
    public Integer getChapter() {
        return chapter;
    }

    @Nullable
    public Integer getVerseStart() {
        return verseStart;
    }

    @Nullable
    public Integer getVerseEnd() {
        return verseEnd;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(book);
        if (chapter != null) {
            sb.append('.').append(chapter);
        }
        if (verseStart != null) {
            sb.append('.').append(verseStart);
            if (!verseStart.equals(verseEnd)) {
                sb.append('-').append(verseEnd);
            }
        }
        return sb.toString();
    }
}
