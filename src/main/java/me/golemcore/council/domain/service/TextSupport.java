package me.golemcore.council.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword and label matching shared by scoring, advisors and heuristics.
 */
public final class TextSupport {

    private static final Pattern KEYWORD_PATTERN = Pattern.compile("\\b[\\w']{4,}\\b");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9]+");
    private static final double LABEL_CONTAINMENT_SIMILARITY = 0.95;

    private TextSupport() {
    }

    public static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /**
     * Distinct lower-case words of at least four characters, in order of first
     * appearance.
     */
    public static Set<String> extractKeywords(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        Matcher matcher = KEYWORD_PATTERN.matcher(normalize(text));
        while (matcher.find()) {
            keywords.add(matcher.group());
        }
        return keywords;
    }

    public static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : TOKEN_SPLIT.split(normalize(text))) {
            if (!token.isBlank()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new LinkedHashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new LinkedHashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    /**
     * Similarity of two short labels such as domain names or tags. Equal or
     * contained labels score 0.95, otherwise the token Jaccard index.
     */
    public static double labelSimilarity(String left, String right) {
        String a = normalizeLabel(left);
        String b = normalizeLabel(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b) || a.contains(b) || b.contains(a)) {
            return LABEL_CONTAINMENT_SIMILARITY;
        }
        return jaccard(tokenize(a), tokenize(b));
    }

    /**
     * True when {@code keyword} occurs in {@code text} starting at a word
     * boundary. Stems like "escalat" match "escalate", while "now" does not
     * match inside "know".
     */
    public static boolean containsKeyword(String text, String keyword) {
        String haystack = normalize(text);
        String needle = normalize(keyword);
        if (needle.isEmpty()) {
            return false;
        }
        int from = 0;
        while (true) {
            int index = haystack.indexOf(needle, from);
            if (index < 0) {
                return false;
            }
            if (index == 0 || !Character.isLetterOrDigit(haystack.charAt(index - 1))) {
                return true;
            }
            from = index + 1;
        }
    }

    public static boolean containsAny(String text, Collection<String> keywords) {
        for (String keyword : keywords) {
            if (containsKeyword(text, keyword)) {
                return true;
            }
        }
        return false;
    }

    public static int countMatches(String text, Collection<String> keywords) {
        int count = 0;
        for (String keyword : keywords) {
            if (containsKeyword(text, keyword)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Number of occurrences of a whole word, used for connective counting.
     */
    public static int countWord(String text, String word) {
        Pattern pattern = Pattern.compile("\\b" + Pattern.quote(normalize(word)) + "\\b");
        Matcher matcher = pattern.matcher(normalize(text));
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static String normalizeLabel(String label) {
        return normalize(label).replace('_', ' ').replace('-', ' ').trim();
    }
}
