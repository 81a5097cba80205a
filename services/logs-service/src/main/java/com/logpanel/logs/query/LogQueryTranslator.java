package com.logpanel.logs.query;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

// Quoted text is never rewritten; input the stages do not recognize passes through.
@Component
public class LogQueryTranslator {
    private static final Logger logger = LoggerFactory.getLogger(LogQueryTranslator.class);

    public static final String MATCH_ALL = "*";

    private static final Pattern FACET_KEY = Pattern.compile(
        "(?<![^\\s(])(-?)(@?)(" + String.join("|", facetNames()) + ")\\s*:\\s*"
    );
    private static final Pattern LEVEL_KEY = Pattern.compile(
        "(?i)(?<![^\\s(])(-?)(" + FacetCatalog.LEVEL_ATTRIBUTE + "|" + FacetCatalog.LEGACY_LEVEL_ATTRIBUTE + ")\\s*:\\s*"
    );
    private static final Pattern LEVEL_WORD = Pattern.compile(
        "(?i)(?<![\\w.-])(" + String.join("|", FacetCatalog.LEVELS) + ")(?![\\w.-])"
    );
    private static final Pattern BOOLEAN_WORD = Pattern.compile("(?i)(?<![\\w@.:*-])(and|or|not)(?![\\w@.:*-])");
    private static final Pattern WILDCARD_RUN = Pattern.compile("([\\w.@:-])\\*{2,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String QUOTE_TRIGGERS = "()[]{}";
    private static final String GROUP_OPENERS = "([{";
    private static final String GROUP_CLOSERS = ")]}";

    private static final List<UnaryOperator<String>> STAGES = List.of(
        LogQueryTranslator::defaultEmpty,
        LogQueryTranslator::normalizeFacets,
        LogQueryTranslator::normalizeLevels,
        LogQueryTranslator::normalizeBooleanOperators,
        LogQueryTranslator::collapseWildcards,
        LogQueryTranslator::collapseWhitespace
    );

    public String translate(String raw) {
        String query = raw;
        for (UnaryOperator<String> stage : STAGES) {
            query = stage.apply(query);
        }
        warnOnInlineTimeFilter(query);
        logger.debug("logs_query_translated raw={} translated={}", raw, query);
        return query;
    }

    static String defaultEmpty(String query) {
        if (query == null || query.isBlank()) {
            return MATCH_ALL;
        }
        return query;
    }

    static String normalizeFacets(String query) {
        StringBuilder out = new StringBuilder(query.length() + 8);
        Matcher matcher = FACET_KEY.matcher(query);
        int last = 0;
        int searchFrom = 0;
        while (searchFrom <= query.length() && matcher.find(searchFrom)) {
            int start = matcher.start();
            if (insideQuotes(query, start)) {
                searchFrom = matcher.end();
                continue;
            }
            String negation = matcher.group(1);
            String prefix = matcher.group(2);
            String facet = matcher.group(3);
            String key = FacetCatalog.isCustomAttribute(facet) ? FacetCatalog.CUSTOM_PREFIX + facet : prefix + facet;
            boolean multiWord = "service".equals(facet) && prefix.isEmpty() && parenDepth(query, start) == 0;

            int valueStart = matcher.end();
            int valueEnd = scanValueEnd(query, valueStart, multiWord);
            out.append(query, last, start)
                .append(negation)
                .append(key)
                .append(':')
                .append(quoteIfNeeded(query.substring(valueStart, valueEnd)));
            last = valueEnd;
            searchFrom = Math.max(valueEnd, matcher.end());
        }
        out.append(query.substring(last));
        return out.toString();
    }

    static String normalizeLevels(String query) {
        StringBuilder out = new StringBuilder(query.length());
        Matcher matcher = LEVEL_KEY.matcher(query);
        int last = 0;
        int searchFrom = 0;
        while (searchFrom <= query.length() && matcher.find(searchFrom)) {
            int start = matcher.start();
            if (insideQuotes(query, start)) {
                searchFrom = matcher.end();
                continue;
            }
            int valueStart = matcher.end();
            int valueEnd = scanValueEnd(query, valueStart, false);
            String value = query.substring(valueStart, valueEnd);
            out.append(query, last, start)
                .append(matcher.group(1))
                .append(FacetCatalog.LEVEL_ATTRIBUTE)
                .append(':')
                .append(normalizeLevelValue(value));
            last = valueEnd;
            searchFrom = Math.max(valueEnd, matcher.end());
        }
        out.append(query.substring(last));
        return out.toString();
    }

    static String normalizeBooleanOperators(String query) {
        return rewriteOutsideQuotes(query, BOOLEAN_WORD, match -> match.group(1).toUpperCase(Locale.ROOT));
    }

    static String collapseWildcards(String query) {
        return rewriteOutsideQuotes(query, WILDCARD_RUN, match -> {
            if (tokenIsNegated(query, match.start())) {
                return null;
            }
            return match.group(1) + "*";
        });
    }

    static String collapseWhitespace(String query) {
        return WHITESPACE.matcher(query).replaceAll(" ").trim();
    }

    private static String normalizeLevelValue(String value) {
        if (value.isEmpty() || value.startsWith("\"")) {
            return value;
        }
        if (value.startsWith("(")) {
            return rewriteOutsideQuotes(value, LEVEL_WORD, match -> match.group(1).toUpperCase(Locale.ROOT));
        }
        if (FacetCatalog.isLevel(value)) {
            return value.toUpperCase(Locale.ROOT);
        }
        return value;
    }

    private static int scanValueEnd(String query, int valueStart, boolean multiWord) {
        int length = query.length();
        if (valueStart >= length) {
            return length;
        }
        char first = query.charAt(valueStart);
        if (first == '"') {
            int close = query.indexOf('"', valueStart + 1);
            return close < 0 ? length : close + 1;
        }
        int group = GROUP_OPENERS.indexOf(first);
        if (group >= 0) {
            int close = matchingClose(query, valueStart, first, GROUP_CLOSERS.charAt(group));
            if (close >= 0) {
                return close;
            }
        }

        int end = tokenEnd(query, valueStart);
        if (!multiWord) {
            return end;
        }
        while (end < length && query.charAt(end) != ')') {
            int wordStart = end;
            while (wordStart < length && Character.isWhitespace(query.charAt(wordStart))) {
                wordStart++;
            }
            if (wordStart >= length) {
                break;
            }
            int wordEnd = wordStart;
            while (wordEnd < length && !Character.isWhitespace(query.charAt(wordEnd))) {
                wordEnd++;
            }
            String word = query.substring(wordStart, wordEnd);
            if (endsValue(word)) {
                break;
            }
            int close = unmatchedClose(word);
            if (close >= 0) {
                if (close > 0) {
                    end = wordStart + close;
                }
                break;
            }
            end = wordEnd;
        }
        return end;
    }

    private static boolean endsValue(String word) {
        if (word.indexOf(':') >= 0) {
            return true;
        }
        char first = word.charAt(0);
        if (first == '-' || first == '(' || first == '"') {
            return true;
        }
        String upper = word.toUpperCase(Locale.ROOT);
        return "AND".equals(upper) || "OR".equals(upper) || "NOT".equals(upper);
    }

    // Whitespace or an unbalanced ')' ends a bare token; "web(1)" stays whole.
    private static int tokenEnd(String query, int from) {
        int depth = 0;
        int end = from;
        while (end < query.length()) {
            char c = query.charAt(end);
            if (Character.isWhitespace(c)) {
                break;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    break;
                }
                depth--;
            }
            end++;
        }
        return end;
    }

    private static int unmatchedClose(String word) {
        int depth = 0;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    // Index just past the close matching the opener at open, or -1 if it never closes.
    private static int matchingClose(String query, int open, char opener, char closer) {
        int depth = 0;
        boolean quoted = false;
        for (int i = open; i < query.length(); i++) {
            char c = query.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && c == opener) {
                depth++;
            } else if (!quoted && c == closer) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    private static String quoteIfNeeded(String value) {
        if (value.isEmpty() || value.startsWith("\"") || isGroup(value)) {
            return value;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isWhitespace(c) || QUOTE_TRIGGERS.indexOf(c) >= 0) {
                return "\"" + value + "\"";
            }
        }
        return value;
    }

    private static boolean isGroup(String value) {
        int group = GROUP_OPENERS.indexOf(value.charAt(0));
        return group >= 0 && value.charAt(value.length() - 1) == GROUP_CLOSERS.charAt(group);
    }

    private static boolean tokenIsNegated(String query, int index) {
        int start = index;
        while (start > 0) {
            char previous = query.charAt(start - 1);
            if (Character.isWhitespace(previous) || previous == '(') {
                break;
            }
            start--;
        }
        return start < query.length() && query.charAt(start) == '-';
    }

    private static boolean insideQuotes(String query, int index) {
        boolean quoted = false;
        for (int i = 0; i < index && i < query.length(); i++) {
            if (query.charAt(i) == '"') {
                quoted = !quoted;
            }
        }
        return quoted;
    }

    private static int parenDepth(String query, int index) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < index && i < query.length(); i++) {
            char c = query.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')' && depth > 0) {
                depth--;
            }
        }
        return depth;
    }

    // A null replacement keeps the matched text.
    private static String rewriteOutsideQuotes(String input, Pattern pattern, Function<Matcher, String> replacement) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder out = new StringBuilder(input.length());
        while (matcher.find()) {
            String replaced = insideQuotes(input, matcher.start()) ? null : replacement.apply(matcher);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replaced == null ? matcher.group() : replaced));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static void warnOnInlineTimeFilter(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        for (String filter : FacetCatalog.INLINE_TIME_FILTERS) {
            if (lower.contains(filter)) {
                logger.warn("logs_query_inline_time_filter pattern={} query={}", filter, query);
                return;
            }
        }
    }

    private static List<String> facetNames() {
        return Stream.concat(FacetCatalog.RESERVED_FACETS.stream(), FacetCatalog.CUSTOM_FACETS.stream()).toList();
    }
}
