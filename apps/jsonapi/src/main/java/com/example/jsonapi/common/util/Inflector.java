package com.example.jsonapi.common.util;

import org.springframework.lang.NonNull;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * English inflection helpers used to derive canonical resource names.
 *
 * <p>Pluralization is idempotent: a word that is already plural is returned unchanged,
 * so {@code pluralize(pluralize(w)).equals(pluralize(w))} for every input.
 */
public final class Inflector {

    private static final Set<String> UNCOUNTABLE = Set.of(
            "equipment", "information", "rice", "money", "species", "series",
            "fish", "sheep", "jeans", "police", "news", "metadata", "feedback");

    private static final Map<String, String> IRREGULAR = Map.of(
            "person", "people",
            "man", "men",
            "woman", "women",
            "child", "children",
            "sex", "sexes",
            "move", "moves",
            "zombie", "zombies",
            "tooth", "teeth",
            "foot", "feet",
            "goose", "geese");

    // Evaluated top to bottom, first match wins
    private static final List<Rule> RULES = List.of(
            new Rule("(quiz)$", "$1zes"),
            new Rule("^(oxen)$", "$1"),
            new Rule("^(ox)$", "$1en"),
            new Rule("([ml])ice$", "$1ice"),
            new Rule("([ml])ouse$", "$1ice"),
            new Rule("(matr|vert|ind)(?:ix|ex)$", "$1ices"),
            new Rule("(x|ch|ss|sh)$", "$1es"),
            new Rule("([^aeiouy]|qu)y$", "$1ies"),
            new Rule("(hive)$", "$1s"),
            new Rule("([^f])fe$", "$1ves"),
            new Rule("([lr])f$", "$1ves"),
            new Rule("sis$", "ses"),
            new Rule("([ti])a$", "$1a"),
            new Rule("([ti])um$", "$1a"),
            new Rule("(buffal|tomat)o$", "$1oes"),
            new Rule("(bu)s$", "$1ses"),
            new Rule("(alias|status)(es)?$", "$1es"),
            new Rule("(octop|vir)(i|us)$", "$1i"),
            new Rule("(ax|test)is$", "$1es"),
            new Rule("s$", "s"),
            new Rule("$", "s"));

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z\\d])([A-Z])");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s_]+");

    private Inflector() {}

    /**
     * Pluralize a single lower-case word.
     */
    @NonNull
    public static String pluralize(@NonNull String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.isEmpty() || UNCOUNTABLE.contains(lower) || IRREGULAR.containsValue(lower)) {
            return lower;
        }
        String irregular = IRREGULAR.get(lower);
        if (irregular != null) {
            return irregular;
        }
        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(lower);
            if (matcher.find()) {
                return matcher.replaceFirst(rule.replacement());
            }
        }
        return lower;
    }

    /**
     * "BlogPost", "blog_post" and "blog post" all become "blog-post".
     */
    @NonNull
    public static String dasherize(@NonNull String value) {
        String spaced = CAMEL_BOUNDARY.matcher(value.trim()).replaceAll("$1-$2");
        return SEPARATORS.matcher(spaced).replaceAll("-").toLowerCase(Locale.ROOT);
    }

    /**
     * "first-name" becomes "firstName". Used for payload attribute keys.
     */
    @NonNull
    public static String camelize(@NonNull String dasherized) {
        StringBuilder out = new StringBuilder(dasherized.length());
        boolean upperNext = false;
        for (char c : dasherized.toCharArray()) {
            if (c == '-' || c == '_') {
                upperNext = out.length() > 0;
            } else if (upperNext) {
                out.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private record Rule(Pattern pattern, String replacement) {
        Rule(String regex, String replacement) {
            this(Pattern.compile(regex), replacement);
        }
    }
}
