package com.agentflow.examples.development;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The invocation argument as the development workers read it: a short description
 * of the code under work, e.g. {@code "legacy orders, customers service with sql queries"}.
 * 
 * Workers derive everything they report from the tokens of this description, so the
 * same argument always produces the same findings.
 */
record DevelopmentTarget(String raw, List<String> tokens) {

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "and", "the", "for", "with", "in", "of", "on", "to", "from", "by",
        "service", "module", "api", "app", "code", "feature", "page", "screen");

    DevelopmentTarget {
        tokens = List.copyOf(tokens);
    }

    static DevelopmentTarget of(String argument) {
        String raw = argument == null ? "" : argument.trim();
        List<String> tokens = new ArrayList<>();
        for (String token : raw.toLowerCase(Locale.ROOT).split("[^a-z0-9+#./-]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return new DevelopmentTarget(raw, tokens);
    }

    boolean isEmpty() {
        return tokens.isEmpty();
    }

    /**
     * True if any token contains the keyword.
     */
    boolean mentions(String keyword) {
        return tokens.stream().anyMatch(t -> t.contains(keyword));
    }

    /**
     * The given keywords this target mentions, in the order given.
     */
    List<String> mentioned(List<String> keywords) {
        return keywords.stream().filter(this::mentions).toList();
    }

    /**
     * Distinct tokens ending with the suffix, in order of appearance.
     */
    List<String> tokensEndingWith(String suffix) {
        return tokens.stream()
            .filter(t -> t.endsWith(suffix) && t.length() > suffix.length())
            .distinct()
            .toList();
    }

    /**
     * Domain nouns an API would expose: plural words that are not stop words.
     */
    List<String> resources() {
        Set<String> resources = new LinkedHashSet<>();
        for (String token : tokens) {
            String word = token.replaceAll("[^a-z]", "");
            if (word.length() > 3 && word.endsWith("s") && !STOP_WORDS.contains(word)) {
                resources.add(word);
            }
        }
        return List.copyOf(resources);
    }

    String describe() {
        return raw.isEmpty() ? "<unnamed target>" : raw;
    }

    static String capitalize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    static String singular(String resource) {
        if (resource.endsWith("ies")) {
            return resource.substring(0, resource.length() - 3) + "y";
        }
        if (resource.endsWith("s")) {
            return resource.substring(0, resource.length() - 1);
        }
        return resource;
    }
}
