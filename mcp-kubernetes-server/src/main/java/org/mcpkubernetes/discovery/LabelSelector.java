package org.mcpkubernetes.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Kubernetes label selector in its string form. Terms are separated by commas and must all match.
 * <p>
 * Supported terms: {@code key=value}, {@code key==value}, {@code key!=value}, {@code key}, {@code !key},
 * {@code key in (a,b)} and {@code key notin (a,b)}.
 */
public final class LabelSelector {

    private static final Pattern KEY = Pattern.compile("^([a-z0-9A-Z.-]+/)?[a-zA-Z0-9]([-a-zA-Z0-9_.]*[a-zA-Z0-9])?$");
    private static final Pattern VALUE = Pattern.compile("^([a-zA-Z0-9]([-a-zA-Z0-9_.]*[a-zA-Z0-9])?)?$");
    private static final Pattern SET_TERM = Pattern.compile("^(\\S+)\\s+(in|notin)\\s*\\((.*)\\)$");

    private static final LabelSelector EVERYTHING = new LabelSelector(List.of());

    private enum Operator {
        EQUALS, NOT_EQUALS, EXISTS, DOES_NOT_EXIST, IN, NOT_IN
    }

    private record Requirement(String key, Operator operator, Set<String> values) {

        boolean matches(Map<String, String> labels) {
            String actual = labels.get(key);
            return switch (operator) {
                case EQUALS, IN -> actual != null && values.contains(actual);
                case NOT_EQUALS, NOT_IN -> actual == null || !values.contains(actual);
                case EXISTS -> labels.containsKey(key);
                case DOES_NOT_EXIST -> !labels.containsKey(key);
            };
        }
    }

    private final List<Requirement> requirements;

    private LabelSelector(List<Requirement> requirements) {
        this.requirements = requirements;
    }

    public static LabelSelector everything() {
        return EVERYTHING;
    }

    public static LabelSelector parse(String selector) {
        if (selector == null || selector.isBlank()) {
            return EVERYTHING;
        }
        List<Requirement> requirements = new ArrayList<>();
        for (String term : splitTerms(selector)) {
            requirements.add(parseTerm(selector, term.trim()));
        }
        return new LabelSelector(List.copyOf(requirements));
    }

    public boolean matches(Map<String, String> labels) {
        Map<String, String> actual = labels == null ? Map.of() : labels;
        return requirements.stream().allMatch(requirement -> requirement.matches(actual));
    }

    public boolean isEmpty() {
        return requirements.isEmpty();
    }

    // commas inside "in (a,b)" do not separate terms
    private static List<String> splitTerms(String selector) {
        List<String> terms = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < selector.length(); i++) {
            char c = selector.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new InvalidSelectorException(selector, "unbalanced parentheses");
                }
            } else if (c == ',' && depth == 0) {
                terms.add(selector.substring(start, i));
                start = i + 1;
            }
        }
        if (depth != 0) {
            throw new InvalidSelectorException(selector, "unbalanced parentheses");
        }
        terms.add(selector.substring(start));
        return terms;
    }

    private static Requirement parseTerm(String selector, String term) {
        if (term.isEmpty()) {
            throw new InvalidSelectorException(selector, "empty term");
        }
        Matcher setMatcher = SET_TERM.matcher(term);
        if (setMatcher.matches()) {
            String key = requireKey(selector, setMatcher.group(1));
            Operator operator = "in".equals(setMatcher.group(2)) ? Operator.IN : Operator.NOT_IN;
            List<String> values = new ArrayList<>();
            for (String raw : setMatcher.group(3).split(",")) {
                values.add(requireValue(selector, raw.trim()));
            }
            if (values.isEmpty() || values.stream().allMatch(String::isEmpty)) {
                throw new InvalidSelectorException(selector, "set requires at least one value");
            }
            return new Requirement(key, operator, Set.copyOf(values));
        }
        int notEquals = term.indexOf("!=");
        if (notEquals > 0) {
            return new Requirement(requireKey(selector, term.substring(0, notEquals).trim()), Operator.NOT_EQUALS,
                    Set.of(requireValue(selector, term.substring(notEquals + 2).trim())));
        }
        int doubleEquals = term.indexOf("==");
        if (doubleEquals > 0) {
            return new Requirement(requireKey(selector, term.substring(0, doubleEquals).trim()), Operator.EQUALS,
                    Set.of(requireValue(selector, term.substring(doubleEquals + 2).trim())));
        }
        int equals = term.indexOf('=');
        if (equals > 0) {
            return new Requirement(requireKey(selector, term.substring(0, equals).trim()), Operator.EQUALS,
                    Set.of(requireValue(selector, term.substring(equals + 1).trim())));
        }
        if (term.startsWith("!")) {
            return new Requirement(requireKey(selector, term.substring(1).trim()), Operator.DOES_NOT_EXIST, Set.of());
        }
        return new Requirement(requireKey(selector, term), Operator.EXISTS, Set.of());
    }

    private static String requireKey(String selector, String key) {
        if (key.isEmpty() || key.length() > 317 || !KEY.matcher(key).matches()) {
            throw new InvalidSelectorException(selector, "invalid label key '" + key + "'");
        }
        return key;
    }

    private static String requireValue(String selector, String value) {
        if (value.length() > 63 || !VALUE.matcher(value).matches()) {
            throw new InvalidSelectorException(selector, "invalid label value '" + value + "'");
        }
        return value;
    }
}
