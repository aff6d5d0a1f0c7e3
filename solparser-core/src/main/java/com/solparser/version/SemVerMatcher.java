package com.solparser.version;

import com.solparser.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Version constraint of a {@code pragma solidity} directive, evaluated against a
 * compiler version.
 *
 * <p>A constraint is a {@code ||}-separated list of ranges. A range is either a
 * hyphen range {@code a - b} or a conjunction of components, each an optional
 * operator ({@code ^ ~ = < <= > >=}) followed by a version whose missing or
 * wildcard ({@code *}, {@code x}, {@code X}) levels match anything.
 */
public final class SemVerMatcher {

    private static final int WILDCARD = -1;

    private enum Operator { EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL, CARET, TILDE }

    private record Component(Operator operator, int[] numbers, int levelsPresent) {

        boolean matches(SemVerVersion version) {
            return switch (operator) {
                case TILDE -> new Component(Operator.GREATER_EQUAL, numbers, levelsPresent).matches(version)
                    && new Component(Operator.LESS_EQUAL, numbers, levelsPresent >= 2 ? 2 : 1).matches(version);
                case CARET -> new Component(Operator.GREATER_EQUAL, numbers, levelsPresent).matches(version)
                    && new Component(Operator.LESS_EQUAL, numbers,
                        numbers[0] == 0 && levelsPresent != 1 ? 2 : 1).matches(version);
                default -> compare(version);
            };
        }

        private boolean compare(SemVerVersion version) {
            int cmp = 0;
            boolean didCompare = false;
            for (int i = 0; i < levelsPresent && cmp == 0; i++) {
                if (numbers[i] != WILDCARD) {
                    didCompare = true;
                    cmp = Integer.compare(version.number(i), numbers[i]);
                }
            }
            if (cmp == 0 && version.isPrerelease() && didCompare) {
                cmp = -1;
            }
            return switch (operator) {
                case EQUAL -> cmp == 0;
                case LESS -> cmp < 0;
                case LESS_EQUAL -> cmp <= 0;
                case GREATER -> cmp > 0;
                case GREATER_EQUAL -> cmp >= 0;
                default -> throw new IllegalStateException("Unexpected operator " + operator);
            };
        }
    }

    private final List<List<Component>> ranges;

    private SemVerMatcher(List<List<Component>> ranges) {
        this.ranges = ranges;
    }

    public boolean matches(SemVerVersion version) {
        for (List<Component> range : ranges) {
            if (range.stream().allMatch(component -> component.matches(version))) {
                return true;
            }
        }
        return false;
    }

    public boolean matches(String version) {
        return matches(SemVerVersion.parse(version));
    }

    /**
     * Builds a matcher from the tokens of a pragma after its leading name. Numbers
     * such as {@code 0.6.0} arrive split as {@code 0.6} and {@code .0}; adjacent
     * pieces are glued back together.
     *
     * @throws IllegalArgumentException if the constraint is malformed
     */
    public static SemVerMatcher fromTokens(List<TokenType> tokens, List<String> literals) {
        StringBuilder text = new StringBuilder();
        String previous = "";
        for (int i = 0; i < tokens.size(); i++) {
            String literal = literals.get(i);
            String piece = literal != null && !literal.isEmpty() ? literal : tokens.get(i).text();
            if (piece == null) {
                throw new IllegalArgumentException("Unexpected token in version constraint: " + tokens.get(i));
            }
            boolean glue = previous.endsWith(".") || piece.startsWith(".");
            if (text.length() > 0 && !glue) {
                text.append(' ');
            }
            text.append(piece);
            previous = piece;
        }
        return parse(text.toString());
    }

    /**
     * Parses a textual constraint such as {@code >=0.6.0 <0.8.0 || ^0.5.2}.
     *
     * @throws IllegalArgumentException if the constraint is malformed
     */
    public static SemVerMatcher parse(String constraint) {
        List<List<Component>> ranges = new ArrayList<>();
        for (String alternative : constraint.split("\\|\\|", -1)) {
            ranges.add(parseRange(alternative.trim()));
        }
        return new SemVerMatcher(ranges);
    }

    private static List<Component> parseRange(String text) {
        List<Component> components = new ArrayList<>();
        if (text.isEmpty()) {
            return components;
        }

        int hyphen = text.indexOf(" - ");
        if (hyphen >= 0) {
            Component lower = parseComponent(text.substring(0, hyphen).trim());
            Component upper = parseComponent(text.substring(hyphen + 3).trim());
            if (lower.operator() != Operator.EQUAL || upper.operator() != Operator.EQUAL) {
                throw new IllegalArgumentException("Operators are not allowed in a hyphen range: " + text);
            }
            components.add(new Component(Operator.GREATER_EQUAL, lower.numbers(), lower.levelsPresent()));
            components.add(new Component(Operator.LESS_EQUAL, upper.numbers(), upper.levelsPresent()));
            return components;
        }

        // Operators may be separated from their version by blanks, so split on
        // the start of each version-bearing component instead of on whitespace.
        int pos = 0;
        while (pos < text.length()) {
            while (pos < text.length() && text.charAt(pos) == ' ') {
                pos++;
            }
            int start = pos;
            while (pos < text.length() && "^~=<>".indexOf(text.charAt(pos)) >= 0) {
                pos++;
            }
            while (pos < text.length() && text.charAt(pos) == ' ') {
                pos++;
            }
            while (pos < text.length() && text.charAt(pos) != ' ' && "^~=<>".indexOf(text.charAt(pos)) < 0) {
                pos++;
            }
            if (start == pos) {
                break;
            }
            components.add(parseComponent(text.substring(start, pos).replace(" ", "")));
        }
        return components;
    }

    private static Component parseComponent(String text) {
        Operator operator = Operator.EQUAL;
        int pos = 0;
        if (text.startsWith(">=")) {
            operator = Operator.GREATER_EQUAL;
            pos = 2;
        } else if (text.startsWith("<=")) {
            operator = Operator.LESS_EQUAL;
            pos = 2;
        } else if (text.startsWith(">")) {
            operator = Operator.GREATER;
            pos = 1;
        } else if (text.startsWith("<")) {
            operator = Operator.LESS;
            pos = 1;
        } else if (text.startsWith("^")) {
            operator = Operator.CARET;
            pos = 1;
        } else if (text.startsWith("~")) {
            operator = Operator.TILDE;
            pos = 1;
        } else if (text.startsWith("=")) {
            pos = 1;
        }

        String version = text.substring(pos);
        if (version.isEmpty()) {
            throw new IllegalArgumentException("Missing version after operator: " + text);
        }
        String[] parts = version.split("\\.", -1);
        if (parts.length > 3) {
            throw new IllegalArgumentException("Too many version levels: " + text);
        }
        int[] numbers = {WILDCARD, WILDCARD, WILDCARD};
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.equals("*") || part.equals("x") || part.equals("X")) {
                numbers[i] = WILDCARD;
            } else if (!part.isEmpty() && part.chars().allMatch(Character::isDigit)) {
                try {
                    numbers[i] = Integer.parseInt(part);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Version number out of range: " + text, e);
                }
            } else {
                throw new IllegalArgumentException("Invalid version level '" + part + "' in " + text);
            }
        }
        return new Component(operator, numbers, parts.length);
    }
}
