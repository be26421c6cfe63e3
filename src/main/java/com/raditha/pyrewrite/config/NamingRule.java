package com.raditha.pyrewrite.config;

import java.util.regex.Pattern;

/**
 * Decides which binding names are eligible for conversion.
 *
 * @param pattern                 full-match pattern a name must satisfy
 * @param allowLeadingUnderscore  whether names starting with {@code _} are eligible
 */
public record NamingRule(Pattern pattern, boolean allowLeadingUnderscore) {

    public static final String SNAKE_CASE = "^[a-z][a-z0-9_]*$";

    public NamingRule {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern cannot be null");
        }
    }

    /**
     * lowercase_snake_case, private names excluded.
     */
    public static NamingRule snakeCase() {
        return new NamingRule(Pattern.compile(SNAKE_CASE), false);
    }

    public static NamingRule of(String regex) {
        return new NamingRule(Pattern.compile(regex), false);
    }

    public boolean matches(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        if (!allowLeadingUnderscore && name.startsWith("_")) {
            return false;
        }
        return pattern.matcher(name).matches();
    }
}
