package com.questrail.dcsim.api;

import java.util.Objects;

/**
 * TopicPattern
 * -----------------------------------------------------------------------------
 * Subscription filter for the event bus.
 *
 * <p>Three forms are accepted:</p>
 * <ul>
 *   <li>an exact identifier, e.g. {@code vm.allocate}</li>
 *   <li>a family, e.g. {@code deployment.*}, matching every topic whose
 *       identifier starts with {@code deployment.}</li>
 *   <li>{@code *}, matching every topic</li>
 * </ul>
 */
public final class TopicPattern
{
    private static final String WILDCARD = "*";
    private static final String FAMILY_SUFFIX = ".*";

    private final String expression;
    private final String familyPrefix;

    private TopicPattern(String expression, String familyPrefix) {
        this.expression = expression;
        this.familyPrefix = familyPrefix;
    }

    /**
     * Parses a pattern expression.
     *
     * @throws IllegalArgumentException if the wildcard appears anywhere other
     *         than as the whole expression or as a trailing {@code .*}
     */
    public static TopicPattern parse(String expression) {
        Objects.requireNonNull(expression, "expression");
        if (expression.isBlank()) {
            throw new IllegalArgumentException("pattern must not be blank");
        }
        if (expression.equals(WILDCARD)) {
            return new TopicPattern(expression, "");
        }
        if (expression.endsWith(FAMILY_SUFFIX)) {
            String prefix = expression.substring(0, expression.length() - 1);
            if (prefix.length() < 2 || prefix.indexOf('*') >= 0) {
                throw new IllegalArgumentException("malformed family pattern: " + expression);
            }
            return new TopicPattern(expression, prefix);
        }
        if (expression.indexOf('*') >= 0) {
            throw new IllegalArgumentException("wildcard only allowed as a trailing segment: " + expression);
        }
        return new TopicPattern(expression, null);
    }

    /**
     * Pattern matching exactly one topic.
     */
    public static TopicPattern exact(Topic topic) {
        Objects.requireNonNull(topic, "topic");
        return new TopicPattern(topic.id(), null);
    }

    /**
     * Pattern matching every topic.
     */
    public static TopicPattern any() {
        return new TopicPattern(WILDCARD, "");
    }

    public boolean matches(Topic topic) {
        Objects.requireNonNull(topic, "topic");
        if (familyPrefix == null) {
            return expression.equals(topic.id());
        }
        return topic.id().startsWith(familyPrefix);
    }

    public String expression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TopicPattern other && expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
