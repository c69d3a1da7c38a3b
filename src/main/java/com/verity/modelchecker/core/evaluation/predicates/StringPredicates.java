/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.evaluation.predicates;

import com.verity.modelchecker.core.property.PropertyResolver;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Text predicates: "contains", "does not contain", "is like" and "is similar to".
 *
 * Values are compared through their string form. Regex patterns are compiled once and
 * shared; an invalid pattern is reported once and never matches.
 */
public final class StringPredicates {
    private static final Logger logger = Logger.getLogger(StringPredicates.class.getName());

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;

    private final PropertyResolver resolver;
    private final Map<String, Optional<Pattern>> patterns = new ConcurrentHashMap<>();

    public StringPredicates(PropertyResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Case-insensitive substring test. A missing property contains nothing.
     */
    public boolean isParameterValueContaining(Object element, String propertyPath, Object substring) {
        Object value = resolver.getParameterValue(element, propertyPath);
        if (value == null || substring == null) {
            return false;
        }
        return StringUtils.containsIgnoreCase(String.valueOf(value), String.valueOf(substring));
    }

    /**
     * Inverse of {@link #isParameterValueContaining}; true for a missing property.
     */
    public boolean isParameterValueNotContaining(Object element, String propertyPath, Object substring) {
        return !isParameterValueContaining(element, propertyPath, substring);
    }

    public boolean isParameterValueLike(Object element, String propertyPath, Object pattern) {
        return isParameterValueLike(element, propertyPath, pattern, false, DEFAULT_SIMILARITY_THRESHOLD);
    }

    public boolean isParameterValueSimilar(Object element, String propertyPath, Object pattern) {
        return isParameterValueLike(element, propertyPath, pattern, true, DEFAULT_SIMILARITY_THRESHOLD);
    }

    /**
     * Pattern match of the value's string form.
     *
     * @param fuzzy     false: the regex must match at the start of the value (not necessarily
     *                  all of it); true: the similarity ratio must reach {@code threshold}
     * @param threshold minimum similarity in [0, 1] for fuzzy matching
     */
    public boolean isParameterValueLike(Object element, String propertyPath, Object pattern,
                                        boolean fuzzy, double threshold) {
        Object value = resolver.getParameterValue(element, propertyPath);
        if (value == null || pattern == null) {
            return false;
        }
        String text = String.valueOf(value);
        String patternText = String.valueOf(pattern);

        if (fuzzy) {
            return SimilarityRatio.ratio(text, patternText) >= threshold;
        }
        return compile(patternText)
                .map(compiled -> compiled.matcher(text).lookingAt())
                .orElse(false);
    }

    private Optional<Pattern> compile(String pattern) {
        return patterns.computeIfAbsent(pattern, p -> {
            try {
                return Optional.of(Pattern.compile(p));
            } catch (PatternSyntaxException e) {
                logger.warning("Invalid regex pattern: " + p);
                return Optional.empty();
            }
        });
    }
}
