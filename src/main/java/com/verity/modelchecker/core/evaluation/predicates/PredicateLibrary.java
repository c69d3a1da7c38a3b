/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.evaluation.predicates;

import com.verity.modelchecker.core.evaluation.ValueComparator;
import com.verity.modelchecker.core.property.PropertyResolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Registration table from spreadsheet predicate names to predicates.
 *
 * Names are looked up once per condition when the rule table is compiled, never per
 * element. Lookup ignores case and surrounding whitespace.
 *
 * <pre>
 * exists          has the property (any value)
 * matches         value equals the cell as written
 * greater than    value &gt; threshold
 * less than       value &lt; threshold
 * in range        min &lt;= value &lt;= max, cell "min,max"
 * in list         value in collection or "a,b,c"
 * equals          loose equality (case, Yes/No, 1e-6 tolerance)
 * not equal       negation of equals, true when missing
 * identical       strict equality on the uncoerced value
 * not identical   negation of identical, true when missing
 * true / false    yes|true|1 / no|false|0
 * is like         regex match at the start of the value
 * is similar to   similarity ratio &gt;= 0.8
 * contains        case-insensitive substring
 * does not contain
 * </pre>
 */
public final class PredicateLibrary {

    private final PropertyResolver resolver;
    private final Map<String, ConditionPredicate> predicates = new LinkedHashMap<>();

    public PredicateLibrary(PropertyResolver resolver, ValueComparator comparator) {
        this.resolver = resolver;

        EqualityPredicates equality = new EqualityPredicates(resolver, comparator);
        NumericPredicates numeric = new NumericPredicates(resolver);
        StringPredicates strings = new StringPredicates(resolver);
        BooleanPredicates booleans = new BooleanPredicates(resolver);

        register("exists", (element, path, value) -> resolver.hasParameter(element, path));
        register("matches", equality::isParameterValue);
        register("greater than", numeric::isParameterValueGreaterThan);
        register("less than", numeric::isParameterValueLessThan);
        register("in range", numeric::isParameterValueInRange);
        register("in list", equality::isParameterValueInList);
        register("equals", equality::isEqualValue);
        register("identical", equality::isIdenticalValue);
        register("not equal", equality::isNotEqualValue);
        register("not identical", equality::isNotIdenticalValue);
        register("true", (element, path, value) -> booleans.isParameterValueTrue(element, path));
        register("false", (element, path, value) -> booleans.isParameterValueFalse(element, path));
        register("is like", strings::isParameterValueLike);
        register("is similar to", strings::isParameterValueSimilar);
        register("contains", strings::isParameterValueContaining);
        register("does not contain", strings::isParameterValueNotContaining);
    }

    /**
     * Library over a resolver with the default (mixed) match mode.
     */
    public static PredicateLibrary standard() {
        return new PredicateLibrary(new PropertyResolver(), new ValueComparator());
    }

    private void register(String name, ConditionPredicate predicate) {
        predicates.put(normalize(name), predicate);
    }

    /**
     * Resolves a predicate name.
     * @param name The name from the rule table (e.g., "Greater Than").
     * @return The predicate, or null if the name is not registered.
     */
    public ConditionPredicate resolve(String name) {
        if (name == null) return null;
        return predicates.get(normalize(name));
    }

    public boolean isKnown(String name) {
        return resolve(name) != null;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(predicates.keySet());
    }

    public PropertyResolver resolver() {
        return resolver;
    }

    private static String normalize(String name) {
        return name.strip().toLowerCase(Locale.ROOT);
    }
}
