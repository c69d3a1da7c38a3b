/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.api;

import com.verity.modelchecker.core.compiler.RuleTableCompilation;
import com.verity.modelchecker.model.RawRuleTable;

/**
 * Contract for turning a raw spreadsheet rule table into validated rule groups.
 */
public interface IRuleTableCompiler {

    /**
     * Compiles a rule table. Never throws: a table that cannot be processed yields a
     * failed compilation carrying the diagnostic.
     *
     * @param table the raw rule table
     * @return rule groups in table order plus warning messages
     */
    RuleTableCompilation compile(RawRuleTable table);
}
