/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.core.compiler;

/**
 * Thrown when a rule group breaks the WHERE/AND/CHECK grammar.
 *
 * Unchecked: the evaluator catches it per rule group, so a malformed rule never
 * aborts the rest of the run.
 */
public class RuleStructureException extends RuntimeException {

    public RuleStructureException(String message) {
        super(message);
    }

    public RuleStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
