/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.api.exceptions;

import java.util.List;

/**
 * Thrown when an experiment definition fails validation.
 *
 * <p>Definition errors are detected once, when a definition is compiled, and
 * never while a participant is navigating. The exception carries every
 * problem found so authors can fix them in one pass.
 */
public class DefinitionException extends RuntimeException {

    private final List<String> errors;

    public DefinitionException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public DefinitionException(List<String> errors) {
        super("Invalid experiment definition: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public List<String> getErrors() {
        return errors;
    }
}
