/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.api.exceptions;

/**
 * A counter, capacity, cache or document store could not be reached.
 *
 * <p>Callers may retry the identical operation but must not re-draw any
 * randomized decision.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
