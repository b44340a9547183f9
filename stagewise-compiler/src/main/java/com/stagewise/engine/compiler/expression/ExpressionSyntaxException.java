package com.stagewise.engine.compiler.expression;

/**
 * Raised by {@link ExpressionParser#parse(String)} for malformed input.
 */
public class ExpressionSyntaxException extends RuntimeException {

    private final String source;

    public ExpressionSyntaxException(String message, String source) {
        super(message + " in expression: " + source);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
