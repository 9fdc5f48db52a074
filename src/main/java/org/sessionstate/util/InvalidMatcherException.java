package org.sessionstate.util;

/** Thrown when a matcher or filter expression can't be compiled. */
public class InvalidMatcherException extends Exception {

    private final String expression;

    public InvalidMatcherException(String expression, String message) {
        super(message);
        this.expression = expression;
    }

    public InvalidMatcherException(String expression, String message, Throwable cause) {
        super(message, cause);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
