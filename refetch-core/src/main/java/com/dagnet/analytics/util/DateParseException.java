package com.dagnet.analytics.util;

/**
 * Raised when calendar date text cannot be parsed in any accepted format.
 */
public class DateParseException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String input;

    public DateParseException(String input) {
        super("Invalid date format: " + input);
        this.input = input;
    }

    public DateParseException(String input, Throwable cause) {
        super("Invalid date format: " + input, cause);
        this.input = input;
    }

    public String input() {
        return input;
    }
}
