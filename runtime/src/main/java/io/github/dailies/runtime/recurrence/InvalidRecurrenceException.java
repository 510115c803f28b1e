package io.github.dailies.runtime.recurrence;

/** A recurrence expression or timezone that cannot be evaluated. */
public class InvalidRecurrenceException extends RuntimeException {

    private final String expression;

    public InvalidRecurrenceException(String expression, String reason) {
        super("Invalid recurrence '" + expression + "': " + reason);
        this.expression = expression;
    }

    public InvalidRecurrenceException(String expression, String reason, Throwable cause) {
        super("Invalid recurrence '" + expression + "': " + reason, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
