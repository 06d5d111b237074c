package io.github.depot2git;

public class RetryBudgetExhaustedException extends FatalConversionException {
    private final int attempts;

    public RetryBudgetExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super("Giving up on " + operation + " after " + attempts + " attempts: " + lastFailure.getMessage(),
                lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
