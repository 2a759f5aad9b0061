package com.airlinereservation.booking.exception;

import java.util.List;

/**
 * A multi-leg booking failed and at least one of its undo actions failed as well.
 * <p>
 * The cause is the failure that triggered the rollback; every undo failure is attached as
 * a suppressed exception so neither is lost.
 */
public class CompensationFailedException extends BookingException {

    private static final String ERROR_CODE = "COMPENSATION_FAILED";

    private final List<String> failedActions;

    public CompensationFailedException(Throwable originalCause, List<String> failedActions, List<Throwable> failures) {
        super(ERROR_CODE, "Booking failed and " + failedActions.size()
                + " compensation(s) could not be completed: " + failedActions, originalCause);
        this.failedActions = List.copyOf(failedActions);
        failures.forEach(this::addSuppressed);
    }

    public List<String> getFailedActions() {
        return failedActions;
    }
}
