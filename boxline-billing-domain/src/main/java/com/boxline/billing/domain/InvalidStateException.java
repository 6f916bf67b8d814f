package com.boxline.billing.domain;

/**
 * The target exists but is not in a state that allows the requested operation
 * (e.g. approving a plan change that is no longer pending).
 */
public final class InvalidStateException extends BillingException {

    public InvalidStateException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "invalid_state";
    }
}
