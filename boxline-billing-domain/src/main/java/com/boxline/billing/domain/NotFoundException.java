package com.boxline.billing.domain;

/**
 * A tenant, subscription, plan, grace period or request does not exist.
 * Retrying the same call will not help.
 */
public final class NotFoundException extends BillingException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String entity, Object id) {
        return new NotFoundException(entity + " not found: " + id);
    }

    @Override
    public String reason() {
        return "not_found";
    }
}
