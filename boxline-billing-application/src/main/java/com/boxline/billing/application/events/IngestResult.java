package com.boxline.billing.application.events;

import java.util.UUID;

/**
 * Outcome of {@link BillingEventService#ingest}. Handler failures are thrown, not returned.
 */
public record IngestResult(Status status, UUID recordId, String externalId, boolean handled) {

    public enum Status {
        PROCESSED,
        ALREADY_PROCESSED,
        IN_PROGRESS
    }

    public static IngestResult processed(UUID recordId, String externalId, boolean handled) {
        return new IngestResult(Status.PROCESSED, recordId, externalId, handled);
    }

    public static IngestResult alreadyProcessed(UUID recordId, String externalId) {
        return new IngestResult(Status.ALREADY_PROCESSED, recordId, externalId, false);
    }

    public static IngestResult inProgress(UUID recordId, String externalId) {
        return new IngestResult(Status.IN_PROGRESS, recordId, externalId, false);
    }
}
