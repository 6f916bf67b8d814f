package com.boxline.billing.application.events;

import com.boxline.billing.application.Errors;
import com.boxline.billing.application.ports.BillingEventStore;
import com.boxline.billing.application.ports.InsertResult;
import com.boxline.billing.domain.model.BillingEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable, idempotent intake of billing events.
 *
 * Rules:
 * - One record per external event id. A processed event is never handled again.
 * - An event is handled only by the caller that claims it (pending/failed to processing).
 * - Handler failures are recorded (error, trace, retry count, next retry time) and rethrown.
 * - Retries stop once retryCount reaches maxRetries; backoff is base * 2^(retryCount + 1).
 * - While an event is dispatched, MDC carries eventId, eventType and, once resolved, tenantId.
 */
public final class BillingEventService {

    private static final Logger log = LoggerFactory.getLogger(BillingEventService.class);

    private static final int RETRY_BATCH_LIMIT = 100;

    public static final String MDC_EVENT_ID = "eventId";
    public static final String MDC_EVENT_TYPE = "eventType";
    public static final String MDC_TENANT_ID = "tenantId";

    private final BillingEventStore store;
    private final BillingEventRouter router;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final int maxRetries;
    private final Duration backoffBase;
    private final Duration staleClaimAfter;

    public BillingEventService(
            BillingEventStore store,
            BillingEventRouter router,
            ObjectMapper mapper,
            Clock clock,
            int maxRetries,
            Duration backoffBase,
            Duration staleClaimAfter
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.router = Objects.requireNonNull(router, "router");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.maxRetries = maxRetries;
        this.backoffBase = Objects.requireNonNull(backoffBase, "backoffBase");
        this.staleClaimAfter = Objects.requireNonNull(staleClaimAfter, "staleClaimAfter");
    }

    /**
     * Records and handles an event exactly once.
     *
     * @throws RuntimeException the handler's failure, after it has been recorded on the event
     */
    public IngestResult ingest(InboundEvent event) {
        Objects.requireNonNull(event, "event");

        Optional<BillingEvent> known = store.findByExternalId(event.id());
        if (known.isPresent() && known.get().processed()) {
            log.debug("Billing event already processed. eventId={}", event.id());
            return IngestResult.alreadyProcessed(known.get().id(), event.id());
        }

        BillingEvent record;
        if (known.isPresent()) {
            record = known.get();
        } else {
            InsertResult<BillingEvent> inserted = store.insertIfAbsent(BillingEvent.pending(UUID.randomUUID(),
                    event.id(), event.type(), event.metadataTenantId(), event.rawPayload(), maxRetries,
                    clock.instant()));
            record = inserted.value();
            if (!inserted.inserted() && record.processed()) {
                return IngestResult.alreadyProcessed(record.id(), event.id());
            }
        }

        return execute(record, event);
    }

    /**
     * Re-runs failed events that still have attempts left and are due. One failure does not stop the
     * others.
     */
    public List<RetryResult> retryFailed(int maxRetries) {
        Instant now = clock.instant();
        List<BillingEvent> due = store.findRetryable(maxRetries, now, RETRY_BATCH_LIMIT);
        List<RetryResult> results = new ArrayList<>(due.size());

        for (BillingEvent e : due) {
            InboundEvent event;
            try {
                event = InboundEvent.parse(mapper, e.payload(), e.externalId());
            } catch (IllegalArgumentException badPayload) {
                // unreadable stored payload still counts as an attempt
                store.markFailed(e.id(), Errors.safeError(badPayload), Errors.stackTrace(badPayload),
                        now.plus(backoff(e.retryCount() + 1)), now);
                results.add(RetryResult.failed(e.id(), e.externalId(), e.type(), Errors.safeError(badPayload)));
                continue;
            }
            try {
                IngestResult r = execute(e, event);
                if (r.status() == IngestResult.Status.IN_PROGRESS) {
                    results.add(RetryResult.failed(e.id(), e.externalId(), e.type(), "in progress"));
                } else {
                    results.add(RetryResult.succeeded(e.id(), e.externalId(), e.type()));
                }
            } catch (RuntimeException ex) {
                results.add(RetryResult.failed(e.id(), e.externalId(), e.type(), Errors.safeError(ex)));
            }
        }

        if (!due.isEmpty()) {
            long ok = results.stream().filter(RetryResult::success).count();
            log.info("Billing event retry finished. attempted={} succeeded={} failed={}",
                    results.size(), ok, results.size() - ok);
        }
        return results;
    }

    public int maxRetries() {
        return maxRetries;
    }

    private IngestResult execute(BillingEvent record, InboundEvent event) {
        Instant now = clock.instant();
        if (!store.claim(record.id(), now, now.minus(staleClaimAfter))) {
            Optional<BillingEvent> latest = store.findById(record.id());
            if (latest.isPresent() && latest.get().processed()) {
                return IngestResult.alreadyProcessed(record.id(), event.id());
            }
            log.info("Billing event in progress elsewhere. eventId={}", event.id());
            return IngestResult.inProgress(record.id(), event.id());
        }

        MDC.put(MDC_EVENT_ID, event.id());
        MDC.put(MDC_EVENT_TYPE, event.type());
        try {
            RouteResult routed = router.route(event);
            store.markProcessed(record.id(), routed.handled(), routed.tenantId(), clock.instant());
            log.info("Billing event processed. eventId={} type={} handled={} tenantId={}",
                    event.id(), event.type(), routed.handled(), routed.tenantId());
            return IngestResult.processed(record.id(), event.id(), routed.handled());
        } catch (RuntimeException e) {
            int attempts = record.retryCount() + 1;
            Instant failedAt = clock.instant();
            Instant nextRetryAt = failedAt.plus(backoff(attempts));
            store.markFailed(record.id(), Errors.safeError(e), Errors.stackTrace(e), nextRetryAt, failedAt);
            log.error("Billing event failed. eventId={} type={} attempt={} nextRetryAt={} err={}",
                    event.id(), event.type(), attempts, nextRetryAt, Errors.safeError(e), e);
            throw e;
        } finally {
            MDC.remove(MDC_EVENT_ID);
            MDC.remove(MDC_EVENT_TYPE);
            MDC.remove(MDC_TENANT_ID);
        }
    }

    /** base * 2^attempts: 10, 20, 40 minutes with the default 5 minute base. */
    Duration backoff(int attempts) {
        int exp = Math.min(Math.max(attempts, 0), 16);
        return backoffBase.multipliedBy(1L << exp);
    }
}
