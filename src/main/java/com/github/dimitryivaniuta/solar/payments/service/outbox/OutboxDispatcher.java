package com.github.dimitryivaniuta.solar.payments.service.outbox;

import com.github.dimitryivaniuta.solar.payments.config.AppProperties;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxCommandType;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxEvent;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxStatus;
import com.github.dimitryivaniuta.solar.payments.repo.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Delivers outbox commands to the project, identity and contractor services and to Kafka.
 *
 * <p>Two entry points share the same delivery code:
 * <ul>
 *   <li>{@link #dispatchNow(List)}: called right after a use case commits, one transaction per command.</li>
 *   <li>{@link #publishBatch()}: scheduled sweep using {@code FOR UPDATE SKIP LOCKED}, so several instances
 *   can run without double-sending.</li>
 * </ul>
 * Failures back off exponentially with jitter and end up DEAD after {@code maxAttempts}.</p>
 */
@Component
public class OutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

    private final OutboxEventRepository outboxEventRepository;
    private final Map<OutboxCommandType, OutboxHandler> handlers = new EnumMap<>(OutboxCommandType.class);
    private final AppProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final Counter sentCounter;
    private final Counter retryCounter;
    private final Counter deadCounter;

    /**
     * Creates the dispatcher.
     *
     * @param outboxEventRepository repo
     * @param handlers              one handler per command type
     * @param properties            app properties
     * @param transactionManager    transaction manager for post-commit dispatch
     * @param clock                 clock
     * @param meterRegistry         metrics
     */
    public OutboxDispatcher(
            OutboxEventRepository outboxEventRepository,
            List<OutboxHandler> handlers,
            AppProperties properties,
            PlatformTransactionManager transactionManager,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.outboxEventRepository = outboxEventRepository;
        for (OutboxHandler h : handlers) {
            OutboxHandler previous = this.handlers.put(h.type(), h);
            if (previous != null) {
                throw new IllegalStateException("Two outbox handlers for " + h.type());
            }
        }
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;

        this.sentCounter = Counter.builder("payments.outbox.sent").register(meterRegistry);
        this.retryCounter = Counter.builder("payments.outbox.retry").register(meterRegistry);
        this.deadCounter = Counter.builder("payments.outbox.dead").register(meterRegistry);
    }

    /**
     * Delivers the given commands now, each in its own transaction. Never throws for delivery failures.
     *
     * @param commandIds ids written by the committed use case
     * @return types of the commands that are still pending afterwards
     */
    public Set<OutboxCommandType> dispatchNow(List<String> commandIds) {
        Set<OutboxCommandType> pending = EnumSet.noneOf(OutboxCommandType.class);
        for (String id : commandIds) {
            OutboxCommandType notDelivered = transactionTemplate.execute(status ->
                    outboxEventRepository.findByIdForUpdate(id)
                            .filter(OutboxEvent::isPending)
                            .map(e -> deliver(e) ? null : e.getEventType())
                            .orElse(null));
            if (notDelivered != null) {
                pending.add(notDelivered);
            }
        }
        return pending;
    }

    /**
     * Periodically delivers pending commands.
     */
    @Scheduled(fixedDelayString = "${app.outbox.publish-interval-ms:1000}")
    @Transactional
    public void publishBatch() {
        AppProperties.Outbox outbox = properties.getOutbox();

        List<OutboxEvent> batch = outboxEventRepository.lockNextBatchForPublish(
                List.of(OutboxStatus.NEW.name(), OutboxStatus.RETRY.name()),
                clock.instant(),
                outbox.getBatchSize()
        );

        if (batch.isEmpty()) {
            return;
        }

        int sent = 0;
        for (OutboxEvent e : batch) {
            if (deliver(e)) {
                sent++;
            }
        }

        log.info("Outbox batch done. size={} sent={} pending={}", batch.size(), sent, batch.size() - sent);
    }

    /**
     * Attempts one delivery and records the outcome on the row. Caller holds the row lock.
     *
     * @return true if delivered
     */
    private boolean deliver(OutboxEvent e) {
        AppProperties.Outbox outbox = properties.getOutbox();
        try {
            OutboxHandler handler = handlers.get(e.getEventType());
            if (handler == null) {
                throw new IllegalStateException("No handler for " + e.getEventType());
            }
            handler.handle(e);
            e.markSent(clock.instant());
            sentCounter.increment();
            return true;
        } catch (Exception ex) {
            String err = safeError(ex);

            if (e.getAttemptCount() + 1 >= outbox.getMaxAttempts()) {
                e.markDead(err, clock.instant());
                deadCounter.increment();
                log.error("Outbox command moved to DEAD, manual reconciliation required. id={} type={} paymentId={} key={} attempts={} error={}",
                        e.getId(), e.getEventType(), e.getAggregateId(), e.getEventKey(), e.getAttemptCount(), err);
            } else {
                Duration backoff = computeBackoff(outbox.getBaseBackoff(), outbox.getMaxBackoff(), e.getAttemptCount() + 1);
                e.markRetry(err, backoff, clock.instant());
                retryCounter.increment();
                log.warn("Outbox command failed. id={} type={} paymentId={} attempt={} nextAttemptAt={} error={}",
                        e.getId(), e.getEventType(), e.getAggregateId(), e.getAttemptCount(), e.getNextAttemptAt(), err);
            }
            return false;
        } finally {
            outboxEventRepository.save(e);
        }
    }

    static Duration computeBackoff(Duration base, Duration max, int attempt) {
        // base * 2^(attempt-1), capped, with jitter [0.5..1.5)
        double exp = Math.pow(2.0, Math.max(0, attempt - 1));
        long candidateMs = (long) (base.toMillis() * exp);
        long capped = Math.min(candidateMs, max.toMillis());

        double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
        long withJitter = (long) (capped * jitter);

        return Duration.ofMillis(Math.max(base.toMillis(), Math.min(withJitter, max.toMillis())));
    }

    private String safeError(Exception ex) {
        String msg = ex.getMessage();
        if (msg == null) {
            msg = ex.getClass().getSimpleName();
        }
        if (msg.length() > 2000) {
            msg = msg.substring(0, 2000);
        }
        return msg;
    }
}
