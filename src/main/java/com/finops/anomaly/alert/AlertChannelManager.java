package com.finops.anomaly.alert;

import com.finops.anomaly.alert.channel.ChannelAdapter;
import com.finops.anomaly.exception.ChannelDeliveryException;
import com.finops.anomaly.exception.ChannelTimeoutException;
import com.finops.anomaly.exception.TransportException;
import com.finops.anomaly.model.AlertData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers one alert to many channels at once.
 *
 * <p>Each configured target runs as its own task on the dispatch executor: format once, then up
 * to {@code maxAttempts} attempts, each bounded by the target's timeout and separated by the
 * backoff policy's delay. A failing channel only ends its own task. The whole send is bounded
 * by the SLA: tasks still running at the deadline are cancelled (interrupted) and reported as
 * {@link DeliveryStatus#TIMED_OUT}. A remote side effect already under way when that happens
 * cannot be undone.
 *
 * <p>Targets without a type, adapter or the endpoint/credential the adapter needs are reported
 * as {@link DeliveryStatus#SKIPPED} and never attempted.
 */
public class AlertChannelManager {

    private static final Logger log = LoggerFactory.getLogger(AlertChannelManager.class);

    private final Map<ChannelType, ChannelAdapter> adapters;
    private final ExecutorService dispatchExecutor;
    private final ExecutorService attemptExecutor;
    private final BackoffPolicy backoffPolicy;
    private final Duration sla;

    public AlertChannelManager(Collection<? extends ChannelAdapter> adapters,
                               ExecutorService dispatchExecutor,
                               ExecutorService attemptExecutor,
                               BackoffPolicy backoffPolicy,
                               Duration sla) {
        this.adapters = new EnumMap<>(ChannelType.class);
        for (ChannelAdapter adapter : adapters) {
            this.adapters.put(adapter.type(), adapter);
        }
        this.dispatchExecutor = dispatchExecutor;
        this.attemptExecutor = attemptExecutor;
        this.backoffPolicy = backoffPolicy;
        this.sla = sla;
    }

    public DeliveryReport send(AlertData alert, List<AlertChannelTarget> targets) {
        String alertId = UUID.randomUUID().toString();
        long startNanos = System.nanoTime();

        DeliveryOutcome[] outcomes = new DeliveryOutcome[targets.size()];
        List<ChannelDelivery> deliveries = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();

        for (int i = 0; i < targets.size(); i++) {
            AlertChannelTarget target = targets.get(i);
            ChannelAdapter adapter = target.getType() != null ? adapters.get(target.getType()) : null;
            if (adapter == null || !adapter.isConfigured(target)) {
                log.debug("Channel {} has no endpoint/credential configured, skipping alert {}",
                        target.getName(), alertId);
                outcomes[i] = DeliveryOutcome.skipped(target, "channel not configured");
                continue;
            }
            deliveries.add(new ChannelDelivery(alertId, alert, target, adapter));
            positions.add(i);
        }

        if (!deliveries.isEmpty()) {
            List<Future<DeliveryOutcome>> futures = dispatch(deliveries);
            for (int j = 0; j < deliveries.size(); j++) {
                ChannelDelivery delivery = deliveries.get(j);
                Future<DeliveryOutcome> future = futures != null ? futures.get(j) : null;
                outcomes[positions.get(j)] = collect(delivery, future, startNanos);
            }
        }

        Duration overall = Duration.ofNanos(System.nanoTime() - startNanos);
        List<DeliveryOutcome> outcomeList = Arrays.asList(outcomes);
        boolean slaMet = overall.compareTo(sla) <= 0
                && outcomeList.stream().noneMatch(o -> o.getStatus() == DeliveryStatus.TIMED_OUT);

        DeliveryReport report = new DeliveryReport(alertId, overall, List.copyOf(outcomeList), slaMet);
        log.info("Alert {} delivered to {}/{} channels in {} ms (slaMet={})",
                alertId, report.successCount(), targets.size(), overall.toMillis(), slaMet);
        return report;
    }

    /**
     * Stops both executors, interrupting deliveries still in flight.
     */
    public void shutdown() {
        dispatchExecutor.shutdownNow();
        attemptExecutor.shutdownNow();
    }

    private List<Future<DeliveryOutcome>> dispatch(List<ChannelDelivery> deliveries) {
        try {
            return dispatchExecutor.invokeAll(deliveries, sla.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Alert send interrupted before all channels finished");
            return null;
        }
    }

    private DeliveryOutcome collect(ChannelDelivery delivery, Future<DeliveryOutcome> future, long startNanos) {
        if (future == null || future.isCancelled()) {
            return delivery.timedOut(Duration.ofNanos(System.nanoTime() - startNanos));
        }
        try {
            return future.get();
        } catch (CancellationException e) {
            return delivery.timedOut(Duration.ofNanos(System.nanoTime() - startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return delivery.timedOut(Duration.ofNanos(System.nanoTime() - startNanos));
        } catch (ExecutionException e) {
            log.error("Unexpected failure delivering to channel {}", delivery.target.getName(), e.getCause());
            return delivery.failed(Duration.ofNanos(System.nanoTime() - startNanos),
                    String.valueOf(e.getCause().getMessage()));
        }
    }

    /**
     * One channel's delivery: pending, then attempting until success, failure or cancellation.
     */
    private final class ChannelDelivery implements Callable<DeliveryOutcome> {

        private final String alertId;
        private final AlertData alert;
        private final AlertChannelTarget target;
        private final ChannelAdapter adapter;

        private volatile int attempts;
        private volatile String lastError;

        private ChannelDelivery(String alertId, AlertData alert, AlertChannelTarget target, ChannelAdapter adapter) {
            this.alertId = alertId;
            this.alert = alert;
            this.target = target;
            this.adapter = adapter;
        }

        @Override
        public DeliveryOutcome call() throws InterruptedException {
            long start = System.nanoTime();
            byte[] payload;
            try {
                payload = adapter.format(alert, target);
            } catch (RuntimeException e) {
                log.warn("Could not format alert {} for channel {}: {}", alertId, target.getName(), e.getMessage());
                return failed(Duration.ofNanos(System.nanoTime() - start), e.getMessage());
            }

            int maxAttempts = Math.max(1, target.getMaxAttempts());
            for (int attempt = 0; attempt < maxAttempts; attempt++) {
                attempts = attempt + 1;
                try {
                    attemptOnce(payload);
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                    log.info("Alert {} delivered to {} on attempt {}/{} in {} ms",
                            alertId, target.getName(), attempts, maxAttempts, elapsed.toMillis());
                    return outcome(DeliveryStatus.SUCCESS, elapsed, null);
                } catch (ChannelDeliveryException e) {
                    lastError = e.getMessage();
                    if (attempt + 1 < maxAttempts) {
                        Duration delay = backoffPolicy.delayAfter(attempt);
                        log.info("Attempt {}/{} to {} failed ({}), retrying in {} ms",
                                attempts, maxAttempts, target.getName(), e.getMessage(), delay.toMillis());
                        Thread.sleep(delay.toMillis());
                    }
                }
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.warn("Alert {} to {} failed after {} attempts: {}", alertId, target.getName(), attempts, lastError);
            return outcome(DeliveryStatus.FAILED, elapsed, lastError);
        }

        private void attemptOnce(byte[] payload) throws ChannelDeliveryException, InterruptedException {
            Future<Void> attempt = attemptExecutor.submit(() -> {
                adapter.deliver(payload, target);
                return null;
            });
            Duration timeout = target.getTimeout();
            try {
                if (timeout != null) {
                    attempt.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
                } else {
                    attempt.get();
                }
            } catch (TimeoutException e) {
                attempt.cancel(true);
                throw new ChannelTimeoutException(target.getName(), timeout);
            } catch (InterruptedException e) {
                attempt.cancel(true);
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof ChannelDeliveryException) {
                    throw (ChannelDeliveryException) cause;
                }
                throw new TransportException(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
            }
        }

        DeliveryOutcome timedOut(Duration elapsed) {
            log.warn("Alert {} to {} still pending at the {} ms deadline, marked timed out",
                    alertId, target.getName(), sla.toMillis());
            String detail = "SLA deadline of " + sla.toMillis() + " ms exceeded"
                    + (lastError != null ? "; last error: " + lastError : "");
            return outcome(DeliveryStatus.TIMED_OUT, elapsed, detail);
        }

        DeliveryOutcome failed(Duration elapsed, String detail) {
            return outcome(DeliveryStatus.FAILED, elapsed, detail);
        }

        private DeliveryOutcome outcome(DeliveryStatus status, Duration elapsed, String detail) {
            return DeliveryOutcome.builder()
                    .channel(target.getName())
                    .channelType(target.getType())
                    .status(status)
                    .elapsed(elapsed)
                    .attempts(attempts)
                    .errorDetail(detail)
                    .build();
        }
    }
}
