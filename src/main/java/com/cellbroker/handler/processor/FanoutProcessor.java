package com.cellbroker.handler.processor;

import com.cellbroker.config.TargetsCache;
import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.exception.ProcessingException;
import com.cellbroker.model.CellTenant;
import com.cellbroker.model.Target;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;

/**
 * Runs the rest of the chain once for every target of the tenant in the context.
 *
 * Up to maxConcurrencyPerEvent targets are processed at the same time. Every
 * target is attempted even if another fails; the first failure is rethrown once
 * all of them are done, which nacks the decouple message and redelivers it to
 * every target.
 */
@Slf4j
public class FanoutProcessor extends BaseProcessor {

    private final TargetsCache targets;
    private final int maxConcurrencyPerEvent;
    private final ExecutorService executor;

    public FanoutProcessor(TargetsCache targets, int maxConcurrencyPerEvent, ExecutorService executor) {
        this.targets = targets;
        this.maxConcurrencyPerEvent = Math.max(1, maxConcurrencyPerEvent);
        this.executor = executor;
    }

    @Override
    public void process(EventContext ctx, BrokerEvent event) throws ProcessingException {
        Optional<CellTenant> tenant = targets.getCellTenant(ctx.getTenantKey());
        if (tenant.isEmpty()) {
            log.warn("Tenant no longer exists in the config: tenant={}", ctx.getTenantKey());
            return;
        }
        List<Target> fanout = tenant.get().getTargets() == null
                ? List.of()
                : new ArrayList<>(tenant.get().getTargets().values());
        if (fanout.isEmpty()) {
            log.debug("Tenant has no targets: tenant={}, eventId={}", ctx.getTenantKey(), event.getId());
            return;
        }

        List<ProcessingException> errors = maxConcurrencyPerEvent == 1 || fanout.size() == 1
                ? processSequentially(ctx, event, fanout)
                : processConcurrently(ctx, event, fanout);

        if (!errors.isEmpty()) {
            ProcessingException first = errors.get(0);
            ProcessingException failure = new ProcessingException(String.format(
                    "%d of %d target deliveries failed, first: %s", errors.size(), fanout.size(), first.getMessage()),
                    first);
            errors.stream().skip(1).forEach(failure::addSuppressed);
            throw failure;
        }
    }

    private List<ProcessingException> processSequentially(EventContext ctx, BrokerEvent event, List<Target> fanout)
            throws ProcessingException {
        List<ProcessingException> errors = new ArrayList<>();
        for (Target target : fanout) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ProcessingException("fan-out of event " + event.getId() + " was cancelled");
            }
            try {
                next().process(ctx.withTarget(target.key()), event);
            } catch (ProcessingException e) {
                log.error("Failed to process event for target={}: {}", target.key(), e.getMessage());
                errors.add(e);
            }
        }
        return errors;
    }

    private List<ProcessingException> processConcurrently(EventContext ctx, BrokerEvent event, List<Target> fanout)
            throws ProcessingException {
        Semaphore permits = new Semaphore(maxConcurrencyPerEvent);
        List<Future<?>> futures = new ArrayList<>(fanout.size());
        List<ProcessingException> errors = new ArrayList<>();
        try {
            for (Target target : fanout) {
                permits.acquire();
                try {
                    futures.add(executor.submit(() -> {
                        try {
                            next().process(ctx.withTarget(target.key()), event);
                            return null;
                        } finally {
                            permits.release();
                        }
                    }));
                } catch (RuntimeException e) {
                    permits.release();
                    throw e;
                }
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    log.error("Failed to process event for target={}: {}", fanout.get(i).key(), cause.getMessage());
                    errors.add(cause instanceof ProcessingException
                            ? (ProcessingException) cause
                            : new ProcessingException(cause.getMessage(), cause));
                } catch (CancellationException e) {
                    errors.add(new ProcessingException("processing for target " + fanout.get(i).key() + " was cancelled"));
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new ProcessingException("fan-out of event " + event.getId() + " was cancelled", e);
        }
        return errors;
    }
}
