package com.cellbroker.handler;

import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.event.EventCodec;
import com.cellbroker.exception.EventFormatException;
import com.cellbroker.exception.ProcessingException;
import com.cellbroker.exception.QueueException;
import com.cellbroker.handler.processor.EventContext;
import com.cellbroker.handler.processor.Processor;
import com.cellbroker.queue.EndOfStreamException;
import com.cellbroker.queue.QueueMessage;
import com.cellbroker.queue.QueueSubscription;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Pumps messages from one queue subscription through a processor chain.
 *
 * HOW IT WORKS:
 *   subscription thread: subscription.open() ── returns/throws ──→ done callback
 *   N worker threads:    receive() → decode → run chain (bounded by timeout) → finish()
 *
 *   chain returned      → finish(null)   (ack)
 *   chain threw/timeout → finish(error)  (nack, the queue service redelivers)
 *   undecodable payload → logged and left unfinished (redelivered after the ack
 *                         deadline, dead-lettered once delivery attempts run out)
 *
 * Each decoded message is finished exactly once.
 */
@Slf4j
public class Handler {

    private static final Duration RECEIVE_RETRY_PAUSE = Duration.ofMillis(100);

    private final String name;
    private final QueueSubscription subscription;
    private final Processor processor;
    private final EventCodec eventCodec;
    private final EventContext baseContext;
    private final Duration timeout;
    private final int concurrency;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean alive = new AtomicBoolean(false);

    private volatile ExecutorService workers;
    private volatile ExecutorService processing;

    public Handler(String name,
                   QueueSubscription subscription,
                   Processor processor,
                   EventCodec eventCodec,
                   EventContext baseContext,
                   Duration timeout,
                   int concurrency) {
        this.name = name;
        this.subscription = subscription;
        this.processor = processor;
        this.eventCodec = eventCodec;
        this.baseContext = baseContext;
        this.timeout = timeout == null ? Duration.ZERO : timeout;
        this.concurrency = concurrency > 0 ? concurrency : Runtime.getRuntime().availableProcessors();
    }

    /**
     * Starts the workers and the subscription. {@code done} is called once, with
     * null when the subscription was closed and with the failure when it broke.
     */
    public void start(Consumer<Throwable> done) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("handler " + name + " was already started");
        }
        alive.set(true);
        workers = Executors.newFixedThreadPool(concurrency, namedThreads(name + "-worker"));
        processing = Executors.newCachedThreadPool(namedThreads(name + "-process"));
        for (int i = 0; i < concurrency; i++) {
            workers.execute(this::receiveLoop);
        }

        Thread subscriptionThread = new Thread(() -> {
            Throwable failure = null;
            try {
                subscription.open();
            } catch (QueueException | RuntimeException e) {
                failure = e;
                log.error("Subscription of handler {} stopped with an error: {}", name, e.getMessage(), e);
            } finally {
                subscription.close();
                alive.set(false);
                workers.shutdownNow();
                processing.shutdownNow();
            }
            done.accept(failure);
        }, name + "-subscription");
        subscriptionThread.setDaemon(true);
        subscriptionThread.start();
        log.info("Handler started: name={}, concurrency={}, timeout={}", name, concurrency, timeout);
    }

    /**
     * Closes the subscription. Workers and in-flight processing are interrupted
     * once the subscription has shut down.
     */
    public void stop() {
        log.info("Stopping handler: name={}", name);
        subscription.close();
    }

    public boolean isAlive() {
        return alive.get();
    }

    public String getName() {
        return name;
    }

    private void receiveLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            QueueMessage message;
            try {
                message = subscription.receive();
            } catch (EndOfStreamException e) {
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (QueueException e) {
                log.error("Failed to receive message: handler={}, error={}", name, e.getMessage());
                if (!pause()) {
                    return;
                }
                continue;
            }
            handleMessage(message);
        }
    }

    private void handleMessage(QueueMessage message) {
        BrokerEvent event;
        try {
            event = eventCodec.decode(message.getPayload());
        } catch (EventFormatException e) {
            // Nacking would only bring the same bytes back.
            log.error("Failed to convert received message to an event, check the integrity of the queue: "
                    + "handler={}, messageId={}, error={}", name, message.getId(), e.getMessage());
            return;
        }

        EventContext ctx = timeout.isZero() || timeout.isNegative()
                ? baseContext
                : baseContext.withDeadline(Instant.now().plus(timeout));
        Throwable error = process(ctx, event);
        if (error != null) {
            log.error("Failed to process event: handler={}, eventId={}, error={}",
                    name, event.getId(), error.getMessage());
        }
        try {
            message.finish(error);
        } catch (QueueException e) {
            log.warn("Failed to finish message: handler={}, messageId={}, error={}",
                    name, message.getId(), e.getMessage());
        }
    }

    private Throwable process(EventContext ctx, BrokerEvent event) {
        Future<?> future;
        try {
            future = processing.submit(() -> {
                processor.process(ctx, event);
                return null;
            });
        } catch (RuntimeException e) {
            return e;
        }
        try {
            if (timeout.isZero() || timeout.isNegative()) {
                future.get();
            } else {
                future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            return null;
        } catch (TimeoutException e) {
            future.cancel(true);
            return new ProcessingException("processing timed out after " + timeout);
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (CancellationException e) {
            return e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new ProcessingException("processing was interrupted", e);
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(RECEIVE_RETRY_PAUSE.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
