package io.multicurl.sdk.ratelimit;

import io.multicurl.sdk.RequestConfig;
import io.multicurl.sdk.ResponseEnvelope;
import io.multicurl.sdk.transport.Transport;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Admission control for HTTP exchanges.
 *
 * <p>
 * Two limits apply to every exchange submitted, whichever operation it belongs to:
 * </p>
 * <ul>
 *   <li>at most {@code maxConcurrent} exchanges are outstanding at any instant;</li>
 *   <li>two exchanges never start closer together than {@code minSpacing}.</li>
 * </ul>
 *
 * <p>
 * Admission is first-submitted, first-admitted. No caller thread ever waits for a slot: submissions are queued and
 * the queue is drained from completion callbacks and from a timer when the spacing window has not elapsed yet. One
 * scheduler is shared by every operation of a client, which makes it the single point enforcing the server's request
 * budget.
 * </p>
 */
public final class RequestScheduler implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(RequestScheduler.class.getName());

    private final Transport transport;
    private final int maxConcurrent;
    private final long minSpacingNanos;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;

    private final Object lock = new Object();
    private final Deque<Job> pending = new ArrayDeque<>();
    private int inFlight;
    private long nextStartAt;
    private boolean wakeupScheduled;
    private boolean closed;

    public RequestScheduler(Transport transport, int maxConcurrent, Duration minSpacing) {
        this.transport = Objects.requireNonNull(transport, "transport");
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive");
        }
        this.maxConcurrent = maxConcurrent;
        this.minSpacingNanos = minSpacing == null || minSpacing.isNegative() ? 0L : minSpacing.toNanos();
        this.workers = Executors.newFixedThreadPool(maxConcurrent, daemonFactory("multicurl-worker"));
        this.timer = Executors.newSingleThreadScheduledExecutor(daemonFactory("multicurl-timer"));
        this.nextStartAt = System.nanoTime();
    }

    /**
     * Queues one exchange.
     *
     * @return a future completing with the transport's envelope; it never completes exceptionally. After
     *     {@link #close()} the future completes with {@link ResponseEnvelope#failure()}.
     */
    public CompletableFuture<ResponseEnvelope> submit(RequestConfig request) {
        Objects.requireNonNull(request, "request");
        Job job = new Job(request, new CompletableFuture<>());
        synchronized (lock) {
            if (closed) {
                job.result.complete(ResponseEnvelope.failure());
                return job.result;
            }
            pending.addLast(job);
        }
        drain();
        return job.result;
    }

    /**
     * @return a future completing after {@code millis} on the scheduler's timer. Completes immediately once the
     *     scheduler has been closed.
     */
    public CompletableFuture<Void> delay(long millis) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (millis <= 0) {
            done.complete(null);
            return done;
        }
        try {
            timer.schedule(() -> done.complete(null), millis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            done.complete(null);
        }
        return done;
    }

    /**
     * @return exchanges currently outstanding.
     */
    public int inFlight() {
        synchronized (lock) {
            return inFlight;
        }
    }

    /**
     * Stops admitting work. Queued exchanges complete with the failure envelope; exchanges already running finish.
     */
    @Override
    public void close() {
        List<Job> abandoned;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            abandoned = new ArrayList<>(pending);
            pending.clear();
        }
        for (Job job : abandoned) {
            job.result.complete(ResponseEnvelope.failure());
        }
        timer.shutdownNow();
        workers.shutdown();
    }

    private void drain() {
        List<Job> admitted = new ArrayList<>();
        synchronized (lock) {
            while (!closed && !pending.isEmpty() && inFlight < maxConcurrent) {
                long now = System.nanoTime();
                long wait = nextStartAt - now;
                if (wait > 0) {
                    scheduleWakeup(wait);
                    break;
                }
                admitted.add(pending.pollFirst());
                inFlight++;
                nextStartAt = now + minSpacingNanos;
            }
        }
        for (Job job : admitted) {
            start(job);
        }
    }

    // Caller holds lock.
    private void scheduleWakeup(long waitNanos) {
        if (wakeupScheduled) {
            return;
        }
        wakeupScheduled = true;
        try {
            timer.schedule(this::wakeup, waitNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException ex) {
            wakeupScheduled = false;
        }
    }

    private void wakeup() {
        synchronized (lock) {
            wakeupScheduled = false;
        }
        drain();
    }

    private void start(Job job) {
        try {
            workers.execute(() -> run(job));
        } catch (RejectedExecutionException ex) {
            synchronized (lock) {
                inFlight--;
            }
            job.result.complete(ResponseEnvelope.failure());
        }
    }

    private void run(Job job) {
        ResponseEnvelope envelope;
        try {
            envelope = transport.exchange(job.request);
            if (envelope == null) {
                envelope = ResponseEnvelope.failure();
            }
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, ex, () -> String.format(Locale.ROOT,
                "[multicurl] transport raised for %s; treating as failed exchange", job.request.url()));
            envelope = ResponseEnvelope.failure();
        }
        // Completion callbacks run on this worker; the slot is released only afterwards so the next admitted job
        // is not left waiting in the executor queue behind them.
        try {
            job.result.complete(envelope);
        } finally {
            synchronized (lock) {
                inFlight--;
            }
            drain();
        }
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Job(RequestConfig request, CompletableFuture<ResponseEnvelope> result) {
    }
}
