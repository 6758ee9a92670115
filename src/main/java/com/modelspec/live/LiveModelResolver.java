package com.modelspec.live;

import com.modelspec.model.AssemblyResult;
import com.modelspec.model.AssemblyStatus;
import com.modelspec.model.ModelSpecAssembler;
import com.modelspec.model.ResolutionToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Debounced formula resolution for live editing.
 * <p>
 * Each request gets a {@link ResolutionToken}; a newer request invalidates the
 * previous token and cancels its pending task. Work runs on a dedicated
 * single-thread scheduler and only the result of the current request reaches
 * the listener. The listener is never called concurrently.
 */
public class LiveModelResolver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LiveModelResolver.class);

    public static final long DEFAULT_DEBOUNCE_MILLIS = 400;

    private static final String THREAD_NAME = "formula-resolver";

    private final ModelSpecAssembler assembler;
    private final long debounceMillis;
    private final Consumer<AssemblyResult> listener;
    private final ScheduledThreadPoolExecutor scheduler;

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicReference<ResolutionToken> currentToken = new AtomicReference<>();
    private final AtomicReference<AssemblyResult> latest = new AtomicReference<>(AssemblyResult.empty());
    private final Object scheduleLock = new Object();
    private final Object publishLock = new Object();
    private ScheduledFuture<?> pending;

    public LiveModelResolver(ModelSpecAssembler assembler, Consumer<AssemblyResult> listener) {
        this(assembler, DEFAULT_DEBOUNCE_MILLIS, listener);
    }

    public LiveModelResolver(ModelSpecAssembler assembler, long debounceMillis, Consumer<AssemblyResult> listener) {
        if (debounceMillis < 0) {
            throw new IllegalArgumentException("Debounce window cannot be negative: " + debounceMillis);
        }
        this.assembler = assembler;
        this.debounceMillis = debounceMillis;
        this.listener = listener == null ? result -> { } : listener;
        this.scheduler = createScheduler();
    }

    private static ScheduledThreadPoolExecutor createScheduler() {
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        };
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return executor;
    }

    /**
     * Schedule resolution of a formula after the debounce window.
     * Supersedes any request still pending.
     *
     * @param formula Formula text
     * @return Token of the new request
     */
    public ResolutionToken submit(String formula) {
        ensureOpen();
        synchronized (scheduleLock) {
            ResolutionToken token = supersede();
            pending = scheduler.schedule(() -> run(formula, token), debounceMillis, TimeUnit.MILLISECONDS);
            log.debug("Scheduled {} in {} ms", token, debounceMillis);
            return token;
        }
    }

    /**
     * Resolve a formula immediately on the calling thread, superseding pending requests.
     * Used when a formula is set programmatically rather than typed.
     *
     * @param formula Formula text
     * @return Assembly result
     */
    public AssemblyResult resolveNow(String formula) {
        ensureOpen();
        ResolutionToken token;
        synchronized (scheduleLock) {
            token = supersede();
            pending = null;
        }
        AssemblyResult result = assembler.assemble(formula, token);
        publish(result, token);
        return result;
    }

    /**
     * Last result delivered to the listener.
     */
    public AssemblyResult getLatest() {
        return latest.get();
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    public Optional<ResolutionToken> getCurrentToken() {
        return Optional.ofNullable(currentToken.get());
    }

    public boolean isClosed() {
        return scheduler.isShutdown();
    }

    @Override
    public void close() {
        if (scheduler.isShutdown()) {
            return;
        }
        synchronized (scheduleLock) {
            ResolutionToken token = currentToken.getAndSet(null);
            if (token != null) {
                token.invalidate();
            }
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        scheduler.shutdownNow();
        log.info("LiveModelResolver closed");
    }

    private ResolutionToken supersede() {
        ResolutionToken token = new ResolutionToken(sequence.incrementAndGet());
        ResolutionToken previous = currentToken.getAndSet(token);
        if (previous != null) {
            previous.invalidate();
        }
        if (pending != null) {
            pending.cancel(false);
        }
        return token;
    }

    private void run(String formula, ResolutionToken token) {
        try {
            publish(assembler.assemble(formula, token), token);
        } catch (RuntimeException e) {
            log.error("Unexpected failure resolving formula '{}'", formula, e);
        }
    }

    // Check, store and notify as one step: a superseded result can never land after a newer one
    private void publish(AssemblyResult result, ResolutionToken token) {
        synchronized (publishLock) {
            if (result.getStatus() == AssemblyStatus.CANCELLED
                    || !token.isValid()
                    || currentToken.get() != token) {
                log.debug("Discarding result of superseded {}", token);
                return;
            }
            latest.set(result);
            listener.accept(result);
        }
    }

    private void ensureOpen() {
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("LiveModelResolver is closed");
        }
    }
}
