package com.kconfig.semantics.validation;

import com.kconfig.semantics.KconfigSettings;
import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.overrides.BuildContext;
import com.kconfig.semantics.overrides.OverrideFile;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Debounces lint requests and runs them on a single worker thread. A request replaces any pending
 * request for the same file; a running pass notices a newer file version and stops on its own.
 */
public final class LintScheduler implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(LintScheduler.class.getName());

    private final OverrideLinter linter;
    private final LintListener listener;
    private final long debounceMillis;
    private final ScheduledExecutorService executor;
    private final Map<OverrideFile, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public LintScheduler(OverrideLinter linter, LintListener listener) {
        this(linter, listener, KconfigSettings.lintDebounceMillis());
    }

    public LintScheduler(OverrideLinter linter, LintListener listener, long debounceMillis) {
        this.linter = Objects.requireNonNull(linter, "linter");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.debounceMillis = debounceMillis;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "kconfig-lint");
            thread.setDaemon(true);
            return thread;
        });
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    /** Lints {@code file} once no further request for it arrived within the debounce delay. */
    public void schedule(OverrideFile file, BuildContext build) {
        submit(file, build, debounceMillis);
    }

    /** Lints {@code file} without waiting, replacing a pending debounced request. */
    public void lintNow(OverrideFile file, BuildContext build) {
        submit(file, build, 0);
    }

    private void submit(OverrideFile file, BuildContext build, long delay) {
        ScheduledFuture<?> future = executor.schedule(() -> run(file, build), delay, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = pending.put(file, future);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    private void run(OverrideFile file, BuildContext build) {
        OverrideFile.Snapshot snapshot = file.getSnapshot();
        LOGGER.log(Level.FINE, "Lint of {0} version {1} starting", new Object[] {file, snapshot.version()});
        try {
            Optional<List<Diagnostic>> result = linter.lint(file, build, snapshot);
            if (result.isEmpty()) {
                return;
            }
            List<Diagnostic> all = new ArrayList<>(snapshot.diagnostics());
            all.addAll(result.get());
            listener.published(file, snapshot.version(), all);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Lint of " + file + " failed", ex);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                LOGGER.warning("Lint worker did not stop within one second");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        pending.clear();
    }
}
