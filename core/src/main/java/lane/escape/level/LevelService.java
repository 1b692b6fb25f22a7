package lane.escape.level;

import com.badlogic.gdx.utils.Disposable;
import com.badlogic.gdx.utils.TimeUtils;
import com.esotericsoftware.minlog.Log;
import lane.escape.GeneratorConfig;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out boards per level, generating them ahead of time on worker threads.
 * <p>
 * At most one generation per level is in flight; callers asking for the same level share it.
 * A finished board is handed out once and then forgotten, so the next request for that level
 * produces a fresh variant. When the background result is late or fails, the caller gets a board
 * generated on its own thread and the background one is discarded.
 * <p>
 * Thread-safe.
 */
public class LevelService implements Disposable {
    private static final long DISPOSE_WAIT_MS = 1000L;

    private final LevelGenerator generator;
    private final ExecutorService executor;
    private final Map<Integer, CompletableFuture<GenerationResult>> inFlight = new ConcurrentHashMap<>();
    private final Map<Integer, AtomicInteger> variants = new ConcurrentHashMap<>();
    private final List<GenerationListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean disposed;

    public LevelService(GeneratorConfig config) {
        this(new LevelGenerator(config), config.getWorkerThreads());
    }

    public LevelService(LevelGenerator generator, int workerThreads) {
        this.generator = generator;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, workerThreads), runnable -> {
            Thread thread = new Thread(runnable, "LevelGenWorker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void addListener(GenerationListener listener) {
        if (listener != null && !listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    public void removeListener(GenerationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Starts generating {@code level} in the background unless it is already in flight.
     *
     * @return the shared in-flight generation
     */
    public CompletableFuture<GenerationResult> prefetch(int level) {
        if (level < 1) {
            throw new IllegalArgumentException("Level must be >= 1: " + level);
        }
        if (disposed) {
            throw new IllegalStateException("LevelService is disposed");
        }
        return inFlight.computeIfAbsent(level, this::startBackground);
    }

    private CompletableFuture<GenerationResult> startBackground(int level) {
        int variant = nextVariant(level);
        Log.debug("LevelService", "Queued level " + level + " variant " + variant);
        return CompletableFuture.supplyAsync(() -> {
            long start = TimeUtils.millis();
            for (GenerationListener listener : listeners) {
                listener.onGenerationStarted(level);
            }
            try {
                GenerationResult result = generator.generate(level, variant);
                Log.debug("LevelService", "Background level " + level + " done in " + TimeUtils.timeSinceMillis(start) + "ms");
                for (GenerationListener listener : listeners) {
                    listener.onGenerationCompleted(level, result);
                }
                return result;
            } catch (RuntimeException e) {
                for (GenerationListener listener : listeners) {
                    listener.onGenerationFailed(level, e);
                }
                throw e;
            }
        }, executor);
    }

    /**
     * Waits for the level's board as long as it takes.
     */
    public GenerationResult obtain(int level) {
        return obtain(level, Long.MAX_VALUE);
    }

    /**
     * Returns the level's board, waiting at most {@code timeoutMs} for the background worker
     * before generating it on the calling thread.
     */
    public GenerationResult obtain(int level, long timeoutMs) {
        CompletableFuture<GenerationResult> future = prefetch(level);
        try {
            GenerationResult result = timeoutMs == Long.MAX_VALUE
                ? future.get()
                : future.get(timeoutMs, TimeUnit.MILLISECONDS);
            inFlight.remove(level, future);
            return result;
        } catch (TimeoutException e) {
            Log.warn("LevelService", "Level " + level + " not ready after " + timeoutMs + "ms, generating in foreground");
        } catch (ExecutionException e) {
            Log.error("LevelService", "Background generation of level " + level + " failed: " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Log.warn("LevelService", "Interrupted while waiting for level " + level + ", generating in foreground");
        }
        inFlight.remove(level, future);
        return generator.generate(level, nextVariant(level));
    }

    public boolean isPending(int level) {
        return inFlight.containsKey(level);
    }

    /**
     * Drops a pending background result without waiting for it.
     */
    public void discard(int level) {
        if (inFlight.remove(level) != null) {
            Log.debug("LevelService", "Discarded pending level " + level);
        }
    }

    private int nextVariant(int level) {
        return variants.computeIfAbsent(level, k -> new AtomicInteger()).getAndIncrement();
    }

    public LevelGenerator getGenerator() {
        return generator;
    }

    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(DISPOSE_WAIT_MS, TimeUnit.MILLISECONDS)) {
                Log.warn("LevelService", "Workers did not stop within " + DISPOSE_WAIT_MS + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Log.warn("LevelService", "Interrupted while stopping workers");
        }
        inFlight.clear();
        Log.info("LevelService", "Disposed");
    }
}
