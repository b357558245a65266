package ibft.validator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.function.Supplier;

// The one thread that owns a shard's consensus state. Every log mutation, validation and
// transition is submitted here, so no two of them for the same shard ever run concurrently.
public final class ConsensusEngine {
    private static final Logger log = LoggerFactory.getLogger(ConsensusEngine.class);
    private final ExecutorService exec;
    private final String name;

    public ConsensusEngine(String name) {
        this.name = name;
        this.exec = Executors.newSingleThreadExecutor(new NamedTF(name));
    }

    public void submit(String reason, Runnable r) {
        try {
            exec.execute(() -> {
                try { r.run(); } catch (Throwable t) { log.error("IBFT task failed: {} on {}", reason, name, t); }
            });
        } catch (RejectedExecutionException e) {
            log.debug("IBFT task dropped after shutdown: {} on {}", reason, name);
        }
    }

    public <T> CompletableFuture<T> call(String reason, Supplier<T> s) {
        CompletableFuture<T> f = new CompletableFuture<>();
        try {
            exec.execute(() -> {
                try { f.complete(s.get()); } catch (Throwable t) { f.completeExceptionally(t); }
            });
        } catch (RejectedExecutionException e) {
            f.completeExceptionally(new IllegalStateException(name + " is shut down: " + reason, e));
        }
        return f;
    }

    public void shutdown() { exec.shutdown(); }

    static final class NamedTF implements ThreadFactory {
        private final String base;
        NamedTF(String base) { this.base = base; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, base);
            t.setDaemon(true);
            return t;
        }
    }
}
