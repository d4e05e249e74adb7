package com.auditflow.core.incremental;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per project root, serialising audits and cache administration on
 * the same project within this process.
 */
@Component
public class ProjectLocks {

    private static final Logger log = LoggerFactory.getLogger(ProjectLocks.class);

    private final ConcurrentHashMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Acquires the lock for {@code projectRoot}, waiting at most {@code timeout}.
     * A lock is dropped from the table once released with no thread waiting on it.
     *
     * @return a handle that releases the lock when closed
     * @throws AuditFailedException if the lock is not acquired in time or the wait is interrupted
     */
    public Held acquire(Path projectRoot, Duration timeout) {
        Path key = projectRoot.toAbsolutePath().normalize();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
            try {
                if (!lock.tryLock(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                    throw new AuditFailedException("Another audit holds the lock for " + key
                            + " (waited " + timeout.toSeconds() + "s)");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AuditFailedException("Interrupted while waiting for the lock on " + key, e);
            }
            if (locks.get(key) == lock) {
                log.debug("Acquired project lock for {}", key);
                return () -> release(key, lock);
            }
            // evicted while we waited on it
            lock.unlock();
        }
    }

    private void release(Path key, ReentrantLock lock) {
        lock.unlock();
        locks.computeIfPresent(key, (k, current) ->
                current == lock && !current.isLocked() && !current.hasQueuedThreads() ? null : current);
    }

    public boolean isLocked(Path projectRoot) {
        ReentrantLock lock = locks.get(projectRoot.toAbsolutePath().normalize());
        return lock != null && lock.isLocked();
    }

    int trackedRoots() {
        return locks.size();
    }

    /**
     * A held project lock.
     */
    @FunctionalInterface
    public interface Held extends AutoCloseable {
        @Override
        void close();
    }
}
