package bulwark.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.jboss.logging.Logger;

import bulwark.core.config.AccountLockoutConfig;
import bulwark.core.model.auth.LockoutStatus;
import bulwark.core.util.SecureHash;

/**
 * Per-identifier failed-attempt counter with temporary lockout.
 *
 * <p>
 * Identifiers are opaque strings supplied by the caller, typically a
 * normalized e-mail address or a client IP. Each identifier moves through:
 * <ul>
 * <li><b>Clean</b> - no entry</li>
 * <li><b>Accumulating</b> - entry exists, fewer than {@code maxAttempts} failures</li>
 * <li><b>Locked</b> - threshold reached and the lock has not expired yet</li>
 * </ul>
 * An expired lock is only noticed on the next read or failure (lazy expiry).
 * The first failure after a lock expires starts a fresh count of one.
 *
 * <p>
 * A background sweep periodically drops entries that never reached the
 * threshold and are not locked, bounding memory used by one-off failures.
 * Entries that were once fully locked are kept until the next failure or an
 * explicit reset so they remain visible for audit.
 *
 * <p>
 * Reads take the shared lock and writes the exclusive lock; the sweep holds the
 * exclusive lock only while removing entries. Call {@link #shutdown()} to stop
 * the sweep; it waits for a running sweep to finish and is safe to call twice.
 */
public class AttemptTracker {

    private static final Logger LOG = Logger.getLogger(AttemptTracker.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, AttemptEntry> attempts = new HashMap<>();
    private final int maxAttempts;
    private final Duration lockoutDuration;
    private final Clock clock;
    private final ScheduledExecutorService sweepExecutor;
    private final AtomicBoolean shutdown = new AtomicBoolean();

    public AttemptTracker(AccountLockoutConfig config) {
        this(config.maxAttempts(), config.lockoutDuration(), config.sweepInterval(), Clock.systemUTC(),
                config.enabled());
    }

    public AttemptTracker(int maxAttempts, Duration lockoutDuration, Duration sweepInterval, Clock clock) {
        this(maxAttempts, lockoutDuration, sweepInterval, clock, true);
    }

    /**
     * @param scheduleSweep false to skip the background sweep thread; {@link #sweep()}
     *                      can still be called directly
     */
    public AttemptTracker(
            int maxAttempts, Duration lockoutDuration, Duration sweepInterval, Clock clock, boolean scheduleSweep) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        Objects.requireNonNull(lockoutDuration, "lockoutDuration");
        Objects.requireNonNull(sweepInterval, "sweepInterval");
        if (lockoutDuration.isNegative()) {
            throw new IllegalArgumentException("lockoutDuration must not be negative: " + lockoutDuration);
        }
        if (sweepInterval.isZero() || sweepInterval.isNegative()) {
            throw new IllegalArgumentException("sweepInterval must be positive: " + sweepInterval);
        }
        this.maxAttempts = maxAttempts;
        this.lockoutDuration = lockoutDuration;
        this.clock = Objects.requireNonNull(clock, "clock");

        if (scheduleSweep) {
            this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                final var t = new Thread(r, "attempt-tracker-sweep");
                t.setDaemon(true);
                return t;
            });
            final var intervalMillis = sweepInterval.toMillis();
            sweepExecutor.scheduleWithFixedDelay(this::sweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        } else {
            this.sweepExecutor = null;
        }

        LOG.infof(
                "Initialized attempt tracker (maxAttempts: %d, lockout: %s, sweep: %s)",
                maxAttempts, lockoutDuration, scheduleSweep ? sweepInterval : "off");
    }

    /**
     * Check whether an identifier is locked right now.
     *
     * @param identifier the tracked identifier
     * @return true iff an entry exists and its lock has not expired
     */
    public boolean isLocked(String identifier) {
        lock.readLock().lock();
        try {
            final var entry = attempts.get(identifier);
            return entry != null && entry.lockedAt(clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Record a failed attempt, locking the identifier once the threshold is reached.
     *
     * @param identifier the tracked identifier
     * @return failure count after this attempt
     */
    public int recordFailure(String identifier) {
        Objects.requireNonNull(identifier, "identifier");
        final int count;
        final boolean lockedNow;
        lock.writeLock().lock();
        try {
            final var now = clock.instant();
            final var entry = attempts.computeIfAbsent(identifier, k -> new AttemptEntry());

            if (entry.lockExpiredAt(now)) {
                entry.failureCount = 0;
                entry.lockedUntil = null;
            }

            entry.failureCount++;
            lockedNow = entry.failureCount >= maxAttempts;
            if (lockedNow) {
                entry.lockedUntil = now.plus(lockoutDuration);
            }
            count = entry.failureCount;
        } finally {
            lock.writeLock().unlock();
        }

        if (lockedNow) {
            LOG.warnf(
                    "Identifier %s locked after %d failed attempts (duration: %s)",
                    SecureHash.forLog(identifier), count, lockoutDuration);
        } else {
            LOG.debugf("Failed attempt recorded for %s: count=%d", SecureHash.forLog(identifier), count);
        }
        return count;
    }

    /**
     * Forget an identifier entirely, typically after a successful authentication.
     *
     * @param identifier the tracked identifier
     */
    public void resetAttempts(String identifier) {
        final AttemptEntry removed;
        lock.writeLock().lock();
        try {
            removed = attempts.remove(identifier);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            LOG.debugf("Cleared failed attempts for %s", SecureHash.forLog(identifier));
        }
    }

    /**
     * Attempts left before the identifier is locked.
     *
     * @param identifier the tracked identifier
     * @return {@code maxAttempts} when clean or the lock has expired, otherwise
     *         {@code max(0, maxAttempts - failureCount)}
     */
    public int getRemainingAttempts(String identifier) {
        lock.readLock().lock();
        try {
            return remaining(attempts.get(identifier), clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Raw failure count of the current entry.
     *
     * @param identifier the tracked identifier
     * @return failure count, 0 when no entry exists
     */
    public int failureCount(String identifier) {
        lock.readLock().lock();
        try {
            final var entry = attempts.get(identifier);
            return entry == null ? 0 : entry.failureCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * End of the active lock.
     *
     * @param identifier the tracked identifier
     * @return the expiry, or empty when the identifier is not locked
     */
    public Optional<Instant> lockedUntil(String identifier) {
        lock.readLock().lock();
        try {
            final var entry = attempts.get(identifier);
            if (entry == null || !entry.lockedAt(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry.lockedUntil);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of one identifier.
     *
     * @param identifier the tracked identifier
     * @return status, {@link LockoutStatus#clean} when untracked
     */
    public LockoutStatus status(String identifier) {
        lock.readLock().lock();
        try {
            final var entry = attempts.get(identifier);
            if (entry == null) {
                return LockoutStatus.clean(identifier, maxAttempts);
            }
            return toStatus(identifier, entry, clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of all identifiers locked right now, soonest expiry first.
     */
    public List<LockoutStatus> lockouts() {
        final var result = new ArrayList<LockoutStatus>();
        lock.readLock().lock();
        try {
            final var now = clock.instant();
            attempts.forEach((identifier, entry) -> {
                if (entry.lockedAt(now)) {
                    result.add(toStatus(identifier, entry, now));
                }
            });
        } finally {
            lock.readLock().unlock();
        }
        result.sort(Comparator.comparing(status -> status.lockedUntil().orElse(Instant.MAX)));
        return result;
    }

    /**
     * Number of identifiers currently held in memory.
     */
    public int trackedCount() {
        lock.readLock().lock();
        try {
            return attempts.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration lockoutDuration() {
        return lockoutDuration;
    }

    /**
     * Drop entries that are not locked and never reached the threshold.
     *
     * <p>Runs on the background schedule; does nothing after {@link #shutdown()}.
     *
     * @return number of removed entries
     */
    public int sweep() {
        if (shutdown.get()) {
            return 0;
        }
        final int removed;
        final int remaining;
        lock.writeLock().lock();
        try {
            final var now = clock.instant();
            final var before = attempts.size();
            attempts.values().removeIf(entry -> !entry.lockedAt(now) && entry.failureCount < maxAttempts);
            remaining = attempts.size();
            removed = before - remaining;
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            LOG.debugf("Swept %d abandoned attempt entries, %d remaining", removed, remaining);
        }
        return removed;
    }

    /**
     * Stop the background sweep and wait until it has terminated.
     *
     * <p>Safe to call more than once.
     */
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            LOG.info("Shutting down attempt tracker sweep");
        }
        if (sweepExecutor == null) {
            return;
        }
        sweepExecutor.shutdown();
        try {
            if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sweepExecutor.shutdownNow();
                sweepExecutor.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            sweepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutdown() {
        return shutdown.get() && (sweepExecutor == null || sweepExecutor.isTerminated());
    }

    /**
     * Whether a background sweep thread was started.
     */
    public boolean isSweepScheduled() {
        return sweepExecutor != null;
    }

    private int remaining(AttemptEntry entry, Instant now) {
        if (entry == null || entry.lockExpiredAt(now)) {
            return maxAttempts;
        }
        return Math.max(0, maxAttempts - entry.failureCount);
    }

    private LockoutStatus toStatus(String identifier, AttemptEntry entry, Instant now) {
        return new LockoutStatus(
                identifier,
                entry.failureCount,
                entry.lockedAt(now),
                Optional.ofNullable(entry.lockedUntil),
                remaining(entry, now));
    }

    /**
     * Mutable state for one identifier, only touched under {@link #lock}.
     */
    private static final class AttemptEntry {
        private int failureCount;
        private Instant lockedUntil;

        boolean lockedAt(Instant now) {
            return lockedUntil != null && now.isBefore(lockedUntil);
        }

        boolean lockExpiredAt(Instant now) {
            return lockedUntil != null && !now.isBefore(lockedUntil);
        }
    }
}
