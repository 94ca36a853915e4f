package bulwark.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Caches one expensive artifact with a TTL and coalesces concurrent rebuilds.
 *
 * <p>Features:
 * <ul>
 *   <li>A fresh value ({@code now - builtAt < ttl}) is served without building</li>
 *   <li>Thundering herd protection: callers missing the cache at the same time
 *       share one build and one result (value or failure)</li>
 *   <li>The cache is re-checked inside the build round, so callers that raced
 *       into the round after another build finished do not build again</li>
 *   <li>Failures are never cached</li>
 *   <li>Every caller receives its own deep copy of the value</li>
 * </ul>
 *
 * <p>A TTL of zero disables caching: every call builds, but concurrent calls
 * still share a round. {@link #invalidate()} bumps a generation counter so a
 * round started before the invalidation cannot repopulate the cache.
 *
 * <p>The build function hands ownership of the returned value to this class.
 *
 * @param <T> the artifact type
 */
public class MemoizedBuilder<T> {

    private static final Logger LOG = Logger.getLogger(MemoizedBuilder.class);

    private final String name;
    private final Supplier<Uni<T>> buildFunction;
    private final ArtifactCopier<T> copier;
    private final CopyFailurePolicy copyFailurePolicy;
    private final Duration ttl;
    private final Clock clock;

    private final Map<String, Uni<T>> inFlightBuilds = new ConcurrentHashMap<>();
    private final Object stateLock = new Object();
    private final AtomicLong builds = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();

    // guarded by stateLock for writes
    private volatile CachedArtifact<T> cached;
    private long generation;

    public MemoizedBuilder(
            String name,
            Supplier<Uni<T>> buildFunction,
            ArtifactCopier<T> copier,
            CopyFailurePolicy copyFailurePolicy,
            Duration ttl,
            Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.buildFunction = Objects.requireNonNull(buildFunction, "buildFunction");
        this.copier = Objects.requireNonNull(copier, "copier");
        this.copyFailurePolicy = Objects.requireNonNull(copyFailurePolicy, "copyFailurePolicy");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
        }
    }

    /**
     * Return a copy of the cached artifact, building it first if needed.
     *
     * @return Uni with an independent copy, or failing with {@link BuildFailedException}
     */
    public Uni<T> getOrBuild() {
        return Uni.createFrom().deferred(() -> {
            final var fresh = freshValue();
            if (fresh != null) {
                hits.incrementAndGet();
                LOG.debugv("Serving cached {0}", name);
                return copyOut(fresh.value());
            }
            return inFlightBuilds.computeIfAbsent(name, this::createBuild).flatMap(this::copyOut);
        });
    }

    /**
     * Drop the cached value. The next {@link #getOrBuild()} rebuilds.
     */
    public void invalidate() {
        synchronized (stateLock) {
            generation++;
            cached = null;
        }
        inFlightBuilds.remove(name);
        LOG.debugv("Invalidated cached {0}", name);
    }

    /**
     * Whether a value would be served without building.
     */
    public boolean isFresh() {
        return freshValue() != null;
    }

    /**
     * When the cached value was built, if one is held.
     */
    public Optional<Instant> builtAt() {
        final var current = cached;
        return current == null ? Optional.empty() : Optional.of(current.builtAt());
    }

    /**
     * Number of times the build function has been invoked.
     */
    public long buildCount() {
        return builds.get();
    }

    /**
     * Number of reads served from the cache.
     */
    public long hitCount() {
        return hits.get();
    }

    public Duration ttl() {
        return ttl;
    }

    private CachedArtifact<T> freshValue() {
        if (ttl.isZero()) {
            return null;
        }
        final var current = cached;
        if (current == null) {
            return null;
        }
        final var age = Duration.between(current.builtAt(), clock.instant());
        return age.compareTo(ttl) < 0 ? current : null;
    }

    /**
     * One build round shared by every caller that finds it in {@link #inFlightBuilds}.
     */
    private Uni<T> createBuild(String key) {
        final var self = new AtomicReference<Uni<T>>();
        final Uni<T> build = Uni.createFrom()
                .<T>deferred(() -> {
                    final var fresh = freshValue();
                    if (fresh != null) {
                        return Uni.createFrom().item(fresh.value());
                    }
                    final long startedGeneration;
                    synchronized (stateLock) {
                        startedGeneration = generation;
                    }
                    builds.incrementAndGet();
                    LOG.debugv("Building {0}", name);
                    return invokeBuild().invoke(value -> store(value, startedGeneration));
                })
                .onFailure()
                .transform(failure -> BuildFailedException.wrap(name, failure))
                .onTermination()
                .invoke(() -> inFlightBuilds.remove(key, self.get()))
                .memoize()
                .indefinitely();
        self.set(build);
        return build;
    }

    private Uni<T> invokeBuild() {
        final Uni<T> result;
        try {
            result = buildFunction.get();
        } catch (RuntimeException e) {
            return Uni.createFrom().failure(e);
        }
        if (result == null) {
            return Uni.createFrom().failure(new BuildFailedException("Build function for " + name + " returned null"));
        }
        return result.onItem().ifNull().failWith(() -> new BuildFailedException("Built " + name + " was null"));
    }

    private void store(T value, long startedGeneration) {
        if (ttl.isZero()) {
            return;
        }
        synchronized (stateLock) {
            if (generation != startedGeneration) {
                LOG.debugv("Discarding {0} built before invalidation", name);
                return;
            }
            cached = new CachedArtifact<>(value, clock.instant());
        }
        LOG.debugv("Cached {0} (ttl: {1})", name, ttl);
    }

    private Uni<T> copyOut(T value) {
        return Uni.createFrom().item(() -> copy(value));
    }

    private T copy(T value) {
        try {
            return copier.copy(value);
        } catch (ArtifactCopyException e) {
            if (copyFailurePolicy == CopyFailurePolicy.FAIL) {
                throw new BuildFailedException("Cannot hand out a copy of " + name, e);
            }
            LOG.warnv("Returning shared {0}, copy failed: {1}", name, e.getMessage());
            return value;
        }
    }

    private record CachedArtifact<T>(T value, Instant builtAt) {}
}
