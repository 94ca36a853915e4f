package bulwark.core.service.openapi;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import bulwark.core.cache.JacksonArtifactCopier;
import bulwark.core.cache.MemoizedBuilder;
import bulwark.core.config.SpecDocumentConfig;
import bulwark.core.model.openapi.ApiSpecDocument;
import bulwark.core.service.auth.ApiKeyAuthenticator;

/**
 * Serves the API specification document, rebuilding it at most once per TTL.
 *
 * <p>The document is invalidated whenever the resource catalog changes.
 * Metrics: {@code bulwark.openapi.builds} and {@code bulwark.openapi.cache.hits}.
 */
@ApplicationScoped
public class SpecDocumentService {

    private static final Logger LOG = Logger.getLogger(SpecDocumentService.class);

    private final MemoizedBuilder<ApiSpecDocument> builder;

    @Inject
    public SpecDocumentService(
            SpecGenerator generator,
            ResourceCatalog catalog,
            ApiKeyAuthenticator authenticator,
            SpecDocumentConfig config,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this(generator, catalog, authenticator, config, objectMapper, Clock.systemUTC());

        FunctionCounter.builder("bulwark.openapi.builds", builder, MemoizedBuilder::buildCount)
                .description("Number of times the API specification document was generated")
                .register(meterRegistry);
        FunctionCounter.builder("bulwark.openapi.cache.hits", builder, MemoizedBuilder::hitCount)
                .description("Number of API specification requests served from cache")
                .register(meterRegistry);
    }

    SpecDocumentService(
            SpecGenerator generator,
            ResourceCatalog catalog,
            ApiKeyAuthenticator authenticator,
            SpecDocumentConfig config,
            ObjectMapper objectMapper,
            Clock clock) {
        this.builder = new MemoizedBuilder<>(
                "api specification",
                () -> Uni.createFrom()
                        .item(() -> generator.generate(catalog.resources(), authenticator.headerName()))
                        .runSubscriptionOn(Infrastructure.getDefaultWorkerPool()),
                new JacksonArtifactCopier<>(objectMapper, ApiSpecDocument.class),
                config.copyFailure(),
                config.cacheTtl(),
                clock);
        LOG.infof("API specification cache initialized (ttl: %s, copy failure: %s)",
                config.cacheTtl(), config.copyFailure());
    }

    /**
     * The current document. Each subscriber gets its own copy.
     */
    public Uni<ApiSpecDocument> getDocument() {
        return builder.getOrBuild();
    }

    /**
     * Force the next request to regenerate the document.
     */
    public void invalidate() {
        builder.invalidate();
        LOG.info("API specification cache invalidated");
    }

    public Optional<Instant> builtAt() {
        return builder.builtAt();
    }

    public long buildCount() {
        return builder.buildCount();
    }

    void onCatalogChanged(@Observes ResourceCatalogChanged event) {
        LOG.debugf("Resource %s %s, invalidating API specification",
                event.slug(), event.change().name().toLowerCase());
        builder.invalidate();
    }
}
