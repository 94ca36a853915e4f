package bulwark.core.service.openapi;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;

import org.jboss.logging.Logger;

import bulwark.core.model.openapi.ResourceDescriptor;

/**
 * Registry of resources exposed by the panel API.
 *
 * <p>Every change fires {@link ResourceCatalogChanged} so that derived
 * artifacts such as the API specification document can be invalidated.
 */
@ApplicationScoped
public class ResourceCatalog {

    private static final Logger LOG = Logger.getLogger(ResourceCatalog.class);

    private final ConcurrentMap<String, ResourceDescriptor> resources = new ConcurrentHashMap<>();
    private final Event<ResourceCatalogChanged> changes;

    public ResourceCatalog(Event<ResourceCatalogChanged> changes) {
        this.changes = changes;
    }

    /**
     * Register or replace a resource.
     *
     * @param descriptor the resource
     */
    public void register(ResourceDescriptor descriptor) {
        resources.put(descriptor.slug(), descriptor);
        LOG.infof("Registered resource %s (%d fields)", descriptor.slug(), descriptor.fields().size());
        changes.fire(new ResourceCatalogChanged(descriptor.slug(), ResourceCatalogChanged.Change.REGISTERED));
    }

    /**
     * Remove a resource.
     *
     * @param slug the resource slug
     * @return true if it was registered
     */
    public boolean unregister(String slug) {
        final var removed = resources.remove(slug) != null;
        if (removed) {
            LOG.infof("Removed resource %s", slug);
            changes.fire(new ResourceCatalogChanged(slug, ResourceCatalogChanged.Change.REMOVED));
        }
        return removed;
    }

    public Optional<ResourceDescriptor> find(String slug) {
        return Optional.ofNullable(resources.get(slug));
    }

    /**
     * Registered resources ordered by slug.
     */
    public List<ResourceDescriptor> resources() {
        return resources.values().stream()
                .sorted(Comparator.comparing(ResourceDescriptor::slug))
                .toList();
    }
}
