package bulwark.core.service.openapi;

/**
 * CDI event fired when a resource is registered or removed.
 *
 * @param slug   the affected resource
 * @param change what happened
 */
public record ResourceCatalogChanged(String slug, Change change) {

    public enum Change {
        REGISTERED,
        REMOVED
    }
}
