package bulwark.core.model.openapi;

import java.util.List;
import java.util.Map;

/**
 * Generated API specification document.
 *
 * <p>The collections are mutable so that callers can post-process their own
 * copy; the cached master instance is never handed out.
 *
 * @param openapi    OpenAPI version string
 * @param info       title, version and description
 * @param servers    server entries
 * @param paths      path to HTTP method (lower case) to operation
 * @param components schemas and security schemes
 * @param tags       one tag per resource
 */
public record ApiSpecDocument(
        String openapi,
        SpecInfo info,
        List<SpecServer> servers,
        Map<String, Map<String, SpecOperation>> paths,
        SpecComponents components,
        List<SpecTag> tags) {}
