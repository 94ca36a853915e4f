package bulwark.adapter.in.http;

import jakarta.ws.rs.container.ContainerRequestContext;

import bulwark.spi.ApiKeyRequestContext;

/**
 * {@link ApiKeyRequestContext} backed by a JAX-RS request.
 *
 * <p>The authentication marker is stored as a request property so that later
 * filters and resources see it.
 */
public final class ContainerApiKeyRequestContext implements ApiKeyRequestContext {

    static final String API_KEY_AUTHENTICATED = "bulwark.auth.api-key.authenticated";

    private final ContainerRequestContext requestContext;

    public ContainerApiKeyRequestContext(ContainerRequestContext requestContext) {
        this.requestContext = requestContext;
    }

    @Override
    public String header(String name) {
        return requestContext.getHeaderString(name);
    }

    @Override
    public String path() {
        return requestContext.getUriInfo().getPath();
    }

    @Override
    public void markApiKeyAuthenticated() {
        requestContext.setProperty(API_KEY_AUTHENTICATED, Boolean.TRUE);
    }

    @Override
    public boolean isApiKeyAuthenticated() {
        return isApiKeyAuthenticated(requestContext);
    }

    /**
     * Whether the API key filter authenticated this request.
     */
    public static boolean isApiKeyAuthenticated(ContainerRequestContext requestContext) {
        return Boolean.TRUE.equals(requestContext.getProperty(API_KEY_AUTHENTICATED));
    }
}
