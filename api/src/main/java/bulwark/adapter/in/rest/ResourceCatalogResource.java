package bulwark.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import bulwark.adapter.in.dto.ResourceRegistrationRequest;
import bulwark.adapter.in.problem.PanelProblem;
import bulwark.core.model.openapi.ResourceDescriptor;
import bulwark.core.service.openapi.ResourceCatalog;

/**
 * REST resource for registering panel resources.
 */
@Path("/admin/resources")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ResourceCatalogResource {

    private final ResourceCatalog catalog;

    public ResourceCatalogResource(ResourceCatalog catalog) {
        this.catalog = catalog;
    }

    @GET
    public List<ResourceDescriptor> listResources() {
        return catalog.resources();
    }

    @PUT
    @Path("/{slug}")
    @Consumes(MediaType.APPLICATION_JSON)
    public ResourceDescriptor registerResource(
            @PathParam("slug") String slug, @Valid ResourceRegistrationRequest request) {
        final var descriptor = request == null
                ? new ResourceDescriptor(slug, null, List.of())
                : request.toModel(slug);
        catalog.register(descriptor);
        return descriptor;
    }

    @DELETE
    @Path("/{slug}")
    public Response removeResource(@PathParam("slug") String slug) {
        if (!catalog.unregister(slug)) {
            throw PanelProblem.notFound("Resource not registered: " + slug);
        }
        return Response.noContent().build();
    }
}
