package bulwark.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import bulwark.core.model.openapi.ApiSpecDocument;
import bulwark.core.service.openapi.SpecDocumentService;

/**
 * Serves the generated API specification and lets admins drop the cached copy.
 */
@Path("/")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class SpecDocumentResource {

    private final SpecDocumentService documentService;

    public SpecDocumentResource(SpecDocumentService documentService) {
        this.documentService = documentService;
    }

    @GET
    @Path("openapi.json")
    public Uni<ApiSpecDocument> getDocument() {
        return documentService.getDocument();
    }

    @DELETE
    @Path("admin/openapi/cache")
    public Response invalidate() {
        documentService.invalidate();
        return Response.noContent().build();
    }
}
