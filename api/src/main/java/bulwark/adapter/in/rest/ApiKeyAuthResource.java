package bulwark.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import org.jboss.logging.Logger;

import bulwark.adapter.in.dto.ApiKeyAuthConfigRequest;
import bulwark.adapter.in.dto.ApiKeyAuthStatusDto;
import bulwark.adapter.in.problem.PanelProblem;
import bulwark.core.service.auth.ApiKeyAuthenticator;
import bulwark.core.service.openapi.SpecDocumentService;

/**
 * REST resource for runtime API key authentication configuration.
 *
 * <p>The admin API itself is guarded by API key authentication, so a
 * configuration that would leave authentication inactive is refused.
 */
@Path("/admin/api-key-auth")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ApiKeyAuthResource {

    private static final Logger LOG = Logger.getLogger(ApiKeyAuthResource.class);

    private final ApiKeyAuthenticator authenticator;
    private final SpecDocumentService documentService;

    public ApiKeyAuthResource(ApiKeyAuthenticator authenticator, SpecDocumentService documentService) {
        this.authenticator = authenticator;
        this.documentService = documentService;
    }

    @GET
    public ApiKeyAuthStatusDto getConfiguration() {
        return status();
    }

    /**
     * Replace the enabled flag, header name and key list in one step.
     */
    @PUT
    @Consumes(MediaType.APPLICATION_JSON)
    public ApiKeyAuthStatusDto replaceConfiguration(@Valid @NotNull ApiKeyAuthConfigRequest request) {
        final var current = authenticator.currentSettings();
        final var requested = current.withConfig(request.enabled(), request.header(), request.keysOrEmpty());
        if (!requested.active()) {
            throw PanelProblem.badRequest(
                    "API key authentication must stay enabled with at least one key; "
                            + "the admin API would be unreachable otherwise");
        }

        authenticator.configure(request.enabled(), request.header(), request.keysOrEmpty());
        LOG.infof("API key authentication reconfigured via admin API (%d keys)", requested.acceptedKeys().size());

        if (!requested.headerName().equals(current.headerName())) {
            LOG.infof("API key header changed from %s to %s", current.headerName(), requested.headerName());
            documentService.invalidate();
        }
        return status();
    }

    /**
     * Switch between the lock-free snapshot and the read-write lock strategy.
     */
    @PUT
    @Path("/strategy")
    public ApiKeyAuthStatusDto switchStrategy(@QueryParam("atomic") @NotNull Boolean atomic) {
        authenticator.setAtomicSnapshotEnabled(atomic);
        return status();
    }

    private ApiKeyAuthStatusDto status() {
        return ApiKeyAuthStatusDto.fromSettings(
                authenticator.currentSettings(), authenticator.isAtomicSnapshotEnabled());
    }
}
