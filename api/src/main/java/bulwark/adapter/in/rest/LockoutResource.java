package bulwark.adapter.in.rest;

import java.time.Instant;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;

import bulwark.adapter.in.dto.LockoutStatusDto;
import bulwark.adapter.in.problem.PanelProblem;
import bulwark.core.config.AccountLockoutConfig;
import bulwark.core.service.auth.AttemptTracker;
import bulwark.core.util.SecureHash;

/**
 * REST resource for failed-attempt lockout administration.
 *
 * <p>Identifiers are the tracker keys, for example {@code ip:203.0.113.7}.
 */
@Path("/admin/lockouts")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class LockoutResource {

    private static final Logger LOG = Logger.getLogger(LockoutResource.class);

    private final AttemptTracker attemptTracker;
    private final AccountLockoutConfig config;

    public LockoutResource(AttemptTracker attemptTracker, AccountLockoutConfig config) {
        this.attemptTracker = attemptTracker;
        this.config = config;
    }

    /**
     * List identifiers locked right now, soonest expiry first.
     */
    @GET
    public Response listLockouts() {
        requireEnabled();
        final var now = Instant.now();
        final var lockouts = attemptTracker.lockouts().stream()
                .map(status -> LockoutStatusDto.fromModel(status, now))
                .toList();
        return Response.ok(Map.of(
                        "lockouts", lockouts,
                        "count", lockouts.size(),
                        "tracked", attemptTracker.trackedCount()))
                .build();
    }

    @GET
    @Path("/{identifier}")
    public LockoutStatusDto getLockoutStatus(@PathParam("identifier") String identifier) {
        requireEnabled();
        return LockoutStatusDto.fromModel(attemptTracker.status(identifier), Instant.now());
    }

    /**
     * Clear failed attempts and any lock for an identifier.
     */
    @DELETE
    @Path("/{identifier}")
    public Response clearLockout(@PathParam("identifier") String identifier) {
        requireEnabled();
        attemptTracker.resetAttempts(identifier);
        LOG.infof("Lockout cleared via admin API for %s", SecureHash.forLog(identifier));
        return Response.noContent().build();
    }

    private void requireEnabled() {
        if (!config.enabled()) {
            throw PanelProblem.featureDisabled("Account lockout");
        }
    }
}
