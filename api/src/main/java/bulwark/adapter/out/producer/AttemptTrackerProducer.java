package bulwark.adapter.out.producer;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import bulwark.core.config.AccountLockoutConfig;
import bulwark.core.service.auth.AttemptTracker;

/**
 * Produces the shared {@link AttemptTracker} and stops its sweep on shutdown.
 * The sweep thread is only started while lockout is enabled.
 */
@ApplicationScoped
public class AttemptTrackerProducer {

    private static final Logger LOG = Logger.getLogger(AttemptTrackerProducer.class);

    private final AccountLockoutConfig config;

    public AttemptTrackerProducer(AccountLockoutConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    public AttemptTracker produceAttemptTracker() {
        if (!config.enabled()) {
            LOG.info("Account lockout is disabled; failed attempts will not be tracked or swept");
        }
        return new AttemptTracker(config);
    }

    void disposeAttemptTracker(@Disposes AttemptTracker tracker) {
        tracker.shutdown();
    }
}
