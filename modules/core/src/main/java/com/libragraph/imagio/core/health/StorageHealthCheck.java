package com.libragraph.imagio.core.health;

import com.libragraph.imagio.core.storage.ObjectStorage;
import com.libragraph.imagio.core.storage.StorageNamespaces;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Probes both namespaces with an {@code exists} call on a key that is never
 * written; only an unreachable backend makes it fail.
 */
@Readiness
@ApplicationScoped
public class StorageHealthCheck implements HealthCheck {

    static final String PROBE_KEY = ".imagio-health-probe";

    @Inject
    StorageNamespaces storage;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder response = HealthCheckResponse.named("storage").up();
        probe(response, StorageNamespaces.ORIGINALS, storage.originals());
        probe(response, StorageNamespaces.DERIVATIVES, storage.derivatives());
        return response.build();
    }

    private static void probe(HealthCheckResponseBuilder response, String name, ObjectStorage store) {
        try {
            store.exists(PROBE_KEY).await().indefinitely();
            response.withData(name, store.toString());
        } catch (Exception e) {
            response.down().withData(name, "error: " + e.getMessage());
        }
    }
}
