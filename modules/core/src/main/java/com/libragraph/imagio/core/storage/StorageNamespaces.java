package com.libragraph.imagio.core.storage;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/**
 * Owns the two storage namespaces for the lifetime of the process.
 * Starts eagerly at boot via {@code @Startup} so a bad backend configuration
 * prevents the application from starting.
 */
@ApplicationScoped
@Startup
public class StorageNamespaces {

    private static final Logger log = Logger.getLogger(StorageNamespaces.class);

    public static final String ORIGINALS = "originals";
    public static final String DERIVATIVES = "derivatives";

    @Inject
    Config config;

    private ObjectStorage originals;
    private ObjectStorage derivatives;

    @PostConstruct
    void init() {
        StorageSettings originalSettings = StorageSettings.fromConfig(config, ORIGINALS);
        StorageSettings derivativeSettings = StorageSettings.fromConfig(config, DERIVATIVES);
        originals = originalSettings.open();
        derivatives = derivativeSettings.open();
        log.infof("Storage ready: %s, %s", originals, derivatives);
    }

    /** Durable store of uploaded bytes. */
    public ObjectStorage originals() {
        return originals;
    }

    /** Disposable cache of rendered variants. */
    public ObjectStorage derivatives() {
        return derivatives;
    }
}
