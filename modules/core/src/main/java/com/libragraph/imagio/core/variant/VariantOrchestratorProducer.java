package com.libragraph.imagio.core.variant;

import com.libragraph.imagio.core.image.ImageTransformer;
import com.libragraph.imagio.core.storage.StorageNamespaces;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/**
 * Builds the orchestrator chain from {@link VariantSettings}. Settings are read
 * at boot, so an invalid value stops the application from starting.
 */
@ApplicationScoped
@Startup
public class VariantOrchestratorProducer {

    private static final Logger log = Logger.getLogger(VariantOrchestratorProducer.class);

    @Inject
    StorageNamespaces storage;

    @Inject
    Config config;

    private VariantSettings settings;

    @PostConstruct
    void init() {
        settings = VariantSettings.fromConfig(config);
        log.infof("Variant settings: deduplicate=%s writeThroughFailure=%s jpegQuality=%.2f",
                settings.deduplicate(), settings.writeThroughFailure().label(), settings.jpegQuality());
    }

    @Produces
    @Singleton
    public VariantSettings variantSettings() {
        return settings;
    }

    @Produces
    @Singleton
    public VariantOrchestrator variantOrchestrator() {
        VariantOrchestrator naive = new NaiveVariantOrchestrator(
                storage.originals(), storage.derivatives(),
                new ImageTransformer(settings.jpegQuality()), settings.writeThroughFailure());
        return settings.deduplicate() ? new DeduplicatingVariantOrchestrator(naive) : naive;
    }
}
