package com.libragraph.imagio.core.storage;

import io.minio.MinioClient;
import org.eclipse.microprofile.config.Config;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;

/**
 * Backend configuration for one storage namespace, read from
 * {@code imagio.storage.{namespace}.*}.
 *
 * <pre>
 *   imagio.storage.originals.type=filesystem
 *   imagio.storage.originals.root=/var/lib/imagio/originals
 *
 *   imagio.storage.derivatives.type=s3
 *   imagio.storage.derivatives.endpoint=http://minio:9000
 *   imagio.storage.derivatives.region=us-east-1
 *   imagio.storage.derivatives.bucket=imagio-cache
 *   imagio.storage.derivatives.access-key=...
 *   imagio.storage.derivatives.secret-key=...
 * </pre>
 */
public record StorageSettings(
        String namespace,
        StorageBackend backend,
        Optional<String> root,
        Optional<String> region,
        Optional<String> bucket,
        Optional<String> endpoint,
        Optional<String> accessKey,
        Optional<String> secretKey,
        String prefix
) {

    public static final String PREFIX = "imagio.storage.";

    public static StorageSettings fromConfig(Config config, String namespace) {
        return of(namespace, property -> config.getOptionalValue(property, String.class));
    }

    /**
     * Builds and validates settings from a property lookup.
     *
     * @throws StorageConfigException if required properties are missing or invalid
     */
    public static StorageSettings of(String namespace, Function<String, Optional<String>> lookup) {
        Function<String, Optional<String>> prop = name ->
                lookup.apply(PREFIX + namespace + "." + name)
                        .map(String::trim)
                        .filter(s -> !s.isEmpty());

        StorageBackend backend = StorageBackend.fromLabel(prop.apply("type")
                .orElseThrow(() -> missing(namespace, "type")));

        StorageSettings settings = new StorageSettings(namespace, backend,
                prop.apply("root"), prop.apply("region"), prop.apply("bucket"),
                prop.apply("endpoint"), prop.apply("access-key"), prop.apply("secret-key"),
                prop.apply("prefix").orElse(""));
        settings.validate();
        return settings;
    }

    private void validate() {
        switch (backend) {
            case FILESYSTEM -> {
                String dir = root.orElseThrow(() -> missing(namespace, "root"));
                if (!Path.of(dir).isAbsolute()) {
                    throw new StorageConfigException(
                            PREFIX + namespace + ".root must be an absolute path, got: " + dir);
                }
            }
            case S3 -> {
                bucket.orElseThrow(() -> missing(namespace, "bucket"));
                endpoint.orElseThrow(() -> missing(namespace, "endpoint"));
                accessKey.orElseThrow(() -> missing(namespace, "access-key"));
                secretKey.orElseThrow(() -> missing(namespace, "secret-key"));
            }
        }
    }

    private static StorageConfigException missing(String namespace, String name) {
        return new StorageConfigException("Missing required property " + PREFIX + namespace + "." + name);
    }

    /** Opens the backend described by these settings. */
    public ObjectStorage open() {
        return switch (backend) {
            case FILESYSTEM -> new FilesystemObjectStorage(namespace, Path.of(root.orElseThrow()));
            case S3 -> new S3ObjectStorage(namespace, minioClient(), bucket.orElseThrow(), prefix);
        };
    }

    private MinioClient minioClient() {
        try {
            MinioClient.Builder builder = MinioClient.builder()
                    .endpoint(endpoint.orElseThrow())
                    .credentials(accessKey.orElseThrow(), secretKey.orElseThrow());
            region.ifPresent(builder::region);
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new StorageConfigException("Invalid S3 settings for " + namespace + ": " + e.getMessage());
        }
    }

    @Override
    public String toString() {
        // keep credentials out of logs
        return "StorageSettings[namespace=" + namespace + ", backend=" + backend.label()
                + ", root=" + root.orElse("-") + ", bucket=" + bucket.orElse("-")
                + ", endpoint=" + endpoint.orElse("-") + ", prefix=" + prefix + "]";
    }
}
