package com.libragraph.imagio.core.storage;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/**
 * S3/MinIO-backed ObjectStorage.
 *
 * <p>One bucket per namespace; object names are {@code {prefix}{key}}.
 * The bucket is created on first write if it does not exist yet.
 */
public class S3ObjectStorage implements ObjectStorage {

    private static final Logger log = Logger.getLogger(S3ObjectStorage.class);

    private final String namespace;
    private final MinioClient minioClient;
    private final String bucket;
    private final String prefix;

    private volatile boolean bucketReady;

    public S3ObjectStorage(String namespace, MinioClient minioClient, String bucket, String prefix) {
        this.namespace = namespace;
        this.minioClient = minioClient;
        this.bucket = bucket;
        this.prefix = prefix == null ? "" : prefix;
    }

    private String objectName(String key) {
        return prefix + key;
    }

    private static boolean isMissing(ErrorResponseException e) {
        String code = e.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code);
    }

    private void ensureBucket() {
        if (bucketReady) {
            return;
        }
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                log.infof("Created bucket %s for namespace %s", bucket, namespace);
            }
            bucketReady = true;
        } catch (ErrorResponseException e) {
            // another writer created the bucket first
            if ("BucketAlreadyOwnedByYou".equals(e.errorResponse().code())) {
                bucketReady = true;
                return;
            }
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        } catch (Exception e) {
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        }
    }

    @Override
    public Uni<byte[]> read(String key) {
        return Uni.createFrom().item(() -> {
            try (InputStream is = minioClient.getObject(
                    GetObjectArgs.builder().bucket(bucket).object(objectName(key)).build())) {
                return is.readAllBytes();
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new ObjectNotFoundException(namespace, key);
                }
                throw new StorageException("Failed to read object: " + key, e);
            } catch (Exception e) {
                throw new StorageException("Failed to read object: " + key, e);
            }
        });
    }

    @Override
    public Uni<Void> write(String key, byte[] data, String mimeType) {
        return Uni.createFrom().voidItem().invoke(() -> {
            ensureBucket();
            try (InputStream is = new ByteArrayInputStream(data)) {
                minioClient.putObject(PutObjectArgs.builder()
                        .bucket(bucket)
                        .object(objectName(key))
                        .stream(is, data.length, -1)
                        .contentType(mimeType != null ? mimeType : "application/octet-stream")
                        .build());
                log.debugf("Put %d bytes: bucket=%s key=%s", data.length, bucket, key);
            } catch (Exception e) {
                throw new StorageException("Failed to write object: " + key, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> {
            try {
                minioClient.statObject(StatObjectArgs.builder()
                        .bucket(bucket).object(objectName(key)).build());
                return true;
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    return false;
                }
                throw new StorageException("Failed to check existence: " + key, e);
            } catch (Exception e) {
                throw new StorageException("Failed to check existence: " + key, e);
            }
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().voidItem().invoke(() -> {
            String name = objectName(key);
            // removeObject is silent on missing keys, so stat first
            try {
                minioClient.statObject(StatObjectArgs.builder()
                        .bucket(bucket).object(name).build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new ObjectNotFoundException(namespace, key);
                }
                throw new StorageException("Failed to delete object: " + key, e);
            } catch (Exception e) {
                throw new StorageException("Failed to delete object: " + key, e);
            }
            try {
                minioClient.removeObject(RemoveObjectArgs.builder()
                        .bucket(bucket).object(name).build());
            } catch (Exception e) {
                throw new StorageException("Failed to delete object: " + key, e);
            }
        });
    }

    @Override
    public String toString() {
        return "s3:" + namespace + "@" + bucket + "/" + prefix;
    }
}
