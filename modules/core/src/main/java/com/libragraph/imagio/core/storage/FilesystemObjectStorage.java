package com.libragraph.imagio.core.storage;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Filesystem-backed ObjectStorage.
 *
 * <p>Layout: {@code {root}/{key}}, where {@code /} in a key becomes a
 * directory. Writes land in a temp file next to the target and are moved into
 * place, so a concurrent reader never observes a half-written file.
 */
public class FilesystemObjectStorage implements ObjectStorage {

    private static final Logger log = Logger.getLogger(FilesystemObjectStorage.class);

    private final String namespace;
    private final Path root;

    public FilesystemObjectStorage(String namespace, Path root) {
        this.namespace = namespace;
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    private Path resolvePath(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("Key escapes storage root: " + key);
        }
        return path;
    }

    @Override
    public Uni<byte[]> read(String key) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(key);
            try {
                return Files.readAllBytes(path);
            } catch (NoSuchFileException e) {
                throw new ObjectNotFoundException(namespace, key);
            } catch (IOException e) {
                throw new StorageException("Failed to read object: " + key, e);
            }
        });
    }

    @Override
    public Uni<Void> write(String key, byte[] data, String mimeType) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(key);
            Path tmp = null;
            try {
                Files.createDirectories(path.getParent());
                tmp = Files.createTempFile(path.getParent(), ".imagio-", ".tmp");
                Files.write(tmp, data);
                moveIntoPlace(tmp, path);
                log.debugf("Wrote %d bytes: namespace=%s key=%s", data.length, namespace, key);
            } catch (IOException e) {
                deleteQuietly(tmp);
                throw new StorageException("Failed to write object: " + key, e);
            }
        });
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warnf("Could not remove temp file %s: %s", tmp, e.getMessage());
        }
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> Files.isRegularFile(resolvePath(key)));
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(key);
            try {
                if (!Files.deleteIfExists(path)) {
                    throw new ObjectNotFoundException(namespace, key);
                }
                pruneEmptyParents(path.getParent());
            } catch (IOException e) {
                throw new StorageException("Failed to delete object: " + key, e);
            }
        });
    }

    private void pruneEmptyParents(Path dir) {
        Path current = dir;
        while (current != null && !current.equals(root)) {
            try {
                if (!isEmptyDirectory(current)) {
                    break;
                }
                Files.delete(current);
            } catch (IOException e) {
                // a concurrent write may have repopulated the directory
                log.debugf("Stopped pruning at %s: %s", current, e.getMessage());
                break;
            }
            current = current.getParent();
        }
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            return !entries.iterator().hasNext();
        }
    }

    @Override
    public String toString() {
        return "filesystem:" + namespace + "@" + root;
    }
}
