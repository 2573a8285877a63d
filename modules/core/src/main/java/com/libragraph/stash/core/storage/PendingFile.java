package com.libragraph.stash.core.storage;

import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Temp file in the destination directory that is deleted on {@link #close()}
 * unless {@link #commit(Path)} moved it into place first.
 */
public final class PendingFile implements Closeable {

    private static final Logger log = Logger.getLogger(PendingFile.class);

    static final String PREFIX = ".upload-";
    static final String SUFFIX = ".tmp";

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path path;
    private boolean committed;

    private PendingFile(Path path) {
        this.path = path;
    }

    public static PendingFile create(Path directory) throws IOException {
        Path temp = supportsPosix(directory.getFileSystem())
                ? Files.createTempFile(directory, PREFIX, SUFFIX, PosixFilePermissions.asFileAttribute(OWNER_ONLY))
                : Files.createTempFile(directory, PREFIX, SUFFIX);
        return new PendingFile(temp);
    }

    public Path path() {
        return path;
    }

    /**
     * Atomically renames the temp file to {@code target} and restricts it to
     * the owner. If the permissions cannot be applied, the target is removed
     * again and the failure propagates.
     */
    public void commit(Path target) throws IOException {
        Files.move(path, target, StandardCopyOption.ATOMIC_MOVE);
        try {
            Files.setPosixFilePermissions(target, OWNER_ONLY);
        } catch (UnsupportedOperationException e) {
            log.debugf("POSIX permissions not supported for %s", target);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(target);
            throw e;
        }
        committed = true;
    }

    @Override
    public void close() throws IOException {
        if (!committed && Files.deleteIfExists(path)) {
            log.debugf("Discarded pending file %s", path.getFileName());
        }
    }

    private static boolean supportsPosix(FileSystem fs) {
        return fs.supportedFileAttributeViews().contains("posix");
    }
}
