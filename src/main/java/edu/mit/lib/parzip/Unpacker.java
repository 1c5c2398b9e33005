/**
 * Copyright 2013, 2014 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */

package edu.mit.lib.parzip;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static edu.mit.lib.parzip.Archive.*;
import static edu.mit.lib.parzip.ArchiveException.Kind.*;

/**
 * Unpacker restores a zip archive into a destination directory. Directory
 * entries are created first, in one sequential pass; file entries are then
 * restored concurrently, with no more than a fixed number in progress at once.
 * Every entry name is checked against the destination root before anything is
 * written on its behalf.
 *
 * The first failure of any worker is reported once all workers have finished;
 * entries unaffected by the failure are still restored.
 *
 * See README for sample invocations and API description.
 *
 * @author richardrodgers
 */

public class Unpacker {

    private static final Logger logger = LoggerFactory.getLogger(Unpacker.class);

    /**
     * Creates (or truncates) a destination file for writing.
     */
    @FunctionalInterface
    interface Opener {
        OutputStream create(Path target) throws IOException;
    }

    /**
     * Sets the modification time of a restored file.
     */
    @FunctionalInterface
    interface Stamper {
        void stamp(Path target, FileTime time) throws IOException;
    }

    // destination root directory
    private final Path destination;
    // maximum number of entries restored at once
    private int permits = Runtime.getRuntime().availableProcessors();
    // destination file factory
    private Opener opener = Files::newOutputStream;
    // modification time setter
    private Stamper stamper = Files::setLastModifiedTime;

    /**
     * Returns a new Unpacker restoring into passed directory,
     * which will be created if absent.
     *
     * @param destination the destination root directory
     */
    public Unpacker(Path destination) {
        this.destination = destination.toAbsolutePath().normalize();
    }

    /**
     * Restores passed archive into passed directory using
     * default concurrency.
     *
     * @param archive the archive file to unpack
     * @param destination the destination root directory
     * @return path the destination root directory
     * @throws IOException if any entry could not be restored
     */
    public static Path unpack(Path archive, Path destination) throws IOException {
        return new Unpacker(destination).unpack(archive);
    }

    /**
     * Assigns the maximum number of entries restored concurrently.
     * Default is the number of available processors.
     *
     * @param permits the concurrency cap, at least one
     * @return Unpacker this Unpacker
     */
    public Unpacker permits(int permits) {
        if (permits < 1) {
            throw new IllegalArgumentException("At least one permit required");
        }
        this.permits = permits;
        return this;
    }

    Unpacker opener(Opener opener) {
        this.opener = opener;
        return this;
    }

    Unpacker stamper(Stamper stamper) {
        this.stamper = stamper;
        return this;
    }

    /**
     * Restores passed archive into the destination directory.
     *
     * @param archive the archive file to unpack
     * @return path the destination root directory
     * @throws IOException the first failure encountered by any entry
     */
    public Path unpack(Path archive) throws IOException {
        try {
            Files.createDirectories(destination);
        } catch (IOException ioE) {
            throw new ArchiveException(RESTORE, "Unable to create destination: " + destination, ioE);
        }
        try (ZipFile zip = open(archive)) {
            List<ZipArchiveEntry> files = new ArrayList<>();
            for (ZipArchiveEntry entry : Collections.list(zip.getEntries())) {
                if (entry.isDirectory()) {
                    createDirectory(entry);
                } else {
                    files.add(entry);
                }
            }
            restoreAll(zip, files);
        }
        logger.info("Unpacked {} into {}", archive, destination);
        return destination;
    }

    private static ZipFile open(Path archive) throws ArchiveException {
        try {
            return Archive.open(archive);
        } catch (IOException ioE) {
            throw new ArchiveException(RESTORE, "Unable to open archive: " + archive, ioE);
        }
    }

    private void createDirectory(ZipArchiveEntry entry) throws IOException {
        Path dir = PathGuard.resolve(destination, entry.getName());
        try {
            Files.createDirectories(dir);
        } catch (IOException ioE) {
            throw new ArchiveException(RESTORE, "Unable to create directory: " + entry.getName(), ioE);
        }
    }

    private void restoreAll(ZipFile zip, List<ZipArchiveEntry> files) throws IOException {
        var firstError = new FirstError();
        var permit = new Semaphore(permits);
        ExecutorService pool = Executors.newCachedThreadPool(Packer.threadFactory("unpack-worker"));
        logger.debug("Restoring {} files with {} permits", files.size(), permits);
        try {
            for (ZipArchiveEntry entry : files) {
                acquire(permit, entry);
                try {
                    pool.execute(() -> {
                        try {
                            restore(zip, entry);
                        } catch (IOException ioE) {
                            firstError.offer(ioE);
                        } catch (RuntimeException rE) {
                            firstError.offer(new ArchiveException(RESTORE, "Unable to restore: " + entry.getName(), rE));
                        } finally {
                            permit.release();
                        }
                    });
                } catch (RejectedExecutionException reE) {
                    permit.release();
                    throw reE;
                }
            }
        } finally {
            pool.shutdown();
            awaitWorkers(pool);
        }
        firstError.rethrow();
    }

    private static void acquire(Semaphore permit, ZipArchiveEntry entry) throws InterruptedIOException {
        try {
            permit.acquire();
        } catch (InterruptedException iE) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted before restoring: " + entry.getName());
        }
    }

    private static void awaitWorkers(ExecutorService pool) throws InterruptedIOException {
        try {
            while (! pool.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.debug("Still awaiting restore workers");
            }
        } catch (InterruptedException iE) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted awaiting restore workers");
        }
    }

    private void restore(ZipFile zip, ZipArchiveEntry entry) throws IOException {
        String name = entry.getName();
        Path target = PathGuard.resolve(destination, name);
        if (! zip.canReadEntryData(entry)) {
            throw new ArchiveException(RESTORE, "Unsupported entry data: " + name);
        }
        try {
            // parent may not have been listed as an entry of its own
            Files.createDirectories(target.getParent());
            try (InputStream in = zip.getInputStream(entry);
                 OutputStream out = opener.create(target)) {
                in.transferTo(out);
            }
            int mode = entry.getUnixMode() & PERM_MASK;
            if (mode != 0) {
                setMode(target, mode);
            }
        } catch (IOException ioE) {
            throw new ArchiveException(RESTORE, "Unable to restore: " + name, ioE);
        }
        restoreTime(target, entry);
        logger.debug("Restored {}", name);
    }

    private static void setMode(Path target, int mode) throws IOException {
        try {
            Files.setPosixFilePermissions(target, toPermissions(mode));
        } catch (UnsupportedOperationException uoE) {
            logger.debug("No POSIX permissions for {}", target);
        }
    }

    // best effort: a file whose time cannot be set is still restored
    private void restoreTime(Path target, ZipArchiveEntry entry) {
        try {
            stamper.stamp(target, FileTime.fromMillis(entry.getTime()));
        } catch (IOException ioE) {
            logger.warn("Unable to set modification time of {}: {}", target, ioE.getMessage());
        }
    }
}
