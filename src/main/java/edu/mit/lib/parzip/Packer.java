/**
 * Copyright 2013, 2014 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */

package edu.mit.lib.parzip;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ObjIntConsumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;

import org.apache.commons.compress.archivers.zip.UnixStat;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static edu.mit.lib.parzip.Archive.*;
import static edu.mit.lib.parzip.ArchiveException.Kind.*;

/**
 * Packer is a builder class used to serialize a file or directory tree into a
 * zip archive. Entries are prepared (stat'ed, given headers) by a pool of workers
 * running in parallel, but are committed to the archive strictly in the order
 * of a sorted walk of the source, so that an unchanged tree always yields
 * the same archive.
 *
 * A directory source places every entry under a folder named for the directory;
 * a single file source yields one entry named for the file.
 *
 * See README for sample invocations and API description.
 *
 * @author richardrodgers
 */

public class Packer {

    private static final Logger logger = LoggerFactory.getLogger(Packer.class);

    // earliest instant every time zone can store as a DOS date
    static final long NO_TIME = 315619200000L;

    // source file or directory
    private final Path source;
    // number of preparing workers
    private int workers = Runtime.getRuntime().availableProcessors();
    // suppress timestamps?
    private boolean noTime = false;
    // invoked by a worker before it prepares each path
    private ObjIntConsumer<Path> prepareHook = (path, seq) -> {};

    /**
     * Returns a new Packer for passed source, which can be either
     * a directory or a single file.
     *
     * @param source the file or directory to pack
     * @throws IOException if source is missing
     */
    public Packer(Path source) throws IOException {
        if (source == null || Files.notExists(source)) {
            throw new ArchiveException(TRAVERSAL, "Missing or nonexistent source: " + source);
        }
        this.source = source.toAbsolutePath().normalize();
        if (this.source.getFileName() == null) {
            throw new ArchiveException(TRAVERSAL, "Cannot pack a filesystem root: " + source);
        }
    }

    /**
     * Assigns the number of workers preparing entries in parallel.
     * Default is the number of available processors.
     *
     * @param workers the worker count, at least one
     * @return Packer this Packer
     */
    public Packer workers(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("At least one worker required");
        }
        this.workers = workers;
        return this;
    }

    /**
     * Suppresses file timestamps: all entries are given the same fixed
     * modification time.
     *
     * @param noTime if true, suppress regular timestamp assignment in archive
     * @return Packer this Packer
     */
    public Packer noTime(boolean noTime) {
        this.noTime = noTime;
        return this;
    }

    Packer onPrepare(ObjIntConsumer<Path> hook) {
        this.prepareHook = hook;
        return this;
    }

    /**
     * Writes the source to passed archive file, creating any missing
     * parent directories. On failure the archive file, if created,
     * holds at most a prefix of the entries and no central directory:
     * it must be considered invalid.
     *
     * @param archive the archive file to write
     * @return path the archive file
     * @throws IOException if error reading source or writing archive
     */
    public Path toArchive(Path archive) throws IOException {
        BasicFileAttributes attrs = attributes(source);
        // walk first, so the archive never appears in its own listing
        List<Path> paths = walk(source);
        String baseDir = attrs.isDirectory() ? source.getFileName().toString() : null;
        Path parent = archive.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException ioE) {
            throw new ArchiveException(WRITE, "Unable to create archive directory: " + parent, ioE);
        }

        Queue<Integer> jobs = new ConcurrentLinkedQueue<>();
        for (int i = 0; i < paths.size(); i++) {
            jobs.add(i);
        }
        int poolSize = Math.min(workers, paths.size());
        BlockingQueue<Prepared> results = new ArrayBlockingQueue<>(2 * poolSize);
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, threadFactory("pack-worker"));
        for (int i = 0; i < poolSize; i++) {
            pool.execute(() -> prepareAll(paths, jobs, results, baseDir));
        }
        logger.debug("Packing {} paths from {} with {} workers", paths.size(), source, poolSize);

        boolean completed = false;
        try {
            try (SeekableByteChannel channel = create(archive)) {
                // closed only on success: closing the stream writes the central directory
                ZipArchiveOutputStream out = new ZipArchiveOutputStream(channel);
                new OrderedWriter(results, paths.size(), entry -> commit(out, entry)).run();
                out.finish();
                out.close();
            } catch (ArchiveException | InterruptedIOException e) {
                throw e;
            } catch (IOException ioE) {
                throw new ArchiveException(WRITE, "Unable to write archive: " + archive, ioE);
            }
            completed = true;
        } finally {
            if (completed) {
                pool.shutdown();
            } else {
                // stop preparing: workers blocked on a full result queue are interrupted
                jobs.clear();
                pool.shutdownNow();
            }
        }
        logger.info("Packed {} into {}", source, archive);
        return archive;
    }

    /**
     * Returns every path under passed root, including the root itself,
     * sorted by full path string.
     *
     * @param root the file or directory to walk
     * @return paths the sorted list of paths
     * @throws ArchiveException if any path cannot be read
     */
    static List<Path> walk(Path root) throws ArchiveException {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream.sorted(Comparator.comparing(Path::toString))
                         .collect(Collectors.toList());
        } catch (UncheckedIOException uioE) {
            throw new ArchiveException(TRAVERSAL, "Unable to walk source: " + root, uioE.getCause());
        } catch (IOException ioE) {
            throw new ArchiveException(TRAVERSAL, "Unable to walk source: " + root, ioE);
        }
    }

    static ThreadFactory threadFactory(String prefix) {
        var counter = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static BasicFileAttributes attributes(Path path) throws ArchiveException {
        try {
            return Files.readAttributes(path, BasicFileAttributes.class);
        } catch (IOException ioE) {
            throw new ArchiveException(TRAVERSAL, "Unable to read source: " + path, ioE);
        }
    }

    private static SeekableByteChannel create(Path archive) throws ArchiveException {
        try {
            return Files.newByteChannel(archive, StandardOpenOption.CREATE,
                                        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException ioE) {
            throw new ArchiveException(WRITE, "Unable to create archive: " + archive, ioE);
        }
    }

    // worker loop: claim the next path until none remain
    private void prepareAll(List<Path> paths, Queue<Integer> jobs, BlockingQueue<Prepared> results, String baseDir) {
        Integer seq;
        while ((seq = jobs.poll()) != null) {
            Prepared entry = prepare(seq, paths.get(seq), baseDir);
            try {
                results.put(entry);
            } catch (InterruptedException iE) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private Prepared prepare(int seq, Path path, String baseDir) {
        try {
            prepareHook.accept(path, seq);
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            if (attrs.isDirectory()) {
                if (path.equals(source)) {
                    return Prepared.root(seq);
                }
                return Prepared.directory(seq, directoryHeader(path, attrs, baseDir));
            }
            return Prepared.file(seq, fileHeader(path, attrs, baseDir), sink -> Files.copy(path, sink));
        } catch (IOException ioE) {
            return Prepared.failed(seq, new ArchiveException(PREPARE, "Unable to prepare entry: " + path, ioE));
        } catch (RuntimeException rE) {
            return Prepared.failed(seq, new ArchiveException(PREPARE, "Unable to prepare entry: " + path, rE));
        }
    }

    private ZipArchiveEntry directoryHeader(Path dir, BasicFileAttributes attrs, String baseDir) throws IOException {
        ZipArchiveEntry entry = new ZipArchiveEntry(entryName(dir, baseDir) + SEPARATOR);
        entry.setMethod(ZipEntry.STORED);
        entry.setSize(0L);
        entry.setCrc(0L);
        entry.setTime(modTime(attrs));
        entry.setUnixMode(UnixStat.DIR_FLAG | permissions(dir, DFLT_DIR_MODE));
        return entry;
    }

    private ZipArchiveEntry fileHeader(Path file, BasicFileAttributes attrs, String baseDir) throws IOException {
        ZipArchiveEntry entry = new ZipArchiveEntry(entryName(file, baseDir));
        entry.setMethod(ZipEntry.DEFLATED);
        entry.setSize(attrs.size());
        entry.setTime(modTime(attrs));
        entry.setUnixMode(UnixStat.FILE_FLAG | permissions(file, DFLT_FILE_MODE));
        return entry;
    }

    // name inside the archive, always '/' separated
    private String entryName(Path path, String baseDir) {
        if (baseDir == null) {
            return path.getFileName().toString();
        }
        var sb = new StringBuilder(baseDir);
        for (Path part : source.relativize(path)) {
            sb.append(SEPARATOR).append(part.toString());
        }
        return sb.toString();
    }

    private long modTime(BasicFileAttributes attrs) {
        return noTime ? NO_TIME : attrs.lastModifiedTime().toMillis();
    }

    private static int permissions(Path path, int dfltMode) throws IOException {
        try {
            return toMode(Files.getPosixFilePermissions(path));
        } catch (UnsupportedOperationException uoE) {
            return dfltMode;
        }
    }

    private static void commit(ZipArchiveOutputStream out, Prepared entry) throws ArchiveException {
        ZipArchiveEntry header = entry.header();
        try {
            out.putArchiveEntry(header);
            if (entry.content() != null) {
                entry.content().writeTo(out);
            }
            out.closeArchiveEntry();
        } catch (IOException ioE) {
            throw new ArchiveException(WRITE, "Unable to write entry: " + header.getName(), ioE);
        }
    }
}
