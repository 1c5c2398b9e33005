/**
 * Copyright 2013, 2014 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */

package edu.mit.lib.parzip;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;

import static java.nio.file.attribute.PosixFilePermission.*;

/**
 * Archive represents a zip archive file as produced by a Packer, or
 * obtained from elsewhere. It offers a read-only view of the archive
 * contents: entry names in directory order and a check that no entry
 * would escape a destination directory on extraction.
 *
 * Archives are written by Packer and restored by Unpacker.
 *
 * See README for sample invocations and API description.
 *
 * @author richardrodgers
 */

public class Archive {
    // coding constants
    static final String LIB_VSN = "1.0";
    static final String DFLT_FMT = "zip";
    static final String ARCHIVE_SFX = "." + DFLT_FMT;
    static final String SEPARATOR = "/";
    static final int DFLT_DIR_MODE = 0755;
    static final int DFLT_FILE_MODE = 0644;
    static final int PERM_MASK = 0777;

    // permission bits in the order of the unix mode word, high bit first
    private static final PosixFilePermission[] PERM_BITS = {
        OWNER_READ, OWNER_WRITE, OWNER_EXECUTE,
        GROUP_READ, GROUP_WRITE, GROUP_EXECUTE,
        OTHERS_READ, OTHERS_WRITE, OTHERS_EXECUTE
    };

    // the archive file
    private final Path file;

    /**
     * Constructor - a view of an existing archive file
     *
     * @param file the archive file
     * @throws IOException if the file does not exist
     */
    public Archive(Path file) throws IOException {
        if (file == null || Files.notExists(file)) {
            throw new IOException("Missing or nonexistent archive file");
        }
        this.file = file;
    }

    /**
     * Returns the software version of the library.
     *
     * @return version the software version string
     */
    public static String libVersion() {
        return LIB_VSN;
    }

    /**
     * Returns the names of all entries, in the order of the
     * archive's central directory.
     *
     * @return names the list of entry names
     * @throws IOException if archive cannot be read
     */
    public List<String> entryNames() throws IOException {
        var names = new ArrayList<String>();
        for (ZipArchiveEntry entry : entries(file)) {
            names.add(entry.getName());
        }
        return names;
    }

    /**
     * Returns the number of entries in the archive.
     *
     * @return size the entry count
     * @throws IOException if archive cannot be read
     */
    public int size() throws IOException {
        return entries(file).size();
    }

    /**
     * Returns the names of entries that would resolve outside any
     * destination directory they were extracted to.
     *
     * @return names the unsafe entry names, empty if none
     * @throws IOException if archive cannot be read
     */
    public List<String> unsafeEntries() throws IOException {
        var unsafe = new ArrayList<String>();
        for (String name : entryNames()) {
            if (! PathGuard.isSafeName(name)) {
                unsafe.add(name);
            }
        }
        return unsafe;
    }

    /**
     * Returns whether every entry can be safely extracted.
     *
     * @return true if no entry escapes its destination
     * @throws IOException if archive cannot be read
     */
    public boolean isSafe() throws IOException {
        return unsafeEntries().isEmpty();
    }

    static ZipFile open(Path file) throws IOException {
        return ZipFile.builder().setPath(file).get();
    }

    static List<ZipArchiveEntry> entries(Path file) throws IOException {
        try (ZipFile zip = open(file)) {
            return Collections.list(zip.getEntries());
        }
    }

    // converts permission set to the low nine bits of a unix mode
    static int toMode(Set<PosixFilePermission> perms) {
        int mode = 0;
        for (PosixFilePermission perm : PERM_BITS) {
            mode <<= 1;
            if (perms.contains(perm)) {
                mode |= 1;
            }
        }
        return mode;
    }

    // converts the low nine bits of a unix mode to a permission set
    static Set<PosixFilePermission> toPermissions(int mode) {
        Set<PosixFilePermission> perms = EnumSet.noneOf(PosixFilePermission.class);
        for (int i = 0; i < PERM_BITS.length; i++) {
            if ((mode & (0400 >> i)) != 0) {
                perms.add(PERM_BITS[i]);
            }
        }
        return perms;
    }
}
