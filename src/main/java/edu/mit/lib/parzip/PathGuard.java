/**
 * Copyright 2013, 2014 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */

package edu.mit.lib.parzip;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * PathGuard decides whether a destination path computed from an untrusted
 * archive entry name stays inside a trusted destination root. Every entry
 * must pass through here before the filesystem is touched on its behalf.
 *
 * @author richardrodgers
 */

public class PathGuard {

    private PathGuard() {}

    /**
     * Returns the destination of the named entry under passed root,
     * provided it does not escape the root.
     *
     * @param root the trusted destination root
     * @param entryName the (untrusted) entry name from the archive
     * @return path the normalized destination path
     * @throws PathEscapeException if the entry would land outside the root
     */
    public static Path resolve(Path root, String entryName) throws PathEscapeException {
        // a name that climbs above its root is refused whatever the root is called
        if (! isSafeName(entryName)) {
            throw new PathEscapeException(entryName, "Entry escapes destination directory: " + entryName);
        }
        Path target = root.resolve(entryName);
        Path base = root.normalize();
        Path normal = target.normalize();
        // element-wise prefix: '/dest-evil' is not under '/dest'
        if (! normal.equals(base) && ! normal.startsWith(base)) {
            throw new PathEscapeException(entryName, "Entry escapes destination directory: " + entryName);
        }
        return normal;
    }

    /**
     * Returns whether the named entry stays beneath any directory it is
     * extracted to. The decision rests on the name alone: absolute names,
     * and names whose normalized form starts with a parent reference, are unsafe.
     *
     * @param entryName the entry name
     * @return true if the entry is safe to extract
     */
    public static boolean isSafeName(String entryName) {
        if (entryName.startsWith(Archive.SEPARATOR)) {
            return false;
        }
        Path name;
        try {
            name = Paths.get(entryName);
        } catch (InvalidPathException ipE) {
            return false;
        }
        if (name.isAbsolute() || name.getRoot() != null) {
            return false;
        }
        Path normal = name.normalize();
        return normal.getNameCount() == 0 || ! normal.getName(0).toString().equals("..");
    }
}
