/**
 * Copyright 2013, 2014 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */

package edu.mit.lib.parzip;

/**
 * Raised when an entry name, joined to a destination root, resolves
 * outside of that root (the 'zip-slip' attack).
 */
public class PathEscapeException extends ArchiveException {

    private static final long serialVersionUID = 1L;

    // the offending entry name, as found in the archive
    private final String entryName;

    public PathEscapeException(String entryName, String message) {
        super(Kind.PATH_ESCAPE, message);
        this.entryName = entryName;
    }

    public String entryName() {
        return entryName;
    }
}
