/**
 * Copyright 2013, 2014 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */

package edu.mit.lib.parzip;

import java.io.IOException;
import java.io.OutputStream;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;

/**
 * A source path readied for the archive by a packing worker. Exactly one of:
 * nothing to write (the implicit root directory), a header alone (a directory
 * entry), a header with content (a file entry), or an error.
 */
final class Prepared {

    /**
     * Streams the content of an entry into the archive.
     */
    @FunctionalInterface
    interface Content {
        void writeTo(OutputStream sink) throws IOException;
    }

    private final int sequence;
    private final ZipArchiveEntry header;
    private final Content content;
    private final IOException error;

    private Prepared(int sequence, ZipArchiveEntry header, Content content, IOException error) {
        this.sequence = sequence;
        this.header = header;
        this.content = content;
        this.error = error;
    }

    static Prepared root(int sequence) {
        return new Prepared(sequence, null, null, null);
    }

    static Prepared directory(int sequence, ZipArchiveEntry header) {
        return new Prepared(sequence, header, null, null);
    }

    static Prepared file(int sequence, ZipArchiveEntry header, Content content) {
        return new Prepared(sequence, header, content, null);
    }

    static Prepared failed(int sequence, IOException error) {
        return new Prepared(sequence, null, null, error);
    }

    int sequence() {
        return sequence;
    }

    ZipArchiveEntry header() {
        return header;
    }

    Content content() {
        return content;
    }

    IOException error() {
        return error;
    }

    boolean failed() {
        return error != null;
    }

    boolean isEmpty() {
        return header == null && error == null;
    }

    @Override
    public String toString() {
        if (failed()) return "#" + sequence + " failed: " + error.getMessage();
        if (isEmpty()) return "#" + sequence + " (root)";
        return "#" + sequence + " " + header.getName();
    }
}
