/**
 * Copyright 2013, 2014 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */

package edu.mit.lib.parzip;

import java.io.IOException;

/**
 * ArchiveException reports the failure of a pack or unpack operation.
 * The kind identifies the stage at which the operation failed; the
 * underlying I/O failure, if any, is carried as the cause.
 *
 * @author richardrodgers
 */

public class ArchiveException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Stage of an archive operation that failed
     */
    public enum Kind {
        /**
         * Source tree could not be walked
         */
        TRAVERSAL,
        /**
         * A single source entry could not be stat'ed or opened
         */
        PREPARE,
        /**
         * The archive itself could not be written
         */
        WRITE,
        /**
         * An entry name would resolve outside the destination root
         */
        PATH_ESCAPE,
        /**
         * An entry could not be restored into the destination
         */
        RESTORE
    }

    private final Kind kind;

    public ArchiveException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ArchiveException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Returns the stage at which the operation failed.
     *
     * @return kind the failure kind
     */
    public Kind kind() {
        return kind;
    }
}
