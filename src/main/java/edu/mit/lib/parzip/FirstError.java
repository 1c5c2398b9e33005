/**
 * Copyright 2013, 2014 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */

package edu.mit.lib.parzip;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-assignment slot holding the first failure reported by any
 * of a set of concurrent workers. Later failures are logged and dropped.
 */
class FirstError {

    private static final Logger logger = LoggerFactory.getLogger(FirstError.class);

    private final AtomicReference<IOException> slot = new AtomicReference<>();

    /**
     * Records the failure if no failure has been recorded yet.
     *
     * @param error the failure
     * @return true if this failure now occupies the slot
     */
    boolean offer(IOException error) {
        if (slot.compareAndSet(null, error)) {
            return true;
        }
        logger.warn("Additional failure not reported: {}", error.getMessage());
        return false;
    }

    // throws the recorded failure, if any
    void rethrow() throws IOException {
        IOException error = slot.get();
        if (error != null) {
            throw error;
        }
    }
}
