/**
 * Copyright 2013, 2014 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */

package edu.mit.lib.parzip;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OrderedWriter takes prepared entries in whatever order the workers finish
 * them and commits them strictly by sequence number. Early arrivals wait in
 * a holding map until every entry before them has been committed.
 * Only the thread calling {@link #run()} touches the holding map or the committer.
 *
 * @author richardrodgers
 */

class OrderedWriter {

    private static final Logger logger = LoggerFactory.getLogger(OrderedWriter.class);

    /**
     * Writes one entry to the archive.
     */
    @FunctionalInterface
    interface Committer {
        void commit(Prepared entry) throws IOException;
    }

    private final BlockingQueue<Prepared> results;
    private final int total;
    private final Committer committer;
    // entries that arrived ahead of their turn
    private final Map<Integer, Prepared> pending = new HashMap<>();
    // next sequence number to commit
    private int next;
    private int maxPending;

    OrderedWriter(BlockingQueue<Prepared> results, int total, Committer committer) {
        this.results = results;
        this.total = total;
        this.committer = committer;
    }

    /**
     * Commits all entries in sequence order, returning once the last has been written.
     *
     * @throws IOException the error of the lowest-sequenced failed entry, or a write failure
     */
    void run() throws IOException {
        while (next < total) {
            Prepared entry = pending.remove(next);
            if (entry == null) {
                entry = take();
                if (entry.sequence() != next) {
                    hold(entry);
                    continue;
                }
            }
            commit(entry);
            next++;
        }
        logger.debug("Committed {} entries, at most {} held back", total, maxPending);
    }

    private Prepared take() throws IOException {
        try {
            return results.take();
        } catch (InterruptedException iE) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted awaiting entry #" + next);
        }
    }

    private void hold(Prepared entry) {
        int seq = entry.sequence();
        if (seq < next || seq >= total || pending.containsKey(seq)) {
            throw new IllegalStateException("Unexpected entry sequence: " + seq);
        }
        pending.put(seq, entry);
        maxPending = Math.max(maxPending, pending.size());
    }

    private void commit(Prepared entry) throws IOException {
        if (entry.failed()) {
            logger.debug("Aborting at {}", entry);
            throw entry.error();
        }
        if (! entry.isEmpty()) {
            committer.commit(entry);
            logger.debug("Committed {}", entry);
        }
    }
}
