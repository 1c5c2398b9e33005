/**
 * Copyright 2013, 2014 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */
package edu.mit.lib.parzip;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.*;

/*
 * Unit tests for in-order commitment of out-of-order arrivals.
 */

@RunWith(JUnit4.class)
public class OrderedWriterTest {

    @Test
    public void commitsInSequenceRegardlessOfArrival() throws IOException {
        var arrivals = new ArrayList<Prepared>();
        for (int i = 0; i < 50; i++) {
            arrivals.add(entry(i));
        }
        Collections.shuffle(arrivals, new Random(42));
        var committed = new ArrayList<Integer>();
        new OrderedWriter(new LinkedBlockingQueue<>(arrivals), 50, e -> committed.add(e.sequence())).run();
        assertEquals(50, committed.size());
        for (int i = 0; i < 50; i++) {
            assertEquals(Integer.valueOf(i), committed.get(i));
        }
    }

    @Test
    public void rootEntryCountedButNotWritten() throws IOException {
        var queue = new LinkedBlockingQueue<Prepared>(List.of(entry(2), entry(1), Prepared.root(0)));
        var committed = new ArrayList<Integer>();
        new OrderedWriter(queue, 3, e -> committed.add(e.sequence())).run();
        assertEquals(List.of(1, 2), committed);
    }

    @Test
    public void lowestSequencedFailureAborts() {
        var failure3 = new IOException("three");
        var failure7 = new IOException("seven");
        var arrivals = new ArrayList<Prepared>();
        arrivals.add(Prepared.failed(7, failure7));
        for (int i = 0; i < 10; i++) {
            if (i == 3) {
                arrivals.add(Prepared.failed(3, failure3));
            } else if (i != 7) {
                arrivals.add(entry(i));
            }
        }
        var committed = new ArrayList<Integer>();
        var writer = new OrderedWriter(new LinkedBlockingQueue<>(arrivals), 10, e -> committed.add(e.sequence()));
        try {
            writer.run();
            fail("writer should abort");
        } catch (IOException ioE) {
            assertSame(failure3, ioE);
        }
        assertEquals(List.of(0, 1, 2), committed);
    }

    @Test
    public void commitFailureAbortsImmediately() {
        var queue = new LinkedBlockingQueue<Prepared>(List.of(entry(0), entry(1), entry(2)));
        var committed = new ArrayList<Integer>();
        var writer = new OrderedWriter(queue, 3, e -> {
            if (e.sequence() == 1) {
                throw new IOException("disk full");
            }
            committed.add(e.sequence());
        });
        try {
            writer.run();
            fail("writer should abort");
        } catch (IOException ioE) {
            assertEquals("disk full", ioE.getMessage());
        }
        assertEquals(List.of(0), committed);
    }

    @Test(expected = IllegalStateException.class)
    public void duplicateSequenceRejected() throws IOException {
        var queue = new LinkedBlockingQueue<Prepared>(List.of(entry(2), entry(2), entry(0), entry(1)));
        new OrderedWriter(queue, 3, e -> {}).run();
    }

    @Test
    public void concurrentProducersThroughBoundedQueue() throws Exception {
        int total = 400;
        BlockingQueue<Prepared> queue = new ArrayBlockingQueue<>(4);
        var threads = new ArrayList<Thread>();
        for (int t = 0; t < 4; t++) {
            final int offset = t;
            Thread producer = new Thread(() -> {
                // each producer sends its share highest sequence first
                for (int i = total - 1 - offset; i >= 0; i -= 4) {
                    try {
                        queue.put(entry(i));
                    } catch (InterruptedException iE) {
                        return;
                    }
                }
            });
            threads.add(producer);
            producer.start();
        }
        var committed = new ArrayList<Integer>();
        new OrderedWriter(queue, total, e -> committed.add(e.sequence())).run();
        for (Thread producer : threads) {
            producer.join();
        }
        assertEquals(total, committed.size());
        for (int i = 0; i < total; i++) {
            assertEquals(Integer.valueOf(i), committed.get(i));
        }
    }

    private static Prepared entry(int seq) {
        return Prepared.directory(seq, new ZipArchiveEntry("d" + seq + "/"));
    }
}
