/**
 * Copyright 2013, 2014 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */
package edu.mit.lib.parzip;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.*;

/*
 * Unit tests for destination containment checks.
 */

@RunWith(JUnit4.class)
public class PathGuardTest {

    private final Path root = Paths.get("/srv/dest");

    @Test
    public void nestedEntryAccepted() throws PathEscapeException {
        assertEquals(Paths.get("/srv/dest/a/b.txt"), PathGuard.resolve(root, "a/b.txt"));
        assertEquals(Paths.get("/srv/dest/a/sub"), PathGuard.resolve(root, "a/sub/"));
    }

    @Test
    public void rootItselfAccepted() throws PathEscapeException {
        assertEquals(root, PathGuard.resolve(root, "./"));
        assertEquals(root, PathGuard.resolve(root, "a/.."));
    }

    @Test
    public void innerTraversalAccepted() throws PathEscapeException {
        assertEquals(Paths.get("/srv/dest/b.txt"), PathGuard.resolve(root, "a/../b.txt"));
    }

    @Test(expected = PathEscapeException.class)
    public void parentTraversalRejected() throws PathEscapeException {
        PathGuard.resolve(root, "../evil");
    }

    @Test(expected = PathEscapeException.class)
    public void deepTraversalRejected() throws PathEscapeException {
        PathGuard.resolve(root, "a/b/../../../etc/passwd");
    }

    @Test(expected = PathEscapeException.class)
    public void absoluteNameRejected() throws PathEscapeException {
        PathGuard.resolve(root, "/etc/passwd");
    }

    @Test(expected = PathEscapeException.class)
    public void siblingWithSharedPrefixRejected() throws PathEscapeException {
        PathGuard.resolve(root, "../dest-evil/x");
    }

    @Test(expected = PathEscapeException.class)
    public void climbBackIntoRootRejected() throws PathEscapeException {
        // lands back in /srv/dest, but only by leaving it first
        PathGuard.resolve(root, "../dest/x");
    }

    @Test
    public void safeNameDecidedWithoutRoot() {
        assertTrue(PathGuard.isSafeName("fine/name.txt"));
        assertTrue(PathGuard.isSafeName("a/../b.txt"));
        assertTrue(PathGuard.isSafeName("./"));
        assertFalse(PathGuard.isSafeName("../../escape.txt"));
        assertFalse(PathGuard.isSafeName("../root/evil.txt"));
        assertFalse(PathGuard.isSafeName("a/../../b.txt"));
        assertFalse(PathGuard.isSafeName("/etc/passwd"));
        assertFalse(PathGuard.isSafeName("bad\0name"));
    }

    @Test
    public void escapeCarriesEntryName() {
        try {
            PathGuard.resolve(root, "../evil");
            fail("escape not detected");
        } catch (PathEscapeException peE) {
            assertEquals("../evil", peE.entryName());
            assertEquals(ArchiveException.Kind.PATH_ESCAPE, peE.kind());
        }
    }
}
