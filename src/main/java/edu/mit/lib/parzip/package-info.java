/**
 * Copyright 2013 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */

/**
 * Package contains a lightweight java library to pack a file or directory tree into a zip archive,
 * and to unpack a zip archive into a directory, using all available processors. It requires a
 * Java 11 or better JRE to run, depends on the Apache commons compression library for the zip format
 * and on SLF4J for logging, and is Apache 2 licensed. Packing prepares entries in parallel but writes
 * them in the order of a sorted walk of the source, so unchanged content always yields the same archive.
 * Unpacking restores entries in parallel under a fixed concurrency cap, and refuses any entry whose
 * name would place it outside the destination directory.
 *
 * @author richardrodgers
 */
package edu.mit.lib.parzip;
