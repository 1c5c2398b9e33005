/**
 * Copyright 2013, 2014 MIT Libraries
 * SPDX-Licence-Identifier: Apache-2.0
 */

package edu.mit.lib.parzip;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static edu.mit.lib.parzip.Archive.*;

/**
 * Zipper is a command-line interface to the parzip library.
 * It allows packing of a file or directory into a zip archive,
 * unpacking an archive into a directory, and listing an archive.
 *
 * See README for sample invocations.
 *
 * @author richardrodgers
 */

public class Zipper {
    /* A bit clunky in the cmd-line arg handling, but deliberately so as to limit
       external dependencies for those who want to only use the library API directly. */
    private final PrintStream out;
    private final PrintStream err;
    private String output;
    private String dest;
    private int workers;
    private boolean noTime = false;
    private int verbosityLevel;

    public static void main(String[] args) {
        System.exit(new Zipper(System.out, System.err).run(args));
    }

    Zipper(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * Executes one command, returning its exit status.
     *
     * @param args command, target and options
     * @return status 0 on success, else non-zero
     */
    int run(String[] args) {
        if (args.length < 2) {
            return usage();
        }
        int i = 2;
        while (i < args.length) {
            if (i + 1 >= args.length) {
                err.println("Missing value for option: '" + args[i] + "'");
                return usage();
            }
            try {
                switch(args[i]) {
                    case "-o": output = args[i+1]; break;
                    case "-d": dest = args[i+1]; break;
                    case "-w": workers = Integer.parseInt(args[i+1]); break;
                    case "-n": noTime = Boolean.valueOf(args[i+1]); break;
                    case "-v": verbosityLevel = Integer.parseInt(args[i+1]); break;
                    default: err.println("Unknown option: '" + args[i] + "'"); return usage();
                }
            } catch (NumberFormatException nfE) {
                err.println("Not a number: '" + args[i+1] + "'");
                return usage();
            }
            i += 2;
        }
        if (verbosityLevel > 1) {
            // only effective before the first logger is created
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", verbosityLevel > 2 ? "debug" : "info");
        }
        // execute command if recognized
        switch(args[0]) {
            case "zip" : return zip(args[1]);
            case "unzip" : return unzip(args[1]);
            case "list" : return list(args[1]);
            default: err.println("Unknown command: '" + args[0] + "'"); return usage();
        }
    }

    int usage() {
        err.println(
            "Usage: Zipper command target [-options]\n" +
            "Commands:\n" +
            "zip      pack a file or directory into a zip archive\n" +
            "unzip    unpack a zip archive into a directory\n" +
            "list     list archive entries, returns non-zero if any are unsafe");
        err.println(
            "Options:\n" +
            "-o    <archive> - zip output file (default: <target name>.zip)\n" +
            "-d    <directory> - unzip destination (default: archive name sans extension)\n" +
            "-w    <count> - parallel workers (default: available processors)\n" +
            "-n    <noTime> - 'true' or 'false'\n" +
            "-v    <level> - output level to console (default: 0 = no output)");
        return 1;
    }

    private int zip(String src) {
        Path source = Paths.get(src);
        if (Files.notExists(source)) {
            err.println("path does not exist: " + src);
            return 1;
        }
        Path archive = Paths.get(output != null ? output : defaultArchiveName(source));
        try {
            Packer packer = new Packer(source).noTime(noTime);
            if (workers > 0) {
                packer.workers(workers);
            }
            packer.toArchive(archive);
        } catch (IOException ioE) {
            err.println("error while packing: " + ioE.getMessage());
            return 1;
        }
        message("Archive created: " + archive);
        return 0;
    }

    private int unzip(String zipFile) {
        Path archive = Paths.get(zipFile);
        if (Files.notExists(archive)) {
            err.println("archive not found: " + zipFile);
            return 1;
        }
        String destName = dest != null ? dest : defaultDestination(archive);
        if (destName.isEmpty()) {
            err.println("no destination can be derived from archive name: " + zipFile);
            return 1;
        }
        Path destination = Paths.get(destName);
        try {
            Unpacker unpacker = new Unpacker(destination);
            if (workers > 0) {
                unpacker.permits(workers);
            }
            unpacker.unpack(archive);
        } catch (IOException ioE) {
            err.println("error while unpacking: " + ioE.getMessage());
            return 1;
        }
        message("Unpacked to: " + destination);
        return 0;
    }

    private int list(String zipFile) {
        try {
            Archive archive = new Archive(Paths.get(zipFile));
            for (String name : archive.entryNames()) {
                out.println(name);
            }
            List<String> unsafe = archive.unsafeEntries();
            for (String name : unsafe) {
                err.println("unsafe entry: " + name);
            }
            return unsafe.isEmpty() ? 0 : 1;
        } catch (IOException ioE) {
            err.println("error while listing: " + ioE.getMessage());
            return 1;
        }
    }

    /**
     * Returns the archive name used when none is given: the
     * source's own name with a zip suffix.
     *
     * @param source the file or directory to pack
     * @return name the archive file name
     */
    static String defaultArchiveName(Path source) {
        return source.toAbsolutePath().normalize().getFileName().toString() + ARCHIVE_SFX;
    }

    /**
     * Returns the destination used when none is given: the archive
     * name stripped of a zip suffix and of one further extension.
     * A name with nothing left, such as '.zip', yields an empty string.
     *
     * @param archive the archive file
     * @return name the destination directory name, empty if none
     */
    static String defaultDestination(Path archive) {
        String base = archive.getFileName().toString();
        if (base.toLowerCase().endsWith(ARCHIVE_SFX)) {
            base = base.substring(0, base.length() - ARCHIVE_SFX.length());
        }
        int idx = base.lastIndexOf(".");
        if (idx > 0) {
            base = base.substring(0, idx);
        }
        return base;
    }

    private void message(String text) {
        if (verbosityLevel > 0) {
            out.println(text);
        }
    }
}
