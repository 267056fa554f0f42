package com.fb2index.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ArchiveFinder {
    private static final Logger log = LoggerFactory.getLogger(ArchiveFinder.class);

    private final boolean recursive;

    public ArchiveFinder(boolean recursive) {
        this.recursive = recursive;
    }

    public List<Path> find(List<Path> inputs) {
        List<Path> archives = new ArrayList<>();
        for (Path input : inputs) {
            if (recursive && Files.isDirectory(input)) {
                archives.addAll(walk(input));
            } else if (isZip(input)) {
                archives.add(input);
            } else {
                log.warn("{}: not a .zip file", input);
            }
        }
        return archives;
    }

    private List<Path> walk(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths.filter(Files::isRegularFile)
                    .filter(ArchiveFinder::isZip)
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("{}: walk: {}", directory, e.getMessage());
            return List.of();
        }
    }

    static boolean isZip(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".zip");
    }
}
