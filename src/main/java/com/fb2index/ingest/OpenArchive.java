package com.fb2index.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class OpenArchive {
    private static final Logger log = LoggerFactory.getLogger(OpenArchive.class);

    private final Path path;
    private final ZipFile zipFile;
    private final AtomicInteger references = new AtomicInteger(1);

    OpenArchive(Path path, ZipFile zipFile) {
        this.path = path;
        this.zipFile = zipFile;
    }

    Path path() {
        return path;
    }

    ZipFile zipFile() {
        return zipFile;
    }

    InputStream open(ZipArchiveEntry entry) throws IOException {
        return zipFile.getInputStream(entry);
    }

    void retain() {
        if (references.getAndIncrement() <= 0) {
            throw new IllegalStateException(path + " is already closed");
        }
    }

    void release() {
        if (references.decrementAndGet() == 0) {
            try {
                zipFile.close();
            } catch (IOException e) {
                log.warn("{}: close: {}", path, e.getMessage());
            }
        }
    }
}
