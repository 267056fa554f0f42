package com.fb2index.ingest;

import java.io.IOException;
import java.io.InputStream;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;

import com.fb2index.catalog.DocumentLocator;

public final class ArchiveEntry {
    private final OpenArchive archive;
    private final ZipArchiveEntry entry;
    private final DocumentLocator locator;

    ArchiveEntry(OpenArchive archive, ZipArchiveEntry entry, DocumentLocator locator) {
        this.archive = archive;
        this.entry = entry;
        this.locator = locator;
    }

    public DocumentLocator locator() {
        return locator;
    }

    public InputStream open() throws IOException {
        return archive.open(entry);
    }

    public void release() {
        archive.release();
    }
}
