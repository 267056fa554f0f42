package com.fb2index.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Enumeration;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.archivers.zip.ZipMethod;

import com.fb2index.catalog.DocumentLocator;

public class ArchiveWalker {
    public static final int SUPPORTED_METHOD = ZipMethod.DEFLATED.getCode();

    public interface EntrySink {
        /**
         * Takes ownership of {@code entry}; the receiver must eventually call {@link ArchiveEntry#release()}.
         */
        void accept(ArchiveEntry entry) throws InterruptedException;

        void unsupported(DocumentLocator locator, int method);
    }

    public int walk(Path archive, EntrySink sink) throws IOException, InterruptedException {
        OpenArchive open = new OpenArchive(archive, openZip(archive));
        int accepted = 0;
        try {
            Enumeration<ZipArchiveEntry> entries = open.zipFile().getEntriesInPhysicalOrder();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                if (entry.isDirectory()) {
                    continue;
                }
                DocumentLocator locator = locate(archive, entry);
                if (entry.getMethod() != SUPPORTED_METHOD) {
                    sink.unsupported(locator, entry.getMethod());
                    continue;
                }

                open.retain();
                try {
                    sink.accept(new ArchiveEntry(open, entry, locator));
                } catch (InterruptedException e) {
                    open.release();
                    throw e;
                }
                accepted++;
            }
        } finally {
            open.release();
        }
        return accepted;
    }

    public byte[] readEntry(DocumentLocator locator) throws IOException {
        try (ZipFile zipFile = openZip(Path.of(locator.archive()))) {
            ZipArchiveEntry entry = zipFile.getEntry(locator.entry());
            if (entry == null) {
                throw new IOException(locator.describe() + ": no such entry");
            }
            try (InputStream in = zipFile.getInputStream(entry)) {
                return in.readAllBytes();
            }
        }
    }

    private static ZipFile openZip(Path archive) throws IOException {
        return ZipFile.builder().setPath(archive).get();
    }

    private static DocumentLocator locate(Path archive, ZipArchiveEntry entry) {
        return new DocumentLocator(
                archive.toString(),
                entry.getName(),
                entry.getDataOffset(),
                entry.getCompressedSize(),
                entry.getSize(),
                entry.getCrc());
    }
}
