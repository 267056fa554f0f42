package com.fb2index.ingest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ArchiveFinderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWalkDirectoriesOnlyWhenRecursive() throws Exception {
        Path library = Files.createDirectories(tempDir.resolve("library/nested"));
        Path top = Files.writeString(tempDir.resolve("library/b.zip"), "");
        Path nested = Files.writeString(library.resolve("a.ZIP"), "");
        Files.writeString(library.resolve("notes.txt"), "");

        assertEquals(List.of(top, nested), new ArchiveFinder(true).find(List.of(tempDir.resolve("library"))));
        assertEquals(List.of(), new ArchiveFinder(false).find(List.of(tempDir.resolve("library"))));
    }

    @Test
    void shouldPassZipPathsThroughAndDropOtherFiles() throws Exception {
        Path missing = tempDir.resolve("missing.zip");
        Path text = Files.writeString(tempDir.resolve("readme.txt"), "");

        assertEquals(List.of(missing), new ArchiveFinder(false).find(List.of(missing, text)));
    }
}
