package com.fb2index.ingest;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import com.fb2index.catalog.BookRecord;
import com.fb2index.catalog.CatalogException;
import com.fb2index.catalog.CatalogStore;
import com.fb2index.catalog.InMemoryCatalogStore;
import com.fb2index.catalog.PersonName;
import com.fb2index.catalog.SeriesRef;
import com.fb2index.fb2.BookDescription;
import com.fb2index.fb2.Fb2DescriptionParser;
import com.fb2index.fb2.MetadataException;
import com.fb2index.fb2.MetadataExtractor;
import com.fb2index.runtime.AppConfig;
import com.fb2index.trigram.CatalogIndexes;
import com.fb2index.trigram.IndexInvariantViolationException;
import com.fb2index.trigram.TrigramIndex;
import com.fb2index.trigram.Trigrams;

import static com.fb2index.Fb2Fixtures.author;
import static com.fb2index.Fb2Fixtures.entries;
import static com.fb2index.Fb2Fixtures.fb2;
import static com.fb2index.Fb2Fixtures.utf8;
import static com.fb2index.Fb2Fixtures.zip;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(value = 60, unit = TimeUnit.SECONDS)
class IngestionPipelineTest {

    private static final List<PersonName> AUTHORS = List.of(
            author("Лев", "Толстой"),
            author("Фёдор", "Достоевский"),
            author("Антон", "Чехов"),
            author("Иван", "Тургенев"),
            author("Николай", "Гоголь"),
            author("Александр", "Пушкин"),
            author("Михаил", "Лермонтов"));
    private static final List<String> SERIES = List.of("Классика", "Собрание сочинений", "Избранное", "Библиотека");

    @TempDir
    Path tempDir;

    @Test
    void shouldProduceSameIndexContentRegardlessOfWorkerInterleaving() throws Exception {
        List<Path> archives = List.of(
                library("one.zip", 0, 334),
                library("two.zip", 334, 333),
                library("three.zip", 667, 333));

        Map<Integer, Set<String>> firstRun = null;
        for (int run = 0; run < 2; run++) {
            InMemoryCatalogStore store = new InMemoryCatalogStore();
            CatalogIndexes indexes = CatalogIndexes.create();
            IngestionPipeline pipeline = new IngestionPipeline(store, indexes,
                    new JitteringExtractor(new Fb2DescriptionParser(Set.of())), new ArchiveWalker(), config(8, 4, 4));

            IngestionReport report = pipeline.ingest(archives);

            assertEquals(1000, report.documentsIndexed());
            assertEquals(3, report.archivesRead());
            assertTrue(report.failures().isEmpty(), () -> report.failures().toString());
            assertEquals(AUTHORS.size(), report.authorsCreated());
            assertEquals(SERIES.size(), report.seriesCreated());

            Map<Integer, Set<String>> content = naturalContent(store, indexes);
            if (firstRun == null) {
                firstRun = content;
            } else {
                assertEquals(firstRun, content);
            }
        }
    }

    @Test
    void shouldReportStoredEntryAndIndexTheRest() throws Exception {
        Path archive = zip(tempDir.resolve("mixed.zip"),
                entries(
                        "1.fb2", fb2("Война и мир", "ru", author("Лев", "Толстой")),
                        "2.fb2", fb2("Анна Каренина", "ru", author("Лев", "Толстой"))),
                entries("3.fb2", fb2("Воскресение", "ru", author("Лев", "Толстой"))));
        InMemoryCatalogStore store = new InMemoryCatalogStore();

        IngestionReport report = pipeline(store, CatalogIndexes.create(), Set.of()).ingest(List.of(archive));

        assertEquals(2, report.documentsIndexed());
        assertEquals(1, report.failureCount(IngestionFailure.Kind.UNSUPPORTED_COMPRESSION));
        assertEquals("3.fb2", report.failures().get(0).entry());
        assertEquals(2, store.countBooks());
    }

    @Test
    void shouldContinuePastArchiveThatCannotBeOpened() throws Exception {
        Path broken = tempDir.resolve("broken.zip");
        Files.writeString(broken, "not a zip at all");
        Path good = zip(tempDir.resolve("good.zip"), entries("1.fb2", fb2("Идиот", "ru")));

        IngestionReport report = pipeline(new InMemoryCatalogStore(), CatalogIndexes.create(), Set.of())
                .ingest(List.of(tempDir.resolve("missing.zip"), broken, good));

        assertEquals(1, report.documentsIndexed());
        assertEquals(1, report.archivesRead());
        assertEquals(2, report.failureCount(IngestionFailure.Kind.ARCHIVE_OPEN));
        assertTrue(report.failures().stream().allMatch(failure -> failure.entry() == null));
    }

    @Test
    void shouldRecordEntryFailuresAndCountSkips() throws Exception {
        Path archive = zip(tempDir.resolve("books.zip"), entries(
                "ok.fb2", fb2("Идиот", "ru"),
                "english.fb2", fb2("The Idiot", "en"),
                "untitled.fb2", "<?xml version=\"1.0\"?><FictionBook><description><title-info><lang>ru</lang>"
                        + "</title-info></description></FictionBook>",
                "broken.fb2", "<FictionBook><description><book-title>x</description>"));
        CatalogIndexes indexes = CatalogIndexes.create();

        IngestionReport report = pipeline(new InMemoryCatalogStore(), indexes, Set.of("ru")).ingest(List.of(archive));

        assertEquals(1, report.documentsIndexed());
        assertEquals(1, report.entriesSkipped());
        assertEquals(1, report.failureCount(IngestionFailure.Kind.NO_TITLE));
        assertEquals(1, report.failureCount(IngestionFailure.Kind.PARSE_ERROR));
        assertEquals(1, indexes.books().query("Идиот").length);
    }

    @Test
    void shouldReportCorruptCompressedDataAsReadFailure() throws Exception {
        Path archive = zip(tempDir.resolve("damaged.zip"), entries(
                "bad.fb2", fb2("Бесы", "ru"),
                "good.fb2", fb2("Идиот", "ru")));
        byte[] bytes = Files.readAllBytes(archive);
        // first local header: 30 fixed bytes, then the name, then the DEFLATE stream
        int data = 30 + "bad.fb2".length();
        for (int i = data; i < data + 4; i++) {
            bytes[i] = (byte) 0xFF;
        }
        Files.write(archive, bytes);

        IngestionReport report = pipeline(new InMemoryCatalogStore(), CatalogIndexes.create(), Set.of())
                .ingest(List.of(archive));

        assertEquals(1, report.documentsIndexed());
        assertEquals(1, report.failureCount(IngestionFailure.Kind.ENTRY_READ));
        assertEquals("bad.fb2", report.failures().get(0).entry());
    }

    @Test
    void shouldRecordCommitFailureAndKeepIndexing() throws Exception {
        Path archive = zip(tempDir.resolve("books.zip"), entries(
                "1.fb2", fb2("Идиот", "ru"),
                "2.fb2", fb2("Бесы", "ru"),
                "3.fb2", fb2("Подросток", "ru")));
        CatalogIndexes indexes = CatalogIndexes.create();
        InMemoryCatalogStore store = new InMemoryCatalogStore() {
            private String title;

            @Override
            public long insertBook(BookRecord book) throws CatalogException {
                title = book.title();
                return super.insertBook(book);
            }

            @Override
            public void commit() throws CatalogException {
                if ("Бесы".equals(title)) {
                    throw new CatalogException("constraint failed");
                }
                super.commit();
            }
        };

        IngestionReport report = pipeline(store, indexes, Set.of()).ingest(List.of(archive));

        assertEquals(2, report.documentsIndexed());
        assertEquals(1, report.failureCount(IngestionFailure.Kind.COMMIT_FAILED));
        assertEquals("2.fb2", report.failures().get(0).entry());
        assertEquals(0, indexes.books().query("Бесы").length);
        assertEquals(1, indexes.books().query("Подросток").length);
    }

    @Test
    void shouldAbortOnInvariantViolation() throws Exception {
        Map<String, byte[]> books = new LinkedHashMap<>();
        for (int i = 0; i < 200; i++) {
            books.put(i + ".fb2", utf8(fb2("Книга " + i, "ru")));
        }
        Path archive = zip(tempDir.resolve("books.zip"), books);
        CatalogIndexes indexes = CatalogIndexes.create();
        indexes.books().add(1_000_000, "Посторонняя запись");

        IngestionPipeline pipeline = new IngestionPipeline(new InMemoryCatalogStore(), indexes,
                new Fb2DescriptionParser(Set.of()), new ArchiveWalker(), config(4, 2, 2));

        IndexInvariantViolationException e = assertThrows(IndexInvariantViolationException.class,
                () -> pipeline.ingest(List.of(archive, archive)));
        assertEquals(1_000_000, e.lastIndexedId());
    }

    private IngestionPipeline pipeline(CatalogStore store, CatalogIndexes indexes, Set<String> languages) {
        return new IngestionPipeline(store, indexes, new Fb2DescriptionParser(languages), new ArchiveWalker(),
                config(3, 2, 2));
    }

    private static AppConfig.IngestConfig config(int parallelism, int queueCapacity, int channelCapacity) {
        AppConfig.IngestConfig config = new AppConfig.IngestConfig();
        config.setParallelism(parallelism);
        config.setQueueCapacity(queueCapacity);
        config.setChannelCapacity(channelCapacity);
        return config;
    }

    private Path library(String name, int from, int count) throws Exception {
        Map<String, byte[]> books = new LinkedHashMap<>();
        for (int i = from; i < from + count; i++) {
            PersonName writer = AUTHORS.get(i % AUTHORS.size());
            List<SeriesRef> series = i % 3 == 0 ? List.of(new SeriesRef(SERIES.get(i % SERIES.size()), i)) : List.of();
            books.put("book-" + i + ".fb2", utf8(fb2("Том " + i + " " + titleWord(i), "ru", List.of(writer), series)));
        }
        return zip(tempDir.resolve(name), books);
    }

    private static String titleWord(int i) {
        return List.of("рассказы", "повести", "романы", "письма", "дневники").get(i % 5);
    }

    // trigram to natural keys, comparable across runs that handed out IDs in different orders
    private static Map<Integer, Set<String>> naturalContent(CatalogStore store, CatalogIndexes indexes)
            throws CatalogException {
        Set<Integer> trigrams = new LinkedHashSet<>();
        for (PersonName writer : AUTHORS) {
            writer.parts().forEach(part -> addAll(trigrams, Trigrams.extract(part)));
        }
        SERIES.forEach(series -> addAll(trigrams, Trigrams.extract(series)));
        for (int i = 0; i < 1000; i++) {
            addAll(trigrams, Trigrams.extract("Том " + i + " " + titleWord(i)));
        }

        Map<Integer, Set<String>> content = new TreeMap<>();
        for (int trigram : trigrams) {
            Set<String> keys = new TreeSet<>();
            for (long id : postings(indexes.authors(), trigram)) {
                keys.add("author:" + store.findAuthor(id).orElseThrow().name().displayName());
            }
            for (long id : postings(indexes.series(), trigram)) {
                keys.add("series:" + store.findSeries(id).orElseThrow().name());
            }
            for (long id : postings(indexes.books(), trigram)) {
                keys.add("book:" + store.findBook(id).orElseThrow().locator().describe());
            }
            content.put(trigram, keys);
        }
        return content;
    }

    // a single-trigram query has a zero threshold and returns the whole posting list
    private static long[] postings(TrigramIndex index, int trigram) {
        return index.queryTrigrams(new int[] { trigram });
    }

    private static void addAll(Set<Integer> target, int[] trigrams) {
        for (int trigram : trigrams) {
            target.add(trigram);
        }
    }

    private static final class JitteringExtractor implements MetadataExtractor {
        private final MetadataExtractor delegate;

        JitteringExtractor(MetadataExtractor delegate) {
            this.delegate = delegate;
        }

        @Override
        public Optional<BookDescription> extract(InputStream content) throws IOException, MetadataException {
            byte[] bytes = content.readAllBytes();
            try {
                Thread.sleep(ThreadLocalRandom.current().nextInt(3));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MetadataException(MetadataException.Kind.PARSE_ERROR, "interrupted", e);
            }
            return delegate.extract(new ByteArrayInputStream(bytes));
        }
    }
}
