package com.fb2index.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fb2index.catalog.CatalogException;
import com.fb2index.catalog.CatalogStore;
import com.fb2index.catalog.DocumentLocator;
import com.fb2index.fb2.BookDescription;
import com.fb2index.fb2.MetadataException;
import com.fb2index.fb2.MetadataExtractor;
import com.fb2index.runtime.AppConfig;
import com.fb2index.trigram.CatalogIndexes;
import com.fb2index.trigram.IndexInvariantViolationException;

public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private static final ArchiveEntry END_OF_ARCHIVES = new ArchiveEntry(null, null, null);
    private static final ParsedDocument END_OF_INPUT = new ParsedDocument(null, null);

    private final CatalogStore store;
    private final CatalogIndexes indexes;
    private final MetadataExtractor extractor;
    private final ArchiveWalker walker;
    private final AppConfig.IngestConfig config;

    public IngestionPipeline(
            CatalogStore store,
            CatalogIndexes indexes,
            MetadataExtractor extractor,
            ArchiveWalker walker,
            AppConfig.IngestConfig config) {
        this.store = store;
        this.indexes = indexes;
        this.extractor = extractor;
        this.walker = walker;
        this.config = config;
    }

    public IngestionReport ingest(List<Path> archives) throws InterruptedException {
        long started = System.nanoTime();
        int parallelism = Math.max(1, config.getParallelism());
        BlockingQueue<ArchiveEntry> jobs = new ArrayBlockingQueue<>(config.effectiveQueueCapacity());
        BlockingQueue<ParsedDocument> channel = new ArrayBlockingQueue<>(config.effectiveChannelCapacity());
        RunState run = new RunState();
        Indexer indexer = new Indexer(store, indexes);

        ExecutorService indexerThread = Executors.newSingleThreadExecutor(named("fb2-indexer"));
        ExecutorService workers = Executors.newFixedThreadPool(parallelism, named("fb2-parser"));
        Future<Void> indexing = indexerThread.submit(() -> consume(channel, indexer, run));
        for (int i = 0; i < parallelism; i++) {
            workers.submit(() -> parse(jobs, channel, run));
        }

        int archivesRead = 0;
        try {
            for (Path archive : archives) {
                if (run.aborted.get()) {
                    log.warn("{}: not read, ingestion aborted", archive);
                    continue;
                }
                if (walk(archive, jobs, run)) {
                    archivesRead++;
                }
            }

            for (int i = 0; i < parallelism; i++) {
                jobs.put(END_OF_ARCHIVES);
            }
            workers.shutdown();
            workers.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
            channel.put(END_OF_INPUT);
            awaitIndexer(indexing);
        } catch (InterruptedException e) {
            workers.shutdownNow();
            indexerThread.shutdownNow();
            releaseAll(jobs);
            throw e;
        } finally {
            workers.shutdown();
            indexerThread.shutdown();
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        IngestionReport report = new IngestionReport(
                indexer.documentsIndexed(),
                archivesRead,
                run.skipped.get(),
                indexer.authorsCreated(),
                indexer.seriesCreated(),
                elapsedMs,
                new ArrayList<>(run.failures));
        log.info("Indexed {} book(s) from {} archive(s) in {} ms ({} skipped, {} failed)",
                report.documentsIndexed(), archivesRead, elapsedMs, report.entriesSkipped(),
                report.failures().size());
        return report;
    }

    private boolean walk(Path archive, BlockingQueue<ArchiveEntry> jobs, RunState run) throws InterruptedException {
        long started = System.nanoTime();
        try {
            int queued = walker.walk(archive, new ArchiveWalker.EntrySink() {
                @Override
                public void accept(ArchiveEntry entry) throws InterruptedException {
                    if (run.aborted.get()) {
                        entry.release();
                        return;
                    }
                    jobs.put(entry);
                }

                @Override
                public void unsupported(DocumentLocator locator, int method) {
                    run.fail(IngestionFailure.Kind.UNSUPPORTED_COMPRESSION, locator.archive(), locator.entry(),
                            "unsupported compression method " + method);
                }
            });
            log.info("{}: {} entries queued in {} ms", archive, queued,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            return true;
        } catch (IOException e) {
            run.fail(IngestionFailure.Kind.ARCHIVE_OPEN, archive.toString(), null, "open: " + e.getMessage());
            return false;
        }
    }

    private void parse(BlockingQueue<ArchiveEntry> jobs, BlockingQueue<ParsedDocument> channel, RunState run) {
        try {
            while (true) {
                ArchiveEntry job = jobs.take();
                if (job == END_OF_ARCHIVES) {
                    return;
                }
                Optional<ParsedDocument> document;
                try {
                    document = run.aborted.get() ? Optional.empty() : extract(job, run);
                } finally {
                    job.release();
                }
                if (document.isPresent()) {
                    channel.put(document.get());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Optional<ParsedDocument> extract(ArchiveEntry job, RunState run) {
        DocumentLocator locator = job.locator();
        try (InputStream content = job.open()) {
            Optional<BookDescription> description = extractor.extract(content);
            if (description.isEmpty()) {
                run.skipped.incrementAndGet();
                log.debug("{}: skipped by language filter", locator.describe());
                return Optional.empty();
            }
            return Optional.of(new ParsedDocument(locator, description.get()));
        } catch (IOException e) {
            run.fail(IngestionFailure.Kind.ENTRY_READ, locator.archive(), locator.entry(), "read: " + e.getMessage());
        } catch (MetadataException e) {
            IngestionFailure.Kind kind = e.kind() == MetadataException.Kind.NO_TITLE
                    ? IngestionFailure.Kind.NO_TITLE
                    : IngestionFailure.Kind.PARSE_ERROR;
            run.fail(kind, locator.archive(), locator.entry(), e.getMessage());
        } catch (RuntimeException e) {
            run.fail(IngestionFailure.Kind.PARSE_ERROR, locator.archive(), locator.entry(), String.valueOf(e));
        }
        return Optional.empty();
    }

    private Void consume(BlockingQueue<ParsedDocument> channel, Indexer indexer, RunState run)
            throws InterruptedException {
        RuntimeException fatal = null;
        while (true) {
            ParsedDocument document = channel.take();
            if (document == END_OF_INPUT) {
                break;
            }
            if (fatal != null) {
                continue;
            }
            try {
                indexer.index(document);
            } catch (CatalogException e) {
                run.fail(IngestionFailure.Kind.COMMIT_FAILED, document.locator().archive(),
                        document.locator().entry(), e.getMessage());
            } catch (RuntimeException e) {
                fatal = e;
                run.aborted.set(true);
                log.error("{}: indexing aborted: {}", document.locator().describe(), e.getMessage(), e);
            }
        }
        if (fatal != null) {
            throw fatal;
        }
        return null;
    }

    private static void awaitIndexer(Future<Void> indexing) throws InterruptedException {
        try {
            indexing.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("indexer failed", cause);
        }
    }

    private static void releaseAll(BlockingQueue<ArchiveEntry> jobs) {
        List<ArchiveEntry> pending = new ArrayList<>();
        jobs.drainTo(pending);
        for (ArchiveEntry entry : pending) {
            if (entry != END_OF_ARCHIVES) {
                entry.release();
            }
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class RunState {
        final Queue<IngestionFailure> failures = new ConcurrentLinkedQueue<>();
        final AtomicInteger skipped = new AtomicInteger();
        final AtomicBoolean aborted = new AtomicBoolean();

        void fail(IngestionFailure.Kind kind, String archive, String entry, String message) {
            IngestionFailure failure = new IngestionFailure(kind, archive, entry, message);
            failures.add(failure);
            log.warn("{}", failure.describe());
        }
    }
}
