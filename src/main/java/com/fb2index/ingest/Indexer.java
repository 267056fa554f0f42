package com.fb2index.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fb2index.catalog.BookRecord;
import com.fb2index.catalog.CatalogException;
import com.fb2index.catalog.CatalogStore;
import com.fb2index.catalog.Insertion;
import com.fb2index.catalog.PersonName;
import com.fb2index.catalog.SeriesRef;
import com.fb2index.fb2.BookDescription;
import com.fb2index.trigram.CatalogIndexes;
import com.fb2index.trigram.TrigramIndex;
import com.fb2index.trigram.Trigrams;

/**
 * The only writer of the catalog store and the trigram indexes. Documents are processed one at a time:
 * each one is stored in its own transaction, and only after that commit are the trigrams of the entities
 * it created appended. IDs therefore reach every index in the order the store handed them out.
 *
 * <p>Not thread-safe; exactly one thread may call {@link #index(ParsedDocument)}.
 */
public class Indexer {
    private static final Logger log = LoggerFactory.getLogger(Indexer.class);

    private final CatalogStore store;
    private final CatalogIndexes indexes;

    private int documentsIndexed;
    private int authorsCreated;
    private int seriesCreated;

    public Indexer(CatalogStore store, CatalogIndexes indexes) {
        this.store = store;
        this.indexes = indexes;
    }

    public long index(ParsedDocument document) throws CatalogException {
        BookDescription description = document.description();
        List<PendingAppend> pending = new ArrayList<>();
        List<int[]> bookTrigrams = new ArrayList<>();
        int newAuthors = 0;
        int newSeries = 0;
        long bookId;

        store.begin();
        try {
            bookId = store.insertBook(new BookRecord(description.title(), description.language(), document.locator()));
            bookTrigrams.add(Trigrams.extract(description.title()));

            for (String genre : description.genres()) {
                store.linkGenre(bookId, store.lookupOrInsertGenre(genre).id());
            }

            for (PersonName author : description.authors()) {
                Insertion insertion = store.lookupOrInsertAuthor(author);
                store.linkAuthor(bookId, insertion.id());
                int[] trigrams = nameTrigrams(author);
                bookTrigrams.add(trigrams);
                if (insertion.inserted()) {
                    pending.add(new PendingAppend(indexes.authors(), insertion.id(), trigrams));
                    newAuthors++;
                }
            }

            for (PersonName translator : description.translators()) {
                Insertion insertion = store.lookupOrInsertAuthor(translator);
                store.linkTranslator(bookId, insertion.id());
                int[] trigrams = nameTrigrams(translator);
                bookTrigrams.add(trigrams);
                if (insertion.inserted()) {
                    pending.add(new PendingAppend(indexes.authors(), insertion.id(), trigrams));
                    newAuthors++;
                }
            }

            for (SeriesRef series : description.series()) {
                Insertion insertion = store.lookupOrInsertSeries(series.name());
                store.linkSeries(bookId, insertion.id(), series.number());
                int[] trigrams = Trigrams.extract(series.name());
                bookTrigrams.add(trigrams);
                if (insertion.inserted()) {
                    pending.add(new PendingAppend(indexes.series(), insertion.id(), trigrams));
                    newSeries++;
                }
            }

            store.commit();
        } catch (CatalogException | RuntimeException e) {
            try {
                store.rollback();
            } catch (CatalogException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }

        for (PendingAppend append : pending) {
            append.index().addTrigrams(append.id(), append.trigrams());
        }
        indexes.books().addTrigrams(bookId, concat(bookTrigrams));

        documentsIndexed++;
        authorsCreated += newAuthors;
        seriesCreated += newSeries;
        log.debug("{}: book {} '{}' ({} new authors, {} new series)",
                document.locator().describe(), bookId, description.title(), newAuthors, newSeries);
        return bookId;
    }

    public int documentsIndexed() {
        return documentsIndexed;
    }

    public int authorsCreated() {
        return authorsCreated;
    }

    public int seriesCreated() {
        return seriesCreated;
    }

    static int[] nameTrigrams(PersonName name) {
        return concat(name.parts().stream().map(Trigrams::extract).toList());
    }

    private static int[] concat(List<int[]> parts) {
        return parts.stream().flatMapToInt(IntStream::of).distinct().toArray();
    }

    private record PendingAppend(TrigramIndex index, long id, int[] trigrams) {
    }
}
