package com.fb2index.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.LongStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fb2index.catalog.Author;
import com.fb2index.catalog.Book;
import com.fb2index.catalog.CatalogException;
import com.fb2index.catalog.CatalogStore;
import com.fb2index.catalog.Series;
import com.fb2index.trigram.CatalogIndexes;
import com.fb2index.trigram.Trigrams;

public class SearchService {
    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final CatalogStore store;
    private final CatalogIndexes indexes;

    public SearchService(CatalogStore store, CatalogIndexes indexes) {
        this.store = store;
        this.indexes = indexes;
    }

    public SearchHits search(String query) {
        int[] trigrams = Trigrams.extract(query);
        return new SearchHits(
                boxed(indexes.authors().queryTrigrams(trigrams)),
                boxed(indexes.series().queryTrigrams(trigrams)),
                boxed(indexes.books().queryTrigrams(trigrams)));
    }

    public SearchResults resolve(SearchHits hits) throws CatalogException {
        List<Author> authors = new ArrayList<>();
        for (long id : hits.authorIds()) {
            present(store.findAuthor(id), "author", id).ifPresent(authors::add);
        }

        List<Series> series = new ArrayList<>();
        for (long id : hits.seriesIds()) {
            present(store.findSeries(id), "series", id).ifPresent(series::add);
        }

        List<SearchResults.BookHit> books = new ArrayList<>();
        for (long id : hits.bookIds()) {
            Optional<Book> book = present(store.findBook(id), "book", id);
            if (book.isPresent()) {
                books.add(new SearchResults.BookHit(book.get(), store.findAuthorsOfBook(id)));
            }
        }
        return new SearchResults(authors, series, books);
    }

    public SearchResults searchAndResolve(String query) throws CatalogException {
        return resolve(search(query));
    }

    private static <T> Optional<T> present(Optional<T> entity, String kind, long id) {
        if (entity.isEmpty()) {
            log.warn("Indexed {} {} not found in the catalog", kind, id);
        }
        return entity;
    }

    private static List<Long> boxed(long[] ids) {
        return LongStream.of(ids).boxed().toList();
    }
}
