package com.fb2index.cover;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fb2index.catalog.Book;
import com.fb2index.catalog.CatalogException;
import com.fb2index.catalog.CatalogStore;
import com.fb2index.fb2.CoverImage;
import com.fb2index.fb2.Fb2CoverReader;
import com.fb2index.fb2.MetadataException;
import com.fb2index.ingest.ArchiveWalker;

public class CoverService {
    private static final Logger log = LoggerFactory.getLogger(CoverService.class);

    private final CatalogStore store;
    private final ArchiveWalker walker;
    private final Fb2CoverReader coverReader;
    private final ExpiringCache<Long, CoverImage> cache;

    public CoverService(CatalogStore store, ArchiveWalker walker, ExpiringCache<Long, CoverImage> cache) {
        this.store = store;
        this.walker = walker;
        this.coverReader = new Fb2CoverReader();
        this.cache = cache;
    }

    public Optional<CoverImage> cover(long bookId) throws CatalogException, IOException, MetadataException {
        Optional<CoverImage> cached = cache.get(bookId);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<Book> book = store.findBook(bookId);
        if (book.isEmpty()) {
            return Optional.empty();
        }

        byte[] content = walker.readEntry(book.get().locator());
        Optional<CoverImage> cover = coverReader.read(new ByteArrayInputStream(content));
        if (cover.isPresent()) {
            cache.put(bookId, cover.get());
        } else {
            log.debug("{}: no cover image", book.get().locator().describe());
        }
        return cover;
    }
}
