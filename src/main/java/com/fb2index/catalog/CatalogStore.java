package com.fb2index.catalog;

import java.util.List;
import java.util.Optional;

public interface CatalogStore extends AutoCloseable {
    void begin() throws CatalogException;

    void commit() throws CatalogException;

    void rollback() throws CatalogException;

    long insertBook(BookRecord book) throws CatalogException;

    Insertion lookupOrInsertGenre(String name) throws CatalogException;

    Insertion lookupOrInsertAuthor(PersonName name) throws CatalogException;

    Insertion lookupOrInsertSeries(String name) throws CatalogException;

    void linkGenre(long bookId, long genreId) throws CatalogException;

    void linkAuthor(long bookId, long authorId) throws CatalogException;

    void linkTranslator(long bookId, long authorId) throws CatalogException;

    void linkSeries(long bookId, long seriesId, int number) throws CatalogException;

    Optional<Author> findAuthor(long id) throws CatalogException;

    Optional<Series> findSeries(long id) throws CatalogException;

    Optional<Book> findBook(long id) throws CatalogException;

    List<Author> findAuthorsOfBook(long bookId) throws CatalogException;

    BookRelations findRelations(long bookId) throws CatalogException;

    List<Book> findBooksByAuthor(long authorId) throws CatalogException;

    List<Book> findBooksTranslatedBy(long authorId) throws CatalogException;

    List<SeriesBook> findBooksInSeries(long seriesId) throws CatalogException;

    List<Book> findBooksByGenre(String genre) throws CatalogException;

    long countBooks() throws CatalogException;

    @Override
    void close() throws CatalogException;
}
