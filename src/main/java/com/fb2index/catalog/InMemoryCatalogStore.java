package com.fb2index.catalog;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class InMemoryCatalogStore implements CatalogStore {
    static final Comparator<Book> BY_TITLE = Comparator.comparing(Book::title).thenComparingLong(Book::id);

    private final Map<String, Long> genresByName = new HashMap<>();
    private final Map<Long, String> genresById = new HashMap<>();
    private final Map<PersonName, Long> authorsByName = new HashMap<>();
    private final Map<Long, PersonName> authorsById = new HashMap<>();
    private final Map<String, Long> seriesByName = new HashMap<>();
    private final Map<Long, String> seriesById = new HashMap<>();
    private final Map<Long, Book> books = new HashMap<>();
    private final Set<List<String>> bookLocations = new HashSet<>();
    private final Links bookGenres = new Links();
    private final Links bookAuthors = new Links();
    private final Links bookTranslators = new Links();
    private final Links bookSeries = new Links();
    private final Map<List<Long>, Integer> seriesNumbers = new HashMap<>();

    private final Sequences sequences = new Sequences();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // undo actions of the open transaction, newest first
    private Deque<Runnable> undoLog;
    private Sequences savepoint;

    @Override
    public void begin() throws CatalogException {
        lock.writeLock().lock();
        try {
            if (undoLog != null) {
                throw new CatalogException("transaction already open");
            }
            undoLog = new ArrayDeque<>();
            savepoint = sequences.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void commit() throws CatalogException {
        lock.writeLock().lock();
        try {
            requireTransaction();
            undoLog = null;
            savepoint = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void rollback() throws CatalogException {
        lock.writeLock().lock();
        try {
            if (undoLog == null) {
                return;
            }
            while (!undoLog.isEmpty()) {
                undoLog.pop().run();
            }
            sequences.restore(savepoint);
            undoLog = null;
            savepoint = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long insertBook(BookRecord book) throws CatalogException {
        lock.writeLock().lock();
        try {
            requireTransaction();
            List<String> location = List.of(book.locator().archive(), book.locator().entry());
            if (!bookLocations.add(location)) {
                throw new CatalogException("book already stored: " + book.locator().describe());
            }
            long id = ++sequences.book;
            books.put(id, new Book(id, book.title(), book.language(), book.locator()));
            undoLog.push(() -> {
                books.remove(id);
                bookLocations.remove(location);
            });
            return id;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Insertion lookupOrInsertGenre(String name) throws CatalogException {
        lock.writeLock().lock();
        try {
            requireTransaction();
            Long existing = genresByName.get(name);
            if (existing != null) {
                return Insertion.existing(existing);
            }
            long id = ++sequences.genre;
            genresByName.put(name, id);
            genresById.put(id, name);
            undoLog.push(() -> {
                genresByName.remove(name);
                genresById.remove(id);
            });
            return Insertion.created(id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Insertion lookupOrInsertAuthor(PersonName name) throws CatalogException {
        lock.writeLock().lock();
        try {
            requireTransaction();
            Long existing = authorsByName.get(name);
            if (existing != null) {
                return Insertion.existing(existing);
            }
            long id = ++sequences.author;
            authorsByName.put(name, id);
            authorsById.put(id, name);
            undoLog.push(() -> {
                authorsByName.remove(name);
                authorsById.remove(id);
            });
            return Insertion.created(id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Insertion lookupOrInsertSeries(String name) throws CatalogException {
        lock.writeLock().lock();
        try {
            requireTransaction();
            Long existing = seriesByName.get(name);
            if (existing != null) {
                return Insertion.existing(existing);
            }
            long id = ++sequences.series;
            seriesByName.put(name, id);
            seriesById.put(id, name);
            undoLog.push(() -> {
                seriesByName.remove(name);
                seriesById.remove(id);
            });
            return Insertion.created(id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void linkGenre(long bookId, long genreId) throws CatalogException {
        link(bookGenres, bookId, genreId);
    }

    @Override
    public void linkAuthor(long bookId, long authorId) throws CatalogException {
        link(bookAuthors, bookId, authorId);
    }

    @Override
    public void linkTranslator(long bookId, long authorId) throws CatalogException {
        link(bookTranslators, bookId, authorId);
    }

    @Override
    public void linkSeries(long bookId, long seriesId, int number) throws CatalogException {
        lock.writeLock().lock();
        try {
            requireTransaction();
            if (bookSeries.add(bookId, seriesId)) {
                List<Long> key = List.of(bookId, seriesId);
                seriesNumbers.put(key, number);
                undoLog.push(() -> {
                    bookSeries.remove(bookId, seriesId);
                    seriesNumbers.remove(key);
                });
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Author> findAuthor(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(authorsById.get(id)).map(name -> new Author(id, name));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Series> findSeries(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(seriesById.get(id)).map(name -> new Series(id, name));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Book> findBook(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(books.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Author> findAuthorsOfBook(long bookId) {
        lock.readLock().lock();
        try {
            return authors(bookAuthors.ofBook(bookId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public BookRelations findRelations(long bookId) {
        lock.readLock().lock();
        try {
            List<String> genres = bookGenres.ofBook(bookId).stream()
                    .map(genresById::get)
                    .sorted()
                    .toList();
            List<BookRelations.SeriesMembership> series = bookSeries.ofBook(bookId).stream()
                    .map(seriesId -> new BookRelations.SeriesMembership(
                            new Series(seriesId, seriesById.get(seriesId)),
                            seriesNumbers.get(List.of(bookId, seriesId))))
                    .sorted(Comparator.comparing((BookRelations.SeriesMembership membership) -> membership.series().name())
                            .thenComparingLong(membership -> membership.series().id()))
                    .toList();
            return new BookRelations(
                    genres,
                    authors(bookAuthors.ofBook(bookId)),
                    authors(bookTranslators.ofBook(bookId)),
                    series);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Book> findBooksByAuthor(long authorId) {
        lock.readLock().lock();
        try {
            return books(bookAuthors.booksOf(authorId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Book> findBooksTranslatedBy(long authorId) {
        lock.readLock().lock();
        try {
            return books(bookTranslators.booksOf(authorId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SeriesBook> findBooksInSeries(long seriesId) {
        lock.readLock().lock();
        try {
            return bookSeries.booksOf(seriesId).stream()
                    .map(bookId -> new SeriesBook(seriesNumbers.get(List.of(bookId, seriesId)), books.get(bookId)))
                    .sorted(Comparator.comparingInt(SeriesBook::number)
                            .thenComparing(SeriesBook::book, BY_TITLE))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Book> findBooksByGenre(String genre) {
        lock.readLock().lock();
        try {
            Long genreId = genresByName.get(genre);
            return genreId == null ? List.of() : books(bookGenres.booksOf(genreId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long countBooks() {
        lock.readLock().lock();
        try {
            return books.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() throws CatalogException {
        rollback();
    }

    private List<Author> authors(Set<Long> ids) {
        return ids.stream()
                .map(authorId -> new Author(authorId, authorsById.get(authorId)))
                .toList();
    }

    private List<Book> books(Set<Long> ids) {
        return ids.stream()
                .map(books::get)
                .sorted(BY_TITLE)
                .toList();
    }

    private void link(Links links, long bookId, long otherId) throws CatalogException {
        lock.writeLock().lock();
        try {
            requireTransaction();
            if (links.add(bookId, otherId)) {
                undoLog.push(() -> links.remove(bookId, otherId));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void requireTransaction() throws CatalogException {
        if (undoLog == null) {
            throw new CatalogException("no open transaction");
        }
    }

    // book-to-entity link table, indexed from both sides; ID sets are sorted
    private static final class Links {
        private final Map<Long, Set<Long>> byBook = new HashMap<>();
        private final Map<Long, Set<Long>> byOther = new HashMap<>();

        boolean add(long bookId, long otherId) {
            if (!byBook.computeIfAbsent(bookId, unused -> new TreeSet<>()).add(otherId)) {
                return false;
            }
            byOther.computeIfAbsent(otherId, unused -> new TreeSet<>()).add(bookId);
            return true;
        }

        void remove(long bookId, long otherId) {
            removeFrom(byBook, bookId, otherId);
            removeFrom(byOther, otherId, bookId);
        }

        Set<Long> ofBook(long bookId) {
            return byBook.getOrDefault(bookId, Set.of());
        }

        Set<Long> booksOf(long otherId) {
            return byOther.getOrDefault(otherId, Set.of());
        }

        private static void removeFrom(Map<Long, Set<Long>> index, long key, long value) {
            Set<Long> values = index.get(key);
            if (values != null && values.remove(value) && values.isEmpty()) {
                index.remove(key);
            }
        }
    }

    private static final class Sequences {
        long book;
        long genre;
        long author;
        long series;

        Sequences copy() {
            Sequences copy = new Sequences();
            copy.restore(this);
            return copy;
        }

        void restore(Sequences other) {
            book = other.book;
            genre = other.genre;
            author = other.author;
            series = other.series;
        }
    }
}
