package com.fb2index.catalog;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SqliteCatalogStore implements CatalogStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteCatalogStore.class);

    private static final String[] SCHEMA = {
            """
            CREATE TABLE IF NOT EXISTS books (
                id                INTEGER PRIMARY KEY AUTOINCREMENT,
                title             TEXT,
                lang              TEXT,
                archive           TEXT,
                filename          TEXT,
                data_offset       INTEGER,
                compressed_size   INTEGER,
                uncompressed_size INTEGER,
                crc32             INTEGER,
                UNIQUE (archive, filename)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS genres (
                id   INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT,
                UNIQUE (name)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS authors (
                id          INTEGER PRIMARY KEY AUTOINCREMENT,
                first_name  TEXT,
                middle_name TEXT,
                last_name   TEXT,
                nickname    TEXT,
                UNIQUE (first_name, middle_name, last_name, nickname)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS series (
                id   INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT,
                UNIQUE (name)
            )
            """,
            "CREATE TABLE IF NOT EXISTS book_genres (book_id INTEGER, genre_id INTEGER, PRIMARY KEY (book_id, genre_id))",
            "CREATE TABLE IF NOT EXISTS book_authors (book_id INTEGER, author_id INTEGER, PRIMARY KEY (book_id, author_id))",
            "CREATE TABLE IF NOT EXISTS book_translators (book_id INTEGER, author_id INTEGER, PRIMARY KEY (book_id, author_id))",
            "CREATE TABLE IF NOT EXISTS book_series (book_id INTEGER, series_id INTEGER, number INTEGER, PRIMARY KEY (book_id, series_id))",
            "CREATE INDEX IF NOT EXISTS books_title_idx ON books (title)",
            "CREATE INDEX IF NOT EXISTS book_genres_idx ON book_genres (genre_id)",
            "CREATE INDEX IF NOT EXISTS book_authors_idx ON book_authors (author_id)",
            "CREATE INDEX IF NOT EXISTS book_translators_idx ON book_translators (author_id)",
            "CREATE INDEX IF NOT EXISTS book_series_idx ON book_series (series_id)"
    };

    private static final String[] TABLES = {
            "book_genres", "book_authors", "book_translators", "book_series", "books", "genres", "authors", "series"
    };

    private final Connection connection;
    private final String url;
    private boolean inTransaction;

    public SqliteCatalogStore(String dbPath) throws CatalogException {
        this.url = "jdbc:sqlite:" + dbPath;
        try {
            this.connection = DriverManager.getConnection(url);
            createSchema();
            connection.setAutoCommit(false);
            log.info("Connected to SQLite catalog {}", dbPath);
        } catch (SQLException e) {
            throw new CatalogException("Failed to open SQLite catalog " + dbPath, e);
        }
    }

    private void createSchema() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
        }
        log.debug("SQLite catalog schema verified");
    }

    public synchronized void reset() throws CatalogException {
        if (inTransaction) {
            throw new CatalogException("cannot reset inside a transaction");
        }
        try (Statement stmt = connection.createStatement()) {
            for (String table : TABLES) {
                stmt.executeUpdate("DELETE FROM " + table);
            }
            stmt.executeUpdate("DELETE FROM sqlite_sequence");
            connection.commit();
            log.info("Cleared SQLite catalog {}", url);
        } catch (SQLException e) {
            try {
                connection.rollback();
            } catch (SQLException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new CatalogException("Failed to clear " + url, e);
        }
    }

    @Override
    public synchronized void begin() throws CatalogException {
        if (inTransaction) {
            throw new CatalogException("transaction already open");
        }
        inTransaction = true;
    }

    @Override
    public synchronized void commit() throws CatalogException {
        requireTransaction();
        try {
            connection.commit();
            inTransaction = false;
        } catch (SQLException e) {
            throw new CatalogException("Commit failed", e);
        }
    }

    @Override
    public synchronized void rollback() throws CatalogException {
        if (!inTransaction) {
            return;
        }
        inTransaction = false;
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new CatalogException("Rollback failed on " + url, e);
        }
    }

    @Override
    public synchronized long insertBook(BookRecord book) throws CatalogException {
        requireTransaction();
        DocumentLocator locator = book.locator();
        String sql = """
                INSERT INTO books (title, lang, archive, filename, data_offset, compressed_size, uncompressed_size, crc32)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, book.title());
            stmt.setString(2, book.language());
            stmt.setString(3, locator.archive());
            stmt.setString(4, locator.entry());
            stmt.setLong(5, locator.offset());
            stmt.setLong(6, locator.compressedSize());
            stmt.setLong(7, locator.uncompressedSize());
            stmt.setLong(8, locator.crc32());
            stmt.executeUpdate();
            return lastInsertId();
        } catch (SQLException e) {
            throw new CatalogException("Failed to insert book " + locator.describe(), e);
        }
    }

    @Override
    public synchronized Insertion lookupOrInsertGenre(String name) throws CatalogException {
        requireTransaction();
        try {
            Optional<Long> existing = selectId("SELECT id FROM genres WHERE name = ?", name);
            if (existing.isPresent()) {
                return Insertion.existing(existing.get());
            }
            update("INSERT INTO genres (name) VALUES (?)", name);
            return Insertion.created(lastInsertId());
        } catch (SQLException e) {
            throw new CatalogException("Failed to store genre " + name, e);
        }
    }

    @Override
    public synchronized Insertion lookupOrInsertAuthor(PersonName name) throws CatalogException {
        requireTransaction();
        try {
            Optional<Long> existing = selectId(
                    "SELECT id FROM authors WHERE last_name = ? AND first_name = ? AND middle_name = ? AND nickname = ?",
                    name.lastName(), name.firstName(), name.middleName(), name.nickname());
            if (existing.isPresent()) {
                return Insertion.existing(existing.get());
            }
            update("INSERT INTO authors (first_name, middle_name, last_name, nickname) VALUES (?, ?, ?, ?)",
                    name.firstName(), name.middleName(), name.lastName(), name.nickname());
            return Insertion.created(lastInsertId());
        } catch (SQLException e) {
            throw new CatalogException("Failed to store author " + name.displayName(), e);
        }
    }

    @Override
    public synchronized Insertion lookupOrInsertSeries(String name) throws CatalogException {
        requireTransaction();
        try {
            Optional<Long> existing = selectId("SELECT id FROM series WHERE name = ?", name);
            if (existing.isPresent()) {
                return Insertion.existing(existing.get());
            }
            update("INSERT INTO series (name) VALUES (?)", name);
            return Insertion.created(lastInsertId());
        } catch (SQLException e) {
            throw new CatalogException("Failed to store series " + name, e);
        }
    }

    @Override
    public synchronized void linkGenre(long bookId, long genreId) throws CatalogException {
        link("INSERT OR IGNORE INTO book_genres (book_id, genre_id) VALUES (?, ?)", bookId, genreId);
    }

    @Override
    public synchronized void linkAuthor(long bookId, long authorId) throws CatalogException {
        link("INSERT OR IGNORE INTO book_authors (book_id, author_id) VALUES (?, ?)", bookId, authorId);
    }

    @Override
    public synchronized void linkTranslator(long bookId, long authorId) throws CatalogException {
        link("INSERT OR IGNORE INTO book_translators (book_id, author_id) VALUES (?, ?)", bookId, authorId);
    }

    @Override
    public synchronized void linkSeries(long bookId, long seriesId, int number) throws CatalogException {
        requireTransaction();
        String sql = "INSERT OR IGNORE INTO book_series (book_id, series_id, number) VALUES (?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, bookId);
            stmt.setLong(2, seriesId);
            stmt.setInt(3, number);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new CatalogException("Failed to link book " + bookId + " to series " + seriesId, e);
        }
    }

    @Override
    public synchronized Optional<Author> findAuthor(long id) throws CatalogException {
        String sql = "SELECT id, first_name, middle_name, last_name, nickname FROM authors WHERE id = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapAuthor(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load author " + id, e);
        }
    }

    @Override
    public synchronized Optional<Series> findSeries(long id) throws CatalogException {
        try (PreparedStatement stmt = connection.prepareStatement("SELECT id, name FROM series WHERE id = ?")) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(new Series(rs.getLong("id"), rs.getString("name"))) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load series " + id, e);
        }
    }

    @Override
    public synchronized Optional<Book> findBook(long id) throws CatalogException {
        String sql = """
                SELECT id, title, lang, archive, filename, data_offset, compressed_size, uncompressed_size, crc32
                  FROM books
                 WHERE id = ?
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapBook(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load book " + id, e);
        }
    }

    @Override
    public synchronized List<Author> findAuthorsOfBook(long bookId) throws CatalogException {
        return linkedAuthors("book_authors", bookId);
    }

    @Override
    public synchronized BookRelations findRelations(long bookId) throws CatalogException {
        List<String> genres = new ArrayList<>();
        String genreSql = """
                SELECT g.name
                  FROM genres g
                  JOIN book_genres bg ON bg.genre_id = g.id
                 WHERE bg.book_id = ?
                 ORDER BY g.name
                """;
        try (PreparedStatement stmt = connection.prepareStatement(genreSql)) {
            stmt.setLong(1, bookId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    genres.add(rs.getString("name"));
                }
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load genres of book " + bookId, e);
        }

        List<BookRelations.SeriesMembership> series = new ArrayList<>();
        String seriesSql = """
                SELECT s.id, s.name, bs.number
                  FROM series s
                  JOIN book_series bs ON bs.series_id = s.id
                 WHERE bs.book_id = ?
                 ORDER BY s.name, s.id
                """;
        try (PreparedStatement stmt = connection.prepareStatement(seriesSql)) {
            stmt.setLong(1, bookId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    series.add(new BookRelations.SeriesMembership(
                            new Series(rs.getLong("id"), rs.getString("name")), rs.getInt("number")));
                }
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load series of book " + bookId, e);
        }

        return new BookRelations(
                genres,
                linkedAuthors("book_authors", bookId),
                linkedAuthors("book_translators", bookId),
                series);
    }

    @Override
    public synchronized List<Book> findBooksByAuthor(long authorId) throws CatalogException {
        return linkedBooks("SELECT book_id FROM book_authors WHERE author_id = ?", authorId);
    }

    @Override
    public synchronized List<Book> findBooksTranslatedBy(long authorId) throws CatalogException {
        return linkedBooks("SELECT book_id FROM book_translators WHERE author_id = ?", authorId);
    }

    @Override
    public synchronized List<SeriesBook> findBooksInSeries(long seriesId) throws CatalogException {
        String sql = """
                SELECT bs.number, b.id, b.title, b.lang, b.archive, b.filename,
                       b.data_offset, b.compressed_size, b.uncompressed_size, b.crc32
                  FROM books b
                  JOIN book_series bs ON bs.book_id = b.id
                 WHERE bs.series_id = ?
                 ORDER BY bs.number, b.title, b.id
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, seriesId);
            try (ResultSet rs = stmt.executeQuery()) {
                List<SeriesBook> books = new ArrayList<>();
                while (rs.next()) {
                    books.add(new SeriesBook(rs.getInt("number"), mapBook(rs)));
                }
                return books;
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load books of series " + seriesId, e);
        }
    }

    @Override
    public synchronized List<Book> findBooksByGenre(String genre) throws CatalogException {
        String sql = """
                SELECT b.id, b.title, b.lang, b.archive, b.filename,
                       b.data_offset, b.compressed_size, b.uncompressed_size, b.crc32
                  FROM books b
                  JOIN book_genres bg ON bg.book_id = b.id
                  JOIN genres g ON g.id = bg.genre_id
                 WHERE g.name = ?
                 ORDER BY b.title, b.id
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, genre);
            return readBooks(stmt);
        } catch (SQLException e) {
            throw new CatalogException("Failed to load books of genre " + genre, e);
        }
    }

    @Override
    public synchronized long countBooks() throws CatalogException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM books")) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new CatalogException("Failed to count books", e);
        }
    }

    @Override
    public synchronized void close() throws CatalogException {
        CatalogException rollbackFailure = null;
        try {
            rollback();
        } catch (CatalogException e) {
            rollbackFailure = e;
        }
        try {
            if (!connection.isClosed()) {
                connection.close();
                log.info("Closed SQLite catalog {}", url);
            }
        } catch (SQLException e) {
            CatalogException closeFailure = new CatalogException("Failed to close " + url, e);
            if (rollbackFailure != null) {
                closeFailure.addSuppressed(rollbackFailure);
            }
            throw closeFailure;
        }
        if (rollbackFailure != null) {
            throw rollbackFailure;
        }
    }

    private List<Author> linkedAuthors(String table, long bookId) throws CatalogException {
        String sql = """
                SELECT a.id, a.first_name, a.middle_name, a.last_name, a.nickname
                  FROM authors a
                  JOIN %s l ON l.author_id = a.id
                 WHERE l.book_id = ?
                 ORDER BY a.id
                """.formatted(table);
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, bookId);
            try (ResultSet rs = stmt.executeQuery()) {
                List<Author> authors = new ArrayList<>();
                while (rs.next()) {
                    authors.add(mapAuthor(rs));
                }
                return authors;
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to load " + table + " of book " + bookId, e);
        }
    }

    private List<Book> linkedBooks(String linkQuery, long otherId) throws CatalogException {
        String sql = """
                SELECT id, title, lang, archive, filename, data_offset, compressed_size, uncompressed_size, crc32
                  FROM books
                 WHERE id IN (%s)
                 ORDER BY title, id
                """.formatted(linkQuery);
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, otherId);
            return readBooks(stmt);
        } catch (SQLException e) {
            throw new CatalogException("Failed to load books linked to " + otherId, e);
        }
    }

    private static List<Book> readBooks(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            List<Book> books = new ArrayList<>();
            while (rs.next()) {
                books.add(mapBook(rs));
            }
            return books;
        }
    }

    private void link(String sql, long bookId, long otherId) throws CatalogException {
        requireTransaction();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, bookId);
            stmt.setLong(2, otherId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new CatalogException("Failed to link book " + bookId + " to " + otherId, e);
        }
    }

    private Optional<Long> selectId(String sql, String... params) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setString(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    private void update(String sql, String... params) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setString(i + 1, params[i]);
            }
            stmt.executeUpdate();
        }
    }

    private long lastInsertId() throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    private void requireTransaction() throws CatalogException {
        if (!inTransaction) {
            throw new CatalogException("no open transaction");
        }
    }

    private static Author mapAuthor(ResultSet rs) throws SQLException {
        PersonName name = new PersonName(
                rs.getString("first_name"),
                rs.getString("middle_name"),
                rs.getString("last_name"),
                rs.getString("nickname"));
        return new Author(rs.getLong("id"), name);
    }

    private static Book mapBook(ResultSet rs) throws SQLException {
        DocumentLocator locator = new DocumentLocator(
                rs.getString("archive"),
                rs.getString("filename"),
                rs.getLong("data_offset"),
                rs.getLong("compressed_size"),
                rs.getLong("uncompressed_size"),
                rs.getLong("crc32"));
        return new Book(rs.getLong("id"), rs.getString("title"), rs.getString("lang"), locator);
    }
}
