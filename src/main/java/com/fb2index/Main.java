package com.fb2index;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fb2index.catalog.Author;
import com.fb2index.catalog.Book;
import com.fb2index.catalog.BookRelations;
import com.fb2index.catalog.CatalogException;
import com.fb2index.catalog.CatalogStore;
import com.fb2index.catalog.InMemoryCatalogStore;
import com.fb2index.catalog.Series;
import com.fb2index.catalog.SeriesBook;
import com.fb2index.catalog.SqliteCatalogStore;
import com.fb2index.cover.CoverService;
import com.fb2index.cover.ExpiringCache;
import com.fb2index.fb2.CoverImage;
import com.fb2index.fb2.Fb2DescriptionParser;
import com.fb2index.fb2.MetadataException;
import com.fb2index.ingest.ArchiveFinder;
import com.fb2index.ingest.ArchiveWalker;
import com.fb2index.ingest.IngestionPipeline;
import com.fb2index.ingest.IngestionReport;
import com.fb2index.runtime.AppConfig;
import com.fb2index.search.SearchResults;
import com.fb2index.search.SearchService;
import com.fb2index.trigram.CatalogIndexes;
import com.fb2index.trigram.IndexInvariantViolationException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "fb2-index",
        mixinStandardHelpOptions = true,
        version = "fb2-index 0.1.0",
        description = "Indexes FB2 books stored in ZIP archives and searches them by title, author and series.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE_ERROR = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "fb2-index.yml")
    Path configPath;

    @Option(names = { "-j", "--parallel" }, description = "Number of parser workers (default: config, then CPU count)")
    Integer parallel;

    @Option(names = { "-r", "--recursive" }, description = "Recursively search directories for .zip files")
    boolean recursive;

    @Option(names = { "-l", "--languages" }, description = "Comma-separated list of allowed book languages")
    String languages;

    @Option(names = "--db", description = "SQLite database path (in-memory catalog when absent)")
    Path dbPath;

    @Option(names = "--query", description = "Search once after ingestion and print the results")
    String query;

    @Option(names = "--interactive", description = "Read queries from standard input after ingestion")
    boolean interactive;

    @Option(names = "--json", description = "Print search results as JSON")
    boolean json;

    @Option(names = "--report-path", description = "Write the ingestion report as JSON to this file")
    Path reportPath;

    @Option(names = "--cover-book-id", description = "Extract the cover image of this book")
    Long coverBookId;

    @Option(names = "--cover-output", description = "File the extracted cover image is written to")
    Path coverOutput;

    @Parameters(arity = "1..*", paramLabel = "PATH", description = "ZIP archives, or directories with -r")
    List<Path> inputs;

    private final InputStream in;
    private final PrintStream out;
    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public Main() {
        this(System.in, System.out);
    }

    Main(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config;
        try {
            config = loadConfig(configPath);
        } catch (IOException e) {
            log.error("Unable to read config file {}: {}", configPath, e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        applyOverrides(config);

        AppConfig.IngestConfig ingest = config.getIngest();
        if (ingest.getParallelism() < 1) {
            log.error("--parallel must be at least 1, got {}", ingest.getParallelism());
            return EXIT_USAGE_ERROR;
        }
        if ((coverBookId == null) != (coverOutput == null)) {
            log.error("--cover-book-id and --cover-output must be given together");
            return EXIT_USAGE_ERROR;
        }

        log.info("Using config file: {}", configPath);
        log.info("Ingest parallelism={} languages={} recursive={} store={}",
                ingest.getParallelism(),
                ingest.getLanguages().isEmpty() ? "any" : ingest.getLanguages(),
                ingest.isRecursive(),
                config.getStore().getSqlitePath() == null ? "memory" : config.getStore().getSqlitePath());

        try (CatalogStore store = openStore(config.getStore())) {
            CatalogIndexes indexes = CatalogIndexes.create();
            ArchiveWalker walker = new ArchiveWalker();
            IngestionPipeline pipeline = new IngestionPipeline(
                    store,
                    indexes,
                    new Fb2DescriptionParser(new LinkedHashSet<>(ingest.getLanguages()), ingest.getHeaderLimitBytes()),
                    walker,
                    ingest);

            List<Path> archives = new ArchiveFinder(ingest.isRecursive()).find(inputs);
            IngestionReport report;
            try {
                report = pipeline.ingest(archives);
            } catch (IndexInvariantViolationException e) {
                log.error("Ingestion aborted: {}", e.getMessage());
                return EXIT_FATAL;
            }
            if (reportPath != null) {
                writeReport(report, reportPath);
            }

            SearchService searchService = new SearchService(store, indexes);
            if (query != null && !query.isBlank()) {
                printResults(searchService.searchAndResolve(query));
            }

            AppConfig.CacheConfig cacheConfig = config.getCache();
            try (ExpiringCache<Long, CoverImage> covers = new ExpiringCache<>(
                    Duration.ofMillis(cacheConfig.getTtlMs()),
                    Duration.ofMillis(cacheConfig.getSweepIntervalMs()))) {
                CoverService coverService = new CoverService(store, walker, covers);
                if (coverBookId != null && !writeCover(coverService, coverBookId, coverOutput)) {
                    return EXIT_FATAL;
                }
                if (interactive) {
                    covers.start();
                    runInteractive(searchService, coverService, store, report);
                }
            }
        }
        return EXIT_OK;
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    void applyOverrides(AppConfig config) {
        AppConfig.IngestConfig ingest = config.getIngest();
        if (parallel != null) {
            ingest.setParallelism(parallel);
        }
        if (recursive) {
            ingest.setRecursive(true);
        }
        if (languages != null) {
            ingest.setLanguages(parseLanguages(languages));
        }
        if (dbPath != null) {
            config.getStore().setSqlitePath(dbPath.toString());
        }
    }

    static List<String> parseLanguages(String languages) {
        Set<String> parsed = new LinkedHashSet<>();
        Arrays.stream(languages.split(","))
                .map(language -> language.trim().toLowerCase(Locale.ROOT))
                .filter(language -> !language.isEmpty())
                .forEach(parsed::add);
        return List.copyOf(parsed);
    }

    private static CatalogStore openStore(AppConfig.StoreConfig storeConfig) throws CatalogException {
        if (storeConfig.getSqlitePath() == null || storeConfig.getSqlitePath().isBlank()) {
            return new InMemoryCatalogStore();
        }
        SqliteCatalogStore store = new SqliteCatalogStore(storeConfig.getSqlitePath());
        try {
            store.reset();
        } catch (CatalogException e) {
            try {
                store.close();
            } catch (CatalogException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return store;
    }

    private void writeReport(IngestionReport report, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        jsonMapper.writeValue(path.toFile(), report);
        log.info("Wrote ingestion report to {}", path);
    }

    private boolean writeCover(CoverService coverService, long bookId, Path output) {
        try {
            Optional<CoverImage> cover = coverService.cover(bookId);
            if (cover.isEmpty()) {
                log.error("Book {} has no cover image", bookId);
                return false;
            }
            Files.write(output, cover.get().data());
            log.info("Wrote {} cover of book {} to {}", cover.get().contentType(), bookId, output);
            return true;
        } catch (IOException | CatalogException | MetadataException e) {
            log.error("Unable to extract cover of book {}: {}", bookId, e.getMessage());
            return false;
        }
    }

    private void printResults(SearchResults results) throws IOException {
        if (json) {
            out.println(jsonMapper.writeValueAsString(results));
            return;
        }
        if (results.isEmpty()) {
            out.println("No matches.");
            return;
        }
        for (Author author : results.authors()) {
            out.printf("author  %d  %s%n", author.id(), author.name().displayName());
        }
        for (Series series : results.series()) {
            out.printf("series  %d  %s%n", series.id(), series.name());
        }
        for (SearchResults.BookHit hit : results.books()) {
            String authors = hit.authors().stream()
                    .map(author -> author.name().displayName())
                    .reduce((left, right) -> left + ", " + right)
                    .orElse("");
            out.printf("book    %d  %s%s%n", hit.book().id(), hit.book().title(),
                    authors.isEmpty() ? "" : " / " + authors);
        }
    }

    private void runInteractive(
            SearchService searchService,
            CoverService coverService,
            CatalogStore store,
            IngestionReport report) throws IOException, CatalogException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        out.println("fb2-index ready. Type a query, or /help for commands.");
        while (true) {
            out.print("search> ");
            out.flush();
            String line = reader.readLine();
            if (line == null || "/exit".equals(line.trim()) || "/quit".equals(line.trim())) {
                break;
            }
            String input = line.trim();
            if (input.isEmpty()) {
                continue;
            }
            String[] parts = input.split("\\s+", 2);
            String command = parts[0];
            String argument = parts.length > 1 ? parts[1].trim() : "";
            if ("/help".equals(command)) {
                out.println("Commands: /help, /stats, /book <id>, /author <id>, /series <id>, /genre <name>,"
                        + " /cover <book-id> <file>, /exit. Any other input is searched.");
                continue;
            }
            if ("/cover".equals(command)) {
                runCoverCommand(coverService, input);
                continue;
            }
            if ("/genre".equals(command)) {
                printGenre(store, argument.toLowerCase(Locale.ROOT));
                continue;
            }
            if ("/book".equals(command) || "/author".equals(command) || "/series".equals(command)) {
                runBrowseCommand(store, command, argument);
                continue;
            }
            if ("/stats".equals(command)) {
                out.printf("Books: %d, indexed this run: %d, skipped: %d, failures: %d, authors created: %d, series created: %d%n",
                        store.countBooks(),
                        report.documentsIndexed(),
                        report.entriesSkipped(),
                        report.failures().size(),
                        report.authorsCreated(),
                        report.seriesCreated());
                continue;
            }
            printResults(searchService.searchAndResolve(input));
        }
    }

    private void runBrowseCommand(CatalogStore store, String command, String argument) throws CatalogException {
        long id;
        try {
            id = Long.parseLong(argument);
        } catch (NumberFormatException e) {
            out.println("Usage: " + command + " <id>");
            return;
        }
        if ("/book".equals(command)) {
            printBook(store, id);
        } else if ("/author".equals(command)) {
            printAuthor(store, id);
        } else {
            printSeries(store, id);
        }
    }

    private void printBook(CatalogStore store, long bookId) throws CatalogException {
        Optional<Book> book = store.findBook(bookId);
        if (book.isEmpty()) {
            out.println("No book " + bookId + ".");
            return;
        }
        out.printf("book    %d  %s [%s]  %s%n", bookId, book.get().title(), book.get().language(),
                book.get().locator().describe());
        BookRelations relations = store.findRelations(bookId);
        for (Author author : relations.authors()) {
            out.printf("  author      %d  %s%n", author.id(), author.name().displayName());
        }
        for (Author translator : relations.translators()) {
            out.printf("  translator  %d  %s%n", translator.id(), translator.name().displayName());
        }
        for (BookRelations.SeriesMembership membership : relations.series()) {
            out.printf("  series      %d  %s #%d%n", membership.series().id(), membership.series().name(),
                    membership.number());
        }
        for (String genre : relations.genres()) {
            out.printf("  genre       %s%n", genre);
        }
    }

    private void printAuthor(CatalogStore store, long authorId) throws CatalogException {
        Optional<Author> author = store.findAuthor(authorId);
        if (author.isEmpty()) {
            out.println("No author " + authorId + ".");
            return;
        }
        out.printf("author  %d  %s%n", authorId, author.get().name().displayName());
        for (Book book : store.findBooksByAuthor(authorId)) {
            out.printf("  book        %d  %s%n", book.id(), book.title());
        }
        for (Book book : store.findBooksTranslatedBy(authorId)) {
            out.printf("  translated  %d  %s%n", book.id(), book.title());
        }
    }

    private void printSeries(CatalogStore store, long seriesId) throws CatalogException {
        Optional<Series> series = store.findSeries(seriesId);
        if (series.isEmpty()) {
            out.println("No series " + seriesId + ".");
            return;
        }
        out.printf("series  %d  %s%n", seriesId, series.get().name());
        for (SeriesBook entry : store.findBooksInSeries(seriesId)) {
            out.printf("  #%-3d  book  %d  %s%n", entry.number(), entry.book().id(), entry.book().title());
        }
    }

    private void printGenre(CatalogStore store, String genre) throws CatalogException {
        if (genre.isEmpty()) {
            out.println("Usage: /genre <name>");
            return;
        }
        List<Book> books = store.findBooksByGenre(genre);
        out.printf("genre   %s  %d book(s)%n", genre, books.size());
        for (Book book : books) {
            out.printf("  book  %d  %s%n", book.id(), book.title());
        }
    }

    private void runCoverCommand(CoverService coverService, String input) {
        String[] args = input.split("\\s+");
        if (args.length != 3) {
            out.println("Usage: /cover <book-id> <file>");
            return;
        }
        long bookId;
        try {
            bookId = Long.parseLong(args[1]);
        } catch (NumberFormatException e) {
            out.println("Not a book ID: " + args[1]);
            return;
        }
        out.println(writeCover(coverService, bookId, Path.of(args[2]))
                ? "Cover written to " + args[2]
                : "No cover written.");
    }
}
