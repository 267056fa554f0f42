package com.fb2index.catalog;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

abstract class CatalogStoreContract {

    protected CatalogStore store;

    protected abstract CatalogStore newStore() throws Exception;

    @BeforeEach
    void openStore() throws Exception {
        store = newStore();
    }

    @AfterEach
    void closeStore() throws Exception {
        store.close();
    }

    static BookRecord book(String title, String entry) {
        return new BookRecord(title, "ru", new DocumentLocator("/books/a.zip", entry, 30, 120, 400, 0xCAFEL));
    }

    @Test
    void shouldAssignIdsPerKindStartingAtOne() throws Exception {
        store.begin();
        assertEquals(1, store.insertBook(book("Идиот", "1.fb2")));
        assertEquals(Insertion.created(1), store.lookupOrInsertGenre("prose_rus_classic"));
        assertEquals(Insertion.created(1), store.lookupOrInsertAuthor(new PersonName("Фёдор", "", "Достоевский", "")));
        assertEquals(Insertion.created(1), store.lookupOrInsertSeries("Собрание сочинений"));
        assertEquals(2, store.insertBook(book("Бесы", "2.fb2")));
        store.commit();

        assertEquals(2, store.countBooks());
    }

    @Test
    void shouldReturnExistingIdForSameNaturalKey() throws Exception {
        PersonName tolstoy = new PersonName("Лев", "Николаевич", "Толстой", "");
        store.begin();
        Insertion first = store.lookupOrInsertAuthor(tolstoy);
        Insertion other = store.lookupOrInsertAuthor(new PersonName("Лев", "", "Толстой", ""));
        store.commit();

        store.begin();
        Insertion again = store.lookupOrInsertAuthor(new PersonName("Лев", "Николаевич", "Толстой", null));
        Insertion series = store.lookupOrInsertSeries("Азбука");
        Insertion seriesAgain = store.lookupOrInsertSeries("Азбука");
        store.commit();

        assertTrue(first.inserted());
        assertTrue(other.inserted());
        assertEquals(Insertion.existing(first.id()), again);
        assertEquals(Insertion.existing(series.id()), seriesAgain);
        assertEquals(tolstoy, store.findAuthor(first.id()).orElseThrow().name());
    }

    @Test
    void shouldUndoEverythingOnRollback() throws Exception {
        store.begin();
        long bookId = store.insertBook(book("Черновик", "draft.fb2"));
        long authorId = store.lookupOrInsertAuthor(new PersonName("", "", "", "anon")).id();
        long seriesId = store.lookupOrInsertSeries("Черновики").id();
        store.linkAuthor(bookId, authorId);
        store.rollback();

        assertFalse(store.findBook(bookId).isPresent());
        assertFalse(store.findAuthor(authorId).isPresent());
        assertFalse(store.findSeries(seriesId).isPresent());
        assertEquals(0, store.countBooks());

        store.begin();
        assertEquals(Insertion.created(authorId), store.lookupOrInsertAuthor(new PersonName("", "", "", "anon")));
        assertEquals(bookId, store.insertBook(book("Черновик", "draft.fb2")));
        store.commit();
    }

    @Test
    void shouldRefuseWritesOutsideTransaction() throws Exception {
        assertThrows(CatalogException.class, () -> store.insertBook(book("Идиот", "1.fb2")));
        assertThrows(CatalogException.class, () -> store.lookupOrInsertGenre("sf"));

        store.begin();
        assertThrows(CatalogException.class, store::begin);
        store.rollback();
    }

    @Test
    void shouldRejectSecondBookAtSameLocation() throws Exception {
        store.begin();
        store.insertBook(book("Идиот", "1.fb2"));
        store.commit();

        store.begin();
        assertThrows(CatalogException.class, () -> store.insertBook(book("Идиот", "1.fb2")));
        store.rollback();

        assertEquals(1, store.countBooks());
    }

    @Test
    void shouldIgnoreDuplicateLinksAndListAuthorsById() throws Exception {
        store.begin();
        long bookId = store.insertBook(book("Двенадцать стульев", "12.fb2"));
        long petrov = store.lookupOrInsertAuthor(new PersonName("Евгений", "", "Петров", "")).id();
        long ilf = store.lookupOrInsertAuthor(new PersonName("Илья", "", "Ильф", "")).id();
        long translator = store.lookupOrInsertAuthor(new PersonName("John", "", "Richardson", "")).id();
        store.linkAuthor(bookId, ilf);
        store.linkAuthor(bookId, petrov);
        store.linkAuthor(bookId, ilf);
        store.linkTranslator(bookId, translator);
        store.linkSeries(bookId, store.lookupOrInsertSeries("Остап Бендер").id(), 1);
        store.linkSeries(bookId, store.lookupOrInsertSeries("Остап Бендер").id(), 2);
        store.commit();

        List<Author> authors = store.findAuthorsOfBook(bookId);
        assertEquals(List.of(petrov, ilf), authors.stream().map(Author::id).toList());
    }

    @Test
    void shouldHydrateBookWithLocator() throws Exception {
        store.begin();
        long bookId = store.insertBook(book("Идиот", "1.fb2"));
        store.commit();

        Book stored = store.findBook(bookId).orElseThrow();
        assertEquals("Идиот", stored.title());
        assertEquals("ru", stored.language());
        assertEquals(new DocumentLocator("/books/a.zip", "1.fb2", 30, 120, 400, 0xCAFEL), stored.locator());
    }

    @Test
    void shouldReadBackRelationsOfBook() throws Exception {
        store.begin();
        long bookId = store.insertBook(book("Двенадцать стульев", "12.fb2"));
        store.linkGenre(bookId, store.lookupOrInsertGenre("prose_rus_classic").id());
        store.linkGenre(bookId, store.lookupOrInsertGenre("humor").id());
        long ilf = store.lookupOrInsertAuthor(new PersonName("Илья", "", "Ильф", "")).id();
        long translator = store.lookupOrInsertAuthor(new PersonName("John", "", "Richardson", "")).id();
        long bender = store.lookupOrInsertSeries("Остап Бендер").id();
        long classics = store.lookupOrInsertSeries("Классика").id();
        store.linkAuthor(bookId, ilf);
        store.linkTranslator(bookId, translator);
        store.linkSeries(bookId, bender, 1);
        store.linkSeries(bookId, bender, 2);
        store.linkSeries(bookId, classics, 7);
        store.commit();

        BookRelations relations = store.findRelations(bookId);

        assertEquals(List.of("humor", "prose_rus_classic"), relations.genres());
        assertEquals(List.of(ilf), relations.authors().stream().map(Author::id).toList());
        assertEquals(List.of(translator), relations.translators().stream().map(Author::id).toList());
        assertEquals(List.of(
                new BookRelations.SeriesMembership(new Series(classics, "Классика"), 7),
                new BookRelations.SeriesMembership(new Series(bender, "Остап Бендер"), 1)),
                relations.series());
        assertEquals(new BookRelations(List.of(), List.of(), List.of(), List.of()), store.findRelations(99));
    }

    @Test
    void shouldListBooksOfAuthorAndTranslatorByTitle() throws Exception {
        store.begin();
        long chairs = store.insertBook(book("Двенадцать стульев", "12.fb2"));
        long calf = store.insertBook(book("Золотой телёнок", "calf.fb2"));
        long stories = store.insertBook(book("Весёлые рассказы", "stories.fb2"));
        long ilf = store.lookupOrInsertAuthor(new PersonName("Илья", "", "Ильф", "")).id();
        store.linkAuthor(calf, ilf);
        store.linkAuthor(chairs, ilf);
        store.linkTranslator(stories, ilf);
        store.commit();

        assertEquals(List.of(chairs, calf), store.findBooksByAuthor(ilf).stream().map(Book::id).toList());
        assertEquals(List.of(stories), store.findBooksTranslatedBy(ilf).stream().map(Book::id).toList());
        assertTrue(store.findBooksByAuthor(42).isEmpty());
    }

    @Test
    void shouldListSeriesBooksByNumberThenTitle() throws Exception {
        store.begin();
        long second = store.insertBook(book("Золотой телёнок", "calf.fb2"));
        long first = store.insertBook(book("Двенадцать стульев", "12.fb2"));
        long extra = store.insertBook(book("Алмазный венец", "crown.fb2"));
        long series = store.lookupOrInsertSeries("Остап Бендер").id();
        store.linkSeries(second, series, 2);
        store.linkSeries(first, series, 1);
        store.linkSeries(extra, series, 2);
        store.commit();

        List<SeriesBook> books = store.findBooksInSeries(series);

        assertEquals(List.of(first, extra, second), books.stream().map(entry -> entry.book().id()).toList());
        assertEquals(List.of(1, 2, 2), books.stream().map(SeriesBook::number).toList());
    }

    @Test
    void shouldListBooksOfGenreAndForgetRolledBackLinks() throws Exception {
        store.begin();
        long idiot = store.insertBook(book("Идиот", "1.fb2"));
        store.linkGenre(idiot, store.lookupOrInsertGenre("prose_rus_classic").id());
        store.commit();

        store.begin();
        long draft = store.insertBook(book("Бесы", "2.fb2"));
        store.linkGenre(draft, store.lookupOrInsertGenre("prose_rus_classic").id());
        store.linkGenre(draft, store.lookupOrInsertGenre("draft").id());
        store.rollback();

        assertEquals(List.of(idiot), store.findBooksByGenre("prose_rus_classic").stream().map(Book::id).toList());
        assertTrue(store.findBooksByGenre("draft").isEmpty());
        assertTrue(store.findBooksByGenre("unknown").isEmpty());
    }
}
