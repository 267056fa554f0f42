package com.fb2index.catalog;

import java.util.List;

public record BookRelations(
        List<String> genres,
        List<Author> authors,
        List<Author> translators,
        List<SeriesMembership> series) {

    public BookRelations {
        genres = List.copyOf(genres);
        authors = List.copyOf(authors);
        translators = List.copyOf(translators);
        series = List.copyOf(series);
    }

    public record SeriesMembership(Series series, int number) {
    }
}
