package com.fb2index.fb2;

import java.util.List;

import com.fb2index.catalog.PersonName;
import com.fb2index.catalog.SeriesRef;

public record BookDescription(
        String title,
        String language,
        List<String> genres,
        List<PersonName> authors,
        List<PersonName> translators,
        List<SeriesRef> series) {

    public BookDescription {
        genres = List.copyOf(genres);
        authors = List.copyOf(authors);
        translators = List.copyOf(translators);
        series = List.copyOf(series);
    }
}
