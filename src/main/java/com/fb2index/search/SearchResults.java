package com.fb2index.search;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import com.fb2index.catalog.Author;
import com.fb2index.catalog.Book;
import com.fb2index.catalog.Series;

public record SearchResults(List<Author> authors, List<Series> series, List<BookHit> books) {
    public SearchResults {
        authors = List.copyOf(authors);
        series = List.copyOf(series);
        books = List.copyOf(books);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return authors.isEmpty() && series.isEmpty() && books.isEmpty();
    }

    public record BookHit(Book book, List<Author> authors) {
        public BookHit {
            authors = List.copyOf(authors);
        }
    }
}
