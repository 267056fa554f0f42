package com.fb2index.catalog;

public record SeriesBook(int number, Book book) {
}
