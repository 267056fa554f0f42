package com.fb2index.catalog;

public record SeriesRef(String name, int number) {
}
