package com.fb2index.catalog;

public record Book(long id, String title, String language, DocumentLocator locator) {
}
