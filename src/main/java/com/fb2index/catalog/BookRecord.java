package com.fb2index.catalog;

public record BookRecord(String title, String language, DocumentLocator locator) {
}
