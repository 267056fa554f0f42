package com.fb2index.ingest;

import com.fb2index.catalog.DocumentLocator;
import com.fb2index.fb2.BookDescription;

public record ParsedDocument(DocumentLocator locator, BookDescription description) {
}
