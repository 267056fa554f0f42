package com.fb2index.trigram;

public record CatalogIndexes(TrigramIndex authors, TrigramIndex series, TrigramIndex books) {
    public static CatalogIndexes create() {
        return new CatalogIndexes(new TrigramIndex(), new TrigramIndex(), new TrigramIndex());
    }
}
