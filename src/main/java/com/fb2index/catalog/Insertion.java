package com.fb2index.catalog;

public record Insertion(long id, boolean inserted) {
    public static Insertion existing(long id) {
        return new Insertion(id, false);
    }

    public static Insertion created(long id) {
        return new Insertion(id, true);
    }
}
