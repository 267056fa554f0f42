package com.fb2index.catalog;

public record Series(long id, String name) {
}
