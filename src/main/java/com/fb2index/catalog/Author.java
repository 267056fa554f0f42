package com.fb2index.catalog;

public record Author(long id, PersonName name) {
}
