package com.fb2index.search;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record SearchHits(List<Long> authorIds, List<Long> seriesIds, List<Long> bookIds) {
    public SearchHits {
        authorIds = List.copyOf(authorIds);
        seriesIds = List.copyOf(seriesIds);
        bookIds = List.copyOf(bookIds);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return authorIds.isEmpty() && seriesIds.isEmpty() && bookIds.isEmpty();
    }
}
