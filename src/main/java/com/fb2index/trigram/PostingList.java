package com.fb2index.trigram;

import java.util.Arrays;

final class PostingList {
    private long[] ids;
    private int size;

    PostingList() {
        this.ids = new long[4];
    }

    boolean isEmpty() {
        return size == 0;
    }

    int size() {
        return size;
    }

    long last() {
        if (size == 0) {
            throw new IllegalStateException("empty posting list");
        }
        return ids[size - 1];
    }

    long get(int position) {
        return ids[position];
    }

    void appendIfNew(long id) {
        if (size > 0 && ids[size - 1] == id) {
            return;
        }
        if (size == ids.length) {
            ids = Arrays.copyOf(ids, ids.length * 2);
        }
        ids[size++] = id;
    }

    long[] toArray() {
        return Arrays.copyOf(ids, size);
    }
}
