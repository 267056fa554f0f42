package com.fb2index.trigram;

public class IndexInvariantViolationException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final long id;
    private final long lastIndexedId;

    public IndexInvariantViolationException(long id, long lastIndexedId) {
        super("out of order: id " + id + " after " + lastIndexedId);
        this.id = id;
        this.lastIndexedId = lastIndexedId;
    }

    public long id() {
        return id;
    }

    public long lastIndexedId() {
        return lastIndexedId;
    }
}
