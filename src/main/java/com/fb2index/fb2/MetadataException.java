package com.fb2index.fb2;

public class MetadataException extends Exception {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        NO_TITLE,
        PARSE_ERROR
    }

    private final Kind kind;

    public MetadataException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MetadataException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
