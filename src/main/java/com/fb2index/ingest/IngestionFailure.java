package com.fb2index.ingest;

public record IngestionFailure(Kind kind, String archive, String entry, String message) {
    public enum Kind {
        ARCHIVE_OPEN,
        UNSUPPORTED_COMPRESSION,
        ENTRY_READ,
        NO_TITLE,
        PARSE_ERROR,
        COMMIT_FAILED
    }

    public String describe() {
        String unit = entry == null ? archive : archive + "/" + entry;
        return unit + ": " + kind + ": " + message;
    }
}
