package com.fb2index.catalog;

public record DocumentLocator(
        String archive,
        String entry,
        long offset,
        long compressedSize,
        long uncompressedSize,
        long crc32) {

    public String describe() {
        return archive + "/" + entry;
    }
}
