package com.fb2index.fb2;

public record CoverImage(String contentType, byte[] data) {
}
