package com.fb2index.fb2;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

public interface MetadataExtractor {
    Optional<BookDescription> extract(InputStream content) throws IOException, MetadataException;
}
