package com.fb2index.fb2;

import java.io.InputStream;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

public class Fb2CoverReader {
    private final XMLInputFactory xmlInputFactory = Fb2Xml.newInputFactory();

    public Optional<CoverImage> read(InputStream content) throws MetadataException {
        XMLStreamReader reader = null;
        try {
            reader = xmlInputFactory.createXMLStreamReader(content);
            String coverId = null;
            Map<String, EncodedBinary> binaries = new HashMap<>();

            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                switch (reader.getLocalName()) {
                    case "coverpage" -> {
                        if (coverId == null) {
                            coverId = coverReference(reader);
                        }
                    }
                    case "binary" -> {
                        String id = Fb2Xml.attribute(reader, "id");
                        String contentType = Fb2Xml.attribute(reader, "content-type");
                        String encoded = Fb2Xml.text(reader);
                        if (id.equals(coverId)) {
                            return Optional.of(decode(contentType, encoded));
                        }
                        if (coverId == null) {
                            binaries.put(id, new EncodedBinary(contentType, encoded));
                        }
                    }
                    default -> {
                    }
                }
            }

            if (coverId != null && binaries.containsKey(coverId)) {
                EncodedBinary pending = binaries.get(coverId);
                return Optional.of(decode(pending.contentType(), pending.encoded()));
            }
            return Optional.empty();
        } catch (XMLStreamException e) {
            throw new MetadataException(MetadataException.Kind.PARSE_ERROR, "FB2 cover: " + e.getMessage(), e);
        } finally {
            Fb2Xml.closeQuietly(reader);
        }
    }

    private static String coverReference(XMLStreamReader reader) throws XMLStreamException {
        String reference = null;
        int depth = 0;
        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                depth++;
                String href = Fb2Xml.attribute(reader, "href");
                if (reference == null && "image".equals(reader.getLocalName()) && href.startsWith("#")) {
                    reference = href.substring(1);
                }
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                if (depth == 0) {
                    return reference;
                }
                depth--;
            }
        }
        return reference;
    }

    private static CoverImage decode(String contentType, String encoded) throws MetadataException {
        try {
            return new CoverImage(contentType, Base64.getMimeDecoder().decode(encoded));
        } catch (IllegalArgumentException e) {
            throw new MetadataException(MetadataException.Kind.PARSE_ERROR, "FB2 cover: bad base64", e);
        }
    }

    private record EncodedBinary(String contentType, String encoded) {
    }
}
