package com.fb2index.fb2;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fb2index.catalog.PersonName;
import com.fb2index.catalog.SeriesRef;

public class Fb2DescriptionParser implements MetadataExtractor {
    public static final int DEFAULT_HEADER_LIMIT = 16 * 1024;

    private static final Logger log = LoggerFactory.getLogger(Fb2DescriptionParser.class);

    private static final Pattern VALID_GENRE = Pattern.compile("[a-z0-9_]+");
    private static final Pattern VALID_LANGUAGE = Pattern.compile("[a-z]{2}");

    private final Set<String> allowedLanguages;
    private final int headerLimitBytes;
    private final XMLInputFactory xmlInputFactory;

    public Fb2DescriptionParser(Set<String> allowedLanguages) {
        this(allowedLanguages, DEFAULT_HEADER_LIMIT);
    }

    public Fb2DescriptionParser(Set<String> allowedLanguages, int headerLimitBytes) {
        this.allowedLanguages = Set.copyOf(allowedLanguages);
        this.headerLimitBytes = headerLimitBytes;
        this.xmlInputFactory = Fb2Xml.newInputFactory();
    }

    @Override
    public Optional<BookDescription> extract(InputStream content) throws IOException, MetadataException {
        byte[] header = content.readNBytes(headerLimitBytes);

        HeaderState state = new HeaderState();
        XMLStreamReader reader = null;
        try {
            reader = xmlInputFactory.createXMLStreamReader(new ByteArrayInputStream(header));
            if (!parse(reader, state)) {
                return Optional.empty();
            }
        } catch (XMLStreamException e) {
            // a header cut off or broken after the title still yields the fields read so far
            if (state.title.isEmpty()) {
                throw new MetadataException(MetadataException.Kind.PARSE_ERROR, "FB2 description: " + e.getMessage(), e);
            }
            log.debug("FB2 description of '{}' ends early: {}", state.title, e.getMessage());
        } finally {
            Fb2Xml.closeQuietly(reader);
        }

        if (state.title.isEmpty()) {
            throw new MetadataException(MetadataException.Kind.NO_TITLE, "no title");
        }
        return Optional.of(new BookDescription(
                state.title,
                state.language,
                state.genres,
                state.authors,
                state.translators,
                state.series));
    }

    boolean languageAllowed(String language) {
        if (allowedLanguages.isEmpty()) {
            return VALID_LANGUAGE.matcher(language).matches();
        }
        return allowedLanguages.contains(language);
    }

    static String normalizeGenre(String genre) {
        return genre.trim().toLowerCase(Locale.ROOT);
    }

    private boolean parse(XMLStreamReader reader, HeaderState state) throws XMLStreamException {
        boolean inTitleInfo = false;
        NameBuilder person = new NameBuilder();

        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                switch (reader.getLocalName()) {
                    case "FictionBook", "description" -> {
                    }
                    case "title-info" -> inTitleInfo = true;
                    case "genre" -> {
                        String genre = normalizeGenre(Fb2Xml.text(reader));
                        if (VALID_GENRE.matcher(genre).matches()) {
                            state.genres.add(genre);
                        }
                    }
                    case "author", "translator" -> person = new NameBuilder();
                    case "first-name" -> person.firstName = Fb2Xml.text(reader);
                    case "middle-name" -> person.middleName = Fb2Xml.text(reader);
                    case "last-name" -> person.lastName = Fb2Xml.text(reader);
                    case "nickname" -> person.nickname = Fb2Xml.text(reader);
                    case "book-title" -> state.title = Fb2Xml.text(reader);
                    case "lang" -> {
                        state.language = Fb2Xml.text(reader);
                        if (!languageAllowed(state.language)) {
                            return false;
                        }
                    }
                    case "sequence" -> {
                        String name = Fb2Xml.attribute(reader, "name").trim();
                        if (!name.isEmpty()) {
                            state.series.add(new SeriesRef(name, parseNumber(Fb2Xml.attribute(reader, "number"))));
                        }
                    }
                    default -> Fb2Xml.skipElement(reader);
                }
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                switch (reader.getLocalName()) {
                    case "description" -> {
                        return true;
                    }
                    case "title-info" -> inTitleInfo = false;
                    case "author" -> person.addTo(state.authors, inTitleInfo);
                    case "translator" -> person.addTo(state.translators, inTitleInfo);
                    default -> {
                    }
                }
            }
        }
        return true;
    }

    private static int parseNumber(String number) {
        try {
            return Integer.parseInt(number.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static final class HeaderState {
        String title = "";
        String language = "";
        final List<String> genres = new ArrayList<>();
        final List<PersonName> authors = new ArrayList<>();
        final List<PersonName> translators = new ArrayList<>();
        final List<SeriesRef> series = new ArrayList<>();
    }

    private static final class NameBuilder {
        String firstName = "";
        String middleName = "";
        String lastName = "";
        String nickname = "";

        void addTo(List<PersonName> names, boolean inTitleInfo) {
            PersonName name = new PersonName(firstName, middleName, lastName, nickname);
            if (inTitleInfo && !name.isEmpty()) {
                names.add(name);
            }
        }
    }
}
