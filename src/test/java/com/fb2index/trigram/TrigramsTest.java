package com.fb2index.trigram;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.CRC32;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class TrigramsTest {

    @Test
    void shouldYieldNothingForEmptyOrSeparatorOnlyText() {
        assertEquals(0, Trigrams.extract("").length);
        assertEquals(0, Trigrams.extract(null).length);
        assertEquals(0, Trigrams.extract(" ,.;- !").length);
    }

    @Test
    void shouldBeDeterministic() {
        assertArrayEquals(Trigrams.extract("Война и мир"), Trigrams.extract("Война и мир"));
    }

    @Test
    void shouldPadShortTextWithBoundaries() {
        int[] trigrams = Trigrams.extract("a");

        assertArrayEquals(new int[] {
                Trigrams.encode(' ', ' ', 'a'),
                Trigrams.encode(' ', 'a', ' ')
        }, trigrams);
    }

    @Test
    void shouldSlideWindowOverWholeWord() {
        int[] trigrams = Trigrams.extract("abc");

        assertArrayEquals(new int[] {
                Trigrams.encode(' ', ' ', 'a'),
                Trigrams.encode(' ', 'a', 'b'),
                Trigrams.encode('a', 'b', 'c'),
                Trigrams.encode('b', 'c', ' ')
        }, trigrams);
    }

    @Test
    void shouldDropRepeatedTrigrams() {
        // "aaaa" produces the window "aaa" twice
        assertEquals(4, Trigrams.extract("aaaa").length);
    }

    @Test
    void shouldIgnoreCaseAndFoldYo() {
        assertArrayEquals(Trigrams.extract("война"), Trigrams.extract("ВОЙНА"));
        assertArrayEquals(Trigrams.extract("еж"), Trigrams.extract("Ёж"));
    }

    @Test
    void shouldCollapseSeparatorRunsAndTrimEdges() {
        assertArrayEquals(Trigrams.extract("war peace"), Trigrams.extract("  war,  -- peace!"));
        assertArrayEquals(new int[] { 'w', 'a', 'r', ' ', 'p' }, Trigrams.normalize("...War ! P..."));
    }

    @Test
    void shouldKeepDigits() {
        assertArrayEquals(new int[] { 'r', '2', ' ', 'd', '2' }, Trigrams.normalize("R2-D2"));
        assertFalse(Arrays.equals(Trigrams.extract("1984"), Trigrams.extract("1985")));
    }

    @Test
    void shouldHashUtf8BytesIntoTwentyFourBits() {
        CRC32 crc = new CRC32();
        crc.update("вой".getBytes(StandardCharsets.UTF_8));
        int expected = (int) ((crc.getValue() >>> 6) & 0xFFFFFF);

        assertEquals(expected, Trigrams.encode('в', 'о', 'й'));
        assertEquals(0, Trigrams.encode('x', 'y', 'z') & ~Trigrams.MASK);
    }
}
