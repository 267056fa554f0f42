package com.fb2index.trigram;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.CRC32;

public final class Trigrams {
    static final int BOUNDARY = ' ';
    static final int MASK = 0xFFFFFF;

    private static final int[] EMPTY = new int[0];

    private Trigrams() {
    }

    public static int[] extract(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }

        int[] symbols = normalize(text);
        if (symbols.length == 0) {
            return EMPTY;
        }

        int[] window = { BOUNDARY, BOUNDARY, BOUNDARY };
        int[] codes = new int[symbols.length + 1];
        int count = 0;
        for (int i = 0; i <= symbols.length; i++) {
            window[0] = window[1];
            window[1] = window[2];
            window[2] = i < symbols.length ? symbols[i] : BOUNDARY;
            count = appendUnique(codes, count, encode(window[0], window[1], window[2]));
        }
        return Arrays.copyOf(codes, count);
    }

    public static int encode(int first, int second, int third) {
        StringBuilder builder = new StringBuilder(6);
        builder.appendCodePoint(first).appendCodePoint(second).appendCodePoint(third);
        CRC32 crc = new CRC32();
        crc.update(builder.toString().getBytes(StandardCharsets.UTF_8));
        return (int) ((crc.getValue() >>> 6) & MASK);
    }

    static int[] normalize(String text) {
        int[] symbols = new int[text.length()];
        int count = 0;
        boolean pendingBoundary = false;
        int offset = 0;
        while (offset < text.length()) {
            int codePoint = text.codePointAt(offset);
            offset += Character.charCount(codePoint);

            int symbol;
            if (Character.isLetter(codePoint)) {
                symbol = fold(Character.toLowerCase(codePoint));
            } else if (Character.isDigit(codePoint)) {
                symbol = codePoint;
            } else {
                pendingBoundary = count > 0;
                continue;
            }

            if (pendingBoundary) {
                symbols[count++] = BOUNDARY;
                pendingBoundary = false;
            }
            symbols[count++] = symbol;
        }
        return Arrays.copyOf(symbols, count);
    }

    private static int fold(int codePoint) {
        return codePoint == 'ё' ? 'е' : codePoint;
    }

    private static int appendUnique(int[] codes, int count, int code) {
        for (int i = 0; i < count; i++) {
            if (codes[i] == code) {
                return count;
            }
        }
        codes[count] = code;
        return count + 1;
    }
}
