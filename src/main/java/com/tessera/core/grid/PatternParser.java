package com.tessera.core.grid;

import com.tessera.core.model.PatternInfo;

import java.util.Locale;

/**
 * Parses pattern descriptors: {@code Square}, {@code Landscape}, {@code Portrait} and
 * {@code Parquet <N>L <M>P}. Matching is case-insensitive; a bare {@code Parquet} is 1:1
 * and anything unrecognised falls back to {@code Square}.
 */
public final class PatternParser {

    private PatternParser() {
    }

    public static PatternInfo parse(String descriptor) {
        if (descriptor == null) {
            return PatternInfo.square();
        }
        String text = descriptor.trim().toLowerCase(Locale.ROOT);
        if (text.equals("landscape")) {
            return PatternInfo.landscapeOnly();
        }
        if (text.equals("portrait")) {
            return PatternInfo.portraitOnly();
        }
        if (text.startsWith("parquet")) {
            int[] ratio = parseRatio(text.substring("parquet".length()));
            return ratio == null ? PatternInfo.parquet(1, 1) : PatternInfo.parquet(ratio[0], ratio[1]);
        }
        return PatternInfo.square();
    }

    /**
     * Finds the first {@code <digits> L <digits> P} run (whitespace allowed between tokens).
     * Returns {@code null} when there is none or either count is zero.
     */
    private static int[] parseRatio(String text) {
        for (int start = 0; start < text.length(); start++) {
            if (!Character.isDigit(text.charAt(start))) {
                continue;
            }
            Cursor cursor = new Cursor(text, start);
            Integer landscape = cursor.number();
            if (landscape == null || !cursor.symbol('l')) {
                continue;
            }
            Integer portrait = cursor.number();
            if (portrait == null || !cursor.symbol('p')) {
                continue;
            }
            if (landscape < 1 || portrait < 1) {
                return null;
            }
            return new int[] {landscape, portrait};
        }
        return null;
    }

    private static final class Cursor {
        private final String text;
        private int index;

        Cursor(String text, int index) {
            this.text = text;
            this.index = index;
        }

        Integer number() {
            skipSpaces();
            int begin = index;
            while (index < text.length() && Character.isDigit(text.charAt(index))) {
                index++;
            }
            if (begin == index) {
                return null;
            }
            try {
                return Integer.parseInt(text.substring(begin, index));
            } catch (NumberFormatException ex) {
                return null;
            }
        }

        boolean symbol(char expected) {
            skipSpaces();
            if (index < text.length() && text.charAt(index) == expected) {
                index++;
                return true;
            }
            return false;
        }

        private void skipSpaces() {
            while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
                index++;
            }
        }
    }
}
