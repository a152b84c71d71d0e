package com.jmathml.reader;

/**
 * Reads numbers out of {@code cn} text the way a formatted stream extraction does:
 * leading whitespace is skipped, the longest numeric prefix is used and anything
 * after it is ignored. A failed read yields zero, an out-of-range read yields the
 * nearest representable value, and both are flagged.
 */
final class NumericText {

    record Scanned<T>(T value, boolean ok) {
    }

    private NumericText() {
    }

    static Scanned<Double> scanDouble(String text) {
        int i = skipWhitespace(text, 0);
        int start = i;
        i = skipSign(text, i);
        int digitsStart = i;
        i = skipDigits(text, i);
        int intDigits = i - digitsStart;
        int fracDigits = 0;
        if (i < text.length() && text.charAt(i) == '.') {
            int fracStart = i + 1;
            int fracEnd = skipDigits(text, fracStart);
            fracDigits = fracEnd - fracStart;
            if (intDigits > 0 || fracDigits > 0) {
                i = fracEnd;
            }
        }
        if (intDigits == 0 && fracDigits == 0) {
            return new Scanned<>(0.0, false);
        }
        if (i < text.length() && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
            int expStart = skipSign(text, i + 1);
            int expEnd = skipDigits(text, expStart);
            if (expEnd > expStart) {
                i = expEnd;
            }
        }
        double value = Double.parseDouble(text.substring(start, i));
        if (Double.isInfinite(value)) {
            return new Scanned<>(Math.copySign(Double.MAX_VALUE, value), false);
        }
        return new Scanned<>(value, true);
    }

    static Scanned<Integer> scanInt(String text) {
        int i = skipWhitespace(text, 0);
        int start = i;
        i = skipSign(text, i);
        int digitsStart = i;
        i = skipDigits(text, i);
        if (i == digitsStart) {
            return new Scanned<>(0, false);
        }
        boolean negative = text.charAt(start) == '-';
        int significant = digitsStart;
        while (significant < i - 1 && text.charAt(significant) == '0') {
            significant++;
        }
        // more digits than any int has always overflow
        if (i - significant > 10) {
            return new Scanned<>(negative ? Integer.MIN_VALUE : Integer.MAX_VALUE, false);
        }
        long value = Long.parseLong(text.substring(significant, i));
        if (negative) {
            value = -value;
        }
        if (value > Integer.MAX_VALUE) {
            return new Scanned<>(Integer.MAX_VALUE, false);
        }
        if (value < Integer.MIN_VALUE) {
            return new Scanned<>(Integer.MIN_VALUE, false);
        }
        return new Scanned<>((int) value, true);
    }

    private static int skipWhitespace(String text, int i) {
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int skipSign(String text, int i) {
        if (i < text.length() && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
            return i + 1;
        }
        return i;
    }

    private static int skipDigits(String text, int i) {
        while (i < text.length() && text.charAt(i) >= '0' && text.charAt(i) <= '9') {
            i++;
        }
        return i;
    }
}
