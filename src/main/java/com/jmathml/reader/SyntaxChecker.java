package com.jmathml.reader;

import java.util.regex.Pattern;

/**
 * Identifier syntax checks for attribute values.
 */
public final class SyntaxChecker {
    private static final Pattern SID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SyntaxChecker() {
    }

    public static boolean isValidSId(String id) {
        return id != null && SID.matcher(id).matches();
    }

    /**
     * Unit identifiers use the SId syntax; an absent (empty) value is accepted.
     */
    public static boolean isValidUnitSId(String units) {
        return units == null || units.isEmpty() || isValidSId(units);
    }
}
