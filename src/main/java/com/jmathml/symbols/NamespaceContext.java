package com.jmathml.symbols;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An SBML level/version pair. Only the combinations that were ever published are
 * accepted.
 */
public record NamespaceContext(int level, int version) {
    public static final String MATHML_URI = "http://www.w3.org/1998/Math/MathML";

    private static final Pattern CORE_URI = Pattern.compile(
        "http://www\\.sbml\\.org/sbml/level(\\d)(?:/version(\\d)(/core)?)?");

    public static final NamespaceContext L3V2 = new NamespaceContext(3, 2);

    public NamespaceContext {
        boolean valid = switch (level) {
            case 1 -> version == 1 || version == 2;
            case 2 -> version >= 1 && version <= 5;
            case 3 -> version == 1 || version == 2;
            default -> false;
        };
        if (!valid) {
            throw new IllegalArgumentException(
                "SBML Level " + level + " Version " + version + " does not exist");
        }
    }

    public String sbmlUri() {
        return switch (level) {
            case 1 -> "http://www.sbml.org/sbml/level1";
            case 2 -> version == 1
                ? "http://www.sbml.org/sbml/level2"
                : "http://www.sbml.org/sbml/level2/version" + version;
            default -> "http://www.sbml.org/sbml/level3/version" + version + "/core";
        };
    }

    /**
     * Parses an SBML core namespace URI back into a context.
     *
     * @throws IllegalArgumentException if the URI is not an SBML core namespace
     */
    public static NamespaceContext fromUri(String uri) {
        Matcher m = CORE_URI.matcher(uri == null ? "" : uri);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not an SBML core namespace: " + uri);
        }
        int level = Integer.parseInt(m.group(1));
        boolean core = m.group(3) != null;
        if (level == 3 && !core || level < 3 && core) {
            throw new IllegalArgumentException("Not an SBML core namespace: " + uri);
        }
        if (m.group(2) == null) {
            // level 1 and level 2 version 1 carry no version segment
            if (level == 3) {
                throw new IllegalArgumentException("Not an SBML core namespace: " + uri);
            }
            return new NamespaceContext(level, level == 1 ? 2 : 1);
        }
        int version = Integer.parseInt(m.group(2));
        if (level == 1 || level == 2 && version == 1) {
            throw new IllegalArgumentException("Not an SBML core namespace: " + uri);
        }
        return new NamespaceContext(level, version);
    }

    @Override
    public String toString() {
        return "L" + level + "V" + version;
    }
}
