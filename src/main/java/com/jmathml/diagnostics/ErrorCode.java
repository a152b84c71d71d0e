package com.jmathml.diagnostics;

/**
 * Diagnostic codes posted while reading MathML. The numeric ids follow the SBML
 * error table so that logs can be compared with other SBML tools.
 */
public enum ErrorCode {
    BADLY_FORMED_XML(1006, "The XML content is not well-formed."),
    INVALID_MATH_ELEMENT(10201, "Invalid MathML element."),
    DISALLOWED_MATHML_SYMBOL(10202, "Disallowed MathML symbol found."),
    DISALLOWED_MATHML_ENCODING_USE(10203, "Use of the MathML 'encoding' attribute is not allowed on this element."),
    DISALLOWED_DEFINITION_URL_USE(10204, "Use of the MathML 'definitionURL' attribute is not allowed on this element."),
    BAD_CSYMBOL_DEFINITION_URL_VALUE(10205, "Invalid <csymbol> 'definitionURL' attribute value."),
    DISALLOWED_MATH_TYPE_ATTRIBUTE_USE(10206, "Use of the MathML 'type' attribute is not allowed on this element."),
    DISALLOWED_MATH_TYPE_ATTRIBUTE_VALUE(10207, "Disallowed MathML 'type' attribute value."),
    OPS_NEED_CORRECT_NUMBER_OF_ARGS(10218, "Incorrect number of arguments given to MathML operator."),
    DISALLOWED_MATH_UNITS_USE(10220, "Units are only permitted on <cn> elements."),
    INVALID_UNIT_ID_SYNTAX(10221, "The units attribute does not conform to the syntax of an SBML unit identifier."),
    FAILED_MATHML_READ_OF_DOUBLE(99211, "Failed to read a valid double value from MathML <cn>."),
    FAILED_MATHML_READ_OF_INTEGER(99212, "Failed to read a valid integer value from MathML <cn>."),
    FAILED_MATHML_READ_OF_EXPONENTIAL(99213, "Failed to read a valid e-notation value from MathML <cn>."),
    FAILED_MATHML_READ_OF_RATIONAL(99214, "Failed to read a valid rational value from MathML <cn>."),
    BAD_MATHML_NODE_TYPE(99215, "Invalid MathML node type."),
    INVALID_MATHML_ATTRIBUTE(99216, "Invalid MathML attribute."),
    BAD_MATHML(99219, "Invalid MathML."),
    MATH_NESTING_TOO_DEEP(99230, "MathML elements are nested too deeply.");

    private final int id;
    private final String shortMessage;

    ErrorCode(int id, String shortMessage) {
        this.id = id;
        this.shortMessage = shortMessage;
    }

    public int id() {
        return id;
    }

    public String shortMessage() {
        return shortMessage;
    }

    public static ErrorCode forId(int id) {
        for (ErrorCode code : values()) {
            if (code.id == id) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unknown error id: " + id);
    }
}
