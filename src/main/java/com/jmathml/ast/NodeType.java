package com.jmathml.ast;

/**
 * Kinds of expression node. Built-in operators and functions carry the MathML
 * element they are written as.
 */
public enum NodeType {
    INTEGER(Category.NUMBER, null),
    REAL(Category.NUMBER, null),
    REAL_E(Category.NUMBER, null),
    RATIONAL(Category.NUMBER, null),

    NAME(Category.NAME, null),
    NAME_AVOGADRO(Category.NAME, null),
    NAME_TIME(Category.NAME, null),

    CONSTANT_E(Category.CONSTANT, "exponentiale"),
    CONSTANT_FALSE(Category.CONSTANT, "false"),
    CONSTANT_PI(Category.CONSTANT, "pi"),
    CONSTANT_TRUE(Category.CONSTANT, "true"),

    PLUS(Category.OPERATOR, "plus"),
    MINUS(Category.OPERATOR, "minus"),
    TIMES(Category.OPERATOR, "times"),
    DIVIDE(Category.OPERATOR, "divide"),
    POWER(Category.OPERATOR, "power"),

    LAMBDA(Category.LAMBDA, "lambda"),

    FUNCTION(Category.FUNCTION, null),
    FUNCTION_ABS(Category.FUNCTION, "abs"),
    FUNCTION_ARCCOS(Category.FUNCTION, "arccos"),
    FUNCTION_ARCCOSH(Category.FUNCTION, "arccosh"),
    FUNCTION_ARCCOT(Category.FUNCTION, "arccot"),
    FUNCTION_ARCCOTH(Category.FUNCTION, "arccoth"),
    FUNCTION_ARCCSC(Category.FUNCTION, "arccsc"),
    FUNCTION_ARCCSCH(Category.FUNCTION, "arccsch"),
    FUNCTION_ARCSEC(Category.FUNCTION, "arcsec"),
    FUNCTION_ARCSECH(Category.FUNCTION, "arcsech"),
    FUNCTION_ARCSIN(Category.FUNCTION, "arcsin"),
    FUNCTION_ARCSINH(Category.FUNCTION, "arcsinh"),
    FUNCTION_ARCTAN(Category.FUNCTION, "arctan"),
    FUNCTION_ARCTANH(Category.FUNCTION, "arctanh"),
    FUNCTION_CEILING(Category.FUNCTION, "ceiling"),
    FUNCTION_COS(Category.FUNCTION, "cos"),
    FUNCTION_COSH(Category.FUNCTION, "cosh"),
    FUNCTION_COT(Category.FUNCTION, "cot"),
    FUNCTION_COTH(Category.FUNCTION, "coth"),
    FUNCTION_CSC(Category.FUNCTION, "csc"),
    FUNCTION_CSCH(Category.FUNCTION, "csch"),
    FUNCTION_DELAY(Category.FUNCTION, null),
    FUNCTION_EXP(Category.FUNCTION, "exp"),
    FUNCTION_FACTORIAL(Category.FUNCTION, "factorial"),
    FUNCTION_FLOOR(Category.FUNCTION, "floor"),
    FUNCTION_LN(Category.FUNCTION, "ln"),
    FUNCTION_LOG(Category.FUNCTION, "log"),
    FUNCTION_PIECEWISE(Category.FUNCTION, "piecewise"),
    FUNCTION_ROOT(Category.FUNCTION, "root"),
    FUNCTION_SEC(Category.FUNCTION, "sec"),
    FUNCTION_SECH(Category.FUNCTION, "sech"),
    FUNCTION_SIN(Category.FUNCTION, "sin"),
    FUNCTION_SINH(Category.FUNCTION, "sinh"),
    FUNCTION_TAN(Category.FUNCTION, "tan"),
    FUNCTION_TANH(Category.FUNCTION, "tanh"),

    LOGICAL_AND(Category.LOGICAL, "and"),
    LOGICAL_NOT(Category.LOGICAL, "not"),
    LOGICAL_OR(Category.LOGICAL, "or"),
    LOGICAL_XOR(Category.LOGICAL, "xor"),

    RELATIONAL_EQ(Category.RELATIONAL, "eq"),
    RELATIONAL_GEQ(Category.RELATIONAL, "geq"),
    RELATIONAL_GT(Category.RELATIONAL, "gt"),
    RELATIONAL_LEQ(Category.RELATIONAL, "leq"),
    RELATIONAL_LT(Category.RELATIONAL, "lt"),
    RELATIONAL_NEQ(Category.RELATIONAL, "neq"),

    // generic <csymbol> with a definitionURL nothing else claims
    CSYMBOL_FUNCTION(Category.FUNCTION, null),
    // contributed by a GrammarExtension; the node carries the ExtensionSymbol
    EXTENSION(Category.FUNCTION, null),
    UNKNOWN(Category.UNKNOWN, null);

    public enum Category {
        NUMBER, NAME, CONSTANT, OPERATOR, LAMBDA, FUNCTION, LOGICAL, RELATIONAL, UNKNOWN
    }

    private final Category category;
    private final String elementName;

    NodeType(Category category, String elementName) {
        this.category = category;
        this.elementName = elementName;
    }

    public Category category() {
        return category;
    }

    /**
     * @return the MathML element for this type, or null when it is written some other
     * way ({@code cn}, {@code ci}, {@code csymbol})
     */
    public String elementName() {
        return elementName;
    }
}
