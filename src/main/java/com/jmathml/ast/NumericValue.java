package com.jmathml.ast;

/**
 * Scalar payload of a number node. Each encoding keeps exactly what was read so that
 * writing reproduces the same {@code cn} type.
 */
public sealed interface NumericValue {
    NodeType nodeType();
    double toDouble();

    record RealValue(double value) implements NumericValue {
        @Override
        public NodeType nodeType() {
            return NodeType.REAL;
        }

        @Override
        public double toDouble() {
            return value;
        }
    }

    record IntegerValue(int value) implements NumericValue {
        @Override
        public NodeType nodeType() {
            return NodeType.INTEGER;
        }

        @Override
        public double toDouble() {
            return value;
        }
    }

    record RationalValue(int numerator, int denominator) implements NumericValue {
        @Override
        public NodeType nodeType() {
            return NodeType.RATIONAL;
        }

        @Override
        public double toDouble() {
            return (double) numerator / denominator;
        }
    }

    // mantissa * 10^exponent, kept apart so "12.3e5" stays "12.3 <sep/> 5"
    record ENotationValue(double mantissa, int exponent) implements NumericValue {
        @Override
        public NodeType nodeType() {
            return NodeType.REAL_E;
        }

        @Override
        public double toDouble() {
            return mantissa * Math.pow(10, exponent);
        }
    }
}
