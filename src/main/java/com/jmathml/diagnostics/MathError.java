package com.jmathml.diagnostics;

public record MathError(ErrorCode code, int level, int version, String detail, int line, int column) {

    public int id() {
        return code.id();
    }

    public String message() {
        if (detail == null || detail.isEmpty()) {
            return code.shortMessage();
        }
        return code.shortMessage() + " " + detail;
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column + ": (" + code.id() + ") " + message();
    }
}
