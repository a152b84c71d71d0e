package com.jmathml.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorLogTest {

    @Test
    public void testEmptyLog() {
        ErrorLog log = new ErrorLog();

        assertTrue(log.isEmpty());
        assertEquals(0, log.size());
        assertFalse(log.contains(ErrorCode.BAD_MATHML));
        assertFalse(log.containsOtherThan());
    }

    @Test
    public void testLogError() {
        ErrorLog log = new ErrorLog();

        log.logError(ErrorCode.BAD_MATHML, 3, 2, "detail", 4, 7);

        assertEquals(1, log.size());
        MathError error = log.get(0);
        assertEquals(ErrorCode.BAD_MATHML, error.code());
        assertEquals(99219, error.id());
        assertEquals(3, error.level());
        assertEquals(2, error.version());
        assertEquals(4, error.line());
        assertEquals(7, error.column());
    }

    @Test
    public void testContainsOtherThan() {
        ErrorLog log = new ErrorLog();
        log.logError(ErrorCode.OPS_NEED_CORRECT_NUMBER_OF_ARGS, 3, 2, "", 1, 1);

        assertFalse(log.containsOtherThan(ErrorCode.OPS_NEED_CORRECT_NUMBER_OF_ARGS));

        log.logError(ErrorCode.INVALID_MATH_ELEMENT, 3, 2, "", 2, 1);
        assertTrue(log.containsOtherThan(ErrorCode.OPS_NEED_CORRECT_NUMBER_OF_ARGS));
        assertFalse(log.containsOtherThan(ErrorCode.OPS_NEED_CORRECT_NUMBER_OF_ARGS, ErrorCode.INVALID_MATH_ELEMENT));
    }

    @Test
    public void testIterationKeepsOrder() {
        ErrorLog log = new ErrorLog();
        log.logError(ErrorCode.DISALLOWED_MATHML_SYMBOL, 2, 4, "", 1, 1);
        log.logError(ErrorCode.BAD_MATHML, 2, 4, "", 2, 1);

        List<ErrorCode> codes = new ArrayList<>();
        for (MathError error : log) {
            codes.add(error.code());
        }

        assertEquals(List.of(ErrorCode.DISALLOWED_MATHML_SYMBOL, ErrorCode.BAD_MATHML), codes);
        assertEquals(2, log.errors().size());
    }

    @Test
    public void testClear() {
        ErrorLog log = new ErrorLog();
        log.logError(ErrorCode.BAD_MATHML, 3, 2, "", 1, 1);

        log.clear();

        assertTrue(log.isEmpty());
    }

    @Test
    public void testMessage() {
        MathError withDetail = new MathError(ErrorCode.DISALLOWED_MATHML_SYMBOL, 2, 4,
            "<max> is not valid in SBML Level 2 Version 4.", 3, 5);
        MathError withoutDetail = new MathError(ErrorCode.BAD_MATHML_NODE_TYPE, 3, 2, "", 1, 1);

        assertEquals("Disallowed MathML symbol found. <max> is not valid in SBML Level 2 Version 4.",
            withDetail.message());
        assertEquals("Invalid MathML node type.", withoutDetail.message());
        assertEquals("line 3, column 5: (10202) " + withDetail.message(), withDetail.toString());
    }

    @Test
    public void testForId() {
        assertEquals(ErrorCode.OPS_NEED_CORRECT_NUMBER_OF_ARGS, ErrorCode.forId(10218));
        assertEquals(ErrorCode.BADLY_FORMED_XML, ErrorCode.forId(1006));
        assertThrows(IllegalArgumentException.class, () -> ErrorCode.forId(1));
    }
}
