package org.lapa.analyzer.ir;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestAnalyzerException extends CommonTest {

    @Test
    public void testFunctionName() {
        IllegalStateException cause = new IllegalStateException("no entry block");
        AnalyzerException e = new AnalyzerException("f", cause);
        assertEquals("f", e.getFunctionName());
        assertSame(cause, e.getCause());
        assertEquals("Exception while analyzing f", e.getMessage());
    }
}
