package org.lapa.analyzer.ir;

public class AnalyzerException extends RuntimeException {
    private final String functionName;

    public AnalyzerException(String functionName, Throwable throwable) {
        super("Exception while analyzing " + functionName, throwable);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
