package com.cooklang.parser;

/**
 * 解析过程中收集的诊断
 *
 * <p>位置以源码 UTF-8 字节偏移表示，区间为 [start, end)。</p>
 */
public final class SourceDiagnostic {

    public enum Severity {
        ERROR,
        WARNING
    }

    private final Severity severity;
    private final String message;
    private final int start;
    private final int end;

    public SourceDiagnostic(Severity severity, String message, int start, int end) {
        this.severity = severity;
        this.message = message;
        this.start = start;
        this.end = Math.max(start, end);
    }

    public static SourceDiagnostic error(String message, int start, int end) {
        return new SourceDiagnostic(Severity.ERROR, message, start, end);
    }

    public static SourceDiagnostic warning(String message, int start, int end) {
        return new SourceDiagnostic(Severity.WARNING, message, start, end);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " [" + start + ", " + end + ") " + message;
    }
}
