package com.cooklang.parser.model;

/**
 * 步骤：以空行分隔的一段文本，组件以其名称出现在文本中
 */
public final class Step {
    private final String text;
    private final int start;
    private final int end;

    public Step(String text, int start, int end) {
        this.text = text;
        this.start = start;
        this.end = end;
    }

    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }
}
