package com.cooklang.lsp;

/**
 * 源码中一个元素的字节范围 [start, end) 及其原文
 *
 * <p>范围不跨越行终止符。</p>
 */
public final class ElementSpan {
    private final ElementKind kind;
    private final int start;
    private final int end;
    private final String text;

    public ElementSpan(ElementKind kind, int start, int end, String text) {
        this.kind = kind;
        this.start = start;
        this.end = end;
        this.text = text;
    }

    public ElementKind getKind() {
        return kind;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getText() {
        return text;
    }

    public int length() {
        return end - start;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    /**
     * 组件名称：标记之后、花括号或备注括号之前的文本（去除首尾空白）。
     * 非组件元素返回原文。
     */
    public String getName() {
        if (!kind.isComponent()) return text;
        int cut = text.length();
        for (int i = 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{' || c == '(') {
                cut = i;
                break;
            }
        }
        return text.substring(1, cut).trim();
    }

    /**
     * 花括号内的文本，没有花括号时返回 null
     */
    public String getBraceContent() {
        int open = text.indexOf('{');
        if (open < 0) return null;
        int close = text.indexOf('}', open + 1);
        return close < 0 ? text.substring(open + 1) : text.substring(open + 1, close);
    }

    @Override
    public String toString() {
        return kind + "[" + start + ", " + end + ") " + text;
    }
}
