package com.cooklang.lsp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 UTF-8 字节的标记扫描器
 *
 * <p>标记字符（{@code @ # ~ { } % \ - = >}）均为 ASCII，多字节字符的任何字节都不会与之混淆，
 * 因此可以直接在字节上扫描。</p>
 *
 * <p>三种扫描共用同一个前向状态机：反斜杠转义下一个字节；花括号组内的标记是内容而不是新元素；
 * 元素不跨行。补全与悬停的回溯范围限制在 {@link #CONTEXT_WINDOW} 字节内，
 * 同一行上更早的标记不会被找到。</p>
 */
public final class MarkerScanner {

    /** 回溯扫描的最大字节数 */
    public static final int CONTEXT_WINDOW = 200;

    private MarkerScanner() {}

    // ============ 补全上下文 ============

    /**
     * 判断光标所在的补全上下文
     *
     * @param text   文档 UTF-8 字节
     * @param cursor 光标字节偏移
     */
    public static CompletionContext completionContext(byte[] text, int cursor) {
        int end = snapBack(text, cursor);
        int start = windowStart(text, end);
        ScanState state = scan(text, start, end);
        if (state.marker < 0) return CompletionContext.none();

        ElementKind kind = ElementKind.fromMarker(text[state.marker]);
        if (state.brace >= 0) {
            if (state.percent >= 0) {
                return CompletionContext.unit(kind, decode(text, state.percent + 1, end).trim());
            }
            return CompletionContext.quantity(kind, decode(text, state.brace + 1, end));
        }
        return CompletionContext.name(kind, decode(text, state.marker + 1, end));
    }

    // ============ 光标处元素 ============

    /**
     * 查找包含指定偏移的元素
     *
     * @return 元素范围，偏移不在任何元素内时返回 null
     */
    public static ElementSpan elementAt(byte[] text, int offset) {
        if (offset < 0 || offset >= text.length) return null;
        int pos = snapBack(text, offset);
        int lineStart = lineStartOf(text, pos);
        int lineEnd = lineEndOf(text, pos);
        if (pos >= lineEnd) return null;

        int first = skipBlanks(text, lineStart, lineEnd);
        if (first < lineEnd) {
            ElementSpan whole = wholeLineElement(text, first, lineEnd);
            if (whole != null) {
                return whole.contains(pos) ? whole : null;
            }
        }

        ElementSpan comment = inlineCommentAt(text, first, lineEnd, pos);
        if (comment != null) return comment;

        int windowStart = windowStart(text, pos);
        ScanState state = scan(text, windowStart, pos);
        int marker;
        if (state.stop == pos && state.brace < 0 && isMarker(text[pos])) {
            marker = pos;
        } else {
            marker = state.marker;
        }
        if (marker < 0) return null;

        int end = elementEnd(text, marker, lineEnd);
        if (end < 0 || pos >= end) return null;
        return span(text, ElementKind.fromMarker(text[marker]), marker, end);
    }

    /**
     * 行内注释（{@code --} 到行尾、单行 {@code [- -]}）中包含 pos 的那一段，与分词结果一致
     */
    private static ElementSpan inlineCommentAt(byte[] text, int from, int lineEnd, int pos) {
        List<ElementSpan> spans = new ArrayList<>();
        tokenizeLine(text, from, lineEnd, spans);
        for (ElementSpan span : spans) {
            if (span.getKind() == ElementKind.COMMENT && span.contains(pos)) return span;
        }
        return null;
    }

    // ============ 全文分词 ============

    /**
     * 将整个文档切分为升序、互不重叠的元素范围
     */
    public static List<ElementSpan> tokenize(byte[] text) {
        List<ElementSpan> spans = new ArrayList<>();
        int pos = 0;

        // front matter：只标记开闭两行
        int firstEnd = lineEndOf(text, 0);
        if (isDashLine(text, 0, firstEnd)) {
            spans.add(span(text, ElementKind.METADATA, 0, firstEnd));
            pos = nextLine(text, firstEnd);
            int scan = pos;
            while (scan < text.length) {
                int end = lineEndOf(text, scan);
                if (isDashLine(text, scan, end)) {
                    spans.add(span(text, ElementKind.METADATA, scan, end));
                    pos = nextLine(text, end);
                    break;
                }
                scan = nextLine(text, end);
            }
        }

        while (pos < text.length) {
            int lineEnd = lineEndOf(text, pos);
            int first = skipBlanks(text, pos, lineEnd);
            if (first < lineEnd) {
                ElementSpan whole = wholeLineElement(text, first, lineEnd);
                if (whole != null) {
                    spans.add(whole);
                } else {
                    tokenizeLine(text, first, lineEnd, spans);
                }
            }
            pos = nextLine(text, lineEnd);
        }
        return spans;
    }

    private static void tokenizeLine(byte[] text, int from, int lineEnd, List<ElementSpan> spans) {
        int i = from;
        while (i < lineEnd) {
            byte b = text[i];
            if (b == '\\') {
                i += 2;
                continue;
            }
            if (b == '-' && i + 1 < lineEnd && text[i + 1] == '-') {
                spans.add(span(text, ElementKind.COMMENT, i, lineEnd));
                return;
            }
            if (b == '[' && i + 1 < lineEnd && text[i + 1] == '-') {
                int close = indexOf(text, i + 2, lineEnd, '-', ']');
                if (close >= 0) {
                    spans.add(span(text, ElementKind.COMMENT, i, close + 2));
                    i = close + 2;
                    continue;
                }
            }
            if (isMarker(b)) {
                int end = elementEnd(text, i, lineEnd);
                if (end > i) {
                    spans.add(span(text, ElementKind.fromMarker(b), i, end));
                    i = end;
                    continue;
                }
            }
            i++;
        }
    }

    /**
     * 整行元素：{@code --} 注释、{@code >>} 元数据、{@code =...=} 分节标题
     */
    private static ElementSpan wholeLineElement(byte[] text, int first, int lineEnd) {
        if (startsWith(text, first, lineEnd, '-', '-')) {
            return span(text, ElementKind.COMMENT, first, lineEnd);
        }
        if (startsWith(text, first, lineEnd, '>', '>')) {
            return span(text, ElementKind.METADATA, first, lineEnd);
        }
        if (text[first] == '=') {
            int last = trimEnd(text, first, lineEnd);
            int lastEquals = last - 1;
            while (lastEquals > first && text[lastEquals] != '=') lastEquals--;
            int end = lastEquals > first ? lastEquals + 1 : last;
            return span(text, ElementKind.SECTION, first, end);
        }
        return null;
    }

    // ============ 元素结束位置 ============

    /**
     * 从标记开始向前扫描元素的结束位置（不含）
     *
     * <p>花括号组延伸到匹配的 '}'，没有时到行尾；没有花括号时，若同一行在下一个标记或 '}'
     * 之前出现 '{' 则为多词名称，否则为单个单词。食材紧跟的 {@code (备注)} 也计入元素。</p>
     *
     * @param limit 行尾字节偏移
     * @return 结束位置；标记后没有名称也没有花括号时返回 -1
     */
    static int elementEnd(byte[] text, int marker, int limit) {
        int nameStart = marker + 1;
        if (nameStart >= limit || isBlank(text[nameStart])) return -1;

        int brace = -1;
        for (int k = nameStart; k < limit; k++) {
            byte b = text[k];
            if (b == '\\') {
                k++;
            } else if (b == '{') {
                brace = k;
                break;
            } else if (isMarker(b) || b == '}') {
                break;
            }
        }

        int end;
        if (brace >= 0) {
            int close = -1;
            for (int k = brace + 1; k < limit; k++) {
                if (text[k] == '\\') {
                    k++;
                } else if (text[k] == '}') {
                    close = k;
                    break;
                }
            }
            end = close >= 0 ? close + 1 : limit;
        } else {
            end = nameStart;
            while (end < limit && isWordByte(text[end])) end++;
            if (end == nameStart) return -1;
        }

        if (text[marker] == '@' && end < limit && text[end] == '(') {
            for (int k = end + 1; k < limit; k++) {
                if (text[k] == ')') return k + 1;
            }
        }
        return end;
    }

    // ============ 共享状态机 ============

    /** 前向扫描结束时的状态 */
    private static final class ScanState {
        /** 当前未结束元素的标记位置，-1 表示不在元素内 */
        int marker = -1;
        /** 当前元素打开的 '{' 位置 */
        int brace = -1;
        /** 花括号组内最后一个 '%' 位置 */
        int percent = -1;
        /** 循环停止的位置；转义跳过 to 处字节时为 to + 1 */
        int stop;
    }

    private static ScanState scan(byte[] text, int from, int to) {
        ScanState state = new ScanState();
        int i = from;
        while (i < to) {
            byte b = text[i];
            if (b == '\\') {
                i += 2;
                continue;
            }
            if (state.brace >= 0) {
                if (b == '}') {
                    state.marker = -1;
                    state.brace = -1;
                    state.percent = -1;
                } else if (b == '%') {
                    state.percent = i;
                }
            } else if (isMarker(b)) {
                state.marker = i;
                state.percent = -1;
            } else if (state.marker >= 0) {
                if (b == '{') {
                    state.brace = i;
                } else if (b == '}') {
                    state.marker = -1;
                }
            }
            i++;
        }
        state.stop = i;
        return state;
    }

    // ============ 字节工具 ============

    static boolean isMarker(byte b) {
        return b == '@' || b == '#' || b == '~';
    }

    /** 单词字节：ASCII 字母数字、下划线以及任意多字节字符的字节 */
    static boolean isWordByte(byte b) {
        int u = b & 0xFF;
        return u >= 0x80 || (u >= 'a' && u <= 'z') || (u >= 'A' && u <= 'Z') || (u >= '0' && u <= '9') || u == '_';
    }

    private static boolean isBlank(byte b) {
        return b == ' ' || b == '\t';
    }

    private static boolean isLineBreak(byte b) {
        return b == '\n' || b == '\r';
    }

    /** 钳制到 [0, length] 并回退到字符起点 */
    private static int snapBack(byte[] text, int offset) {
        if (offset <= 0) return 0;
        if (offset >= text.length) return text.length;
        int o = offset;
        while (o > 0 && PositionIndex.isContinuation(text[o])) o--;
        return o;
    }

    /** 回溯起点：行首与 CONTEXT_WINDOW 中较近者，落在字符起点上 */
    private static int windowStart(byte[] text, int end) {
        int start = Math.max(0, end - CONTEXT_WINDOW);
        while (start < end && PositionIndex.isContinuation(text[start])) start++;
        for (int i = end - 1; i >= start; i--) {
            if (isLineBreak(text[i])) return i + 1;
        }
        return start;
    }

    private static int lineStartOf(byte[] text, int pos) {
        int i = pos;
        while (i > 0 && !isLineBreak(text[i - 1])) i--;
        return i;
    }

    /** 行尾（行终止符位置或文末） */
    private static int lineEndOf(byte[] text, int pos) {
        int i = pos;
        while (i < text.length && !isLineBreak(text[i])) i++;
        return i;
    }

    private static int nextLine(byte[] text, int lineEnd) {
        if (lineEnd >= text.length) return text.length;
        if (text[lineEnd] == '\r' && lineEnd + 1 < text.length && text[lineEnd + 1] == '\n') return lineEnd + 2;
        return lineEnd + 1;
    }

    private static int skipBlanks(byte[] text, int from, int to) {
        int i = from;
        while (i < to && isBlank(text[i])) i++;
        return i;
    }

    private static int trimEnd(byte[] text, int from, int to) {
        int i = to;
        while (i > from && isBlank(text[i - 1])) i--;
        return i;
    }

    private static boolean startsWith(byte[] text, int at, int limit, char a, char b) {
        return at + 1 < limit && text[at] == a && text[at + 1] == b;
    }

    private static int indexOf(byte[] text, int from, int to, char a, char b) {
        for (int i = from; i + 1 < to; i++) {
            if (text[i] == a && text[i + 1] == b) return i;
        }
        return -1;
    }

    private static boolean isDashLine(byte[] text, int from, int to) {
        int end = trimEnd(text, from, to);
        if (end - from < 3) return false;
        for (int i = from; i < end; i++) {
            if (text[i] != '-') return false;
        }
        return true;
    }

    private static ElementSpan span(byte[] text, ElementKind kind, int start, int end) {
        return new ElementSpan(kind, start, end, decode(text, start, end));
    }

    private static String decode(byte[] text, int start, int end) {
        if (end <= start) return "";
        return new String(text, start, end - start, StandardCharsets.UTF_8);
    }
}
