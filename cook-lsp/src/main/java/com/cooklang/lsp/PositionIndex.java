package com.cooklang.lsp;

import java.util.Arrays;

/**
 * UTF-8 字节偏移与 LSP 位置（行号 + UTF-16 列号）的互转
 *
 * <p>构建时一次线性扫描记录每行的起止字节。行终止符为 {@code \n}、{@code \r\n} 和单独的 {@code \r}。</p>
 *
 * <p>所有越界输入都会被钳制，不会抛出异常：</p>
 * <ul>
 *   <li>偏移落在多字节字符内部时回退到该字符起点</li>
 *   <li>偏移落在 {@code \r\n} 的 {@code \n} 上时回退到 {@code \r}</li>
 *   <li>列号落在代理对中间时回退到代理对起点</li>
 * </ul>
 */
public final class PositionIndex {

    private final byte[] text;
    /** 每行首字节偏移，升序 */
    private final int[] lineStarts;
    /** 每行末尾（不含终止符）的字节偏移 */
    private final int[] lineEnds;

    public PositionIndex(byte[] text) {
        this.text = text;
        int[] starts = new int[16];
        int[] ends = new int[16];
        int count = 0;
        int lineStart = 0;
        int i = 0;
        while (i < text.length) {
            byte b = text[i];
            if (b == '\n' || b == '\r') {
                int next = (b == '\r' && i + 1 < text.length && text[i + 1] == '\n') ? i + 2 : i + 1;
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                    ends = Arrays.copyOf(ends, count * 2);
                }
                starts[count] = lineStart;
                ends[count] = i;
                count++;
                lineStart = next;
                i = next;
            } else {
                i++;
            }
        }
        if (count == starts.length) {
            starts = Arrays.copyOf(starts, count + 1);
            ends = Arrays.copyOf(ends, count + 1);
        }
        starts[count] = lineStart;
        ends[count] = text.length;
        count++;
        this.lineStarts = Arrays.copyOf(starts, count);
        this.lineEnds = Arrays.copyOf(ends, count);
    }

    public int length() {
        return text.length;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public int lineStart(int line) {
        if (line < 0) return 0;
        if (line >= lineStarts.length) return text.length;
        return lineStarts[line];
    }

    /** 行末字节偏移（不含行终止符） */
    public int lineEnd(int line) {
        if (line < 0) return lineEnds[0];
        if (line >= lineEnds.length) return text.length;
        return lineEnds[line];
    }

    /**
     * 偏移所在的行号
     */
    public int lineOf(int offset) {
        int clamped = clamp(offset);
        int pos = Arrays.binarySearch(lineStarts, clamped);
        if (pos >= 0) return pos;
        return -pos - 2;
    }

    /**
     * 将偏移钳制到 [0, length] 且落在字符边界上
     */
    public int clamp(int offset) {
        if (offset <= 0) return 0;
        if (offset >= text.length) return text.length;
        int o = offset;
        while (o > 0 && isContinuation(text[o])) o--;
        if (o > 0 && text[o] == '\n' && text[o - 1] == '\r') o--;
        return o;
    }

    /**
     * 字节偏移 → 位置
     */
    public Position positionOf(int offset) {
        int clamped = clamp(offset);
        int line = lineOf(clamped);
        return new Position(line, utf16Length(lineStarts[line], clamped));
    }

    /**
     * 位置 → 字节偏移
     */
    public int offsetOf(int line, int character) {
        if (line < 0) return 0;
        if (line >= lineStarts.length) return text.length;
        int pos = lineStarts[line];
        int end = lineEnds[line];
        int units = 0;
        while (pos < end && units < character) {
            int width = sequenceLength(text[pos]);
            int w16 = width == 4 ? 2 : 1;
            if (units + w16 > character) break;
            units += w16;
            pos = Math.min(pos + width, end);
        }
        return pos;
    }

    public int offsetOf(Position position) {
        return offsetOf(position.getLine(), position.getCharacter());
    }

    /**
     * [start, end) 之间的 UTF-16 代码单元数
     */
    public int utf16Length(int start, int end) {
        int from = Math.max(0, start);
        int to = Math.min(text.length, end);
        int units = 0;
        for (int i = from; i < to; i++) {
            byte b = text[i];
            if (isContinuation(b)) continue;
            units += sequenceLength(b) == 4 ? 2 : 1;
        }
        return units;
    }

    static boolean isContinuation(byte b) {
        return (b & 0xC0) == 0x80;
    }

    /** 由首字节推断 UTF-8 序列长度 */
    static int sequenceLength(byte b) {
        int u = b & 0xFF;
        if (u < 0x80) return 1;
        if (u >= 0xF0) return 4;
        if (u >= 0xE0) return 3;
        if (u >= 0xC0) return 2;
        return 1;
    }
}
