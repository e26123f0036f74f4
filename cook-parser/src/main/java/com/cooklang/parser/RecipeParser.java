package com.cooklang.parser;

import com.cooklang.parser.model.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Cooklang 容错解析器
 *
 * <p>按行处理源码：front matter、{@code >>} 元数据、{@code =} 分节标题与以空行分隔的步骤。
 * 步骤中识别 {@code @} 食材、{@code #} 厨具、{@code ~} 计时器。遇到错误时继续解析并收集诊断，
 * 只要存在错误就不产出菜谱结构。</p>
 *
 * <p>每个实例只解析一次；诊断位置均为 UTF-8 字节偏移。</p>
 */
public class RecipeParser {

    private final List<Line> lines;

    private final List<MetadataEntry> metadata = new ArrayList<>();
    private final List<Section> sections = new ArrayList<>();
    private final List<Ingredient> ingredients = new ArrayList<>();
    private final List<Cookware> cookware = new ArrayList<>();
    private final List<Timer> timers = new ArrayList<>();
    private final List<SourceDiagnostic> errors = new ArrayList<>();
    private final List<SourceDiagnostic> warnings = new ArrayList<>();

    // 当前分节
    private String sectionName;
    private boolean sectionHasHeader;
    private int sectionStart = -1;
    private int sectionEnd;
    private List<Step> sectionSteps = new ArrayList<>();

    // 当前步骤（null 表示没有未结束的步骤）
    private StringBuilder stepText;
    private int stepStart;
    private int stepEnd;

    public RecipeParser(String source) {
        this.lines = splitLines(source != null ? source : "");
    }

    /**
     * 执行解析
     */
    public ParseResult parse() {
        int first = parseFrontMatter();
        for (int i = first; i < lines.size(); i++) {
            parseLine(lines.get(i));
        }
        endStep();
        endSection();

        Recipe recipe = errors.isEmpty()
                ? new Recipe(metadata, sections, ingredients, cookware, timers)
                : null;
        return new ParseResult(recipe, errors, warnings);
    }

    // ============ front matter ============

    private int parseFrontMatter() {
        if (lines.isEmpty() || !isDashLine(lines.get(0).text)) return 0;

        int close = -1;
        for (int i = 1; i < lines.size(); i++) {
            if (isDashLine(lines.get(i).text)) {
                close = i;
                break;
            }
        }
        Line open = lines.get(0);
        if (close < 0) {
            errors.add(SourceDiagnostic.error("Unterminated front matter", open.byteStart, open.byteEnd()));
            return 1;
        }

        for (int i = 1; i < close; i++) {
            Line line = lines.get(i);
            String text = line.text;
            String trimmed = text.trim();
            // 空行、注释与缩进的续行（YAML 列表等）不作为键值处理
            if (trimmed.isEmpty() || trimmed.startsWith("#") || Character.isWhitespace(text.charAt(0))) {
                continue;
            }
            int colon = text.indexOf(':');
            if (colon <= 0) {
                warnings.add(SourceDiagnostic.warning("Invalid front matter line", line.byteStart, line.byteEnd()));
                continue;
            }
            String key = text.substring(0, colon).trim();
            if (key.isEmpty()) {
                warnings.add(SourceDiagnostic.warning("Empty metadata key", line.byteStart, line.byteEnd()));
                continue;
            }
            String value = unquote(text.substring(colon + 1).trim());
            metadata.add(new MetadataEntry(key, value, line.byteStart, line.byteEnd()));
        }
        return close + 1;
    }

    private static boolean isDashLine(String text) {
        String t = text.stripTrailing();
        if (t.length() < 3) return false;
        for (int i = 0; i < t.length(); i++) {
            if (t.charAt(i) != '-') return false;
        }
        return true;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    // ============ 行处理 ============

    private void parseLine(Line line) {
        String text = stripComments(line.text);
        int first = firstNonBlank(text);
        if (first < 0) {
            // 只有注释的行不打断当前步骤
            if (line.text.trim().isEmpty()) endStep();
            return;
        }
        if (text.startsWith(">>", first)) {
            endStep();
            parseMetadataLine(line, text, first);
            return;
        }
        if (text.charAt(first) == '=') {
            endStep();
            startSection(line, text.trim());
            return;
        }
        parseStepLine(line, text, first);
    }

    /**
     * 将行注释与单行块注释替换为空格，保持列位置不变
     */
    private static String stripComments(String text) {
        int len = text.length();
        char[] out = null;
        int depth = 0;
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth > 0) depth--;
            } else if (depth == 0 && c == '[' && i + 1 < len && text.charAt(i + 1) == '-') {
                int close = text.indexOf("-]", i + 2);
                if (close >= 0) {
                    if (out == null) out = text.toCharArray();
                    Arrays.fill(out, i, close + 2, ' ');
                    i = close + 1;
                }
            } else if (depth == 0 && c == '-' && i + 1 < len && text.charAt(i + 1) == '-') {
                if (out == null) out = text.toCharArray();
                Arrays.fill(out, i, len, ' ');
                break;
            }
        }
        return out != null ? new String(out) : text;
    }

    private void parseMetadataLine(Line line, String text, int first) {
        int last = lastNonBlank(text);
        int start = line.byteAt(first);
        int end = line.byteAt(last);
        String body = text.substring(first + 2, last);
        int colon = body.indexOf(':');
        if (colon < 0) {
            warnings.add(SourceDiagnostic.warning("Metadata line without ':'", start, end));
            return;
        }
        String key = body.substring(0, colon).trim();
        if (key.isEmpty()) {
            warnings.add(SourceDiagnostic.warning("Empty metadata key", start, end));
            return;
        }
        metadata.add(new MetadataEntry(key, body.substring(colon + 1).trim(), start, end));
    }

    private void startSection(Line line, String header) {
        endSection();
        int from = 0;
        int to = header.length();
        while (from < to && header.charAt(from) == '=') from++;
        while (to > from && header.charAt(to - 1) == '=') to--;
        String name = header.substring(from, to).trim();

        sectionName = name.isEmpty() ? null : name;
        sectionHasHeader = true;
        sectionStart = line.byteStart;
        sectionEnd = line.byteEnd();
    }

    private void endSection() {
        if (sectionHasHeader || !sectionSteps.isEmpty()) {
            sections.add(new Section(sectionName, sectionSteps, sectionStart, sectionEnd));
        }
        sectionName = null;
        sectionHasHeader = false;
        sectionStart = -1;
        sectionSteps = new ArrayList<>();
    }

    private void parseStepLine(Line line, String text, int first) {
        int last = lastNonBlank(text);
        if (stepText == null) {
            stepText = new StringBuilder();
            stepStart = line.byteAt(first);
        } else {
            stepText.append(' ');
        }
        parseInline(line, text, first, last);
        stepEnd = line.byteAt(last);
    }

    private void endStep() {
        if (stepText == null) return;
        if (sectionStart < 0) sectionStart = stepStart;
        sectionSteps.add(new Step(stepText.toString().trim().replaceAll("\\s+", " "), stepStart, stepEnd));
        sectionEnd = stepEnd;
        stepText = null;
    }

    // ============ 步骤内组件 ============

    private void parseInline(Line line, String text, int from, int to) {
        int i = from;
        while (i < to) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < to) {
                stepText.append(text.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '@' || c == '#' || c == '~') {
                int next = parseComponent(line, text, i, to);
                if (next > i) {
                    i = next;
                    continue;
                }
            }
            stepText.append(c);
            i++;
        }
    }

    /**
     * 解析以标记字符开头的组件
     *
     * @return 组件之后的位置；不构成组件时返回 {@code at}
     */
    private int parseComponent(Line line, String text, int at, int to) {
        char marker = text.charAt(at);
        int nameStart = at + 1;
        if (nameStart >= to || Character.isWhitespace(text.charAt(nameStart))) return at;

        String name;
        int pos;
        int brace = findMultiwordBrace(text, nameStart, to);
        if (brace >= 0) {
            name = text.substring(nameStart, brace).trim();
            pos = brace;
        } else {
            pos = nameStart;
            while (pos < to) {
                int cp = text.codePointAt(pos);
                if (!isWordChar(cp)) break;
                pos += Character.charCount(cp);
            }
            name = text.substring(nameStart, pos);
            if (name.isEmpty()) return at;
        }

        String kindName = marker == '@' ? "ingredient" : marker == '#' ? "cookware" : "timer";
        int start = line.byteAt(at);
        Quantity quantity = null;
        boolean hasBraces = false;
        if (pos < to && text.charAt(pos) == '{') {
            hasBraces = true;
            int close = findClosingBrace(text, pos + 1, to);
            String body;
            if (close < 0) {
                body = text.substring(pos + 1, to);
                errors.add(SourceDiagnostic.error("Unclosed '{' in " + kindName, start, line.byteAt(to)));
                pos = to;
            } else {
                body = text.substring(pos + 1, close);
                pos = close + 1;
            }
            quantity = parseQuantity(body, kindName, start, line.byteAt(pos));
        }

        String note = null;
        if (marker == '@' && pos < to && text.charAt(pos) == '(') {
            int closeParen = text.indexOf(')', pos + 1);
            if (closeParen < 0 || closeParen >= to) {
                warnings.add(SourceDiagnostic.warning("Unclosed '(' in ingredient note",
                        line.byteAt(pos), line.byteAt(to)));
            } else {
                note = text.substring(pos + 1, closeParen).trim();
                if (note.isEmpty()) note = null;
                pos = closeParen + 1;
            }
        }

        int end = line.byteAt(pos);
        switch (marker) {
            case '@':
                if (name.isEmpty()) errors.add(SourceDiagnostic.error("Ingredient without name", start, end));
                ingredients.add(new Ingredient(name, quantity, note, start, end));
                break;
            case '#':
                if (name.isEmpty()) errors.add(SourceDiagnostic.error("Cookware without name", start, end));
                cookware.add(new Cookware(name, quantity, start, end));
                break;
            default:
                if (!hasBraces) {
                    warnings.add(SourceDiagnostic.warning("Timer without duration", start, end));
                } else if (quantity == null) {
                    errors.add(SourceDiagnostic.error("Empty timer duration", start, end));
                }
                timers.add(new Timer(name.isEmpty() ? null : name, quantity, start, end));
                break;
        }

        stepText.append(name.isEmpty() && quantity != null ? quantity.toString() : name);
        return pos;
    }

    private Quantity parseQuantity(String body, String kindName, int start, int end) {
        String trimmed = body.trim();
        if (trimmed.isEmpty()) return null;
        int percent = trimmed.indexOf('%');
        if (percent < 0) return new Quantity(trimmed, null);

        String value = trimmed.substring(0, percent).trim();
        String unit = trimmed.substring(percent + 1).trim();
        if (value.isEmpty()) {
            if (unit.isEmpty()) return null;
            errors.add(SourceDiagnostic.error("Unit without quantity in " + kindName, start, end));
        }
        return new Quantity(value, unit.isEmpty() ? null : unit);
    }

    /**
     * 多词名称：同一行中在下一个标记或 '}' 之前出现的 '{'
     */
    private static int findMultiwordBrace(String text, int from, int to) {
        for (int k = from; k < to; k++) {
            char c = text.charAt(k);
            if (c == '\\') {
                k++;
            } else if (c == '{') {
                return k;
            } else if (c == '@' || c == '#' || c == '~' || c == '}') {
                return -1;
            }
        }
        return -1;
    }

    private static int findClosingBrace(String text, int from, int to) {
        for (int k = from; k < to; k++) {
            char c = text.charAt(k);
            if (c == '\\') {
                k++;
            } else if (c == '}') {
                return k;
            }
        }
        return -1;
    }

    /** 单词字符：字母、数字、下划线及任意非 ASCII 字符 */
    static boolean isWordChar(int cp) {
        return cp >= 0x80 || Character.isLetterOrDigit(cp) || cp == '_';
    }

    private static int firstNonBlank(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) return i;
        }
        return -1;
    }

    /** 最后一个非空白字符之后的位置 */
    private static int lastNonBlank(String text) {
        int i = text.length();
        while (i > 0 && Character.isWhitespace(text.charAt(i - 1))) i--;
        return i;
    }

    // ============ 行与字节偏移 ============

    private static List<Line> splitLines(String source) {
        List<Line> result = new ArrayList<>();
        int n = source.length();
        int lineStart = 0;
        int byteStart = 0;
        while (true) {
            int j = lineStart;
            while (j < n && source.charAt(j) != '\n' && source.charAt(j) != '\r') j++;
            Line line = new Line(source.substring(lineStart, j), byteStart);
            result.add(line);
            if (j >= n) break;
            int terminator = source.charAt(j) == '\r' && j + 1 < n && source.charAt(j + 1) == '\n' ? 2 : 1;
            byteStart = line.byteEnd() + terminator;
            lineStart = j + terminator;
        }
        return result;
    }

    /** 一行源码（不含行终止符）及其字符 → 字节偏移表 */
    private static final class Line {
        final String text;
        final int byteStart;
        final int[] columns;

        Line(String text, int byteStart) {
            this.text = text;
            this.byteStart = byteStart;
            this.columns = utf8Columns(text);
        }

        int byteAt(int charIndex) {
            return byteStart + columns[Math.min(charIndex, text.length())];
        }

        int byteEnd() {
            return byteStart + columns[text.length()];
        }
    }

    /**
     * 每个 char 下标之前的 UTF-8 字节数；代理对的低位与高位映射到同一位置。
     * 孤立代理按编码器的替换字符计 1 字节。
     */
    static int[] utf8Columns(String s) {
        int len = s.length();
        int[] columns = new int[len + 1];
        int bytes = 0;
        int i = 0;
        while (i < len) {
            char c = s.charAt(i);
            columns[i] = bytes;
            if (Character.isHighSurrogate(c) && i + 1 < len && Character.isLowSurrogate(s.charAt(i + 1))) {
                columns[i + 1] = bytes;
                bytes += 4;
                i += 2;
                continue;
            }
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isSurrogate(c)) {
                bytes += 1;
            } else {
                bytes += 3;
            }
            i++;
        }
        columns[len] = bytes;
        return columns;
    }
}
