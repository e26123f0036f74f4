package com.cooklang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.*;

/**
 * 语义令牌生成器
 *
 * <p>对扫描器切分出的元素生成 LSP 语义令牌（相对编码格式）。</p>
 */
public class SemanticTokensBuilder {

    // === 令牌类型 ===
    private static final String[] TOKEN_TYPES = {
            "variable",     // 0 食材
            "class",        // 1 厨具
            "function",     // 2 计时器
            "number",       // 3 数量（保留）
            "string",       // 4 单位（保留）
            "comment",      // 5
            "keyword",      // 6 元数据
            "property",     // 7 元数据值（保留）
            "namespace",    // 8 分节
    };

    static final int TYPE_INGREDIENT = 0;
    static final int TYPE_COOKWARE = 1;
    static final int TYPE_TIMER = 2;
    static final int TYPE_COMMENT = 5;
    static final int TYPE_METADATA = 6;
    static final int TYPE_SECTION = 8;

    public static JsonArray getTokenTypesJson() {
        JsonArray arr = new JsonArray();
        for (String t : TOKEN_TYPES) arr.add(t);
        return arr;
    }

    /**
     * semanticTokensProvider 能力声明（无修饰符，仅支持全量）
     */
    public static JsonObject getLegendCapability() {
        JsonObject legend = new JsonObject();
        legend.add("tokenTypes", getTokenTypesJson());
        legend.add("tokenModifiers", new JsonArray());
        JsonObject provider = new JsonObject();
        provider.add("legend", legend);
        provider.addProperty("full", true);
        provider.addProperty("range", false);
        return provider;
    }

    /** 原始令牌条目（绝对位置） */
    private static class RawToken implements Comparable<RawToken> {
        final int line;      // 0-based
        final int startChar; // UTF-16
        final int length;
        final int tokenType;

        RawToken(int line, int startChar, int length, int tokenType) {
            this.line = line;
            this.startChar = startChar;
            this.length = length;
            this.tokenType = tokenType;
        }

        @Override
        public int compareTo(RawToken o) {
            int cmp = Integer.compare(this.line, o.line);
            return cmp != 0 ? cmp : Integer.compare(this.startChar, o.startChar);
        }
    }

    private final List<RawToken> tokens = new ArrayList<>();

    private void addToken(PositionIndex index, ElementSpan span, int tokenType) {
        int length = index.utf16Length(span.getStart(), span.getEnd());
        if (length <= 0) return;
        Position start = index.positionOf(span.getStart());
        tokens.add(new RawToken(start.getLine(), start.getCharacter(), length, tokenType));
    }

    /**
     * 从文档快照生成语义令牌数据数组
     */
    public int[] build(Document document) {
        tokens.clear();
        PositionIndex index = document.getIndex();
        for (ElementSpan span : MarkerScanner.tokenize(document.getBytes())) {
            addToken(index, span, tokenType(span.getKind()));
        }

        // 排序 + 编码为相对格式
        Collections.sort(tokens);

        int[] data = new int[tokens.size() * 5];
        int prevLine = 0, prevChar = 0;
        for (int i = 0; i < tokens.size(); i++) {
            RawToken t = tokens.get(i);
            int deltaLine = t.line - prevLine;
            int deltaChar = deltaLine == 0 ? t.startChar - prevChar : t.startChar;
            data[i * 5] = deltaLine;
            data[i * 5 + 1] = deltaChar;
            data[i * 5 + 2] = t.length;
            data[i * 5 + 3] = t.tokenType;
            data[i * 5 + 4] = 0;
            prevLine = t.line;
            prevChar = t.startChar;
        }
        return data;
    }

    static int tokenType(ElementKind kind) {
        switch (kind) {
            case INGREDIENT: return TYPE_INGREDIENT;
            case COOKWARE: return TYPE_COOKWARE;
            case TIMER: return TYPE_TIMER;
            case COMMENT: return TYPE_COMMENT;
            case METADATA: return TYPE_METADATA;
            default: return TYPE_SECTION;
        }
    }
}
