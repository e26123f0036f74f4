package com.cooklang.lsp;

import com.google.gson.JsonObject;

/**
 * LSP 结构的 JSON 构造工具
 */
final class LspJson {

    private LspJson() {}

    static JsonObject position(Position position) {
        JsonObject obj = new JsonObject();
        obj.addProperty("line", position.getLine());
        obj.addProperty("character", position.getCharacter());
        return obj;
    }

    static JsonObject range(Position start, Position end) {
        JsonObject range = new JsonObject();
        range.add("start", position(start));
        range.add("end", position(end));
        return range;
    }

    /** 字节范围 [start, end) 转为 LSP range */
    static JsonObject range(PositionIndex index, int start, int end) {
        return range(index.positionOf(start), index.positionOf(Math.max(start, end)));
    }

    static JsonObject hover(String markdownContent, JsonObject range) {
        JsonObject hover = new JsonObject();
        JsonObject contents = new JsonObject();
        contents.addProperty("kind", "markdown");
        contents.addProperty("value", markdownContent);
        hover.add("contents", contents);
        if (range != null) hover.add("range", range);
        return hover;
    }

    static JsonObject completionItem(String label, int kind, String detail) {
        JsonObject item = new JsonObject();
        item.addProperty("label", label);
        item.addProperty("kind", kind);
        if (detail != null) item.addProperty("detail", detail);
        return item;
    }
}
