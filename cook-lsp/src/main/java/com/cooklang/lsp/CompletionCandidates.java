package com.cooklang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 按优先级收集补全项
 *
 * <p>先加入的来源优先；label 忽略大小写去重，先出现者保留。
 * 只接受 label 以前缀开头（忽略大小写）的候选。</p>
 */
final class CompletionCandidates {
    private final String prefix;
    private final Set<String> seen = new HashSet<>();
    private final JsonArray items = new JsonArray();

    CompletionCandidates(String prefix) {
        this.prefix = prefix == null ? "" : prefix.toLowerCase(Locale.ROOT);
    }

    boolean matches(String label) {
        return label != null && label.toLowerCase(Locale.ROOT).startsWith(prefix);
    }

    /**
     * 加入候选项
     *
     * @return 是否被接受
     */
    boolean add(JsonObject item) {
        String label = item.get("label").getAsString();
        if (!matches(label)) return false;
        if (!seen.add(label.toLowerCase(Locale.ROOT))) return false;
        items.add(item);
        return true;
    }

    JsonArray toJson() {
        return items;
    }
}
