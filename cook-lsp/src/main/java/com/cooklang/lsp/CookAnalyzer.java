package com.cooklang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Cooklang 分析器
 *
 * <p>按 URI 取出文档快照，把 LSP 位置换算为字节偏移后交给各个解析器。
 * 未打开的文档返回空结果。</p>
 */
public class CookAnalyzer {

    private final DocumentManager documents;
    private final CompletionResolver completion;
    private final HoverResolver hover = new HoverResolver();
    private final OutlineBuilder outline = new OutlineBuilder();
    private final DiagnosticsBuilder diagnostics = new DiagnosticsBuilder();

    public CookAnalyzer(DocumentManager documents, AisleConfig aisle) {
        this.documents = documents;
        this.completion = new CompletionResolver(documents, aisle);
    }

    // ============ 诊断 ============

    public JsonArray diagnostics(String uri) {
        Document document = documents.get(uri);
        if (document == null) return new JsonArray();
        return diagnostics.build(document);
    }

    // ============ 补全 ============

    public JsonArray complete(String uri, int line, int character) {
        Document document = documents.get(uri);
        if (document == null) return new JsonArray();
        int offset = document.getIndex().offsetOf(line, character);
        return completion.complete(document, offset);
    }

    // ============ 悬停 ============

    /**
     * @return hover 对象，没有可描述的元素时返回 null
     */
    public JsonObject hover(String uri, int line, int character) {
        Document document = documents.get(uri);
        if (document == null) return null;
        int offset = document.getIndex().offsetOf(line, character);
        return hover.hover(document, offset);
    }

    // ============ 文档符号 ============

    public JsonArray documentSymbols(String uri) {
        Document document = documents.get(uri);
        if (document == null) return new JsonArray();
        return outline.build(document);
    }

    // ============ 语义令牌 ============

    public JsonObject semanticTokens(String uri) {
        JsonArray data = new JsonArray();
        Document document = documents.get(uri);
        if (document != null) {
            // 每次请求新建 builder，请求在线程池中并发执行
            int[] encoded = new SemanticTokensBuilder().build(document);
            for (int value : encoded) data.add(value);
        }
        JsonObject result = new JsonObject();
        result.add("data", data);
        return result;
    }
}
