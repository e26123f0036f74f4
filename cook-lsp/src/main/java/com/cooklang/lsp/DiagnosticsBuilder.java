package com.cooklang.lsp;

import com.cooklang.parser.SourceDiagnostic;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * 文档诊断：先错误后警告，字节范围经位置索引转换为 LSP range
 */
public class DiagnosticsBuilder {

    public JsonArray build(Document document) {
        JsonArray diagnostics = new JsonArray();
        PositionIndex index = document.getIndex();
        for (SourceDiagnostic error : document.getErrors()) {
            diagnostics.add(toJson(index, error));
        }
        for (SourceDiagnostic warning : document.getWarnings()) {
            diagnostics.add(toJson(index, warning));
        }
        if (document.getRecipe() == null && document.getErrors().isEmpty()) {
            diagnostics.add(diagnostic(LspJson.range(new Position(0, 0), new Position(0, 0)),
                    LspConstants.SEVERITY_ERROR, "Failed to parse recipe"));
        }
        return diagnostics;
    }

    private static JsonObject toJson(PositionIndex index, SourceDiagnostic source) {
        int severity = source.isError() ? LspConstants.SEVERITY_ERROR : LspConstants.SEVERITY_WARNING;
        return diagnostic(LspJson.range(index, source.getStart(), source.getEnd()), severity, source.getMessage());
    }

    private static JsonObject diagnostic(JsonObject range, int severity, String message) {
        JsonObject diag = new JsonObject();
        diag.add("range", range);
        diag.addProperty("severity", severity);
        diag.addProperty("source", LspConstants.DIAGNOSTIC_SOURCE);
        diag.addProperty("message", message);
        return diag;
    }
}
