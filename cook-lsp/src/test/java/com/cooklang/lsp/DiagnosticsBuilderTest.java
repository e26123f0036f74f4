package com.cooklang.lsp;

import com.cooklang.parser.ParseResult;
import com.cooklang.parser.SourceDiagnostic;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DiagnosticsBuilder 测试")
class DiagnosticsBuilderTest {

    private final DiagnosticsBuilder builder = new DiagnosticsBuilder();

    private JsonArray build(DocumentManager documents, String content) {
        return builder.build(documents.open("file:///test.cook", 1, content));
    }

    @Test
    @DisplayName("错误在前，警告在后")
    void testErrorsBeforeWarnings() {
        JsonArray diagnostics = build(new DocumentManager(), "Let it ~rest.\n@flour{200%g");
        assertThat(diagnostics.size()).isEqualTo(2);

        JsonObject error = diagnostics.get(0).getAsJsonObject();
        assertThat(error.get("severity").getAsInt()).isEqualTo(LspConstants.SEVERITY_ERROR);
        assertThat(error.get("message").getAsString()).isEqualTo("Unclosed '{' in ingredient");
        assertThat(error.get("source").getAsString()).isEqualTo("cooklang");
        JsonObject range = error.getAsJsonObject("range");
        assertThat(range.getAsJsonObject("start").get("line").getAsInt()).isEqualTo(1);
        assertThat(range.getAsJsonObject("start").get("character").getAsInt()).isEqualTo(0);
        assertThat(range.getAsJsonObject("end").get("character").getAsInt()).isEqualTo(12);

        JsonObject warning = diagnostics.get(1).getAsJsonObject();
        assertThat(warning.get("severity").getAsInt()).isEqualTo(LspConstants.SEVERITY_WARNING);
        assertThat(warning.get("message").getAsString()).isEqualTo("Timer without duration");
    }

    @Test
    @DisplayName("诊断范围以 UTF-16 列表示")
    void testUtf16Range() {
        JsonArray diagnostics = build(new DocumentManager(), "😀 @番茄{2");
        JsonObject range = diagnostics.get(0).getAsJsonObject().getAsJsonObject("range");
        assertThat(range.getAsJsonObject("start").get("character").getAsInt()).isEqualTo(3);
        assertThat(range.getAsJsonObject("end").get("character").getAsInt()).isEqualTo(8);
    }

    @Test
    @DisplayName("没有问题时诊断为空")
    void testClean() {
        assertThat(build(new DocumentManager(), "Mix @flour{200%g} in a #bowl.")).isEmpty();
    }

    @Test
    @DisplayName("没有结构化结果也没有错误时给出通用错误")
    void testGenericFailure() {
        DocumentManager documents = new DocumentManager(content -> new ParseResult(null,
                Collections.<SourceDiagnostic>emptyList(), Collections.<SourceDiagnostic>emptyList()));
        JsonArray diagnostics = build(documents, "anything");
        assertThat(diagnostics.size()).isEqualTo(1);
        JsonObject diag = diagnostics.get(0).getAsJsonObject();
        assertThat(diag.get("message").getAsString()).isEqualTo("Failed to parse recipe");
        assertThat(diag.getAsJsonObject("range").getAsJsonObject("start").get("line").getAsInt()).isZero();
    }
}
