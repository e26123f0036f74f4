package com.cooklang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SemanticTokensBuilder 测试")
class SemanticTokensBuilderTest {

    private DocumentManager documents;

    @BeforeEach
    void setUp() {
        documents = new DocumentManager();
    }

    private int[] build(String content) {
        return new SemanticTokensBuilder().build(documents.open("file:///test.cook", 1, content));
    }

    @Test
    @DisplayName("图例顺序与令牌类型编号一致")
    void testLegend() {
        JsonArray types = SemanticTokensBuilder.getTokenTypesJson();
        assertThat(types.size()).isEqualTo(9);
        assertThat(types.get(SemanticTokensBuilder.TYPE_INGREDIENT).getAsString()).isEqualTo("variable");
        assertThat(types.get(SemanticTokensBuilder.TYPE_COOKWARE).getAsString()).isEqualTo("class");
        assertThat(types.get(SemanticTokensBuilder.TYPE_TIMER).getAsString()).isEqualTo("function");
        assertThat(types.get(SemanticTokensBuilder.TYPE_COMMENT).getAsString()).isEqualTo("comment");
        assertThat(types.get(SemanticTokensBuilder.TYPE_METADATA).getAsString()).isEqualTo("keyword");
        assertThat(types.get(SemanticTokensBuilder.TYPE_SECTION).getAsString()).isEqualTo("namespace");

        JsonObject provider = SemanticTokensBuilder.getLegendCapability();
        assertThat(provider.get("full").getAsBoolean()).isTrue();
        assertThat(provider.get("range").getAsBoolean()).isFalse();
        assertThat(provider.getAsJsonObject("legend").getAsJsonArray("tokenTypes")).isEqualTo(types);
    }

    @Test
    @DisplayName("注释、分节与食材的增量编码")
    void testLineElements() {
        assertThat(build("-- note\n=Section=\n@salt{1%tsp}"))
                .containsExactly(0, 0, 7, 5, 0, 1, 0, 9, 8, 0, 1, 0, 12, 0, 0);
    }

    @Test
    @DisplayName("同一行多个令牌使用相对列")
    void testSameLine() {
        assertThat(build("Add @salt and #pan"))
                .containsExactly(0, 4, 5, 0, 0, 0, 10, 4, 1, 0);
    }

    @Test
    @DisplayName("列与长度以 UTF-16 单位计")
    void testUtf16Columns() {
        assertThat(build("é @salt")).containsExactly(0, 2, 5, 0, 0);
        assertThat(build("😀 ~{5%min}")).containsExactly(0, 3, 8, 2, 0);
        assertThat(build("@番茄{2}")).containsExactly(0, 0, 6, 0, 0);
    }

    @Test
    @DisplayName("元数据行与 front matter 分隔线")
    void testMetadata() {
        assertThat(build("---\ntitle: x\n---\n>> servings: 2"))
                .containsExactly(0, 0, 3, 6, 0, 2, 0, 3, 6, 0, 1, 0, 14, 6, 0);
    }

    @Test
    @DisplayName("解析失败的文档仍有令牌")
    void testBrokenDocument() {
        assertThat(build("@flour{200%g")).containsExactly(0, 0, 12, 0, 0);
    }

    @Test
    @DisplayName("空文档没有令牌")
    void testEmpty() {
        assertThat(build("")).isEmpty();
        assertThat(build("just words\n\n")).isEmpty();
    }

    @Test
    @DisplayName("builder 可以重复使用")
    void testReuse() {
        SemanticTokensBuilder builder = new SemanticTokensBuilder();
        Document first = documents.open("file:///a.cook", 1, "@salt and @pepper");
        Document second = documents.open("file:///b.cook", 1, "#pan");
        assertThat(builder.build(first)).hasSize(10);
        assertThat(builder.build(second)).containsExactly(0, 0, 4, 1, 0);
    }
}
