package com.cooklang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OutlineBuilder 测试")
class OutlineBuilderTest {

    private static final String RECIPE = "---\n"
            + "title: Pancakes\n"
            + "servings: 4\n"
            + "---\n"
            + "Mix @flour{200%g} and @milk{300%ml} in a #bowl.\n"
            + "\n"
            + "== Cook ==\n"
            + "Fry for ~{3%min}.\n";

    private DocumentManager documents;
    private OutlineBuilder builder;

    @BeforeEach
    void setUp() {
        documents = new DocumentManager();
        builder = new OutlineBuilder();
    }

    private JsonArray build(String content) {
        return builder.build(documents.open("file:///test.cook", 1, content));
    }

    private static List<String> names(JsonArray symbols) {
        List<String> names = new ArrayList<>();
        for (JsonElement symbol : symbols) {
            names.add(symbol.getAsJsonObject().get("name").getAsString());
        }
        return names;
    }

    private static JsonObject byName(JsonArray symbols, String name) {
        for (JsonElement symbol : symbols) {
            if (symbol.getAsJsonObject().get("name").getAsString().equals(name)) return symbol.getAsJsonObject();
        }
        return null;
    }

    @Test
    @DisplayName("顶层顺序：元数据、分节、食材、厨具、计时器")
    void testTopLevelOrder() {
        assertThat(names(build(RECIPE)))
                .containsExactly("Metadata", "Steps", "Cook", "Ingredients", "Cookware", "Timers");
    }

    @Test
    @DisplayName("元数据容器包含各个属性")
    void testMetadata() {
        JsonObject metadata = byName(build(RECIPE), "Metadata");
        assertThat(metadata.get("detail").getAsString()).isEqualTo("2 properties");
        assertThat(metadata.get("kind").getAsInt()).isEqualTo(LspConstants.SYMBOL_NAMESPACE);

        JsonArray children = metadata.getAsJsonArray("children");
        assertThat(names(children)).containsExactly("title", "servings");
        JsonObject title = children.get(0).getAsJsonObject();
        assertThat(title.get("detail").getAsString()).isEqualTo("Pancakes");
        assertThat(title.get("kind").getAsInt()).isEqualTo(LspConstants.SYMBOL_PROPERTY);
        assertThat(title.getAsJsonObject("range").getAsJsonObject("start").get("line").getAsInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("分节给出步骤数")
    void testSections() {
        JsonArray symbols = build(RECIPE);
        assertThat(byName(symbols, "Steps").get("detail").getAsString()).isEqualTo("1 steps");
        JsonObject cook = byName(symbols, "Cook");
        assertThat(cook.get("detail").getAsString()).isEqualTo("1 steps");
        assertThat(cook.getAsJsonObject("range").getAsJsonObject("start").get("line").getAsInt()).isEqualTo(6);
    }

    @Test
    @DisplayName("组件容器的范围覆盖所有子项")
    void testComponentContainers() {
        JsonArray symbols = build(RECIPE);

        JsonObject ingredients = byName(symbols, "Ingredients");
        assertThat(ingredients.get("detail").getAsString()).isEqualTo("2 items");
        JsonArray children = ingredients.getAsJsonArray("children");
        assertThat(names(children)).containsExactly("flour", "milk");
        assertThat(children.get(0).getAsJsonObject().get("detail").getAsString()).isEqualTo("200 g");
        assertThat(children.get(0).getAsJsonObject().get("kind").getAsInt()).isEqualTo(LspConstants.SYMBOL_VARIABLE);

        JsonObject range = ingredients.getAsJsonObject("range");
        assertThat(range.getAsJsonObject("start").get("line").getAsInt()).isEqualTo(4);
        assertThat(range.getAsJsonObject("start").get("character").getAsInt()).isEqualTo(4);
        assertThat(range.getAsJsonObject("end").get("line").getAsInt()).isEqualTo(4);
        assertThat(range.getAsJsonObject("end").get("character").getAsInt()).isEqualTo(35);
        assertThat(ingredients.get("selectionRange")).isEqualTo(range);

        JsonObject cookware = byName(symbols, "Cookware");
        JsonObject bowl = cookware.getAsJsonArray("children").get(0).getAsJsonObject();
        assertThat(bowl.get("name").getAsString()).isEqualTo("bowl");
        assertThat(bowl.has("detail")).isFalse();
        assertThat(bowl.get("kind").getAsInt()).isEqualTo(LspConstants.SYMBOL_CLASS);

        JsonObject timer = byName(symbols, "Timers").getAsJsonArray("children").get(0).getAsJsonObject();
        assertThat(timer.get("name").getAsString()).isEqualTo("Timer");
        assertThat(timer.get("detail").getAsString()).isEqualTo("3 min");
        assertThat(timer.get("kind").getAsInt()).isEqualTo(LspConstants.SYMBOL_FUNCTION);
    }

    @Test
    @DisplayName("空的类别不出现")
    void testEmptyCategoriesOmitted() {
        assertThat(names(build("Just a step."))).containsExactly("Steps");
        assertThat(names(build("Add @salt."))).containsExactly("Steps", "Ingredients");
    }

    @Test
    @DisplayName("没有结构化结果时大纲为空")
    void testNoRecipe() {
        assertThat(build("@flour{200%g")).isEmpty();
        assertThat(build("")).isEmpty();
    }
}
