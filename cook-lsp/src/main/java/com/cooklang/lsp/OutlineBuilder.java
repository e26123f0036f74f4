package com.cooklang.lsp;

import com.cooklang.parser.model.*;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * 文档大纲（textDocument/documentSymbol）
 *
 * <p>顶层依次为 Metadata、各分节、Ingredients、Cookware、Timers；空的类别不出现。
 * 容器的范围覆盖其所有子项。</p>
 */
public class OutlineBuilder {

    public JsonArray build(Document document) {
        JsonArray symbols = new JsonArray();
        Recipe recipe = document.getRecipe();
        if (recipe == null) return symbols;
        PositionIndex index = document.getIndex();

        List<MetadataEntry> metadata = recipe.getMetadataEntries();
        if (!metadata.isEmpty()) {
            JsonArray children = new JsonArray();
            for (MetadataEntry entry : metadata) {
                children.add(symbol(index, entry.getKey(), entry.getValue(), LspConstants.SYMBOL_PROPERTY,
                        entry.getStart(), entry.getEnd()));
            }
            JsonObject container = symbol(index, "Metadata", recipe.getMetadata().size() + " properties",
                    LspConstants.SYMBOL_NAMESPACE,
                    metadata.get(0).getStart(), metadata.get(metadata.size() - 1).getEnd());
            container.add("children", children);
            symbols.add(container);
        }

        for (Section section : recipe.getSections()) {
            String name = section.getName() != null ? section.getName() : "Steps";
            symbols.add(symbol(index, name, section.getSteps().size() + " steps", LspConstants.SYMBOL_NAMESPACE,
                    section.getStart(), section.getEnd()));
        }

        List<Ingredient> ingredients = recipe.getIngredients();
        if (!ingredients.isEmpty()) {
            JsonArray children = new JsonArray();
            int start = Integer.MAX_VALUE;
            int end = 0;
            for (Ingredient ingredient : ingredients) {
                children.add(symbol(index, ingredient.getName(), quantityDetail(ingredient.getQuantity()),
                        LspConstants.SYMBOL_VARIABLE, ingredient.getStart(), ingredient.getEnd()));
                start = Math.min(start, ingredient.getStart());
                end = Math.max(end, ingredient.getEnd());
            }
            symbols.add(container(index, "Ingredients", children, start, end));
        }

        List<Cookware> cookware = recipe.getCookware();
        if (!cookware.isEmpty()) {
            JsonArray children = new JsonArray();
            int start = Integer.MAX_VALUE;
            int end = 0;
            for (Cookware item : cookware) {
                children.add(symbol(index, item.getName(), quantityDetail(item.getQuantity()),
                        LspConstants.SYMBOL_CLASS, item.getStart(), item.getEnd()));
                start = Math.min(start, item.getStart());
                end = Math.max(end, item.getEnd());
            }
            symbols.add(container(index, "Cookware", children, start, end));
        }

        List<Timer> timers = recipe.getTimers();
        if (!timers.isEmpty()) {
            JsonArray children = new JsonArray();
            int start = Integer.MAX_VALUE;
            int end = 0;
            for (Timer timer : timers) {
                String name = timer.getName() != null ? timer.getName() : "Timer";
                children.add(symbol(index, name, quantityDetail(timer.getQuantity()),
                        LspConstants.SYMBOL_FUNCTION, timer.getStart(), timer.getEnd()));
                start = Math.min(start, timer.getStart());
                end = Math.max(end, timer.getEnd());
            }
            symbols.add(container(index, "Timers", children, start, end));
        }
        return symbols;
    }

    private static JsonObject container(PositionIndex index, String name, JsonArray children, int start, int end) {
        JsonObject container = symbol(index, name, children.size() + " items", LspConstants.SYMBOL_NAMESPACE,
                start, end);
        container.add("children", children);
        return container;
    }

    private static JsonObject symbol(PositionIndex index, String name, String detail, int kind, int start, int end) {
        JsonObject symbol = new JsonObject();
        symbol.addProperty("name", name.isEmpty() ? " " : name);
        if (detail != null) symbol.addProperty("detail", detail);
        symbol.addProperty("kind", kind);
        JsonObject range = LspJson.range(index, start, end);
        symbol.add("range", range);
        symbol.add("selectionRange", range);
        return symbol;
    }

    private static String quantityDetail(Quantity quantity) {
        return quantity != null ? quantity.toString() : null;
    }
}
