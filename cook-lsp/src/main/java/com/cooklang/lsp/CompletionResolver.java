package com.cooklang.lsp;

import com.cooklang.parser.model.Cookware;
import com.cooklang.parser.model.Ingredient;
import com.cooklang.parser.model.Recipe;
import com.cooklang.parser.model.Timer;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 补全解析
 *
 * <p>根据光标处的补全上下文给出候选项：</p>
 * <ul>
 *   <li>食材名称：当前文档 → 其他打开的文档 → aisle.conf → 常用食材</li>
 *   <li>厨具名称：当前文档 → 其他打开的文档 → 常用厨具</li>
 *   <li>计时器名称：当前文档 → 其他打开的文档</li>
 *   <li>数量：代码片段</li>
 *   <li>单位：计量单位 → 时间单位（计时器只给时间单位）</li>
 * </ul>
 */
public class CompletionResolver {
    private static final Logger LOG = Logger.getLogger(CompletionResolver.class.getName());

    static final List<String> COMMON_INGREDIENTS = Collections.unmodifiableList(Arrays.asList(
            "salt", "pepper", "olive oil", "vegetable oil", "butter", "garlic", "onion", "water",
            "chicken broth", "beef broth", "flour", "sugar", "eggs", "milk", "cream", "cheese",
            "tomato", "lemon", "lime", "parsley", "cilantro", "basil", "oregano", "thyme",
            "rosemary", "cumin", "paprika", "cinnamon", "vanilla", "honey", "soy sauce", "vinegar", "wine"
    ));

    static final List<String> COMMON_COOKWARE = Collections.unmodifiableList(Arrays.asList(
            "pot", "pan", "skillet", "saucepan", "wok", "dutch oven", "stockpot", "frying pan",
            "bowl", "mixing bowl", "large bowl", "small bowl", "cutting board", "knife", "chef's knife",
            "paring knife", "oven", "stove", "grill", "blender", "food processor", "mixer", "stand mixer",
            "whisk", "spatula", "wooden spoon", "ladle", "tongs", "colander", "strainer", "sieve",
            "baking sheet", "baking dish", "roasting pan", "casserole dish", "measuring cup",
            "measuring spoons", "rolling pin", "grater", "peeler", "can opener", "thermometer",
            "timer", "foil", "parchment paper", "plastic wrap"
    ));

    /** 时间单位（简写, 全称） */
    static final String[][] TIME_UNITS = {
            {"s", "seconds"}, {"sec", "seconds"}, {"secs", "seconds"}, {"second", "seconds"}, {"seconds", "seconds"},
            {"min", "minutes"}, {"mins", "minutes"}, {"minute", "minutes"}, {"minutes", "minutes"},
            {"h", "hours"}, {"hr", "hours"}, {"hrs", "hours"}, {"hour", "hours"}, {"hours", "hours"},
    };

    private static final String UNITS_RESOURCE = "units.txt";

    private final DocumentManager documents;
    private final AisleConfig aisle;

    public CompletionResolver(DocumentManager documents, AisleConfig aisle) {
        this.documents = documents;
        this.aisle = aisle;
    }

    /**
     * 计算补全项
     *
     * @param document 当前文档快照
     * @param offset   光标字节偏移
     */
    public JsonArray complete(Document document, int offset) {
        CompletionContext context = MarkerScanner.completionContext(document.getBytes(), offset);
        switch (context.getType()) {
            case NAME:
                switch (context.getKind()) {
                    case INGREDIENT: return completeIngredients(document, context.getPrefix());
                    case COOKWARE: return completeCookware(document, context.getPrefix());
                    default: return completeTimerNames(document, context.getPrefix());
                }
            case QUANTITY:
                return completeQuantity(context.getKind());
            case UNIT:
                return completeUnits(context.getKind(), context.getPrefix());
            default:
                return new JsonArray();
        }
    }

    // ============ 名称 ============

    private JsonArray completeIngredients(Document document, String prefix) {
        CompletionCandidates candidates = new CompletionCandidates(prefix);

        Recipe recipe = document.getRecipe();
        if (recipe != null) {
            for (Ingredient ingredient : recipe.getIngredients()) {
                JsonObject item = LspJson.completionItem(ingredient.getName(),
                        LspConstants.COMPLETION_VARIABLE, "Ingredient (from recipe)");
                item.addProperty("insertText", ingredient.getName() + "{}");
                item.addProperty("insertTextFormat", LspConstants.INSERT_TEXT_PLAIN);
                candidates.add(item);
            }
        }

        for (Recipe other : otherRecipes(document)) {
            for (Ingredient ingredient : other.getIngredients()) {
                candidates.add(LspJson.completionItem(ingredient.getName(),
                        LspConstants.COMPLETION_VARIABLE, "Ingredient (from workspace)"));
            }
        }

        for (AliasTable.Entry entry : aisle.getTable().getEntries()) {
            String detail = entry.isAlias()
                    ? entry.getCategory() + " (alias for " + entry.getCanonicalName() + ")"
                    : entry.getCategory();
            JsonObject item = LspJson.completionItem(entry.getName(), LspConstants.COMPLETION_VARIABLE, detail);
            item.addProperty("documentation", "From aisle.conf - " + entry.getCategory());
            candidates.add(item);
        }

        for (String name : COMMON_INGREDIENTS) {
            candidates.add(LspJson.completionItem(name, LspConstants.COMPLETION_VARIABLE, "Common ingredient"));
        }
        return candidates.toJson();
    }

    private JsonArray completeCookware(Document document, String prefix) {
        CompletionCandidates candidates = new CompletionCandidates(prefix);

        Recipe recipe = document.getRecipe();
        if (recipe != null) {
            for (Cookware cookware : recipe.getCookware()) {
                candidates.add(LspJson.completionItem(cookware.getName(),
                        LspConstants.COMPLETION_CLASS, "Cookware (from recipe)"));
            }
        }
        for (Recipe other : otherRecipes(document)) {
            for (Cookware cookware : other.getCookware()) {
                candidates.add(LspJson.completionItem(cookware.getName(),
                        LspConstants.COMPLETION_CLASS, "Cookware (from workspace)"));
            }
        }
        for (String name : COMMON_COOKWARE) {
            candidates.add(LspJson.completionItem(name, LspConstants.COMPLETION_CLASS, "Common cookware"));
        }
        return candidates.toJson();
    }

    private JsonArray completeTimerNames(Document document, String prefix) {
        CompletionCandidates candidates = new CompletionCandidates(prefix);

        Recipe recipe = document.getRecipe();
        if (recipe != null) {
            addTimers(candidates, recipe, "Timer (from recipe)");
        }
        for (Recipe other : otherRecipes(document)) {
            addTimers(candidates, other, "Timer (from workspace)");
        }
        return candidates.toJson();
    }

    private static void addTimers(CompletionCandidates candidates, Recipe recipe, String detail) {
        for (Timer timer : recipe.getTimers()) {
            if (timer.getName() == null) continue;
            JsonObject item = LspJson.completionItem(timer.getName(), LspConstants.COMPLETION_FUNCTION, detail);
            if (timer.getQuantity() != null) {
                item.addProperty("documentation", "Duration: " + timer.getQuantity());
            }
            candidates.add(item);
        }
    }

    /** 其他打开文档中成功解析的菜谱 */
    private List<Recipe> otherRecipes(Document document) {
        List<Recipe> recipes = new ArrayList<>();
        for (Document other : documents.snapshots()) {
            if (other.getUri().equals(document.getUri())) continue;
            Recipe recipe = other.getRecipe();
            if (recipe != null) recipes.add(recipe);
        }
        return recipes;
    }

    // ============ 数量与单位 ============

    private static JsonArray completeQuantity(ElementKind kind) {
        JsonArray items = new JsonArray();
        if (kind == ElementKind.TIMER) {
            items.add(snippet("duration with unit", "${1:amount}%${2:min}", "Insert duration with time unit"));
            return items;
        }
        items.add(snippet("quantity with unit", "${1:amount}%${2:unit}", "Insert quantity with unit"));
        items.add(snippet("quantity only", "${1:amount}", "Insert quantity without unit"));
        return items;
    }

    private static JsonObject snippet(String label, String insertText, String detail) {
        JsonObject item = LspJson.completionItem(label, LspConstants.COMPLETION_SNIPPET, detail);
        item.addProperty("insertText", insertText);
        item.addProperty("insertTextFormat", LspConstants.INSERT_TEXT_SNIPPET);
        return item;
    }

    private static JsonArray completeUnits(ElementKind kind, String prefix) {
        CompletionCandidates candidates = new CompletionCandidates(prefix);
        if (kind != ElementKind.TIMER) {
            for (String[] unit : UnitsHolder.UNITS) {
                candidates.add(LspJson.completionItem(unit[0], LspConstants.COMPLETION_UNIT, unit[1]));
            }
        }
        for (String[] unit : TIME_UNITS) {
            JsonObject item = LspJson.completionItem(unit[0], LspConstants.COMPLETION_UNIT,
                    kind == ElementKind.TIMER ? unit[1] : unit[1] + " (time)");
            item.addProperty("documentation", "Time unit: " + unit[1]);
            candidates.add(item);
        }
        return candidates.toJson();
    }

    /** 计量单位表，首次使用时从资源加载 */
    private static final class UnitsHolder {
        static final List<String[]> UNITS = loadUnits();
    }

    static List<String[]> loadUnits() {
        List<String[]> units = new ArrayList<>();
        InputStream in = CompletionResolver.class.getResourceAsStream(UNITS_RESOURCE);
        if (in == null) {
            LOG.warning("找不到单位资源: " + UNITS_RESOURCE);
            return units;
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String[] unit = parseUnitLine(line);
                if (unit != null) units.add(unit);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读取单位资源失败: " + UNITS_RESOURCE, e);
        }
        return units;
    }

    /**
     * 解析 {@code short = long} 行，空行、注释与格式错误的行返回 null
     */
    static String[] parseUnitLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) return null;
        String[] parts = trimmed.split("=", -1);
        if (parts.length != 2) return null;
        String shortName = parts[0].trim();
        String longName = parts[1].trim();
        if (shortName.isEmpty() || longName.isEmpty()) return null;
        return new String[]{shortName, longName};
    }
}
