package com.cooklang.lsp;

import com.cooklang.parser.model.Cookware;
import com.cooklang.parser.model.Ingredient;
import com.cooklang.parser.model.Quantity;
import com.cooklang.parser.model.Recipe;
import com.cooklang.parser.model.Timer;
import com.google.gson.JsonObject;

/**
 * 悬停解析
 *
 * <p>先由扫描器确定光标处的元素，再在结构化解析结果中按名称（忽略大小写）查找；
 * 没有结构化结果或找不到时给出通用描述。分节、元数据与注释直接由原文生成。</p>
 */
public class HoverResolver {

    /**
     * @return hover 对象，光标不在任何元素上时返回 null
     */
    public JsonObject hover(Document document, int offset) {
        ElementSpan span = MarkerScanner.elementAt(document.getBytes(), offset);
        if (span == null) return null;
        String markdown = describe(document.getRecipe(), span);
        return LspJson.hover(markdown, LspJson.range(document.getIndex(), span.getStart(), span.getEnd()));
    }

    String describe(Recipe recipe, ElementSpan span) {
        switch (span.getKind()) {
            case INGREDIENT:
                return describeIngredient(recipe, span.getName());
            case COOKWARE:
                return describeCookware(recipe, span.getName());
            case TIMER:
                return describeTimer(recipe, span);
            case SECTION:
                return "**Section:** " + stripEquals(span.getText().trim());
            case METADATA:
                return "**Metadata:** " + stripLeading(span.getText(), '>').trim();
            default:
                return "**Comment**";
        }
    }

    private static String describeIngredient(Recipe recipe, String name) {
        if (recipe != null) {
            for (Ingredient ingredient : recipe.getIngredients()) {
                if (ingredient.getName().equalsIgnoreCase(name)) {
                    StringBuilder sb = new StringBuilder("**Ingredient:** ").append(ingredient.getName());
                    if (ingredient.getQuantity() != null) {
                        sb.append("\n\n**Quantity:** ").append(ingredient.getQuantity());
                    }
                    if (ingredient.getNote() != null) {
                        sb.append("\n\n**Note:** ").append(ingredient.getNote());
                    }
                    return sb.toString();
                }
            }
        }
        return "**Ingredient:** " + name;
    }

    private static String describeCookware(Recipe recipe, String name) {
        if (recipe != null) {
            for (Cookware cookware : recipe.getCookware()) {
                if (cookware.getName().equalsIgnoreCase(name)) {
                    StringBuilder sb = new StringBuilder("**Cookware:** ").append(cookware.getName());
                    if (cookware.getQuantity() != null) {
                        sb.append("\n\n**Quantity:** ").append(cookware.getQuantity());
                    }
                    return sb.toString();
                }
            }
        }
        return "**Cookware:** " + name;
    }

    private static String describeTimer(Recipe recipe, ElementSpan span) {
        String name = span.getName();
        if (recipe != null) {
            for (Timer timer : recipe.getTimers()) {
                boolean match = name.isEmpty()
                        ? timer.getName() == null && sameQuantity(timer.getQuantity(), span.getBraceContent())
                        : name.equalsIgnoreCase(timer.getName());
                if (match) {
                    StringBuilder sb = new StringBuilder();
                    sb.append(timer.getName() != null ? "**Timer:** " + timer.getName() : "**Timer**");
                    if (timer.getQuantity() != null) {
                        sb.append("\n\n**Duration:** ").append(timer.getQuantity());
                    }
                    return sb.toString();
                }
            }
        }
        return "**Timer:** " + (name.isEmpty() ? "unnamed" : name);
    }

    /** 花括号原文（{@code 值%单位}）与解析出的数量是否一致 */
    private static boolean sameQuantity(Quantity quantity, String braceContent) {
        if (quantity == null || braceContent == null) return false;
        String value = braceContent;
        String unit = null;
        int percent = braceContent.indexOf('%');
        if (percent >= 0) {
            value = braceContent.substring(0, percent);
            unit = braceContent.substring(percent + 1).trim();
            if (unit.isEmpty()) unit = null;
        }
        if (!value.trim().equalsIgnoreCase(quantity.getValue())) return false;
        return unit == null ? !quantity.hasUnit() : unit.equalsIgnoreCase(quantity.getUnit());
    }

    private static String stripEquals(String text) {
        int from = 0;
        int to = text.length();
        while (from < to && text.charAt(from) == '=') from++;
        while (to > from && text.charAt(to - 1) == '=') to--;
        return text.substring(from, to).trim();
    }

    private static String stripLeading(String text, char c) {
        int i = 0;
        while (i < text.length() && text.charAt(i) == c) i++;
        return text.substring(i);
    }
}
