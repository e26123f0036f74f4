package com.cooklang.parser.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析得到的菜谱结构
 */
public final class Recipe {
    private final List<MetadataEntry> metadata;
    private final List<Section> sections;
    private final List<Ingredient> ingredients;
    private final List<Cookware> cookware;
    private final List<Timer> timers;

    public Recipe(List<MetadataEntry> metadata, List<Section> sections,
                  List<Ingredient> ingredients, List<Cookware> cookware, List<Timer> timers) {
        this.metadata = Collections.unmodifiableList(metadata);
        this.sections = Collections.unmodifiableList(sections);
        this.ingredients = Collections.unmodifiableList(ingredients);
        this.cookware = Collections.unmodifiableList(cookware);
        this.timers = Collections.unmodifiableList(timers);
    }

    public List<MetadataEntry> getMetadataEntries() {
        return metadata;
    }

    /** 元数据键值表（同名键后者覆盖前者，保持首次出现的顺序） */
    public Map<String, String> getMetadata() {
        Map<String, String> map = new LinkedHashMap<>();
        for (MetadataEntry entry : metadata) {
            map.put(entry.getKey(), entry.getValue());
        }
        return map;
    }

    public List<Section> getSections() {
        return sections;
    }

    public List<Ingredient> getIngredients() {
        return ingredients;
    }

    public List<Cookware> getCookware() {
        return cookware;
    }

    public List<Timer> getTimers() {
        return timers;
    }
}
