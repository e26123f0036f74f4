package com.cooklang.parser;

import com.cooklang.parser.model.Recipe;

import java.util.Collections;
import java.util.List;

/**
 * 容错解析的结果：菜谱结构（存在错误时为 null）以及收集到的错误和警告
 */
public final class ParseResult {
    private final Recipe recipe;
    private final List<SourceDiagnostic> errors;
    private final List<SourceDiagnostic> warnings;

    public ParseResult(Recipe recipe, List<SourceDiagnostic> errors, List<SourceDiagnostic> warnings) {
        this.recipe = recipe;
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    /** 仅包含一条错误、没有菜谱结构的结果 */
    public static ParseResult failure(SourceDiagnostic error) {
        return new ParseResult(null, Collections.singletonList(error), Collections.<SourceDiagnostic>emptyList());
    }

    public Recipe getRecipe() {
        return recipe;
    }

    public boolean hasRecipe() {
        return recipe != null;
    }

    public List<SourceDiagnostic> getErrors() {
        return errors;
    }

    public List<SourceDiagnostic> getWarnings() {
        return warnings;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
