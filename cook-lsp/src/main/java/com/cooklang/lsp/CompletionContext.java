package com.cooklang.lsp;

/**
 * 光标处的补全上下文
 */
public final class CompletionContext {

    public enum Type {
        /** 不在任何组件内 */
        NONE,
        /** 标记之后的名称 */
        NAME,
        /** 花括号内的数量 */
        QUANTITY,
        /** 花括号内 '%' 之后的单位 */
        UNIT
    }

    private static final CompletionContext NONE = new CompletionContext(Type.NONE, null, "");

    private final Type type;
    private final ElementKind kind;
    private final String prefix;

    private CompletionContext(Type type, ElementKind kind, String prefix) {
        this.type = type;
        this.kind = kind;
        this.prefix = prefix;
    }

    public static CompletionContext none() {
        return NONE;
    }

    public static CompletionContext name(ElementKind kind, String prefix) {
        return new CompletionContext(Type.NAME, kind, prefix);
    }

    public static CompletionContext quantity(ElementKind kind, String prefix) {
        return new CompletionContext(Type.QUANTITY, kind, prefix);
    }

    public static CompletionContext unit(ElementKind kind, String prefix) {
        return new CompletionContext(Type.UNIT, kind, prefix);
    }

    public Type getType() {
        return type;
    }

    /** 所在组件种类，NONE 时为 null */
    public ElementKind getKind() {
        return kind;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public String toString() {
        return type == Type.NONE ? "NONE" : type + "(" + kind + ", '" + prefix + "')";
    }
}
