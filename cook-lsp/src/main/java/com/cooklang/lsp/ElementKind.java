package com.cooklang.lsp;

/**
 * 源码元素种类
 */
public enum ElementKind {
    INGREDIENT,
    COOKWARE,
    TIMER,
    SECTION,
    METADATA,
    COMMENT;

    /**
     * 标记字符对应的种类，非标记字符返回 null
     */
    public static ElementKind fromMarker(int b) {
        switch (b) {
            case '@': return INGREDIENT;
            case '#': return COOKWARE;
            case '~': return TIMER;
            default: return null;
        }
    }

    public boolean isComponent() {
        return this == INGREDIENT || this == COOKWARE || this == TIMER;
    }
}
