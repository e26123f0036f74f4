package com.cooklang.parser.model;

/**
 * 数量（花括号内的 {@code 值%单位}）
 *
 * <p>值与单位均保留原文，不做单位换算与数值校验。</p>
 */
public final class Quantity {
    private final String value;
    private final String unit;

    public Quantity(String value, String unit) {
        this.value = value;
        this.unit = unit;
    }

    public String getValue() {
        return value;
    }

    /** 单位，可能为 null */
    public String getUnit() {
        return unit;
    }

    public boolean hasUnit() {
        return unit != null && !unit.isEmpty();
    }

    @Override
    public String toString() {
        return hasUnit() ? value + " " + unit : value;
    }
}
