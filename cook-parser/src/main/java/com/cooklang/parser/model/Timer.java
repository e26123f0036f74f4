package com.cooklang.parser.model;

/**
 * 计时器（{@code ~name{qty%unit}} 或匿名的 {@code ~{qty%unit}}）
 */
public final class Timer {
    private final String name;
    private final Quantity quantity;
    private final int start;
    private final int end;

    public Timer(String name, Quantity quantity, int start, int end) {
        this.name = name;
        this.quantity = quantity;
        this.start = start;
        this.end = end;
    }

    /** 计时器名称，匿名计时器为 null */
    public String getName() {
        return name;
    }

    /** 时长 */
    public Quantity getQuantity() {
        return quantity;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "~" + (name != null ? name : "") + (quantity != null ? "{" + quantity + "}" : "");
    }
}
