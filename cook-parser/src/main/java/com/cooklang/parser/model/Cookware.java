package com.cooklang.parser.model;

/**
 * 厨具（{@code #name{qty}}）
 */
public final class Cookware {
    private final String name;
    private final Quantity quantity;
    private final int start;
    private final int end;

    public Cookware(String name, Quantity quantity, int start, int end) {
        this.name = name;
        this.quantity = quantity;
        this.start = start;
        this.end = end;
    }

    public String getName() {
        return name;
    }

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
        return "#" + name;
    }
}
