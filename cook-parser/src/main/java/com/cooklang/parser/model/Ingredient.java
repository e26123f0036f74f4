package com.cooklang.parser.model;

/**
 * 食材（{@code @name{qty%unit}(note)}）
 */
public final class Ingredient {
    private final String name;
    private final Quantity quantity;
    private final String note;
    private final int start;
    private final int end;

    public Ingredient(String name, Quantity quantity, String note, int start, int end) {
        this.name = name;
        this.quantity = quantity;
        this.note = note;
        this.start = start;
        this.end = end;
    }

    public String getName() {
        return name;
    }

    /** 数量，未声明时为 null */
    public Quantity getQuantity() {
        return quantity;
    }

    /** 备注，未声明时为 null */
    public String getNote() {
        return note;
    }

    /** 起始字节偏移（含） */
    public int getStart() {
        return start;
    }

    /** 结束字节偏移（不含） */
    public int getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "@" + name + (quantity != null ? "{" + quantity + "}" : "");
    }
}
