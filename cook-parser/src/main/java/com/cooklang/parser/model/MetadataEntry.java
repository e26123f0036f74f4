package com.cooklang.parser.model;

/**
 * 元数据条目（{@code >> key: value} 行或 front matter 中的 {@code key: value}）
 */
public final class MetadataEntry {
    private final String key;
    private final String value;
    private final int start;
    private final int end;

    public MetadataEntry(String key, String value, int start, int end) {
        this.key = key;
        this.value = value;
        this.start = start;
        this.end = end;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }
}
