package com.cooklang.parser.model;

import java.util.Collections;
import java.util.List;

/**
 * 分节（{@code = 名称 =}）
 *
 * <p>第一个分节标题之前的步骤归入匿名分节（name 为 null）。</p>
 */
public final class Section {
    private final String name;
    private final List<Step> steps;
    private final int start;
    private final int end;

    public Section(String name, List<Step> steps, int start, int end) {
        this.name = name;
        this.steps = Collections.unmodifiableList(steps);
        this.start = start;
        this.end = end;
    }

    /** 分节名称，匿名分节为 null */
    public String getName() {
        return name;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }
}
