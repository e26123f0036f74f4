package com.cooklang.lsp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * aisle.conf 中的食材别名表（不可变）
 *
 * <p>文件格式：</p>
 * <pre>
 * [produce]
 * onions|yellow onion|brown onion
 * # 注释
 * </pre>
 * <p>每行第一个名称为规范名，其余为别名。格式错误的行记录警告后跳过。</p>
 */
public final class AliasTable {
    private static final Logger LOG = Logger.getLogger(AliasTable.class.getName());

    private static final AliasTable EMPTY = new AliasTable(Collections.<Entry>emptyList());

    private final List<Entry> entries;

    private AliasTable(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    public static AliasTable empty() {
        return EMPTY;
    }

    /** 别名表中的一个名称 */
    public static final class Entry {
        private final String name;
        private final String canonicalName;
        private final String category;

        public Entry(String name, String canonicalName, String category) {
            this.name = name;
            this.canonicalName = canonicalName;
            this.category = category;
        }

        public String getName() {
            return name;
        }

        public String getCanonicalName() {
            return canonicalName;
        }

        public String getCategory() {
            return category;
        }

        public boolean isAlias() {
            return !name.equals(canonicalName);
        }
    }

    /**
     * 宽松解析 aisle.conf 内容
     */
    public static AliasTable parse(String content) {
        List<Entry> entries = new ArrayList<>();
        String category = null;
        String[] lines = content.split("\r\n|\r|\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            if (line.startsWith("[")) {
                if (!line.endsWith("]") || line.length() < 3) {
                    LOG.warning("aisle.conf 第 " + (i + 1) + " 行分类标题无效: " + line);
                    category = null;
                    continue;
                }
                category = line.substring(1, line.length() - 1).trim();
                if (category.isEmpty()) category = null;
                continue;
            }

            if (category == null) {
                LOG.warning("aisle.conf 第 " + (i + 1) + " 行不属于任何分类，已跳过: " + line);
                continue;
            }

            String[] names = line.split("\\|");
            String canonical = names[0].trim();
            if (canonical.isEmpty()) {
                LOG.warning("aisle.conf 第 " + (i + 1) + " 行缺少食材名称，已跳过: " + line);
                continue;
            }
            for (String raw : names) {
                String name = raw.trim();
                if (!name.isEmpty()) {
                    entries.add(new Entry(name, canonical, category));
                }
            }
        }
        return new AliasTable(entries);
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * 按名称（忽略大小写）查找条目
     */
    public Entry find(String name) {
        for (Entry entry : entries) {
            if (entry.getName().equalsIgnoreCase(name)) return entry;
        }
        return null;
    }
}
