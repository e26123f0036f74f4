package com.cooklang.lsp;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 工作区 aisle.conf 的加载与持有
 *
 * <p>文件读取与解析在锁外进行，写锁只用于替换快照引用；读取方总是拿到完整的一张表。</p>
 */
public class AisleConfig {
    private static final Logger LOG = Logger.getLogger(AisleConfig.class.getName());

    /** 按优先级排列的候选位置（相对工作区根目录） */
    static final String[] CANDIDATES = {
            ".cooklang/aisle.conf",
            "config/aisle.conf",
            "aisle.conf"
    };

    private static final String AISLE_FILE_NAME = "aisle.conf";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private AliasTable table = AliasTable.empty();

    /**
     * 当前别名表
     */
    public AliasTable getTable() {
        lock.readLock().lock();
        try {
            return table;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 从工作区根目录加载 aisle.conf；找不到或读取失败时别名表置空
     *
     * @return 加载后的别名表
     */
    public AliasTable load(Path workspaceRoot) {
        AliasTable loaded = AliasTable.empty();
        Path file = workspaceRoot != null ? findConfigFile(workspaceRoot) : null;
        if (file != null) {
            try {
                String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
                loaded = AliasTable.parse(content);
                LOG.info("已加载 aisle.conf: " + file + "（" + loaded.size() + " 个名称）");
            } catch (IOException e) {
                LOG.log(Level.WARNING, "读取 aisle.conf 失败: " + file, e);
            }
        } else {
            LOG.fine("工作区中没有 aisle.conf: " + workspaceRoot);
        }
        replace(loaded);
        return loaded;
    }

    /**
     * 替换别名表
     */
    public void replace(AliasTable next) {
        lock.writeLock().lock();
        try {
            table = next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 按候选顺序查找第一个存在的配置文件
     */
    static Path findConfigFile(Path workspaceRoot) {
        for (String candidate : CANDIDATES) {
            Path path = workspaceRoot.resolve(candidate);
            if (Files.isRegularFile(path)) return path;
        }
        return null;
    }

    /**
     * 文件 URI 的最后一段是否为 aisle.conf
     */
    public static boolean isAisleFile(String uri) {
        if (uri == null) return false;
        int slash = Math.max(uri.lastIndexOf('/'), uri.lastIndexOf('\\'));
        return AISLE_FILE_NAME.equals(uri.substring(slash + 1));
    }
}
