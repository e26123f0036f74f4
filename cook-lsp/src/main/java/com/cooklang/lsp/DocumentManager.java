package com.cooklang.lsp;

import com.cooklang.parser.ParseResult;
import com.cooklang.parser.RecipeParser;
import com.cooklang.parser.SourceDiagnostic;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 文档管理器
 *
 * <p>管理当前打开的文档快照，支持 LSP 的 textDocument/didOpen、didChange、didClose。</p>
 * <p>新快照（位置索引 + 解析）在映射之外构建，写入时只锁定对应的键；读取不加锁，
 * 总是得到某个完整快照。</p>
 */
public class DocumentManager {
    private static final Logger LOG = Logger.getLogger(DocumentManager.class.getName());

    /** URI -> 文档快照 */
    private final Map<String, Document> documents = new ConcurrentHashMap<>();

    private final Parser parser;

    /** 文档解析函数 */
    @FunctionalInterface
    public interface Parser {
        ParseResult parse(String content);
    }

    public DocumentManager() {
        this(content -> new RecipeParser(content).parse());
    }

    public DocumentManager(Parser parser) {
        this.parser = parser;
    }

    /**
     * 打开文档，替换同一 URI 已有的快照
     */
    public Document open(String uri, int version, String content) {
        Document document = analyze(uri, version, content);
        documents.put(uri, document);
        return document;
    }

    /**
     * 用新内容替换已打开文档
     *
     * <p>未打开的文档忽略更新；版本号低于当前快照的更新视为过期并丢弃。</p>
     *
     * @return 新快照是否生效
     */
    public boolean update(String uri, int version, String content) {
        Document current = documents.get(uri);
        if (current == null) {
            LOG.info("忽略未打开文档的更新: " + uri);
            return false;
        }
        if (version < current.getVersion()) {
            LOG.fine("丢弃过期更新: " + uri + " v" + version + " < v" + current.getVersion());
            return false;
        }

        Document next = analyze(uri, version, content);
        Document stored = documents.computeIfPresent(uri,
                (key, old) -> version < old.getVersion() ? old : next);
        if (stored == null) {
            LOG.info("文档在更新期间被关闭: " + uri);
        }
        return stored == next;
    }

    /**
     * 关闭文档
     *
     * @return 文档此前是否已打开
     */
    public boolean close(String uri) {
        return documents.remove(uri) != null;
    }

    /**
     * 获取文档快照，未打开时返回 null
     */
    public Document get(String uri) {
        return documents.get(uri);
    }

    /**
     * 检查文档是否已打开
     */
    public boolean isOpen(String uri) {
        return documents.containsKey(uri);
    }

    /**
     * 所有打开文档的快照视图（弱一致）
     */
    public Collection<Document> snapshots() {
        return Collections.unmodifiableCollection(documents.values());
    }

    /**
     * 构建快照；解析器崩溃时记录日志并转为文档级错误
     */
    private Document analyze(String uri, int version, String content) {
        String text = content != null ? content : "";
        ParseResult result;
        try {
            result = parser.parse(text);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "解析文档失败: " + uri, e);
            result = ParseResult.failure(SourceDiagnostic.error("Failed to parse recipe: " + e.getMessage(), 0, 0));
        }
        return new Document(uri, version, text, result);
    }
}
