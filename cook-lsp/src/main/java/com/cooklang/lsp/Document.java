package com.cooklang.lsp;

import com.cooklang.parser.ParseResult;
import com.cooklang.parser.SourceDiagnostic;
import com.cooklang.parser.model.Recipe;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 打开文档的不可变快照
 *
 * <p>内容、UTF-8 字节、位置索引与解析结果在构建时一并生成，之后不再改变。
 * 每次编辑都会生成新快照替换旧快照，持有旧快照的读取方不受影响。</p>
 */
public final class Document {
    private final String uri;
    private final int version;
    private final String content;
    private final byte[] bytes;
    private final PositionIndex index;
    private final ParseResult parseResult;

    Document(String uri, int version, String content, ParseResult parseResult) {
        this.uri = uri;
        this.version = version;
        this.content = content;
        this.bytes = content.getBytes(StandardCharsets.UTF_8);
        this.index = new PositionIndex(bytes);
        this.parseResult = parseResult;
    }

    public String getUri() {
        return uri;
    }

    public int getVersion() {
        return version;
    }

    public String getContent() {
        return content;
    }

    /** 内容的 UTF-8 字节，调用方不得修改 */
    public byte[] getBytes() {
        return bytes;
    }

    public PositionIndex getIndex() {
        return index;
    }

    public ParseResult getParseResult() {
        return parseResult;
    }

    /** 结构化解析结果，解析有错误时为 null */
    public Recipe getRecipe() {
        return parseResult.getRecipe();
    }

    public List<SourceDiagnostic> getErrors() {
        return parseResult.getErrors();
    }

    public List<SourceDiagnostic> getWarnings() {
        return parseResult.getWarnings();
    }
}
