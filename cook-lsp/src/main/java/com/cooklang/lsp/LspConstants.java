package com.cooklang.lsp;

/**
 * LSP 协议常量定义。
 *
 * @see <a href="https://microsoft.github.io/language-server-protocol/specifications/lsp/3.17/specification/">LSP 3.17 Spec</a>
 */
public final class LspConstants {

    private LspConstants() {}

    // ==================== 服务器信息 ====================

    public static final String SERVER_NAME = "cooklang-language-server";
    public static final String SERVER_VERSION = "0.1.0";
    public static final String DIAGNOSTIC_SOURCE = "cooklang";

    // ==================== CompletionItemKind ====================

    public static final int COMPLETION_FUNCTION = 3;
    public static final int COMPLETION_VARIABLE = 6;
    public static final int COMPLETION_CLASS = 7;
    public static final int COMPLETION_UNIT = 11;
    public static final int COMPLETION_SNIPPET = 15;

    // ==================== DiagnosticSeverity ====================

    public static final int SEVERITY_ERROR = 1;
    public static final int SEVERITY_WARNING = 2;

    // ==================== SymbolKind ====================

    public static final int SYMBOL_NAMESPACE = 3;
    public static final int SYMBOL_CLASS = 5;
    public static final int SYMBOL_PROPERTY = 7;
    public static final int SYMBOL_FUNCTION = 12;
    public static final int SYMBOL_VARIABLE = 13;

    // ==================== InsertTextFormat ====================

    public static final int INSERT_TEXT_PLAIN = 1;
    public static final int INSERT_TEXT_SNIPPET = 2;

    // ==================== TextDocumentSyncKind ====================

    public static final int SYNC_FULL = 1;

    // ==================== MessageType ====================

    public static final int MESSAGE_INFO = 3;

    // ==================== JSON-RPC 错误码 ====================

    public static final int ERR_INVALID_REQUEST = -32600;
    public static final int ERR_METHOD_NOT_FOUND = -32601;
    public static final int ERR_INVALID_PARAMS = -32602;
    public static final int ERR_INTERNAL = -32603;
    public static final int ERR_REQUEST_CANCELLED = -32800;
}
