package com.cooklang.lsp;

import com.google.gson.*;

import static com.cooklang.lsp.LspConstants.*;

import java.io.*;
import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.*;

/**
 * Cooklang Language Server
 *
 * <p>实现 LSP 协议，为 Cooklang 菜谱提供编辑支持。通过 stdin/stdout 与编辑器通信。</p>
 *
 * <p>支持的功能：</p>
 * <ul>
 *   <li>解析诊断</li>
 *   <li>食材、厨具、计时器、数量与单位补全</li>
 *   <li>悬停信息</li>
 *   <li>文档大纲</li>
 *   <li>语义令牌</li>
 *   <li>aisle.conf 别名表（文件变化时重新加载）</li>
 * </ul>
 *
 * <p>通知在读取线程上按顺序同步处理；请求提交到线程池异步处理，尚未开始执行的请求可被
 * {@code $/cancelRequest} 取消。每个请求 id 只会收到一个响应。</p>
 */
public class CookLanguageServer {
    private static final Logger LOG = Logger.getLogger(CookLanguageServer.class.getName());

    private final JsonRpcTransport transport;
    private final DocumentManager documents;
    private final AisleConfig aisle;
    private final CookAnalyzer analyzer;
    private volatile Path workspaceRoot;
    private volatile boolean shutdownRequested = false;
    private boolean running = true;

    /** 异步请求线程池 */
    private final ExecutorService requestPool = Executors.newFixedThreadPool(4, r -> {
        Thread t = new Thread(r, "cook-lsp-request");
        t.setDaemon(true);
        return t;
    });

    /** 待处理的异步请求（id -> 请求状态），用于取消追踪 */
    private final Map<String, PendingRequest> pendingRequests = new ConcurrentHashMap<>();

    public CookLanguageServer(InputStream input, OutputStream output) {
        this.transport = new JsonRpcTransport(input, output);
        this.documents = new DocumentManager();
        this.aisle = new AisleConfig();
        this.analyzer = new CookAnalyzer(documents, aisle);
    }

    /**
     * 启动服务器主循环
     *
     * @return 进程退出码：收到 shutdown 后 exit 为 0，否则为 1
     */
    public int run() {
        LOG.info("Cooklang LSP 服务器启动");

        while (running) {
            JsonObject message = null;
            try {
                message = transport.readMessage();
                if (message == null) {
                    break; // 流结束
                }
                handleMessage(message);
            } catch (Exception e) {
                LOG.log(Level.SEVERE, "处理消息时出错", e);
                // 对带有 id 的请求发送错误响应，确保客户端不会挂起
                if (message != null && message.has("id")) {
                    try {
                        String errMsg = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
                        transport.sendError(message.get("id"), ERR_INTERNAL, "Internal error: " + errMsg);
                    } catch (IOException ioEx) {
                        LOG.log(Level.SEVERE, "发送错误响应失败", ioEx);
                    }
                }
            }
        }

        requestPool.shutdown();
        try {
            if (!requestPool.awaitTermination(5, TimeUnit.SECONDS)) {
                requestPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            requestPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Cooklang LSP 服务器关闭");
        return shutdownRequested ? 0 : 1;
    }

    private void handleMessage(JsonObject message) throws IOException {
        String method = message.has("method") ? message.get("method").getAsString() : null;
        JsonElement id = message.get("id");

        // 无 method 的消息：如果有 id 则为无效请求，否则忽略（可能是响应）
        if (method == null) {
            if (id != null) {
                transport.sendError(id, ERR_INVALID_REQUEST, "Missing 'method' field");
            }
            return;
        }

        switch (method) {
            // === 生命周期 ===
            case "initialize":
                handleInitialize(id, message.getAsJsonObject("params"));
                break;
            case "initialized":
                handleInitialized();
                break;
            case "shutdown":
                shutdownRequested = true;
                transport.sendResponse(id, JsonNull.INSTANCE);
                break;
            case "exit":
                running = false;
                break;

            // === 通知（同步处理，保证顺序） ===
            case "textDocument/didOpen":
                handleDidOpen(message.getAsJsonObject("params"));
                break;
            case "textDocument/didChange":
                handleDidChange(message.getAsJsonObject("params"));
                break;
            case "textDocument/didSave":
                handleDidSave(message.getAsJsonObject("params"));
                break;
            case "textDocument/didClose":
                handleDidClose(message.getAsJsonObject("params"));
                break;
            case "workspace/didChangeWatchedFiles":
                handleDidChangeWatchedFiles(message.getAsJsonObject("params"));
                break;
            case "$/cancelRequest":
                handleCancelRequest(message.getAsJsonObject("params"));
                break;

            // === 请求（异步处理） ===
            case "textDocument/completion":
                submitAsync(id, () -> handleCompletion(id, message.getAsJsonObject("params")));
                break;
            case "textDocument/hover":
                submitAsync(id, () -> handleHover(id, message.getAsJsonObject("params")));
                break;
            case "textDocument/documentSymbol":
                submitAsync(id, () -> handleDocumentSymbol(id, message.getAsJsonObject("params")));
                break;
            case "textDocument/semanticTokens/full":
                submitAsync(id, () -> handleSemanticTokensFull(id, message.getAsJsonObject("params")));
                break;

            default:
                // 未支持的方法；以 $/ 开头的通知可以忽略
                if (id != null) {
                    transport.sendError(id, ERR_METHOD_NOT_FOUND, "Method not found: " + method);
                }
                break;
        }
    }

    // ============ 异步请求管理 ============

    /**
     * 异步请求的状态：排队中的请求可以被取消，开始执行后由处理器负责唯一的响应
     */
    private static final class PendingRequest {
        static final int QUEUED = 0;
        static final int STARTED = 1;
        static final int CANCELLED = 2;

        final AtomicInteger state = new AtomicInteger(QUEUED);
        volatile Future<?> future;
    }

    private void submitAsync(JsonElement id, RequestHandler handler) {
        String idStr = id != null ? id.toString() : null;
        PendingRequest pending = new PendingRequest();
        // 先登记再提交，任务结束时只移除自己的登记
        if (idStr != null) pendingRequests.put(idStr, pending);
        pending.future = requestPool.submit(() -> {
            try {
                if (!pending.state.compareAndSet(PendingRequest.QUEUED, PendingRequest.STARTED)) return;
                handler.handle();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "异步请求处理失败", e);
                try {
                    if (id != null) {
                        transport.sendError(id, ERR_INTERNAL,
                                "Internal error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getName()));
                    }
                } catch (IOException ioEx) {
                    LOG.log(Level.SEVERE, "发送错误响应失败", ioEx);
                }
            } finally {
                if (idStr != null) pendingRequests.remove(idStr, pending);
            }
        });
    }

    @FunctionalInterface
    private interface RequestHandler {
        void handle() throws Exception;
    }

    /**
     * 只取消尚未开始的请求；已开始的请求照常返回结果
     */
    private void handleCancelRequest(JsonObject params) {
        if (params == null || !params.has("id")) return;
        String cancelId = params.get("id").toString();
        PendingRequest pending = pendingRequests.get(cancelId);
        if (pending == null) return;
        if (!pending.state.compareAndSet(PendingRequest.QUEUED, PendingRequest.CANCELLED)) {
            LOG.fine("请求已开始执行，忽略取消: " + cancelId);
            return;
        }
        pendingRequests.remove(cancelId, pending);
        Future<?> future = pending.future;
        if (future != null) future.cancel(false);
        try {
            transport.sendError(params.get("id"), ERR_REQUEST_CANCELLED, "Request cancelled");
        } catch (IOException e) {
            LOG.log(Level.WARNING, "发送取消响应失败", e);
        }
    }

    // ============ 生命周期 ============

    private void handleInitialize(JsonElement id, JsonObject params) throws IOException {
        workspaceRoot = params != null ? resolveWorkspaceRoot(params) : null;
        if (workspaceRoot != null) {
            LOG.info("工作区根目录: " + workspaceRoot);
        }

        JsonObject result = new JsonObject();

        // 服务器能力
        JsonObject capabilities = new JsonObject();

        // 文本同步：全量同步
        JsonObject textDocumentSync = new JsonObject();
        textDocumentSync.addProperty("openClose", true);
        textDocumentSync.addProperty("change", SYNC_FULL);
        JsonObject save = new JsonObject();
        save.addProperty("includeText", false);
        textDocumentSync.add("save", save);
        capabilities.add("textDocumentSync", textDocumentSync);

        // 补全
        JsonObject completionProvider = new JsonObject();
        completionProvider.addProperty("resolveProvider", false);
        JsonArray triggerChars = new JsonArray();
        for (String c : new String[]{"@", "#", "~", "%", "{"}) {
            triggerChars.add(c);
        }
        completionProvider.add("triggerCharacters", triggerChars);
        capabilities.add("completionProvider", completionProvider);

        // 悬停
        capabilities.addProperty("hoverProvider", true);

        // 文档符号
        capabilities.addProperty("documentSymbolProvider", true);

        // 语义令牌
        capabilities.add("semanticTokensProvider", SemanticTokensBuilder.getLegendCapability());

        result.add("capabilities", capabilities);

        // 服务器信息
        JsonObject serverInfo = new JsonObject();
        serverInfo.addProperty("name", SERVER_NAME);
        serverInfo.addProperty("version", SERVER_VERSION);
        result.add("serverInfo", serverInfo);

        transport.sendResponse(id, result);
    }

    /**
     * 工作区根目录：workspaceFolders[0].uri → rootUri → rootPath
     */
    static Path resolveWorkspaceRoot(JsonObject params) {
        JsonElement folders = params.get("workspaceFolders");
        if (folders != null && folders.isJsonArray() && folders.getAsJsonArray().size() > 0) {
            JsonElement first = folders.getAsJsonArray().get(0);
            if (first.isJsonObject() && first.getAsJsonObject().has("uri")) {
                Path path = uriToPath(first.getAsJsonObject().get("uri").getAsString());
                if (path != null) return path;
            }
        }
        JsonElement rootUri = params.get("rootUri");
        if (rootUri != null && !rootUri.isJsonNull()) {
            Path path = uriToPath(rootUri.getAsString());
            if (path != null) return path;
        }
        JsonElement rootPath = params.get("rootPath");
        if (rootPath != null && !rootPath.isJsonNull()) {
            try {
                return Paths.get(rootPath.getAsString());
            } catch (InvalidPathException e) {
                LOG.log(Level.WARNING, "无效的 rootPath: " + rootPath, e);
            }
        }
        return null;
    }

    private static Path uriToPath(String uri) {
        try {
            return Paths.get(URI.create(uri));
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            LOG.log(Level.WARNING, "无法转换为本地路径: " + uri, e);
            return null;
        }
    }

    private void handleInitialized() throws IOException {
        aisle.load(workspaceRoot);

        JsonObject params = new JsonObject();
        params.addProperty("type", MESSAGE_INFO);
        params.addProperty("message", "Cooklang Language Server initialized");
        transport.sendNotification("window/logMessage", params);
    }

    // ============ 文档同步 ============

    private void handleDidOpen(JsonObject params) throws IOException {
        if (params == null) return;
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        if (textDocument == null || !textDocument.has("uri") || !textDocument.has("text")) return;
        String uri = textDocument.get("uri").getAsString();
        String text = textDocument.get("text").getAsString();
        int version = textDocument.has("version") ? textDocument.get("version").getAsInt() : 0;

        documents.open(uri, version, text);
        publishDiagnostics(uri);
    }

    private void handleDidChange(JsonObject params) throws IOException {
        if (params == null) return;
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        if (textDocument == null || !textDocument.has("uri")) return;
        String uri = textDocument.get("uri").getAsString();
        int version = textDocument.has("version") && !textDocument.get("version").isJsonNull()
                ? textDocument.get("version").getAsInt() : Integer.MAX_VALUE;

        JsonArray changes = params.getAsJsonArray("contentChanges");
        if (changes == null || changes.size() == 0) return;

        // 全量同步：只有最后一次变更的内容有效
        JsonObject change = changes.get(changes.size() - 1).getAsJsonObject();
        if (!change.has("text")) return;
        if (documents.update(uri, version, change.get("text").getAsString())) {
            publishDiagnostics(uri);
        }
    }

    private void handleDidSave(JsonObject params) throws IOException {
        if (params == null) return;
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        if (textDocument == null || !textDocument.has("uri")) return;
        String uri = textDocument.get("uri").getAsString();
        if (documents.isOpen(uri)) {
            publishDiagnostics(uri);
        }
    }

    private void handleDidClose(JsonObject params) throws IOException {
        if (params == null) return;
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        if (textDocument == null || !textDocument.has("uri")) return;
        String uri = textDocument.get("uri").getAsString();
        documents.close(uri);

        // 清除诊断
        JsonObject diagParams = new JsonObject();
        diagParams.addProperty("uri", uri);
        diagParams.add("diagnostics", new JsonArray());
        transport.sendNotification("textDocument/publishDiagnostics", diagParams);
    }

    private void handleDidChangeWatchedFiles(JsonObject params) {
        if (params == null) return;
        JsonArray changes = params.getAsJsonArray("changes");
        if (changes == null) return;
        for (JsonElement change : changes) {
            if (!change.isJsonObject() || !change.getAsJsonObject().has("uri")) continue;
            if (AisleConfig.isAisleFile(change.getAsJsonObject().get("uri").getAsString())) {
                LOG.info("aisle.conf 已变化，重新加载");
                aisle.load(workspaceRoot);
                return;
            }
        }
    }

    // ============ textDocument/completion ============

    private void handleCompletion(JsonElement id, JsonObject params) throws IOException {
        if (params == null) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing params");
            return;
        }
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        JsonObject position = params.getAsJsonObject("position");
        if (textDocument == null || !textDocument.has("uri") || position == null) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing textDocument or position");
            return;
        }
        String uri = textDocument.get("uri").getAsString();
        int line = position.get("line").getAsInt();
        int character = position.get("character").getAsInt();

        JsonArray items = analyzer.complete(uri, line, character);
        transport.sendResponse(id, items);
    }

    // ============ textDocument/hover ============

    private void handleHover(JsonElement id, JsonObject params) throws IOException {
        if (params == null) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing params");
            return;
        }
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        JsonObject position = params.getAsJsonObject("position");
        if (textDocument == null || !textDocument.has("uri") || position == null) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing textDocument or position");
            return;
        }
        String uri = textDocument.get("uri").getAsString();
        int line = position.get("line").getAsInt();
        int character = position.get("character").getAsInt();

        JsonObject hover = analyzer.hover(uri, line, character);
        transport.sendResponse(id, hover != null ? hover : JsonNull.INSTANCE);
    }

    // ============ textDocument/documentSymbol ============

    private void handleDocumentSymbol(JsonElement id, JsonObject params) throws IOException {
        if (params == null) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing params");
            return;
        }
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        if (textDocument == null || !textDocument.has("uri")) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing textDocument");
            return;
        }
        String uri = textDocument.get("uri").getAsString();
        transport.sendResponse(id, analyzer.documentSymbols(uri));
    }

    // ============ textDocument/semanticTokens/full ============

    private void handleSemanticTokensFull(JsonElement id, JsonObject params) throws IOException {
        if (params == null) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing params");
            return;
        }
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        if (textDocument == null || !textDocument.has("uri")) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing textDocument");
            return;
        }
        String uri = textDocument.get("uri").getAsString();
        transport.sendResponse(id, analyzer.semanticTokens(uri));
    }

    // ============ 诊断 ============

    private void publishDiagnostics(String uri) throws IOException {
        JsonObject params = new JsonObject();
        params.addProperty("uri", uri);
        params.add("diagnostics", analyzer.diagnostics(uri));
        transport.sendNotification("textDocument/publishDiagnostics", params);
    }

    // ============ 入口 ============

    public static void main(String[] args) {
        // 配置日志到 stderr（不干扰 stdin/stdout 的 LSP 通信）
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(Level.INFO);
        rootLogger.addHandler(stderrHandler);

        CookLanguageServer server = new CookLanguageServer(System.in, System.out);
        System.exit(server.run());
    }
}
