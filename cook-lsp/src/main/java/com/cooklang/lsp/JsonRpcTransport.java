package com.cooklang.lsp;

import com.google.gson.*;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * JSON-RPC 2.0 传输层
 *
 * <p>以 {@code Content-Length} 头分帧，通过 stdin/stdout 读写 LSP 消息。写入是同步的，
 * 线程池中的请求处理器可以并发发送响应。</p>
 */
public class JsonRpcTransport {
    private static final String CONTENT_LENGTH = "content-length:";

    private final InputStream input;
    private final OutputStream output;
    private final Gson gson;

    public JsonRpcTransport(InputStream input, OutputStream output) {
        this.input = input;
        this.output = output;
        this.gson = new GsonBuilder().serializeNulls().create();
    }

    /**
     * 读取一条 JSON-RPC 消息
     *
     * @return 解析后的 JSON 对象，如果流结束则返回 null
     * @throws IOException 头部或消息体格式错误
     */
    public JsonObject readMessage() throws IOException {
        int contentLength = -1;
        boolean sawHeader = false;
        String line;
        while ((line = readLine()) != null) {
            if (line.isEmpty()) {
                if (sawHeader) break; // header 和 body 之间的空行
                continue;
            }
            sawHeader = true;
            if (line.toLowerCase(Locale.ROOT).startsWith(CONTENT_LENGTH)) {
                String value = line.substring(CONTENT_LENGTH.length()).trim();
                try {
                    contentLength = Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    throw new IOException("Invalid Content-Length: " + value, e);
                }
            }
            // 其他 header（如 Content-Type）忽略
        }

        if (line == null && contentLength < 0) {
            return null; // 流结束
        }
        if (contentLength < 0) {
            throw new IOException("Missing Content-Length header");
        }

        byte[] body = new byte[contentLength];
        int offset = 0;
        while (offset < contentLength) {
            int read = input.read(body, offset, contentLength - offset);
            if (read < 0) {
                return null;
            }
            offset += read;
        }

        try {
            JsonElement element = JsonParser.parseString(new String(body, StandardCharsets.UTF_8));
            if (!element.isJsonObject()) {
                throw new IOException("JSON-RPC message is not an object");
            }
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Malformed JSON-RPC message", e);
        }
    }

    /**
     * 发送 JSON-RPC 响应
     */
    public void sendResponse(JsonElement id, JsonElement result) throws IOException {
        JsonObject response = new JsonObject();
        response.addProperty("jsonrpc", "2.0");
        response.add("id", id);
        response.add("result", result != null ? result : JsonNull.INSTANCE);
        writeMessage(response);
    }

    /**
     * 发送 JSON-RPC 错误响应
     */
    public void sendError(JsonElement id, int code, String message) throws IOException {
        JsonObject response = new JsonObject();
        response.addProperty("jsonrpc", "2.0");
        response.add("id", id != null ? id : JsonNull.INSTANCE);
        JsonObject error = new JsonObject();
        error.addProperty("code", code);
        error.addProperty("message", message);
        response.add("error", error);
        writeMessage(response);
    }

    /**
     * 发送 JSON-RPC 通知（无 id）
     */
    public void sendNotification(String method, JsonElement params) throws IOException {
        JsonObject notification = new JsonObject();
        notification.addProperty("jsonrpc", "2.0");
        notification.addProperty("method", method);
        notification.add("params", params);
        writeMessage(notification);
    }

    private synchronized void writeMessage(JsonObject message) throws IOException {
        byte[] body = gson.toJson(message).getBytes(StandardCharsets.UTF_8);
        String header = "Content-Length: " + body.length + "\r\n\r\n";
        output.write(header.getBytes(StandardCharsets.US_ASCII));
        output.write(body);
        output.flush();
    }

    /**
     * 读取一行 header（以 \r\n 或 \n 结尾，不含终止符）
     */
    private String readLine() throws IOException {
        StringBuilder sb = new StringBuilder();
        while (true) {
            int c = input.read();
            if (c < 0) {
                return sb.length() > 0 ? sb.toString() : null;
            }
            if (c == '\n') {
                int len = sb.length();
                if (len > 0 && sb.charAt(len - 1) == '\r') sb.setLength(len - 1);
                return sb.toString();
            }
            sb.append((char) c);
        }
    }
}
