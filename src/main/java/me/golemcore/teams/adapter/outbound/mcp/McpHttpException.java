package me.golemcore.teams.adapter.outbound.mcp;

import java.io.IOException;

/**
 * Non-2xx HTTP reply from a remote MCP server. Only 408, 429 and 5xx are worth
 * another attempt; other client errors repeat on every retry.
 */
public class McpHttpException extends IOException {

    private static final long serialVersionUID = 1L;

    private final int status;

    public McpHttpException(int status) {
        super("MCP server returned HTTP " + status);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return status == 408 || status == 429 || status >= 500;
    }
}
