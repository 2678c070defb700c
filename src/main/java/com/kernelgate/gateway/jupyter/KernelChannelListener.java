package com.kernelgate.gateway.jupyter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.WebSocket;
import java.util.concurrent.CompletionStage;

/**
 * Keeps a kernel channel drained until a message consumer takes over.
 */
class KernelChannelListener implements WebSocket.Listener {

    private static final Logger log = LoggerFactory.getLogger(KernelChannelListener.class);

    private final String kernelId;
    private final StringBuilder buffer = new StringBuilder();

    KernelChannelListener(String kernelId) {
        this.kernelId = kernelId;
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        buffer.append(data);
        if (last) {
            log.trace("Kernel {} message: {} chars", kernelId, buffer.length());
            buffer.setLength(0);
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        log.debug("Kernel {} channel closed: {} {}", kernelId, statusCode, reason);
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        log.warn("Kernel {} channel error: {}", kernelId, error.getMessage());
    }
}
