package com.kernelgate.gateway.jupyter;

import com.kernelgate.core.model.ConnectionOptions;
import com.kernelgate.core.model.FailureKind;
import com.kernelgate.core.model.KernelModel;
import com.kernelgate.core.model.KernelSpec;
import com.kernelgate.core.model.SessionModel;
import com.kernelgate.gateway.GatewayException;
import com.kernelgate.gateway.GatewaySession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.WebSocket;

/**
 * A Jupyter session with an open kernel channels WebSocket.
 */
public class JupyterGatewaySession implements GatewaySession {

    private static final Logger log = LoggerFactory.getLogger(JupyterGatewaySession.class);

    private final SessionModel model;
    private final ConnectionOptions options;
    private final WebSocket channel;
    private final JupyterGatewayClient client;

    JupyterGatewaySession(SessionModel model, ConnectionOptions options, WebSocket channel,
                          JupyterGatewayClient client) {
        this.model = model;
        this.options = options;
        this.channel = channel;
        this.client = client;
    }

    @Override
    public String id() {
        return model.id();
    }

    @Override
    public String path() {
        return model.path();
    }

    @Override
    public KernelModel kernel() {
        return model.kernel();
    }

    public ConnectionOptions options() {
        return options;
    }

    /**
     * The open kernel channels connection.
     */
    public WebSocket channel() {
        return channel;
    }

    @Override
    public KernelSpec getKernelSpec() {
        String kernelName = model.kernelName().orElseThrow(() -> new GatewayException(
                FailureKind.STRUCTURED, GatewayException.NO_STATUS, null,
                "Session " + model.id() + " does not report a kernel name"));
        return client.getKernelSpecs(options).stream()
                .filter(spec -> spec.name().equals(kernelName))
                .findFirst()
                .orElseThrow(() -> new GatewayException(
                        FailureKind.STRUCTURED, GatewayException.NO_STATUS, null,
                        "Kernel spec '" + kernelName + "' is not offered by " + options.baseUrl()));
    }

    @Override
    public void close() {
        if (!channel.isOutputClosed()) {
            channel.sendClose(WebSocket.NORMAL_CLOSURE, "");
            log.debug("Closed kernel channel for session {}", model.id());
        }
    }
}
