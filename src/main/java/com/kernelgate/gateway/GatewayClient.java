package com.kernelgate.gateway;

import com.kernelgate.core.model.ConnectionOptions;
import com.kernelgate.core.model.KernelSpec;
import com.kernelgate.core.model.SessionModel;
import com.kernelgate.core.model.StartSessionRequest;

import java.util.List;

/**
 * Kernel and session operations of a remote gateway.
 * Implementations: JupyterGatewayClient (Jupyter server / kernel gateway REST API).
 *
 * <p>All calls block until the gateway answers and throw {@link GatewayException}
 * with a classified {@link com.kernelgate.core.model.FailureKind} on failure.
 */
public interface GatewayClient {

    /**
     * Lists the kernel specs the gateway can start.
     */
    List<KernelSpec> getKernelSpecs(ConnectionOptions options);

    /**
     * Lists running sessions.
     */
    List<SessionModel> listSessions(ConnectionOptions options);

    /**
     * Attaches to an existing session and opens its kernel connection.
     */
    GatewaySession connectToSession(String sessionId, ConnectionOptions options);

    /**
     * Starts a new session and opens its kernel connection.
     */
    GatewaySession startSession(StartSessionRequest request);
}
