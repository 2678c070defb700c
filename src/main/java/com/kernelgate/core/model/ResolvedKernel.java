package com.kernelgate.core.model;

import com.kernelgate.gateway.GatewaySession;

/**
 * Final result of a resolution. Ownership of {@code session} passes to the receiver,
 * which is responsible for closing it.
 *
 * @param gatewayName name of the gateway the session lives on
 * @param kernelSpec  spec of the session's kernel
 * @param language    document language the kernel is bound to
 * @param session     the live session
 */
public record ResolvedKernel(String gatewayName, KernelSpec kernelSpec, String language, GatewaySession session) {}
