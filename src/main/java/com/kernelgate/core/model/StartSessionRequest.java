package com.kernelgate.core.model;

/**
 * Parameters for starting a new session on a gateway.
 *
 * @param options    connection options
 * @param kernelName kernel spec name to start
 * @param path       unique session path
 */
public record StartSessionRequest(ConnectionOptions options, String kernelName, String path) {}
