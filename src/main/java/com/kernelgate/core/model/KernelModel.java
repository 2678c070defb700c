package com.kernelgate.core.model;

/**
 * A running kernel process as seen in a session listing.
 *
 * @param id   kernel id on the gateway
 * @param name kernel spec name, or null when the gateway does not report it
 */
public record KernelModel(String id, String name) {}
