package com.kernelgate.gateway;

import java.net.URI;
import java.net.http.HttpRequest;

/**
 * Creates the request builder for every HTTP call made to a gateway.
 */
@FunctionalInterface
public interface HttpRequestFactory {

    HttpRequest.Builder newRequest(URI uri);
}
