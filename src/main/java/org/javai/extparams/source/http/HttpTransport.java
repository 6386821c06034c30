package org.javai.extparams.source.http;

import java.io.IOException;
import java.net.http.HttpRequest;

/**
 * Sends one HTTP request and returns the status and body. Shared by the HTTP and Vault adapters;
 * tests substitute a scripted implementation.
 */
@FunctionalInterface
public interface HttpTransport {

	HttpResult send(HttpRequest request) throws IOException, InterruptedException;
}
