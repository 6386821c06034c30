package org.javai.extparams.source.http;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link HttpTransport} backed by the JDK {@link HttpClient}.
 */
public class JdkHttpTransport implements HttpTransport {

	private final HttpClient client;

	public JdkHttpTransport(Duration connectTimeout) {
		this.client = HttpClient.newBuilder()
				.connectTimeout(connectTimeout)
				.followRedirects(HttpClient.Redirect.NORMAL)
				.build();
	}

	@Override
	public HttpResult send(HttpRequest request) throws IOException, InterruptedException {
		HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
		return new HttpResult(response.statusCode(), response.body());
	}
}
