package org.javai.extparams.source.http;

/**
 * Status code and body text of an HTTP response.
 */
public record HttpResult(int statusCode, String body) {

	public boolean isSuccess() {
		return statusCode >= 200 && statusCode < 300;
	}

	@Override
	public String toString() {
		return "HttpResult[statusCode=" + statusCode + "]";
	}
}
