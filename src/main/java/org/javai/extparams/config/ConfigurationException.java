package org.javai.extparams.config;

/**
 * Thrown when a configuration file exists but cannot be read or is not valid.
 */
public class ConfigurationException extends RuntimeException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
