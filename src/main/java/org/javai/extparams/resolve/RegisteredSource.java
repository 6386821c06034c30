package org.javai.extparams.resolve;

import java.time.Duration;
import java.util.Objects;
import org.javai.extparams.source.ParamSource;
import org.javai.extparams.source.SourceType;

/**
 * An initialized adapter together with the upper bound the engine places on each of its
 * {@code resolve} calls.
 */
public record RegisteredSource(SourceType type, ParamSource source, Duration resolveTimeout) {

	public RegisteredSource {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(resolveTimeout, "resolveTimeout must not be null");
	}
}
