package org.javai.extparams.resolve;

import java.util.List;
import org.javai.extparams.placeholder.Placeholder;
import org.javai.extparams.source.SourceType;

/**
 * Result of walking the fallback chain for one placeholder. Values are never included in
 * {@code toString()}.
 */
public sealed interface ResolutionOutcome {

	Placeholder placeholder();

	/**
	 * Failures recorded before the outcome was reached, in the order the sources were tried.
	 */
	List<SourceFailure> attempts();

	default boolean isResolved() {
		return !(this instanceof Unresolved);
	}

	/**
	 * A source supplied the value, or the top-level cache did.
	 *
	 * @param source the source that answered; {@code null} for a cache hit
	 */
	record Resolved(Placeholder placeholder, String value, SourceType source, boolean cached,
			List<SourceFailure> attempts) implements ResolutionOutcome {

		public Resolved {
			attempts = List.copyOf(attempts);
		}

		@Override
		public String toString() {
			return "Resolved[" + placeholder.name() + ":" + placeholder.source() + "#" + placeholder.key()
					+ " via " + (cached ? "cache" : source) + "]";
		}
	}

	/**
	 * No source answered and the placeholder's literal default was used.
	 */
	record Defaulted(Placeholder placeholder, List<SourceFailure> attempts) implements ResolutionOutcome {

		public Defaulted {
			attempts = List.copyOf(attempts);
		}

		public String value() {
			return placeholder.defaultValue();
		}

		@Override
		public String toString() {
			return "Defaulted[" + placeholder.name() + ":" + placeholder.source() + "#" + placeholder.key()
					+ " after " + attempts.size() + " failed attempt(s)]";
		}
	}

	record Unresolved(Placeholder placeholder, List<SourceFailure> attempts) implements ResolutionOutcome {

		public Unresolved {
			attempts = List.copyOf(attempts);
		}

		public UnresolvedPlaceholderException toException() {
			return new UnresolvedPlaceholderException(placeholder.key(), placeholder.source(), attempts);
		}
	}
}
