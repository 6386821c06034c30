/**
 * The placeholder wire format: {@code <name:source#key|default>}.
 * <p>
 * {@link org.javai.extparams.placeholder.PlaceholderGrammar} is the only place that knows the
 * syntax. Everything else works with {@link org.javai.extparams.placeholder.Placeholder} values.
 */
package org.javai.extparams.placeholder;
