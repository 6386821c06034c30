/**
 * Resolves {@code <name:source#key|default>} placeholders in text from pluggable external
 * sources.
 * <p>
 * Start at {@link org.javai.extparams.ParamResolver}. Batch processing of spec directories lives
 * in {@code batch}, the host runtime hooks in {@code host} and the command line in {@code cli}.
 */
package org.javai.extparams;
