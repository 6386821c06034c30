package org.javai.extparams.source;

import org.javai.extparams.config.SourceConfig;

/**
 * Creates the adapter for a source variant from its configuration. Creation must not contact the
 * backend; that happens in {@link ParamSource#initialize()}.
 */
@FunctionalInterface
public interface SourceFactory {

	ParamSource create(SourceType type, SourceConfig config);
}
