/**
 * The resolution engine: source registry, fallback walk, top-level cache and text substitution.
 * <p>
 * {@link org.javai.extparams.resolve.PrecedenceResolver} owns the fallback algorithm.
 * {@link org.javai.extparams.resolve.TextResolver} applies it to whole documents.
 */
package org.javai.extparams.resolve;
