/**
 * Batch mode: resolving whole spec trees, validating them without writing, and reporting
 * placeholder usage.
 */
package org.javai.extparams.batch;
