/**
 * Object ⇄ record codec.
 *
 * <p>{@link com.ryuqq.recordgraph.core.codec.RecordCodec} classifies and encodes fields,
 * renders records to the sanitized wire map and decodes inlined maps back into object graphs,
 * sharing instances per identity through a {@link com.ryuqq.recordgraph.core.codec.DecodeContext}.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.core.codec;
