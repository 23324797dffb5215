/**
 * 순환 참조 검출.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.core.cycle;
