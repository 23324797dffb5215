/**
 * 영속화 엔진 설정.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.core.config;
