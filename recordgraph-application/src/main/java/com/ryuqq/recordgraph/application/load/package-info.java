/**
 * 조회 파이프라인 - 단건/페이지/전체 조회와 참조 인라인.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.application.load;
