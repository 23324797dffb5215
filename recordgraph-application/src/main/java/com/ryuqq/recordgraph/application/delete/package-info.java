/**
 * 레코드 삭제 (단건, 직접 참조 연쇄).
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.application.delete;
