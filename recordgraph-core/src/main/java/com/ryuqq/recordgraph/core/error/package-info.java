/**
 * RecordGraph 오류 분류 체계.
 *
 * <p>모든 예외는 unchecked이며 {@link com.ryuqq.recordgraph.core.error.PersistenceException}을 상속합니다.
 * 비동기 연산의 future는 {@code CompletionException}으로 감싸지 않은 이 예외들로 실패합니다.</p>
 *
 * <h2>처리 원칙</h2>
 * <ul>
 *   <li>저장 중 필드 오류는 루트와 의존 체인의 저장 전체를 중단합니다.</li>
 *   <li>일괄 조회 중 레코드별 변환 오류는 Identity별 부분 오류로 수집됩니다.</li>
 *   <li>페이지 단위 Store 오류는 해당 페이지를 실패시킵니다.</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.core.error;
