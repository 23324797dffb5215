package com.ryuqq.recordgraph.core.object;

import com.ryuqq.recordgraph.core.codec.DecodeContext;

import java.util.Map;

/**
 * 타입별 사용자 정의 인코딩/디코딩.
 *
 * <p>{@link TypeDescriptor}에 등록하면 encode는 필드 열거를, decode는 구조적 디코딩을
 * 대체합니다. encode 결과 값은 일반 필드와 똑같이 분류되므로 참조 값(Persistable)도
 * 돌려줄 수 있습니다.</p>
 *
 * @param <T> 대상 타입
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public interface CustomRecordCodec<T extends Persistable> {

    /**
     * 객체를 필드 이름 → 값 맵으로 변환.
     *
     * @param object 인코딩할 객체
     * @return 필드 맵 (null 값은 무시됨)
     */
    Map<String, Object> encode(T object);

    /**
     * 정제된(sanitized) 레코드 맵에서 객체 생성.
     *
     * <p>identity와 시스템 속성은 호출 측이 반영하므로 구현체가 설정할 필요는 없습니다.</p>
     *
     * @param values 레코드 맵 (참조는 인라인된 맵 또는 순환 마커)
     * @param context 디코딩 컨텍스트
     * @return 디코딩된 객체
     */
    T decode(Map<String, Object> values, DecodeContext context);
}
