package com.ryuqq.prp.core.outcome;

/**
 * 아이템 하나의 파이프라인 실행 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 모든 단계 완료 (완료 집합에 추가됨)</li>
 *   <li>{@link Deferred}: Rate gate 거부로 연기됨 (다음 사이클에 다시 제공)</li>
 *   <li>{@link Fail}: 영구 실패 (정의 파일이 failed 디렉토리로 이동됨)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Deferred, Fail {

    /**
     * 대상 아이템 이름.
     *
     * @return 아이템 이름
     */
    String itemName();

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isDeferred() {
        return this instanceof Deferred;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }
}
