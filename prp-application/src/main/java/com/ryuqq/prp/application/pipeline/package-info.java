/**
 * 아이템별 Phase Pipeline.
 *
 * <p>파일 시스템을 큐로 사용하는 처리 과정을 명시적인 상태 머신으로 표현합니다.
 * 각 단계의 산출물은 {@link com.ryuqq.prp.application.pipeline.ItemArtifacts}가 정한 위치에 남으며,
 * 다음 실행에서 {@link com.ryuqq.prp.application.pipeline.ShortCircuitResolver}가
 * 이를 보고 재개 단계를 결정합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.prp.application.pipeline;
