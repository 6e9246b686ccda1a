/**
 * 큐 처리 Run Loop 계약.
 *
 * <p>{@link com.ryuqq.prp.application.runtime.QueueRuntime}은 큐를 한 번 처리하는
 * {@code runOnce()}와 stop() 전까지 반복하는 {@code runDaemon()}을 정의하고,
 * {@link com.ryuqq.prp.application.runtime.RunSummary}는 한 사이클의 아이템별 결과를 담습니다.</p>
 *
 * <p>adapter-runner 모듈의 {@code QueueWorkerRunner}가 구현합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.prp.application.runtime;
