package com.ryuqq.prp.core.state;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 오케스트레이터의 단일 영속 상태 (불변 값).
 *
 * <p>Rate Limiter는 이 값을 읽기만 하며, 변경은 {@code StateStore}의
 * 이름 있는 메서드(recordSubmission, markCurrent, markCompleted)를 통해서만 일어납니다.
 * 각 변경 메서드는 새 인스턴스를 반환합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>completedItems는 추가만 가능 (제거 불가)</li>
 *   <li>submissionTimes는 오래된 순서로 정렬</li>
 *   <li>currentItem은 관찰/재개 힌트 용도이며 재진입 판단에 사용하지 않음</li>
 * </ul>
 *
 * @param lastSubmissionTime 마지막 제출 시각 (null 허용)
 * @param submissionTimes 최근 1시간 윈도우 내 제출 시각 (오래된 순)
 * @param completedItems 완료된 아이템 이름 (삽입 순서 유지)
 * @param currentItem 처리 중인 아이템 이름 (null 허용)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestratorState(
    Instant lastSubmissionTime,
    List<Instant> submissionTimes,
    Set<String> completedItems,
    String currentItem
) {

    /**
     * Rate limit 윈도우 크기 (rolling 1시간).
     */
    public static final Duration SUBMISSION_WINDOW = Duration.ofHours(1);

    private static final OrchestratorState INITIAL =
        new OrchestratorState(null, List.of(), Set.of(), null);

    /**
     * Compact constructor (방어적 복사).
     *
     * @throws IllegalArgumentException 컬렉션이 null인 경우
     */
    public OrchestratorState {
        if (submissionTimes == null) {
            throw new IllegalArgumentException("submissionTimes cannot be null");
        }
        if (completedItems == null) {
            throw new IllegalArgumentException("completedItems cannot be null");
        }
        List<Instant> sorted = new ArrayList<>(submissionTimes);
        Collections.sort(sorted);
        submissionTimes = List.copyOf(sorted);
        completedItems = Collections.unmodifiableSet(new LinkedHashSet<>(completedItems));
    }

    /**
     * 최초 실행 시의 빈 상태.
     *
     * @return 기본 상태
     */
    public static OrchestratorState initial() {
        return INITIAL;
    }

    /**
     * now 기준 윈도우 안에 남아있는 제출 시각.
     *
     * <p>{@code timestamp > now - 1h} 인 항목만 반환합니다.</p>
     *
     * @param now 기준 시각
     * @return 윈도우 내 제출 시각 (오래된 순)
     */
    public List<Instant> submissionsInWindow(Instant now) {
        Instant cutoff = now.minus(SUBMISSION_WINDOW);
        List<Instant> recent = new ArrayList<>();
        for (Instant t : submissionTimes) {
            if (t.isAfter(cutoff)) {
                recent.add(t);
            }
        }
        return recent;
    }

    /**
     * 제출 기록 추가 (윈도우 정리 포함).
     *
     * @param at 제출 시각
     * @return 새 상태
     * @throws IllegalArgumentException at이 null인 경우
     */
    public OrchestratorState withSubmission(Instant at) {
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        List<Instant> times = submissionsInWindow(at);
        times.add(at);
        return new OrchestratorState(at, times, completedItems, currentItem);
    }

    /**
     * 처리 중인 아이템 변경.
     *
     * @param itemName 아이템 이름 (null이면 해제)
     * @return 새 상태
     */
    public OrchestratorState withCurrentItem(String itemName) {
        return new OrchestratorState(lastSubmissionTime, submissionTimes, completedItems, itemName);
    }

    /**
     * 아이템 완료 처리 (currentItem 해제 포함).
     *
     * @param itemName 아이템 이름
     * @return 새 상태
     * @throws IllegalArgumentException itemName이 null이거나 비어있는 경우
     */
    public OrchestratorState withCompleted(String itemName) {
        if (itemName == null || itemName.isBlank()) {
            throw new IllegalArgumentException("itemName cannot be null or blank");
        }
        Set<String> completed = new LinkedHashSet<>(completedItems);
        completed.add(itemName);
        return new OrchestratorState(lastSubmissionTime, submissionTimes, completed, null);
    }

    public boolean isCompleted(String itemName) {
        return completedItems.contains(itemName);
    }
}
