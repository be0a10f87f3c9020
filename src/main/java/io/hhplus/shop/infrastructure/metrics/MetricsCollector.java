package io.hhplus.shop.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 쓰기/읽기 일관성 파이프라인 메트릭 수집 컴포넌트
 *
 * 수집 메트릭:
 * - unit_of_work_commit_total: 커밋 성공/실패 카운터
 * - unit_of_work_rollback_total: 롤백 카운터 (재시도 전 롤백 포함)
 * - unit_of_work_commit_duration_seconds: 커밋 처리 시간 (재시도 포함, 전파 제외)
 * - event_store_append_total: 이벤트 저장소 기록 성공/실패
 * - event_dispatch_total: 이벤트 디스패치 성공/실패
 */
@Component
public class MetricsCollector {

    private final Counter commitSuccessCounter;
    private final Counter commitFailureCounter;
    private final Counter rollbackCounter;
    private final Timer commitDurationTimer;

    private final Counter eventStoreSuccessCounter;
    private final Counter eventStoreFailureCounter;

    private final Counter dispatchSuccessCounter;
    private final Counter dispatchFailureCounter;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.commitSuccessCounter = Counter.builder("unit_of_work_commit_total")
                .tag("status", "success")
                .description("Total number of successful unit of work commits")
                .register(meterRegistry);

        this.commitFailureCounter = Counter.builder("unit_of_work_commit_total")
                .tag("status", "failure")
                .description("Total number of failed unit of work commits")
                .register(meterRegistry);

        this.rollbackCounter = Counter.builder("unit_of_work_rollback_total")
                .description("Total number of rolled back commit attempts")
                .register(meterRegistry);

        this.commitDurationTimer = Timer.builder("unit_of_work_commit_duration_seconds")
                .description("Unit of work commit duration including retries")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.eventStoreSuccessCounter = Counter.builder("event_store_append_total")
                .tag("status", "success")
                .description("Total number of successful event store appends")
                .register(meterRegistry);

        this.eventStoreFailureCounter = Counter.builder("event_store_append_total")
                .tag("status", "failure")
                .description("Total number of failed event store appends")
                .register(meterRegistry);

        this.dispatchSuccessCounter = Counter.builder("event_dispatch_total")
                .tag("status", "success")
                .description("Total number of successful event publish calls")
                .register(meterRegistry);

        this.dispatchFailureCounter = Counter.builder("event_dispatch_total")
                .tag("status", "failure")
                .description("Total number of failed event publish calls")
                .register(meterRegistry);
    }

    public void recordCommitSuccess() {
        commitSuccessCounter.increment();
    }

    public void recordCommitFailure() {
        commitFailureCounter.increment();
    }

    public void recordRollback() {
        rollbackCounter.increment();
    }

    public void recordCommitDuration(long durationNanos) {
        commitDurationTimer.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordEventStoreSuccess() {
        eventStoreSuccessCounter.increment();
    }

    public void recordEventStoreFailure() {
        eventStoreFailureCounter.increment();
    }

    public void recordDispatchSuccess() {
        dispatchSuccessCounter.increment();
    }

    public void recordDispatchFailure() {
        dispatchFailureCounter.increment();
    }
}
