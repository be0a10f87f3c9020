package io.hhplus.shop.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 이벤트 디스패치 전용 Executor 설정
 * - 커밋 이후 프로젝션 핸들러 호출에만 사용
 * - 큐가 가득 차면 호출 스레드에서 실행 (CallerRunsPolicy): 이벤트 유실 없음
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "eventDispatchExecutor")
    public ThreadPoolTaskExecutor eventDispatchExecutor(
            @Value("${shop.events.dispatch.core-pool-size:4}") int corePoolSize,
            @Value("${shop.events.dispatch.max-pool-size:8}") int maxPoolSize,
            @Value("${shop.events.dispatch.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-dispatch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setAwaitTerminationSeconds(60);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();

        log.info("이벤트 디스패치 Executor 초기화: core={}, max={}, queue={}",
            corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }
}
