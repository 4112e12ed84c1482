package dustin.perp.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 비동기 처리 설정
 * Performance Configuration
 * 엔진 이벤트 팬아웃 (Kafka 발행)과 유지보수 크랭크용 스레드 풀
 */
@Configuration
@EnableAsync
public class PerformanceConfig {

    /**
     * 이벤트 발행용 스레드 풀
     * Engine event fan-out thread pool
     *
     * 엔진 락 밖에서 Kafka 전송을 처리
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(10000);
        executor.setThreadNamePrefix("engine-event-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * 유지보수 작업용 스레드 풀
     * Maintenance crank executor
     */
    @Bean(name = "maintenanceExecutor")
    public Executor maintenanceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // 엔진은 단일 락으로 직렬화되므로 스레드 수를 늘려도 처리량이 늘지 않음
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("maintenance-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
