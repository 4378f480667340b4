package kr.jemi.zcassa.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;

/**
 * 감사 로그 리스너가 쓰는 비동기 실행기. 감사 기록 실패는 로그만 남기고 발권 흐름에는 전파하지 않는다.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    private final int poolSize;
    private final int queueCapacity;

    public AsyncConfig(@Value("${zcassa.async.pool-size:4}") int poolSize,
                       @Value("${zcassa.async.queue-capacity:1000}") int queueCapacity) {
        this.poolSize = poolSize;
        this.queueCapacity = queueCapacity;
    }

    @Override
    public Executor getAsyncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("zcassa-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable ex, Method method, Object... params) ->
                log.error("비동기 작업 실패(발권/취소 결과에는 영향 없음): {}.{}, 인자 {}개",
                        method.getDeclaringClass().getSimpleName(), method.getName(), params.length, ex);
    }
}
