package com.example.cronhooks.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Webhook 投递线程池。每个任务大部分时间阻塞在出站 HTTP 上，按 IO 型配置。
 * 队列为 0 + CallerRunsPolicy：池满时轮询线程自己执行，领取速度自然降下来。
 */
@Configuration
public class ExecPoolConfig {

    @Bean("dispatchExec")
    public ThreadPoolTaskExecutor dispatchExec(
            @Value("${cronhooks.worker.core-size:0}") int configuredCore,
            @Value("${cronhooks.worker.max-size:0}") int configuredMax) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();

        int cores = Runtime.getRuntime().availableProcessors();
        int corePoolSize = configuredCore > 0 ? configuredCore : Math.max(8, cores * 4);
        int maxPoolSize = Math.max(corePoolSize, configuredMax > 0 ? configuredMax : Math.max(16, cores * 8));

        e.setCorePoolSize(corePoolSize);
        e.setMaxPoolSize(maxPoolSize);
        e.setQueueCapacity(0);
        e.setKeepAliveSeconds(30);
        e.setAllowCoreThreadTimeOut(true);
        e.setThreadNamePrefix("hook-");
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        // 关闭时等正在进行的调用结束，未完成的会因心跳过期被重新投递
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(20);

        e.initialize();
        return e;
    }
}
