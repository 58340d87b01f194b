package com.example.taskhub.scheduler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 两个线程池：
 * - workerExec：worker slot，数量 = scheduler.dispatcher.workers（由 Dispatcher 的 Semaphore 控制占用）
 * - taskBodyExec：真正跑任务体；超时后 worker 放弃等待并 interrupt，这里的线程可能稍晚才退出
 */
@Configuration
public class ExecPoolConfig {

    @Bean("workerExec")
    public ThreadPoolTaskExecutor workerExec(SchedulerProperties props) {
        int workers = Math.max(1, props.getDispatcher().getWorkers());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(workers);
        e.setMaxPoolSize(workers);
        e.setQueueCapacity(0);                    // slot 由 Semaphore 保证，不排队
        e.setKeepAliveSeconds(30);
        e.setAllowCoreThreadTimeOut(true);
        e.setThreadNamePrefix("worker-");
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // 优雅关闭
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(20);
        e.initialize();
        return e;
    }

    @Bean("taskBodyExec")
    public ThreadPoolTaskExecutor taskBodyExec(SchedulerProperties props) {
        int workers = Math.max(1, props.getDispatcher().getWorkers());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        // 超时被放弃的任务体可能还没退出，留出余量
        e.setCorePoolSize(workers);
        e.setMaxPoolSize(workers * 2);
        e.setQueueCapacity(0);
        e.setKeepAliveSeconds(30);
        e.setAllowCoreThreadTimeOut(true);
        e.setThreadNamePrefix("task-");
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        e.setWaitForTasksToCompleteOnShutdown(false);
        e.setAwaitTerminationSeconds(5);
        e.initialize();
        return e;
    }
}
