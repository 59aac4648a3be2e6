package com.tictactoehub.gameservice.infrastructure.scheduler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * AI 并行根搜索线程池（tictactoe.ai.parallel=true 时使用）。
 * 独立线程池，搜索任务不与其他任务排队。
 */
@Configuration
public class AiSearchExecutorConfig {

	/** 固定大小线程池，线程名 ai-search-N，随容器关闭 */
	@Bean(name = "aiSearchExecutor", destroyMethod = "shutdownNow")
	public ExecutorService aiSearchExecutor() {
		int poolSize = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
		return Executors.newFixedThreadPool(poolSize, new ThreadFactory() {
			private final AtomicInteger idx = new AtomicInteger(1);
			@Override
			public Thread newThread(Runnable r) {
				Thread t = new Thread(r, "ai-search-" + idx.getAndIncrement());
				// 守护线程，不阻止 JVM 退出
				t.setDaemon(true);
				return t;
			}
		});
	}
}
