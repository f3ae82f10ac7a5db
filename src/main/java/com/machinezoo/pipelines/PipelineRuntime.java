// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import java.util.*;
import java.util.concurrent.*;
import com.google.common.util.concurrent.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;

/*
 * Asynchronous processor work is mostly I/O. It spends its time waiting, not computing.
 * Running it on pipeline workers would leave CPU idle while workers wait, so it gets its own thread pool.
 *
 * Any Executor can serve as the asynchronous runtime. This class is just a reasonable default.
 * It is a fixed-size pool with generous thread count, because blocked threads are cheap compared to idle CPU.
 * Threads time out when idle, so the pool costs nothing when there's no I/O.
 */
/**
 * Default asynchronous runtime for {@link Processor#processAsync()}.
 */
@StubDocs
public class PipelineRuntime extends ThreadPoolExecutor {
	private static final ThreadLocal<PipelineRuntime> running = new ThreadLocal<>();
	private static final Timer taskTimer = Metrics.timer("pipelines.runtime.tasks");
	/*
	 * Every task is wrapped, so that it can see its runtime via current() and so that we can time it.
	 */
	private static class RuntimeTask implements Runnable {
		final PipelineRuntime runtime;
		final Runnable runnable;
		final Timer.Sample sample;
		RuntimeTask(PipelineRuntime runtime, Runnable runnable) {
			this.runtime = runtime;
			this.runnable = runnable;
			/*
			 * Only the common runtime is timed. Timer sample is started here to include queuing latency.
			 */
			sample = runtime == common ? Timer.start() : null;
		}
		@Override
		public void run() {
			running.set(runtime);
			try {
				runnable.run();
			} finally {
				running.remove();
				if (sample != null)
					sample.stop(taskTimer);
			}
		}
	}
	public PipelineRuntime(int parallelism, ThreadFactory threads) {
		super(parallelism, parallelism, 1, TimeUnit.MINUTES, new LinkedBlockingQueue<>(), threads);
		allowCoreThreadTimeOut(true);
	}
	public PipelineRuntime(int parallelism) {
		this(parallelism, new ThreadFactoryBuilder().setNameFormat("pipeline-runtime-%d").setDaemon(true).build());
	}
	public PipelineRuntime() {
		this(4 * Runtime.getRuntime().availableProcessors());
	}
	@Override
	public void execute(Runnable runnable) {
		Objects.requireNonNull(runnable);
		super.execute(new RuntimeTask(this, runnable));
	}
	/**
	 * Runtime that executes the calling code.
	 *
	 * @return current runtime or {@code null} if called outside of any runtime
	 */
	public static PipelineRuntime current() {
		return running.get();
	}
	/*
	 * Daemon threads, so that leftover I/O tasks do not prevent process termination.
	 */
	private static final PipelineRuntime common = new PipelineRuntime(4 * Runtime.getRuntime().availableProcessors(),
		new ThreadFactoryBuilder().setNameFormat("pipeline-io-%d").setDaemon(true).build());
	static {
		Metrics.gauge("pipelines.runtime.threads", common, x -> x.getPoolSize());
		Metrics.gauge("pipelines.runtime.active", common, x -> x.getActiveCount());
		Metrics.gauge("pipelines.runtime.queue", common, x -> x.getQueue().size());
	}
	public static PipelineRuntime common() {
		return common;
	}
}
