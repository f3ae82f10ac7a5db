// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.slf4j.*;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.tag.Tags;
import io.opentracing.util.*;
import it.unimi.dsi.fastutil.ints.*;

/*
 * Executor drives one pipeline graph from initial source readiness to terminal state.
 *
 * Pipeline reaches one of three terminal states:
 * - finished when every processor reported FINISHED
 * - failed when any processor threw, the first failure is latched and reported by run()
 * - cancelled when cancel() was called or a processor threw PipelineCancelledException
 *
 * Scheduling is driven by port changes. Whenever a processor completes a task, it is re-evaluated together with all its neighbors.
 * Whenever event() itself changes some port, processors on the other end of that port are re-evaluated too.
 * Processors that report SYNC or ASYNC are queued. Everything else just waits until its ports change again.
 *
 * The executor is single-use. Graph ports keep state of the execution and there's no way to reset them.
 * Callers that want to retry must build fresh graph and fresh executor.
 */
/**
 * Runs {@link PipelineGraph} on a pool of worker threads.
 */
@StubDocs
public class PipelineExecutor {
	private static final Logger logger = LoggerFactory.getLogger(PipelineExecutor.class);
	private final PipelineGraph graph;
	public PipelineExecutor(PipelineGraph graph) {
		Objects.requireNonNull(graph);
		this.graph = graph;
	}
	public PipelineGraph graph() {
		return graph;
	}
	/*
	 * Configuration can be changed only before run() is called.
	 */
	private boolean started;
	private void ensureNotStarted() {
		if (started)
			throw new IllegalStateException("Pipeline executor is already running.");
	}
	private int workers = Runtime.getRuntime().availableProcessors();
	public synchronized PipelineExecutor workers(int workers) {
		Preconditions.checkArgument(workers > 0, "Worker count must be positive.");
		ensureNotStarted();
		this.workers = workers;
		return this;
	}
	public synchronized int workers() {
		return workers;
	}
	/*
	 * Asynchronous runtime is any Executor. It just needs to run the submitted Runnable eventually.
	 */
	private Executor runtime = PipelineRuntime.common();
	public synchronized PipelineExecutor runtime(Executor runtime) {
		Objects.requireNonNull(runtime);
		ensureNotStarted();
		this.runtime = runtime;
		return this;
	}
	public synchronized Executor runtime() {
		return runtime;
	}
	private MeterRegistry registry = Metrics.globalRegistry;
	public synchronized PipelineExecutor registry(MeterRegistry registry) {
		Objects.requireNonNull(registry);
		ensureNotStarted();
		this.registry = registry;
		return this;
	}
	public synchronized MeterRegistry registry() {
		return registry;
	}
	/*
	 * Worker threads are daemon threads by default. Run() blocks until they exit anyway,
	 * but a stuck processor should not prevent process termination.
	 */
	private ThreadFactory threads = new ThreadFactoryBuilder()
		.setNameFormat("pipeline-worker-%d")
		.setDaemon(true)
		.build();
	public synchronized PipelineExecutor threads(ThreadFactory threads) {
		Objects.requireNonNull(threads);
		ensureNotStarted();
		this.threads = threads;
		return this;
	}
	public synchronized ThreadFactory threads() {
		return threads;
	}
	/*
	 * Execution state. Arrays and helper objects are created when run() starts.
	 */
	private volatile ProcessorNode[] nodes;
	private volatile ExecutorTaskQueue queue;
	private volatile WorkerNotifier notifier;
	private final AtomicInteger finished = new AtomicInteger();
	private final AtomicInteger inflight = new AtomicInteger();
	private volatile boolean completed;
	private final AtomicBoolean cancelled = new AtomicBoolean();
	private final AtomicReference<PipelineException> failure = new AtomicReference<>();
	private final List<PipelineException> suppressed = new ArrayList<>();
	/*
	 * Statistics are kept both locally, so that every executor can be inspected, and in the meter registry.
	 */
	private final LongAdder scheduledCount = new LongAdder();
	private final LongAdder completedCount = new LongAdder();
	private final LongAdder asyncCount = new LongAdder();
	private Counter scheduledCounter;
	private Counter completedCounter;
	private Counter asyncCounter;
	private Counter failureCounter;
	private Timer taskTimer;
	public long scheduledCount() {
		return scheduledCount.sum();
	}
	public long completedCount() {
		return completedCount.sum();
	}
	public long asyncCount() {
		return asyncCount.sum();
	}
	public long wakeupCount() {
		WorkerNotifier current = notifier;
		return current != null ? current.wakeups() : 0;
	}
	private static final ThreadLocal<PipelineExecutor> current = new ThreadLocal<>();
	/**
	 * Executor whose worker or asynchronous task is running the calling code.
	 *
	 * @return current executor or {@code null} when called outside of any pipeline
	 */
	public static PipelineExecutor current() {
		return current.get();
	}
	void enter() {
		current.set(this);
	}
	void exit() {
		current.remove();
	}
	public static void run(PipelineGraph graph, int workers) {
		new PipelineExecutor(graph).workers(workers).run();
	}
	/**
	 * Runs the pipeline to completion. Blocks until all workers exit.
	 * Interrupting the calling thread cancels the pipeline. Interrupt flag is then restored before returning.
	 *
	 * @throws ProcessorException
	 *             if any processor failed, the first failure is thrown
	 * @throws PipelineLogicException
	 *             if the scheduler detected violation of its invariants, including stalled pipeline
	 * @throws IllegalStateException
	 *             if the executor was already started or the graph is not valid
	 */
	public void run() {
		int parallelism;
		synchronized (this) {
			ensureNotStarted();
			started = true;
			parallelism = workers;
		}
		graph.seal();
		scheduledCounter = registry.counter("pipelines.tasks.scheduled");
		completedCounter = registry.counter("pipelines.tasks.completed");
		asyncCounter = registry.counter("pipelines.tasks.async");
		failureCounter = registry.counter("pipelines.failures");
		taskTimer = registry.timer("pipelines.tasks");
		ProcessorNode[] created = new ProcessorNode[graph.size()];
		for (int i = 0; i < created.length; ++i)
			created[i] = new ProcessorNode(graph, new ProcessorId(i));
		queue = new ExecutorTaskQueue();
		notifier = new WorkerNotifier(parallelism, this::idle, this::stall);
		nodes = created;
		logger.debug("Starting pipeline of {} processors on {} workers.", created.length, parallelism);
		/*
		 * Cancellation might have arrived before there were any ports to finish.
		 */
		if (cancelled.get())
			forceFinish();
		if (created.length == 0)
			complete();
		IntArrayFIFOQueue seeds = new IntArrayFIFOQueue();
		for (int i = 0; i < created.length; ++i)
			seeds.enqueue(i);
		schedule(seeds);
		List<Thread> pool = new ArrayList<>();
		for (int i = 0; i < parallelism; ++i) {
			Thread thread = threads.newThread(new ExecutorWorker(this, i));
			pool.add(thread);
			thread.start();
		}
		boolean interrupted = false;
		for (Thread thread : pool) {
			while (true) {
				try {
					thread.join();
					break;
				} catch (InterruptedException ex) {
					interrupted = true;
					cancel();
				}
			}
		}
		if (interrupted)
			Thread.currentThread().interrupt();
		registry.counter("pipelines.worker.wakes").increment(notifier.wakeups());
		PipelineException exception = failure.get();
		if (exception != null) {
			synchronized (suppressed) {
				for (PipelineException other : suppressed)
					exception.addSuppressed(other);
			}
			throw exception;
		}
		logger.debug("Pipeline {} after {} tasks.", cancelled.get() ? "cancelled" : "finished", completedCount.sum());
	}
	/**
	 * Requests cancellation. Only the first call has any effect.
	 * Queued synchronous tasks still run, but nothing new is scheduled and all ports are force-finished.
	 * Results of asynchronous tasks that are still running are discarded when they arrive.
	 * Cancelled pipeline completes normally, i.e. {@link #run()} returns without exception.
	 */
	public void cancel() {
		if (cancelled.compareAndSet(false, true)) {
			logger.debug("Cancelling pipeline.");
			forceFinish();
			WorkerNotifier current = notifier;
			if (current != null)
				current.wakeAll();
		}
	}
	public boolean cancelled() {
		return cancelled.get();
	}
	/**
	 * Cooperative cancellation check for long-running processors.
	 *
	 * @throws PipelineCancelledException
	 *             if the pipeline was cancelled
	 */
	public void checkCancelled() {
		if (cancelled.get())
			throw new PipelineCancelledException();
	}
	public boolean failed() {
		return failure.get() != null;
	}
	public boolean terminated() {
		return completed || cancelled.get() || failure.get() != null;
	}
	ExecutorTaskQueue queue() {
		return queue;
	}
	WorkerNotifier notifier() {
		return notifier;
	}
	ProcessorNode node(ProcessorId id) {
		return nodes[id.index()];
	}
	/*
	 * Evaluates processors in the pending queue. Processors behind ports changed during evaluation are appended to the queue.
	 * This converges, because ports change version only on real state transitions.
	 */
	void schedule(IntArrayFIFOQueue pending) {
		while (!pending.isEmpty()) {
			if (terminated())
				return;
			ProcessorNode node = nodes[pending.dequeueInt()];
			ProcessorEvent event;
			try {
				event = node.evaluate(pending::enqueue);
			} catch (Throwable ex) {
				fail(node, ex);
				return;
			}
			if (event == null)
				continue;
			switch (event) {
				case SYNC:
					enqueue(ExecutorTask.sync(node.id, node.name));
					break;
				case ASYNC:
					enqueue(ExecutorTask.async(node.id, node.name));
					break;
				case FINISHED:
					logger.trace("Processor {} finished.", node);
					if (finished.incrementAndGet() == nodes.length)
						complete();
					break;
				default:
					break;
			}
		}
	}
	private void enqueue(ExecutorTask task) {
		queue.pushReady(task);
		scheduledCount.increment();
		scheduledCounter.increment();
		/*
		 * Wake even if the queue wasn't empty. Parked workers would otherwise sleep while the queue grows.
		 * Notifier turns the wake into a permit if nobody is parked.
		 */
		notifier.wakeOne();
	}
	/*
	 * Called by workers after processor's task completed successfully.
	 * During cancellation, tasks still complete, but nothing new is scheduled.
	 */
	void completed(ProcessorNode node) {
		completedCount.increment();
		completedCounter.increment();
		if (terminated())
			return;
		IntArrayFIFOQueue pending = new IntArrayFIFOQueue();
		pending.enqueue(node.id.index());
		for (int neighbor : node.neighbors)
			pending.enqueue(neighbor);
		schedule(pending);
	}
	Timer.Sample startTimer() {
		return Timer.start(registry);
	}
	void stopTimer(Timer.Sample sample) {
		sample.stop(taskTimer);
	}
	static Span span(String operation, ProcessorNode node) {
		return GlobalTracer.get().buildSpan(operation)
			.withTag("component", "pipelines")
			.withTag("processor.name", node.name)
			.withTag("processor.id", node.id.index())
			.start();
	}
	/*
	 * Async work counts as in-flight from hand-off until its completion is posted,
	 * so that stall detection never mistakes pending I/O for a stalled pipeline.
	 */
	void spawn(ProcessorNode node, int worker) {
		inflight.incrementAndGet();
		asyncCount.increment();
		asyncCounter.increment();
		try {
			runtime.execute(ExceptionLogging.log(logger).runnable(() -> runAsync(node, worker)));
		} catch (RejectedExecutionException ex) {
			inflight.decrementAndGet();
			fail(node, ex);
		}
	}
	private void runAsync(ProcessorNode node, int worker) {
		Span span = span("pipelines.async", node);
		CompletableFuture<Void> future;
		enter();
		try (Scope scope = GlobalTracer.get().activateSpan(span)) {
			future = node.processor.processAsync();
			if (future == null)
				future = CompletableFuture.failedFuture(new PipelineLogicException("Processor " + node + " returned null future."));
		} catch (Throwable ex) {
			future = CompletableFuture.failedFuture(ex);
		} finally {
			exit();
		}
		future.whenComplete((result, exception) -> ExceptionLogging.log(logger).run(() -> {
			Throwable cause = exception instanceof CompletionException && exception.getCause() != null ? exception.getCause() : exception;
			if (cause != null)
				Tags.ERROR.set(span, true);
			span.finish();
			completeAsync(new CompletedAsyncTask(node.id, worker, cause));
		}));
	}
	/*
	 * This is the only entry point that is called from foreign threads.
	 * Completion is posted before in-flight counter is decremented. Stall detection relies on this order.
	 */
	private void completeAsync(CompletedAsyncTask task) {
		queue.pushAsyncCompletion(task);
		notifier.wakeSpecific(task.worker());
		inflight.decrementAndGet();
	}
	/*
	 * Natural completion. All processors are finished, so there's nothing left to do for the workers.
	 */
	private void complete() {
		completed = true;
		logger.trace("All {} processors finished.", nodes.length);
		WorkerNotifier current = notifier;
		if (current != null)
			current.wakeAll();
	}
	private void forceFinish() {
		ProcessorNode[] current = nodes;
		if (current != null)
			for (ProcessorNode node : current)
				node.forceFinishPorts();
	}
	/*
	 * First failure wins. Later failures are kept as suppressed exceptions of the first one.
	 * Ports are force-finished, so that processors still running observe shutdown instead of waiting on each other.
	 */
	void fail(ProcessorNode node, Throwable exception) {
		if (exception instanceof PipelineCancelledException) {
			logger.debug("Processor {} observed cancellation.", node);
			cancel();
			return;
		}
		/*
		 * Processors that were queued before cancellation still run, but they find their ports force-finished.
		 * Whatever they throw is a consequence of cancellation.
		 */
		if (cancelled.get() && failure.get() == null && !(exception instanceof PipelineLogicException)) {
			logger.debug("Ignoring failure in {} after cancellation.", node, exception);
			return;
		}
		PipelineException wrapped;
		if (exception instanceof PipelineLogicException)
			wrapped = (PipelineLogicException)exception;
		else if (node != null)
			wrapped = new ProcessorException(node.id, node.name, exception);
		else
			wrapped = new PipelineLogicException("Unexpected failure in pipeline executor.", exception);
		if (failureCounter != null)
			failureCounter.increment();
		if (failure.compareAndSet(null, wrapped)) {
			logger.error("Pipeline failed in {}.", node != null ? node : "executor", exception);
			forceFinish();
			List<ExecutorTask> dropped = queue.clear();
			if (!dropped.isEmpty())
				logger.debug("Dropped {} queued tasks after failure.", dropped.size());
			notifier.wakeAll();
		} else {
			logger.warn("Another failure in {} after the pipeline already failed.", node != null ? node : "executor", exception);
			synchronized (suppressed) {
				suppressed.add(wrapped);
			}
		}
	}
	/*
	 * Called by the notifier under its lock. In-flight counter is read first,
	 * because async completion is posted to the queue before the counter is decremented.
	 */
	private boolean idle() {
		return inflight.get() == 0 && !queue.hasCompletions() && queue.isEmpty() && !terminated();
	}
	private void stall() {
		List<String> unfinished = new ArrayList<>();
		for (ProcessorNode node : nodes)
			if (node.state() != ProcessorNode.State.FINISHED)
				unfinished.add(node + " " + node.state());
		fail(null, new PipelineLogicException("Pipeline stalled with unfinished processors: " + unfinished));
	}
	@Override
	public String toString() {
		return "PipelineExecutor[" + graph + "]";
	}
}
