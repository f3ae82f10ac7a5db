// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import java.util.*;
import org.slf4j.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.tag.Tags;
import io.opentracing.util.*;

/*
 * One worker runs on one thread for the whole lifetime of the pipeline.
 *
 * Worker loop takes ready tasks before it drains async completions. Completions are drained in batches
 * into a local backlog, which is emptied before the shared queue is checked again.
 * Worker parks only when there are no ready tasks, no completions, and the pipeline is still running.
 *
 * Workers exit once the pipeline reaches terminal state and there are no more queued tasks.
 * During cancellation, queued tasks still run, so that processors can release buffered resources.
 * After failure, the queue is cleared and whatever gets queued concurrently is discarded.
 */
class ExecutorWorker implements Runnable {
	private static final Logger logger = LoggerFactory.getLogger(ExecutorWorker.class);
	enum State {
		IDLE,
		DISPATCHING,
		RUNNING
	}
	private final PipelineExecutor executor;
	private final int ordinal;
	private final Deque<CompletedAsyncTask> backlog = new ArrayDeque<>();
	private ExecutorTask task = ExecutorTask.none();
	private volatile State state = State.IDLE;
	ExecutorWorker(PipelineExecutor executor, int ordinal) {
		this.executor = executor;
		this.ordinal = ordinal;
	}
	int ordinal() {
		return ordinal;
	}
	State state() {
		return state;
	}
	boolean hasTask() {
		return task.kind() != ExecutorTask.Kind.NONE;
	}
	void task(ExecutorTask task) {
		this.task = Objects.requireNonNull(task);
	}
	@Override
	public void run() {
		executor.enter();
		logger.debug("Worker {} started.", ordinal);
		try {
			while (next()) {
				state = State.DISPATCHING;
				execute();
				state = State.IDLE;
			}
		} catch (Throwable ex) {
			/*
			 * Processor failures are handled in execute(). Anything that gets here is executor's own bug.
			 */
			executor.fail(null, ex);
		} finally {
			state = State.IDLE;
			executor.exit();
			logger.debug("Worker {} exiting.", ordinal);
		}
	}
	/*
	 * Returns false when the worker should exit.
	 */
	private boolean next() {
		ExecutorTaskQueue queue = executor.queue();
		while (true) {
			CompletedAsyncTask completion = backlog.pollFirst();
			if (completion != null) {
				task = ExecutorTask.completed(completion, executor.node(completion.processor()).name);
				return true;
			}
			ExecutorTask ready = queue.popReady();
			if (ready != null) {
				task = ready;
				return true;
			}
			List<CompletedAsyncTask> drained = queue.drainCompletions();
			if (!drained.isEmpty()) {
				backlog.addAll(drained);
				continue;
			}
			if (executor.terminated())
				return false;
			executor.notifier().await(ordinal);
		}
	}
	void execute() {
		ExecutorTask current = task;
		task = ExecutorTask.none();
		logger.trace("Worker {} executing {}.", ordinal, current);
		switch (current.kind()) {
			case SYNC:
				executeSync(executor.node(current.processor()));
				break;
			case ASYNC:
				executeAsync(executor.node(current.processor()));
				break;
			case ASYNC_COMPLETED:
				executeCompleted(current.completion());
				break;
			default:
				throw new PipelineLogicException("Worker " + ordinal + " cannot execute empty task.");
		}
	}
	private void executeSync(ProcessorNode node) {
		if (executor.failed()) {
			logger.trace("Discarding {} after failure.", node);
			return;
		}
		node.acquire();
		state = State.RUNNING;
		Span span = PipelineExecutor.span("pipelines.process", node);
		Timer.Sample sample = executor.startTimer();
		try (Scope scope = GlobalTracer.get().activateSpan(span)) {
			node.processor.process();
		} catch (Throwable ex) {
			Tags.ERROR.set(span, true);
			executor.fail(node, ex);
			return;
		} finally {
			span.finish();
			executor.stopTimer(sample);
		}
		node.release();
		executor.completed(node);
	}
	private void executeAsync(ProcessorNode node) {
		if (executor.terminated()) {
			logger.trace("Not starting asynchronous work of {} after termination.", node);
			return;
		}
		node.acquire();
		executor.spawn(node, ordinal);
	}
	/*
	 * Completions arriving after termination are discarded. Processor stays in RUNNING state, which blocks any further scheduling.
	 */
	private void executeCompleted(CompletedAsyncTask completion) {
		ProcessorNode node = executor.node(completion.processor());
		if (executor.terminated()) {
			logger.debug("Discarding asynchronous result of {} after termination.", node);
			return;
		}
		if (completion.exception() != null) {
			executor.fail(node, completion.exception());
			return;
		}
		state = State.RUNNING;
		node.release();
		executor.completed(node);
	}
	@Override
	public String toString() {
		return "ExecutorWorker[" + ordinal + ", " + state + "]";
	}
}
