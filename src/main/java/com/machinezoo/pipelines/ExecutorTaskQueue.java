// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import java.util.*;
import java.util.concurrent.*;
import it.unimi.dsi.fastutil.ints.*;

/*
 * Ready tasks are kept in FIFO order. LIFO would have better cache locality,
 * but it can starve a processor indefinitely when the graph is wide.
 *
 * Async completions arrive from threads of the asynchronous runtime that know nothing about workers.
 * They go to a separate lock-free list, so that foreign threads never contend on the ready queue lock.
 */
/**
 * Shared queue of processors ready to run and of finished asynchronous work.
 */
public class ExecutorTaskQueue {
	private final Deque<ExecutorTask> ready = new ArrayDeque<>();
	/*
	 * Indexes of processors currently in the ready queue. Enforces at most one queued task per processor.
	 */
	private final IntSet queued = new IntOpenHashSet();
	private final ConcurrentLinkedQueue<CompletedAsyncTask> completions = new ConcurrentLinkedQueue<>();
	/**
	 * Queues the task unless its processor is already queued.
	 * 
	 * @param task
	 *            task to queue
	 * @return {@code true} if the queue was empty before this call and the task was added
	 */
	public synchronized boolean pushReady(ExecutorTask task) {
		Objects.requireNonNull(task);
		if (task.kind() == ExecutorTask.Kind.NONE || task.kind() == ExecutorTask.Kind.ASYNC_COMPLETED)
			throw new IllegalArgumentException("Only SYNC and ASYNC tasks can be queued as ready: " + task);
		if (!queued.add(task.processor().index()))
			return false;
		boolean empty = ready.isEmpty();
		ready.addLast(task);
		return empty;
	}
	/**
	 * Removes the oldest ready task.
	 * 
	 * @return oldest task or {@code null} if there is none
	 */
	public synchronized ExecutorTask popReady() {
		ExecutorTask task = ready.pollFirst();
		if (task != null)
			queued.remove(task.processor().index());
		return task;
	}
	public synchronized boolean contains(ProcessorId processor) {
		return queued.contains(processor.index());
	}
	public synchronized int size() {
		return ready.size();
	}
	public synchronized boolean isEmpty() {
		return ready.isEmpty();
	}
	/*
	 * Used when the pipeline fails. Queued tasks are dropped without running.
	 */
	public synchronized List<ExecutorTask> clear() {
		List<ExecutorTask> dropped = new ArrayList<>(ready);
		ready.clear();
		queued.clear();
		return dropped;
	}
	/**
	 * Posts finished asynchronous work. Safe to call from any thread.
	 * 
	 * @param task
	 *            completed task
	 */
	public void pushAsyncCompletion(CompletedAsyncTask task) {
		completions.add(Objects.requireNonNull(task));
	}
	public boolean hasCompletions() {
		return !completions.isEmpty();
	}
	/**
	 * Claims all pending completions. Every completion is returned to exactly one caller.
	 * 
	 * @return claimed completions in arrival order
	 */
	public List<CompletedAsyncTask> drainCompletions() {
		List<CompletedAsyncTask> drained = new ArrayList<>();
		CompletedAsyncTask task;
		while ((task = completions.poll()) != null)
			drained.add(task);
		return drained;
	}
}
