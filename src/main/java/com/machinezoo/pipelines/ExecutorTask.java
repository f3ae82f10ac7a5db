// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import java.util.*;

/**
 * Unit of work dispatched to a worker.
 */
public final class ExecutorTask {
	public enum Kind {
		/**
		 * No work. Executing it is a logic error.
		 */
		NONE,
		/**
		 * Run {@link Processor#process()} on the worker.
		 */
		SYNC,
		/**
		 * Hand {@link Processor#processAsync()} over to the asynchronous runtime.
		 */
		ASYNC,
		/**
		 * Fold result of finished asynchronous work back into the graph.
		 */
		ASYNC_COMPLETED
	}
	private static final ExecutorTask NONE = new ExecutorTask(Kind.NONE, null, null, null);
	private final Kind kind;
	private final ProcessorId processor;
	private final String name;
	private final CompletedAsyncTask completion;
	private ExecutorTask(Kind kind, ProcessorId processor, String name, CompletedAsyncTask completion) {
		this.kind = kind;
		this.processor = processor;
		this.name = name;
		this.completion = completion;
	}
	public static ExecutorTask none() {
		return NONE;
	}
	public static ExecutorTask sync(ProcessorId processor, String name) {
		return new ExecutorTask(Kind.SYNC, Objects.requireNonNull(processor), name, null);
	}
	public static ExecutorTask async(ProcessorId processor, String name) {
		return new ExecutorTask(Kind.ASYNC, Objects.requireNonNull(processor), name, null);
	}
	public static ExecutorTask completed(CompletedAsyncTask completion, String name) {
		return new ExecutorTask(Kind.ASYNC_COMPLETED, completion.processor(), name, completion);
	}
	public Kind kind() {
		return kind;
	}
	/**
	 * Handle of the processor this task belongs to.
	 * 
	 * @return processor handle or {@code null} for {@link Kind#NONE}
	 */
	public ProcessorId processor() {
		return processor;
	}
	public CompletedAsyncTask completion() {
		return completion;
	}
	@Override
	public String toString() {
		if (kind == Kind.NONE)
			return "NONE";
		return kind + "[" + name + " " + processor + "]";
	}
}
