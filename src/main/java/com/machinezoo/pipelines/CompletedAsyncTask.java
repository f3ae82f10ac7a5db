// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

/*
 * Result of processAsync() on its way back from the asynchronous runtime.
 * Worker that issued the task is recorded, so that the completion can preferably wake it up again.
 */
/**
 * Finished asynchronous work that must be folded back into the pipeline graph.
 */
public final class CompletedAsyncTask {
	private final ProcessorId processor;
	private final int worker;
	private final Throwable exception;
	public CompletedAsyncTask(ProcessorId processor, int worker, Throwable exception) {
		if (processor == null)
			throw new NullPointerException();
		this.processor = processor;
		this.worker = worker;
		this.exception = exception;
	}
	public ProcessorId processor() {
		return processor;
	}
	public int worker() {
		return worker;
	}
	/**
	 * Exception that failed the asynchronous work.
	 * 
	 * @return exception or {@code null} on success
	 */
	public Throwable exception() {
		return exception;
	}
	@Override
	public String toString() {
		return "CompletedAsyncTask[" + processor + ", worker " + worker + (exception != null ? ", failed: " + exception : "") + "]";
	}
}
