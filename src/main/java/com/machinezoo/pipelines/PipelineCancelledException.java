// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

/**
 * Signals that the pipeline was cancelled before natural completion.
 * <p>
 * Processors may throw this exception (usually via {@link PipelineExecutor#checkCancelled()})
 * to stop work early. Executor treats it as cancellation rather than failure,
 * so it is never thrown from {@link PipelineExecutor#run()}.
 */
public class PipelineCancelledException extends PipelineException {
	private static final long serialVersionUID = 1L;
	public PipelineCancelledException() {
		super("Pipeline was cancelled.");
	}
}
