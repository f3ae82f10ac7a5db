// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

/*
 * Logic exceptions are always bugs, either in the executor or in a processor that violates its contract.
 * Executor never tries to continue after one of these.
 */
/**
 * Violation of a scheduler invariant, for example dispatch of an empty task or a stalled pipeline.
 */
public class PipelineLogicException extends PipelineException {
	private static final long serialVersionUID = 1L;
	public PipelineLogicException(String message, Throwable cause) {
		super(message, cause);
	}
	public PipelineLogicException(String message) {
		this(message, null);
	}
}
