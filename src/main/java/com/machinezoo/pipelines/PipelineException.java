// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

/**
 * Base class of all exceptions thrown by pipeline execution.
 */
public class PipelineException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	public PipelineException(String message, Throwable cause) {
		super(message, cause);
	}
	public PipelineException(String message) {
		this(message, null);
	}
}
