// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import java.util.*;

/**
 * Failure of a single {@link Processor}, reported by {@link PipelineExecutor#run()}.
 * <p>
 * Exception thrown by the processor is available via {@link #getCause()}.
 * Name and ID of the failing processor are included in the message and exposed separately.
 */
public class ProcessorException extends PipelineException {
	private static final long serialVersionUID = 1L;
	private final ProcessorId processor;
	private final String processorName;
	public ProcessorException(ProcessorId processor, String processorName, Throwable cause) {
		super("Processor " + processorName + " " + processor + " failed: " + cause, Objects.requireNonNull(cause));
		this.processor = processor;
		this.processorName = processorName;
	}
	public ProcessorId processor() {
		return processor;
	}
	public String processorName() {
		return processorName;
	}
}
