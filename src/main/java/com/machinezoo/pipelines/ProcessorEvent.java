// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

/**
 * Readiness of a {@link Processor} as reported by {@link Processor#event()}.
 */
public enum ProcessorEvent {
	/**
	 * Waiting for data on an input port. Processor is not rescheduled until some of its ports change.
	 */
	NEED_DATA,
	/**
	 * Waiting for downstream processor to drain an output port.
	 */
	NEED_CONSUME,
	/**
	 * Ready to run {@link Processor#process()} on a worker thread.
	 */
	SYNC,
	/**
	 * Ready to run {@link Processor#processAsync()} on the asynchronous runtime.
	 */
	ASYNC,
	/**
	 * No more work, ever.
	 */
	FINISHED;
	public boolean runnable() {
		return this == SYNC || this == ASYNC;
	}
}
