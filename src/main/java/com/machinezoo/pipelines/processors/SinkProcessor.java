// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines.processors;

import java.util.*;
import java.util.function.*;
import com.machinezoo.pipelines.*;
import com.machinezoo.stagean.*;

/*
 * Sink pulls in event() and consumes in process(). Once the input is drained,
 * it runs one more synchronous task to let the subclass flush whatever it buffered.
 */
/**
 * Processor with single input that hands every received unit to a consumer.
 *
 * @param <T>
 *            type of consumed data
 */
@StubDocs
public class SinkProcessor<T> implements Processor {
	private final InputPort<T> input = new InputPort<>();
	private final Consumer<T> consumer;
	private T pulled;
	private boolean full;
	private boolean flushed;
	public SinkProcessor(Consumer<T> consumer) {
		Objects.requireNonNull(consumer);
		this.consumer = consumer;
	}
	protected SinkProcessor() {
		consumer = null;
	}
	public InputPort<T> input() {
		return input;
	}
	@Override
	public List<InputPort<?>> inputs() {
		return List.of(input);
	}
	protected void consume(T data) throws Exception {
		consumer.accept(data);
	}
	/**
	 * Called once after the last unit was consumed. Not called when the pipeline fails or gets cancelled.
	 *
	 * @throws Exception
	 *             if flushing failed
	 */
	protected void finish() throws Exception {
	}
	@Override
	public ProcessorEvent event() {
		if (full)
			return ProcessorEvent.SYNC;
		if (input.isFinished())
			return flushed ? ProcessorEvent.FINISHED : ProcessorEvent.SYNC;
		if (input.hasData()) {
			pulled = input.pull();
			full = true;
			return ProcessorEvent.SYNC;
		}
		input.setNeedData();
		return ProcessorEvent.NEED_DATA;
	}
	@Override
	public void process() throws Exception {
		if (full) {
			T data = pulled;
			pulled = null;
			full = false;
			consume(data);
		} else {
			flushed = true;
			finish();
		}
	}
}
