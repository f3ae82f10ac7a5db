// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines.processors;

import java.util.*;
import java.util.function.*;
import com.machinezoo.pipelines.*;
import com.machinezoo.stagean.*;

/*
 * Transform holds at most one input unit and one output unit besides what sits in its ports.
 * Output is drained before anything new is pulled, which propagates backpressure upstream.
 *
 * Finish flows both ways. End of input finishes the output and a finished output finishes the input.
 */
/**
 * Processor that maps every input unit to at most one output unit on a worker thread.
 * Returning {@code null} from the transformation drops the unit.
 *
 * @param <I>
 *            type of input data
 * @param <O>
 *            type of output data
 */
@StubDocs
public class TransformProcessor<I, O> implements Processor {
	private final InputPort<I> input = new InputPort<>();
	private final OutputPort<O> output = new OutputPort<>();
	private final Function<I, O> function;
	private I pulled;
	private boolean hasInput;
	private O transformed;
	public TransformProcessor(Function<I, O> function) {
		Objects.requireNonNull(function);
		this.function = function;
	}
	protected TransformProcessor() {
		function = null;
	}
	public InputPort<I> input() {
		return input;
	}
	public OutputPort<O> output() {
		return output;
	}
	@Override
	public List<InputPort<?>> inputs() {
		return List.of(input);
	}
	@Override
	public List<OutputPort<?>> outputs() {
		return List.of(output);
	}
	protected O transform(I data) throws Exception {
		return function.apply(data);
	}
	@Override
	public ProcessorEvent event() {
		if (output.isFinished()) {
			input.finish();
			return ProcessorEvent.FINISHED;
		}
		if (transformed != null) {
			if (!output.canPush())
				return ProcessorEvent.NEED_CONSUME;
			output.push(transformed);
			transformed = null;
		}
		if (hasInput)
			return ProcessorEvent.SYNC;
		if (input.isFinished()) {
			output.finish();
			return ProcessorEvent.FINISHED;
		}
		if (input.hasData()) {
			pulled = input.pull();
			hasInput = true;
			return ProcessorEvent.SYNC;
		}
		input.setNeedData();
		return ProcessorEvent.NEED_DATA;
	}
	@Override
	public void process() throws Exception {
		I data = pulled;
		pulled = null;
		hasInput = false;
		transformed = transform(data);
	}
}
