// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines.processors;

import java.util.*;
import com.machinezoo.pipelines.*;
import com.machinezoo.stagean.*;

/*
 * Broadcast does no real work, so everything happens in event() and process() is never requested.
 * Next unit is pulled only after the current one reached every output that is still open.
 * Output finished by its consumer is skipped. Input is finished only when all outputs are finished.
 */
/**
 * Processor that copies every input unit to all of its outputs.
 *
 * @param <T>
 *            type of broadcast data
 */
@StubDocs
public class DuplicateProcessor<T> implements Processor {
	private final InputPort<T> input = new InputPort<>();
	private final List<OutputPort<T>> outputs = new ArrayList<>();
	private T current;
	private boolean full;
	private final boolean[] delivered;
	public DuplicateProcessor(int fanout) {
		if (fanout <= 0)
			throw new IllegalArgumentException("Duplicate processor needs at least one output.");
		for (int i = 0; i < fanout; ++i)
			outputs.add(new OutputPort<>());
		delivered = new boolean[fanout];
	}
	public InputPort<T> input() {
		return input;
	}
	public OutputPort<T> output(int index) {
		return outputs.get(index);
	}
	@Override
	public List<InputPort<?>> inputs() {
		return List.of(input);
	}
	@Override
	public List<OutputPort<?>> outputs() {
		return Collections.unmodifiableList(outputs);
	}
	private boolean closed() {
		for (OutputPort<T> output : outputs)
			if (!output.isFinished())
				return false;
		return true;
	}
	@Override
	public ProcessorEvent event() {
		if (closed()) {
			input.finish();
			return ProcessorEvent.FINISHED;
		}
		if (full) {
			boolean pending = false;
			for (int i = 0; i < outputs.size(); ++i) {
				OutputPort<T> output = outputs.get(i);
				if (delivered[i] || output.isFinished())
					continue;
				if (output.canPush()) {
					output.push(current);
					delivered[i] = true;
				} else
					pending = true;
			}
			if (pending)
				return ProcessorEvent.NEED_CONSUME;
			current = null;
			full = false;
		}
		if (input.isFinished()) {
			for (OutputPort<T> output : outputs)
				output.finish();
			return ProcessorEvent.FINISHED;
		}
		if (input.hasData()) {
			current = input.pull();
			full = true;
			Arrays.fill(delivered, false);
			/*
			 * Try to deliver right away. Whatever cannot be delivered now waits for consumers.
			 */
			return event();
		}
		input.setNeedData();
		return ProcessorEvent.NEED_DATA;
	}
}
