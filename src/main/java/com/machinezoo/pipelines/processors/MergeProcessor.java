// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines.processors;

import java.util.*;
import com.machinezoo.pipelines.*;
import com.machinezoo.stagean.*;

/*
 * Inputs are polled round-robin starting after the last input that delivered data, so that no input starves.
 * Order within every input is preserved. Order across inputs is not defined.
 */
/**
 * Processor that merges several input streams into one output.
 *
 * @param <T>
 *            type of merged data
 */
@StubDocs
public class MergeProcessor<T> implements Processor {
	private final List<InputPort<T>> inputs = new ArrayList<>();
	private final OutputPort<T> output = new OutputPort<>();
	private int next;
	public MergeProcessor(int fanin) {
		if (fanin <= 0)
			throw new IllegalArgumentException("Merge processor needs at least one input.");
		for (int i = 0; i < fanin; ++i)
			inputs.add(new InputPort<>());
	}
	public InputPort<T> input(int index) {
		return inputs.get(index);
	}
	public OutputPort<T> output() {
		return output;
	}
	@Override
	public List<InputPort<?>> inputs() {
		return Collections.unmodifiableList(inputs);
	}
	@Override
	public List<OutputPort<?>> outputs() {
		return List.of(output);
	}
	@Override
	public ProcessorEvent event() {
		if (output.isFinished()) {
			for (InputPort<T> input : inputs)
				input.finish();
			return ProcessorEvent.FINISHED;
		}
		if (!output.canPush())
			return ProcessorEvent.NEED_CONSUME;
		for (int i = 0; i < inputs.size(); ++i) {
			int index = (next + i) % inputs.size();
			InputPort<T> input = inputs.get(index);
			if (input.hasData()) {
				output.push(input.pull());
				next = index + 1;
				return ProcessorEvent.NEED_CONSUME;
			}
		}
		boolean open = false;
		for (InputPort<T> input : inputs) {
			if (!input.isFinished()) {
				input.setNeedData();
				open = true;
			}
		}
		if (!open) {
			output.finish();
			return ProcessorEvent.FINISHED;
		}
		return ProcessorEvent.NEED_DATA;
	}
}
