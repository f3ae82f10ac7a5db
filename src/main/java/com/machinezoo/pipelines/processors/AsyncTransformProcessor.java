// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines.processors;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.pipelines.*;
import com.machinezoo.stagean.*;

/*
 * Every input unit passes through three stages:
 * - CONSUME: waiting for input
 * - PREPARE: CPU-bound preparation (serialization, compression) runs on a worker
 * - SUBMIT: the prepared unit is handed to I/O running on the asynchronous runtime
 *
 * Executor never runs two methods of one processor concurrently and it does not re-evaluate the processor
 * until the future returned from processAsync() completes. Fields can be therefore updated from the future's callback.
 */
/**
 * Transform that prepares every unit synchronously and then submits it to asynchronous I/O.
 * Result of the I/O, if not {@code null}, is pushed to the output port.
 *
 * @param <I>
 *            type of input data
 * @param <P>
 *            type of prepared data
 * @param <O>
 *            type of I/O results
 */
@DraftApi
public class AsyncTransformProcessor<I, P, O> implements Processor {
	private enum Stage {
		CONSUME,
		PREPARE,
		SUBMIT
	}
	private final InputPort<I> input = new InputPort<>();
	private final OutputPort<O> output = new OutputPort<>();
	private final Function<I, P> preparation;
	private final Function<P, CompletableFuture<O>> submission;
	private Stage stage = Stage.CONSUME;
	private I pulled;
	private P prepared;
	private O result;
	public AsyncTransformProcessor(Function<I, P> preparation, Function<P, CompletableFuture<O>> submission) {
		Objects.requireNonNull(preparation);
		Objects.requireNonNull(submission);
		this.preparation = preparation;
		this.submission = submission;
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
	@Override
	public ProcessorEvent event() {
		if (output.isFinished()) {
			input.finish();
			return ProcessorEvent.FINISHED;
		}
		if (result != null) {
			if (!output.canPush())
				return ProcessorEvent.NEED_CONSUME;
			output.push(result);
			result = null;
		}
		switch (stage) {
			case PREPARE:
				return ProcessorEvent.SYNC;
			case SUBMIT:
				return ProcessorEvent.ASYNC;
			default:
				if (input.isFinished()) {
					output.finish();
					return ProcessorEvent.FINISHED;
				}
				if (input.hasData()) {
					pulled = input.pull();
					stage = Stage.PREPARE;
					return ProcessorEvent.SYNC;
				}
				input.setNeedData();
				return ProcessorEvent.NEED_DATA;
		}
	}
	@Override
	public void process() {
		I data = pulled;
		pulled = null;
		prepared = preparation.apply(data);
		stage = Stage.SUBMIT;
	}
	@Override
	public CompletableFuture<Void> processAsync() {
		P data = prepared;
		prepared = null;
		return submission.apply(data).thenAccept(written -> {
			result = written;
			stage = Stage.CONSUME;
		});
	}
}
