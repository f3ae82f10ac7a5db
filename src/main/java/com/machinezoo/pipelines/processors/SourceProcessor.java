// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines.processors;

import java.util.*;
import java.util.function.*;
import com.machinezoo.pipelines.*;
import com.machinezoo.stagean.*;

/*
 * Source generates the next unit only when its output port is empty.
 * Generated unit is kept in the processor until the next event() moves it into the port.
 * That way process() never touches ports and all port traffic happens in event().
 */
/**
 * Processor with single output that generates data until the generator returns {@code null}.
 *
 * @param <T>
 *            type of generated data
 */
@StubDocs
public class SourceProcessor<T> implements Processor {
	private final OutputPort<T> output = new OutputPort<>();
	private final Supplier<T> generator;
	private T buffered;
	private boolean exhausted;
	public SourceProcessor(Supplier<T> generator) {
		Objects.requireNonNull(generator);
		this.generator = generator;
	}
	/*
	 * For subclasses that override generate().
	 */
	protected SourceProcessor() {
		generator = null;
	}
	public OutputPort<T> output() {
		return output;
	}
	@Override
	public List<OutputPort<?>> outputs() {
		return List.of(output);
	}
	/**
	 * Produces the next unit of data.
	 *
	 * @return next unit or {@code null} at the end of the stream
	 * @throws Exception
	 *             if generation failed
	 */
	protected T generate() throws Exception {
		return generator.get();
	}
	@Override
	public ProcessorEvent event() {
		/*
		 * Consumer may finish the port early when it doesn't want any more data.
		 */
		if (output.isFinished())
			return ProcessorEvent.FINISHED;
		if (buffered != null) {
			if (!output.canPush())
				return ProcessorEvent.NEED_CONSUME;
			output.push(buffered);
			buffered = null;
		}
		if (exhausted) {
			output.finish();
			return ProcessorEvent.FINISHED;
		}
		if (!output.canPush())
			return ProcessorEvent.NEED_CONSUME;
		return ProcessorEvent.SYNC;
	}
	@Override
	public void process() throws Exception {
		T generated = generate();
		if (generated == null)
			exhausted = true;
		else
			buffered = generated;
	}
}
