// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import java.util.concurrent.*;
import java.util.function.*;

/**
 * Consuming end of a port.
 * 
 * @param <T>
 *            type of data carried by the port
 */
public class InputPort<T> extends Port<T> {
	public boolean hasData() {
		return state().full();
	}
	/**
	 * Takes the buffered unit of data out of the port.
	 * 
	 * @return pulled data
	 * @throws IllegalStateException
	 *             if the port holds no data
	 * @throws CompletionException
	 *             if the producer pushed an exception via {@link OutputPort#pushError(Throwable)}
	 */
	public T pull() {
		return state().pull();
	}
	/*
	 * Consumer is used instead of return value, because null is a valid unit of data.
	 */
	/**
	 * Non-blocking pull that reports empty or finished port instead of throwing.
	 * 
	 * @param consumer
	 *            receives the pulled data if there is any
	 * @return {@link PortStatus#READY} if data was pulled and passed to the consumer
	 */
	public PortStatus tryPull(Consumer<? super T> consumer) {
		PortState<T> state = state();
		T data;
		synchronized (state) {
			if (!state.full())
				return state.finished() ? PortStatus.FINISHED : PortStatus.NOT_READY;
			data = state.pull();
		}
		consumer.accept(data);
		return PortStatus.READY;
	}
	/**
	 * Tells the producer that this consumer is waiting for data.
	 */
	public void setNeedData() {
		state().requestData();
	}
	/**
	 * Checks whether the stream has ended. Last unit pushed before the producer finished the port
	 * must be pulled before this method returns {@code true}.
	 */
	@Override
	public boolean isFinished() {
		return state().drained();
	}
}
