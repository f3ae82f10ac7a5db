// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

/**
 * Producing end of a port.
 * 
 * @param <T>
 *            type of data carried by the port
 */
public class OutputPort<T> extends Port<T> {
	/**
	 * Checks whether the port is empty and not finished, i.e. whether {@link #push(Object)} will deliver data.
	 * 
	 * @return {@code true} if data can be pushed
	 */
	public boolean canPush() {
		return state().canPush();
	}
	/**
	 * Buffers one unit of data in the port.
	 * Data pushed into finished port is dropped.
	 * 
	 * @param data
	 *            data to push, possibly {@code null}
	 * @throws IllegalStateException
	 *             if the port still holds unconsumed data
	 */
	public void push(T data) {
		state().push(data, null);
	}
	/**
	 * Sends an exception downstream in place of data. Consumer will see it thrown from {@link InputPort#pull()}.
	 * 
	 * @param exception
	 *            exception to send
	 */
	public void pushError(Throwable exception) {
		if (exception == null)
			throw new NullPointerException();
		state().push(null, exception);
	}
	/**
	 * Non-blocking variant of {@link #push(Object)} that reports full or finished port instead of throwing.
	 * 
	 * @param data
	 *            data to push
	 * @return {@link PortStatus#READY} if the data was buffered
	 */
	public PortStatus tryPush(T data) {
		return state().offer(data, null);
	}
	/**
	 * Checks whether the consumer requested data since the last push.
	 * 
	 * @return {@code true} if the consumer waits for data
	 */
	public boolean isNeedData() {
		return state().needData();
	}
	/**
	 * Checks whether the port was finished by either end or force-finished by the executor.
	 * Nothing pushed after this point will reach the consumer.
	 */
	@Override
	public boolean isFinished() {
		return state().finished();
	}
}
