// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import com.machinezoo.stagean.*;

/*
 * Processors create their own ports. Ports are useless until PipelineGraph.connect() pairs output with input
 * and gives both of them the same shared state.
 */
/**
 * One end of a single-slot channel between two processors.
 * 
 * @param <T>
 *            type of data carried by the port
 * @see OutputPort
 * @see InputPort
 */
@StubDocs
public abstract class Port<T> {
	private volatile PortState<T> state;
	Port() {
	}
	void attach(PortState<T> state) {
		if (this.state != null)
			throw new IllegalStateException("Port is already connected.");
		this.state = state;
	}
	PortState<T> state() {
		PortState<T> current = state;
		if (current == null)
			throw new IllegalStateException("Port is not connected.");
		return current;
	}
	public boolean connected() {
		return state != null;
	}
	public abstract boolean isFinished();
	/*
	 * Both ends can finish the port. Output finishes it at the end of the stream, input when it doesn't want any more data.
	 */
	public void finish() {
		state().finish();
	}
	@Override
	public String toString() {
		PortState<T> current = state;
		return getClass().getSimpleName() + (current != null ? current.toString() : "[unconnected]");
	}
}
