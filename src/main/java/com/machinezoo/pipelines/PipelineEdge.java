// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

/**
 * Connection from an {@link OutputPort} of one processor to an {@link InputPort} of another.
 */
public final class PipelineEdge {
	private final int index;
	private final ProcessorId source;
	private final ProcessorId target;
	final PortState<?> port;
	PipelineEdge(int index, ProcessorId source, ProcessorId target, PortState<?> port) {
		this.index = index;
		this.source = source;
		this.target = target;
		this.port = port;
	}
	public int index() {
		return index;
	}
	public ProcessorId source() {
		return source;
	}
	public ProcessorId target() {
		return target;
	}
	/*
	 * Self-loops are rejected by the graph, so every edge has exactly one opposite endpoint.
	 */
	public ProcessorId opposite(ProcessorId end) {
		if (end.equals(source))
			return target;
		if (end.equals(target))
			return source;
		throw new IllegalArgumentException();
	}
	@Override
	public String toString() {
		return source + " -> " + target;
	}
}
