// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

/**
 * Stable handle of a {@link Processor} in its {@link PipelineGraph}.
 * Handles are dense indexes starting at zero in the order processors were added.
 */
public final class ProcessorId implements Comparable<ProcessorId> {
	private final int index;
	ProcessorId(int index) {
		if (index < 0)
			throw new IllegalArgumentException();
		this.index = index;
	}
	public int index() {
		return index;
	}
	@Override
	public boolean equals(Object obj) {
		return obj instanceof ProcessorId && ((ProcessorId)obj).index == index;
	}
	@Override
	public int hashCode() {
		return Integer.hashCode(index);
	}
	@Override
	public int compareTo(ProcessorId other) {
		return Integer.compare(index, other.index);
	}
	@Override
	public String toString() {
		return "#" + index;
	}
}
