// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import java.util.*;
import com.google.common.base.Preconditions;
import com.machinezoo.stagean.*;
import it.unimi.dsi.fastutil.ints.*;

/*
 * Graph is an arena of processors indexed by ProcessorId. Edges reference processors by index, never by object,
 * which gives us O(1) neighbor lookup without any reference cycles between processors and ports.
 *
 * Graph is built on one thread and then handed over to the executor, which seals it.
 * After sealing, the graph is immutable and it can be read from any worker without synchronization.
 */
/**
 * Directed acyclic graph of processors connected by ports.
 */
@StubDocs
public class PipelineGraph {
	private final List<Processor> processors = new ArrayList<>();
	private final List<PipelineEdge> edges = new ArrayList<>();
	/*
	 * Per-processor lists of edge indexes. Inbound edges end in the processor's input ports, outbound edges start in its outputs.
	 */
	private final List<IntList> inbound = new ArrayList<>();
	private final List<IntList> outbound = new ArrayList<>();
	/*
	 * Ports are matched by identity. Ports are plain objects without meaningful equals().
	 */
	private final Map<Port<?>, ProcessorId> owners = new IdentityHashMap<>();
	private boolean sealed;
	private void ensureNotSealed() {
		if (sealed)
			throw new IllegalStateException("Pipeline graph cannot be modified after execution has started.");
	}
	public synchronized ProcessorId add(Processor processor) {
		Objects.requireNonNull(processor);
		ensureNotSealed();
		Preconditions.checkArgument(processors.stream().noneMatch(p -> p == processor), "Processor %s is already in the graph.", processor.name());
		ProcessorId id = new ProcessorId(processors.size());
		List<Port<?>> ports = new ArrayList<>();
		ports.addAll(processor.inputs());
		ports.addAll(processor.outputs());
		for (Port<?> port : ports) {
			Objects.requireNonNull(port);
			Preconditions.checkArgument(!owners.containsKey(port), "Port of processor %s is already owned by another processor.", processor.name());
		}
		for (Port<?> port : ports)
			owners.put(port, id);
		processors.add(processor);
		inbound.add(new IntArrayList());
		outbound.add(new IntArrayList());
		return id;
	}
	public synchronized <T> PipelineEdge connect(OutputPort<T> output, InputPort<T> input) {
		Objects.requireNonNull(output);
		Objects.requireNonNull(input);
		ensureNotSealed();
		ProcessorId source = owners.get(output);
		ProcessorId target = owners.get(input);
		Preconditions.checkArgument(source != null, "Output port does not belong to any processor in the graph.");
		Preconditions.checkArgument(target != null, "Input port does not belong to any processor in the graph.");
		Preconditions.checkArgument(!source.equals(target), "Processor %s cannot be connected to itself.", processors.get(source.index()).name());
		Preconditions.checkState(!output.connected() && !input.connected(), "Port is already connected.");
		PortState<T> state = new PortState<>();
		output.attach(state);
		input.attach(state);
		PipelineEdge edge = new PipelineEdge(edges.size(), source, target, state);
		edges.add(edge);
		outbound.get(source.index()).add(edge.index());
		inbound.get(target.index()).add(edge.index());
		return edge;
	}
	public synchronized int size() {
		return processors.size();
	}
	public synchronized Processor processor(ProcessorId id) {
		return processors.get(id.index());
	}
	public synchronized List<Processor> processors() {
		return Collections.unmodifiableList(new ArrayList<>(processors));
	}
	public synchronized List<PipelineEdge> edges() {
		return Collections.unmodifiableList(new ArrayList<>(edges));
	}
	public synchronized PipelineEdge edge(int index) {
		return edges.get(index);
	}
	public synchronized ProcessorId owner(Port<?> port) {
		return owners.get(port);
	}
	/**
	 * Lists edges attached to the processor, inbound edges first.
	 *
	 * @param id
	 *            processor handle
	 * @return indexes of attached edges
	 */
	public synchronized IntList edges(ProcessorId id) {
		IntList all = new IntArrayList(inbound.get(id.index()));
		all.addAll(outbound.get(id.index()));
		return IntLists.unmodifiable(all);
	}
	private List<ProcessorId> ends(IntList list, boolean sources) {
		/*
		 * Parallel edges between the same two processors are allowed, so deduplicate while preserving order.
		 */
		IntSet seen = new IntLinkedOpenHashSet();
		for (int index : list) {
			PipelineEdge edge = edges.get(index);
			seen.add((sources ? edge.source() : edge.target()).index());
		}
		List<ProcessorId> ids = new ArrayList<>();
		for (int index : seen)
			ids.add(new ProcessorId(index));
		return ids;
	}
	public synchronized List<ProcessorId> predecessors(ProcessorId id) {
		return ends(inbound.get(id.index()), true);
	}
	public synchronized List<ProcessorId> successors(ProcessorId id) {
		return ends(outbound.get(id.index()), false);
	}
	public synchronized List<ProcessorId> neighbors(ProcessorId id) {
		List<ProcessorId> all = new ArrayList<>(predecessors(id));
		for (ProcessorId successor : successors(id))
			if (!all.contains(successor))
				all.add(successor);
		return all;
	}
	/*
	 * Kahn's algorithm. Processors left with non-zero in-degree are on a cycle or downstream of one.
	 */
	private void checkAcyclic() {
		int[] degrees = new int[processors.size()];
		for (PipelineEdge edge : edges)
			++degrees[edge.target().index()];
		IntArrayFIFOQueue ready = new IntArrayFIFOQueue();
		for (int i = 0; i < degrees.length; ++i)
			if (degrees[i] == 0)
				ready.enqueue(i);
		int placed = 0;
		while (!ready.isEmpty()) {
			int node = ready.dequeueInt();
			++placed;
			for (int index : outbound.get(node)) {
				int target = edges.get(index).target().index();
				if (--degrees[target] == 0)
					ready.enqueue(target);
			}
		}
		if (placed != processors.size()) {
			List<String> stuck = new ArrayList<>();
			for (int i = 0; i < degrees.length; ++i)
				if (degrees[i] > 0)
					stuck.add(processors.get(i).name() + " #" + i);
			throw new IllegalStateException("Pipeline graph contains a cycle among processors: " + stuck);
		}
	}
	/*
	 * Called by the executor before it starts. Sealing twice is not allowed, because every graph can be executed only once.
	 * Ports carry state of previous execution and there's no way to reset them.
	 */
	synchronized void seal() {
		ensureNotSealed();
		for (Map.Entry<Port<?>, ProcessorId> entry : owners.entrySet()) {
			if (!entry.getKey().connected())
				throw new IllegalStateException("Processor " + processors.get(entry.getValue().index()).name() + " " + entry.getValue() + " has unconnected port.");
		}
		checkAcyclic();
		sealed = true;
	}
	@Override
	public synchronized String toString() {
		return "PipelineGraph[" + processors.size() + " processors, " + edges.size() + " edges]";
	}
}
