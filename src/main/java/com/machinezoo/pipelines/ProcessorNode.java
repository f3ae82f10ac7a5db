// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import java.util.function.*;
import java.util.function.IntConsumer;
import it.unimi.dsi.fastutil.ints.*;

/*
 * Executor's view of one processor. It carries scheduling state that enforces mutual exclusion.
 *
 * State transitions:
 * - IDLE -> QUEUED when event() reports SYNC or ASYNC
 * - QUEUED -> RUNNING when a worker takes the task
 * - RUNNING -> IDLE when process() returns or async completion is folded back
 * - IDLE -> FINISHED when event() reports FINISHED
 *
 * Only IDLE processors are evaluated. Since event() runs under this object's monitor,
 * and process()/processAsync() run only in RUNNING state, no two methods of the processor ever overlap.
 */
class ProcessorNode {
	enum State {
		IDLE,
		QUEUED,
		RUNNING,
		FINISHED
	}
	final ProcessorId id;
	final Processor processor;
	final String name;
	/*
	 * Ports of all attached edges together with processors at the opposite ends.
	 * Used to map changed port versions to processors that need re-evaluation.
	 */
	private final PortState<?>[] ports;
	private final int[] peers;
	/*
	 * All distinct neighbors. Re-evaluated after every completed task.
	 */
	final int[] neighbors;
	private final long[] versions;
	private State state = State.IDLE;
	ProcessorNode(PipelineGraph graph, ProcessorId id) {
		this.id = id;
		processor = graph.processor(id);
		name = processor.name();
		IntList edges = graph.edges(id);
		ports = new PortState<?>[edges.size()];
		peers = new int[edges.size()];
		versions = new long[edges.size()];
		for (int i = 0; i < ports.length; ++i) {
			PipelineEdge edge = graph.edge(edges.getInt(i));
			ports[i] = edge.port;
			peers[i] = edge.opposite(id).index();
		}
		neighbors = graph.neighbors(id).stream().mapToInt(ProcessorId::index).toArray();
	}
	synchronized State state() {
		return state;
	}
	/*
	 * Returns null if the processor is not idle. Otherwise returns processor's event and reports neighbors behind changed ports.
	 * Exceptions from event() propagate. The executor fails the whole pipeline in that case, so node state doesn't matter anymore.
	 */
	synchronized ProcessorEvent evaluate(IntConsumer changed) throws Exception {
		if (state != State.IDLE)
			return null;
		for (int i = 0; i < ports.length; ++i)
			versions[i] = ports[i].version();
		ProcessorEvent event = processor.event();
		if (event == null)
			throw new PipelineLogicException("Processor " + name + " " + id + " returned null event.");
		switch (event) {
			case SYNC:
			case ASYNC:
				state = State.QUEUED;
				break;
			case FINISHED:
				state = State.FINISHED;
				break;
			default:
				break;
		}
		for (int i = 0; i < ports.length; ++i)
			if (ports[i].version() != versions[i])
				changed.accept(peers[i]);
		return event;
	}
	synchronized void acquire() {
		if (state != State.QUEUED)
			throw new PipelineLogicException("Processor " + name + " " + id + " dispatched in state " + state + ".");
		state = State.RUNNING;
	}
	synchronized void release() {
		if (state != State.RUNNING)
			throw new PipelineLogicException("Processor " + name + " " + id + " released in state " + state + ".");
		state = State.IDLE;
	}
	void forceFinishPorts() {
		for (PortState<?> port : ports)
			port.forceFinish();
	}
	@Override
	public String toString() {
		return name + " " + id;
	}
}
