// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.stagean.*;

/*
 * Processors are event-driven. Executor never asks processor to do anything without first asking what it wants to do.
 * This keeps the scheduling decisions in the executor while the processor only reports its readiness.
 *
 * Executor guarantees that no two methods of one processor ever run concurrently,
 * so processor implementations need no synchronization of their own.
 */
/**
 * Node of the pipeline graph.
 * 
 * @see PipelineGraph#add(Processor)
 */
@StubDocs
public interface Processor {
	/**
	 * Operator kind label used in logs, traces, and exception messages.
	 * 
	 * @return processor name
	 */
	default String name() {
		return getClass().getSimpleName();
	}
	/**
	 * Ports consumed by this processor. Graph needs them to find edge endpoints.
	 * 
	 * @return list of input ports
	 */
	default List<InputPort<?>> inputs() {
		return Collections.emptyList();
	}
	/**
	 * Ports produced by this processor.
	 * 
	 * @return list of output ports
	 */
	default List<OutputPort<?>> outputs() {
		return Collections.emptyList();
	}
	/**
	 * Reports what the processor wants to do next.
	 * This method must be cheap. It may move buffered data between internal state and ports, but it must not do real work.
	 * 
	 * @return readiness of the processor
	 * @throws Exception
	 *             if the processor failed, for example when it pulled an error from an input port
	 */
	ProcessorEvent event() throws Exception;
	/**
	 * Performs one bounded unit of CPU work. Called only after {@link #event()} returns {@link ProcessorEvent#SYNC}.
	 * Must not block on I/O.
	 * 
	 * @throws Exception
	 *             if the processor failed
	 */
	default void process() throws Exception {
		throw new PipelineLogicException(name() + " requested synchronous processing, but it does not implement process().");
	}
	/**
	 * Starts offloaded work. Called on the asynchronous runtime after {@link #event()} returns {@link ProcessorEvent#ASYNC}.
	 * The executor resumes scheduling this processor only after the returned future completes.
	 * 
	 * @return future that completes when the work is done
	 */
	default CompletableFuture<Void> processAsync() {
		return CompletableFuture.failedFuture(new PipelineLogicException(name() + " requested asynchronous processing, but it does not implement processAsync()."));
	}
}
