// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import java.util.concurrent.*;
import com.google.common.base.Preconditions;

/*
 * Shared state of one edge in the pipeline graph. Output and input port objects are just two views of this state.
 *
 * The slot holds at most one unit of data or one error. There is no queue behind it.
 * That's what limits every processor to running at most one unit ahead of its consumer.
 *
 * Every real state transition increments the version. Scheduler snapshots versions of all ports of a processor
 * around its event() call in order to learn which neighbors need to be re-evaluated.
 * Transitions that change nothing (repeated need-data requests, repeated finish) must not increment the version,
 * otherwise two idle processors would keep re-evaluating each other forever.
 *
 * Both ends can call in concurrently, because neighboring processors run on different workers.
 * Methods are short and never call out, so plain synchronization is cheap enough here.
 */
class PortState<T> {
	private T data;
	private Throwable error;
	private boolean full;
	private boolean finished;
	private boolean needData;
	private long version;
	synchronized long version() {
		return version;
	}
	synchronized boolean full() {
		return full;
	}
	synchronized boolean finished() {
		return finished;
	}
	/*
	 * Input side sees the port finished only after the last unit is pulled.
	 */
	synchronized boolean drained() {
		return finished && !full;
	}
	synchronized boolean needData() {
		return needData;
	}
	synchronized boolean canPush() {
		return !full && !finished;
	}
	synchronized PortStatus offer(T data, Throwable error) {
		if (finished)
			return PortStatus.FINISHED;
		if (full)
			return PortStatus.NOT_READY;
		this.data = data;
		this.error = error;
		full = true;
		needData = false;
		++version;
		return PortStatus.READY;
	}
	synchronized void push(T data, Throwable error) {
		/*
		 * Pushing into finished port silently drops the data. Consumer is gone, possibly because the pipeline failed.
		 */
		if (finished)
			return;
		Preconditions.checkState(!full, "Port already holds unconsumed data.");
		offer(data, error);
	}
	synchronized T pull() {
		Preconditions.checkState(full, "Port has no data to pull.");
		T result = data;
		Throwable exception = error;
		data = null;
		error = null;
		full = false;
		++version;
		if (exception != null)
			throw new CompletionException(exception);
		return result;
	}
	synchronized void requestData() {
		if (!needData && !finished) {
			needData = true;
			++version;
		}
	}
	synchronized void finish() {
		if (!finished) {
			finished = true;
			++version;
		}
	}
	/*
	 * Used when the pipeline fails or gets cancelled. Buffered unit is discarded, so that nothing flows past this point.
	 */
	synchronized void forceFinish() {
		if (!finished || full) {
			finished = true;
			full = false;
			data = null;
			error = null;
			++version;
		}
	}
	@Override
	public synchronized String toString() {
		return "port[" + (full ? "full" : "empty") + (finished ? ", finished" : "") + (needData ? ", need data" : "") + "]";
	}
}
