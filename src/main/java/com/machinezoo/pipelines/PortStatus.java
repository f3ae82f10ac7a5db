// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

/**
 * Outcome of non-blocking {@link OutputPort#tryPush(Object)} and {@link InputPort#tryPull(java.util.function.Consumer)}.
 */
public enum PortStatus {
	READY,
	NOT_READY,
	FINISHED
}
