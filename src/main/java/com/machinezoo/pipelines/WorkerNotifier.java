// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import java.util.concurrent.locks.*;
import java.util.function.*;
import com.google.common.base.Preconditions;

/*
 * Plain condition variable would lose wakeups that arrive just before the worker starts waiting.
 * Every worker therefore has a guard flag that is set by wakes and consumed by await().
 * Wakes directed at no worker in particular are kept as permits when nobody is parked,
 * so that the next worker about to park returns immediately instead.
 * Permits are capped at worker count. More permits would only cause useless spins.
 *
 * Every worker parks on its own condition, so that wakeOne() really wakes just one worker.
 *
 * Wakes are idempotent. Waking an already woken worker has no further effect.
 *
 * Notifier is also the only place that knows when all workers are parked.
 * If that happens while the executor reports that there's nothing pending,
 * nobody would ever wake the workers again. That's a stall and we report it instead of hanging.
 */
/**
 * Parks idle workers and wakes them when new work arrives.
 */
public class WorkerNotifier {
	private static class Slot {
		boolean woken;
		boolean parked;
		final Condition condition;
		Slot(Condition condition) {
			this.condition = condition;
		}
	}
	private final ReentrantLock lock = new ReentrantLock();
	private final Slot[] slots;
	private final BooleanSupplier idle;
	private final Runnable stalled;
	private int parked;
	private int permits;
	private long wakeups;
	/**
	 * Creates notifier for fixed number of workers.
	 *
	 * @param workers
	 *            number of workers, at least one
	 * @param idle
	 *            reports whether the executor has no queued or in-flight work, evaluated under notifier's lock
	 * @param stalled
	 *            called when all workers are about to park while the executor is idle, expected to call {@link #wakeAll()}
	 */
	public WorkerNotifier(int workers, BooleanSupplier idle, Runnable stalled) {
		Preconditions.checkArgument(workers > 0, "Worker count must be positive.");
		this.idle = idle;
		this.stalled = stalled;
		slots = new Slot[workers];
		for (int i = 0; i < workers; ++i)
			slots[i] = new Slot(lock.newCondition());
	}
	public WorkerNotifier(int workers) {
		this(workers, () -> false, () -> {});
	}
	public int workers() {
		return slots.length;
	}
	private boolean pending() {
		if (permits > 0)
			return true;
		for (Slot slot : slots)
			if (slot.woken)
				return true;
		return false;
	}
	/**
	 * Parks the calling worker until it is woken by any of the wake methods.
	 * Returns immediately if a wake arrived since the last call.
	 *
	 * @param worker
	 *            ordinal of the calling worker
	 */
	public void await(int worker) {
		lock.lock();
		try {
			Slot slot = slots[worker];
			boolean reported = false;
			while (!slot.woken && permits == 0) {
				if (!reported && parked + 1 == slots.length && !pending() && idle.getAsBoolean()) {
					reported = true;
					stalled.run();
					continue;
				}
				slot.parked = true;
				++parked;
				try {
					slot.condition.awaitUninterruptibly();
				} finally {
					slot.parked = false;
					--parked;
				}
			}
			if (slot.woken)
				slot.woken = false;
			else
				--permits;
		} finally {
			lock.unlock();
		}
	}
	/**
	 * Wakes one parked worker or, if none is parked, lets the next worker skip parking.
	 */
	public void wakeOne() {
		lock.lock();
		try {
			wakeAny();
		} finally {
			lock.unlock();
		}
	}
	private void wakeAny() {
		for (Slot slot : slots) {
			if (slot.parked && !slot.woken) {
				slot.woken = true;
				++wakeups;
				slot.condition.signal();
				return;
			}
		}
		if (permits < slots.length)
			++permits;
	}
	/*
	 * Busy worker may stay busy for a long time. Its own wake flag is set, so it comes back for the work eventually,
	 * but another worker is woken too, so that the work does not wait for the busy one.
	 */
	/**
	 * Wakes particular worker if it is parked. Otherwise marks it woken and wakes some other worker as in {@link #wakeOne()}.
	 *
	 * @param worker
	 *            ordinal of the preferred worker
	 */
	public void wakeSpecific(int worker) {
		lock.lock();
		try {
			Slot slot = slots[worker];
			if (slot.parked) {
				if (!slot.woken) {
					slot.woken = true;
					++wakeups;
					slot.condition.signal();
				}
				return;
			}
			slot.woken = true;
			wakeAny();
		} finally {
			lock.unlock();
		}
	}
	/**
	 * Wakes every worker. Used when the pipeline reaches terminal state.
	 */
	public void wakeAll() {
		lock.lock();
		try {
			for (Slot slot : slots) {
				if (!slot.woken) {
					slot.woken = true;
					if (slot.parked) {
						++wakeups;
						slot.condition.signal();
					}
				}
			}
		} finally {
			lock.unlock();
		}
	}
	public int parked() {
		lock.lock();
		try {
			return parked;
		} finally {
			lock.unlock();
		}
	}
	/**
	 * Counts wakes that actually unparked a worker.
	 *
	 * @return number of unparked workers since creation
	 */
	public long wakeups() {
		lock.lock();
		try {
			return wakeups;
		} finally {
			lock.unlock();
		}
	}
}
