// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;

public class ExecutorTaskQueueTest extends TestBase {
	ExecutorTaskQueue q = new ExecutorTaskQueue();
	static ExecutorTask sync(int id) {
		return ExecutorTask.sync(new ProcessorId(id), "test");
	}
	@Test
	public void fifo() {
		assertTrue(q.isEmpty());
		assertNull(q.popReady());
		// First push reports empty queue, so that the caller knows it should wake a worker.
		assertTrue(q.pushReady(sync(1)));
		assertFalse(q.pushReady(ExecutorTask.async(new ProcessorId(2), "test")));
		assertFalse(q.pushReady(sync(3)));
		assertEquals(3, q.size());
		// Tasks come out in insertion order.
		assertEquals(new ProcessorId(1), q.popReady().processor());
		ExecutorTask second = q.popReady();
		assertEquals(ExecutorTask.Kind.ASYNC, second.kind());
		assertEquals(new ProcessorId(2), second.processor());
		assertEquals(new ProcessorId(3), q.popReady().processor());
		assertNull(q.popReady());
	}
	@Test
	public void dedup() {
		q.pushReady(sync(1));
		// The same processor is never queued twice.
		assertFalse(q.pushReady(sync(1)));
		assertEquals(1, q.size());
		assertTrue(q.contains(new ProcessorId(1)));
		q.popReady();
		assertFalse(q.contains(new ProcessorId(1)));
		// Once popped, it can be queued again.
		assertTrue(q.pushReady(sync(1)));
	}
	@Test
	public void rejected() {
		assertThrows(IllegalArgumentException.class, () -> q.pushReady(ExecutorTask.none()));
		CompletedAsyncTask completion = new CompletedAsyncTask(new ProcessorId(1), 0, null);
		assertThrows(IllegalArgumentException.class, () -> q.pushReady(ExecutorTask.completed(completion, "test")));
	}
	@Test
	public void clear() {
		q.pushReady(sync(1));
		q.pushReady(sync(2));
		List<ExecutorTask> dropped = q.clear();
		assertEquals(2, dropped.size());
		assertTrue(q.isEmpty());
		assertTrue(q.pushReady(sync(1)));
	}
	@Test
	public void completions() throws Exception {
		assertFalse(q.hasCompletions());
		assertEquals(List.of(), q.drainCompletions());
		// Completions are posted from many threads at once.
		int threads = 4;
		int each = 1000;
		ExecutorService pool = Executors.newFixedThreadPool(threads);
		try {
			for (int t = 0; t < threads; ++t) {
				int worker = t;
				pool.execute(() -> {
					for (int i = 0; i < each; ++i)
						q.pushAsyncCompletion(new CompletedAsyncTask(new ProcessorId(i), worker, null));
				});
			}
			// Every completion is claimed by exactly one drain.
			AtomicInteger drained = new AtomicInteger();
			long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
			while (drained.get() < threads * each && System.nanoTime() < deadline)
				drained.addAndGet(q.drainCompletions().size());
			assertEquals(threads * each, drained.get());
			assertFalse(q.hasCompletions());
		} finally {
			pool.shutdown();
		}
	}
	@Test
	public void describe() {
		assertEquals("NONE", ExecutorTask.none().toString());
		assertThat(ExecutorTask.sync(new ProcessorId(7), "Parser").toString(), allOf(containsString("SYNC"), containsString("Parser"), containsString("#7")));
		CompletedAsyncTask failed = new CompletedAsyncTask(new ProcessorId(7), 2, new RuntimeException());
		assertThat(ExecutorTask.completed(failed, "Writer").toString(), containsString("ASYNC_COMPLETED"));
		assertThat(failed.toString(), containsString("failed"));
	}
}
