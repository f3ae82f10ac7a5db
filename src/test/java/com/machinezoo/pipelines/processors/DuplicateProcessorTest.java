// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines.processors;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;
import com.machinezoo.pipelines.*;

public class DuplicateProcessorTest extends TestBase {
	PipelineGraph graph = new PipelineGraph();
	@Test
	public void broadcast() {
		AtomicInteger next = new AtomicInteger();
		SourceProcessor<Integer> source = new SourceProcessor<>(() -> next.get() < 50 ? next.getAndIncrement() : null);
		DuplicateProcessor<Integer> duplicate = new DuplicateProcessor<>(3);
		graph.add(source);
		graph.add(duplicate);
		graph.connect(source.output(), duplicate.input());
		List<List<Integer>> received = new ArrayList<>();
		for (int i = 0; i < 3; ++i) {
			List<Integer> branch = new ArrayList<>();
			received.add(branch);
			SinkProcessor<Integer> sink = new SinkProcessor<>(branch::add);
			graph.add(sink);
			graph.connect(duplicate.output(i), sink.input());
		}
		PipelineExecutor.run(graph, 4);
		// Every output gets the full stream in order.
		List<Integer> expected = new ArrayList<>();
		for (int n = 0; n < 50; ++n)
			expected.add(n);
		for (List<Integer> branch : received)
			assertEquals(expected, branch);
	}
	@Test
	public void closedBranch() {
		AtomicInteger next = new AtomicInteger();
		SourceProcessor<Integer> source = new SourceProcessor<>(() -> next.get() < 20 ? next.getAndIncrement() : null);
		DuplicateProcessor<Integer> duplicate = new DuplicateProcessor<>(2);
		List<Integer> all = new ArrayList<>();
		SinkProcessor<Integer> full = new SinkProcessor<>(all::add);
		// The other branch stops listening after the first unit.
		SinkProcessor<Integer> picky = new SinkProcessor<>() {
			@Override
			protected void consume(Integer data) {
				input().finish();
			}
		};
		graph.add(source);
		graph.add(duplicate);
		graph.add(full);
		graph.add(picky);
		graph.connect(source.output(), duplicate.input());
		graph.connect(duplicate.output(0), full.input());
		graph.connect(duplicate.output(1), picky.input());
		PipelineExecutor.run(graph, 2);
		// Closed branch does not block the open one.
		assertEquals(20, all.size());
	}
	@Test
	public void invalid() {
		assertThrows(IllegalArgumentException.class, () -> new DuplicateProcessor<Integer>(0));
	}
}
