// Part of Pipelines: https://pipelines.machinezoo.com
package com.machinezoo.pipelines;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;
import com.machinezoo.pipelines.processors.*;

public class PortTest extends TestBase {
	SourceProcessor<String> source;
	SinkProcessor<String> sink;
	OutputPort<String> output;
	InputPort<String> input;
	PipelineEdge edge;
	@BeforeEach
	public void setup() {
		source = new SourceProcessor<>(() -> null);
		sink = new SinkProcessor<>(s -> {});
		PipelineGraph graph = new PipelineGraph();
		graph.add(source);
		graph.add(sink);
		output = source.output();
		input = sink.input();
		edge = graph.connect(output, input);
	}
	@Test
	public void tryPush() {
		// Empty port accepts one unit.
		assertTrue(output.canPush());
		assertEquals(PortStatus.READY, output.tryPush("a"));
		// Second unit is refused until the first one is pulled.
		assertFalse(output.canPush());
		assertEquals(PortStatus.NOT_READY, output.tryPush("b"));
		assertTrue(input.hasData());
		assertEquals("a", input.pull());
		assertEquals(PortStatus.READY, output.tryPush("b"));
		// Finished port refuses everything.
		input.pull();
		output.finish();
		assertEquals(PortStatus.FINISHED, output.tryPush("c"));
	}
	@Test
	public void tryPull() {
		List<String> pulled = new ArrayList<>();
		// Empty port reports that it is not ready.
		assertEquals(PortStatus.NOT_READY, input.tryPull(pulled::add));
		output.push("a");
		assertEquals(PortStatus.READY, input.tryPull(pulled::add));
		assertEquals(List.of("a"), pulled);
		// Null is valid data.
		output.push(null);
		assertEquals(PortStatus.READY, input.tryPull(pulled::add));
		assertEquals(Arrays.asList("a", null), pulled);
		output.finish();
		assertEquals(PortStatus.FINISHED, input.tryPull(pulled::add));
	}
	@Test
	public void misuse() {
		// Pulling from empty port is a programming error.
		assertThrows(IllegalStateException.class, () -> input.pull());
		output.push("a");
		// So is pushing into full port.
		assertThrows(IllegalStateException.class, () -> output.push("b"));
	}
	@Test
	public void unconnected() {
		OutputPort<String> lonely = new OutputPort<>();
		assertFalse(lonely.connected());
		assertThrows(IllegalStateException.class, () -> lonely.push("a"));
		assertThrows(IllegalStateException.class, () -> new InputPort<String>().hasData());
		assertThat(lonely.toString(), containsString("unconnected"));
	}
	@Test
	public void finish() {
		output.push("last");
		output.finish();
		// Producer sees the port finished immediately.
		assertTrue(output.isFinished());
		// Consumer still gets the last unit.
		assertFalse(input.isFinished());
		assertEquals("last", input.pull());
		assertTrue(input.isFinished());
	}
	@Test
	public void finishByConsumer() {
		input.finish();
		assertTrue(output.isFinished());
		// Data pushed into finished port is silently dropped.
		output.push("dropped");
		assertFalse(input.hasData());
	}
	@Test
	public void forceFinish() {
		output.push("discarded");
		edge.port.forceFinish();
		// Buffered unit is gone.
		assertFalse(input.hasData());
		assertTrue(input.isFinished());
		assertTrue(output.isFinished());
	}
	@Test
	public void error() {
		IllegalArgumentException ex = new IllegalArgumentException();
		output.pushError(ex);
		// Error travels through the port like data and it is thrown on pull.
		assertTrue(input.hasData());
		CompletionException thrown = assertThrows(CompletionException.class, () -> input.pull());
		assertSame(ex, thrown.getCause());
		// Slot is free again.
		assertTrue(output.canPush());
	}
	@Test
	public void needData() {
		assertFalse(output.isNeedData());
		input.setNeedData();
		assertTrue(output.isNeedData());
		// Push satisfies the request.
		output.push("a");
		assertFalse(output.isNeedData());
	}
	@Test
	public void version() {
		long v0 = edge.port.version();
		input.setNeedData();
		long v1 = edge.port.version();
		assertThat(v1, greaterThan(v0));
		// Repeated request changes nothing.
		input.setNeedData();
		assertEquals(v1, edge.port.version());
		output.push("a");
		input.pull();
		long v2 = edge.port.version();
		assertThat(v2, greaterThan(v1));
		// Finish is counted only once.
		output.finish();
		long v3 = edge.port.version();
		assertThat(v3, greaterThan(v2));
		input.finish();
		edge.port.forceFinish();
		assertEquals(v3, edge.port.version());
	}
}
