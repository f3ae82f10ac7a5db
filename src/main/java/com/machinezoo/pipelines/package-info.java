// Part of Pipelines: https://pipelines.machinezoo.com
/*
 * Diagnostic functions supported by the executor:
 * - Null check is performed on method parameters where appropriate.
 * - Exceptions from processors are never swallowed. The first one fails the pipeline and later ones are attached as suppressed.
 * - Callbacks that have no way to propagate exceptions log them.
 * - Metrics are exposed by the executor and by the common asynchronous runtime.
 * - Opentracing spans are created around every process() call and every asynchronous task.
 * - Method toString() is defined on graph, ports, tasks, and executor.
 */
/**
 * Dataflow pipeline graph and its multi-threaded executor.
 * 
 * @see com.machinezoo.pipelines.PipelineExecutor
 */
package com.machinezoo.pipelines;
