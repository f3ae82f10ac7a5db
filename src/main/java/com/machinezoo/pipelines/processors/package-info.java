// Part of Pipelines: https://pipelines.machinezoo.com
/**
 * Reusable processors: sources, sinks, transforms, broadcast, and merge.
 */
package com.machinezoo.pipelines.processors;
