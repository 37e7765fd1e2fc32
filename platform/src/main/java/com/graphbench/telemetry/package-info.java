/**
 * Performance telemetry for graph-processing benchmark runs.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@code parse} - duration, tool-report, dstat and sar readers</li>
 *   <li>{@code capture} - {@link com.graphbench.telemetry.capture.ToolCapture} runs a phase under GNU time, dstat and sar</li>
 *   <li>{@code sampler} - {@link com.graphbench.telemetry.sampler.ProcessSupervisor} runs a command and samples host counters</li>
 *   <li>{@code aggregate} - {@link com.graphbench.telemetry.aggregate.MetricsAggregator} joins profiler output into the summary table</li>
 *   <li>{@code report} - per-dataset framework comparison</li>
 *   <li>{@code cli} - {@link com.graphbench.telemetry.cli.TelemetryCli} entry point</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * java -jar telemetry-platform.jar capture --framework hadoop --dataset email-EuAll --phase indegree -- hadoop jar degree.jar
 * java -jar telemetry-platform.jar sample --system spark --dataset email-EuAll -- spark-submit job.py
 * java -jar telemetry-platform.jar aggregate --data-root ./data
 * java -jar telemetry-platform.jar compare
 * }</pre>
 *
 * @see com.graphbench.telemetry.cli.TelemetryCli
 */
package com.graphbench.telemetry;
