package com.graphbench.telemetry.aggregate;

import com.graphbench.platform.base.Result;
import com.graphbench.platform.config.TelemetryConfig;
import com.graphbench.platform.observe.InvestigationContext;
import com.graphbench.telemetry.model.DstatAverages;
import com.graphbench.telemetry.model.MetricsRecord;
import com.graphbench.telemetry.model.ParsedToolMetrics;
import com.graphbench.telemetry.model.RunKey;
import com.graphbench.telemetry.parse.DstatCsvReader;
import com.graphbench.telemetry.parse.SarReportReader;
import com.graphbench.telemetry.parse.ToolReportReader;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static com.graphbench.platform.observe.Log.*;

/**
 * Joins profiler output into one {@link MetricsRecord} per (framework, dataset, phase)
 * and writes the summary table.
 *
 * Per triple:
 * <ol>
 *   <li>tool report ({@code <phase>.time}) for elapsed, CPU seconds and max RSS</li>
 *   <li>dstat CSV for host averages</li>
 *   <li>sar reports, only when every dstat average is absent</li>
 * </ol>
 *
 * Triples are independent and are processed on a bounded pool; the only shared state is
 * the sorted result map.
 */
public final class MetricsAggregator {

    private final TelemetryConfig config;
    private final RunLayout layout;
    private final ToolReportReader toolReader;
    private final DstatCsvReader dstatReader;
    private final SarReportReader sarReader;

    public static MetricsAggregator create(TelemetryConfig config) {
        return new MetricsAggregator(config);
    }

    private MetricsAggregator(TelemetryConfig config) {
        this.config = config;
        this.layout = new RunLayout(config.paths().metricsRoot(), config.frameworks());
        this.toolReader = new ToolReportReader(config.parse());
        this.dstatReader = new DstatCsvReader(config.parse());
        this.sarReader = new SarReportReader();
    }

    public RunLayout layout() {
        return layout;
    }

    // ========================================================================
    // Pipeline
    // ========================================================================

    /**
     * Collect every record and write the table, falling back to the alternate file when
     * the configured one cannot be written.
     */
    public Result<TableWriteResult> run() {
        NavigableMap<RunKey, MetricsRecord> records = collect();
        return SummaryTable.write(records.values(),
                config.paths().summaryFile(), config.paths().fallbackSummaryFile());
    }

    /**
     * All records in key order.
     */
    public NavigableMap<RunKey, MetricsRecord> collect() {
        List<RunKey> keys = layout.discover();
        info("Aggregating {} runs under {}", keys.size(), layout.metricsRoot());

        ConcurrentSkipListMap<RunKey, MetricsRecord> records = new ConcurrentSkipListMap<>();
        boolean investigating = isInvestigating();
        ExecutorService pool = Executors.newFixedThreadPool(
                Math.min(config.aggregate().parallelism(), Math.max(1, keys.size())), workerThreads());
        try {
            List<Future<MetricsRecord>> pending = new ArrayList<>(keys.size());
            for (RunKey key : keys) {
                Callable<MetricsRecord> task = () -> InvestigationContext.withInvestigation(investigating, () -> {
                    MetricsRecord record = safely(key);
                    records.put(key, record);
                    return record;
                });
                pending.add(pool.submit(task));
            }
            for (Future<MetricsRecord> f : pending) {
                f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while aggregating " + layout.metricsRoot(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Aggregation worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }

        if (config.aggregate().includeSampledRuns()) {
            addSampledRuns(records);
        }
        return records;
    }

    /**
     * One triple through the reader pipeline.
     */
    public MetricsRecord aggregate(RunKey key) {
        return traced("aggregate " + key, () -> {
            attr("framework", key.framework());
            attr("dataset", key.dataset());
            attr("phase", key.phase());
            ParsedToolMetrics tool = toolReader.read(layout.timeReport(key));
            DstatAverages averages = dstatReader.read(layout.dstatLog(key));
            if (averages.isEmpty()) {
                debug("No dstat averages for {}, trying sar reports", key);
                averages = sarReader.read(layout.sarReports(key));
            }
            return new MetricsRecord(key, tool, averages);
        });
    }

    private MetricsRecord safely(RunKey key) {
        return Result.of(() -> aggregate(key))
                .onFailure(e -> error("Failed to aggregate " + key + ", writing an empty row", e))
                .getOrElse(new MetricsRecord(key, null, null));
    }

    private void addSampledRuns(ConcurrentSkipListMap<RunKey, MetricsRecord> records) {
        SampledRunReader reader = new SampledRunReader(config.sampler().outRoot(), config.aggregate().sampledPhase());
        for (MetricsRecord sampled : reader.readAll()) {
            if (records.putIfAbsent(sampled.key(), sampled) != null) {
                debug("Keeping tool-report row for {} over its sampled run", sampled.key());
            }
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "aggregate-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
