package io.dataload.datasets.cli;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.dataload.batch.BatchProducer;
import io.dataload.batch.ProducerSource;
import io.dataload.config.LoaderConfig;
import io.dataload.core.Record;
import io.dataload.core.RowBatch;
import io.dataload.core.SourceAdapter;
import io.dataload.datasets.DatasetsModule;
import io.dataload.datasets.LoadRequest;
import io.dataload.datasets.SourceFactory;
import io.dataload.datasets.SourceKind;
import io.dataload.error.SourceException;
import io.dataload.sink.JsonlBatchSink;
import picocli.CommandLine;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI that loads a dataset in batches and writes its rows as JSON Lines.
 */
@CommandLine.Command(name = "load-dataset", mixinStandardHelpOptions = true,
        description = "Load a hub dataset, data files or a saved snapshot in batches of rows")
public final class LoadDatasetMain implements Callable<Integer> {
    @CommandLine.Parameters(index = "0", description = "Hub repository id, or path/URI of the files or snapshot")
    String location;

    @CommandLine.Option(names = {"-k", "--kind"}, description = "Source kind: ${COMPLETION-CANDIDATES}", defaultValue = "HUB")
    SourceKind kind;

    @CommandLine.Option(names = "--config", description = "Dataset config (hub datasets and distisets)")
    String config;

    @CommandLine.Option(names = "--split", description = "Split to load; default train for hub and files")
    String split;

    @CommandLine.Option(names = "--streaming", description = "Read rows lazily instead of loading them up front")
    boolean streaming;

    @CommandLine.Option(names = {"-n", "--limit"}, description = "Maximum number of rows")
    Long limit;

    @CommandLine.Option(names = {"-b", "--batch-size"}, description = "Rows per batch; default from dataload.batch.size")
    Integer batchSize;

    @CommandLine.Option(names = "--offset", description = "Rows to skip before the first batch", defaultValue = "0")
    long offset;

    @CommandLine.Option(names = "--filetype", description = "Filetype of data files (json, csv, tsv, text); default from extension")
    String filetype;

    @CommandLine.Option(names = "--storage-option", description = "Filesystem provider option, key=value (repeatable)")
    Map<String, String> storageOptions = new LinkedHashMap<>();

    @CommandLine.Option(names = "--distiset", description = "Read the snapshot as a distiset of configs")
    boolean distiset;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output JSON Lines file; default stdout")
    Path out;

    private final LoaderConfig loaderConfig;
    private final PrintStream stdout;
    private final PrintStream stderr;

    public LoadDatasetMain() { this(LoaderConfig.fromEnv(), System.out, System.err); }

    LoadDatasetMain(LoaderConfig loaderConfig, PrintStream stdout, PrintStream stderr) {
        this.loaderConfig = loaderConfig;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new LoadDatasetMain()).execute(args));
    }

    static CommandLine commandLine(LoadDatasetMain main) {
        return new CommandLine(main).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() throws Exception {
        LoadRequest request;
        try {
            request = LoadRequest.builder(kind, location)
                    .config(config)
                    .split(split)
                    .streaming(streaming)
                    .rowLimit(limit)
                    .batchSize(batchSize != null ? batchSize : loaderConfig.defaultBatchSize())
                    .filetype(filetype)
                    .storageOptions(storageOptions)
                    .distiset(distiset)
                    .offset(offset)
                    .build();
        } catch (IllegalArgumentException e) {
            stderr.println("Invalid arguments: " + e.getMessage());
            return 2;
        }

        Injector injector = Guice.createInjector(new DatasetsModule(loaderConfig));
        SourceFactory factory = injector.getInstance(SourceFactory.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);

        try (SourceAdapter adapter = factory.adapter(request);
             JsonlBatchSink sink = out != null
                     ? new JsonlBatchSink(out, request.offset() > 0)
                     : new JsonlBatchSink(new OutputStreamWriter(stdout, StandardCharsets.UTF_8))) {
            adapter.open();
            BatchProducer producer = factory.producer(adapter, request);
            ProducerSource source = new ProducerSource(producer, request.offset());
            while (!source.isFinished()) {
                Optional<Record<RowBatch>> next = source.poll();
                if (next.isPresent()) sink.accept(next.get());
            }
            PrintStream summary = out != null ? stdout : stderr;
            summary.println("Loaded " + adapter.descriptor() + ": batches=" + sink.batchesWritten()
                    + " rows=" + sink.rowsWritten() + " budget=" + adapter.rowCount()
                    + (out != null ? " to " + out : ""));
            printMetrics(registry, summary);
            if (!source.reachedLast()) {
                stderr.println("Source ended before its row budget of " + adapter.rowCount());
                return 1;
            }
            return 0;
        } catch (SourceException e) {
            stderr.println("Cannot load " + location + ": " + e.getMessage());
            return 2;
        } catch (IOException e) {
            stderr.println("Cannot write " + (out != null ? out : "output") + ": " + e.getMessage());
            return 2;
        }
    }

    private static void printMetrics(MetricRegistry r, PrintStream ps) {
        Meter rows = r.meter("producer.rows");
        Meter discarded = r.meter("producer.rows.discarded");
        Timer read = r.timer("producer.read.time");
        ps.println("metrics: rows=" + rows.getCount() + " discarded=" + discarded.getCount()
                + " reads=" + read.getCount() + " read.p50(ms)=" + nsToMs(read.getSnapshot().getMedian()));
    }

    private static String nsToMs(double nanos) { return String.format("%.3f", nanos / 1_000_000.0); }
}
