package org.zimcorpus.sharding;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import org.zimcorpus.archive.ManifestArchive;
import org.zimcorpus.sharding.pipeline.ExtractionConfig;
import org.zimcorpus.sharding.pipeline.ExtractionException;
import org.zimcorpus.sharding.pipeline.ExtractionPipeline;
import org.zimcorpus.sharding.pipeline.filter.ExclusionRules;
import org.zimcorpus.sharding.pipeline.filter.Language;
import org.zimcorpus.sharding.pipeline.ir.ExtractionReport;
import org.zimcorpus.sharding.pipeline.ir.ShardSummary;
import org.zimcorpus.sharding.pipeline.sink.GzipShardSink;
import org.zimcorpus.sharding.pipeline.sink.ShardReader;

import lombok.extern.slf4j.Slf4j;

/**
 * Converts an archive into a directory of gzip shards. Each shard holds up to
 * {@code --documents} payloads, each prefixed by its length as a big-endian uint32.
 */
@Slf4j
public class ArchiveToShards {

    public static final int SUCCESS_EXIT_CODE = 0;
    public static final int INVALID_ARGUMENTS_EXIT_CODE = 1;
    public static final int SETUP_FAILED_EXIT_CODE = 2;
    public static final int RUN_FAILED_EXIT_CODE = 3;

    public static class Args {
        @Parameter(names = {"-i", "--input-file"}, required = true,
            description = "the archive to read: a directory with a manifest.jsonl")
        public String inputFile;

        @Parameter(names = {"-o", "--output-dir"}, required = true,
            description = "the name of the output directory, created if missing")
        public String outputDir;

        @Parameter(names = {"-l", "--language"},
            description = "the two-letter language code of the Wikipedia dump, selects the disambiguation "
                + "title marker")
        public String language = Language.HU.code();

        @Parameter(names = {"--title-exclusion-pattern"},
            description = "drop articles whose title contains a match of this regular expression, "
                + "instead of the disambiguation marker of --language")
        public String titleExclusionPattern;

        @Parameter(names = {"--namespace"}, description = "the namespace whose entries are kept")
        public String namespace = ExclusionRules.ARTICLE_NAMESPACE;

        @Parameter(names = {"-d", "--documents"}, description = "the number of articles saved into a single output file")
        public int documents = ExtractionConfig.DEFAULT_DOCUMENTS_PER_SHARD;

        @Parameter(names = {"-Z", "--zeroes"}, description = "the number of zeroes in the output files' names")
        public int zeroes = ExtractionConfig.DEFAULT_ZERO_PADDING_WIDTH;

        @Parameter(names = {"-T", "--threads"}, description = "the number of parallel writer threads to use")
        public int threads = ExtractionConfig.DEFAULT_THREAD_COUNT;

        @Parameter(names = {"--verify-output"},
            description = "re-read every written shard and check its document count")
        public boolean verifyOutput = false;

        @Parameter(names = {"-h", "--help"}, help = true, description = "print help")
        public boolean help = false;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... rawArgs) {
        var args = new Args();
        var jCommander = JCommander.newBuilder()
            .addObject(args)
            .programName(ArchiveToShards.class.getSimpleName())
            .build();
        try {
            jCommander.parse(rawArgs);
        } catch (ParameterException e) {
            System.err.println("Error parsing options: " + e.getMessage());
            jCommander.usage();
            return INVALID_ARGUMENTS_EXIT_CODE;
        }
        if (args.help) {
            jCommander.usage();
            return SUCCESS_EXIT_CODE;
        }

        ExtractionConfig config;
        try {
            config = toConfig(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return INVALID_ARGUMENTS_EXIT_CODE;
        }

        ManifestArchive archive;
        Path outputDir = Paths.get(args.outputDir);
        try {
            archive = ManifestArchive.open(Paths.get(args.inputFile));
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            log.error("Setup failed: {}", e.getMessage(), e);
            return SETUP_FAILED_EXIT_CODE;
        }

        var sink = new GzipShardSink(outputDir, config.getZeroPaddingWidth());
        try {
            ExtractionReport report = new ExtractionPipeline(archive, sink, config).run();
            log.info("Wrote {} documents into {} shards in {}", report.documentsWritten(),
                report.shards().size(), outputDir);
            if (args.verifyOutput) {
                verify(sink, report);
            }
        } catch (ExtractionException e) {
            log.error("Extraction failed: {}", e.getMessage(), e);
            return RUN_FAILED_EXIT_CODE;
        } catch (IOException e) {
            log.error("Verification failed: {}", e.getMessage(), e);
            return RUN_FAILED_EXIT_CODE;
        }
        return SUCCESS_EXIT_CODE;
    }

    static ExtractionConfig toConfig(Args args) {
        ExclusionRules rules = args.titleExclusionPattern != null
            ? ExclusionRules.forRegex(args.namespace, args.titleExclusionPattern)
            : ExclusionRules.forLiteralTitleMarker(args.namespace,
                Language.fromCode(args.language).disambiguationMarker());
        return ExtractionConfig.builder()
            .documentsPerShard(args.documents)
            .threadCount(args.threads)
            .zeroPaddingWidth(args.zeroes)
            .exclusionRules(rules)
            .build();
    }

    private static void verify(GzipShardSink sink, ExtractionReport report) throws IOException {
        for (ShardSummary shard : report.shards()) {
            Path path = sink.pathOf(shard.shardId());
            int found = ShardReader.countDocuments(path);
            if (found != shard.documents()) {
                throw new IOException(path + " holds " + found + " documents, expected " + shard.documents());
            }
        }
        log.info("Verified {} shards", report.shards().size());
    }
}
