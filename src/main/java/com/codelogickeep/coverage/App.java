package com.codelogickeep.coverage;

import ch.qos.logback.classic.Level;
import com.codelogickeep.coverage.config.AppConfig;
import com.codelogickeep.coverage.config.ConfigLoader;
import com.codelogickeep.coverage.config.ConfigValidator;
import com.codelogickeep.coverage.discovery.GitFileDetector;
import com.codelogickeep.coverage.engine.AnalysisRequest;
import com.codelogickeep.coverage.engine.CoverageOutcome;
import com.codelogickeep.coverage.engine.CoverageProcessor;
import com.codelogickeep.coverage.exception.CoverageException;
import com.codelogickeep.coverage.model.CoverageData;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.parser.LcovParserImpl;
import com.codelogickeep.coverage.report.ConsoleReporter;
import com.codelogickeep.coverage.report.ReportService;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "smart-coverage", mixinStandardHelpOptions = true, version = "0.1.0",
        description = "Coverage report scoped to the files changed against a base branch.",
        subcommands = {App.DeltaCommand.class, App.FileCommand.class, App.ConfigCommand.class})
public class App implements Callable<Integer> {

    @Option(names = {"-l", "--lcov"}, description = "Path to the LCOV file (default: coverage/lcov.info)")
    private String lcovPath;

    @Option(names = {"-b", "--base-branch"}, description = "Base branch to compare against. Omit to analyze all files.")
    private String baseBranch;

    @Option(names = {"-p", "--package"}, description = "Package root directory (monorepo sub-package). Default: current directory.")
    private String packagePath;

    @Option(names = {"-o", "--output"}, description = "Output directory for json/lcov reports.")
    private String outputDir;

    @Option(names = {"-f", "--format"}, split = ",", description = "Output formats: console, json, lcov (comma-separated or repeated).")
    private List<String> formats;

    @Option(names = {"-c", "--config"}, description = "Path to a smart-coverage.yml configuration file.")
    private String configPath;

    @Option(names = {"-v", "--verbose"}, description = "Enable debug logging.")
    private boolean verbose;

    private final PrintStream out;
    private final PrintStream err;

    public App() {
        this(System.out, System.err);
    }

    App(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new App()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            enableDebugLogging();
        }
        try {
            AppConfig config = new ConfigLoader().load(configPath);
            applyOverrides(config);
            ConfigValidator.validate(config);

            AppConfig.CoverageConfig coverage = config.getCoverage();
            AnalysisRequest request = new AnalysisRequest(
                    Paths.get(coverage.getLcovPath()),
                    coverage.getBaseBranch(),
                    Paths.get(coverage.getPackagePath()));

            out.println(">>> Analyzing coverage: " + request.lcovPath());
            CoverageOutcome outcome;
            try (LcovParserImpl parser = new LcovParserImpl(config.getParser().getAsyncThresholdBytes())) {
                CoverageProcessor processor = new CoverageProcessor(new GitFileDetector(config.getDiscovery()), parser);
                outcome = processor.process(request);
            }
            out.println(">>> " + outcome.statusMessage());

            new ReportService(out).generate(outcome.data(), coverage.getOutputFormats(), Paths.get(coverage.getOutputDir()))
                    .forEach(p -> out.println(">>> Report written: " + p));
            return 0;
        } catch (CoverageException e) {
            err.println(e.toDisplayMessage());
            return 1;
        } catch (IOException e) {
            err.println("Configuration Error: " + e.getMessage());
            return 1;
        }
    }

    private void applyOverrides(AppConfig config) {
        AppConfig.CoverageConfig coverage = config.getCoverage();
        if (lcovPath != null) {
            coverage.setLcovPath(lcovPath);
        }
        if (baseBranch != null) {
            coverage.setBaseBranch(baseBranch);
        }
        if (packagePath != null) {
            coverage.setPackagePath(packagePath);
        }
        if (outputDir != null) {
            coverage.setOutputDir(outputDir);
        }
        if (formats != null && !formats.isEmpty()) {
            coverage.setOutputFormats(formats);
        }
    }

    /**
     * Loads and validates the layered configuration without CLI overrides.
     */
    AppConfig loadConfig() throws IOException {
        AppConfig config = new ConfigLoader().load(configPath);
        ConfigValidator.validate(config);
        return config;
    }

    static void enableDebugLogging() {
        org.slf4j.Logger logger = LoggerFactory.getLogger("com.codelogickeep.coverage");
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(Level.DEBUG);
        }
    }

    @Command(name = "delta",
            mixinStandardHelpOptions = true,
            description = "Show per-line hit count changes between two LCOV files.")
    static class DeltaCommand implements Callable<Integer> {

        @Option(names = {"--base"}, required = true, description = "Baseline LCOV file.")
        private String baseLcov;

        @Option(names = {"--current"}, required = true, description = "Current LCOV file.")
        private String currentLcov;

        @CommandLine.ParentCommand
        private App parent;

        @Override
        public Integer call() {
            try {
                AppConfig config = parent.loadConfig();
                try (LcovParserImpl parser = new LcovParserImpl(config.getParser().getAsyncThresholdBytes())) {
                    CoverageProcessor processor = new CoverageProcessor(new GitFileDetector(config.getDiscovery()), parser);
                    CoverageData delta = processor.calculateDelta(Paths.get(baseLcov), Paths.get(currentLcov));
                    parent.out.println(">>> Coverage delta: " + delta.fileCount() + " file(s) changed");
                    parent.out.print(new ConsoleReporter().render(delta));
                    return 0;
                }
            } catch (CoverageException e) {
                parent.err.println(e.toDisplayMessage());
                return 1;
            } catch (IOException e) {
                parent.err.println("Configuration Error: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "file",
            mixinStandardHelpOptions = true,
            description = "Show coverage of a single source file.")
    static class FileCommand implements Callable<Integer> {

        @Option(names = {"-l", "--lcov"}, description = "Path to the LCOV file (default: coverage.lcov-path from the configuration).")
        private String lcovPath;

        @Parameters(index = "0", description = "Source file path to look up.")
        private String filePath;

        @CommandLine.ParentCommand
        private App parent;

        @Override
        public Integer call() {
            try {
                AppConfig config = parent.loadConfig();
                Path lcov = Path.of(lcovPath != null ? lcovPath : config.getCoverage().getLcovPath());
                try (LcovParserImpl parser = new LcovParserImpl(config.getParser().getAsyncThresholdBytes())) {
                    CoverageProcessor processor = new CoverageProcessor(new GitFileDetector(config.getDiscovery()), parser);
                    Optional<FileCoverage> file = processor.getFileCoverage(lcov, filePath);
                    if (file.isEmpty()) {
                        parent.out.println(">>> No coverage data found for " + filePath);
                        return 1;
                    }
                    FileCoverage coverage = file.get();
                    parent.out.println(">>> " + coverage.path());
                    parent.out.printf("    Lines: %d/%d (%.1f%%)%n", coverage.summary().linesHit(),
                            coverage.summary().linesFound(), coverage.summary().linePercentage());
                    parent.out.println("    Uncovered lines: " + coverage.uncoveredLines().size());
                    return 0;
                }
            } catch (CoverageException e) {
                parent.err.println(e.toDisplayMessage());
                return 1;
            } catch (IOException e) {
                parent.err.println("Configuration Error: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "config",
            mixinStandardHelpOptions = true,
            description = "Print the effective configuration after merging all sources.")
    static class ConfigCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        private App parent;

        @Override
        public Integer call() {
            try {
                ConfigLoader loader = new ConfigLoader();
                AppConfig config = loader.load(parent.configPath);
                parent.out.println(loader.toYaml(config));
                return 0;
            } catch (IOException e) {
                parent.err.println("Configuration Error: " + e.getMessage());
                return 1;
            }
        }
    }
}
