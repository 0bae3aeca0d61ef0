package com.codelogickeep.coverage.config;

import com.codelogickeep.coverage.exception.CoverageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Validates AppConfig and fills in defaults for missing sections.
 */
public class ConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    static final Set<String> SUPPORTED_FORMATS = Set.of("console", "json", "lcov");

    /**
     * Validates the configuration and throws exception if invalid.
     *
     * @param config the configuration to validate
     * @throws CoverageException if required fields are missing or values are out of range
     */
    public static void validate(AppConfig config) {
        if (config == null) {
            throw new CoverageException(
                    CoverageException.ErrorCode.CONFIG_INVALID,
                    "Configuration is null",
                    "No configuration loaded"
            );
        }

        applyDefaults(config);

        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        AppConfig.CoverageConfig coverage = config.getCoverage();
        if (isNullOrEmpty(coverage.getLcovPath())) {
            missing.add("coverage.lcov-path: LCOV file path is required (use --lcov)");
        }
        if (isNullOrEmpty(coverage.getPackagePath())) {
            missing.add("coverage.package-path: Package path is required (use --package)");
        }
        if (coverage.getOutputFormats() == null || coverage.getOutputFormats().isEmpty()) {
            missing.add("coverage.output-formats: At least one output format is required (console | json | lcov)");
        } else {
            for (String format : coverage.getOutputFormats()) {
                if (format == null || !SUPPORTED_FORMATS.contains(format.toLowerCase(Locale.ROOT))) {
                    invalid.add("coverage.output-formats: Unsupported format '" + format + "'. Supported: console, json, lcov");
                }
            }
            if (coverage.getOutputFormats().stream().anyMatch(f -> !"console".equalsIgnoreCase(f))
                    && isNullOrEmpty(coverage.getOutputDir())) {
                missing.add("coverage.output-dir: Output directory is required for file reports (use --output)");
            }
        }

        if (config.getParser().getAsyncThresholdBytes() < 0) {
            invalid.add("parser.async-threshold-bytes: Must be >= 0, got " + config.getParser().getAsyncThresholdBytes());
        }

        AppConfig.DiscoveryConfig discovery = config.getDiscovery();
        if (discovery.getExtensions() == null || discovery.getExtensions().isEmpty()) {
            missing.add("discovery.extensions: At least one source file extension is required");
        }

        if (!missing.isEmpty()) {
            throw new CoverageException(
                    CoverageException.ErrorCode.CONFIG_MISSING_FIELD,
                    "Configuration validation failed:\n  - " + String.join("\n  - ", concat(missing, invalid)),
                    "Check your smart-coverage.yml or command line parameters"
            );
        }
        if (!invalid.isEmpty()) {
            throw new CoverageException(
                    CoverageException.ErrorCode.CONFIG_INVALID,
                    "Configuration validation failed:\n  - " + String.join("\n  - ", invalid),
                    "Check your smart-coverage.yml or command line parameters"
            );
        }

        log.debug("Configuration validation passed");
    }

    static void applyDefaults(AppConfig config) {
        if (config.getCoverage() == null) {
            config.setCoverage(new AppConfig.CoverageConfig());
        }
        if (config.getParser() == null) {
            config.setParser(new AppConfig.ParserConfig());
        }
        if (config.getDiscovery() == null) {
            config.setDiscovery(new AppConfig.DiscoveryConfig());
        }
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> all = new ArrayList<>(a);
        all.addAll(b);
        return all;
    }

    private static boolean isNullOrEmpty(String value) {
        return value == null || value.trim().isEmpty();
    }
}
