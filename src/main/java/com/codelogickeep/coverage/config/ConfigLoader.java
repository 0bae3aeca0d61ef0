package com.codelogickeep.coverage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 配置加载器 - 按优先级合并多个 YAML 配置来源
 *
 * 优先级（低 → 高）：classpath smart-coverage.yml、~/.smart-coverage/config.yml、
 * 当前目录 smart-coverage.yml、--config 指定文件。
 */
@Slf4j
public class ConfigLoader {

    static final String CONFIG_FILE_NAME = "smart-coverage.yml";
    private static final Pattern ENV_PLACEHOLDER = Pattern.compile("\\$\\{env:([A-Za-z_][A-Za-z0-9_]*)}");

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final Function<String, String> env;
    private final String userHome;
    private final File workingDir;

    public ConfigLoader() {
        this(System::getenv, System.getProperty("user.home"), new File("."));
    }

    ConfigLoader(Function<String, String> env, String userHome, File workingDir) {
        this.env = env;
        this.userHome = userHome;
        this.workingDir = workingDir;
    }

    public AppConfig load(String explicitConfigPath) throws IOException {
        AppConfig config = new AppConfig();

        try (InputStream in = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (in != null) {
                mapper.readerForUpdating(config).readValue(in);
            }
        }

        if (userHome != null) {
            mergeConfigFromFile(config, Paths.get(userHome, ".smart-coverage", "config.yml").toFile());
        }
        mergeConfigFromFile(config, new File(workingDir, CONFIG_FILE_NAME));

        if (explicitConfigPath != null) {
            File explicit = new File(explicitConfigPath);
            if (!explicit.exists()) {
                throw new IOException("Config file not found: " + explicit.getAbsolutePath());
            }
            mapper.readerForUpdating(config).readValue(explicit);
            log.info("Merged configuration from {}", explicit.getAbsolutePath());
        }

        ConfigValidator.applyDefaults(config);
        substituteEnvVars(config);
        return config;
    }

    private void mergeConfigFromFile(AppConfig config, File file) {
        if (file.exists()) {
            try {
                mapper.readerForUpdating(config).readValue(file);
                log.info("Merged configuration from {}", file.getAbsolutePath());
            } catch (IOException e) {
                log.warn("Failed to merge config from {}: {}", file.getAbsolutePath(), e.getMessage());
            }
        }
    }

    private void substituteEnvVars(AppConfig config) {
        AppConfig.CoverageConfig coverage = config.getCoverage();
        coverage.setLcovPath(replaceEnvVars(coverage.getLcovPath()));
        coverage.setPackagePath(replaceEnvVars(coverage.getPackagePath()));
        coverage.setBaseBranch(replaceEnvVars(coverage.getBaseBranch()));
        coverage.setOutputDir(replaceEnvVars(coverage.getOutputDir()));
        if (coverage.getOutputFormats() != null) {
            coverage.setOutputFormats(coverage.getOutputFormats().stream()
                    .map(this::replaceEnvVars)
                    .collect(Collectors.toList()));
        }
    }

    /**
     * Replaces every {@code ${env:NAME}} placeholder; unknown variables are left as-is.
     */
    String replaceEnvVars(String value) {
        if (value == null || !value.contains("${env:")) {
            return value;
        }
        Matcher matcher = ENV_PLACEHOLDER.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String envValue = env.apply(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(envValue != null ? envValue : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Dumps the effective configuration as YAML.
     */
    public String toYaml(AppConfig config) throws IOException {
        return mapper.writeValueAsString(config);
    }
}
