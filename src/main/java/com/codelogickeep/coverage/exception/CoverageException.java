package com.codelogickeep.coverage.exception;

/**
 * Unified exception for the coverage pipeline.
 * Callers dispatch on {@link ErrorCode}, never on the message text.
 */
public class CoverageException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String context;
    private final String suggestion;

    public CoverageException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.context = null;
        this.suggestion = errorCode.getSuggestion();
    }

    public CoverageException(ErrorCode errorCode, String message, String context) {
        super(message);
        this.errorCode = errorCode;
        this.context = context;
        this.suggestion = errorCode.getSuggestion();
    }

    public CoverageException(ErrorCode errorCode, String message, String context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context;
        this.suggestion = errorCode.getSuggestion();
    }

    private CoverageException(Builder builder) {
        super(builder.message, builder.cause);
        this.errorCode = builder.errorCode;
        this.context = builder.context;
        this.suggestion = builder.suggestion != null ? builder.suggestion : builder.errorCode.getSuggestion();
    }

    public static Builder builder(ErrorCode errorCode, String message) {
        return new Builder(errorCode, message);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getContext() {
        return context;
    }

    public String getSuggestion() {
        return suggestion;
    }

    /**
     * True when this failure means no revision-control context could be established.
     */
    public boolean isVcsUnavailable() {
        return errorCode == ErrorCode.VCS_UNAVAILABLE;
    }

    /**
     * Formats code, message, context and suggestion for the console.
     */
    public String toDisplayMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("ERROR [").append(errorCode.getCode()).append("]: ").append(getMessage());

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ").append(context);
        }

        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append("\nSuggestion: ").append(suggestion);
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return toDisplayMessage();
    }

    public static class Builder {
        private final ErrorCode errorCode;
        private final String message;
        private String context;
        private String suggestion;
        private Throwable cause;

        private Builder(ErrorCode errorCode, String message) {
            this.errorCode = errorCode;
            this.message = message;
        }

        public Builder context(String context) {
            this.context = context;
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public CoverageException build() {
            return new CoverageException(this);
        }
    }

    /**
     * Error codes grouped by pipeline stage.
     */
    public enum ErrorCode {
        // Coverage source (1xx)
        COVERAGE_FILE_NOT_FOUND("E101", "LCOV file not found", "Run the test suite with coverage enabled, or pass --lcov with the correct path."),
        COVERAGE_READ_FAILED("E102", "Failed to read LCOV file", "Check file permissions and encoding (UTF-8 expected)."),
        COVERAGE_PARSE_FAILED("E103", "LCOV parsing failed", "Retry the run; if it persists, inspect the LCOV file for truncation."),
        REPORT_WRITE_FAILED("E104", "Failed to write report", "Check that the output directory is writable."),

        // File discovery (2xx)
        VCS_UNAVAILABLE("E201", "Not a Git repository", "Run inside a Git working tree, or omit --base-branch to analyse all files."),
        DISCOVERY_FAILED("E202", "Changed-file detection failed", "Check that the base branch exists and the repository is not corrupted."),
        INVALID_PACKAGE("E203", "Invalid package structure", "Point --package at the package root directory."),

        // Configuration (3xx)
        CONFIG_INVALID("E301", "Invalid configuration", "Check the configuration file for syntax errors."),
        CONFIG_MISSING_FIELD("E302", "Required configuration field missing", "Ensure all required fields are set in smart-coverage.yml or on the command line."),

        UNKNOWN_ERROR("E999", "Unknown error occurred", "Check the logs for more details.");

        private final String code;
        private final String description;
        private final String suggestion;

        ErrorCode(String code, String description, String suggestion) {
            this.code = code;
            this.description = description;
            this.suggestion = suggestion;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }

        public String getSuggestion() {
            return suggestion;
        }
    }
}
