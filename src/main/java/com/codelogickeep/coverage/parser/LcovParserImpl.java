package com.codelogickeep.coverage.parser;

import com.codelogickeep.coverage.exception.CoverageException;
import com.codelogickeep.coverage.model.CoverageData;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.codelogickeep.coverage.exception.CoverageException.ErrorCode.*;

/**
 * LCOV 解析实现
 *
 * 小于阈值的输入在调用线程上同步解析；达到阈值后交给 {@link ParseWorker}。
 * 阈值只决定在哪里解析，不影响解析结果。
 */
@Slf4j
public class LcovParserImpl implements LcovParser, AutoCloseable {

    public static final long DEFAULT_ASYNC_THRESHOLD_BYTES = 1024L * 1024L;

    private final long asyncThresholdBytes;
    private ParseWorker worker;

    public LcovParserImpl() {
        this(DEFAULT_ASYNC_THRESHOLD_BYTES);
    }

    public LcovParserImpl(long asyncThresholdBytes) {
        if (asyncThresholdBytes < 0) {
            throw new IllegalArgumentException("asyncThresholdBytes must be non-negative: " + asyncThresholdBytes);
        }
        this.asyncThresholdBytes = asyncThresholdBytes;
    }

    @Override
    public CoverageData parse(String content) {
        if (content == null) {
            return CoverageData.empty();
        }
        return dispatch(new ParseRequest(content, "<string>"), content.length());
    }

    @Override
    public CoverageData parse(Path lcovFile) {
        if (lcovFile == null || !Files.isRegularFile(lcovFile)) {
            throw new CoverageException(COVERAGE_FILE_NOT_FOUND,
                    "LCOV file not found: " + lcovFile,
                    "Path: " + (lcovFile == null ? "null" : lcovFile.toAbsolutePath()));
        }

        long size;
        String content;
        try {
            size = Files.size(lcovFile);
            content = Files.readString(lcovFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CoverageException(COVERAGE_READ_FAILED,
                    "Failed to read LCOV file: " + lcovFile,
                    "Path: " + lcovFile.toAbsolutePath(), e);
        }
        return dispatch(new ParseRequest(content, lcovFile.toString()), size);
    }

    public long getAsyncThresholdBytes() {
        return asyncThresholdBytes;
    }

    boolean usesWorker(long size) {
        return size >= asyncThresholdBytes;
    }

    private CoverageData dispatch(ParseRequest request, long size) {
        long start = System.nanoTime();
        boolean offload = usesWorker(size);

        ParseResponse response = offload ? worker().send(request) : ParseWorker.handle(request);
        if (!response.isSuccess()) {
            throw new CoverageException(COVERAGE_PARSE_FAILED,
                    "LCOV parsing failed: " + response.error().getMessage(),
                    "Source: " + request.source(), response.error());
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        CoverageData data = response.data();
        log.debug("Parsed {} ({} bytes, {}) -> {} files in {}ms",
                request.source(), size, offload ? "worker" : "sync", data.fileCount(), elapsedMs);
        if (response.skippedLines() > 0) {
            log.debug("Skipped {} malformed LCOV line(s) in {}", response.skippedLines(), request.source());
        }
        return data;
    }

    private synchronized ParseWorker worker() {
        if (worker == null) {
            worker = new ParseWorker();
        }
        return worker;
    }

    @Override
    public synchronized void close() {
        if (worker != null) {
            worker.close();
            worker = null;
        }
    }
}
