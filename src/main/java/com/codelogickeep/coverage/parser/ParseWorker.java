package com.codelogickeep.coverage.parser;

import com.codelogickeep.coverage.exception.CoverageException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static com.codelogickeep.coverage.exception.CoverageException.ErrorCode.COVERAGE_PARSE_FAILED;

/**
 * 大文件解析 worker - 在独立线程上执行与同步路径相同的解析算法
 *
 * 调用方发送 {@link ParseRequest}，阻塞等待 {@link ParseResponse}。
 * worker 与调用方之间只传递不可变消息，不共享可变状态。
 */
@Slf4j
class ParseWorker implements AutoCloseable {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ExecutorService executor;

    ParseWorker() {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "lcov-parse-worker-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Sends the request to the worker thread and waits for its reply.
     */
    ParseResponse send(ParseRequest request) {
        Future<ParseResponse> reply = executor.submit(() -> handle(request));
        try {
            return reply.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CoverageException(COVERAGE_PARSE_FAILED,
                    "Interrupted while waiting for LCOV parse worker",
                    "Source: " + request.source(), e);
        } catch (ExecutionException e) {
            // handle() 已捕获解析异常，这里只可能是 Error 等致命问题
            throw new CoverageException(COVERAGE_PARSE_FAILED,
                    "LCOV parse worker crashed: " + e.getCause(),
                    "Source: " + request.source(), e.getCause());
        }
    }

    static ParseResponse handle(ParseRequest request) {
        try {
            LcovRecordReader reader = new LcovRecordReader();
            reader.consume(request.content());
            return ParseResponse.success(reader.finish(), reader.skippedLines());
        } catch (RuntimeException e) {
            log.error("LCOV parsing failed on worker for {}", request.source(), e);
            return ParseResponse.failure(e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
