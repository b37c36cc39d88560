package com.trackdeck.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Base class for all unit tests.
 * Provides a fresh data directory per test and start/finish logging.
 */
public abstract class TestBase {
    protected static final Logger logger = LoggerFactory.getLogger(TestBase.class);

    @TempDir
    protected Path dataDir;

    @BeforeEach
    void logStart(TestInfo testInfo) {
        logger.info("🧪 Starting test: {}", testInfo.getDisplayName());
    }

    @AfterEach
    void logFinish(TestInfo testInfo) {
        logger.info("✅ Finished test: {}", testInfo.getDisplayName());
    }

    /**
     * Polls {@code condition} until it holds or {@code timeoutMillis} passed.
     */
    protected static void await(String message, long timeoutMillis, BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline)
                fail("Timed out: " + message);
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting: " + message);
            }
        }
    }
}
