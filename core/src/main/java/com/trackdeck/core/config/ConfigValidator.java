package com.trackdeck.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IllegalFormatException;
import java.util.List;

/**
 * ConfigValidator - Validates configuration on startup.
 * Catches broken poll settings before the background tasks are scheduled.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    /**
     * Validate configuration and return list of errors/warnings
     */
    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        // 1. Media URL
        validateUrlTemplate(config, errors);

        // 2. Paging
        validatePaging(config, errors);

        // 3. Poll intervals and thresholds
        validateTimings(config, errors);

        return errors;
    }

    private void validateUrlTemplate(Configuration config, List<ValidationError> errors) {
        String template = config.mediaUrlTemplate;
        if (template == null || !template.contains("%s")) {
            errors.add(new ValidationError(
                    "mediaUrlTemplate must contain %s for the track id: " + template,
                    "ERROR"));
            return;
        }
        try {
            String.format(template, "probe");
        } catch (IllegalFormatException e) {
            errors.add(new ValidationError(
                    "mediaUrlTemplate is not a valid format string: " + e.getMessage(),
                    "ERROR"));
        }
    }

    private void validatePaging(Configuration config, List<ValidationError> errors) {
        if (config.pageSize < 1)
            errors.add(new ValidationError("pageSize must be >= 1 (is " + config.pageSize + ")", "ERROR"));
        if (config.historyPageSize < 1)
            errors.add(new ValidationError("historyPageSize must be >= 1 (is " + config.historyPageSize + ")", "ERROR"));
        if (config.searchLimit < 1)
            errors.add(new ValidationError("searchLimit must be >= 1 (is " + config.searchLimit + ")", "ERROR"));
        else if (config.searchLimit > 200)
            errors.add(new ValidationError("searchLimit " + config.searchLimit + " is high - searches will be slow", "WARNING"));
    }

    private void validateTimings(Configuration config, List<ValidationError> errors) {
        requirePositive("confirmPollMillis", config.confirmPollMillis, errors);
        requirePositive("endOfTrackPollMillis", config.endOfTrackPollMillis, errors);
        requirePositive("timeObserverMillis", config.timeObserverMillis, errors);
        requirePositive("listeningTrackerMillis", config.listeningTrackerMillis, errors);

        if (config.confirmInitialDelayMillis < 0)
            errors.add(new ValidationError("confirmInitialDelayMillis must be >= 0", "ERROR"));
        if (config.confirmIdleBudget < 1)
            errors.add(new ValidationError("confirmIdleBudget must be >= 1", "ERROR"));
        if (config.endOfTrackIdleThreshold < 1)
            errors.add(new ValidationError("endOfTrackIdleThreshold must be >= 1", "ERROR"));
        else if (config.endOfTrackIdleThreshold == 1)
            errors.add(new ValidationError(
                    "endOfTrackIdleThreshold of 1 advances on the first missed poll - buffering may skip tracks",
                    "WARNING"));

        if (config.timeObserverMillis > 0 && config.timeObserverMillis < 100)
            errors.add(new ValidationError(
                    "timeObserverMillis below 100 ms floods the player with queries",
                    "WARNING"));
    }

    private void requirePositive(String name, long value, List<ValidationError> errors) {
        if (value <= 0)
            errors.add(new ValidationError(name + " must be > 0 (is " + value + ")", "ERROR"));
    }

    /**
     * Validate and report errors to logger.
     * Throws IllegalStateException if critical errors found.
     */
    public void validateAndReport(Configuration config) {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.severity.equals("ERROR")) {
                logger.error("❌ Config Error: {}", error.message);
                errorCount++;
            } else {
                logger.warn("⚠️ Config Warning: {}", error.message);
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("📋 Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("✅ Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new IllegalStateException(
                    String.format("Configuration validation failed with %d error(s). Fix config and restart.",
                            errorCount));
        }
    }
}
