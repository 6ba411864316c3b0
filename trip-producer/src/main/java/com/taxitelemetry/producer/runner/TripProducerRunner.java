package com.taxitelemetry.producer.runner;

import com.taxitelemetry.producer.config.ProducerSettings;
import com.taxitelemetry.producer.service.ProducerRunSummary;
import com.taxitelemetry.producer.service.TripStreamPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI entry point: one pass over the configured source file.
 *
 * Exit codes: 0 completed, 1 source missing or unreadable, 2 configuration incomplete.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TripProducerRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_SOURCE_FAILURE = 1;
    static final int EXIT_CONFIGURATION_ERROR = 2;

    private final ProducerSettings settings;
    private final TripStreamPublisher publisher;

    private int exitCode;

    @Override
    public void run(String... args) {
        List<String> missing = settings.missing();
        if (!missing.isEmpty()) {
            log.error("Producer not started, missing required configuration: {}", missing);
            exitCode = EXIT_CONFIGURATION_ERROR;
            return;
        }

        log.info("Publishing {} to stream {} in region {} (batch size {})",
                settings.getSourcePath(), settings.getStreamName(), settings.getRegion(), settings.getBatchSize());
        ProducerRunSummary summary = publisher.sendAll(
                Path.of(settings.getSourcePath()), settings.getStreamName(), settings.getBatchSize());
        exitCode = summary.succeeded() ? 0 : EXIT_SOURCE_FAILURE;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
