package io.warden.core.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Metrics sink that writes every update to an SLF4J logger at DEBUG level.
 *
 * <p>Useful during development, or as a fallback where no metrics backend is
 * wired. Nothing is formatted unless DEBUG is enabled for {@code io.warden.metrics}.</p>
 *
 * @since 1.0.0
 */
public class Slf4jMetricsSink implements MetricsSink {

    private final Logger logger;

    public Slf4jMetricsSink() {
        this(LoggerFactory.getLogger("io.warden.metrics"));
    }

    public Slf4jMetricsSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void record(String name, double value, Map<String, String> labels) {
        if (logger.isDebugEnabled()) {
            logger.debug("[WARDEN] metric {}{} = {}", name, labels, value);
        }
    }
}
