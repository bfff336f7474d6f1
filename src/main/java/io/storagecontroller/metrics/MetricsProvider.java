package io.storagecontroller.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Meters of the storage controller. Every meter carries the
 * {@value MetricsConstants#CONTROLLER_TAG} tag so that several controller
 * instances can report to the same backend.
 */
@Component
@Slf4j
public class MetricsProvider {

    private static final double[] PERCENTILES = {0.5, 0.9, 0.99};

    private final MeterRegistry registry;
    private final String controllerId;
    // one value holder per gauge name and tag set
    private final Map<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

    public MetricsProvider(MeterRegistry registry, @Value("${controller.id}") String controllerId) {
        this.registry = registry;
        this.controllerId = controllerId;
        log.info("Publishing metrics of controller \"{}\"", controllerId);
    }

    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(tagsOf(tags)).register(registry);
    }

    /**
     * Value holder of a gauge. Asking twice for the same name and tags returns
     * the same holder, so callers may look gauges up on every update.
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        return gauges.computeIfAbsent(name + tags, key -> {
            AtomicDouble value = new AtomicDouble(0);
            Gauge.builder(name, value::get).tags(tagsOf(tags)).register(registry);
            return value;
        });
    }

    /**
     * Timer publishing a histogram and the median, 90th and 99th percentiles.
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
                .tags(tagsOf(tags))
                .publishPercentileHistogram()
                .publishPercentiles(PERCENTILES)
                .register(registry);
    }

    private String[] tagsOf(Map<String, String> tags) {
        String[] pairs = new String[(tags.size() + 1) * 2];
        int i = 0;
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            pairs[i++] = tag.getKey();
            pairs[i++] = tag.getValue();
        }
        pairs[i++] = MetricsConstants.CONTROLLER_TAG;
        pairs[i] = controllerId;
        return pairs;
    }
}
