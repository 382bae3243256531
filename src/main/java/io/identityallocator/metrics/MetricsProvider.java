package io.identityallocator.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/*
 * MetricsProvider creates counters, gauges and timers tagged with the node they are
 * reported from.
 */
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    static final String NODE_TAG = "node";

    private final MeterRegistry registry;
    private final String nodeName;
    private final Map<String, AtomicDouble> gaugeCache = new ConcurrentHashMap<>();

    public MetricsProvider(MeterRegistry registry, String nodeName) {
        this.registry = registry;
        this.nodeName = nodeName;
        log.info("MetricsProvider initialized for node: {}", nodeName);
    }

    /**
     * Creates or retrieves a Counter metric with the given name and tags.
     *
     * @param name the name of the counter
     * @param tags a map of tag keys to tag values
     * @return the Counter instance
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(toTagArray(withNode(tags))).register(registry);
    }

    /**
     * Gets or creates a Gauge metric and sets it to {@code value}.
     * Identical name+tags combinations share one AtomicDouble.
     */
    public AtomicDouble gauge(String name, double value, Map<String, String> tags) {
        Map<String, String> allTags = withNode(tags);
        AtomicDouble gauge = gaugeCache.computeIfAbsent(buildCacheKey(name, allTags), k -> {
            AtomicDouble gaugeValue = new AtomicDouble(value);
            Gauge.builder(name, gaugeValue::get)
                .tags(toTagArray(allTags))
                .register(registry);
            return gaugeValue;
        });
        gauge.set(value);
        return gauge;
    }

    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(toTagArray(withNode(tags)))
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    private Map<String, String> withNode(Map<String, String> tags) {
        Map<String, String> allTags = new TreeMap<>(tags);
        allTags.put(NODE_TAG, nodeName);
        return allTags;
    }

    // tags are sorted, so the key is stable
    private String buildCacheKey(String name, Map<String, String> tags) {
        StringBuilder key = new StringBuilder(name);
        tags.forEach((k, v) -> key.append(':').append(k).append('=').append(v));
        return key.toString();
    }

    private String[] toTagArray(Map<String, String> tags) {
        String[] tagArray = new String[tags.size() * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        return tagArray;
    }
}
