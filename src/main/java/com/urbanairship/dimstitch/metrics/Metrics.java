package com.urbanairship.dimstitch.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Metric;
import com.codahale.metrics.MetricFilter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.codahale.metrics.Timer;
import org.slf4j.Logger;

import java.util.SortedMap;
import java.util.concurrent.TimeUnit;

/**
 * A Singleton for a MetricsRegistry. Use of this mechanism is not strictly necessary
 * in application space. It's here for consistency within this project and as a
 * convenience, tests may look at counts directly through {@link #getRegistry()}.
 *
 * A download is a short lived process, so instead of a JMX reporter the registry is
 * written to a log once at the end of a run with {@link #report(Logger)}.
 */
public final class Metrics {

    private Metrics() {
        //no instances
    }

    private static final MetricRegistry registry = new MetricRegistry();

    public static MetricRegistry getRegistry() {
        return registry;
    }

    public static String name(Class<?> clazz, String name) {
        return MetricRegistry.name(clazz, name);
    }

    public static String name(Class<?> clazz, String name, String scope) {
        if (scope == null || scope.isEmpty()) {
            return name(clazz, name);
        }
        return MetricRegistry.name(clazz, name, scope);
    }

    public static Meter meter(Class<?> clazz, String name) {
        return registry.meter(name(clazz, name));
    }

    public static Meter meter(Class<?> clazz, String name, String scope) {
        return registry.meter(name(clazz, name, scope));
    }

    public static Counter counter(Class<?> clazz, String name) {
        return registry.counter(name(clazz, name));
    }

    public static Counter counter(Class<?> clazz, String name, String scope) {
        return registry.counter(name(clazz, name, scope));
    }

    public static Histogram histogram(Class<?> clazz, String name) {
        return registry.histogram(name(clazz, name));
    }

    public static Histogram histogram(Class<?> clazz, String name, String scope) {
        return registry.histogram(name(clazz, name, scope));
    }

    public static Timer timer(Class<?> clazz, String name) {
        return registry.timer(name(clazz, name));
    }

    public static Timer timer(Class<?> clazz, String name, String scope) {
        return registry.timer(name(clazz, name, scope));
    }

    public static <T> void gauge(Class<?> clazz, String name, Gauge<T> impl) {
        final String newGaugeName = name(clazz, name);
        SortedMap<String, Gauge> found = registry.getGauges(new MetricFilter() {
            @Override
            public boolean matches(String name, Metric metric) {
                return newGaugeName.equals(name);
            }
        });

        if (found.isEmpty()) {
            registry.register(newGaugeName, impl);
        }
    }

    /**
     * Write every metric to the given logger at INFO. Durations in milliseconds, rates per second.
     */
    public static void report(Logger logger) {
        Slf4jReporter.forRegistry(registry)
                .outputTo(logger)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .convertRatesTo(TimeUnit.SECONDS)
                .build()
                .report();
    }
}
