package tech.yump.tenancy.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricsRecorderTest {

    @Test
    @DisplayName("Hit rate is hits over total requests, as a percentage")
    void cacheHitRate_isPercentageOfRequests() {
        MetricsRecorder recorder = new MetricsRecorder(true);
        for (int i = 0; i < 3; i++) {
            recorder.recordHit();
        }
        recorder.recordMiss();

        DataSourceStats stats = recorder.snapshot(1, 10, 1, 1);

        assertThat(stats.cacheHits()).isEqualTo(3);
        assertThat(stats.cacheMisses()).isEqualTo(1);
        assertThat(stats.cacheHitRate()).isCloseTo(75.0, within(0.0001));
    }

    @Test
    @DisplayName("Hit rate is zero without any requests")
    void cacheHitRate_zeroWithoutTraffic() {
        assertThat(MetricsRecorder.cacheHitRate(0, 0)).isZero();
        assertThat(new MetricsRecorder(true).snapshot(0, 50, 0, 0).cacheHitRate()).isZero();
    }

    @Test
    @DisplayName("Pool utilization is live over max, as a percentage")
    void poolUtilization() {
        assertThat(MetricsRecorder.poolUtilization(5, 50)).isCloseTo(10.0, within(0.0001));
        assertThat(MetricsRecorder.poolUtilization(0, 0)).isZero();
    }

    @Test
    @DisplayName("reset zeroes every counter")
    void reset_zeroesCounters() {
        MetricsRecorder recorder = new MetricsRecorder(true);
        recorder.recordHit();
        recorder.recordMiss();
        recorder.recordClientCreated();
        recorder.recordPoolExhausted();
        recorder.recordConfigHit();
        recorder.recordConfigMiss();

        recorder.reset();

        DataSourceStats stats = recorder.snapshot(2, 50, 2, 3);
        assertThat(stats.totalClientsCreated()).isZero();
        assertThat(stats.poolExhaustedCount()).isZero();
        assertThat(stats.cacheHits()).isZero();
        assertThat(stats.cacheMisses()).isZero();
        assertThat(stats.configCacheHits()).isZero();
        assertThat(stats.configCacheMisses()).isZero();
        assertThat(stats.clientCacheSize()).isEqualTo(2);
        assertThat(stats.configCacheSize()).isEqualTo(3);
    }

    @Test
    @DisplayName("Disabled recorder ignores events but still reports sizes")
    void disabled_recordsNothing() {
        MetricsRecorder recorder = new MetricsRecorder(false);
        recorder.recordHit();
        recorder.recordClientCreated();
        recorder.recordPoolExhausted();

        DataSourceStats stats = recorder.snapshot(4, 8, 4, 1);

        assertThat(stats.cacheHits()).isZero();
        assertThat(stats.totalClientsCreated()).isZero();
        assertThat(stats.poolExhaustedCount()).isZero();
        assertThat(stats.liveClients()).isEqualTo(4);
        assertThat(stats.poolUtilization()).isCloseTo(50.0, within(0.0001));
    }

    @Test
    @DisplayName("bindTo publishes counters and cache size gauges")
    void bindTo_registersMeters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsRecorder recorder = new MetricsRecorder(true);
        recorder.bindTo(registry, () -> 7, () -> 3);

        recorder.recordClientCreated();
        recorder.recordClientCreated();
        recorder.recordPoolExhausted();

        assertThat(registry.get("tenant.datasource.clients.created").functionCounter().count()).isEqualTo(2.0);
        assertThat(registry.get("tenant.datasource.pool.exhausted").functionCounter().count()).isEqualTo(1.0);
        assertThat(registry.get("tenant.datasource.client.cache.size").gauge().value()).isEqualTo(7.0);
        assertThat(registry.get("tenant.datasource.config.cache.size").gauge().value()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("bindTo registers nothing when disabled")
    void bindTo_disabled_registersNothing() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        new MetricsRecorder(false).bindTo(registry, () -> 1, () -> 1);

        assertThat(registry.getMeters()).isEmpty();
    }
}
