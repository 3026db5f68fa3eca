package com.company.pmm.repository;

import com.company.pmm.config.MonitoringProperties;
import com.company.pmm.domain.MetricPoint;
import com.company.pmm.support.MutableClock;
import com.company.pmm.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MetricSeriesRepositoryTest {

    private static final String METRIC = "response_accuracy";

    private MutableClock clock;
    private MetricSeriesRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.NOW);
        MonitoringProperties properties = TestFixtures.properties();
        properties.getRetention().setMetricWindow(Duration.ofHours(2));
        repository = new MetricSeriesRepository(properties, clock);
    }

    @Test
    @DisplayName("Reading the retention window returns the non-evicted points in order, without duplicates")
    void appendThenReadReturnsRetainedPointsInOrder() {
        // given: 5 points, one every 45 minutes
        Instant start = TestFixtures.NOW;
        for (int i = 0; i < 5; i++) {
            clock.set(start.plus(Duration.ofMinutes(45L * i)));
            repository.append(METRIC, i, clock.instant());
        }

        // when
        List<MetricPoint> window = repository.window(METRIC, Duration.ofHours(2));

        // then: points older than now - 2h (i = 0, 1) were evicted
        assertThat(window).extracting(MetricPoint::getValue).containsExactly(2.0, 3.0, 4.0);
        assertThat(repository.all(METRIC)).hasSize(3);
    }

    @Test
    @DisplayName("Unknown metric yields an empty window, not an error")
    void unknownMetricIsEmpty() {
        assertThat(repository.window("nope", Duration.ofHours(1))).isEmpty();
        assertThat(repository.latest("nope")).isEmpty();
    }

    @Test
    void outOfOrderAppendIsReordered() {
        repository.append(METRIC, 2.0, TestFixtures.NOW.minusSeconds(10));
        repository.append(METRIC, 1.0, TestFixtures.NOW.minusSeconds(20));
        repository.append(METRIC, 3.0, TestFixtures.NOW);

        assertThat(repository.all(METRIC)).extracting(MetricPoint::getValue).containsExactly(1.0, 2.0, 3.0);
        assertThat(repository.latest(METRIC)).map(MetricPoint::getValue).contains(3.0);
    }

    @Test
    @DisplayName("Sweep evicts points of a metric that stopped receiving data")
    void evictExpiredForIdleSeries() {
        repository.append(METRIC, 1.0, TestFixtures.NOW);
        clock.advance(Duration.ofHours(3));

        assertThat(repository.evictExpired()).isEqualTo(1);
        assertThat(repository.all(METRIC)).isEmpty();
        assertThat(repository.metricNames()).containsExactly(METRIC);
    }

    @Test
    @DisplayName("Concurrent appends lose no points and keep every series ordered")
    void concurrentAppends() throws Exception {
        int threads = 8;
        int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);

        for (int t = 0; t < threads; t++) {
            int offset = t;
            executor.submit(() -> {
                startGate.await();
                for (int i = 0; i < perThread; i++) {
                    String metric = i % 2 == 0 ? "a" : "b";
                    repository.append(metric, i, TestFixtures.NOW.minusMillis((long) i * threads + offset));
                }
                return null;
            });
        }
        startGate.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        List<MetricPoint> a = repository.all("a");
        List<MetricPoint> b = repository.all("b");
        assertThat(a.size() + b.size()).isEqualTo(threads * perThread);
        assertThat(a).extracting(MetricPoint::getTimestamp).isSorted();
        assertThat(b).extracting(MetricPoint::getTimestamp).isSorted();
    }
}
