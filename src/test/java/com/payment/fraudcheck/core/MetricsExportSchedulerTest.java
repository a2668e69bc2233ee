package com.payment.fraudcheck.core;

import com.payment.fraudcheck.emission.EmissionSinkAdapter;
import com.payment.fraudcheck.metrics.MetricSample;
import com.payment.fraudcheck.metrics.MetricsAggregator;
import com.payment.fraudcheck.metrics.MetricsSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MetricsExportSchedulerTest {

    @Mock
    private EmissionSinkAdapter sink;

    @Test
    void exportsCurrentSnapshot() {
        MetricsAggregator metrics = new MetricsAggregator();
        metrics.record(MetricSample.increment("fraud.checks", Map.of("status", "approved")));
        MetricsExportScheduler scheduler = new MetricsExportScheduler(metrics, sink);

        scheduler.export();

        ArgumentCaptor<MetricsSnapshot> captor = ArgumentCaptor.forClass(MetricsSnapshot.class);
        verify(sink).emit(captor.capture());
        assertThat(captor.getValue().count("fraud.checks")).isEqualTo(1);
    }
}
