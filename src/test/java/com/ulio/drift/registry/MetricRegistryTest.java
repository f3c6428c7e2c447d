package com.ulio.drift.registry;

import com.ulio.drift.detector.Algorithm;
import com.ulio.drift.detector.CumsumDetector;
import com.ulio.drift.detector.EwmaDetector;
import com.ulio.drift.detector.StreamingDetector;
import com.ulio.drift.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MetricRegistryTest {

    @Test
    public void testDefaultCatalogCoversSystemMetrics() {
        MetricRegistry registry = MetricRegistry.withDefaults();

        assertThat(registry.getConfigs()).containsOnlyKeys(
                "cpu_percent", "ram_percent", "load_avg",
                "net_sent_mb", "net_recv_mb", "disk_read_mb", "disk_write_mb", "connections");
        assertThat(registry.getActiveDetectors()).hasSize(8);

        MetricConfig ram = registry.getConfig("ram_percent");
        assertThat(ram.getAlgorithm()).isEqualTo(Algorithm.CUMSUM);
        assertThat(ram.getThreshold()).isEqualTo(10.0);
        assertThat(ram.getDrift()).isEqualTo(2.0);
        assertThat(ram.getReferenceMean()).isEqualTo(50.0);

        MetricConfig disk = registry.getConfig("disk_write_mb");
        assertThat(disk.getAlgorithm()).isEqualTo(Algorithm.EWMA);
        assertThat(disk.getAlpha()).isEqualTo(0.15);
        assertThat(disk.getThresholdSigma()).isEqualTo(4.5);
    }

    @Test
    public void testSetConfigDiscardsLearnedState() throws Exception {
        MetricRegistry registry = MetricRegistry.withDefaults();
        StreamingDetector before = registry.getDetector("cpu_percent");
        before.update(80.0);
        before.update(80.0);

        registry.setConfig("cpu_percent", MetricConfig.cumsum(30.0, 5.0, 30.0, "cpu"));

        StreamingDetector after = registry.getDetector("cpu_percent");
        assertThat(after).isNotSameAs(before);
        assertThat(((CumsumDetector) after).getPositiveSum()).isZero();
        assertThat(((CumsumDetector) after).getReferenceMean()).isEqualTo(30.0);
    }

    @Test
    public void testSwitchingAlgorithmBuildsMatchingDetector() throws Exception {
        MetricRegistry registry = MetricRegistry.withDefaults();

        registry.configure("cpu_percent", MetricParameters.ewma(0.2, 3.0));

        assertThat(registry.getDetector("cpu_percent")).isInstanceOf(EwmaDetector.class);
        assertThat(registry.getConfig("cpu_percent").getDescription()).isEqualTo("CPU usage - sustained changes only");
    }

    @Test
    public void testConfigureMergesWithExistingConfig() throws Exception {
        MetricRegistry registry = MetricRegistry.withDefaults();

        MetricParameters parameters = new MetricParameters();
        parameters.setThreshold(30.0);
        MetricConfig merged = registry.configure("cpu_percent", parameters);

        assertThat(merged.getThreshold()).isEqualTo(30.0);
        assertThat(merged.getDrift()).isEqualTo(5.0);
        assertThat(merged.getReferenceMean()).isEqualTo(30.0);
        assertThat(merged.getAlgorithm()).isEqualTo(Algorithm.CUMSUM);
    }

    @Test
    public void testConfigureUnknownMetricUsesBuiltInDefaults() throws Exception {
        MetricRegistry registry = new MetricRegistry();

        MetricConfig config = registry.configure("queue_depth", null);

        assertThat(config.getAlgorithm()).isEqualTo(Algorithm.CUMSUM);
        assertThat(config.getThreshold()).isEqualTo(MetricConfig.DEFAULT_THRESHOLD);
        assertThat(config.getDrift()).isEqualTo(MetricConfig.DEFAULT_DRIFT);
        assertThat(config.getReferenceMean()).isNull();
        assertThat(config.getDescription()).isEqualTo("Custom metric: queue_depth");
        assertThat(((CumsumDetector) registry.getDetector("queue_depth")).hasReference()).isFalse();
    }

    @Test
    public void testDisableKeepsConfigAndDropsDetector() throws Exception {
        MetricRegistry registry = MetricRegistry.withDefaults();

        assertThat(registry.disable("connections")).isTrue();

        assertThat(registry.getDetector("connections")).isNull();
        assertThat(registry.getConfig("connections").isEnabled()).isFalse();
        assertThat(registry.getActiveDetectors()).doesNotContainKey("connections");

        MetricParameters enable = new MetricParameters();
        enable.setEnabled(true);
        registry.configure("connections", enable);

        assertThat(registry.getDetector("connections")).isInstanceOf(EwmaDetector.class);
        assertThat(registry.getConfig("connections").getAlpha()).isEqualTo(0.15);
    }

    @Test
    public void testDisableUnknownMetricReturnsFalse() {
        assertThat(new MetricRegistry().disable("nope")).isFalse();
    }

    @Test
    public void testInvalidParametersAreRejectedAndOldConfigKept() {
        MetricRegistry registry = MetricRegistry.withDefaults();
        StreamingDetector before = registry.getDetector("net_sent_mb");

        MetricParameters parameters = MetricParameters.ewma(1.5, 3.0);

        assertThatThrownBy(() -> registry.configure("net_sent_mb", parameters))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("alpha");
        assertThat(registry.getDetector("net_sent_mb")).isSameAs(before);
        assertThat(registry.getConfig("net_sent_mb").getAlpha()).isEqualTo(0.1);
    }

    @Test
    public void testValidationRejectsBadValues() {
        assertThatThrownBy(() -> MetricConfig.cumsum(0.0, 0.5, null, "").validate("m"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> MetricConfig.cumsum(5.0, -1.0, null, "").validate("m"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> MetricConfig.cumsum(5.0, 0.5, Double.NaN, "").validate("m"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> MetricConfig.ewma(0.3, -2.0, "").validate("m"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> MetricConfig.ewma(0.3, 3.0, "").validate(" "))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    public void testRegisterCustomRequiresCollector() {
        MetricRegistry registry = new MetricRegistry();

        assertThatThrownBy(() -> registry.registerCustom("queue_depth", null, MetricConfig.ewma(0.2, 3.0, "")))
                .isInstanceOf(ConfigurationException.class);
        assertThat(registry.getConfig("queue_depth")).isNull();
    }

    @Test
    public void testDisabledCustomMetricIsNotCollected() throws Exception {
        MetricRegistry registry = new MetricRegistry();
        registry.registerCustom("queue_depth", () -> 1.0, MetricConfig.ewma(0.2, 3.0, "queue"));
        registry.registerCustom("error_rate", () -> 0.1, MetricConfig.cumsum(5.0, 1.0, null, "errors"));

        registry.disable("queue_depth");

        assertThat(registry.getEnabledCollectors()).containsOnlyKeys("error_rate");
        assertThat(registry.hasCollector("queue_depth")).isTrue();
    }

    @Test
    public void testResetDetectorsClearsLearnedReference() {
        MetricRegistry registry = MetricRegistry.withDefaults();
        CumsumDetector cpu = (CumsumDetector) registry.getDetector("cpu_percent");
        cpu.update(70.0);

        registry.resetDetectors();

        assertThat(cpu.hasReference()).isFalse();
        assertThat(cpu.getPositiveSum()).isZero();
    }
}
