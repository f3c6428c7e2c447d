package com.ulio.drift.telemetry;

import com.ulio.drift.registry.DefaultMetricConfigs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import oshi.SystemInfo;
import oshi.hardware.CentralProcessor;
import oshi.hardware.GlobalMemory;
import oshi.hardware.HWDiskStore;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.hardware.NetworkIF;
import oshi.software.os.OperatingSystem;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the default system metrics through OSHI. Disk and network values are
 * cumulative totals in megabytes since boot.
 */
public class OshiSystemMetricsSource implements SystemMetricsSource {
    private static final Logger LOG = LoggerFactory.getLogger(OshiSystemMetricsSource.class);
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;
    static final long FIRST_CPU_SAMPLE_MS = 100;

    private final HardwareAbstractionLayer hardware;
    private final OperatingSystem operatingSystem;

    private long[] previousCpuTicks;

    public OshiSystemMetricsSource() {
        HardwareAbstractionLayer loadedHardware = null;
        OperatingSystem loadedOs = null;

        try {
            SystemInfo systemInfo = new SystemInfo();
            loadedHardware = systemInfo.getHardware();
            loadedOs = systemInfo.getOperatingSystem();
        } catch (Throwable e) {
            LOG.warn("OSHI initialization failed, system metrics will be zero-filled: {}", e.getMessage());
        }

        this.hardware = loadedHardware;
        this.operatingSystem = loadedOs;
    }

    @Override
    public synchronized SampleSet collect() {
        Instant timestamp = Instant.now();
        Map<String, Double> values = new LinkedHashMap<>();
        if (hardware == null) {
            return new SampleSet(timestamp, values);
        }

        double cpuPercent = collectCpuPercent();
        values.put(DefaultMetricConfigs.CPU_PERCENT, cpuPercent);
        values.put(DefaultMetricConfigs.RAM_PERCENT, collectRamPercent());

        double[] disk = collectDiskMb();
        values.put(DefaultMetricConfigs.DISK_READ_MB, disk[0]);
        values.put(DefaultMetricConfigs.DISK_WRITE_MB, disk[1]);

        double[] network = collectNetworkMb();
        values.put(DefaultMetricConfigs.NET_SENT_MB, network[0]);
        values.put(DefaultMetricConfigs.NET_RECV_MB, network[1]);

        values.put(DefaultMetricConfigs.LOAD_AVG, collectLoadAverage(cpuPercent));
        values.put(DefaultMetricConfigs.CONNECTIONS, collectConnectionCount());

        return new SampleSet(timestamp, values);
    }

    private double collectCpuPercent() {
        try {
            CentralProcessor processor = hardware.getProcessor();
            double load;
            if (previousCpuTicks == null) {
                // no tick baseline yet, measure over a short window instead
                load = processor.getSystemCpuLoad(FIRST_CPU_SAMPLE_MS);
            } else {
                load = processor.getSystemCpuLoadBetweenTicks(previousCpuTicks);
            }
            previousCpuTicks = processor.getSystemCpuLoadTicks();
            return sanitize(load * 100.0);
        } catch (Throwable e) {
            LOG.debug("CPU load unavailable: {}", e.getMessage());
            return 0.0;
        }
    }

    private double collectRamPercent() {
        try {
            GlobalMemory memory = hardware.getMemory();
            long total = memory.getTotal();
            if (total <= 0) {
                return 0.0;
            }
            return sanitize((total - memory.getAvailable()) * 100.0 / total);
        } catch (Throwable e) {
            LOG.debug("Memory usage unavailable: {}", e.getMessage());
            return 0.0;
        }
    }

    private double[] collectDiskMb() {
        long readBytes = 0;
        long writeBytes = 0;

        try {
            List<HWDiskStore> disks = hardware.getDiskStores();
            if (disks != null) {
                for (HWDiskStore disk : disks) {
                    if (disk == null) {
                        continue;
                    }
                    try {
                        disk.updateAttributes();
                        readBytes += Math.max(0L, disk.getReadBytes());
                        writeBytes += Math.max(0L, disk.getWriteBytes());
                    } catch (Throwable e) {
                        LOG.debug("Skipping unreadable disk {}: {}", disk.getName(), e.getMessage());
                    }
                }
            }
        } catch (Throwable e) {
            LOG.debug("Disk counters unavailable: {}", e.getMessage());
        }

        return new double[] {readBytes / BYTES_PER_MB, writeBytes / BYTES_PER_MB};
    }

    private double[] collectNetworkMb() {
        long sentBytes = 0;
        long receivedBytes = 0;

        try {
            List<NetworkIF> interfaces = hardware.getNetworkIFs();
            if (interfaces != null) {
                for (NetworkIF networkIf : interfaces) {
                    if (networkIf == null) {
                        continue;
                    }
                    try {
                        networkIf.updateAttributes();
                        sentBytes += Math.max(0L, networkIf.getBytesSent());
                        receivedBytes += Math.max(0L, networkIf.getBytesRecv());
                    } catch (Throwable e) {
                        LOG.debug("Skipping unreadable interface {}: {}", networkIf.getName(), e.getMessage());
                    }
                }
            }
        } catch (Throwable e) {
            LOG.debug("Network counters unavailable: {}", e.getMessage());
        }

        return new double[] {sentBytes / BYTES_PER_MB, receivedBytes / BYTES_PER_MB};
    }

    private double collectLoadAverage(double cpuPercent) {
        try {
            CentralProcessor processor = hardware.getProcessor();
            double load = processor.getSystemLoadAverage(1)[0];
            if (load >= 0.0) {
                return sanitize(load);
            }
            // platforms without a load average (Windows) report a negative value
            return sanitize(cpuPercent / 100.0 * processor.getLogicalProcessorCount());
        } catch (Throwable e) {
            LOG.debug("Load average unavailable: {}", e.getMessage());
            return 0.0;
        }
    }

    private double collectConnectionCount() {
        if (operatingSystem == null) {
            return 0.0;
        }
        try {
            return operatingSystem.getInternetProtocolStats().getConnections().size();
        } catch (Throwable e) {
            LOG.debug("Connection table unavailable: {}", e.getMessage());
            return 0.0;
        }
    }

    private static double sanitize(double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            return 0.0;
        }
        return value;
    }
}
