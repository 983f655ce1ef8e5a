package io.pricedock.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.pricedock.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tunables read from {@code pricedock-settings.json} under the data root.
 * Missing or invalid values fall back to the {@link PriceDockConfig} defaults.
 */
public record IngestSettings(
        long supervisorTimeoutMs,
        long killGraceMs,
        int stdioTailChars,
        long staleRunningMinutes,
        long stalePendingMinutes,
        List<String> allowedExtensions,
        int maxFiles,
        String defaultTarget,
        String lockName,
        int busyTimeoutMs
) {
    private static final Logger log = LoggerFactory.getLogger(IngestSettings.class);

    public IngestSettings {
        allowedExtensions = List.copyOf(allowedExtensions);
    }

    public static IngestSettings defaults() {
        return new IngestSettings(
                PriceDockConfig.DEFAULT_SUPERVISOR_TIMEOUT_MS,
                PriceDockConfig.DEFAULT_KILL_GRACE_MS,
                PriceDockConfig.DEFAULT_STDIO_TAIL_CHARS,
                PriceDockConfig.DEFAULT_STALE_RUNNING_MINUTES,
                PriceDockConfig.DEFAULT_STALE_PENDING_MINUTES,
                List.of(".csv"),
                PriceDockConfig.DEFAULT_MAX_FILES,
                PriceDockConfig.DEFAULT_TARGET,
                PriceDockConfig.DEFAULT_LOCK_NAME,
                PriceDockConfig.DEFAULT_BUSY_TIMEOUT_MS
        );
    }

    public static IngestSettings load(PriceDockConfig config) {
        Path cfg = config.settingsFile();
        if (!Files.isRegularFile(cfg)) {
            return defaults();
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(cfg.toFile(), SettingsFile.class);
            return fromFile(file, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings: " + cfg, e);
        }
    }

    static IngestSettings fromFile(SettingsFile file, IngestSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long timeout = sanitizeLong(file.supervisorTimeoutMs(), defaults.supervisorTimeoutMs(), 1_000L);
        long killGrace = sanitizeLong(file.killGraceMs(), defaults.killGraceMs(), 0L);
        int tail = sanitizeInt(file.stdioTailChars(), defaults.stdioTailChars(), 64);
        long staleRunning = sanitizeLong(file.staleRunningMinutes(), defaults.staleRunningMinutes(), 1L);
        long stalePending = sanitizeLong(file.stalePendingMinutes(), defaults.stalePendingMinutes(), 1L);
        int maxFiles = sanitizeInt(file.maxFiles(), defaults.maxFiles(), 1);
        int busyTimeout = sanitizeInt(file.busyTimeoutMs(), defaults.busyTimeoutMs(), 0);
        return new IngestSettings(
                timeout,
                killGrace,
                tail,
                staleRunning,
                stalePending,
                sanitizeExtensions(file.allowedExtensions(), defaults.allowedExtensions()),
                maxFiles,
                sanitizeName(file.defaultTarget(), defaults.defaultTarget()),
                sanitizeName(file.lockName(), defaults.lockName()),
                busyTimeout
        );
    }

    private static List<String> sanitizeExtensions(List<String> raw, List<String> fallback) {
        if (raw == null) {
            return fallback;
        }
        List<String> out = new ArrayList<>();
        for (String ext : raw) {
            if (ext == null || ext.isBlank()) {
                continue;
            }
            String normalized = ext.trim().toLowerCase(Locale.ROOT);
            out.add(normalized.startsWith(".") ? normalized : "." + normalized);
        }
        if (out.isEmpty()) {
            log.warn("settings allowedExtensions is empty, using defaults {}", fallback);
            return fallback;
        }
        return out;
    }

    private static String sanitizeName(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long supervisorTimeoutMs,
            Long killGraceMs,
            Integer stdioTailChars,
            Long staleRunningMinutes,
            Long stalePendingMinutes,
            List<String> allowedExtensions,
            Integer maxFiles,
            String defaultTarget,
            String lockName,
            Integer busyTimeoutMs
    ) {
    }
}
