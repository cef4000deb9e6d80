package org.opensase.upo;

import org.opensase.upo.adapter.TargetKind;
import org.opensase.upo.model.InspectionLevel;
import org.opensase.upo.util.EnvVars;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runtime settings, read from the environment:
 *
 * <ul>
 *   <li>{@code UPO_OPNSENSE_URL}, {@code UPO_OPENZITI_URL}, {@code UPO_FLEXIWAN_URL}: target API base URLs</li>
 *   <li>{@code UPO_COMPILE_THREADS}, {@code UPO_APPLY_THREADS}: executor sizes (1..16)</li>
 *   <li>{@code UPO_HTTP_TIMEOUT_SECONDS}: per-request timeout for HTTP targets (1..300)</li>
 *   <li>{@code UPO_CACHE_ENABLED}: reuse compiled configs for an unchanged policy</li>
 *   <li>{@code UPO_<TARGET>_INSPECTION_LEVELS}: comma-separated levels overriding a target's defaults</li>
 * </ul>
 */
public record UpoSettings(
        Map<TargetKind, String> targetUrls,
        int compileThreads,
        int applyThreads,
        int httpTimeoutSeconds,
        boolean cacheEnabled,
        Map<TargetKind, Set<InspectionLevel>> inspectionLevels
) {
    public static final Map<TargetKind, String> DEFAULT_URLS = Map.of(
            TargetKind.OPNSENSE, "http://localhost:8081",
            TargetKind.OPENZITI, "https://localhost:1280",
            TargetKind.FLEXIWAN, "http://localhost:3000");

    public UpoSettings {
        targetUrls = Map.copyOf(targetUrls);
        inspectionLevels = Map.copyOf(inspectionLevels);
    }

    public static UpoSettings defaults() {
        return fromEnv(Map.of());
    }

    public static UpoSettings fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * @throws IllegalArgumentException when an inspection level override names an unknown level
     */
    public static UpoSettings fromEnv(Map<String, String> env) {
        Map<TargetKind, String> urls = new EnumMap<>(TargetKind.class);
        Map<TargetKind, Set<InspectionLevel>> levels = new EnumMap<>(TargetKind.class);
        for (TargetKind target : TargetKind.values()) {
            String prefix = "UPO_" + target.id().toUpperCase(Locale.ROOT);
            urls.put(target, EnvVars.getOrDefault(env, prefix + "_URL", DEFAULT_URLS.get(target)));
            List<String> raw = EnvVars.getList(env, prefix + "_INSPECTION_LEVELS");
            if (!raw.isEmpty()) {
                Set<InspectionLevel> set = EnumSet.noneOf(InspectionLevel.class);
                for (String value : raw) {
                    set.add(InspectionLevel.fromValue(value.toLowerCase(Locale.ROOT)).orElseThrow(() ->
                            new IllegalArgumentException(prefix + "_INSPECTION_LEVELS: unknown level '" + value + "'")));
                }
                levels.put(target, set);
            }
        }
        return new UpoSettings(
                urls,
                EnvVars.getIntClamped(env, "UPO_COMPILE_THREADS", 3, 1, 16),
                EnvVars.getIntClamped(env, "UPO_APPLY_THREADS", 3, 1, 16),
                EnvVars.getIntClamped(env, "UPO_HTTP_TIMEOUT_SECONDS", 30, 1, 300),
                EnvVars.getBoolean(env, "UPO_CACHE_ENABLED", true),
                levels);
    }

    public String targetUrl(TargetKind target) {
        return targetUrls.get(target);
    }

    /** Configured inspection levels for {@code target}, empty when the adapter's defaults apply. */
    public Optional<Set<InspectionLevel>> inspectionLevels(TargetKind target) {
        return Optional.ofNullable(inspectionLevels.get(target));
    }
}
