package com.khaounen.authguard.security.ratelimit;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of presets by name. Built once at startup from the shipped
 * presets plus any configured overrides.
 */
public class PolicyPresetRegistry {

    private final Map<String, PolicyPreset> presets;

    public PolicyPresetRegistry(Collection<PolicyPreset> presets) {
        Map<String, PolicyPreset> byName = new LinkedHashMap<>();
        for (PolicyPreset preset : presets) {
            byName.put(normalize(preset.name()), preset);
        }
        this.presets = Collections.unmodifiableMap(byName);
    }

    public static PolicyPresetRegistry defaults() {
        return new PolicyPresetRegistry(defaultPresets());
    }

    public static Collection<PolicyPreset> defaultPresets() {
        return List.of(
                PolicyPreset.LOGIN,
                PolicyPreset.PASSWORD_RESET,
                PolicyPreset.TWO_FACTOR,
                PolicyPreset.GENERAL_API
        );
    }

    /**
     * Applies configured presets on top of the shipped ones. A configured preset
     * with a shipped name replaces only the fields it sets.
     */
    public static PolicyPresetRegistry fromProperties(RateLimitProperties properties) {
        Map<String, PolicyPreset> merged = new LinkedHashMap<>();
        for (PolicyPreset preset : defaultPresets()) {
            merged.put(preset.name(), preset);
        }
        properties.getPresets().forEach((name, config) -> {
            String key = normalize(name);
            PolicyPreset base = merged.get(key);
            merged.put(key, config.toPreset(key, base));
        });
        PolicyPresetRegistry registry = new PolicyPresetRegistry(merged.values());
        registry.require(properties.getDefaultPreset());
        for (RateLimitProperties.Route route : properties.getRoutes()) {
            registry.require(route.getPreset());
        }
        return registry;
    }

    public Optional<PolicyPreset> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(presets.get(normalize(name)));
    }

    public PolicyPreset require(String name) {
        return find(name).orElseThrow(() ->
                new IllegalArgumentException("unknown rate limit preset '" + name + "', known: " + presets.keySet()));
    }

    public Collection<PolicyPreset> all() {
        return presets.values();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
