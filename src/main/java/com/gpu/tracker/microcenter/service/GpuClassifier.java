package com.gpu.tracker.microcenter.service;

import com.gpu.tracker.microcenter.model.GpuIdentity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Derives manufacturer and model name from a raw listing name. Pure and total:
 * every input, including null, yields an identity whose model name fits the
 * column.
 */
@Component
public class GpuClassifier {
    static final List<String> MANUFACTURERS = List.of("NVIDIA", "AMD", "Intel");
    static final int MODEL_NAME_MAX = 99;
    static final int LONG_NAME_THRESHOLD = 100;

    private final List<ModelNameRule> rules;

    public GpuClassifier() {
        this(defaultRules());
    }

    GpuClassifier(List<ModelNameRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public GpuIdentity classify(String fullName, String brandHint) {
        String name = fullName == null ? "" : fullName;
        String brand = brandHint == null || brandHint.isBlank() ? GpuIdentity.UNKNOWN : brandHint;
        String manufacturer = detectManufacturer(name);

        String modelName = name;
        for (ModelNameRule rule : rules) {
            Optional<String> match = rule.apply(name, brand, manufacturer);
            if (match.isPresent()) {
                modelName = match.get();
                break;
            }
        }
        if (modelName.length() > MODEL_NAME_MAX) {
            modelName = modelName.substring(0, MODEL_NAME_MAX);
        }
        return new GpuIdentity(brand, manufacturer, modelName);
    }

    static String detectManufacturer(String fullName) {
        for (String candidate : MANUFACTURERS) {
            if (ModelNameRule.indexOfIgnoreCase(fullName, candidate) >= 0) {
                return candidate;
            }
        }
        return GpuIdentity.UNKNOWN;
    }

    static List<ModelNameRule> defaultRules() {
        return List.of(
                ModelNameRule.family("GeForce RTX"),
                ModelNameRule.family("Radeon RX"),
                ModelNameRule.family("Intel Arc"),
                ModelNameRule.longNameFallback(LONG_NAME_THRESHOLD),
                ModelNameRule.fullName()
        );
    }
}
