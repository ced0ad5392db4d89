package org.pyjs.compiler.api;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * The declared set of native JavaScript features available to the translator for a compile call.
 * Constructs that need an undeclared feature fail with an unsupported-construct error
 * unless degradation is enabled.
 */
public final class TargetProfile {

    /** Plain ES5: no generators, no async functions, function-scoped {@code var} only. */
    public static final TargetProfile ES5 = new TargetProfile("es5", EnumSet.noneOf(TargetFeature.class));

    /** ES2015: generators and block-scoped declarations. */
    public static final TargetProfile ES2015 = new TargetProfile("es2015",
            EnumSet.of(TargetFeature.GENERATORS, TargetFeature.BLOCK_SCOPING));

    /** ES2017: ES2015 plus async functions. */
    public static final TargetProfile ES2017 = new TargetProfile("es2017",
            EnumSet.of(TargetFeature.GENERATORS, TargetFeature.BLOCK_SCOPING, TargetFeature.ASYNC));

    private final String name;
    private final Set<TargetFeature> features;

    private TargetProfile(String name, EnumSet<TargetFeature> features) {
        this.name = name;
        this.features = Collections.unmodifiableSet(features);
    }

    /**
     * Creates a custom profile from an explicit feature set.
     * @param features The supported features.
     * @return A new profile named {@code custom}.
     */
    public static TargetProfile of(Collection<TargetFeature> features) {
        EnumSet<TargetFeature> set = EnumSet.noneOf(TargetFeature.class);
        set.addAll(features);
        return new TargetProfile("custom", set);
    }

    /**
     * Looks up a preset by name ({@code es5}, {@code es2015}, {@code es2017}), case-insensitive.
     * @param presetName The preset name.
     * @return The preset.
     * @throws IllegalArgumentException if no preset has this name.
     */
    public static TargetProfile preset(String presetName) {
        return switch (presetName.toLowerCase(Locale.ROOT)) {
            case "es5" -> ES5;
            case "es2015", "es6" -> ES2015;
            case "es2017" -> ES2017;
            default -> throw new IllegalArgumentException("Unknown target profile: " + presetName);
        };
    }

    public boolean supports(TargetFeature feature) {
        return features.contains(feature);
    }

    public Set<TargetFeature> features() {
        return features;
    }

    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetProfile other)) return false;
        return features.equals(other.features);
    }

    @Override
    public int hashCode() {
        return features.hashCode();
    }

    @Override
    public String toString() {
        return name + features;
    }
}
