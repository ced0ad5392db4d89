package org.pyjs.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Immutable configuration of a compile call.
 *
 * <p>Options are normally read from the {@code pyjs.compiler} block of the HOCON
 * configuration (see {@code reference.conf}) via {@link #fromConfig(Config)}; tests and
 * embedders can also use the {@link Builder}.</p>
 */
public final class CompilerOptions {

    /** Path of the compiler block inside the application configuration. */
    public static final String CONFIG_PATH = "pyjs.compiler";

    private final int indentWidth;
    private final IndentStyle indentStyle;
    private final TargetProfile targetProfile;
    private final HelperLinking helperLinking;
    private final String runtimeModuleName;
    private final Strictness strictness;
    private final Degradation degradation;
    private final boolean docstrings;
    private final List<String> allowedGlobals;

    private CompilerOptions(Builder builder) {
        this.indentWidth = builder.indentWidth;
        this.indentStyle = builder.indentStyle;
        this.targetProfile = builder.targetProfile;
        this.helperLinking = builder.helperLinking;
        this.runtimeModuleName = builder.runtimeModuleName;
        this.strictness = builder.strictness;
        this.degradation = builder.degradation;
        this.docstrings = builder.docstrings;
        this.allowedGlobals = List.copyOf(builder.allowedGlobals);
    }

    /**
     * Returns the defaults declared in {@code reference.conf}.
     * @return The default options.
     */
    public static CompilerOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * Reads options from the {@code pyjs.compiler} block of the given configuration.
     *
     * @param config The application configuration (must contain {@code pyjs.compiler}).
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a required key is missing or has the wrong type.
     * @throws IllegalArgumentException if an enumerated value is not recognized.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config c = config.getConfig(CONFIG_PATH);
        Builder builder = builder()
                .indentWidth(c.getInt("indent.width"))
                .indentStyle(parseEnum(IndentStyle.class, c.getString("indent.style")))
                .helperLinking(parseEnum(HelperLinking.class, c.getString("runtime.linking")))
                .runtimeModuleName(c.getString("runtime.module-name"))
                .strictness(parseEnum(Strictness.class, c.getString("strictness")))
                .degradation(parseEnum(Degradation.class, c.getString("degradation")))
                .docstrings(c.getBoolean("docstrings"))
                .allowedGlobals(c.getStringList("allowed-globals"));

        if (c.hasPath("target.features")) {
            List<TargetFeature> features = new ArrayList<>();
            for (String f : c.getStringList("target.features")) {
                features.add(parseEnum(TargetFeature.class, f));
            }
            builder.targetProfile(TargetProfile.of(features));
        } else {
            builder.targetProfile(TargetProfile.preset(c.getString("target.profile")));
        }
        return builder.build();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid value '" + value + "' for " + type.getSimpleName(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialized from this instance.
     * @return A builder with all fields copied.
     */
    public Builder toBuilder() {
        return new Builder()
                .indentWidth(indentWidth)
                .indentStyle(indentStyle)
                .targetProfile(targetProfile)
                .helperLinking(helperLinking)
                .runtimeModuleName(runtimeModuleName)
                .strictness(strictness)
                .degradation(degradation)
                .docstrings(docstrings)
                .allowedGlobals(allowedGlobals);
    }

    public int indentWidth() {
        return indentWidth;
    }

    public IndentStyle indentStyle() {
        return indentStyle;
    }

    public TargetProfile targetProfile() {
        return targetProfile;
    }

    public HelperLinking helperLinking() {
        return helperLinking;
    }

    public String runtimeModuleName() {
        return runtimeModuleName;
    }

    public Strictness strictness() {
        return strictness;
    }

    public Degradation degradation() {
        return degradation;
    }

    public boolean docstrings() {
        return docstrings;
    }

    public List<String> allowedGlobals() {
        return allowedGlobals;
    }

    @Override
    public String toString() {
        return "CompilerOptions{indent=" + indentWidth + " " + indentStyle
                + ", target=" + targetProfile
                + ", linking=" + helperLinking
                + ", strictness=" + strictness
                + ", degradation=" + degradation + "}";
    }

    /**
     * Builder for {@link CompilerOptions}. Unset fields keep hard-coded fallbacks
     * that match {@code reference.conf}.
     */
    public static final class Builder {
        private int indentWidth = 4;
        private IndentStyle indentStyle = IndentStyle.SPACES;
        private TargetProfile targetProfile = TargetProfile.ES5;
        private HelperLinking helperLinking = HelperLinking.INLINE;
        private String runtimeModuleName = "pyjs_runtime";
        private Strictness strictness = Strictness.FAIL_FAST;
        private Degradation degradation = Degradation.NONE;
        private boolean docstrings = false;
        private List<String> allowedGlobals = List.of();

        private Builder() {
        }

        public Builder indentWidth(int indentWidth) {
            if (indentWidth < 0) {
                throw new IllegalArgumentException("indentWidth must not be negative: " + indentWidth);
            }
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder indentStyle(IndentStyle indentStyle) {
            this.indentStyle = indentStyle;
            return this;
        }

        public Builder targetProfile(TargetProfile targetProfile) {
            this.targetProfile = targetProfile;
            return this;
        }

        public Builder helperLinking(HelperLinking helperLinking) {
            this.helperLinking = helperLinking;
            return this;
        }

        public Builder runtimeModuleName(String runtimeModuleName) {
            this.runtimeModuleName = runtimeModuleName;
            return this;
        }

        public Builder strictness(Strictness strictness) {
            this.strictness = strictness;
            return this;
        }

        public Builder degradation(Degradation degradation) {
            this.degradation = degradation;
            return this;
        }

        public Builder docstrings(boolean docstrings) {
            this.docstrings = docstrings;
            return this;
        }

        public Builder allowedGlobals(List<String> allowedGlobals) {
            this.allowedGlobals = List.copyOf(allowedGlobals);
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(this);
        }
    }
}
