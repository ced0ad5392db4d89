package org.pyjs.compiler.api;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CompilerOptionsTest {

    @Test
    @Tag("unit")
    void builderFallbacksMatchReferenceDefaults() {
        CompilerOptions defaults = CompilerOptions.defaults();
        CompilerOptions built = CompilerOptions.builder().allowedGlobals(defaults.allowedGlobals()).build();

        assertThat(built.toString()).isEqualTo(defaults.toString());
    }

    @Test
    @Tag("unit")
    void toBuilderCopiesEveryField() {
        CompilerOptions options = CompilerOptions.builder()
                .indentWidth(2)
                .indentStyle(IndentStyle.TABS)
                .targetProfile(TargetProfile.ES2017)
                .helperLinking(HelperLinking.EXTERNAL)
                .runtimeModuleName("rt")
                .strictness(Strictness.BATCH)
                .degradation(Degradation.EAGER)
                .docstrings(true)
                .allowedGlobals(List.of("window"))
                .build();

        CompilerOptions copy = options.toBuilder().build();

        assertThat(copy.indentWidth()).isEqualTo(2);
        assertThat(copy.indentStyle()).isEqualTo(IndentStyle.TABS);
        assertThat(copy.targetProfile()).isEqualTo(TargetProfile.ES2017);
        assertThat(copy.helperLinking()).isEqualTo(HelperLinking.EXTERNAL);
        assertThat(copy.runtimeModuleName()).isEqualTo("rt");
        assertThat(copy.strictness()).isEqualTo(Strictness.BATCH);
        assertThat(copy.degradation()).isEqualTo(Degradation.EAGER);
        assertThat(copy.docstrings()).isTrue();
        assertThat(copy.allowedGlobals()).containsExactly("window");
    }

    @Test
    @Tag("unit")
    void parsesHyphenatedEnumValues() {
        CompilerOptions options = CompilerOptions.fromConfig(ConfigFactory.parseString("""
                pyjs.compiler.strictness = fail-fast
                pyjs.compiler.target.features = [block-scoping]
                """).withFallback(ConfigFactory.defaultReference()));

        assertThat(options.strictness()).isEqualTo(Strictness.FAIL_FAST);
        assertThat(options.targetProfile().features()).containsExactly(TargetFeature.BLOCK_SCOPING);
        assertThat(options.targetProfile().name()).isEqualTo("custom");
    }

    @Test
    @Tag("unit")
    void rejectsUnknownEnumValue() {
        assertThatThrownBy(() -> CompilerOptions.fromConfig(ConfigFactory.parseString(
                "pyjs.compiler.degradation = lazy").withFallback(ConfigFactory.defaultReference())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lazy")
                .hasMessageContaining("Degradation");
    }

    @Test
    @Tag("unit")
    void rejectsNegativeIndentWidth() {
        assertThatThrownBy(() -> CompilerOptions.builder().indentWidth(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void presetsDeclareTheirFeatures() {
        assertThat(TargetProfile.ES5.features()).isEmpty();
        assertThat(TargetProfile.ES2015.features())
                .containsExactlyInAnyOrder(TargetFeature.GENERATORS, TargetFeature.BLOCK_SCOPING);
        assertThat(TargetProfile.ES2017.supports(TargetFeature.ASYNC)).isTrue();
        assertThat(TargetProfile.preset("ES2015")).isSameAs(TargetProfile.ES2015);
        assertThat(TargetProfile.of(List.of(TargetFeature.GENERATORS, TargetFeature.BLOCK_SCOPING)))
                .isEqualTo(TargetProfile.ES2015);
        assertThatThrownBy(() -> TargetProfile.preset("es3")).isInstanceOf(IllegalArgumentException.class);
    }
}
