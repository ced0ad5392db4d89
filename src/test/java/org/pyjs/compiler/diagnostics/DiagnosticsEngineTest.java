package org.pyjs.compiler.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pyjs.compiler.api.Strictness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DiagnosticsEngineTest {

    private static final SourcePosition AT = new SourcePosition("a.py", 3, 5);

    @Test
    @Tag("unit")
    void failFastRethrowsAndRecords() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        NameResolutionError error = new NameResolutionError("Name 'x' is not defined", AT);

        assertThatThrownBy(() -> diagnostics.report(error)).isSameAs(error);
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics()).containsExactly(error);
    }

    @Test
    @Tag("unit")
    void batchAccumulatesInReportOrder() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(Strictness.BATCH);
        TranslationError first = new UnsupportedConstructError("'import' is not supported", AT);
        TranslationError second = new NameResolutionError("Name 'y' is not defined", new SourcePosition("a.py", 9, 1));

        diagnostics.report(first);
        diagnostics.report(second);

        assertThat(diagnostics.getDiagnostics()).containsExactly(first, second);
        assertThat(diagnostics.summary()).isEqualTo(
                "a.py:3:5: UnsupportedConstructError: 'import' is not supported\n"
                        + "a.py:9:1: NameResolutionError: Name 'y' is not defined");
    }

    @Test
    @Tag("unit")
    void startsEmpty() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(Strictness.BATCH);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.summary()).isEmpty();
        assertThat(diagnostics.getStrictness()).isEqualTo(Strictness.BATCH);
    }

    @Test
    @Tag("unit")
    void errorsWithoutPositionUseUnknown() {
        InternalInvariantError error = new InternalInvariantError("broken");

        assertThat(error.getPosition()).isEqualTo(SourcePosition.UNKNOWN);
        assertThat(error.format()).isEqualTo("<unknown>:0:0: InternalInvariantError: broken");
    }
}
