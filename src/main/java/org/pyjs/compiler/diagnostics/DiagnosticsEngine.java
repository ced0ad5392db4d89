package org.pyjs.compiler.diagnostics;

import org.pyjs.compiler.api.Strictness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects translation errors for one compile call.
 *
 * <p>In {@link Strictness#FAIL_FAST} mode the first reported error is rethrown at once and
 * aborts the call. In {@link Strictness#BATCH} mode errors accumulate so that independent
 * top-level statements can still be translated; the caller checks {@link #hasErrors()}
 * at the end and fails the call as a whole.</p>
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final Strictness strictness;
    private final List<TranslationError> errors = new ArrayList<>();

    /**
     * Creates an engine with the given strictness.
     * @param strictness How reported errors propagate.
     */
    public DiagnosticsEngine(Strictness strictness) {
        this.strictness = strictness;
    }

    /**
     * Creates a fail-fast engine.
     */
    public DiagnosticsEngine() {
        this(Strictness.FAIL_FAST);
    }

    /**
     * Records an error. Rethrows it in fail-fast mode.
     * @param error The error to record.
     * @throws TranslationError the given error, when the engine is fail-fast.
     */
    public void report(TranslationError error) {
        errors.add(error);
        LOG.debug("Reported {}", error.format());
        if (strictness == Strictness.FAIL_FAST) {
            throw error;
        }
    }

    /**
     * @return true if at least one error was reported.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @return The reported errors in report order.
     */
    public List<TranslationError> getDiagnostics() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * @return The strictness this engine was created with.
     */
    public Strictness getStrictness() {
        return strictness;
    }

    /**
     * Formats all reported errors, one per line.
     * @return The summary text, empty if there are no errors.
     */
    public String summary() {
        return errors.stream().map(TranslationError::format).collect(Collectors.joining("\n"));
    }
}
