package org.pyjs.compiler.api;

import org.pyjs.compiler.diagnostics.TranslationError;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Thrown when a compile call fails. Carries every translation error in report order:
 * exactly one in fail-fast mode, one or more in batch mode.
 */
public class CompilationException extends Exception {

    private final List<TranslationError> errors;
    private final String partialSource;

    /**
     * @param errors        The errors, at least one.
     * @param partialSource The output of the top-level statements that did translate
     *                      (batch mode only), or null.
     */
    public CompilationException(List<TranslationError> errors, String partialSource) {
        super(formatMessage(errors), errors.isEmpty() ? null : errors.get(0));
        this.errors = List.copyOf(errors);
        this.partialSource = partialSource;
    }

    public CompilationException(TranslationError error) {
        this(List.of(error), null);
    }

    private static String formatMessage(List<TranslationError> errors) {
        return errors.stream().map(TranslationError::format).collect(Collectors.joining("\n"));
    }

    /**
     * @return The errors in report order.
     */
    public List<TranslationError> getErrors() {
        return errors;
    }

    /**
     * @return The partial output of a batch-mode call, if any statement translated.
     */
    public Optional<String> getPartialSource() {
        return Optional.ofNullable(partialSource);
    }
}
