package org.pyjs.compiler;

import org.pyjs.compiler.api.CompilationException;
import org.pyjs.compiler.api.CompilerOptions;
import org.pyjs.compiler.api.Strictness;
import org.pyjs.compiler.api.TranslationResult;
import org.pyjs.compiler.backend.emit.StatementTranslator;
import org.pyjs.compiler.backend.emit.TranslationContext;
import org.pyjs.compiler.backend.mangle.IdentifierMangler;
import org.pyjs.compiler.backend.output.OutputAssembler;
import org.pyjs.compiler.diagnostics.DiagnosticsEngine;
import org.pyjs.compiler.diagnostics.TranslationError;
import org.pyjs.compiler.frontend.parser.PythonParser;
import org.pyjs.compiler.frontend.parser.SourceParser;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;
import org.pyjs.compiler.frontend.semantics.ScopeAnalyzer;
import org.pyjs.compiler.frontend.semantics.ScopeTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Translates a Python module into JavaScript.
 *
 * <p>One compile call runs scope analysis, identifier mangling, statement translation and
 * output assembly over a single syntax tree. A {@code Compiler} holds only its options, so
 * one instance may serve concurrent calls; all per-call state lives in objects created by
 * {@link #compile(SyntaxNode)}.</p>
 */
public class Compiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final CompilerOptions options;

    /**
     * @param options The options applied to every compile call.
     */
    public Compiler(CompilerOptions options) {
        this.options = options;
    }

    /**
     * Creates a compiler with the defaults from {@code reference.conf}.
     */
    public Compiler() {
        this(CompilerOptions.defaults());
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * Parses and translates source text with the bundled parser.
     *
     * @param source The module source.
     * @param fileName The file name used in error positions.
     * @return The generated JavaScript and the helpers it references.
     * @throws CompilationException if parsing or translation fails.
     */
    public TranslationResult compile(String source, String fileName) throws CompilationException {
        return compile(source, fileName, new PythonParser());
    }

    /**
     * Parses source text with the given parser, then translates it.
     *
     * @param source The module source.
     * @param fileName The file name used in error positions.
     * @param parser The upstream parser.
     * @return The generated JavaScript and the helpers it references.
     * @throws CompilationException if parsing or translation fails.
     */
    public TranslationResult compile(String source, String fileName, SourceParser parser) throws CompilationException {
        SyntaxNode module;
        try {
            module = parser.parse(source, fileName);
        } catch (TranslationError e) {
            throw new CompilationException(e);
        }
        LOG.debug("Parsed {} ({} top-level statements)", fileName, module.childCount());
        return compile(module);
    }

    /**
     * Translates a parsed module.
     *
     * @param module The MODULE node.
     * @return The generated JavaScript and the helpers it references.
     * @throws CompilationException with one error in fail-fast mode, or every collected error in
     *                              batch mode together with the output of the statements that translated.
     */
    public TranslationResult compile(SyntaxNode module) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(options.strictness());
        try {
            ScopeTree tree = new ScopeAnalyzer(diagnostics, options.allowedGlobals()).analyze(module);
            LOG.debug("Analyzed {} scopes", tree.scopesInPreOrder().size());

            IdentifierMangler mangler = new IdentifierMangler(tree).assign();
            LOG.debug("Renamed bindings: {}", mangler.renamed());

            OutputAssembler assembler = new OutputAssembler(options);
            TranslationContext context = new TranslationContext(options, tree, mangler, assembler);
            StatementTranslator.ModuleTranslation translation =
                    new StatementTranslator(context).translateModule(module, diagnostics);
            String source = assembler.assemble(translation.statements(), translation.helpers());
            LOG.debug("Used helpers: {}", new TreeSet<>(translation.helpers()));

            if (diagnostics.hasErrors()) {
                LOG.info("Translation failed with {} error(s):\n{}", diagnostics.getDiagnostics().size(),
                        diagnostics.summary());
                throw new CompilationException(diagnostics.getDiagnostics(), source);
            }
            return new TranslationResult(source, new TreeSet<>(translation.helpers()));
        } catch (TranslationError e) {
            List<TranslationError> errors = new ArrayList<>(diagnostics.getDiagnostics());
            if (!errors.contains(e)) {
                errors.add(e);
            }
            if (options.strictness() == Strictness.BATCH) {
                LOG.info("Translation aborted with {} error(s)", errors.size());
            }
            throw new CompilationException(errors, null);
        }
    }
}
