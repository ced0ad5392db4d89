package org.pyjs.compiler.backend.output;

import org.pyjs.compiler.api.CompilerOptions;
import org.pyjs.compiler.api.HelperLinking;
import org.pyjs.compiler.api.IndentStyle;
import org.pyjs.compiler.runtime.RuntimeLibrary;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Serializes translated statements into JavaScript source text.
 *
 * <p>Rendering is a pure function of the statements and the options: the indentation unit is
 * fixed per call, and multi-line expression code (function bodies nested in an expression) is
 * re-indented line by line relative to the statement that contains it.</p>
 */
public class OutputAssembler {

    private final CompilerOptions options;
    private final String indentUnit;

    /**
     * @param options The compile options; indentation and helper linking are read from them.
     */
    public OutputAssembler(CompilerOptions options) {
        this.options = options;
        this.indentUnit = options.indentStyle() == IndentStyle.TABS ? "\t" : " ".repeat(options.indentWidth());
    }

    public String indentUnit() {
        return indentUnit;
    }

    /**
     * Renders statements at the given nesting level. Every line ends with a newline.
     * @param statements The statements.
     * @param level The nesting level of the first statement.
     * @return The rendered text.
     */
    public String render(List<JsStatement> statements, int level) {
        StringBuilder out = new StringBuilder();
        for (JsStatement statement : statements) {
            render(statement, level, out);
        }
        return out.toString();
    }

    /**
     * Produces the final output: the helper header selected by the linking mode, then the program.
     * @param program The top-level statements.
     * @param usedHelpers The helpers the program references directly.
     * @return The output text, ending with exactly one newline.
     */
    public String assemble(List<JsStatement> program, Collection<String> usedHelpers) {
        StringBuilder out = new StringBuilder();
        if (!usedHelpers.isEmpty()) {
            if (options.helperLinking() == HelperLinking.INLINE) {
                out.append(RuntimeLibrary.definitions(usedHelpers));
            } else {
                for (String helper : new TreeSet<>(usedHelpers)) {
                    out.append("var ").append(helper).append(" = ")
                            .append(options.runtimeModuleName()).append('.').append(helper).append(";\n");
                }
            }
        }
        out.append(render(program, 0));
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '\n') {
            end--;
        }
        out.setLength(end);
        return out.append('\n').toString();
    }

    private void render(JsStatement statement, int level, StringBuilder out) {
        switch (statement.kind()) {
            case SIMPLE -> {
                String code = statement.code();
                if (code.startsWith("function") || code.startsWith("{") || code.startsWith("async function")) {
                    code = "(" + code + ")";
                }
                appendLines(code + ";", level, out);
            }
            case COMMENT -> appendLines(statement.code().stripTrailing(), level, out);
            case COMPOUND -> {
                appendLines(statement.code().isEmpty() ? "{" : statement.code() + " {", level, out);
                out.append(render(statement.body(), level + 1));
                for (JsStatement clause = statement.continuation(); clause != null; clause = clause.continuation()) {
                    appendLines("} " + clause.code() + " {", level, out);
                    out.append(render(clause.body(), level + 1));
                }
                appendLines("}", level, out);
            }
        }
    }

    private void appendLines(String code, int level, StringBuilder out) {
        String prefix = indentUnit.repeat(level);
        for (String line : code.split("\n", -1)) {
            if (!line.isEmpty()) {
                out.append(prefix).append(line);
            }
            out.append('\n');
        }
    }
}
