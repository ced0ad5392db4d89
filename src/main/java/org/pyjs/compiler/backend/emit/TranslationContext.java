package org.pyjs.compiler.backend.emit;

import org.pyjs.compiler.api.CompilerOptions;
import org.pyjs.compiler.api.TargetFeature;
import org.pyjs.compiler.backend.mangle.IdentifierMangler;
import org.pyjs.compiler.backend.output.OutputAssembler;
import org.pyjs.compiler.diagnostics.InternalInvariantError;
import org.pyjs.compiler.frontend.parser.ast.NodeKind;
import org.pyjs.compiler.frontend.parser.ast.SyntaxNode;
import org.pyjs.compiler.frontend.semantics.Binding;
import org.pyjs.compiler.frontend.semantics.BindingKind;
import org.pyjs.compiler.frontend.semantics.Scope;
import org.pyjs.compiler.frontend.semantics.ScopeKind;
import org.pyjs.compiler.frontend.semantics.ScopeTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.pyjs.compiler.backend.emit.ExpressionTranslator.helperName;

/**
 * Per-call state shared by the translators.
 *
 * <p>Holds the options, the analysis results and the stack of JavaScript function frames
 * being emitted. Temporaries are numbered per call, so output does not depend on anything
 * outside the call.</p>
 */
public class TranslationContext {

    static final String TEMPORARY_PREFIX = "_pytmp_";
    static final String ERROR_PREFIX = "_pyerr_";
    static final String CLASS_VARIABLE = "_pycls";
    static final String BASE_PARAMETER = "_pybase";
    static final String MIXINS_PARAMETER = "_pymixins";
    static final String LOCAL_CHECK = helperName("op_local");
    static final String UNBOUND = helperName("op_unbound");

    private final CompilerOptions options;
    private final ScopeTree tree;
    private final IdentifierMangler mangler;
    private final OutputAssembler assembler;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private int temporaryCounter;
    private int errorCounter;

    /**
     * @param options   The compile options.
     * @param tree      The analyzed program.
     * @param mangler   The mangler, with names already assigned.
     * @param assembler The assembler used to render nested function bodies.
     */
    public TranslationContext(CompilerOptions options, ScopeTree tree, IdentifierMangler mangler,
                              OutputAssembler assembler) {
        this.options = options;
        this.tree = tree;
        this.mangler = mangler;
        this.assembler = assembler;
        frames.push(new Frame(tree.moduleScope(), null));
    }

    public CompilerOptions options() {
        return options;
    }

    public ScopeTree tree() {
        return tree;
    }

    public OutputAssembler assembler() {
        return assembler;
    }

    public boolean supports(TargetFeature feature) {
        return options.targetProfile().supports(feature);
    }

    Frame frame() {
        return frames.peek();
    }

    Frame moduleFrame() {
        return frames.peekLast();
    }

    void enter(Frame frame) {
        frames.push(frame);
    }

    void exit(Frame frame) {
        if (frames.peek() != frame || frames.size() == 1) {
            throw new InternalInvariantError("Unbalanced frame exit for " + frame.scope());
        }
        frames.pop();
    }

    /**
     * Discards every frame but the module frame after a failed top-level statement.
     */
    void resetToModuleFrame() {
        while (frames.size() > 1) {
            frames.pop();
        }
        moduleFrame().loops.clear();
        moduleFrame().errorVariables.clear();
    }

    /**
     * Allocates a temporary declared at the top of the current frame.
     * @return The temporary's name.
     */
    String declareTemporary() {
        String name = nextTemporary();
        frame().temporaries.add(name);
        return name;
    }

    /**
     * Allocates a temporary that the caller declares itself, e.g. with {@code let} in a loop header.
     * @return The temporary's name.
     */
    String nextTemporary() {
        return TEMPORARY_PREFIX + (++temporaryCounter);
    }

    String nextErrorVariable() {
        return ERROR_PREFIX + (++errorCounter);
    }

    /**
     * @param binding A resolved binding.
     * @return The JavaScript expression that reads or writes it.
     */
    String reference(Binding binding) {
        if (binding.kind() == BindingKind.CLASS_ATTRIBUTE) {
            return CLASS_VARIABLE + ".prototype." + binding.name();
        }
        return mangler.targetName(binding);
    }

    /**
     * Reads a variable. A function local that may not be assigned at this point, or that the
     * function deletes somewhere, is read through a check that raises UnboundLocalError.
     *
     * @param binding A resolved binding.
     * @param c Receives the check helper when one is needed.
     * @return The JavaScript expression that reads the binding.
     */
    String read(Binding binding, FragmentCollector c) {
        String reference = reference(binding);
        if (!mayBeUnbound(binding)) {
            return reference;
        }
        frame().guarded.add(binding);
        return c.helper(LOCAL_CHECK) + "(" + reference + ", " + JsLiterals.quote(binding.name()) + ")";
    }

    /**
     * @return true if reading the binding in the current frame needs the unbound check.
     */
    boolean mayBeUnbound(Binding binding) {
        Frame frame = frame();
        if (binding.kind() != BindingKind.LOCAL || binding.scope() != frame.scope()
                || frame.scope().kind() != ScopeKind.FUNCTION) {
            return false;
        }
        if (frame.deleted == null) {
            frame.deleted = new HashSet<>();
            collectDeleted(frame.scope().node().child(1), frame.deleted);
        }
        return !frame.assigned.contains(binding) || frame.deleted.contains(binding);
    }

    private void collectDeleted(SyntaxNode node, Set<Binding> out) {
        switch (node.kind()) {
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF, CLASS_DEF, LAMBDA -> {
                return;
            }
            case DELETE -> node.children().forEach(target -> collectDeletedTargets(target, out));
            default -> node.children().forEach(child -> collectDeleted(child, out));
        }
    }

    private void collectDeletedTargets(SyntaxNode target, Set<Binding> out) {
        if (target.is(NodeKind.NAME)) {
            tree.findBinding(target).ifPresent(out::add);
        } else if (target.is(NodeKind.TUPLE) || target.is(NodeKind.LIST)) {
            target.children().forEach(child -> collectDeletedTargets(child, out));
        }
    }

    /**
     * Records that the current frame has assigned a variable on the path being emitted.
     */
    void assigned(Binding binding) {
        frame().assigned.add(binding);
    }

    /**
     * One JavaScript function being emitted: the module, a function, a lambda, a class body
     * or a comprehension closure.
     */
    static final class Frame {

        private final Scope scope;
        private final String self;
        private final Set<String> temporaries = new LinkedHashSet<>();
        private final Deque<Loop> loops = new ArrayDeque<>();
        private final Deque<String> errorVariables = new ArrayDeque<>();
        private final Set<Binding> assigned = new HashSet<>();
        private final Set<Binding> guarded = new LinkedHashSet<>();
        private final Set<Binding> blockDeclared = new HashSet<>();
        private Set<Binding> deleted;
        private String accumulator;

        /**
         * @param scope The scope whose code this frame holds.
         * @param self  The emitted name of the receiver parameter of a method, or null.
         */
        Frame(Scope scope, String self) {
            this.scope = scope;
            this.self = self;
        }

        Scope scope() {
            return scope;
        }

        String self() {
            return self;
        }

        List<String> temporaries() {
            return new ArrayList<>(temporaries);
        }

        Deque<Loop> loops() {
            return loops;
        }

        Deque<String> errorVariables() {
            return errorVariables;
        }

        /**
         * @return A copy of the variables assigned on the path emitted so far.
         */
        Set<Binding> assignedSnapshot() {
            return new HashSet<>(assigned);
        }

        void restoreAssigned(Set<Binding> snapshot) {
            assigned.retainAll(snapshot);
        }

        void unassign(Binding binding) {
            assigned.remove(binding);
        }

        /**
         * @return true if some read of the binding goes through the unbound check.
         */
        boolean isGuarded(Binding binding) {
            return guarded.contains(binding);
        }

        void markGuarded(Binding binding) {
            guarded.add(binding);
        }

        /**
         * @return The loop-scoped variables declared by enclosing loop blocks of this frame.
         */
        Set<Binding> blockDeclared() {
            return blockDeclared;
        }

        /**
         * @return The array collecting yielded values of an eagerly evaluated generator, or null.
         */
        String accumulator() {
            return accumulator;
        }

        void setAccumulator(String accumulator) {
            this.accumulator = accumulator;
        }
    }

    /**
     * @param elseFlag The completed-normally flag of a loop with an {@code else} clause, or null.
     */
    record Loop(String elseFlag) {
    }
}
