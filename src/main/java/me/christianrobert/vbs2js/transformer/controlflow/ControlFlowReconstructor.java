package me.christianrobert.vbs2js.transformer.controlflow;

import me.christianrobert.vbs2js.transformer.builder.ExpressionTranspiler;
import me.christianrobert.vbs2js.transformer.context.DiagnosticKind;
import me.christianrobert.vbs2js.transformer.context.Diagnostics;
import me.christianrobert.vbs2js.transformer.context.ExpressionContext;
import me.christianrobert.vbs2js.transformer.context.TranspilationContext;
import me.christianrobert.vbs2js.transformer.context.TranspilerOptions;
import me.christianrobert.vbs2js.transformer.parser.FunctionUnit;
import me.christianrobert.vbs2js.transformer.parser.LineClassifier;
import me.christianrobert.vbs2js.transformer.parser.ParsedProgram;
import me.christianrobert.vbs2js.transformer.parser.Token;
import me.christianrobert.vbs2js.transformer.parser.TokenVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Rebuilds brace structure from keyword-delimited VBScript blocks.
 *
 * <p>Walks one token stream (a unit body or the script-level code) with a stack of open
 * blocks. Openers push a frame and emit a header ending in '{'; closers pop the matching
 * frame and emit '}'. Structural problems never abort the run:</p>
 * <ul>
 *   <li>a closer whose frame is not on top closes the frames above it, one UNMATCHED_BLOCK each</li>
 *   <li>a closer without any frame is recorded and kept as a comment</li>
 *   <li>frames still open at the end of the stream are recorded and closed</li>
 * </ul>
 *
 * <p>Select Case becomes a switch with a {@code break;} after every clause body that does not
 * already end in a jump. An Exit For/Do that would otherwise leave a nested switch or loop
 * labels its target loop and breaks to the label.</p>
 *
 * <p>One instance serves one run (it shares the run's transpiler and diagnostics).</p>
 */
public class ControlFlowReconstructor {

    private static final Logger log = LoggerFactory.getLogger(ControlFlowReconstructor.class);

    private static final Pattern JUMP = Pattern.compile("^(?:return|break)\\b.*");
    private static final Pattern NUMERIC_STEP = Pattern.compile("^[+-]?\\s*\\d+(?:\\.\\d+)?$");
    private static final Pattern SIMPLE_EXPRESSION = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$.\\[\\]]*$");

    private final ExpressionTranspiler transpiler;
    private final LineClassifier classifier;
    private final Diagnostics diagnostics;
    private final DeclarationRenderer declarationRenderer;
    private final String indent;

    public ControlFlowReconstructor(ExpressionTranspiler transpiler, LineClassifier classifier, TranspilerOptions options) {
        this.transpiler = transpiler;
        this.classifier = classifier;
        this.diagnostics = transpiler.getDiagnostics();
        this.declarationRenderer = new DeclarationRenderer(transpiler);
        this.indent = options.getIndent();
    }

    /**
     * Reconstructs the script-level code and every unit of a program.
     *
     * @param program Parsed program
     * @param header Leading comment lines (may be empty)
     * @return Program ready for post-processing
     */
    public GeneratedProgram reconstruct(ParsedProgram program, List<String> header) {
        GeneratedUnit preamble = reconstructGlobal(program.getGlobalTokens());
        List<GeneratedUnit> units = new ArrayList<>();
        for (FunctionUnit unit : program.getUnits()) {
            units.add(reconstructUnit(unit));
        }
        log.debug("Reconstructed {} units and {} script-level lines", units.size(), preamble.getLines().size());
        return new GeneratedProgram(header, preamble, units);
    }

    /**
     * Reconstructs one Function or Sub as a JavaScript function declaration.
     */
    public GeneratedUnit reconstructUnit(FunctionUnit unit) {
        log.debug("Reconstructing {}", unit);
        Emitter emitter = new Emitter(unit, 1);
        emitter.emitAt(0, "function " + transpiler.getKnowledgeBase().canonical(unit.getName())
                + "(" + String.join(", ", unit.getParameters()) + ") {");
        emitter.emitAll(unit.getBodyTokens());
        emitter.closeRemaining();
        if (unit.isValueReturning() && !unit.hasReturnAssignments()) {
            emitter.emit("return null;");
        }
        emitter.emitAt(0, "}");
        return new GeneratedUnit(unit.getName(), emitter.output, unit.getStartLine(), unit.getEndLine());
    }

    /**
     * Reconstructs script-level tokens (outside every unit).
     */
    public GeneratedUnit reconstructGlobal(List<Token> tokens) {
        Emitter emitter = new Emitter(null, 0);
        emitter.emitAll(tokens);
        emitter.closeRemaining();
        int first = tokens.isEmpty() ? 0 : tokens.get(0).getLine();
        int last = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).getLine();
        return new GeneratedUnit(null, emitter.output, first, last);
    }

    /**
     * Per-stream state: output lines, open frames and the label counter.
     */
    private class Emitter implements TokenVisitor<Void> {

        private final FunctionUnit unit;
        private final int baseDepth;
        private final List<String> output = new ArrayList<>();
        private final Deque<BlockFrame> frames = new ArrayDeque<>();

        // Single-line actions are collected here instead of the output
        private List<String> sink = output;
        private boolean inline;
        private int labelCounter;

        Emitter(FunctionUnit unit, int baseDepth) {
            this.unit = unit;
            this.baseDepth = baseDepth;
        }

        // ========== Output ==========

        void emitAll(List<Token> tokens) {
            for (Token token : tokens) {
                log.trace("Line {}: {} (depth {})", token.getLine(), token.getKind(), frames.size());
                token.accept(this);
            }
        }

        void emit(String text) {
            emitAt(currentDepth(), text);
        }

        void emitAt(int depth, String text) {
            if (inline || text.isEmpty()) {
                sink.add(text);
            } else {
                sink.add(indent.repeat(depth) + text);
            }
        }

        private int currentDepth() {
            int depth = baseDepth;
            for (BlockFrame frame : frames) {
                depth += frame.innerDepth();
            }
            return depth;
        }

        // ========== Frames ==========

        private void openFrame(FrameKind kind, Token token, String header) {
            if (inline) {
                emit(unknown(token));
                return;
            }
            int depth = currentDepth();
            int index = output.size();
            emitAt(depth, header);
            frames.push(new BlockFrame(kind, token.getLine(), index, depth, header));
        }

        private BlockFrame findFrame(Predicate<FrameKind> matches) {
            for (BlockFrame frame : frames) {
                if (matches.test(frame.getKind())) {
                    return frame;
                }
            }
            return null;
        }

        /**
         * Closes the frames above the target, recording each as unmatched.
         */
        private void closeIntervening(BlockFrame target, Token closer) {
            while (frames.peek() != target) {
                BlockFrame frame = frames.peek();
                diagnostics.record(DiagnosticKind.UNMATCHED_BLOCK, frame.getSourceLine(),
                        frame.getKind().getOpener() + " opened at line " + frame.getSourceLine()
                                + " closed implicitly by '" + closer.getSourceText() + "' at line " + closer.getLine());
                closeFrame(frame, defaultClosing(frame));
            }
        }

        private void closeFrame(BlockFrame frame, String closing) {
            if (frame.getKind() == FrameKind.SELECT && frame.isClauseOpen()) {
                emitBreakIfNeeded(frame);
            }
            frames.pop();
            emitAt(frame.getDepth(), closing);
        }

        private void closeBlock(Token closer, Predicate<FrameKind> matches, Function<BlockFrame, String> closing) {
            if (inline) {
                emit(unknown(closer));
                return;
            }
            BlockFrame frame = findFrame(matches);
            if (frame == null) {
                unmatched(closer, "'" + closer.getSourceText() + "' has no open block");
                return;
            }
            closeIntervening(frame, closer);
            closeFrame(frame, closing.apply(frame));
        }

        void closeRemaining() {
            while (!frames.isEmpty()) {
                BlockFrame frame = frames.peek();
                diagnostics.record(DiagnosticKind.UNMATCHED_BLOCK, frame.getSourceLine(),
                        frame.getKind().getOpener() + " opened at line " + frame.getSourceLine()
                                + " is not closed by " + frame.getKind().getCloser());
                closeFrame(frame, defaultClosing(frame));
            }
        }

        private String defaultClosing(BlockFrame frame) {
            return frame.getKind() == FrameKind.DO_BOTTOM ? "} while (true);" : "}";
        }

        private void emitBreakIfNeeded(BlockFrame select) {
            for (int i = output.size() - 1; i > select.getHeaderIndex(); i--) {
                String line = output.get(i).trim();
                if (line.isEmpty() || line.startsWith("//")) {
                    continue;
                }
                if (JUMP.matcher(line).matches()) {
                    return;
                }
                break;
            }
            emitAt(select.getDepth() + 2, "break;");
        }

        private String ensureLabel(BlockFrame loop) {
            if (loop.getLabel() == null) {
                String label = "loop" + (++labelCounter);
                loop.setLabel(label);
                output.set(loop.getHeaderIndex(), indent.repeat(loop.getDepth()) + label + ": " + loop.getHeader());
                log.trace("Labeled {} as {}", loop, label);
            }
            return loop.getLabel();
        }

        private void unmatched(Token token, String message) {
            diagnostics.record(DiagnosticKind.UNMATCHED_BLOCK, token.getLine(), message);
            emit("// UNMATCHED: " + token.getSourceText());
        }

        private String unknown(Token token) {
            return new TranspilationContext(transpiler.getKnowledgeBase(), diagnostics, unit, token.getLine(),
                    ExpressionContext.ASSIGNMENT).unknownConstruct(token.getSourceText());
        }

        // ========== Expressions ==========

        private String expression(String text, int line) {
            return transpiler.transpileExpression(text, unit, line);
        }

        private String test(String condition, boolean until, int line) {
            String js = expression(condition, line);
            if (!until) {
                return js;
            }
            return SIMPLE_EXPRESSION.matcher(js).matches() ? "!" + js : "!(" + js + ")";
        }

        private String inlineActions(String action, int line) {
            List<String> saved = sink;
            boolean savedInline = inline;
            List<String> collected = new ArrayList<>();
            sink = collected;
            inline = true;
            try {
                for (Token token : classifier.classifyAction(action, line)) {
                    token.accept(this);
                }
            } finally {
                sink = saved;
                inline = savedInline;
            }
            return String.join(" ", collected);
        }

        // ========== Tokens ==========

        @Override
        public Void visitComment(Token.Comment token) {
            if (inline) {
                return null;
            }
            if (token.isBlank()) {
                emitAt(0, "");
            } else {
                emit(token.getText().isEmpty() ? "//" : "// " + token.getText());
            }
            return null;
        }

        @Override
        public Void visitDeclaration(Token.Declaration token) {
            for (String statement : declarationRenderer.render(token, unit)) {
                emit(statement);
            }
            return null;
        }

        @Override
        public Void visitFunctionStart(Token.FunctionStart token) {
            // Units are split off by the parser; a nested boundary cannot be expressed here
            emit(unknown(token));
            return null;
        }

        @Override
        public Void visitFunctionEnd(Token.FunctionEnd token) {
            emit(unknown(token));
            return null;
        }

        @Override
        public Void visitConditional(Token.Conditional token) {
            switch (token.getForm()) {
                case SINGLE_LINE -> {
                    String line = "if (" + expression(token.getCondition(), token.getLine()) + ") { "
                            + inlineActions(token.getThenAction(), token.getLine()) + " }";
                    if (token.getElseAction() != null) {
                        line += " else { " + inlineActions(token.getElseAction(), token.getLine()) + " }";
                    }
                    emit(line);
                }
                case BLOCK_START -> openFrame(FrameKind.IF, token,
                        "if (" + expression(token.getCondition(), token.getLine()) + ") {");
                case ELSE_IF, ELSE -> continueConditional(token);
                case END -> closeBlock(token, k -> k == FrameKind.IF, f -> "}");
            }
            return null;
        }

        private void continueConditional(Token.Conditional token) {
            if (inline) {
                emit(unknown(token));
                return;
            }
            BlockFrame frame = findFrame(k -> k == FrameKind.IF);
            if (frame == null) {
                unmatched(token, "'" + token.getSourceText() + "' outside an If block");
                return;
            }
            closeIntervening(frame, token);
            if (token.getForm() == Token.ConditionalForm.ELSE_IF) {
                emitAt(frame.getDepth(), "} else if (" + expression(token.getCondition(), token.getLine()) + ") {");
            } else {
                emitAt(frame.getDepth(), "} else {");
            }
        }

        @Override
        public Void visitLoop(Token.Loop token) {
            switch (token.getForm()) {
                case FOR_START -> openFrame(FrameKind.FOR, token, countedLoopHeader(token));
                case FOR_EACH_START -> openFrame(FrameKind.FOR_EACH, token,
                        "for (const " + transpiler.getKnowledgeBase().canonical(token.getVariable()) + " of "
                                + expression(token.getCollection(), token.getLine()) + ") {");
                case DO_START -> {
                    if (token.getCondition() == null) {
                        openFrame(FrameKind.DO_BOTTOM, token, "do {");
                    } else {
                        openFrame(FrameKind.DO_TOP, token,
                                "while (" + test(token.getCondition(), token.isUntil(), token.getLine()) + ") {");
                    }
                }
                case WHILE_START -> openFrame(FrameKind.WHILE, token,
                        "while (" + expression(token.getCondition(), token.getLine()) + ") {");
                case NEXT -> closeBlock(token, FrameKind::isCountedLoop, f -> "}");
                case LOOP_END -> closeBlock(token, FrameKind::isDoLoop, f -> loopEnd(f, token));
                case WEND -> closeBlock(token, k -> k == FrameKind.WHILE, f -> "}");
            }
            return null;
        }

        private String loopEnd(BlockFrame frame, Token.Loop token) {
            if (frame.getKind() == FrameKind.DO_TOP) {
                return "}";
            }
            if (token.getCondition() == null) {
                return "} while (true);";
            }
            return "} while (" + test(token.getCondition(), token.isUntil(), token.getLine()) + ");";
        }

        private String countedLoopHeader(Token.Loop token) {
            int line = token.getLine();
            String counter = transpiler.getKnowledgeBase().canonical(token.getVariable());
            String start = expression(token.getStart(), line);
            String end = expression(token.getEnd(), line);
            String rawStep = token.getStep();

            String condition;
            String update;
            if (rawStep == null) {
                condition = counter + " <= " + end;
                update = counter + "++";
            } else if (NUMERIC_STEP.matcher(rawStep.trim()).matches()) {
                String literal = rawStep.replaceAll("\\s+", "");
                boolean negative = literal.startsWith("-");
                String magnitude = literal.replaceFirst("^[+-]", "");
                condition = counter + (negative ? " >= " : " <= ") + end;
                if ("1".equals(magnitude)) {
                    update = counter + (negative ? "--" : "++");
                } else {
                    update = counter + (negative ? " -= " : " += ") + magnitude;
                }
            } else {
                // Direction known only at run time
                String step = expression(rawStep, line);
                condition = "(" + step + ") >= 0 ? " + counter + " <= " + end + " : " + counter + " >= " + end;
                update = counter + " += " + step;
            }
            return "for (let " + counter + " = " + start + "; " + condition + "; " + update + ") {";
        }

        @Override
        public Void visitSelectDispatch(Token.SelectDispatch token) {
            switch (token.getForm()) {
                case START -> openFrame(FrameKind.SELECT, token,
                        "switch (" + expression(token.getSubject(), token.getLine()) + ") {");
                case CLAUSE, CLAUSE_ELSE -> clause(token);
                case END -> closeBlock(token, k -> k == FrameKind.SELECT, f -> "}");
            }
            return null;
        }

        private void clause(Token.SelectDispatch token) {
            if (inline) {
                emit(unknown(token));
                return;
            }
            BlockFrame select = findFrame(k -> k == FrameKind.SELECT);
            if (select == null) {
                // Left in place; the post-processor comments out misplaced labels
                for (String label : clauseLabels(token)) {
                    emit(label);
                }
                return;
            }
            closeIntervening(select, token);
            if (select.isClauseOpen()) {
                emitBreakIfNeeded(select);
            }
            for (String label : clauseLabels(token)) {
                emitAt(select.getDepth() + 1, label);
            }
            select.setClauseOpen(true);
        }

        private List<String> clauseLabels(Token.SelectDispatch token) {
            List<String> labels = new ArrayList<>();
            if (token.getForm() == Token.DispatchForm.CLAUSE_ELSE) {
                labels.add("default:");
                return labels;
            }
            for (String value : token.getValues()) {
                labels.add("case " + expression(value, token.getLine()) + ":");
            }
            return labels;
        }

        @Override
        public Void visitUnitExit(Token.UnitExit token) {
            if (token.exitsUnit()) {
                if (unit == null) {
                    unmatched(token, "'" + token.getSourceText() + "' outside a Function or Sub");
                } else {
                    emit("return;");
                }
                return null;
            }

            Predicate<FrameKind> target = token.getTarget() == Token.ExitTarget.FOR
                    ? FrameKind::isCountedLoop
                    : FrameKind::isDoLoop;
            boolean crossesBreakable = false;
            for (BlockFrame frame : frames) {
                if (target.test(frame.getKind())) {
                    if (crossesBreakable) {
                        emit("break " + ensureLabel(frame) + ";");
                    } else {
                        emit("break;");
                    }
                    return null;
                }
                if (frame.getKind() == FrameKind.SELECT || frame.getKind().isLoop()) {
                    crossesBreakable = true;
                }
            }
            unmatched(token, "'" + token.getSourceText() + "' outside a matching loop");
            return null;
        }

        @Override
        public Void visitStatement(Token.Statement token) {
            emit(transpiler.transpileStatement(token.getText(), unit, token.getLine()));
            return null;
        }
    }
}
