package me.christianrobert.vbs2js.transformer.parser;

import java.util.List;

/**
 * One classified VBScript line (or one ':'-separated statement of a line).
 *
 * <p>The set of token kinds is closed: the constructor is private and every kind is a
 * nested subclass. Consumers dispatch through {@link TokenVisitor}, which has one method
 * per kind, so adding a kind breaks the build until every consumer handles it.</p>
 */
public abstract class Token {

    private final int line;
    private final String sourceText;

    private Token(int line, String sourceText) {
        this.line = line;
        this.sourceText = sourceText;
    }

    /**
     * 1-based source line number (first physical line for continued lines).
     */
    public int getLine() {
        return line;
    }

    /**
     * The source text the token was classified from (comment stripped, trimmed).
     */
    public String getSourceText() {
        return sourceText;
    }

    public abstract TokenKind getKind();

    public abstract <R> R accept(TokenVisitor<R> visitor);

    @Override
    public String toString() {
        return getKind() + "@" + line + "{" + sourceText + "}";
    }

    // ========== Comment ==========

    public static final class Comment extends Token {
        private final String text;

        public Comment(int line, String sourceText, String text) {
            super(line, sourceText);
            this.text = text;
        }

        /**
         * Comment text without the ' or Rem marker; empty for blank lines.
         */
        public String getText() {
            return text;
        }

        public boolean isBlank() {
            return text.isEmpty() && getSourceText().isEmpty();
        }

        @Override
        public TokenKind getKind() {
            return TokenKind.COMMENT;
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitComment(this);
        }
    }

    // ========== Declaration ==========

    public enum DeclarationKeyword { DIM, PRIVATE, PUBLIC, CONST, REDIM }

    public static final class Declaration extends Token {
        private final DeclarationKeyword keyword;
        private final List<VariableDeclaration> declarations;
        private final boolean preserve;

        public Declaration(int line, String sourceText, DeclarationKeyword keyword,
                           List<VariableDeclaration> declarations, boolean preserve) {
            super(line, sourceText);
            this.keyword = keyword;
            this.declarations = List.copyOf(declarations);
            this.preserve = preserve;
        }

        public DeclarationKeyword getKeyword() {
            return keyword;
        }

        public List<VariableDeclaration> getDeclarations() {
            return declarations;
        }

        /**
         * True for ReDim Preserve.
         */
        public boolean isPreserve() {
            return preserve;
        }

        public boolean isResize() {
            return keyword == DeclarationKeyword.REDIM;
        }

        @Override
        public TokenKind getKind() {
            return TokenKind.DECLARATION;
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitDeclaration(this);
        }
    }

    // ========== Function boundaries ==========

    public static final class FunctionStart extends Token {
        private final String name;
        private final UnitKind unitKind;
        private final List<String> parameters;

        public FunctionStart(int line, String sourceText, String name, UnitKind unitKind, List<String> parameters) {
            super(line, sourceText);
            this.name = name;
            this.unitKind = unitKind;
            this.parameters = List.copyOf(parameters);
        }

        public String getName() {
            return name;
        }

        public UnitKind getUnitKind() {
            return unitKind;
        }

        public List<String> getParameters() {
            return parameters;
        }

        @Override
        public TokenKind getKind() {
            return TokenKind.FUNCTION_START;
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitFunctionStart(this);
        }
    }

    public static final class FunctionEnd extends Token {
        private final UnitKind unitKind;

        public FunctionEnd(int line, String sourceText, UnitKind unitKind) {
            super(line, sourceText);
            this.unitKind = unitKind;
        }

        public UnitKind getUnitKind() {
            return unitKind;
        }

        @Override
        public TokenKind getKind() {
            return TokenKind.FUNCTION_END;
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitFunctionEnd(this);
        }
    }

    // ========== Conditional ==========

    public enum ConditionalForm { BLOCK_START, SINGLE_LINE, ELSE_IF, ELSE, END }

    public static final class Conditional extends Token {
        private final ConditionalForm form;
        private final String condition;
        private final String thenAction;
        private final String elseAction;

        public Conditional(int line, String sourceText, ConditionalForm form,
                           String condition, String thenAction, String elseAction) {
            super(line, sourceText);
            this.form = form;
            this.condition = condition;
            this.thenAction = thenAction;
            this.elseAction = elseAction;
        }

        public ConditionalForm getForm() {
            return form;
        }

        /**
         * Condition text for BLOCK_START, SINGLE_LINE and ELSE_IF; null otherwise.
         */
        public String getCondition() {
            return condition;
        }

        /**
         * Action after Then on a single-line conditional.
         */
        public String getThenAction() {
            return thenAction;
        }

        /**
         * Action after Else on a single-line conditional, or null.
         */
        public String getElseAction() {
            return elseAction;
        }

        @Override
        public TokenKind getKind() {
            return TokenKind.CONDITIONAL;
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitConditional(this);
        }
    }

    // ========== Loop ==========

    public enum LoopForm { FOR_START, FOR_EACH_START, DO_START, WHILE_START, NEXT, LOOP_END, WEND }

    public static final class Loop extends Token {
        private final LoopForm form;
        private final String variable;
        private final String start;
        private final String end;
        private final String step;
        private final String collection;
        private final String condition;
        private final boolean until;

        private Loop(int line, String sourceText, LoopForm form, String variable, String start, String end,
                     String step, String collection, String condition, boolean until) {
            super(line, sourceText);
            this.form = form;
            this.variable = variable;
            this.start = start;
            this.end = end;
            this.step = step;
            this.collection = collection;
            this.condition = condition;
            this.until = until;
        }

        public static Loop counted(int line, String sourceText, String variable, String start, String end, String step) {
            return new Loop(line, sourceText, LoopForm.FOR_START, variable, start, end, step, null, null, false);
        }

        public static Loop forEach(int line, String sourceText, String element, String collection) {
            return new Loop(line, sourceText, LoopForm.FOR_EACH_START, element, null, null, null, collection, null, false);
        }

        /**
         * Do [While|Until cond]; condition is null for a bare Do.
         */
        public static Loop doStart(int line, String sourceText, String condition, boolean until) {
            return new Loop(line, sourceText, LoopForm.DO_START, null, null, null, null, null, condition, until);
        }

        public static Loop whileStart(int line, String sourceText, String condition) {
            return new Loop(line, sourceText, LoopForm.WHILE_START, null, null, null, null, null, condition, false);
        }

        public static Loop next(int line, String sourceText, String variable) {
            return new Loop(line, sourceText, LoopForm.NEXT, variable, null, null, null, null, null, false);
        }

        /**
         * Loop [While|Until cond]; condition is null for a bare Loop.
         */
        public static Loop loopEnd(int line, String sourceText, String condition, boolean until) {
            return new Loop(line, sourceText, LoopForm.LOOP_END, null, null, null, null, null, condition, until);
        }

        public static Loop wend(int line, String sourceText) {
            return new Loop(line, sourceText, LoopForm.WEND, null, null, null, null, null, null, false);
        }

        public LoopForm getForm() {
            return form;
        }

        /**
         * Counter of a counted loop, element of a For Each, optional name after Next.
         */
        public String getVariable() {
            return variable;
        }

        public String getStart() {
            return start;
        }

        public String getEnd() {
            return end;
        }

        public String getStep() {
            return step;
        }

        public String getCollection() {
            return collection;
        }

        public String getCondition() {
            return condition;
        }

        /**
         * True when the condition is an Until test (loop runs while it is false).
         */
        public boolean isUntil() {
            return until;
        }

        @Override
        public TokenKind getKind() {
            return TokenKind.LOOP;
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitLoop(this);
        }
    }

    // ========== Select dispatch ==========

    public enum DispatchForm { START, CLAUSE, CLAUSE_ELSE, END }

    public static final class SelectDispatch extends Token {
        private final DispatchForm form;
        private final String subject;
        private final List<String> values;

        public SelectDispatch(int line, String sourceText, DispatchForm form, String subject, List<String> values) {
            super(line, sourceText);
            this.form = form;
            this.subject = subject;
            this.values = List.copyOf(values);
        }

        public DispatchForm getForm() {
            return form;
        }

        /**
         * Expression after Select Case; null for other forms.
         */
        public String getSubject() {
            return subject;
        }

        /**
         * Values of a Case clause; several values share one clause body.
         */
        public List<String> getValues() {
            return values;
        }

        @Override
        public TokenKind getKind() {
            return TokenKind.SELECT_DISPATCH;
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitSelectDispatch(this);
        }
    }

    // ========== Unit exit ==========

    public enum ExitTarget { FUNCTION, SUB, FOR, DO }

    public static final class UnitExit extends Token {
        private final ExitTarget target;

        public UnitExit(int line, String sourceText, ExitTarget target) {
            super(line, sourceText);
            this.target = target;
        }

        public ExitTarget getTarget() {
            return target;
        }

        public boolean exitsUnit() {
            return target == ExitTarget.FUNCTION || target == ExitTarget.SUB;
        }

        @Override
        public TokenKind getKind() {
            return TokenKind.UNIT_EXIT;
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitUnitExit(this);
        }
    }

    // ========== Plain statement ==========

    public static final class Statement extends Token {
        private final String text;
        private final boolean returnAssignment;

        public Statement(int line, String sourceText, String text, boolean returnAssignment) {
            super(line, sourceText);
            this.text = text;
            this.returnAssignment = returnAssignment;
        }

        public String getText() {
            return text;
        }

        /**
         * True when the statement assigns to the name of its enclosing Function.
         */
        public boolean isReturnAssignment() {
            return returnAssignment;
        }

        public Statement asReturnAssignment() {
            return new Statement(getLine(), getSourceText(), text, true);
        }

        @Override
        public TokenKind getKind() {
            return TokenKind.STATEMENT;
        }

        @Override
        public <R> R accept(TokenVisitor<R> visitor) {
            return visitor.visitStatement(this);
        }
    }
}
