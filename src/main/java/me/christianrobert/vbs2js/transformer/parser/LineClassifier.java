package me.christianrobert.vbs2js.transformer.parser;

import me.christianrobert.vbs2js.core.tools.CodeCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies one logical VBScript line into tokens by its leading keyword.
 *
 * Input is a logical line (continuations already joined). The classifier strips the
 * trailing comment, splits ':'-separated statements (except on a single-line If, whose
 * actions keep their separators) and maps each statement to a {@link Token}.
 * Matching is case-insensitive and ignores keywords inside string literals.
 *
 * Stateless: one instance may classify any number of lines.
 */
public class LineClassifier {

    private static final Logger log = LoggerFactory.getLogger(LineClassifier.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern OPTION_DIRECTIVE = Pattern.compile("^Option\\s+Explicit$", FLAGS);
    private static final Pattern REM_COMMENT = Pattern.compile("^Rem(\\s.*)?$", FLAGS);
    private static final Pattern UNIT_START = Pattern.compile(
            "^(?:(?:Public|Private)\\s+(?:Default\\s+)?)?(Function|Sub)\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*(?:\\((.*)\\))?$", FLAGS);
    private static final Pattern UNIT_END = Pattern.compile("^End\\s+(Function|Sub)$", FLAGS);
    private static final Pattern CONST_DECLARATION = Pattern.compile("^(?:(?:Public|Private)\\s+)?Const\\s+(.*)$", FLAGS);
    private static final Pattern VARIABLE_DECLARATION = Pattern.compile("^(Dim|Private|Public)(?:\\s+(.*))?$", FLAGS);
    private static final Pattern UNSUPPORTED_MEMBER = Pattern.compile("^(?:Public|Private)\\s+(?:Property|Class|Default)\\b.*$", FLAGS);
    private static final Pattern RESIZE_DECLARATION = Pattern.compile("^ReDim\\s+(Preserve\\s+)?(.*)$", FLAGS);
    private static final Pattern DECLARED_NAME = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*(?:\\((.*)\\))?$");
    private static final Pattern CONST_ITEM = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.+)$");
    private static final Pattern INTEGER = Pattern.compile("^\\d+$");
    private static final Pattern IF_START = Pattern.compile("^If\\s+(.*)$", FLAGS);
    private static final Pattern ELSE_IF = Pattern.compile("^ElseIf\\s+(.*)$", FLAGS);
    private static final Pattern ELSE = Pattern.compile("^Else(?:\\s+(.*))?$", FLAGS);
    private static final Pattern END_IF = Pattern.compile("^End\\s+If$", FLAGS);
    private static final Pattern FOR_EACH = Pattern.compile("^For\\s+Each\\s+([A-Za-z_][A-Za-z0-9_]*)\\s+In\\s+(.+)$", FLAGS);
    private static final Pattern FOR = Pattern.compile("^For\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.+)$", FLAGS);
    private static final Pattern NEXT = Pattern.compile("^Next(?:\\s+([A-Za-z_][A-Za-z0-9_]*))?$", FLAGS);
    private static final Pattern DO = Pattern.compile("^Do(?:\\s+(While|Until)\\s+(.+))?$", FLAGS);
    private static final Pattern LOOP = Pattern.compile("^Loop(?:\\s+(While|Until)\\s+(.+))?$", FLAGS);
    private static final Pattern WHILE = Pattern.compile("^While\\s+(.+)$", FLAGS);
    private static final Pattern WEND = Pattern.compile("^Wend$", FLAGS);
    private static final Pattern SELECT_START = Pattern.compile("^Select\\s+Case\\s+(.+)$", FLAGS);
    private static final Pattern CASE_ELSE = Pattern.compile("^Case\\s+Else$", FLAGS);
    private static final Pattern CASE = Pattern.compile("^Case\\s+(.+)$", FLAGS);
    private static final Pattern END_SELECT = Pattern.compile("^End\\s+Select$", FLAGS);
    private static final Pattern EXIT = Pattern.compile("^Exit\\s+(Function|Sub|For|Do)$", FLAGS);
    private static final Pattern PARAMETER_MODIFIER = Pattern.compile("^(?:ByVal|ByRef)\\s+", FLAGS);

    /**
     * Classifies a logical line.
     *
     * @param logicalLine Line text with continuations joined
     * @param lineNumber 1-based number of the first physical line
     * @return Tokens in source order; empty for directives that produce no output
     * @throws ParseException for a malformed declaration
     */
    public List<Token> classifyLine(String logicalLine, int lineNumber) {
        String trimmed = logicalLine.trim();
        List<Token> tokens = new ArrayList<>();

        if (trimmed.isEmpty()) {
            tokens.add(new Token.Comment(lineNumber, "", ""));
            return tokens;
        }

        if (trimmed.startsWith("'")) {
            tokens.add(new Token.Comment(lineNumber, trimmed, trimmed.substring(1).trim()));
            return tokens;
        }

        Matcher rem = REM_COMMENT.matcher(trimmed);
        if (rem.matches()) {
            String text = rem.group(1) == null ? "" : rem.group(1).trim();
            tokens.add(new Token.Comment(lineNumber, trimmed, text));
            return tokens;
        }

        String code = CodeCleaner.removeComment(trimmed).trim();
        String trailingComment = CodeCleaner.extractComment(trimmed);

        if (OPTION_DIRECTIVE.matcher(code).matches()) {
            log.trace("Line {}: dropping directive '{}'", lineNumber, code);
            return Collections.emptyList();
        }

        if (isSingleLineConditional(code)) {
            tokens.add(classifyStatement(code, lineNumber));
        } else {
            for (String statement : CodeCleaner.splitStatements(code)) {
                tokens.addAll(classifyStatementWithElse(statement, lineNumber));
            }
        }

        if (trailingComment != null && !trailingComment.trim().isEmpty()) {
            tokens.add(new Token.Comment(lineNumber, "'" + trailingComment, trailingComment.trim()));
        }
        return tokens;
    }

    /**
     * Classifies the action of a single-line conditional (the text after Then or Else).
     * The action may hold several ':'-separated statements.
     */
    public List<Token> classifyAction(String action, int lineNumber) {
        List<Token> tokens = new ArrayList<>();
        if (isSingleLineConditional(action.trim())) {
            tokens.add(classifyStatement(action.trim(), lineNumber));
            return tokens;
        }
        for (String statement : CodeCleaner.splitStatements(action)) {
            tokens.add(classifyStatement(statement, lineNumber));
        }
        return tokens;
    }

    private List<Token> classifyStatementWithElse(String statement, int lineNumber) {
        Matcher elseIfMatcher = ELSE_IF.matcher(statement);
        if (elseIfMatcher.matches()) {
            String rest = elseIfMatcher.group(1);
            int thenPos = CodeCleaner.indexOfKeyword(rest, "Then", 0);
            String action = thenPos >= 0 ? rest.substring(thenPos + "Then".length()).trim() : "";
            if (!action.isEmpty()) {
                // "ElseIf c Then stmt": the branch marker followed by its statement
                List<Token> tokens = new ArrayList<>();
                tokens.add(new Token.Conditional(lineNumber, statement, Token.ConditionalForm.ELSE_IF,
                        rest.substring(0, thenPos).trim(), null, null));
                tokens.addAll(classifyAction(action, lineNumber));
                return tokens;
            }
        }

        Matcher elseMatcher = ELSE.matcher(statement);
        if (elseMatcher.matches() && elseMatcher.group(1) != null) {
            // "Else stmt" on its own line: the branch marker followed by its statement
            List<Token> tokens = new ArrayList<>();
            tokens.add(new Token.Conditional(lineNumber, statement, Token.ConditionalForm.ELSE, null, null, null));
            tokens.add(classifyStatement(elseMatcher.group(1).trim(), lineNumber));
            return tokens;
        }
        return List.of(classifyStatement(statement, lineNumber));
    }

    /**
     * Classifies one statement (no ':' separators at top level, no comment).
     */
    Token classifyStatement(String statement, int line) {
        Matcher m;

        if ((m = UNIT_START.matcher(statement)).matches()) {
            return new Token.FunctionStart(line, statement, m.group(2), UnitKind.fromKeyword(m.group(1)),
                    parseParameters(m.group(3)));
        }
        if ((m = UNIT_END.matcher(statement)).matches()) {
            return new Token.FunctionEnd(line, statement, UnitKind.fromKeyword(m.group(1)));
        }
        if ((m = CONST_DECLARATION.matcher(statement)).matches()) {
            return new Token.Declaration(line, statement, Token.DeclarationKeyword.CONST,
                    parseConstants(m.group(1), statement, line), false);
        }
        if ((m = RESIZE_DECLARATION.matcher(statement)).matches()) {
            return new Token.Declaration(line, statement, Token.DeclarationKeyword.REDIM,
                    parseResizes(m.group(2), statement, line), m.group(1) != null);
        }
        if (UNSUPPORTED_MEMBER.matcher(statement).matches()) {
            return new Token.Statement(line, statement, statement, false);
        }
        if ((m = VARIABLE_DECLARATION.matcher(statement)).matches()) {
            Token.DeclarationKeyword keyword = Token.DeclarationKeyword.valueOf(m.group(1).toUpperCase());
            String list = m.group(2) == null ? "" : m.group(2);
            return new Token.Declaration(line, statement, keyword,
                    parseVariables(list, m.group(1), statement, line), false);
        }

        if ((m = IF_START.matcher(statement)).matches()) {
            Token conditional = classifyConditional(m.group(1), statement, line);
            if (conditional != null) {
                return conditional;
            }
        }
        if ((m = ELSE_IF.matcher(statement)).matches()) {
            String rest = m.group(1);
            int thenPos = CodeCleaner.indexOfKeyword(rest, "Then", 0);
            String condition = thenPos >= 0 ? rest.substring(0, thenPos).trim() : rest.trim();
            return new Token.Conditional(line, statement, Token.ConditionalForm.ELSE_IF, condition, null, null);
        }
        if (ELSE.matcher(statement).matches()) {
            return new Token.Conditional(line, statement, Token.ConditionalForm.ELSE, null, null, null);
        }
        if (END_IF.matcher(statement).matches()) {
            return new Token.Conditional(line, statement, Token.ConditionalForm.END, null, null, null);
        }

        if ((m = FOR_EACH.matcher(statement)).matches()) {
            return Token.Loop.forEach(line, statement, m.group(1), m.group(2).trim());
        }
        if ((m = FOR.matcher(statement)).matches()) {
            Token counted = classifyCountedLoop(m.group(1), m.group(2), statement, line);
            if (counted != null) {
                return counted;
            }
        }
        if ((m = NEXT.matcher(statement)).matches()) {
            return Token.Loop.next(line, statement, m.group(1));
        }
        if ((m = DO.matcher(statement)).matches()) {
            return Token.Loop.doStart(line, statement, m.group(2) == null ? null : m.group(2).trim(),
                    "until".equalsIgnoreCase(m.group(1)));
        }
        if ((m = LOOP.matcher(statement)).matches()) {
            return Token.Loop.loopEnd(line, statement, m.group(2) == null ? null : m.group(2).trim(),
                    "until".equalsIgnoreCase(m.group(1)));
        }
        if ((m = WHILE.matcher(statement)).matches()) {
            return Token.Loop.whileStart(line, statement, m.group(1).trim());
        }
        if (WEND.matcher(statement).matches()) {
            return Token.Loop.wend(line, statement);
        }

        if ((m = SELECT_START.matcher(statement)).matches()) {
            return new Token.SelectDispatch(line, statement, Token.DispatchForm.START, m.group(1).trim(), List.of());
        }
        if (CASE_ELSE.matcher(statement).matches()) {
            return new Token.SelectDispatch(line, statement, Token.DispatchForm.CLAUSE_ELSE, null, List.of());
        }
        if ((m = CASE.matcher(statement)).matches()) {
            return new Token.SelectDispatch(line, statement, Token.DispatchForm.CLAUSE, null,
                    CodeCleaner.splitTopLevel(m.group(1), ','));
        }
        if (END_SELECT.matcher(statement).matches()) {
            return new Token.SelectDispatch(line, statement, Token.DispatchForm.END, null, List.of());
        }

        if ((m = EXIT.matcher(statement)).matches()) {
            return new Token.UnitExit(line, statement, Token.ExitTarget.valueOf(m.group(1).toUpperCase()));
        }

        return new Token.Statement(line, statement, statement, false);
    }

    private boolean isSingleLineConditional(String code) {
        if (!CodeCleaner.isKeywordAt(code, 0, "If")) {
            return false;
        }
        int thenPos = CodeCleaner.indexOfKeyword(code, "Then", 0);
        return thenPos >= 0 && !code.substring(thenPos + 4).trim().isEmpty();
    }

    /**
     * Splits "cond Then [action [Else action]]". Returns null when Then is missing,
     * so the text falls through to a plain statement.
     */
    private Token classifyConditional(String afterIf, String statement, int line) {
        int thenPos = CodeCleaner.indexOfKeyword(afterIf, "Then", 0);
        if (thenPos < 0) {
            return null;
        }
        String condition = afterIf.substring(0, thenPos).trim();
        String rest = afterIf.substring(thenPos + 4).trim();

        if (rest.isEmpty()) {
            return new Token.Conditional(line, statement, Token.ConditionalForm.BLOCK_START, condition, null, null);
        }

        String thenAction = rest;
        String elseAction = null;
        // A nested single-line If owns the Else
        if (!CodeCleaner.isKeywordAt(rest, 0, "If")) {
            int elsePos = CodeCleaner.indexOfKeyword(rest, "Else", 0);
            if (elsePos >= 0) {
                thenAction = rest.substring(0, elsePos).trim();
                elseAction = rest.substring(elsePos + 4).trim();
            }
        }
        return new Token.Conditional(line, statement, Token.ConditionalForm.SINGLE_LINE, condition, thenAction,
                elseAction == null || elseAction.isEmpty() ? null : elseAction);
    }

    private Token classifyCountedLoop(String counter, String bounds, String statement, int line) {
        int toPos = CodeCleaner.indexOfKeyword(bounds, "To", 0);
        if (toPos < 0) {
            return null;
        }
        String start = bounds.substring(0, toPos).trim();
        String rest = bounds.substring(toPos + 2);
        String step = null;
        int stepPos = CodeCleaner.indexOfKeyword(rest, "Step", 0);
        String end = rest;
        if (stepPos >= 0) {
            end = rest.substring(0, stepPos);
            step = rest.substring(stepPos + 4).trim();
        }
        return Token.Loop.counted(line, statement, counter, start, end.trim(), step);
    }

    private List<String> parseParameters(String parameterList) {
        List<String> parameters = new ArrayList<>();
        if (parameterList == null || parameterList.trim().isEmpty()) {
            return parameters;
        }
        for (String raw : CodeCleaner.splitTopLevel(parameterList, ',')) {
            String name = PARAMETER_MODIFIER.matcher(raw).replaceFirst("").trim();
            // Array parameters are written "p()"
            if (name.endsWith("()")) {
                name = name.substring(0, name.length() - 2).trim();
            }
            if (!name.isEmpty()) {
                parameters.add(name);
            }
        }
        return parameters;
    }

    private List<VariableDeclaration> parseVariables(String list, String keyword, String statement, int line) {
        List<VariableDeclaration> declarations = new ArrayList<>();
        for (String item : CodeCleaner.splitTopLevel(list, ',')) {
            Matcher m = DECLARED_NAME.matcher(item);
            if (!m.matches()) {
                throw malformed(line, keyword, item.isEmpty() ? "missing name" : "invalid declaration '" + item + "'", statement);
            }
            String name = m.group(1);
            String sizes = m.group(2);
            if (sizes == null) {
                declarations.add(VariableDeclaration.scalar(name, line));
            } else if (sizes.trim().isEmpty()) {
                declarations.add(VariableDeclaration.dynamicContainer(name, line));
            } else {
                List<Integer> dimensions = new ArrayList<>();
                for (String size : CodeCleaner.splitTopLevel(sizes, ',')) {
                    if (!INTEGER.matcher(size).matches()) {
                        throw malformed(line, keyword, "size of '" + name + "' is not an integer: '" + size + "'", statement);
                    }
                    Integer bound = CodeCleaner.parseIntLiteral(size);
                    if (bound == null) {
                        throw malformed(line, keyword, "size of '" + name + "' is out of range: '" + size + "'", statement);
                    }
                    dimensions.add(bound);
                }
                declarations.add(VariableDeclaration.container(name, dimensions, line));
            }
        }
        return declarations;
    }

    private List<VariableDeclaration> parseConstants(String list, String statement, int line) {
        List<VariableDeclaration> declarations = new ArrayList<>();
        for (String item : CodeCleaner.splitTopLevel(list, ',')) {
            Matcher m = CONST_ITEM.matcher(item);
            if (!m.matches()) {
                throw malformed(line, "Const", item.isEmpty() ? "missing name" : "invalid constant '" + item + "'", statement);
            }
            declarations.add(VariableDeclaration.constant(m.group(1), m.group(2).trim(), line));
        }
        return declarations;
    }

    private List<VariableDeclaration> parseResizes(String list, String statement, int line) {
        List<VariableDeclaration> declarations = new ArrayList<>();
        for (String item : CodeCleaner.splitTopLevel(list, ',')) {
            Matcher m = DECLARED_NAME.matcher(item);
            if (!m.matches() || m.group(2) == null) {
                throw malformed(line, "ReDim", item.isEmpty() ? "missing name" : "invalid resize '" + item + "'", statement);
            }
            List<String> sizes = CodeCleaner.splitTopLevel(m.group(2), ',');
            if (sizes.stream().anyMatch(String::isEmpty)) {
                throw malformed(line, "ReDim", "missing size for '" + m.group(1) + "'", statement);
            }
            declarations.add(VariableDeclaration.resizedContainer(m.group(1), sizes, line));
        }
        return declarations;
    }

    private ParseException malformed(int line, String construct, String detail, String statement) {
        return new ParseException(line, construct, "Malformed " + construct + " declaration: " + detail, statement);
    }
}
