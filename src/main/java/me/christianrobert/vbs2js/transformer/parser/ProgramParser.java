package me.christianrobert.vbs2js.transformer.parser;

import me.christianrobert.vbs2js.core.tools.CodeCleaner;
import me.christianrobert.vbs2js.core.tools.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * State machine that splits a VBScript program into function units and global code.
 *
 * <p>Two states: SCRIPT_LEVEL (tokens go to the global stream) and IN_UNIT (tokens go to the
 * open unit). Function boundaries move between them; any boundary that does not fit the current
 * state aborts the parse with a {@link ParseException}.</p>
 *
 * <p>Physical lines ending in " _" are joined into one logical line before classification;
 * the logical line keeps the number of its first physical line.</p>
 *
 * <p>Not thread-safe: create one instance per parse (the service does).</p>
 */
public class ProgramParser {

    private static final Logger log = LoggerFactory.getLogger(ProgramParser.class);

    private static final Pattern ASSIGNMENT_TARGET = Pattern.compile(
            "^(?:Set\\s+)?([A-Za-z_][A-Za-z0-9_]*)\\s*=(?!=)", Pattern.CASE_INSENSITIVE);

    private enum State {
        SCRIPT_LEVEL,
        IN_UNIT
    }

    private final LineClassifier classifier;

    private State currentState;

    // Current unit being collected
    private Token.FunctionStart currentStart;
    private List<VariableDeclaration> currentLocals;
    private List<Token> currentBody;
    private List<Token.Statement> currentReturns;

    // Results
    private List<FunctionUnit> units;
    private List<VariableDeclaration> globalDeclarations;
    private List<Token> globalTokens;

    public ProgramParser() {
        this(new LineClassifier());
    }

    public ProgramParser(LineClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Parses a whole program.
     *
     * @param source Program text
     * @return Units, global declarations and global tokens
     * @throws ParseException for unterminated or mismatched units and malformed declarations
     */
    public ParsedProgram parse(SourceProgram source) {
        log.debug("Parsing program ({} lines)", source.getLineCount());

        this.currentState = State.SCRIPT_LEVEL;
        this.units = new ArrayList<>();
        this.globalDeclarations = new ArrayList<>();
        this.globalTokens = new ArrayList<>();
        resetUnit();

        List<String> lines = source.getLines();
        int index = 0;
        while (index < lines.size()) {
            int firstLine = index + 1;
            StringBuilder logical = new StringBuilder();
            String physical = lines.get(index);

            while (CodeCleaner.endsWithContinuation(physical) && index + 1 < lines.size()) {
                logical.append(CodeCleaner.removeContinuation(physical)).append(' ');
                index++;
                physical = lines.get(index);
            }
            logical.append(physical);
            index++;

            log.trace("Line {}: {}", firstLine, logical);
            for (Token token : classifier.classifyLine(logical.toString(), firstLine)) {
                accept(token);
            }
        }

        if (currentState == State.IN_UNIT) {
            throw new ParseException(currentStart.getLine(), currentStart.getUnitKind().getKeyword(),
                    currentStart.getUnitKind().getKeyword() + " '" + currentStart.getName()
                            + "' is not closed before end of input",
                    currentStart.getSourceText());
        }

        ParsedProgram program = new ParsedProgram(units, globalDeclarations, globalTokens, source.getLineCount());
        log.debug("Parse complete: {}", program);
        return program;
    }

    private void accept(Token token) {
        switch (token.getKind()) {
            case FUNCTION_START -> openUnit((Token.FunctionStart) token);
            case FUNCTION_END -> closeUnit((Token.FunctionEnd) token);
            case DECLARATION -> addDeclaration((Token.Declaration) token);
            case STATEMENT -> addStatement((Token.Statement) token);
            case CONDITIONAL -> addConditional((Token.Conditional) token);
            default -> addToken(token);
        }
    }

    private void openUnit(Token.FunctionStart start) {
        if (currentState == State.IN_UNIT) {
            throw new ParseException(currentStart.getLine(), currentStart.getUnitKind().getKeyword(),
                    currentStart.getUnitKind().getKeyword() + " '" + currentStart.getName()
                            + "' is not closed before line " + start.getLine(),
                    currentStart.getSourceText());
        }
        currentState = State.IN_UNIT;
        currentStart = start;
        currentLocals = new ArrayList<>();
        currentBody = new ArrayList<>();
        currentReturns = new ArrayList<>();
        log.trace("Unit {} opened at line {}", start.getName(), start.getLine());
    }

    private void closeUnit(Token.FunctionEnd end) {
        if (currentState != State.IN_UNIT) {
            throw new ParseException(end.getLine(), end.getUnitKind().getKeyword(),
                    "End " + end.getUnitKind().getKeyword() + " without an open unit", end.getSourceText());
        }
        if (end.getUnitKind() != currentStart.getUnitKind()) {
            throw new ParseException(end.getLine(), end.getUnitKind().getKeyword(),
                    "End " + end.getUnitKind().getKeyword() + " closes " + currentStart.getUnitKind().getKeyword()
                            + " '" + currentStart.getName() + "' opened at line " + currentStart.getLine(),
                    end.getSourceText());
        }

        FunctionUnit unit = new FunctionUnit(currentStart.getName(), currentStart.getUnitKind(),
                currentStart.getParameters(), currentLocals, currentBody, currentReturns,
                currentStart.getLine(), end.getLine());
        units.add(unit);
        log.debug("Parsed {} ({} tokens, {} locals, {} return assignments)",
                unit, unit.getBodyTokens().size(), unit.getLocalDeclarations().size(),
                unit.getReturnAssignments().size());

        currentState = State.SCRIPT_LEVEL;
        resetUnit();
    }

    private void addDeclaration(Token.Declaration declaration) {
        // ReDim resizes an existing container; it does not declare a new name
        if (!declaration.isResize()) {
            if (currentState == State.IN_UNIT) {
                currentLocals.addAll(declaration.getDeclarations());
            } else {
                globalDeclarations.addAll(declaration.getDeclarations());
            }
        }
        addToken(declaration);
    }

    private void addStatement(Token.Statement statement) {
        if (isReturnAssignment(statement.getText())) {
            Token.Statement marked = statement.asReturnAssignment();
            currentReturns.add(marked);
            addToken(marked);
            return;
        }
        addToken(statement);
    }

    private void addConditional(Token.Conditional conditional) {
        // Return assignments inside single-line actions count for the unit as well
        if (conditional.getForm() == Token.ConditionalForm.SINGLE_LINE && currentState == State.IN_UNIT) {
            collectActionReturns(conditional.getThenAction(), conditional.getLine());
            collectActionReturns(conditional.getElseAction(), conditional.getLine());
        }
        addToken(conditional);
    }

    private void collectActionReturns(String action, int line) {
        if (action == null) {
            return;
        }
        for (Token token : classifier.classifyAction(action, line)) {
            if (token instanceof Token.Statement && isReturnAssignment(((Token.Statement) token).getText())) {
                currentReturns.add(((Token.Statement) token).asReturnAssignment());
            } else if (token instanceof Token.Conditional) {
                Token.Conditional nested = (Token.Conditional) token;
                collectActionReturns(nested.getThenAction(), line);
                collectActionReturns(nested.getElseAction(), line);
            }
        }
    }

    private void addToken(Token token) {
        if (currentState == State.IN_UNIT) {
            currentBody.add(token);
        } else {
            globalTokens.add(token);
        }
    }

    private boolean isReturnAssignment(String text) {
        if (currentState != State.IN_UNIT || currentStart.getUnitKind() != UnitKind.VALUE_RETURNING) {
            return false;
        }
        Matcher m = ASSIGNMENT_TARGET.matcher(text);
        return m.find() && NameNormalizer.sameIdentifier(m.group(1), currentStart.getName());
    }

    private void resetUnit() {
        currentStart = null;
        currentLocals = null;
        currentBody = null;
        currentReturns = null;
    }
}
