package me.christianrobert.vbs2js.transformer.parser;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of parsing one VBScript statement or expression.
 * Contains the parse tree, the token stream (hidden whitespace included) and any syntax errors.
 */
public class ParseResult {

    private final ParserRuleContext tree;
    private final CommonTokenStream tokens;
    private final List<String> errors;
    private final String source;

    public ParseResult(ParserRuleContext tree, CommonTokenStream tokens, List<String> errors, String source) {
        this.tree = tree;
        this.tokens = tokens;
        this.errors = new ArrayList<>(errors);
        this.source = source;
    }

    public ParserRuleContext getTree() {
        return tree;
    }

    /**
     * Token stream the tree was built from; the code builder reads inter-token spacing from it.
     */
    public CommonTokenStream getTokens() {
        return tokens;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public String getSource() {
        return source;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("\n", errors);
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + isSuccess() + ", errors=" + errors.size() + "}";
    }
}
