package me.christianrobert.vbs2js.transformer.context;

import me.christianrobert.vbs2js.core.tools.NameNormalizer;
import me.christianrobert.vbs2js.transformer.parser.FunctionUnit;
import me.christianrobert.vbs2js.transformer.parser.ParsedProgram;
import me.christianrobert.vbs2js.transformer.parser.Token;
import me.christianrobert.vbs2js.transformer.parser.VariableDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link KnowledgeBase} from a parsed program in one pass.
 *
 * <p>Usage:
 * <pre>
 * ParsedProgram program = new ProgramParser().parse(source);
 * KnowledgeBase kb = KnowledgeBaseBuilder.build(program, diagnostics);
 * </pre>
 */
public class KnowledgeBaseBuilder {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseBuilder.class);

    /**
     * Collects unit names as callables and every indexed container (global or local,
     * sized, dynamic or resized) as containers. A name that is both is kept as a container
     * and recorded once as an ambiguity.
     *
     * @param program Parsed program
     * @param diagnostics Receives AMBIGUITY_UNRESOLVED entries
     * @return Immutable knowledge base
     */
    public static KnowledgeBase build(ParsedProgram program, Diagnostics diagnostics) {
        if (program == null) {
            throw new IllegalArgumentException("Parsed program cannot be null");
        }

        Map<String, String> containers = new LinkedHashMap<>();
        Map<String, String> callables = new LinkedHashMap<>();
        Map<String, String> canonical = new LinkedHashMap<>();
        Map<String, List<Integer>> dimensions = new LinkedHashMap<>();
        Map<String, Integer> containerLines = new LinkedHashMap<>();

        for (FunctionUnit unit : program.getUnits()) {
            callables.putIfAbsent(NameNormalizer.normalizeIdentifier(unit.getName()), unit.getName());
            for (String parameter : unit.getParameters()) {
                canonical.putIfAbsent(NameNormalizer.normalizeIdentifier(parameter), parameter);
            }
            indexDeclarations(unit.getBodyTokens(), containers, canonical, dimensions, containerLines);
        }
        indexDeclarations(program.getGlobalTokens(), containers, canonical, dimensions, containerLines);

        for (Map.Entry<String, String> container : containers.entrySet()) {
            if (callables.containsKey(container.getKey())) {
                diagnostics.record(DiagnosticKind.AMBIGUITY_UNRESOLVED, containerLines.get(container.getKey()),
                        "'" + container.getValue() + "' is both a container and a Function/Sub; treated as container");
            }
        }

        KnowledgeBase kb = new KnowledgeBase(containers, callables, canonical, dimensions);
        log.info("Knowledge base built: {} containers, {} callables", containers.size(), callables.size());
        log.debug("{}", kb);
        return kb;
    }

    private static void indexDeclarations(List<Token> tokens,
                                          Map<String, String> containers,
                                          Map<String, String> canonical,
                                          Map<String, List<Integer>> dimensions,
                                          Map<String, Integer> containerLines) {
        for (Token token : tokens) {
            if (!(token instanceof Token.Declaration)) {
                continue;
            }
            for (VariableDeclaration declaration : ((Token.Declaration) token).getDeclarations()) {
                String key = NameNormalizer.normalizeIdentifier(declaration.getName());
                canonical.putIfAbsent(key, declaration.getName());
                if (declaration.isIndexedContainer()) {
                    containers.putIfAbsent(key, canonical.get(key));
                    containerLines.putIfAbsent(key, declaration.getLine());
                    // A sized declaration wins over a dynamic one or a ReDim
                    if (!dimensions.containsKey(key) || dimensions.get(key).isEmpty()) {
                        dimensions.put(key, declaration.getDimensions());
                    }
                }
            }
        }
    }
}
