package me.christianrobert.vbs2js.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.vbs2js.config.service.ConfigService;
import me.christianrobert.vbs2js.transformer.builder.ExpressionTranspiler;
import me.christianrobert.vbs2js.transformer.catalog.CatalogBuilder;
import me.christianrobert.vbs2js.transformer.context.Diagnostics;
import me.christianrobert.vbs2js.transformer.context.KnowledgeBase;
import me.christianrobert.vbs2js.transformer.context.KnowledgeBaseBuilder;
import me.christianrobert.vbs2js.transformer.context.TransformationException;
import me.christianrobert.vbs2js.transformer.context.TranspilationResult;
import me.christianrobert.vbs2js.transformer.context.TranspilerOptions;
import me.christianrobert.vbs2js.transformer.controlflow.ControlFlowReconstructor;
import me.christianrobert.vbs2js.transformer.controlflow.GeneratedProgram;
import me.christianrobert.vbs2js.transformer.parser.AntlrParser;
import me.christianrobert.vbs2js.transformer.parser.LineClassifier;
import me.christianrobert.vbs2js.transformer.parser.ParseException;
import me.christianrobert.vbs2js.transformer.parser.ParsedProgram;
import me.christianrobert.vbs2js.transformer.parser.ProgramParser;
import me.christianrobert.vbs2js.transformer.parser.SourceProgram;
import me.christianrobert.vbs2js.transformer.postprocess.PostProcessor;
import me.christianrobert.vbs2js.transformer.validation.ResidualKeywordScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Transpiles a complete VBScript program to JavaScript.
 *
 * <p>Architecture:
 * <pre>
 * VBScript → ProgramParser → KnowledgeBaseBuilder → ControlFlowReconstructor → PostProcessor → JavaScript
 *                 ↓                  ↓                        ↓
 *           FunctionUnits      KnowledgeBase      ExpressionTranspiler (ANTLR + JavaScriptCodeBuilder)
 * </pre>
 *
 * <p>The knowledge base is complete before the first expression is transpiled, so names
 * declared late in the source are resolved everywhere. A run either completes with
 * best-effort output and diagnostics, or fails as a whole on a {@link ParseException}.</p>
 */
@ApplicationScoped
public class TranspilationService {

    private static final Logger log = LoggerFactory.getLogger(TranspilationService.class);

    @Inject
    AntlrParser parser;

    @Inject
    ConfigService configService;

    /**
     * Transpiles with the current configuration.
     *
     * @param vbScript Complete VBScript source
     * @return TranspilationResult containing either JavaScript or error details
     */
    public TranspilationResult transpile(String vbScript) {
        return transpile(vbScript, configService.getTranspilerOptions());
    }

    /**
     * Transpiles with explicit options.
     *
     * @param vbScript Complete VBScript source
     * @param options Settings for this run
     * @return TranspilationResult containing either JavaScript or error details
     */
    public TranspilationResult transpile(String vbScript, TranspilerOptions options) {
        if (vbScript == null || vbScript.trim().isEmpty()) {
            return TranspilationResult.failure(vbScript, "VBScript source cannot be null or empty");
        }

        log.debug("Transpiling with {}", options);
        log.trace("VBScript: {}", vbScript);

        try {
            // STEP 1: Split into units and tokens
            log.debug("Step 1: Parsing program structure");
            SourceProgram source = SourceProgram.of(vbScript);
            LineClassifier classifier = new LineClassifier();
            ParsedProgram program = new ProgramParser(classifier).parse(source);

            // STEP 2: Index containers and callables of the whole program
            log.debug("Step 2: Building knowledge base");
            Diagnostics diagnostics = new Diagnostics();
            KnowledgeBase knowledgeBase = KnowledgeBaseBuilder.build(program, diagnostics);

            // STEP 3: Generate code unit by unit
            log.debug("Step 3: Reconstructing control flow");
            ExpressionTranspiler transpiler = new ExpressionTranspiler(parser, knowledgeBase, diagnostics);
            ControlFlowReconstructor reconstructor = new ControlFlowReconstructor(transpiler, classifier, options);
            GeneratedProgram generated = reconstructor.reconstruct(program, header(program, options));

            // STEP 4: Repair and format
            log.debug("Step 4: Post-processing");
            String javaScript = new PostProcessor(knowledgeBase, options).process(generated.render(), diagnostics);

            // STEP 5: Report untranslated keywords
            List<String> residualKeywords = options.isResidualKeywordScan()
                    ? ResidualKeywordScanner.scan(javaScript)
                    : List.of();
            for (String finding : residualKeywords) {
                log.warn("Residual VBScript keyword: {}", finding);
            }

            log.info("Successfully transpiled {} lines ({} units, {} diagnostics)",
                    program.getLineCount(), program.getUnits().size(), diagnostics.getTotal());
            log.debug("JavaScript: {}", javaScript);

            return TranspilationResult.success(vbScript, javaScript, diagnostics,
                    CatalogBuilder.buildFunctionCatalog(program),
                    CatalogBuilder.buildContainerCatalog(program),
                    residualKeywords);

        } catch (ParseException e) {
            log.error("Parse failed at line {} ({}): {}", e.getLineNumber(), e.getConstruct(), e.getMessage());
            return TranspilationResult.failure(vbScript, e);

        } catch (TransformationException e) {
            log.error("Transpilation failed: {}", e.getDetailedMessage(), e);
            return TranspilationResult.failure(vbScript, e);

        } catch (Exception e) {
            log.error("Unexpected error during transpilation", e);
            String errorMsg = "Unexpected error: " + e.getMessage();
            return TranspilationResult.failure(vbScript, errorMsg);
        }
    }

    private static List<String> header(ParsedProgram program, TranspilerOptions options) {
        List<String> header = new ArrayList<>();
        if (options.isEmitHeader()) {
            header.add("// Transpiled from VBScript by vbs2js");
            header.add("// Source: " + program.getLineCount() + " lines, " + program.getUnits().size() + " units");
        }
        return header;
    }
}
