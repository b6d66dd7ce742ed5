package me.christianrobert.vbs2js.transformer.postprocess;

import me.christianrobert.vbs2js.transformer.context.Diagnostics;
import me.christianrobert.vbs2js.transformer.context.KnowledgeBase;
import me.christianrobert.vbs2js.transformer.context.TranspilerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Second pass over the complete generated text.
 *
 * <p>The generator already applies every rule it owns; this pass catches what slips through
 * and repairs structure so the output stays loadable. Steps run in order:</p>
 * <ol>
 *   <li>char-code humanization (configurable)</li>
 *   <li>container access correction (configurable)</li>
 *   <li>misplaced clause detection</li>
 *   <li>brace repair</li>
 *   <li>formatting (always)</li>
 * </ol>
 *
 * <p>Every step is idempotent, so {@code process(process(x))} equals {@code process(x)}.
 * A step that fails is logged and skipped; processing never throws.</p>
 */
public class PostProcessor {

    private static final Logger log = LoggerFactory.getLogger(PostProcessor.class);

    private final List<PostProcessingStep> steps = new ArrayList<>();

    public PostProcessor(KnowledgeBase knowledgeBase, TranspilerOptions options) {
        if (options.isPostProcessingEnabled()) {
            if (options.isHumanizeCharCodes()) {
                steps.add(new CharCodeHumanizer());
            }
            if (options.isContainerCorrection()) {
                steps.add(new ContainerAccessCorrector(knowledgeBase));
            }
            steps.add(new MisplacedClauseDetector());
            steps.add(new BraceBalancer());
        }
        steps.add(new OutputFormatter());
    }

    /**
     * Runs all enabled steps.
     *
     * @param javaScript Generated text
     * @param diagnostics Receives the counts of every repair
     * @return Processed text, ending in a newline
     */
    public String process(String javaScript, Diagnostics diagnostics) {
        String current = javaScript == null ? "" : javaScript;
        for (PostProcessingStep step : steps) {
            try {
                int before = diagnostics.getTotal();
                current = step.apply(current, diagnostics);
                log.debug("Post-processing step '{}' recorded {} issue(s)", step.getName(),
                        diagnostics.getTotal() - before);
            } catch (RuntimeException e) {
                log.warn("Post-processing step '{}' failed, keeping its input: {}", step.getName(), e.getMessage(), e);
            }
        }
        return current;
    }

    List<PostProcessingStep> getSteps() {
        return steps;
    }
}
