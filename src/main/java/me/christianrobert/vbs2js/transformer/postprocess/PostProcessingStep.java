package me.christianrobert.vbs2js.transformer.postprocess;

import me.christianrobert.vbs2js.transformer.context.Diagnostics;

/**
 * One rewrite over the complete generated text.
 *
 * Implementations must be idempotent: applying a step to its own output changes nothing.
 */
public interface PostProcessingStep {

    String getName();

    String apply(String text, Diagnostics diagnostics);
}
