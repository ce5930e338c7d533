package com.guardian.generation;

/**
 * The one external text-generation backend the gate talks to.
 */
public interface TextGenerator {

    /**
     * Produces a completion for the prompt. May block; callers bound the wait.
     */
    String generate(String prompt);
}
