package io.github.hide212131.rayskillkit.runtime.skill;

import java.util.Objects;

/**
 * Prompt-in, text-out skill: the prompt is tokenized into a fixed window of hashed ids that a language runner
 * turns into a reply.
 */
public final class TextPipelineSkillDescriptor implements SkillDescriptor<String, long[], String> {

    public static final int DEFAULT_MAX_TOKENS = 32;

    private static final SkillTypes<String, long[], String> TYPES =
            SkillTypes.of(String.class, long[].class, String.class);

    private final HashingTokenizer tokenizer;
    private final int maxTokens;
    private final SkillRunner<long[], String> runner;

    public TextPipelineSkillDescriptor(SkillRunner<long[], String> runner) {
        this(new HashingTokenizer(), DEFAULT_MAX_TOKENS, runner);
    }

    public TextPipelineSkillDescriptor(HashingTokenizer tokenizer, int maxTokens, SkillRunner<long[], String> runner) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.runner = Objects.requireNonNull(runner, "runner");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        this.maxTokens = maxTokens;
    }

    @Override
    public long[] buildFeatures(String prompt) {
        return tokenizer.pad(tokenizer.encode(prompt, maxTokens), maxTokens);
    }

    @Override
    public SkillRunner<long[], String> runner() {
        return runner;
    }

    @Override
    public SkillTypes<String, long[], String> types() {
        return TYPES;
    }

    public int maxTokens() {
        return maxTokens;
    }
}
