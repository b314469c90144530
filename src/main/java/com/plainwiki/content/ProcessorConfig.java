package com.plainwiki.content;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Ordered text transforms and options for a {@link ContentProcessor}.
 * Instances are immutable; build them with {@link #builder()}.
 */
public final class ProcessorConfig {

    private final List<UnaryOperator<String>> preProcessors;
    private final List<UnaryOperator<String>> postProcessors;
    private final MarkdownRenderer renderer;
    private final boolean legacyRatingFold;

    private ProcessorConfig(Builder builder) {
        this.preProcessors = Collections.unmodifiableList(new ArrayList<>(builder.preProcessors));
        this.postProcessors = Collections.unmodifiableList(new ArrayList<>(builder.postProcessors));
        this.renderer = builder.renderer != null ? builder.renderer : new MarkdownRenderer();
        this.legacyRatingFold = builder.legacyRatingFold;
    }

    /**
     * No pre-processors, the wiki link resolver as the only post-processor.
     */
    public static ProcessorConfig defaults(UrlFormatter urlFormatter) {
        return builder()
            .postProcessor(new WikiLinkResolver(urlFormatter))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<UnaryOperator<String>> getPreProcessors() { return preProcessors; }

    public List<UnaryOperator<String>> getPostProcessors() { return postProcessors; }

    public MarkdownRenderer getRenderer() { return renderer; }

    /**
     * When set, every parse folds the stored {@code rating} into {@code total}
     * and {@code timesrated}, the way older wiki files expect.
     */
    public boolean isLegacyRatingFold() { return legacyRatingFold; }

    public static class Builder {
        private final List<UnaryOperator<String>> preProcessors = new ArrayList<>();
        private final List<UnaryOperator<String>> postProcessors = new ArrayList<>();
        private MarkdownRenderer renderer;
        private boolean legacyRatingFold = false;

        public Builder preProcessor(UnaryOperator<String> processor) {
            this.preProcessors.add(processor);
            return this;
        }

        public Builder postProcessor(UnaryOperator<String> processor) {
            this.postProcessors.add(processor);
            return this;
        }

        public Builder renderer(MarkdownRenderer renderer) {
            this.renderer = renderer;
            return this;
        }

        public Builder legacyRatingFold(boolean legacyRatingFold) {
            this.legacyRatingFold = legacyRatingFold;
            return this;
        }

        public ProcessorConfig build() {
            return new ProcessorConfig(this);
        }
    }
}
