package com.draftlens.analysis;

import com.draftlens.AppConfig;
import com.draftlens.context.CharacterRegistry;
import com.draftlens.context.FormatDetector;
import com.draftlens.context.OutlineProvider;
import com.draftlens.models.DocumentStyle;
import com.draftlens.models.OutlineEntry;
import com.draftlens.models.PageLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller-supplied context for one analysis pass. Every field has a usable default, so
 * {@code AnalysisOptions.builder().build()} analyzes plain prose with no character data.
 */
public final class AnalysisOptions {

    private final OutlineProvider outline;
    private final List<PageLocation> pageMapping;
    private final int pageCountOverride;
    private final DocumentStyle style;
    private final CharacterRegistry registry;
    private final List<String> candidateNames;
    private final boolean extractNamesFromText;
    private final int maxAnalysisLength;
    private final FormatDetector formatDetector;

    private AnalysisOptions(Builder b) {
        this.outline = b.outline;
        this.pageMapping = List.copyOf(b.pageMapping);
        this.pageCountOverride = b.pageCountOverride;
        this.style = b.style;
        this.registry = b.registry;
        this.candidateNames = List.copyOf(b.candidateNames);
        this.extractNamesFromText = b.extractNamesFromText;
        this.maxAnalysisLength = b.maxAnalysisLength;
        this.formatDetector = b.formatDetector;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AnalysisOptions defaults() {
        return builder().build();
    }

    public OutlineProvider getOutline() {
        return outline;
    }

    public List<PageLocation> getPageMapping() {
        return pageMapping;
    }

    /**
     * Page count to report instead of the estimate; 0 or less means "estimate".
     */
    public int getPageCountOverride() {
        return pageCountOverride;
    }

    public DocumentStyle getStyle() {
        return style;
    }

    public CharacterRegistry getRegistry() {
        return registry;
    }

    public List<String> getCandidateNames() {
        return candidateNames;
    }

    public boolean isExtractNamesFromText() {
        return extractNamesFromText;
    }

    public int getMaxAnalysisLength() {
        return maxAnalysisLength;
    }

    public FormatDetector getFormatDetector() {
        return formatDetector;
    }

    public static final class Builder {
        private OutlineProvider outline = OutlineProvider.none();
        private List<PageLocation> pageMapping = new ArrayList<>();
        private int pageCountOverride = 0;
        private DocumentStyle style = DocumentStyle.PROSE;
        private CharacterRegistry registry = CharacterRegistry.empty();
        private List<String> candidateNames = new ArrayList<>();
        private boolean extractNamesFromText = false;
        private int maxAnalysisLength = AppConfig.DEFAULT_MAX_ANALYSIS_LENGTH;
        private FormatDetector formatDetector = new HeuristicFormatDetector();

        public Builder outline(List<OutlineEntry> entries) {
            this.outline = OutlineProvider.of(entries);
            return this;
        }

        public Builder outline(OutlineProvider provider) {
            this.outline = provider != null ? provider : OutlineProvider.none();
            return this;
        }

        public Builder pageMapping(List<PageLocation> pageMapping) {
            this.pageMapping = new ArrayList<>();
            if (pageMapping != null) {
                for (PageLocation location : pageMapping) {
                    if (location != null) {
                        this.pageMapping.add(location);
                    }
                }
            }
            return this;
        }

        public Builder pageCountOverride(int pageCountOverride) {
            this.pageCountOverride = pageCountOverride;
            return this;
        }

        public Builder style(DocumentStyle style) {
            this.style = style != null ? style : DocumentStyle.PROSE;
            return this;
        }

        public Builder registry(CharacterRegistry registry) {
            this.registry = registry != null ? registry : CharacterRegistry.empty();
            return this;
        }

        public Builder candidateNames(List<String> candidateNames) {
            this.candidateNames = new ArrayList<>();
            if (candidateNames != null) {
                for (String name : candidateNames) {
                    if (name != null) {
                        this.candidateNames.add(name);
                    }
                }
            }
            return this;
        }

        /**
         * Allows guessing character names from capitalized words when neither a registry nor
         * candidate names are given.
         */
        public Builder extractNamesFromText(boolean extractNamesFromText) {
            this.extractNamesFromText = extractNamesFromText;
            return this;
        }

        public Builder maxAnalysisLength(int maxAnalysisLength) {
            if (maxAnalysisLength <= 0) {
                throw new IllegalArgumentException("Max analysis length must be positive: " + maxAnalysisLength);
            }
            this.maxAnalysisLength = maxAnalysisLength;
            return this;
        }

        public Builder formatDetector(FormatDetector formatDetector) {
            if (formatDetector == null) {
                throw new IllegalArgumentException("Format detector is required");
            }
            this.formatDetector = formatDetector;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }
}
