package com.draftlens.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON body of {@code POST /api/analysis}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisRequest {
    private String text;
    private DocumentStyle style = DocumentStyle.PROSE;
    private List<OutlineEntry> outline = new ArrayList<>();
    private List<PageLocation> pageMapping = new ArrayList<>();
    private int pageCountOverride;
    private List<CharacterEntry> characters = new ArrayList<>();
    private List<String> candidateNames = new ArrayList<>();
    private boolean extractNamesFromText;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CharacterEntry {
        private String name;
        private List<String> aliases = new ArrayList<>();

        public CharacterEntry() {
        }

        public CharacterEntry(String name, List<String> aliases) {
            this.name = name;
            setAliases(aliases);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getAliases() {
            return aliases;
        }

        public void setAliases(List<String> aliases) {
            this.aliases = aliases != null ? aliases : new ArrayList<>();
        }
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public DocumentStyle getStyle() {
        return style;
    }

    public void setStyle(DocumentStyle style) {
        this.style = style != null ? style : DocumentStyle.PROSE;
    }

    public List<OutlineEntry> getOutline() {
        return outline;
    }

    public void setOutline(List<OutlineEntry> outline) {
        this.outline = outline != null ? outline : new ArrayList<>();
    }

    public List<PageLocation> getPageMapping() {
        return pageMapping;
    }

    public void setPageMapping(List<PageLocation> pageMapping) {
        this.pageMapping = pageMapping != null ? pageMapping : new ArrayList<>();
    }

    public int getPageCountOverride() {
        return pageCountOverride;
    }

    public void setPageCountOverride(int pageCountOverride) {
        this.pageCountOverride = pageCountOverride;
    }

    public List<CharacterEntry> getCharacters() {
        return characters;
    }

    public void setCharacters(List<CharacterEntry> characters) {
        this.characters = characters != null ? characters : new ArrayList<>();
    }

    public List<String> getCandidateNames() {
        return candidateNames;
    }

    public void setCandidateNames(List<String> candidateNames) {
        this.candidateNames = candidateNames != null ? candidateNames : new ArrayList<>();
    }

    public boolean isExtractNamesFromText() {
        return extractNamesFromText;
    }

    public void setExtractNamesFromText(boolean extractNamesFromText) {
        this.extractNamesFromText = extractNamesFromText;
    }
}
