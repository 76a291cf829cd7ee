package com.draftlens.analysis;

import com.draftlens.models.OutlineEntry;
import com.draftlens.models.PageLocation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a manuscript into chapters, from the caller's outline when it has usable headings,
 * otherwise from chapter markers at the start of lines.
 */
public final class ChapterSplitter {

    static final int MAX_HEADING_CHAPTERS = 10;
    private static final int TITLE_MAX = 80;

    private static final Pattern CHAPTER_TITLE = Pattern.compile(
            "^\\s*(?:chapter|ch\\.)\\s+(?:\\d+|[ivxlcdm]+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CHAPTER_MARKER = Pattern.compile(
            "^(?:Chapter \\d+|CHAPTER \\d+|Ch\\. \\d+|\\d+\\.|# Chapter)");

    private ChapterSplitter() {
    }

    public static List<Chapter> split(String text, List<OutlineEntry> outline) {
        String source = text == null ? "" : text;
        List<OutlineEntry> chosen = chapterLevelEntries(outline);
        if (!chosen.isEmpty()) {
            return fromOutline(source, chosen);
        }
        return fromMarkers(source);
    }

    /**
     * Picks the most chapter-like outline entries: "Chapter N" titles, then level 1,
     * then the first level-2 headings, then level-0 parts.
     */
    static List<OutlineEntry> chapterLevelEntries(List<OutlineEntry> outline) {
        if (outline == null || outline.isEmpty()) {
            return List.of();
        }
        List<OutlineEntry> titled = new ArrayList<>();
        List<OutlineEntry> level1 = new ArrayList<>();
        List<OutlineEntry> level2 = new ArrayList<>();
        List<OutlineEntry> level0 = new ArrayList<>();
        for (OutlineEntry entry : outline) {
            if (entry == null) {
                continue;
            }
            if (entry.title() != null && CHAPTER_TITLE.matcher(entry.title()).find()) {
                titled.add(entry);
            }
            switch (entry.level()) {
                case 0:
                    level0.add(entry);
                    break;
                case 1:
                    level1.add(entry);
                    break;
                case 2:
                    level2.add(entry);
                    break;
                default:
                    break;
            }
        }
        if (!titled.isEmpty()) {
            return titled;
        }
        if (!level1.isEmpty()) {
            return level1;
        }
        if (!level2.isEmpty()) {
            return level2.subList(0, Math.min(MAX_HEADING_CHAPTERS, level2.size()));
        }
        return level0;
    }

    private static List<Chapter> fromOutline(String text, List<OutlineEntry> entries) {
        List<OutlineEntry> ordered = new ArrayList<>(entries);
        ordered.sort(Comparator.comparingInt(OutlineEntry::rangeStart));
        int length = text.length();
        List<Chapter> chapters = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            OutlineEntry entry = ordered.get(i);
            int start = clamp(entry.rangeStart(), length);
            int end = i < ordered.size() - 1 ? clamp(ordered.get(i + 1).rangeStart(), length) : length;
            end = Math.max(start, end);
            String title = entry.title() != null && !entry.title().isBlank() ? entry.title().trim() : "Chapter " + (i + 1);
            chapters.add(new Chapter(i + 1, title, start, end, text.substring(start, end)));
        }
        return chapters;
    }

    private static List<Chapter> fromMarkers(String text) {
        List<int[]> bounds = new ArrayList<>();
        int chapterStart = 0;
        int lineStart = 0;
        int length = text.length();
        while (lineStart < length) {
            int newline = text.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? length : newline;
            String line = text.substring(lineStart, lineEnd).trim();
            if (lineStart > chapterStart && CHAPTER_MARKER.matcher(line).find()) {
                bounds.add(new int[]{chapterStart, lineStart});
                chapterStart = lineStart;
            }
            lineStart = newline < 0 ? length : newline + 1;
        }
        bounds.add(new int[]{chapterStart, length});

        List<Chapter> chapters = new ArrayList<>();
        for (int i = 0; i < bounds.size(); i++) {
            int[] b = bounds.get(i);
            String slice = text.substring(b[0], b[1]);
            chapters.add(new Chapter(i + 1, titleOf(slice, i + 1), b[0], b[1], slice));
        }
        return chapters;
    }

    private static String titleOf(String slice, int number) {
        for (String line : TextSegmenter.splitLines(slice)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                return trimmed.length() > TITLE_MAX ? trimmed.substring(0, TITLE_MAX) : trimmed;
            }
        }
        return "Chapter " + number;
    }

    private static int clamp(int offset, int length) {
        return Math.max(0, Math.min(offset, length));
    }

    /**
     * Up to {@code maxSamples} evenly spaced chapter indexes, first and last always included.
     */
    public static List<Integer> sampleIndices(int chapterCount, int maxSamples) {
        List<Integer> indices = new ArrayList<>();
        if (chapterCount <= 0) {
            return indices;
        }
        int k = Math.min(chapterCount, maxSamples);
        if (chapterCount <= k) {
            for (int i = 0; i < chapterCount; i++) {
                indices.add(i);
            }
            return indices;
        }
        if (k <= 1) {
            indices.add(0);
            return indices;
        }
        double step = (double) (chapterCount - 1) / (k - 1);
        for (int i = 0; i < k; i++) {
            int idx = (int) Math.round(i * step);
            idx = Math.min(chapterCount - 1, Math.max(0, idx));
            if (!indices.contains(idx)) {
                indices.add(idx);
            }
        }
        return indices;
    }

    /**
     * Page of the last mapping location at or before {@code offset}, or 0 when unknown.
     */
    public static int pageAt(List<PageLocation> pageMapping, int offset) {
        if (pageMapping == null || pageMapping.isEmpty()) {
            return 0;
        }
        int page = 0;
        int bestLocation = Integer.MIN_VALUE;
        for (PageLocation location : pageMapping) {
            if (location.location() <= offset && location.location() >= bestLocation) {
                bestLocation = location.location();
                page = location.page();
            }
        }
        return page;
    }
}
