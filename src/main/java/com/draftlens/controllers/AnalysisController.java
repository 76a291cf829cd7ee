package com.draftlens.controllers;

import com.draftlens.AppLogger;
import com.draftlens.analysis.AnalysisEngine;
import com.draftlens.analysis.AnalysisOptions;
import com.draftlens.context.InMemoryCharacterRegistry;
import com.draftlens.models.AnalysisRequest;
import com.draftlens.models.AnalysisResults;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

public class AnalysisController implements Controller {

    private final AnalysisEngine engine;
    private final ObjectMapper objectMapper;
    private final int maxAnalysisLength;
    private final String version;

    public AnalysisController(AnalysisEngine engine, ObjectMapper objectMapper, int maxAnalysisLength,
                              String version) {
        this.engine = engine;
        this.objectMapper = objectMapper;
        this.maxAnalysisLength = maxAnalysisLength;
        this.version = version;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/health", this::health);
        app.post("/api/analysis", this::analyze);
    }

    private void health(Context ctx) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", "ok");
        payload.put("version", version);
        ctx.json(payload);
    }

    private void analyze(Context ctx) {
        AnalysisRequest request;
        AnalysisOptions options;
        try {
            request = objectMapper.readValue(ctx.body(), AnalysisRequest.class);
            options = toOptions(request, maxAnalysisLength);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.warn("Rejected analysis request: " + e.getMessage());
            }
            ctx.status(400).json(Controller.errorBody(e));
            return;
        }

        AnalysisResults results = engine.analyze(request.getText(), options);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("results", results);
        payload.put("significantCharacters", engine.significantCharacters(results));
        ctx.json(payload);
    }

    /**
     * Maps a request body onto engine options. A missing text or a character without a name is
     * a client error.
     */
    static AnalysisOptions toOptions(AnalysisRequest request, int maxAnalysisLength) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        if (request.getText() == null) {
            throw new IllegalArgumentException("text is required");
        }
        InMemoryCharacterRegistry.Builder registry = InMemoryCharacterRegistry.builder();
        for (AnalysisRequest.CharacterEntry entry : request.getCharacters()) {
            if (entry == null) {
                continue;
            }
            registry.character(entry.getName(), entry.getAliases());
        }
        return AnalysisOptions.builder()
                .style(request.getStyle())
                .outline(request.getOutline())
                .pageMapping(request.getPageMapping())
                .pageCountOverride(request.getPageCountOverride())
                .registry(registry.build())
                .candidateNames(request.getCandidateNames())
                .extractNamesFromText(request.isExtractNamesFromText())
                .maxAnalysisLength(maxAnalysisLength)
                .build();
    }
}
