package com.rom.ei.io;

import com.rom.ei.algorithms.GreedyHistory;
import com.rom.ei.algorithms.GreedyResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes the diagnostics of a greedy run as JSON.
 *
 * The basis vectors themselves are not written, only their count; the output
 * is meant for inspection and plotting of the error decay.
 */
public final class ResultReportWriter {
    private final ObjectMapper mapper = new ObjectMapper();

    public ObjectNode toJsonTree(GreedyResult result) {
        GreedyHistory h = result.history();
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("stopReason", h.stopReason().name());
        report.put("basisSize", result.basis().len());
        report.put("dim", result.basis().dim());
        report.put("dofs", result.dofs());
        report.put("errors", h.errors());
        if (!h.triangularityErrors().isEmpty())
            report.put("triangularityErrors", h.triangularityErrors());
        if (h.finalError() != null)
            report.put("finalError", h.finalError());
        if (h.podModes() != null) {
            report.put("requestedModes", h.requestedModes());
            report.put("podModes", h.podModes());
            report.put("truncated", h.truncated());
        }
        return mapper.valueToTree(report);
    }

    public String toJson(GreedyResult result) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonTree(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize interpolation report", e);
        }
    }

    public void write(GreedyResult result, Path path) throws IOException {
        Files.writeString(path, toJson(result));
    }
}
