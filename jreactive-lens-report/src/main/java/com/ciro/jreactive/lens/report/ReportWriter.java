package com.ciro.jreactive.lens.report;

import com.ciro.jreactive.lens.AnalysisResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.time.Instant;

/** Informe JSON (Jackson) de un análisis. */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;
    private final Clock clock;

    public ReportWriter() {
        this(ObjectMapperFactory.create(), Clock.systemUTC());
    }

    public ReportWriter(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    public AnalysisReport toReport(AnalysisResult result) {
        return AnalysisReport.from(result, Instant.now(clock));
    }

    public String write(AnalysisResult result) {
        AnalysisReport report = toReport(result);
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ReportException("Could not serialize report for " + result.sourceName(), e);
        }
    }

    /** Escribe el informe en {@code out} sin cerrarlo. */
    public void write(AnalysisResult result, Writer out) {
        AnalysisReport report = toReport(result);
        try {
            mapper.writeValue(out, report);
            log.debug("Wrote JSON report for {} ({} patterns)", result.sourceName(), report.patterns().size());
        } catch (IOException e) {
            throw new ReportException("Could not write report for " + result.sourceName(), e);
        }
    }

    public AnalysisReport read(String json) {
        try {
            return mapper.readValue(json, AnalysisReport.class);
        } catch (JsonProcessingException e) {
            throw new ReportException("Invalid report JSON", e);
        }
    }
}
