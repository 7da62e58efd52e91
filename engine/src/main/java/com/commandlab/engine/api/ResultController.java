package com.commandlab.engine.api;

import com.commandlab.engine.capture.ExportFormat;
import com.commandlab.engine.capture.OverallRisk;
import com.commandlab.engine.capture.ResultCapture;
import com.commandlab.engine.capture.ResultStatistics;
import com.commandlab.engine.capture.SearchCriteria;
import com.commandlab.engine.capture.TestResult;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

/**
 * Captured results.
 *
 * GET    /results            - search (all filters optional, newest first)
 * GET    /results/{id}       - one result
 * GET    /results/statistics - aggregate statistics
 * GET    /results/export     - export matching results as json, csv or markdown
 * DELETE /results            - clear the store (204)
 */
@RestController
@RequestMapping("/results")
public class ResultController {

    private final ResultCapture resultCapture;

    public ResultController(ResultCapture resultCapture) {
        this.resultCapture = resultCapture;
    }

    @GetMapping
    public List<TestResult> search(
            @RequestParam(required = false) String commandId,
            @RequestParam(required = false) Boolean success,
            @RequestParam(required = false) String risk,
            @RequestParam(required = false) List<String> tags,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) Boolean hasNotes) {
        return resultCapture.searchResults(criteria(commandId, success, risk, tags, from, to, hasNotes));
    }

    @GetMapping("/statistics")
    public ResultStatistics statistics() {
        return resultCapture.getStatistics();
    }

    @GetMapping("/export")
    public ResponseEntity<String> export(
            @RequestParam(defaultValue = "json") String format,
            @RequestParam(required = false) String commandId,
            @RequestParam(required = false) Boolean success,
            @RequestParam(required = false) String risk) {
        ExportFormat exportFormat;
        try {
            exportFormat = ExportFormat.parse(format);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        SearchCriteria criteria = commandId == null && success == null && risk == null
                ? null : criteria(commandId, success, risk, null, null, null, null);
        String body = resultCapture.exportResults(exportFormat, criteria);
        MediaType type = switch (exportFormat) {
            case JSON     -> MediaType.APPLICATION_JSON;
            case CSV      -> MediaType.valueOf("text/csv");
            case MARKDOWN -> MediaType.valueOf("text/markdown");
        };
        return ResponseEntity.ok().contentType(type).body(body);
    }

    @GetMapping("/{id}")
    public TestResult get(@PathVariable String id) {
        return resultCapture.getResult(id).orElseThrow(() -> new ResponseStatusException(
                HttpStatus.NOT_FOUND, "Result not found: " + id));
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        resultCapture.clearResults();
        return ResponseEntity.noContent().build();
    }

    private static SearchCriteria criteria(String commandId, Boolean success, String risk, List<String> tags,
                                           Instant from, Instant to, Boolean hasNotes) {
        OverallRisk riskLevel = null;
        if (risk != null) {
            try {
                riskLevel = OverallRisk.parse(risk);
            } catch (IllegalArgumentException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
            }
        }
        return new SearchCriteria(commandId, success, riskLevel, tags, from, to, hasNotes);
    }
}
