package com.firmenakte.aggregate.api;

import com.firmenakte.aggregate.model.AggregationResult;
import com.firmenakte.aggregate.model.AggregationRunView;
import com.firmenakte.aggregate.model.SessionState;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.aggregate.model.StoredCompanyRecord;
import com.firmenakte.aggregate.persistence.CompanyRecordRepository;
import com.firmenakte.aggregate.service.CompanyAggregationService;
import com.firmenakte.aggregate.session.SessionManager;
import com.firmenakte.aggregate.source.SourceAdapter;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class AggregationController {
    private final CompanyAggregationService aggregationService;
    private final CompanyRecordRepository repository;
    private final SessionManager sessionManager;
    private final List<SourceAdapter> adapters;

    public AggregationController(
        CompanyAggregationService aggregationService,
        CompanyRecordRepository repository,
        SessionManager sessionManager,
        List<SourceAdapter> adapters
    ) {
        this.aggregationService = aggregationService;
        this.repository = repository;
        this.sessionManager = sessionManager;
        this.adapters = adapters;
    }

    @PostMapping("/companies/aggregate")
    public AggregationResult aggregate(@RequestBody AggregationApiRequest request) {
        return aggregationService.aggregate(requireBody(request).toIdentity());
    }

    @PostMapping("/companies/aggregate/async")
    public Map<String, Object> aggregateAsync(@RequestBody AggregationApiRequest request) {
        long runId = aggregationService.startAsync(requireBody(request).toIdentity());
        return Map.of("run_id", runId, "status", CompanyRecordRepository.RUN_RUNNING);
    }

    @GetMapping("/aggregation-runs/{runId}")
    public AggregationRunView getRun(@PathVariable("runId") long runId) {
        return aggregationService.findRun(runId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "aggregation run not found: " + runId));
    }

    @GetMapping("/companies/{fingerprint}")
    public StoredCompanyRecord getCompany(@PathVariable("fingerprint") String fingerprint) {
        return repository.findCompanyRecord(fingerprint)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "company record not found: " + fingerprint));
    }

    @GetMapping("/sessions")
    public Map<String, Object> sessions() {
        Map<String, Object> sessions = new LinkedHashMap<>();
        adapters.stream()
            .filter(SourceAdapter::requiresSession)
            .map(SourceAdapter::source)
            .sorted()
            .forEach(source -> sessions.put(source.key(), sessionView(source)));
        return sessions;
    }

    @PutMapping("/sessions/{source}")
    public Map<String, Object> updateSession(
        @PathVariable("source") String source,
        @RequestBody SessionUpdateRequest request
    ) {
        SourceId sourceId = SourceId.fromKey(source);
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "credential_blob is required");
        }
        sessionManager.refresh(sourceId, request.credentialBlob());
        return sessionView(sourceId);
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        status.put("db_connected", dbConnected);
        status.put("counts", dbConnected ? repository.tableCounts() : Map.of());
        return status;
    }

    private Map<String, Object> sessionView(SourceId source) {
        Map<String, Object> view = new LinkedHashMap<>();
        SessionState state = sessionManager.load(source).orElse(null);
        view.put("present", state != null);
        view.put("valid", state != null && state.usable());
        view.put("last_validated_at", state == null ? null : state.lastValidatedAt());
        return view;
    }

    private static AggregationApiRequest requireBody(AggregationApiRequest request) {
        return request == null ? new AggregationApiRequest(null, null, null) : request;
    }
}
