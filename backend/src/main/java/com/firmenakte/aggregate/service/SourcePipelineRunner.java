package com.firmenakte.aggregate.service;

import com.firmenakte.aggregate.model.AttemptRecord;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.FailureKind;
import com.firmenakte.aggregate.model.PartialFieldMap;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.RawPayload;
import com.firmenakte.aggregate.model.SessionState;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.aggregate.model.SourceResult;
import com.firmenakte.aggregate.model.SourceStatus;
import com.firmenakte.aggregate.parse.DocumentParseException;
import com.firmenakte.aggregate.parse.DocumentParserRegistry;
import com.firmenakte.aggregate.session.SessionManager;
import com.firmenakte.aggregate.source.SourceAdapter;
import com.firmenakte.aggregate.source.SourceFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs fetch-then-parse for one source with retries. Each attempt is recorded; the final outcome is
 * written to the {@link SourceResultRecorder}, which may already have been finished by a deadline.
 */
@Service
public class SourcePipelineRunner {
    private static final Logger log = LoggerFactory.getLogger(SourcePipelineRunner.class);

    private final DocumentParserRegistry parserRegistry;
    private final SessionManager sessionManager;

    public SourcePipelineRunner(DocumentParserRegistry parserRegistry, SessionManager sessionManager) {
        this.parserRegistry = parserRegistry;
        this.sessionManager = sessionManager;
    }

    public SourceResult run(CompanyIdentity identity, SourceAdapter adapter, RetryPolicy policy, SourceResultRecorder recorder) {
        SourceId source = adapter.source();
        SessionState session = null;
        if (adapter.requiresSession()) {
            Optional<SessionState> stored = sessionManager.load(source);
            if (stored.isEmpty() || !stored.get().usable()) {
                log.warn("Skipping {} for {}: session missing or invalid", source.key(), identity.displayName());
                return recorder.fail(FailureKind.AUTH_EXPIRED, stored.isEmpty() ? "no stored session" : "session marked invalid");
            }
            session = stored.get();
        }

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (recorder.isFinished()) {
                return recorder.result();
            }
            if (attempt > 1 && !backoff(policy, attempt - 1, source)) {
                return recorder.fail(FailureKind.TIMEOUT, "cancelled during backoff after attempt " + (attempt - 1));
            }
            if (Thread.currentThread().isInterrupted()) {
                return recorder.fail(FailureKind.TIMEOUT, "cancelled before attempt " + attempt);
            }

            Instant attemptStart = Instant.now();
            AttemptOutcome outcome = attempt(identity, adapter, session);
            Duration duration = Duration.between(attemptStart, Instant.now());
            recorder.recordAttempt(new AttemptRecord(
                attempt,
                attemptStart,
                duration,
                outcome.label(),
                outcome.failureKind(),
                outcome.detail()
            ));

            if (outcome.failureKind() == null) {
                log.info(
                    "{} attempt {} for {}: {} with {} fields in {}ms",
                    source.key(),
                    attempt,
                    identity.displayName(),
                    outcome.status(),
                    outcome.fields().size(),
                    duration.toMillis()
                );
                return recorder.succeed(outcome.status(), outcome.fields(), outcome.artifacts(), outcome.documents(), outcome.detail());
            }

            boolean retry = policy.isRetryable(outcome.failureKind()) && attempt < policy.maxAttempts();
            log.warn(
                "{} attempt {}/{} for {} failed: {} ({}){}",
                source.key(),
                attempt,
                policy.maxAttempts(),
                identity.displayName(),
                outcome.failureKind(),
                outcome.detail(),
                retry ? ", retrying" : ""
            );
            if (!retry) {
                return recorder.fail(outcome.failureKind(), outcome.detail());
            }
        }
        return recorder.fail(FailureKind.TRANSIENT_NETWORK, "no attempt made");
    }

    private AttemptOutcome attempt(CompanyIdentity identity, SourceAdapter adapter, SessionState session) {
        SourceId source = adapter.source();
        RawPayload payload;
        try {
            payload = adapter.fetch(identity, session);
        } catch (SourceFetchException e) {
            return AttemptOutcome.failed(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected error from {} adapter", source.key(), e);
            return AttemptOutcome.failed(FailureKind.TRANSIENT_NETWORK, "unexpected adapter error: " + e);
        }
        if (payload == null || payload.documents().isEmpty()) {
            return AttemptOutcome.failed(FailureKind.RECORD_NOT_FOUND, "source returned no documents");
        }

        PartialFieldMap fields = new PartialFieldMap(source, payload.fetchedAt());
        Map<CanonicalField, String> artifacts = new EnumMap<>(CanonicalField.class);
        List<String> problems = new ArrayList<>(payload.failures());
        int parsed = 0;
        for (RawDocument document : payload.documents()) {
            if (document.artifactField() != null && document.artifactRef() != null) {
                artifacts.putIfAbsent(document.artifactField(), document.artifactRef());
            }
            try {
                fields.addMissing(parserRegistry.parse(document, source, payload.fetchedAt()));
                parsed++;
            } catch (DocumentParseException | RuntimeException e) {
                log.warn("{} {} document {} could not be parsed: {}", source.key(), document.format(), document.artifactRef(), e.getMessage());
                problems.add(document.format() + ": " + e.getMessage());
            }
        }
        if (parsed == 0) {
            return AttemptOutcome.failed(FailureKind.MALFORMED_RESPONSE, String.join("; ", problems));
        }
        artifacts.forEach(fields::put);

        SourceStatus status = problems.isEmpty() ? SourceStatus.SUCCESS : SourceStatus.PARTIAL_SUCCESS;
        String detail = problems.isEmpty() ? null : String.join("; ", problems);
        return new AttemptOutcome(status, null, detail, fields, artifacts, payload.documents());
    }

    private boolean backoff(RetryPolicy policy, int failedAttempts, SourceId source) {
        Duration delay = policy.backoff().delayAfter(failedAttempts);
        if (delay.isZero()) {
            return !Thread.currentThread().isInterrupted();
        }
        log.debug("Backing off {}ms before retrying {}", delay.toMillis(), source.key());
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private record AttemptOutcome(
        SourceStatus status,
        FailureKind failureKind,
        String detail,
        PartialFieldMap fields,
        Map<CanonicalField, String> artifacts,
        List<RawDocument> documents
    ) {
        static AttemptOutcome failed(FailureKind kind, String detail) {
            return new AttemptOutcome(SourceStatus.FAILED, kind, detail, null, Map.of(), List.of());
        }

        String label() {
            if (failureKind != null) {
                return AttemptRecord.OUTCOME_FAILED;
            }
            return status == SourceStatus.PARTIAL_SUCCESS ? AttemptRecord.OUTCOME_PARTIAL : AttemptRecord.OUTCOME_SUCCESS;
        }
    }
}
