package com.firmenakte.aggregate.service;

import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.FailureKind;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.RawPayload;
import com.firmenakte.aggregate.model.SessionState;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.aggregate.source.SourceAdapter;
import com.firmenakte.aggregate.source.SourceFetchException;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapter test double that replays a fixed list of steps, one per fetch call. The last step repeats
 * once the script runs out.
 */
class ScriptedSourceAdapter implements SourceAdapter {
    interface Step {
        RawPayload fetch(SourceId source) throws SourceFetchException;
    }

    private final SourceId source;
    private final boolean requiresSession;
    private final Deque<Step> steps = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private Step last;

    ScriptedSourceAdapter(SourceId source, boolean requiresSession) {
        this.source = source;
        this.requiresSession = requiresSession;
    }

    static ScriptedSourceAdapter of(SourceId source) {
        return new ScriptedSourceAdapter(source, false);
    }

    ScriptedSourceAdapter then(Step step) {
        steps.add(step);
        return this;
    }

    ScriptedSourceAdapter thenFail(FailureKind kind) {
        return then(src -> {
            throw new SourceFetchException(kind, kind + " from " + src.key());
        });
    }

    ScriptedSourceAdapter thenReturn(String body) {
        return then(src -> payload(src, body));
    }

    ScriptedSourceAdapter thenHang(CountDownLatch release) {
        return then(src -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SourceFetchException(FailureKind.TIMEOUT, "interrupted");
            }
            return payload(src, "registernummer=HRB1");
        });
    }

    static RawPayload payload(SourceId source, String... bodies) {
        List<RawDocument> documents = Arrays.stream(bodies)
            .map(body -> RawDocument.html(null, null, body))
            .toList();
        return new RawPayload(source, documents, Instant.now());
    }

    static RawPayload artifactPayload(SourceId source, CanonicalField field, String ref, String body) {
        return new RawPayload(source, List.of(RawDocument.html(field, ref, body)), Instant.now());
    }

    int calls() {
        return calls.get();
    }

    @Override
    public SourceId source() {
        return source;
    }

    @Override
    public boolean requiresSession() {
        return requiresSession;
    }

    @Override
    public boolean supports(CompanyIdentity identity) {
        return identity.hasIdentifyingField();
    }

    @Override
    public RawPayload fetch(CompanyIdentity identity, SessionState session) throws SourceFetchException {
        calls.incrementAndGet();
        Step step;
        synchronized (steps) {
            step = steps.isEmpty() ? last : steps.poll();
            last = step;
        }
        if (step == null) {
            throw new SourceFetchException(FailureKind.RECORD_NOT_FOUND, "no scripted step");
        }
        return step.fetch(source);
    }
}
