package com.releasefeed.pipeline.validation;

import com.releasefeed.core.events.AlertRaised;
import com.releasefeed.core.events.FeedValidated;
import com.releasefeed.core.model.CandidateUrl;
import com.releasefeed.core.model.FailureKind;
import com.releasefeed.core.model.FeedFailure;
import com.releasefeed.core.model.ValidatedFeed;
import com.releasefeed.pipeline.api.PipelineContext;
import com.releasefeed.pipeline.concurrent.WorkerPool;
import com.releasefeed.pipeline.http.FetchResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Existence check for candidate feed URLs, run ahead of the full fetch so bodies are only downloaded for
 * feeds that exist. Each candidate is checked independently on the shared worker pool.
 */
public class FeedValidator {
    private static final Logger LOGGER = Logger.getLogger(FeedValidator.class.getName());

    private final PipelineContext ctx;
    private final WorkerPool pool;

    public FeedValidator(PipelineContext ctx, WorkerPool pool) {
        this.ctx = ctx;
        this.pool = pool;
    }

    public ValidationResult validate(List<CandidateUrl> candidates) {
        List<CandidateCheck> checks = pool.mapAll(candidates, this::check, (candidate, error) ->
                new CandidateCheck(candidate, Verdict.ERROR, 0, "Unexpected validation failure: " + error));

        List<ValidatedFeed> valid = new ArrayList<>();
        List<FeedFailure> failures = new ArrayList<>();
        for (CandidateCheck check : checks) {
            if (check.verdict() == Verdict.VALID) {
                valid.add(new ValidatedFeed(check.candidate(), check.statusCode()));
            } else if (check.verdict() == Verdict.ERROR) {
                failures.add(new FeedFailure(check.candidate().url(), FailureKind.TRANSIENT_NETWORK, check.detail()));
            }
        }
        LOGGER.fine(() -> "Validated " + candidates.size() + " candidates: " + valid.size() + " valid");
        return new ValidationResult(checks, valid, failures);
    }

    CandidateCheck check(CandidateUrl candidate) {
        Instant startedAt = ctx.clock().instant();
        FetchResponse response = ctx.fetchClient().head(candidate.url());
        if (!response.isTransportFailure() && headUnsupported(response.statusCode())) {
            response = ctx.fetchClient().rangedGet(candidate.url());
        }
        long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();

        if (response.isTransportFailure()) {
            ctx.eventBus().publish(new FeedValidated(ctx.clock().instant(), candidate.url(), 0, false, durationMillis));
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    "validation",
                    response.failure().message(),
                    Map.of("url", candidate.url(), "kind", response.failure().kind().name())
            ));
            return new CandidateCheck(candidate, Verdict.ERROR, 0, response.describe());
        }

        boolean valid = response.isSuccess();
        ctx.eventBus().publish(new FeedValidated(
                ctx.clock().instant(),
                candidate.url(),
                response.statusCode(),
                valid,
                durationMillis
        ));
        return new CandidateCheck(candidate, valid ? Verdict.VALID : Verdict.NOT_FOUND, response.statusCode(), response.describe());
    }

    private static boolean headUnsupported(int statusCode) {
        return statusCode == 405 || statusCode == 501;
    }
}
