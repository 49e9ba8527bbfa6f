package fr.lapetina.factcheck.orchestrator;

import fr.lapetina.factcheck.domain.model.CheckResult;
import fr.lapetina.factcheck.domain.model.CheckStatus;
import fr.lapetina.factcheck.domain.model.Complexity;
import fr.lapetina.factcheck.domain.model.Confidence;
import fr.lapetina.factcheck.domain.model.ErrorCategory;
import fr.lapetina.factcheck.domain.model.ModelSelectionCriteria;
import fr.lapetina.factcheck.domain.model.ModelTier;
import fr.lapetina.factcheck.domain.model.RecoveryStrategy;
import fr.lapetina.factcheck.domain.model.TaskType;
import fr.lapetina.factcheck.domain.policy.ErrorClassifier;
import fr.lapetina.factcheck.domain.policy.ModelPolicy;
import fr.lapetina.factcheck.domain.policy.RecoveryPolicy;
import fr.lapetina.factcheck.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.factcheck.provider.ModelClient;
import fr.lapetina.factcheck.provider.SearchProvider;
import fr.lapetina.factcheck.queue.CancellationToken;
import fr.lapetina.factcheck.queue.RequestQueue;
import fr.lapetina.factcheck.resilience.RetryExecutor;
import fr.lapetina.factcheck.resilience.RetryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Entry point of a fact check.
 *
 * <p>Concurrent checks of the same text (same fingerprint over the first
 * {@code fingerprintPrefixLength} characters) share one execution and one result.
 * A check runs: complexity estimate, tier selection, search query extraction,
 * evidence collection, then either a single prompt or the two-prompt analysis.
 *
 * <p>Failures escalate instead of surfacing: model calls retry within the recovery
 * table's budget for the failure's category, temporary errors retry the whole
 * pipeline, categories with a fallback tier run a simplified emergency check, and
 * anything left becomes a {@link CheckStatus#FAILED} result. The returned future
 * never completes exceptionally.
 */
public final class FactCheckOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FactCheckOrchestrator.class);

    static final int QUERY_TEXT_LENGTH = 100;
    static final int MIN_VALID_RESPONSE_LENGTH = 20;
    static final Duration EMERGENCY_RETRY_DELAY = Duration.ofSeconds(1);
    static final String TECHNICAL_ISSUES = "Could not perform a complete fact-check due to technical issues. "
            + "The rating provided is a default value and may not be accurate.";
    static final String SEARCH_UNAVAILABLE =
            "Unable to fetch references - search is not configured. Please check the search API key.";
    static final String EMERGENCY_REFERENCES = "No references available (emergency mode).";

    private static final DateTimeFormatter TODAY_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.US);

    private final ModelClient modelClient;
    private final EvidenceCollector evidenceCollector;
    private final QueryExtractor queryExtractor;
    private final RetryExecutor retryExecutor;
    private final ModelPolicy modelPolicy;
    private final RecoveryPolicy recoveryPolicy;
    private final ErrorClassifier errorClassifier;
    private final RatingAggregator ratingAggregator;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final PendingCheckRegistry pending;
    private final AtomicReference<CheckSettings> settings;

    private FactCheckOrchestrator(Builder builder) {
        this.modelClient = Objects.requireNonNull(builder.modelClient, "Model client is required");
        this.evidenceCollector = builder.searchProvider != null
                ? new EvidenceCollector(builder.searchProvider, builder.searchQueue,
                builder.maxClaims, builder.maxClaimLength)
                : null;
        this.queryExtractor = new QueryExtractor(modelClient);
        this.retryExecutor = builder.retryExecutor != null ? builder.retryExecutor : new RetryExecutor();
        this.modelPolicy = new ModelPolicy();
        this.recoveryPolicy = new RecoveryPolicy();
        this.errorClassifier = new ErrorClassifier();
        this.ratingAggregator = new RatingAggregator();
        this.metrics = builder.metrics;
        this.clock = builder.clock;
        this.settings = new AtomicReference<>(builder.settings);
        this.pending = new PendingCheckRegistry(builder.settings.fingerprintPrefixLength());

        log.info("Fact-check orchestrator created: provider={}, search={}, multiModel={}",
                modelClient.providerName(),
                builder.searchProvider != null ? builder.searchProvider.name() : "none",
                builder.settings.multiModel());
    }

    public static Builder builder(ModelClient modelClient) {
        return new Builder(modelClient);
    }

    public CompletableFuture<CheckResult> check(String text) {
        return check(text, CancellationToken.none());
    }

    /**
     * Checks {@code text}, joining an in-flight check of the same text if there is one.
     *
     * @param token cancels this caller's interest; the shared execution stops its queued
     *              model and search calls only once every caller sharing it has cancelled
     * @return future that always completes normally
     */
    public CompletableFuture<CheckResult> check(String text, CancellationToken token) {
        if (text == null || text.isBlank()) {
            return CompletableFuture.completedFuture(
                    CheckResult.failed("No text provided for fact-checking.", "", null));
        }
        CancellationToken effectiveToken = token != null ? token : CancellationToken.none();

        String fingerprint = pending.fingerprint(text);
        PendingCheckRegistry.Registration registration = pending.register(fingerprint, effectiveToken);
        PendingCheckRegistry.Entry entry = registration.entry();
        if (!registration.owner()) {
            log.debug("Joining in-flight check: fingerprint={}", abbreviate(fingerprint));
            if (metrics != null) {
                metrics.incrementDeduplicated();
            }
            return entry.future();
        }

        Instant start = clock.instant();
        if (metrics != null) {
            metrics.checkStarted();
        }
        log.info("Check started: fingerprint={}, textLength={}", abbreviate(fingerprint), text.length());

        CompletableFuture<CheckResult> run;
        try {
            run = runCheck(new CheckContext(text), settings.get(), entry.token());
        } catch (RuntimeException e) {
            run = CompletableFuture.failedFuture(e);
        }

        run.whenComplete((result, error) -> {
            CheckResult outcome = error == null ? result : unexpectedFailure(text, error);
            pending.remove(fingerprint, entry);
            recordOutcome(outcome, start);
            entry.future().complete(outcome);
        });
        return entry.future();
    }

    public CheckSettings getSettings() {
        return settings.get();
    }

    /**
     * Replaces the settings used by checks started from now on.
     */
    public void updateSettings(CheckSettings newSettings) {
        CheckSettings previous = settings.getAndSet(Objects.requireNonNull(newSettings, "Settings are required"));
        log.info("Check settings updated: multiModel={}->{}, costSensitive={}->{}, urgency={}->{}",
                previous.multiModel(), newSettings.multiModel(),
                previous.costSensitive(), newSettings.costSensitive(),
                previous.urgency(), newSettings.urgency());
    }

    public int getPendingChecks() {
        return pending.size();
    }

    public boolean isSearchEnabled() {
        return evidenceCollector != null;
    }

    private CompletableFuture<CheckResult> runCheck(CheckContext ctx, CheckSettings current, CancellationToken token) {
        CheckSettings.RetrySettings retry = current.checkRetry();
        RetryOptions options = RetryOptions.builder()
                .maxRetries(retry.maxRetries())
                .initialDelay(retry.initialDelay())
                .maxDelay(retry.maxDelay())
                .shouldRetry(error -> errorClassifier.categorize(error) == ErrorCategory.TEMPORARY)
                .onRetry((error, info) -> {
                    if (metrics != null) {
                        metrics.incrementRetry("check", ErrorCategory.TEMPORARY);
                    }
                })
                .build();

        return retryExecutor.retry(() -> performCheck(ctx, current, token), options, token)
                .handle((result, error) -> error == null
                        ? CompletableFuture.completedFuture(result)
                        : recover(ctx, current, error, token))
                .thenCompose(Function.identity());
    }

    private CompletableFuture<CheckResult> performCheck(CheckContext ctx, CheckSettings current, CancellationToken token) {
        String text = ctx.text();
        Complexity complexity = modelPolicy.estimateComplexity(text);
        ModelTier tier = modelPolicy.selectOptimalModel(ModelSelectionCriteria.builder()
                .provider(modelClient.providerName())
                .textLength(text.length())
                .complexity(complexity)
                .urgency(current.urgency())
                .costSensitive(current.costSensitive())
                .task(TaskType.FACT_CHECK)
                .build());
        ctx.tier(tier);
        log.debug("Model tier selected: tier={}, complexity={}, textLength={}", tier, complexity, text.length());

        return queryExtractor.extract(text, current.queryExtractionThreshold(), current.extractionMaxTokens(), token)
                .thenCompose(query -> {
                    ctx.queryText(query);
                    return collectEvidence(query, token);
                })
                .thenCompose(evidence -> current.multiModel()
                        ? multiModelCheck(ctx, tier, evidence, current, token)
                        : singleModelCheck(ctx, tier, evidence, current, token));
    }

    private CompletableFuture<Evidence> collectEvidence(String query, CancellationToken token) {
        if (evidenceCollector == null) {
            return CompletableFuture.completedFuture(Evidence.none(SEARCH_UNAVAILABLE));
        }
        return evidenceCollector.collect(query, token);
    }

    private CompletableFuture<CheckResult> singleModelCheck(
            CheckContext ctx,
            ModelTier tier,
            Evidence evidence,
            CheckSettings current,
            CancellationToken token
    ) {
        String model = modelClient.modelFor(tier);
        String prompt = PromptTemplates.singleCheck(ctx.text(), evidence.context(), today());
        return callModel(prompt, tier, current, token)
                .thenApply(response -> CheckResult.builder()
                        .result(response + "\n\nModel: " + model + evidence.referencesText())
                        .queryText(ctx.queryText())
                        .rating(RatingExtractor.extract(response).orElse(null))
                        .status(CheckStatus.COMPLETE)
                        .model(model)
                        .references(evidence.references())
                        .completedAt(clock.instant())
                        .build());
    }

    private CompletableFuture<CheckResult> multiModelCheck(
            CheckContext ctx,
            ModelTier primaryTier,
            Evidence evidence,
            CheckSettings current,
            CancellationToken token
    ) {
        ModelTier secondaryTier = modelPolicy.secondaryTier(primaryTier);
        String primaryModel = modelClient.modelFor(primaryTier);
        String secondaryModel = modelClient.modelFor(secondaryTier);

        List<CompletableFuture<Analysis>> analyses = List.of(
                analyse(PromptTemplates.EVIDENCE_ANALYSIS,
                        PromptTemplates.evidenceAnalysis(ctx.text(), evidence.context()),
                        primaryTier, current, token),
                analyse(PromptTemplates.LOGICAL_CONSISTENCY,
                        PromptTemplates.logicalConsistency(ctx.text()),
                        secondaryTier, current, token)
        );

        return CompletableFuture.allOf(analyses.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<Analysis> results = analyses.stream().map(CompletableFuture::join).toList();
                    if (results.stream().allMatch(Analysis::failed)) {
                        throw new CompletionException(results.get(0).error());
                    }
                    return combine(ctx, results, evidence, primaryModel, secondaryModel);
                });
    }

    private CompletableFuture<Analysis> analyse(
            String name,
            String prompt,
            ModelTier tier,
            CheckSettings current,
            CancellationToken token
    ) {
        return callModel(prompt, tier, current, token)
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = ErrorClassifier.unwrap(error);
                        log.warn("Analysis failed: analysis={}, tier={}, error={}", name, tier, cause.getMessage());
                        return new Analysis(name, "Error: Could not complete " + name + " analysis.", cause);
                    }
                    return new Analysis(name, response, null);
                });
    }

    private CheckResult combine(
            CheckContext ctx,
            List<Analysis> analyses,
            Evidence evidence,
            String primaryModel,
            String secondaryModel
    ) {
        List<Integer> ratings = new ArrayList<>();
        for (Analysis analysis : analyses) {
            RatingExtractor.extract(analysis.response()).ifPresent(ratings::add);
        }
        RatingAggregator.Verdict verdict = ratingAggregator.aggregate(ratings);

        StringBuilder text = new StringBuilder("Rating: ").append(verdict.rating()).append("\n\nExplanation: ");
        List<Analysis> valid = analyses.stream()
                .filter(a -> !a.response().contains("Error:") && a.response().length() > MIN_VALID_RESPONSE_LENGTH)
                .toList();
        if (valid.isEmpty()) {
            text.append(TECHNICAL_ISSUES);
        } else {
            for (Analysis analysis : valid) {
                String explanation = RatingExtractor.explanation(analysis.response())
                        .orElse(analysis.response().trim());
                text.append("\n\n").append(analysis.name()).append(": ").append(explanation);
            }
        }

        if (verdict.ratingCount() > 1) {
            text.append("\n\nConfidence Level: ").append(verdict.confidence().getLabel())
                    .append(" (based on agreement between different analysis methods)");
        } else {
            text.append("\n\nConfidence Level: Low (limited analysis methods available)");
        }
        text.append("\n\nPrimary Model: ").append(primaryModel)
                .append("\nSecondary Model(s): ").append(secondaryModel)
                .append(evidence.referencesText());

        log.debug("Analyses combined: ratings={}, rating={}, confidence={}",
                ratings, verdict.rating(), verdict.confidence());
        return CheckResult.builder()
                .result(text.toString())
                .queryText(ctx.queryText())
                .rating(verdict.rating())
                .confidence(verdict.confidence())
                .status(CheckStatus.COMPLETE)
                .model(primaryModel)
                .references(evidence.references())
                .completedAt(clock.instant())
                .build();
    }

    /**
     * One model call, retried as the recovery table allows for the failure's category.
     * Categories that need a smaller prompt are left to the emergency check.
     * The configured call retry settings cap the number of retries and every wait.
     */
    private CompletableFuture<String> callModel(String prompt, ModelTier tier, CheckSettings current, CancellationToken token) {
        CheckSettings.RetrySettings retry = current.callRetry();
        AtomicInteger retries = new AtomicInteger();
        RetryOptions options = RetryOptions.builder()
                .maxRetries(retry.maxRetries())
                .initialDelay(retry.initialDelay())
                .maxDelay(retry.maxDelay())
                .shouldRetry(error -> {
                    RecoveryStrategy strategy = recoveryPolicy.recoveryFor(errorClassifier.categorize(error), tier);
                    return strategy.retry()
                            && !strategy.reducePromptSize()
                            && retries.get() < strategy.maxRetries();
                })
                .minDelay(error -> recoveryPolicy.recoveryFor(errorClassifier.categorize(error), tier).waitTime())
                .onRetry((error, info) -> {
                    retries.incrementAndGet();
                    if (metrics != null) {
                        metrics.incrementRetry("model_call", errorClassifier.categorize(error));
                    }
                })
                .build();
        return retryExecutor.retry(
                () -> modelClient.call(prompt, tier, current.maxTokens(), true, token), options, token);
    }

    private CompletableFuture<CheckResult> recover(
            CheckContext ctx,
            CheckSettings current,
            Throwable error,
            CancellationToken token
    ) {
        Throwable cause = ErrorClassifier.unwrap(error);
        String head = head(ctx.text(), QUERY_TEXT_LENGTH);
        if (cause instanceof CancellationException) {
            log.info("Check cancelled");
            return CompletableFuture.completedFuture(CheckResult.failed("Fact check was cancelled.", head, null));
        }

        ErrorCategory category = errorClassifier.categorize(cause);
        if (metrics != null) {
            metrics.incrementErrorCount(category);
        }
        RecoveryStrategy strategy = recoveryPolicy.recoveryFor(category, ctx.tier());
        Optional<ModelTier> fallback = strategy.fallback();
        log.warn("Check failed: category={}, tier={}, fallback={}, error={}",
                category, ctx.tier(), fallback.map(Enum::name).orElse("none"), cause.getMessage());

        if (fallback.isEmpty()) {
            return CompletableFuture.completedFuture(CheckResult.failed(strategy.userMessage(), head, category));
        }
        return emergencyCheck(ctx, fallback.get(), category, strategy.userMessage(), current, token);
    }

    /**
     * Simplified single prompt over the head of the text on the fallback tier.
     */
    private CompletableFuture<CheckResult> emergencyCheck(
            CheckContext ctx,
            ModelTier tier,
            ErrorCategory category,
            String userMessage,
            CheckSettings current,
            CancellationToken token
    ) {
        String model = modelClient.modelFor(tier);
        String prompt = PromptTemplates.emergencyCheck(head(ctx.text(), current.emergencyInputLength()));
        String head = head(ctx.text(), QUERY_TEXT_LENGTH);
        RetryOptions once = RetryOptions.builder()
                .maxRetries(1)
                .initialDelay(EMERGENCY_RETRY_DELAY)
                .maxDelay(EMERGENCY_RETRY_DELAY)
                .shouldRetry(errorClassifier::isTemporaryError)
                .build();
        log.warn("Running emergency check: tier={}, model={}, category={}", tier, model, category);

        return retryExecutor.retry(
                        () -> modelClient.call(prompt, tier, current.extractionMaxTokens(), true, token), once, token)
                .handle((response, error) -> {
                    if (error != null) {
                        log.error("Emergency check failed: model={}, error={}",
                                model, ErrorClassifier.unwrap(error).getMessage());
                        return CheckResult.failed(userMessage, head, category);
                    }
                    Integer rating = RatingExtractor.extract(response).orElse(null);
                    return CheckResult.builder()
                            .result(response + Evidence.REFERENCES_HEADER + EMERGENCY_REFERENCES
                                    + "\n\nNote: This is a simplified fact-check using the " + model + " model.")
                            .queryText(head)
                            .rating(rating)
                            .confidence(rating != null ? Confidence.LOW : null)
                            .status(CheckStatus.EMERGENCY)
                            .model(model)
                            .errorCategory(category)
                            .completedAt(clock.instant())
                            .build();
                });
    }

    private CheckResult unexpectedFailure(String text, Throwable error) {
        log.error("Check pipeline failed unexpectedly", ErrorClassifier.unwrap(error));
        return CheckResult.failed(recoveryPolicy.userMessage(ErrorCategory.UNKNOWN),
                head(text, QUERY_TEXT_LENGTH), ErrorCategory.UNKNOWN);
    }

    private void recordOutcome(CheckResult result, Instant start) {
        Duration latency = Duration.between(start, clock.instant());
        if (metrics != null) {
            metrics.checkFinished();
            metrics.recordCheck(result.status(), latency);
        }
        log.info("Check finished: status={}, rating={}, model={}, durationMs={}",
                result.status(), result.rating(), result.model(), latency.toMillis());
    }

    private String today() {
        return LocalDate.now(clock).format(TODAY_FORMAT);
    }

    private static String head(String text, int length) {
        return text.length() > length ? text.substring(0, length) : text;
    }

    private static String abbreviate(String fingerprint) {
        return fingerprint.substring(0, 12);
    }

    private record Analysis(String name, String response, Throwable error) {
        boolean failed() {
            return error != null;
        }
    }

    public static final class Builder {
        private final ModelClient modelClient;
        private SearchProvider searchProvider;
        private RequestQueue searchQueue;
        private int maxClaims = 2;
        private int maxClaimLength = 80;
        private RetryExecutor retryExecutor;
        private MetricsRegistry metrics;
        private Clock clock = Clock.systemUTC();
        private CheckSettings settings = CheckSettings.defaults();

        private Builder(ModelClient modelClient) {
            this.modelClient = modelClient;
        }

        /**
         * Enables evidence collection. Without it checks run on model knowledge only.
         */
        public Builder search(SearchProvider searchProvider, RequestQueue searchQueue) {
            this.searchProvider = Objects.requireNonNull(searchProvider, "Search provider is required");
            this.searchQueue = Objects.requireNonNull(searchQueue, "Search queue is required");
            return this;
        }

        public Builder maxClaims(int maxClaims) {
            this.maxClaims = maxClaims;
            return this;
        }

        public Builder maxClaimLength(int maxClaimLength) {
            this.maxClaimLength = maxClaimLength;
            return this;
        }

        public Builder retryExecutor(RetryExecutor retryExecutor) {
            this.retryExecutor = retryExecutor;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock is required");
            return this;
        }

        public Builder settings(CheckSettings settings) {
            this.settings = Objects.requireNonNull(settings, "Settings are required");
            return this;
        }

        public FactCheckOrchestrator build() {
            return new FactCheckOrchestrator(this);
        }
    }
}
