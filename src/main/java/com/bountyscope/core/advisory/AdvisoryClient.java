package com.bountyscope.core.advisory;

import com.bountyscope.core.engine.CancellationSignal;
import com.bountyscope.core.engine.RunCancelledException;
import com.bountyscope.core.metrics.BountyscopeMetrics;
import com.bountyscope.core.model.ActionDescriptor;
import com.bountyscope.core.model.Decision;
import com.bountyscope.core.model.FindingRecord;
import com.bountyscope.core.model.RateBudget;
import com.bountyscope.core.model.ScopeDefinition;
import com.bountyscope.core.persistence.ScanStore;
import com.bountyscope.core.ratelimit.RateLimiter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Client for the external reasoning service, built on Spring AI's {@link ChatClient}.
 * <p>
 * Every call is bounded: inputs are truncated, pattern lists capped, temperature and
 * token limits fixed per purpose. Calls take a permit from a dedicated rate limiter that
 * observes run cancellation. Results are returned as {@link AdvisoryOutcome}
 * values; malformed or incomplete payloads count as failures.
 */
public class AdvisoryClient {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryClient.class);

    static final int SCOPE_MAX_TOKENS = 500;
    static final int ACTION_MAX_TOKENS = 400;
    static final int FINDING_MAX_TOKENS = 400;
    static final double POLICY_TEMPERATURE = 0.1;
    static final double FINDING_TEMPERATURE = 0.2;

    private static final Set<Decision> ADVISORY_DECISIONS =
            EnumSet.of(Decision.ALLOWED, Decision.BLOCKED, Decision.UNKNOWN);

    static final String SCOPE_SYSTEM_PROMPT = """
            You are a strict security policy assistant for bug bounty programs.
            Your role is to determine if a target is within the scope of a security testing program.

            Respond ONLY with valid JSON in this exact format:
            {
              "decision": "ALLOWED" or "BLOCKED" or "UNKNOWN",
              "confidence": 0.0 to 1.0,
              "reasons": ["reason1", "reason2"],
              "suggested_next_steps": ["step1", "step2"]
            }

            Rules:
            - ALLOWED: Target clearly matches in-scope patterns
            - BLOCKED: Target clearly matches out-of-scope patterns or is high-risk
            - UNKNOWN: Insufficient information to make determination
            - Never suggest evasive or destructive actions
            - Be conservative - when in doubt, return UNKNOWN""";

    static final String ACTION_SYSTEM_PROMPT = """
            You are a security policy validator for ethical bug bounty testing.
            Evaluate if a proposed scanner action is safe and appropriate.

            Respond ONLY with valid JSON:
            {
              "decision": "ALLOWED" or "BLOCKED",
              "confidence": 0.0 to 1.0,
              "reasons": ["reason1"],
              "risk_level": "low" or "medium" or "high"
            }

            BLOCK if:
            - Action could cause damage or disruption
            - Action involves exploitation (not just detection)
            - Action is outside typical bug bounty scope

            ALLOW if:
            - Action is read-only or passive
            - Action is standard vulnerability detection
            - Risk is low and within ethical bounds""";

    static final String FINDING_SYSTEM_PROMPT = """
            You are a security researcher evaluating vulnerability findings.
            Score the finding from 0.0 (false positive) to 1.0 (critical true positive).

            Respond with JSON:
            {
              "score": 0.0 to 1.0,
              "confidence": 0.0 to 1.0,
              "explanation": "brief explanation",
              "severity": "info|low|medium|high|critical",
              "is_likely_fp": true or false
            }

            Consider:
            - Evidence quality
            - Exploitability
            - Impact
            - Context""";

    private final ChatClient chatClient;
    private final AdvisoryProperties properties;
    private final ScanStore store;
    private final BountyscopeMetrics metrics;
    private final RateLimiter limiter;
    private final ObjectMapper mapper;

    public AdvisoryClient(ChatClient.Builder builder, AdvisoryProperties properties,
                          ScanStore store, BountyscopeMetrics metrics) {
        this.chatClient = builder.build();
        this.properties = properties;
        this.store = store;
        this.metrics = metrics;
        this.limiter = new RateLimiter("advisory",
                new RateBudget(properties.getRequestsPerMinute(), properties.getMaxConcurrency()));
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        log.info("Advisory client initialized ({} req/min, {} concurrent)",
                properties.getRequestsPerMinute(), properties.getMaxConcurrency());
    }

    /**
     * Sends one bounded prompt and returns the raw response text.
     * <p>
     * Transient transport failures are retried inside the chat model by Spring AI's
     * retry template ({@code spring.ai.retry.*}), so this method makes a single call.
     *
     * @param cancel observed while waiting for a rate-limiter permit
     * @throws RunCancelledException if the run is cancelled before a permit is granted
     */
    public AdvisoryOutcome<String> ask(String prompt, String systemContext, int maxTokens, double temperature,
                                       CancellationSignal cancel) {
        try (RateLimiter.Permit permit = limiter.acquire(cancel)) {
            String response = chatClient.prompt()
                    .system(systemContext)
                    .user(prompt)
                    .options(ChatOptions.builder()
                            .maxTokens(maxTokens)
                            .temperature(temperature)
                            .build())
                    .call()
                    .content();
            if (response == null || response.isBlank()) {
                throw new AdvisoryEmptyResponseException("Advisory service returned empty content");
            }
            if (properties.isStoreResponses() && store != null) {
                store.recordAdvisoryExchange(prompt, response);
            }
            return AdvisoryOutcome.success(response);
        } catch (RunCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            String failure = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Advisory call failed: {}", failure);
            return AdvisoryOutcome.failed(failure);
        }
    }

    public AdvisoryOutcome<String> ask(String prompt, String systemContext, int maxTokens, double temperature) {
        return ask(prompt, systemContext, maxTokens, temperature, CancellationSignal.NONE);
    }

    /**
     * Asks whether a target outside every declared pattern should be tested.
     * A payload whose decision is missing or not one of Allowed, Blocked, Unknown is a failure.
     */
    public AdvisoryOutcome<AdvisoryDecision> validateScope(String target, ScopeDefinition scope) {
        return validateScope(target, scope, CancellationSignal.NONE);
    }

    public AdvisoryOutcome<AdvisoryDecision> validateScope(String target, ScopeDefinition scope,
                                                           CancellationSignal cancel) {
        String prompt = "Target: " + truncate(target) + "\n\n"
                + "In-Scope Patterns: " + patternList(scope.inScope()) + "\n"
                + "Out-of-Scope Patterns: " + patternList(scope.outOfScope()) + "\n\n"
                + "Is this target within scope for security testing?";
        var outcome = askStructured(prompt, SCOPE_SYSTEM_PROMPT, SCOPE_MAX_TOKENS, POLICY_TEMPERATURE,
                AdvisoryDecision.class, cancel).map(this::requireDecision);
        record("scope", outcome);
        return outcome.isSuccess() && outcome.value() == null
                ? AdvisoryOutcome.failed("advisory payload has no valid decision")
                : outcome;
    }

    /**
     * Asks whether a scan action flagged for validation is safe to run.
     */
    public AdvisoryOutcome<AdvisoryDecision> validateAction(ActionDescriptor action) {
        return validateAction(action, CancellationSignal.NONE);
    }

    public AdvisoryOutcome<AdvisoryDecision> validateAction(ActionDescriptor action, CancellationSignal cancel) {
        String prompt = "Scanner Action:\n"
                + "Scanner: " + truncate(action.scannerKind()) + "\n"
                + "Target: " + truncate(action.target()) + "\n"
                + "Template: " + orNa(truncate(action.templateOrRuleId())) + "\n"
                + "Severity: " + orNa(truncate(action.severityHint())) + "\n\n"
                + "Should this action be allowed?";
        var outcome = askStructured(prompt, ACTION_SYSTEM_PROMPT, ACTION_MAX_TOKENS, POLICY_TEMPERATURE,
                AdvisoryDecision.class, cancel).map(this::requireDecision);
        record("action", outcome);
        return outcome.isSuccess() && outcome.value() == null
                ? AdvisoryOutcome.failed("advisory payload has no valid decision")
                : outcome;
    }

    /**
     * Asks for an exploitability score of a finding. A payload without a score is a failure.
     */
    public AdvisoryOutcome<FindingAssessment> scoreFinding(FindingRecord finding) {
        return scoreFinding(finding, CancellationSignal.NONE);
    }

    public AdvisoryOutcome<FindingAssessment> scoreFinding(FindingRecord finding, CancellationSignal cancel) {
        String evidence;
        try {
            evidence = mapper.writeValueAsString(finding.getEvidence());
        } catch (JsonProcessingException e) {
            evidence = String.valueOf(finding.getEvidence());
        }
        String prompt = "Finding:\n"
                + "Name: " + truncate(finding.getName()) + "\n"
                + "Severity: " + truncate(finding.getSeverity()) + "\n"
                + "Description: " + orNa(truncate(finding.getDescription())) + "\n"
                + "Evidence: " + orNa(truncate(evidence)) + "\n\n"
                + "Score this finding:";
        var outcome = askStructured(prompt, FINDING_SYSTEM_PROMPT, FINDING_MAX_TOKENS, FINDING_TEMPERATURE,
                FindingAssessment.class, cancel);
        if (outcome.isSuccess() && outcome.value().score() == null) {
            outcome = AdvisoryOutcome.failed("advisory assessment has no score");
        }
        record("finding", outcome);
        return outcome;
    }

    /**
     * Parses a response into {@code type}, accepting JSON wrapped in a markdown code fence.
     *
     * @throws AdvisoryParseException if the text is not a JSON object of the expected shape
     */
    <T> T parse(String response, Class<T> type) {
        String cleaned = response.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        if (!cleaned.startsWith("{")) {
            throw new AdvisoryParseException("Advisory response is not a JSON object");
        }
        try {
            return mapper.readValue(cleaned, type);
        } catch (JsonProcessingException e) {
            throw new AdvisoryParseException("Failed to parse advisory response to "
                    + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> AdvisoryOutcome<T> askStructured(String prompt, String system, int maxTokens,
                                                 double temperature, Class<T> type, CancellationSignal cancel) {
        var converter = new BeanOutputConverter<>(type);
        var raw = ask(prompt + "\n\n" + converter.getFormat(), system, maxTokens, temperature, cancel);
        if (!raw.isSuccess()) {
            return AdvisoryOutcome.failed(raw.failure());
        }
        try {
            return AdvisoryOutcome.success(parse(raw.value(), type));
        } catch (AdvisoryParseException e) {
            log.warn("{}", e.getMessage());
            log.debug("Raw advisory response: {}", raw.value());
            return AdvisoryOutcome.failed(e.getMessage());
        }
    }

    /** Returns null when the decision is absent or outside the advisory vocabulary. */
    private AdvisoryDecision requireDecision(AdvisoryDecision payload) {
        if (payload.decision() == null) {
            return null;
        }
        try {
            Decision decision = Decision.fromWireName(payload.decision());
            return ADVISORY_DECISIONS.contains(decision) ? payload : null;
        } catch (IllegalArgumentException e) {
            log.warn("Advisory returned unsupported decision '{}'", payload.decision());
            return null;
        }
    }

    private void record(String purpose, AdvisoryOutcome<?> outcome) {
        if (metrics != null) {
            metrics.recordAdvisoryCall(purpose, outcome.isSuccess() && outcome.value() != null);
        }
    }

    private String patternList(List<String> patterns) {
        List<String> capped = patterns.stream()
                .limit(properties.getMaxScopePatterns())
                .map(this::truncate)
                .toList();
        try {
            return mapper.writeValueAsString(capped);
        } catch (JsonProcessingException e) {
            return capped.toString();
        }
    }

    private String truncate(String value) {
        if (value == null) {
            return "";
        }
        int max = properties.getMaxFieldLength();
        return value.length() > max ? value.substring(0, max) : value;
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : value;
    }
}
