package com.example.careplan.careplan.service;

import com.example.careplan.adjudication.model.AdjudicationDecision;
import com.example.careplan.adjudication.model.ReasonCode;
import com.example.careplan.adjudication.service.TierAdjudicator;
import com.example.careplan.advisory.model.AdjudicationContext;
import com.example.careplan.advisory.model.AdvisoryOpinion;
import com.example.careplan.advisory.service.AdvisoryClient;
import com.example.careplan.careplan.model.CarePlan;
import com.example.careplan.common.util.StringSanitizer;
import com.example.careplan.flag.model.Flag;
import com.example.careplan.flag.service.FlagDeriver;
import com.example.careplan.gate.model.GateResult;
import com.example.careplan.gate.service.GateEvaluator;
import com.example.careplan.intake.model.Answers;
import com.example.careplan.intake.service.IntakeValidator;
import com.example.careplan.journey.service.ProductUnlockService;
import com.example.careplan.observability.metrics.BusinessMetrics;
import com.example.careplan.scoring.model.ScoreResult;
import com.example.careplan.scoring.service.DeterministicScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one intake through gates, scoring, advisory and adjudication to produce a care plan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CarePlanService {

    private final IntakeValidator validator;
    private final GateEvaluator gateEvaluator;
    private final DeterministicScorer scorer;
    private final AdvisoryClient advisoryClient;
    private final TierAdjudicator adjudicator;
    private final FlagDeriver flagDeriver;
    private final ProductUnlockService unlockService;
    private final BusinessMetrics metrics;
    private final Clock clock;

    @NonNull
    public Mono<CarePlan> computeCarePlan(@NonNull String personId, @NonNull Answers answers) {
        return Mono.fromCallable(() -> evaluate(answers))
                .flatMap(evaluation -> advisoryClient.advise(evaluation.context())
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty())
                        .map(advisory -> assemble(personId, answers, evaluation, advisory)))
                .doOnNext(plan -> {
                    metrics.recordCarePlan(plan.isDegraded());
                    log.info("Care plan {} computed for person {}: tier={}, source={}, reason={}",
                            plan.carePlanId(),
                            StringSanitizer.forLog(personId),
                            plan.finalTier().getCode(),
                            plan.adjudication().source().code(),
                            plan.adjudication().reason());
                });
    }

    private Evaluation evaluate(Answers answers) {
        validator.validate(answers);
        GateResult gates = gateEvaluator.evaluate(answers);
        ScoreResult score = scorer.score(answers, gates);
        AdjudicationContext context = new AdjudicationContext(
                gates.bands(), gates.allowed(), score.domainScores(), gates.riskyBehaviors());
        return new Evaluation(gates, score, context);
    }

    private CarePlan assemble(String personId, Answers answers, Evaluation evaluation,
                              Optional<AdvisoryOpinion> advisory) {
        GateResult gates = evaluation.gates();
        ScoreResult score = evaluation.score();

        AdjudicationDecision decision = adjudicator.adjudicate(
                score.deterministicTier(), advisory, gates.allowed(), gates.riskyBehaviors());
        List<Flag> flags = flagDeriver.derive(answers, gates);

        CarePlan plan = CarePlan.builder()
                .carePlanId(UUID.randomUUID().toString())
                .personId(personId)
                .finalTier(decision.finalTier())
                .confidence(score.confidence())
                .allowedTiers(gates.allowed())
                .bands(gates.bands())
                .flags(flags)
                .rationale(rationale(score, decision))
                .adjudication(decision)
                .domainScores(score.domainScores())
                .totalScore(score.totalScore())
                .tierRankings(score.tierRankings())
                .createdAt(Instant.now(clock))
                .build();
        return plan.toBuilder()
                .suggestedNextProduct(unlockService.suggestedNextProduct(plan))
                .build();
    }

    private List<String> rationale(ScoreResult score, AdjudicationDecision decision) {
        List<String> lines = new ArrayList<>();
        lines.add("Based on " + score.totalScore().setScale(0, RoundingMode.HALF_UP).toPlainString()
                + " points, we recommend: " + decision.finalTier().getDisplayName());

        if (score.overrideApplied()) {
            lines.add("A confirmed severe cognitive diagnosis with risky behaviors calls for memory care");
        }

        if (decision.reason() == ReasonCode.DOUBLE_MISSING_DEFAULT) {
            lines.add("No tier could be determined, so "
                    + decision.finalTier().getDisplayName() + " is shown as a placeholder");
        } else if (decision.reason() == ReasonCode.ADVISORY_TIER_NOT_ALLOWED) {
            lines.add("The advisory suggestion was not permitted for this profile and was set aside");
        }

        lines.addAll(score.summaryPoints());
        return lines;
    }

    private record Evaluation(GateResult gates, ScoreResult score, AdjudicationContext context) {
    }
}
