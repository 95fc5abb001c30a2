package com.example.careplan.scoring.service;

import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.config.CarePlanProperties.TierThreshold;
import com.example.careplan.config.properties.IntakeCatalogProperties.OptionDefinition;
import com.example.careplan.config.properties.IntakeCatalogProperties.QuestionDefinition;
import com.example.careplan.gate.model.AllowedTierSet;
import com.example.careplan.gate.model.CognitionBand;
import com.example.careplan.gate.model.GateResult;
import com.example.careplan.gate.model.Tier;
import com.example.careplan.intake.model.Answers;
import com.example.careplan.intake.model.Domain;
import com.example.careplan.intake.service.IntakeCatalog;
import com.example.careplan.scoring.model.ScoreResult;
import com.example.careplan.scoring.model.TierRanking;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Weighted-sum scorer mapping intake answers to a tier through configured score bands.
 */
@Slf4j
@Service
public class DeterministicScorer {

    private static final List<Tier> FALLBACK_ORDER = List.of(Tier.ASSISTED_LIVING, Tier.IN_HOME, Tier.NO_CARE_NEEDED);
    private static final BigDecimal COMPLETENESS_WEIGHT = new BigDecimal("0.6");
    private static final BigDecimal CLARITY_WEIGHT = new BigDecimal("0.4");
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final IntakeCatalog catalog;
    private final CarePlanProperties.Scoring scoring;

    public DeterministicScorer(IntakeCatalog catalog, CarePlanProperties properties) {
        this.catalog = catalog;
        this.scoring = properties.getScoring();
    }

    @NonNull
    public ScoreResult score(@NonNull Answers answers, @NonNull GateResult gates) {
        Map<Domain, BigDecimal> domainScores = new EnumMap<>(Domain.class);
        for (Domain domain : Domain.values()) {
            domainScores.put(domain, BigDecimal.ZERO);
        }
        List<Contribution> contributions = new ArrayList<>();
        int answered = 0;

        for (QuestionDefinition question : catalog.questions()) {
            if (!answers.isAnswered(question.id())) {
                continue;
            }
            answered++;
            BigDecimal weight = scoring.getDomainWeights().weightFor(question.domain());
            for (String value : valuesOf(answers, question)) {
                Optional<OptionDefinition> option = catalog.option(question.id(), value);
                if (option.isEmpty()) {
                    continue;
                }
                BigDecimal points = option.get().score().multiply(weight, MathContext.DECIMAL64);
                domainScores.merge(question.domain(), points, BigDecimal::add);
                contributions.add(new Contribution(question.label(), option.get().label(), points));
            }
        }

        BigDecimal total = domainScores.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        Optional<TierThreshold> band = bandFor(total);
        Optional<Tier> scored = band.map(TierThreshold::getTier);

        boolean override = isConfirmedSevere(gates) && gates.riskyBehaviors();
        Optional<Tier> tier = override ? Optional.of(Tier.MEMORY_CARE) : scored;
        tier = tier.map(t -> admissible(t, gates.allowed()));

        if (band.isEmpty()) {
            log.warn("Scoring: total {} is outside every configured band", total.toPlainString());
        }

        int catalogSize = catalog.questions().size();
        BigDecimal completeness = catalogSize == 0
                ? BigDecimal.ONE
                : BigDecimal.valueOf(answered).divide(BigDecimal.valueOf(catalogSize), MathContext.DECIMAL64);

        ScoreResult result = new ScoreResult(
                tier,
                domainScores,
                total,
                rankings(total, band),
                summaryPoints(contributions),
                confidence(completeness, total, band),
                override
        );

        log.debug("Scoring: total={}, scoredTier={}, tier={}, override={}",
                total.toPlainString(),
                scored.map(Tier::getCode).orElse("none"),
                tier.map(Tier::getCode).orElse("none"),
                override);
        return result;
    }

    private List<String> valuesOf(Answers answers, QuestionDefinition question) {
        if (answers.isList(question.id())) {
            return answers.list(question.id());
        }
        return answers.text(question.id()).map(List::of).orElse(List.of());
    }

    private Optional<TierThreshold> bandFor(BigDecimal total) {
        return scoring.getThresholds().stream()
                .filter(t -> t.contains(total))
                .findFirst();
    }

    private boolean isConfirmedSevere(GateResult gates) {
        // The gate downgrades an unconfirmed severe report, so a severe band implies dx_yes
        return gates.bands().cognition() == CognitionBand.SEVERE;
    }

    private Tier admissible(Tier tier, AllowedTierSet allowed) {
        if (allowed.contains(tier)) {
            return tier;
        }
        Tier fallback = FALLBACK_ORDER.stream()
                .filter(allowed::contains)
                .findFirst()
                .orElse(Tier.SAFE_DEFAULT);
        log.debug("Scoring: tier {} not admissible, falling back to {}", tier.getCode(), fallback.getCode());
        return fallback;
    }

    private List<TierRanking> rankings(BigDecimal total, Optional<TierThreshold> winner) {
        List<TierRanking> rankings = new ArrayList<>();
        for (TierThreshold threshold : scoring.getThresholds()) {
            if (winner.isPresent() && winner.get().getTier() == threshold.getTier()) {
                rankings.add(new TierRanking(threshold.getTier(), total.setScale(1, RoundingMode.HALF_UP)));
            } else {
                rankings.add(new TierRanking(threshold.getTier(), midpoint(threshold)));
            }
        }
        rankings.sort(Comparator.comparing(TierRanking::score).reversed());
        return rankings;
    }

    private BigDecimal midpoint(TierThreshold threshold) {
        if (threshold.getMax() == null) {
            return BigDecimal.valueOf(threshold.getMin()).setScale(1, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(threshold.getMin() + (long) threshold.getMax())
                .divide(TWO, 1, RoundingMode.HALF_UP);
    }

    private List<String> summaryPoints(List<Contribution> contributions) {
        return contributions.stream()
                .filter(c -> c.points().signum() > 0)
                .sorted(Comparator.comparing(Contribution::points).reversed())
                .limit(scoring.getMaxSummaryPoints())
                .map(c -> c.question() + ": " + c.answer())
                .toList();
    }

    private BigDecimal confidence(BigDecimal completeness, BigDecimal total, Optional<TierThreshold> band) {
        BigDecimal clarity = band.map(b -> clarity(total, b)).orElse(BigDecimal.ZERO);
        BigDecimal confidence = completeness.multiply(COMPLETENESS_WEIGHT)
                .add(clarity.multiply(CLARITY_WEIGHT));
        return confidence.max(scoring.getConfidenceFloor()).min(BigDecimal.ONE).setScale(2, RoundingMode.HALF_UP);
    }

    private BigDecimal clarity(BigDecimal total, TierThreshold band) {
        BigDecimal fromMin = total.subtract(BigDecimal.valueOf(band.getMin()));
        BigDecimal distance = band.getMax() == null
                ? fromMin
                : fromMin.min(BigDecimal.valueOf(band.getMax()).subtract(total));
        if (distance.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return distance.divide(scoring.getClarityDistance(), MathContext.DECIMAL64).min(BigDecimal.ONE);
    }

    private record Contribution(String question, String answer, BigDecimal points) {
    }
}
