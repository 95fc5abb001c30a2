package com.example.careplan.gate.service;

import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.gate.model.AllowedTierSet;
import com.example.careplan.gate.model.Bands;
import com.example.careplan.gate.model.CognitionBand;
import com.example.careplan.gate.model.GateResult;
import com.example.careplan.gate.model.SupportBand;
import com.example.careplan.gate.model.Tier;
import com.example.careplan.intake.model.Answers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Derives cognition and support bands from intake answers and decides which tiers are
 * admissible for the person.
 *
 * <p>Gates run in a fixed order: the cognitive gate, the optional moderate/high gate, then the
 * behavior gate last so it can force memory-care tiers back in. The three non-memory-care
 * tiers are never removed.
 */
@Slf4j
@Service
public class GateEvaluator {

    static final String MEMORY_CHANGES = "memory_changes";
    static final String DIAGNOSIS_CONFIRM = "cognitive_dx_confirm";
    static final String HOURS_PER_DAY = "hours_per_day";
    static final String BADLS = "badls";
    static final String IADLS = "iadls";

    private static final String DIAGNOSIS_CONFIRMED = "dx_yes";

    private final CarePlanProperties.Gates gates;

    public GateEvaluator(CarePlanProperties properties) {
        this.gates = properties.getGates();
    }

    @NonNull
    public GateResult evaluate(@NonNull Answers answers) {
        CognitionBand cognition = cognitionBand(answers);
        SupportBand support = supportBand(answers);
        boolean risky = hasRiskyBehavior(answers);

        Set<Tier> allowed = EnumSet.allOf(Tier.class);

        if (!cognition.atLeast(CognitionBand.MODERATE) && !risky) {
            allowed.removeAll(Tier.memoryCareTiers());
        }

        if (gates.isModerateHighBehaviorGate()
                && cognition == CognitionBand.MODERATE
                && support == SupportBand.HIGH
                && !risky) {
            allowed.removeAll(Tier.memoryCareTiers());
        }

        if (risky && cognition.atLeast(CognitionBand.MODERATE)) {
            allowed.addAll(Tier.memoryCareTiers());
        }

        allowed.add(Tier.NO_CARE_NEEDED);
        allowed.add(Tier.IN_HOME);
        allowed.add(Tier.ASSISTED_LIVING);

        GateResult result = new GateResult(new Bands(cognition, support), AllowedTierSet.of(allowed), risky);
        log.debug("Gates: cognition={}, support={}, risky={}, allowed={}",
                cognition.code(), support.code(), risky, result.allowed());
        return result;
    }

    @NonNull
    CognitionBand cognitionBand(@NonNull Answers answers) {
        CognitionBand band = answers.text(MEMORY_CHANGES)
                .map(this::toCognitionBand)
                .orElse(CognitionBand.NONE);

        // An unconfirmed severe report is treated as moderate
        if (band == CognitionBand.SEVERE
                && !answers.text(DIAGNOSIS_CONFIRM).map(DIAGNOSIS_CONFIRMED::equals).orElse(false)) {
            return CognitionBand.MODERATE;
        }
        return band;
    }

    @NonNull
    SupportBand supportBand(@NonNull Answers answers) {
        String hours = answers.text(HOURS_PER_DAY).orElse("");
        int badls = answers.list(BADLS).size();
        int iadls = answers.list(IADLS).size();

        if ("24h".equals(hours) || badls >= 3 || badls + iadls >= 6) {
            return SupportBand.HIGH;
        }
        if ("4-8h".equals(hours) || badls >= 1 || iadls >= 2) {
            return SupportBand.MEDIUM;
        }
        return SupportBand.LOW;
    }

    boolean hasRiskyBehavior(@NonNull Answers answers) {
        List<String> behaviors = answers.list(gates.getBehaviorsQuestion());
        return behaviors.stream().anyMatch(gates.getRiskyBehaviors()::contains);
    }

    private CognitionBand toCognitionBand(String value) {
        return switch (value) {
            case "mild" -> CognitionBand.MILD;
            case "moderate" -> CognitionBand.MODERATE;
            case "severe" -> CognitionBand.SEVERE;
            default -> CognitionBand.NONE;
        };
    }
}
