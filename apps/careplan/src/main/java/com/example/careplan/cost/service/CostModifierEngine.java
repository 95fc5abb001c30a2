package com.example.careplan.cost.service;

import com.example.careplan.common.util.Money;
import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.config.CarePlanProperties.FlagMapping;
import com.example.careplan.config.CarePlanProperties.Modifier;
import com.example.careplan.cost.model.CareSetting;
import com.example.careplan.cost.model.CostAdjustment;
import com.example.careplan.cost.model.ModifierResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Applies cost modifiers cumulatively: each percentage applies to the running total left by
 * the previous one, in a fixed configured order, so the same flags always produce the same
 * itemization.
 */
@Slf4j
@Service
public class CostModifierEngine {

    private final List<String> order;
    private final String highAcuityFlag;
    private final Map<String, Modifier> modifiers;
    private final Map<String, Set<String>> flagMappings;

    public CostModifierEngine(CarePlanProperties properties) {
        CarePlanProperties.Cost cost = properties.getCost();
        this.order = List.copyOf(new LinkedHashSet<>(cost.getModifierOrder()));
        this.highAcuityFlag = cost.getHighAcuityFlag();

        Map<String, Modifier> index = new HashMap<>();
        for (Modifier modifier : cost.getModifiers()) {
            if (index.put(modifier.getFlagId(), modifier) != null) {
                throw new IllegalStateException("Duplicate cost modifier: " + modifier.getFlagId());
            }
        }
        this.modifiers = Map.copyOf(index);

        Map<String, Set<String>> mappings = new HashMap<>();
        for (FlagMapping mapping : cost.getFlagMappings()) {
            mappings.computeIfAbsent(mapping.getFlag(), k -> new LinkedHashSet<>()).add(mapping.getCostFlag());
        }
        this.flagMappings = Map.copyOf(mappings);

        for (String flagId : order) {
            if (!modifiers.containsKey(flagId)) {
                log.warn("Cost modifier '{}' is ordered but has no percentages configured", flagId);
            }
        }
        log.info("Cost modifier engine initialized: order={}, modifiers={}, mappings={}",
                order, modifiers.size(), flagMappings.size());
    }

    /**
     * Translate care plan flags into cost flag ids. Flags that already are cost flags pass
     * through; flags with no mapping are dropped.
     */
    @NonNull
    public Set<String> costFlagsFor(@NonNull Collection<String> carePlanFlags) {
        Set<String> costFlags = new TreeSet<>();
        for (String flag : carePlanFlags) {
            if (modifiers.containsKey(flag)) {
                costFlags.add(flag);
            }
            costFlags.addAll(flagMappings.getOrDefault(flag, Set.of()));
        }
        costFlags.remove(highAcuityFlag);
        return costFlags;
    }

    @NonNull
    public ModifierResult apply(@NonNull BigDecimal base, @NonNull Collection<String> costFlags,
                                @NonNull CareSetting setting) {
        Set<String> active = new LinkedHashSet<>(costFlags);
        List<CostAdjustment> adjustments = new ArrayList<>();
        BigDecimal running = base;

        for (String flagId : order) {
            if (active.remove(flagId)) {
                running = step(flagId, running, setting, adjustments);
            }
        }
        active.remove(highAcuityFlag);
        if (!active.isEmpty()) {
            log.debug("Ignoring cost flags without an ordered modifier: {}", active);
        }

        if (setting == CareSetting.MEMORY_CARE_HIGH_ACUITY) {
            running = step(highAcuityFlag, running, setting, adjustments);
        }

        return new ModifierResult(adjustments, running);
    }

    private BigDecimal step(String flagId, BigDecimal running, CareSetting setting, List<CostAdjustment> adjustments) {
        Modifier modifier = modifiers.get(flagId);
        BigDecimal percentage = modifier == null ? null : modifier.percentageFor(setting);
        if (percentage == null || percentage.signum() == 0) {
            return running;
        }
        BigDecimal amount = running.multiply(percentage, MathContext.DECIMAL64);
        BigDecimal next = running.add(amount, MathContext.DECIMAL64);
        adjustments.add(new CostAdjustment(
                flagId,
                percentage,
                Money.cents(amount),
                Money.cents(next),
                modifier.getLabel(),
                modifier.getRationale()));
        return next;
    }
}
