package com.example.careplan.flag.service;

import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.flag.model.Flag;
import com.example.careplan.flag.model.FlagTone;
import com.example.careplan.gate.service.GateEvaluator;
import com.example.careplan.intake.model.Answers;
import com.example.careplan.intake.service.IntakeCatalog;
import com.example.careplan.util.CarePlanTestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.careplan.util.AnswersTestBuilder.anAnswers;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FlagDeriver")
class FlagDeriverTest {

    private FlagSchema schema;
    private FlagDeriver deriver;
    private GateEvaluator gateEvaluator;

    @BeforeEach
    void setUp() {
        schema = new FlagSchema(CarePlanTestProperties.flagSchema());
        deriver = new FlagDeriver(new IntakeCatalog(CarePlanTestProperties.intakeCatalog()), schema);
        gateEvaluator = new GateEvaluator(new CarePlanProperties());
    }

    private List<Flag> derive(Answers answers) {
        return deriver.derive(answers, gateEvaluator.evaluate(answers));
    }

    @Test
    @DisplayName("should raise flags from selected options once each")
    void shouldRaiseOptionFlags() {
        List<Flag> flags = derive(anAnswers()
                .with("falls", "multiple")
                .with("chronic_conditions", List.of("diabetes", "copd"))
                .build());

        assertThat(flags).extracting(Flag::id).containsExactly("falls_multiple", "chronic_present");
    }

    @Test
    @DisplayName("should add a dependence flag from the support band")
    void shouldAddDependenceFlag() {
        assertThat(derive(anAnswers().withHoursPerDay("24h").build()))
                .extracting(Flag::id).containsExactly("high_dependence");
        assertThat(derive(anAnswers().withHoursPerDay("4-8h").build()))
                .extracting(Flag::id).containsExactly("moderate_dependence");
        assertThat(derive(anAnswers().build())).isEmpty();
    }

    @Test
    @DisplayName("should describe flags from the schema")
    void shouldDescribeFlagsFromSchema() {
        Flag flag = derive(anAnswers().withBehaviors("wandering").build()).get(0);

        assertThat(flag.id()).isEqualTo("high_risk");
        assertThat(flag.tone()).isEqualTo(FlagTone.CRITICAL);
        assertThat(flag.label()).isEqualTo("Safety risk behaviors");
        assertThat(flag.suggestedNextAction()).isNotBlank();
    }

    @Test
    @DisplayName("should give unknown flags a generic informational entry")
    void shouldResolveUnknownFlag() {
        Flag flag = schema.resolve("night_time_confusion");

        assertThat(flag.tone()).isEqualTo(FlagTone.INFO);
        assertThat(flag.label()).isEqualTo("Night Time Confusion");
        assertThat(flag.priority()).isEqualTo(1000);
        assertThat(schema.isDefined("night_time_confusion")).isFalse();
    }
}
