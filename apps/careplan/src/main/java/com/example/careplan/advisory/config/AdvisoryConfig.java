package com.example.careplan.advisory.config;

import com.example.careplan.advisory.port.AdvisoryPort;
import com.example.careplan.advisory.port.DisabledAdvisoryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class AdvisoryConfig {

    @Bean
    @ConditionalOnMissingBean(AdvisoryPort.class)
    public AdvisoryPort disabledAdvisoryPort() {
        log.info("No advisory port configured, care plans use deterministic tiers only");
        return new DisabledAdvisoryPort();
    }
}
