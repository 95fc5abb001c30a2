package com.example.careplan.regional.config;

import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.regional.model.RegionalCostTable;
import com.example.careplan.regional.service.RegionalCostTableLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RegionalConfig {

    /**
     * Regional multiplier tables, loaded once at startup.
     */
    @Bean
    public RegionalCostTable regionalCostTable(RegionalCostTableLoader loader, CarePlanProperties properties) {
        return loader.load(properties.getRegional().getConfigLocation());
    }
}
