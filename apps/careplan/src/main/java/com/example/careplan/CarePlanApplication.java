package com.example.careplan;

import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.config.properties.FlagSchemaProperties;
import com.example.careplan.config.properties.IntakeCatalogProperties;
import com.example.careplan.config.properties.JourneyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        CarePlanProperties.class,
        IntakeCatalogProperties.class,
        FlagSchemaProperties.class,
        JourneyProperties.class
})
public class CarePlanApplication {

    public static void main(String[] args) {
        SpringApplication.run(CarePlanApplication.class, args);
    }

}
