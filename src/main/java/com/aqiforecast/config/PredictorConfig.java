package com.aqiforecast.config;

import com.aqiforecast.client.RemotePredictor;
import com.aqiforecast.predictor.Predictor;
import com.aqiforecast.predictor.PredictorCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class PredictorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Remote predictors declared under {@code forecast.predictors} plus any {@link Predictor}
     * beans in the context. Configuration is validated here so a bad setup fails startup.
     */
    @Bean
    public PredictorCatalog predictorCatalog(ForecastProperties properties,
                                             ObjectProvider<Predictor> predictorBeans,
                                             Clock clock) {
        properties.validate();
        List<Predictor> predictors = new ArrayList<>();
        predictorBeans.orderedStream().forEach(predictors::add);
        for (ForecastProperties.PredictorEndpoint endpoint : properties.getPredictors()) {
            predictors.add(new RemotePredictor(
                endpoint.getId(),
                endpoint.getBaseUrl(),
                Duration.ofSeconds(endpoint.getTimeoutSeconds()),
                properties.getRetraining().getTimeout(),
                clock));
        }
        PredictorCatalog catalog = new PredictorCatalog(predictors);
        log.info("Predictor catalog ready | predictors={}", catalog.ids());
        return catalog;
    }
}
