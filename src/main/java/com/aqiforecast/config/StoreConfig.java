package com.aqiforecast.config;

import com.aqiforecast.store.JpaModelRunStore;
import com.aqiforecast.store.ModelRunStore;
import com.aqiforecast.store.RetryingModelRunStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class StoreConfig {

    @Bean
    @Primary
    public ModelRunStore modelRunStore(JpaModelRunStore jpaModelRunStore, ForecastProperties properties) {
        return new RetryingModelRunStore(jpaModelRunStore, properties.getPersistence());
    }
}
