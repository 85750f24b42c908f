package com.aqiforecast;

import com.aqiforecast.cli.RetrainCommand;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AqiForecastApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(AqiForecastApplication.class, args);
        if (new DefaultApplicationArguments(args).containsOption(RetrainCommand.OPTION)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
