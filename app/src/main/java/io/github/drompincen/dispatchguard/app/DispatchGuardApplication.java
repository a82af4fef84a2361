package io.github.drompincen.dispatchguard.app;

import io.github.drompincen.dispatchguard.runtime.settings.DispatchDefaultsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.dispatchguard")
@EnableMongoRepositories(basePackages = "io.github.drompincen.dispatchguard.persistence.repository")
@EnableConfigurationProperties(DispatchDefaultsProperties.class)
@EnableScheduling
public class DispatchGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(DispatchGuardApplication.class, args);
    }
}
