package io.github.dailies.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.dailies")
@EnableMongoRepositories(basePackages = "io.github.dailies.persistence.repository")
@ConfigurationPropertiesScan("io.github.dailies.gateway.config")
public class DailiesApplication {

    public static void main(String[] args) {
        SpringApplication.run(DailiesApplication.class, args);
    }
}
