package io.github.drompincen.aigov.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.aigov")
@EnableMongoRepositories(basePackages = "io.github.drompincen.aigov.persistence.repository")
@EnableScheduling
public class AiGovernanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiGovernanceApplication.class, args);
    }
}
