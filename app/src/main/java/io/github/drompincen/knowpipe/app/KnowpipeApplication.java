package io.github.drompincen.knowpipe.app;

import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.knowpipe")
@EnableMongoRepositories(basePackages = "io.github.drompincen.knowpipe.persistence.repository")
@EnableConfigurationProperties(PipelineProperties.class)
@EnableScheduling
public class KnowpipeApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowpipeApplication.class, args);
    }
}
