package dev.jobaggregator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class JobAggregatorApplication implements CommandLineRunner {

    private final PipelineRunner pipelineRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(JobAggregatorApplication.class, args);
    }

    @Override
    public void run(String... args) {
        int status;
        try {
            status = pipelineRunner.execute(args);
        } catch (RuntimeException e) {
            log.error("Job Aggregator failed: {}", e.getMessage(), e);
            status = PipelineRunner.EXIT_FAILURE;
        }
        exitManager.exit(status);
    }
}
