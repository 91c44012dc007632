package com.jreinhal.quarry;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class QuarryApplication {
    private static final Logger log = LoggerFactory.getLogger(QuarryApplication.class);
    private final Environment environment;

    public QuarryApplication(Environment environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(QuarryApplication.class, (String[])args);
    }

    @PostConstruct
    public void logReaderConfiguration() {
        String timeoutMs = this.environment.getProperty("quarry.retrieval.timeout-ms", "8000");
        String vectorEnabled = this.environment.getProperty("quarry.retrieval.vector-enabled", "true");
        String fallbackEnabled = this.environment.getProperty("quarry.fallback.enabled", "true");
        log.info("Quarry reader pipeline starting (retrievalTimeoutMs={}, vectorChannel={}, generativeFallback={})", new Object[]{timeoutMs, vectorEnabled, fallbackEnabled});
    }
}
