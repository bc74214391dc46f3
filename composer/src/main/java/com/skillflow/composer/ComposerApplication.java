package com.skillflow.composer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class ComposerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComposerApplication.class, args);
    }

    /**
     * Source of started_at / completed_at for execution records.
     * A bean so tests can pin time with Clock.fixed(...).
     */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
