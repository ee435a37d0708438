package com.intelscan.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Collection-job orchestrator: job store, lifecycle commands, worker dispatch
 * and the REST API observers poll.
 *
 * To run against a local Postgres:
 *   mvn -pl orchestrator spring-boot:run
 *
 * Without a database:
 *   mvn -pl orchestrator spring-boot:run -Dspring-boot.run.profiles=memory
 */
@SpringBootApplication
@EnableScheduling
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
