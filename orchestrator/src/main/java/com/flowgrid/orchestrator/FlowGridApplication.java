package com.flowgrid.orchestrator;

import com.flowgrid.orchestrator.service.WorkerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.UUID;

@SpringBootApplication
public class FlowGridApplication {

    private static final Logger log = LoggerFactory.getLogger(FlowGridApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(FlowGridApplication.class, args);
    }

    /**
     * Identity this process uses when claiming grid jobs. Without a configured
     * id each start gets a fresh {@code worker-xxxxxxxx}.
     */
    @Bean
    WorkerIdentity workerIdentity(@Value("${flowgrid.worker.id:}") String workerId,
                                  @Value("${flowgrid.worker.role:core}") String role) {
        String id = workerId.isBlank() ? "worker-" + UUID.randomUUID().toString().substring(0, 8) : workerId;
        WorkerIdentity identity = new WorkerIdentity(id, role);
        log.info("Grid worker {} starting with role {}", identity.workerId(), identity.role());
        return identity;
    }
}
