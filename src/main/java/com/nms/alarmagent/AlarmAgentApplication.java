package com.nms.alarmagent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the NMS Alarm Agent.
 *
 * Keeps an API token and an alarm/fault subscription alive against the network-management
 * system and exports every event published on the subscription topic to a JSON Lines log.
 */
@Slf4j
@SpringBootApplication
public class AlarmAgentApplication {

    public static void main(String[] args) {
        log.info("Starting Alarm Agent Application...");
        SpringApplication.run(AlarmAgentApplication.class, args);
        log.info("Alarm Agent Application started successfully");
    }
}
