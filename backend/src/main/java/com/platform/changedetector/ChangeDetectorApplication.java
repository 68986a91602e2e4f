package com.platform.changedetector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Resource Change Detector
 * 
 * Polls a custom resource collection that only supports full listing and
 * turns successive snapshots into ADDED / MODIFIED / DELETED change events.
 * 
 * Features:
 * - Diffing by UID and resourceVersion
 * - Deletions emitted before additions within a cycle
 * - Fetch failures logged and skipped, never fatal
 * - Metrics and a read-only status endpoint
 */
@SpringBootApplication
public class ChangeDetectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChangeDetectorApplication.class, args);
    }
}
