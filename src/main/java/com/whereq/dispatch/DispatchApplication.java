package com.whereq.dispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Dispatch.
 * This service tracks and controls long-running jobs on a remote search head:
 * status reads, waits with timeout and cancellation, and lifecycle control.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class DispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DispatchApplication.class, args);
    }
}
