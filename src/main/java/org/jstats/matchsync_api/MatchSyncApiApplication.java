package org.jstats.matchsync_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MatchSyncApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(MatchSyncApiApplication.class, args);
    }
}
