package com.portbuilder.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortbuilderApplication {

    /**
     * Builds the ports named on the command line and exits with the run's
     * status.
     *
     * To run:
     *   java -jar orchestrator.jar --portbuilder.no-op=true www/curl devel/git
     */
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PortbuilderApplication.class, args)));
    }
}
