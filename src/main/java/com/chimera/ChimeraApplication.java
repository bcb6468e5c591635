package com.chimera;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Chimera - resilient streaming generation pipeline.
 */
@SpringBootApplication
public class ChimeraApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChimeraApplication.class, args);
    }
}
