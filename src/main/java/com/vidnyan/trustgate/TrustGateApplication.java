package com.vidnyan.trustgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TrustGate - multi-language static verification engine.
 *
 * Parses code into a language-agnostic tree, derives program graphs and
 * evaluates security and correctness rules without executing anything.
 */
@SpringBootApplication
public class TrustGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustGateApplication.class, args);
    }
}
