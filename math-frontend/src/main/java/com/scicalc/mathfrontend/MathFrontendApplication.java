package com.scicalc.mathfrontend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MathFrontendApplication {

    private static final Logger log = LoggerFactory.getLogger(MathFrontendApplication.class);

    public static void main(String[] args) {
        log.info("Starting SciCalc math front end...");
        SpringApplication.run(MathFrontendApplication.class, args);
        log.info("Application startup completed");
    }
}
