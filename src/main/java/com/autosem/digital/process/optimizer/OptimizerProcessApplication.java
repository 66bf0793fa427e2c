package com.autosem.digital.process.optimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OptimizerProcessApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptimizerProcessApplication.class, args);
    }
}
