package com.work.txpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TxPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TxPipelineApplication.class, args);
    }
}
