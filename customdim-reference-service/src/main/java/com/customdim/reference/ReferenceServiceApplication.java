package com.customdim.reference;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = {"com.customdim"})
public class ReferenceServiceApplication {

    public static void main(String[] args) {
        long maxMemory = Runtime.getRuntime().maxMemory();
        log.info("Max memory: {} MB", maxMemory / 1_048_576L);
        SpringApplication.run(ReferenceServiceApplication.class, args);
    }
}
