package com.parasitereg;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@Slf4j
public class ParasiteRegistryApplication {

    public static void main(String[] args) {
        log.info("Starting parasite registry application");
        SpringApplication.run(ParasiteRegistryApplication.class, args);
        log.info("Parasite registry application started");
    }

}
