package com.ble.cube;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point hosting the in-memory observation cube.
 */
@SpringBootApplication
public class BleCubeApplication {

    public static void main(String[] args) {
        SpringApplication.run(BleCubeApplication.class, args);
    }
}
