package com.radoncal.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
public class RadonCalibrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(RadonCalibrationApplication.class, args);
    }
}
