package com.dnsguard.detection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DnsTunnelDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(DnsTunnelDetectionApplication.class, args);
    }
}
