package com.flowlayout.flowlayout_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowlayoutBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowlayoutBackendApplication.class, args);
    }
}
