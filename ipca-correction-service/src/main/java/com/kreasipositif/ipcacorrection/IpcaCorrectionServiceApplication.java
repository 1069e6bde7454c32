package com.kreasipositif.ipcacorrection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class IpcaCorrectionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(IpcaCorrectionServiceApplication.class, args);
    }
}
