package com.tscan.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TripletScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripletScanApplication.class, args);
    }
}
