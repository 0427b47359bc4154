package com.medReports.facilityRecon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FacilityReconApplication {

    public static void main(String[] args) {
        SpringApplication.run(FacilityReconApplication.class, args);
    }
}
