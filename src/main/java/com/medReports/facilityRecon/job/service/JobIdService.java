package com.medReports.facilityRecon.job.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating job ids. A job id doubles as the run id in every log line of the run.
 */
@Service
public class JobIdService {

    public String generateJobId() {
        return UUID.randomUUID().toString();
    }
}
