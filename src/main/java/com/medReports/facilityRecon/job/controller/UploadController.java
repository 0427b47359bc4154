package com.medReports.facilityRecon.job.controller;

import com.medReports.facilityRecon.extract.model.ExtractType;
import com.medReports.facilityRecon.job.dto.UploadResponse;
import com.medReports.facilityRecon.job.exception.UnreadableUploadException;
import com.medReports.facilityRecon.job.model.JobState;
import com.medReports.facilityRecon.job.model.UploadedExtract;
import com.medReports.facilityRecon.job.service.JobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Upload REST controller - thin HTTP layer that turns multipart uploads into jobs.
 */
@RestController
@RequestMapping("/api/v1/uploads")
@RequiredArgsConstructor
public class UploadController {

    private final JobService jobService;

    /**
     * Accepts one upload of extract files and starts a reconciliation job.
     *
     * @return 202 with the job id and the URL to poll
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(
            @RequestParam(value = "adtFiles", required = false) List<MultipartFile> adtFiles,
            @RequestParam(value = "losFiles", required = false) List<MultipartFile> losFiles,
            @RequestParam(value = "visitFiles", required = false) List<MultipartFile> visitFiles,
            @RequestParam(value = "assessmentFiles", required = false) List<MultipartFile> assessmentFiles) {

        List<UploadedExtract> uploads = new ArrayList<>();
        collect(uploads, ExtractType.ADMISSION_DISCHARGE_TRANSFER, adtFiles);
        collect(uploads, ExtractType.LENGTH_OF_STAY, losFiles);
        collect(uploads, ExtractType.CHARGE_CAPTURE, visitFiles);
        collect(uploads, ExtractType.FUNCTIONAL_ASSESSMENT, assessmentFiles);

        JobState job = jobService.submit(uploads);
        UploadResponse response = UploadResponse.builder()
                .jobId(job.getJobId())
                .statusUrl("/api/v1/jobs/" + job.getJobId())
                .files(job.getFiles())
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    private static void collect(List<UploadedExtract> uploads, ExtractType type, List<MultipartFile> files) {
        if (files == null) {
            return;
        }
        for (MultipartFile file : files) {
            if (file == null || file.isEmpty()) {
                continue;
            }
            try {
                uploads.add(new UploadedExtract(type, file.getOriginalFilename(), file.getBytes()));
            } catch (IOException e) {
                throw new UnreadableUploadException("Could not read uploaded file '" + file.getOriginalFilename() + "'", e);
            }
        }
    }
}
