package com.medReports.facilityRecon.job.controller;

import com.medReports.facilityRecon.job.dto.JobStatusResponse;
import com.medReports.facilityRecon.job.exception.ArtifactNotReadyException;
import com.medReports.facilityRecon.job.exception.JobNotFoundException;
import com.medReports.facilityRecon.job.exception.NoFilesUploadedException;
import com.medReports.facilityRecon.job.model.JobState;
import com.medReports.facilityRecon.job.model.JobStatus;
import com.medReports.facilityRecon.job.model.UploadedExtract;
import com.medReports.facilityRecon.job.service.JobService;
import com.medReports.facilityRecon.extract.model.ExtractType;
import com.medReports.facilityRecon.reconcile.model.RunStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class JobControllerTest {

    @Mock
    private JobService jobService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new JobController(jobService), new UploadController(jobService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void upload_shouldAcceptFilesAndReturnThePollingUrl() throws Exception {
        // GIVEN
        when(jobService.submit(anyList())).thenReturn(JobState.builder()
                .jobId("job-1")
                .status(JobStatus.UPLOADED)
                .files(List.of("visits.csv", "los.csv"))
                .build());

        // WHEN / THEN
        mockMvc.perform(multipart("/api/v1/uploads")
                        .file(new MockMultipartFile("visitFiles", "visits.csv", "text/csv", "First,Last\nAnn,Lee".getBytes()))
                        .file(new MockMultipartFile("losFiles", "los.csv", "text/csv", "First,Last\nAnn,Lee".getBytes()))
                        .file(new MockMultipartFile("adtFiles", "adt.csv", "text/csv", new byte[0])))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job-1"))
                .andExpect(jsonPath("$.statusUrl").value("/api/v1/jobs/job-1"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<UploadedExtract>> uploads = ArgumentCaptor.forClass(List.class);
        verify(jobService).submit(uploads.capture());
        assertThat(uploads.getValue())
                .extracting(UploadedExtract::type)
                .containsExactly(ExtractType.LENGTH_OF_STAY, ExtractType.CHARGE_CAPTURE);
    }

    @Test
    void upload_shouldReturnBadRequestWithoutFiles() throws Exception {
        when(jobService.submit(anyList())).thenThrow(new NoFilesUploadedException("At least one extract file is required"));

        mockMvc.perform(multipart("/api/v1/uploads"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NO_FILES_UPLOADED"));
    }

    @Test
    void status_shouldReturnTheJobSnapshot() throws Exception {
        when(jobService.getStatus("job-1")).thenReturn(JobStatusResponse.builder()
                .jobId("job-1")
                .status(JobStatus.PROCESSING)
                .progress(45)
                .stage(RunStage.MATCHED)
                .files(List.of("visits.csv"))
                .issueCounts(Map.of())
                .errors(List.of())
                .build());

        mockMvc.perform(get("/api/v1/jobs/job-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PROCESSING"))
                .andExpect(jsonPath("$.progress").value(45))
                .andExpect(jsonPath("$.stage").value("MATCHED"));
    }

    @Test
    void status_shouldReturnNotFoundForAnUnknownJob() throws Exception {
        when(jobService.getStatus("missing")).thenThrow(new JobNotFoundException("No job found with id missing"));

        mockMvc.perform(get("/api/v1/jobs/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("JOB_NOT_FOUND"));
    }

    @Test
    void summary_shouldDownloadCsvOnceCompleted() throws Exception {
        when(jobService.getSummaryCsv("job-1")).thenReturn("Facility,Patients Served\r\n");

        mockMvc.perform(get("/api/v1/jobs/job-1/summary.csv"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"facility_summary.csv\""))
                .andExpect(content().string("Facility,Patients Served\r\n"));
    }

    @Test
    void allPatients_shouldReturnConflictWhileTheJobRuns() throws Exception {
        when(jobService.getAllPatientsCsv("job-1")).thenThrow(new ArtifactNotReadyException("Job job-1 is PROCESSING; artifacts are not ready"));

        mockMvc.perform(get("/api/v1/jobs/job-1/all-patients.csv"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ARTIFACT_NOT_READY"));
    }
}
