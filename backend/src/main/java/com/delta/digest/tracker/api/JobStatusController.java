package com.delta.digest.tracker.api;

import com.delta.digest.tracker.model.JobStatusResponse;
import com.delta.digest.tracker.service.DigestPreviewService;
import com.delta.digest.tracker.service.JobStatusService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class JobStatusController {
    private final JobStatusService statusService;
    private final DigestPreviewService previewService;

    public JobStatusController(JobStatusService statusService, DigestPreviewService previewService) {
        this.statusService = statusService;
        this.previewService = previewService;
    }

    @GetMapping("/job/status")
    public JobStatusResponse status(
        @RequestParam(name = "jobId", required = false) String jobId,
        @RequestParam(name = "items", required = false, defaultValue = "false") boolean includeItems
    ) {
        return statusService.status(jobId, includeItems);
    }

    @GetMapping(value = "/preview", produces = MediaType.TEXT_HTML_VALUE)
    public String preview(@RequestParam(name = "jobId", required = false) String jobId) {
        return previewService.preview(jobId);
    }
}
