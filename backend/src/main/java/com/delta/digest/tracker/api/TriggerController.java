package com.delta.digest.tracker.api;

import com.delta.digest.tracker.model.ResetResult;
import com.delta.digest.tracker.model.TriggerResult;
import com.delta.digest.tracker.security.RequestVerifier;
import com.delta.digest.tracker.service.JobTriggerService;
import com.delta.digest.tracker.service.TrackerResetService;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class TriggerController {
    private final RequestVerifier verifier;
    private final JobTriggerService triggerService;
    private final TrackerResetService resetService;

    public TriggerController(RequestVerifier verifier, JobTriggerService triggerService, TrackerResetService resetService) {
        this.verifier = verifier;
        this.triggerService = triggerService;
        this.resetService = resetService;
    }

    @GetMapping("/cron")
    public TriggerResult trigger(
        @RequestParam(name = "force", required = false, defaultValue = "false") boolean force,
        @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
        @RequestHeader(name = RequestVerifier.LOCAL_DEV_HEADER, required = false) String localDev
    ) {
        verifier.verifyTrigger(authorization, localDev);
        return triggerService.trigger(force);
    }

    @PostMapping("/reset")
    public ResetResult reset(
        @RequestParam(name = "full", required = false, defaultValue = "false") boolean full,
        @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
        @RequestHeader(name = RequestVerifier.LOCAL_DEV_HEADER, required = false) String localDev
    ) {
        verifier.verifyTrigger(authorization, localDev);
        return resetService.reset(full);
    }
}
