package com.delta.digest.tracker.api;

import com.delta.digest.tracker.dispatch.ContinuationPublisher;
import com.delta.digest.tracker.model.DiscoverBatchRequest;
import com.delta.digest.tracker.model.FetchBatchRequest;
import com.delta.digest.tracker.model.FinalizeRequest;
import com.delta.digest.tracker.model.PhaseResult;
import com.delta.digest.tracker.security.RequestVerifier;
import com.delta.digest.tracker.service.DiscoverPhaseService;
import com.delta.digest.tracker.service.FetchPhaseService;
import com.delta.digest.tracker.service.FinalizePhaseService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
public class JobPhaseController {
    private final RequestVerifier verifier;
    private final ObjectMapper objectMapper;
    private final DiscoverPhaseService discoverService;
    private final FetchPhaseService fetchService;
    private final FinalizePhaseService finalizeService;

    public JobPhaseController(
        RequestVerifier verifier,
        ObjectMapper objectMapper,
        DiscoverPhaseService discoverService,
        FetchPhaseService fetchService,
        FinalizePhaseService finalizeService
    ) {
        this.verifier = verifier;
        this.objectMapper = objectMapper;
        this.discoverService = discoverService;
        this.fetchService = fetchService;
        this.finalizeService = finalizeService;
    }

    @PostMapping(ContinuationPublisher.DISCOVER_PATH)
    public PhaseResult discover(
        @RequestBody(required = false) String body,
        @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
        @RequestHeader(name = RequestVerifier.LOCAL_DEV_HEADER, required = false) String localDev,
        @RequestHeader(name = RequestVerifier.SIGNATURE_HEADER, required = false) String signature
    ) {
        verifier.verify(authorization, localDev, signature, body, ContinuationPublisher.DISCOVER_PATH);
        DiscoverBatchRequest request = parse(body, DiscoverBatchRequest.class);
        requireJobId(request.jobId());
        return discoverService.discover(request);
    }

    @PostMapping(ContinuationPublisher.FETCH_PATH)
    public PhaseResult fetch(
        @RequestBody(required = false) String body,
        @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
        @RequestHeader(name = RequestVerifier.LOCAL_DEV_HEADER, required = false) String localDev,
        @RequestHeader(name = RequestVerifier.SIGNATURE_HEADER, required = false) String signature
    ) {
        verifier.verify(authorization, localDev, signature, body, ContinuationPublisher.FETCH_PATH);
        FetchBatchRequest request = parse(body, FetchBatchRequest.class);
        requireJobId(request.jobId());
        return fetchService.fetch(request);
    }

    @PostMapping(ContinuationPublisher.FINALIZE_PATH)
    public PhaseResult finalizeJob(
        @RequestBody(required = false) String body,
        @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
        @RequestHeader(name = RequestVerifier.LOCAL_DEV_HEADER, required = false) String localDev,
        @RequestHeader(name = RequestVerifier.SIGNATURE_HEADER, required = false) String signature
    ) {
        verifier.verify(authorization, localDev, signature, body, ContinuationPublisher.FINALIZE_PATH);
        FinalizeRequest request = parse(body, FinalizeRequest.class);
        requireJobId(request.jobId());
        return finalizeService.finalizeJob(request);
    }

    private <T> T parse(String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "Request body is required");
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Malformed request body");
        }
    }

    private void requireJobId(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "jobId is required");
        }
    }
}
