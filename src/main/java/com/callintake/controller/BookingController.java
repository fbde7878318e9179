package com.callintake.controller;

import com.callintake.domain.model.AppointmentIntent;
import com.callintake.dto.BookingRequest;
import com.callintake.dto.BookingResponse;
import com.callintake.service.AppointmentOrchestrator;
import com.callintake.service.AppointmentPayloadNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class BookingController {

    private final AppointmentPayloadNormalizer normalizer;
    private final AppointmentOrchestrator orchestrator;

    @PostMapping(value = "/booking", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BookingResponse> book(@RequestBody BookingRequest request) {
        log.info("Accepted booking request. date={}, time={}, hasEmail={}",
                request.preferredDate(), request.preferredTime(), request.email() != null);

        AppointmentIntent intent = normalizer.normalize(request);
        return ResponseEntity.ok(BookingResponse.from(orchestrator.process(intent)));
    }
}
