package com.spendmonitor.monitor.application.controller.spendcheck;

import com.spendmonitor.common.event.SpendCheckRequest;
import com.spendmonitor.monitor.application.controller.spendcheck.mapper.SpendCheckResponseMapper;
import com.spendmonitor.monitor.application.service.SpendCheckCoordinator;
import com.spendmonitor.monitor.domain.exceptions.NotFoundException;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runs a spend check on demand. The call blocks until the run finishes or its time
 * budget runs out.
 */
@RestController
@RequestMapping("/api/v1/spend-checks")
@RequiredArgsConstructor
public class SpendCheckController {

    private final SpendCheckCoordinator coordinator;
    private final SpendCheckResponseMapper mapper;
    private final Clock clock;

    @PostMapping
    public SpendCheckResponse run(@Valid @RequestBody(required = false) SpendCheckRequestBody body) {
        var builder = SpendCheckRequest.builder().requestedAt(clock.instant());
        if (body != null) {
            builder.threshold(body.threshold())
                    .periodStart(body.periodStart())
                    .periodEnd(body.periodEnd());
        }
        return mapper.toResponse(coordinator.runCheck(builder.build()));
    }

    @GetMapping
    public Set<String> inFlight() {
        return coordinator.inFlightRequests();
    }

    @DeleteMapping("/{requestId}")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void cancel(@PathVariable String requestId) {
        if (!coordinator.cancel(requestId)) {
            throw NotFoundException.of("No spend check in flight with id " + requestId);
        }
    }
}
