package com.spendmonitor.monitor.application.controller.device;

import com.spendmonitor.monitor.application.controller.device.mapper.DeviceResponseMapper;
import com.spendmonitor.monitor.application.service.DeviceCommandHandler;
import com.spendmonitor.monitor.domain.device.DeviceRegistry;
import com.spendmonitor.monitor.domain.device.InvalidTokenCleanupResult;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/devices")
@RequiredArgsConstructor
public class DeviceController {

    private final DeviceCommandHandler commandHandler;
    private final DeviceRegistry deviceRegistry;
    private final DeviceResponseMapper mapper;

    @PostMapping
    public ResponseEntity<DeviceResponse> register(@Valid @RequestBody RegisterDeviceRequest request) {
        var registration = commandHandler.register(request.deviceToken(), request.userId());
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(registration));
    }

    @PutMapping
    public DeviceResponse updateToken(@Valid @RequestBody UpdateDeviceTokenRequest request) {
        return mapper.toResponse(commandHandler.updateToken(request.platformEndpointArn(), request.newDeviceToken()));
    }

    @GetMapping
    public List<DeviceResponse> list(@RequestParam(required = false) String userId) {
        var registrations = userId == null
                ? deviceRegistry.activeRegistrations()
                : deviceRegistry.findByOwner(userId);
        return mapper.toResponses(registrations);
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void remove(@RequestParam String platformEndpointArn) {
        commandHandler.remove(platformEndpointArn);
    }

    @PostMapping("/cleanup")
    public InvalidTokenCleanupResult cleanup(@RequestBody(required = false) CleanupRequest request) {
        return commandHandler.cleanup(request == null ? List.of() : request.platformEndpointArns());
    }

    @GetMapping("/health")
    public PushHealthResponse health() {
        return mapper.toResponse(deviceRegistry.healthCheck());
    }
}
