package com.spendmonitor.monitor.application.controller;

import static com.spendmonitor.monitor.test.fixtures.CostFixtures.SOME_INSTANT;
import static com.spendmonitor.monitor.test.fixtures.DeviceFixtures.SOME_OTHER_TOKEN;
import static com.spendmonitor.monitor.test.fixtures.DeviceFixtures.SOME_OWNER;
import static com.spendmonitor.monitor.test.fixtures.DeviceFixtures.SOME_TOKEN;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.spendmonitor.monitor.application.controller.device.DeviceController;
import com.spendmonitor.monitor.application.controller.device.mapper.DeviceResponseMapper;
import com.spendmonitor.monitor.application.service.DeviceCommandHandler;
import com.spendmonitor.monitor.domain.device.DeviceRegistration;
import com.spendmonitor.monitor.domain.device.DeviceRegistry;
import com.spendmonitor.monitor.domain.device.HealthStatus;
import com.spendmonitor.monitor.domain.device.InvalidTokenCleanupResult;
import com.spendmonitor.monitor.domain.device.PushHealthReport;
import com.spendmonitor.monitor.domain.exceptions.DeviceNotFoundException;
import com.spendmonitor.monitor.domain.exceptions.InvalidDeviceTokenException;
import com.spendmonitor.monitor.domain.exceptions.RateLimitExceededException;
import java.util.List;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class DeviceControllerTest {

    private static final String DEVICES_PATH = "/api/v1/devices";
    private static final String SOME_ENDPOINT = "arn:aws:sns:us-east-1:000000000000:endpoint/APNS/spend-monitor/1";

    @Mock
    private DeviceCommandHandler commandHandler;

    @Mock
    private DeviceRegistry deviceRegistry;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        var controller = new DeviceController(commandHandler, deviceRegistry, Mappers.getMapper(DeviceResponseMapper.class));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @SneakyThrows
    void shouldRegisterDeviceAndReturn201() {
        given(commandHandler.register(SOME_TOKEN, SOME_OWNER)).willReturn(someRegistration(SOME_TOKEN));

        mockMvc.perform(post(DEVICES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "deviceToken": "%s",
                                    "userId": "%s"
                                }
                                """.formatted(SOME_TOKEN, SOME_OWNER)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.deviceToken", is(SOME_TOKEN)))
                .andExpect(jsonPath("$.platformEndpointArn", is(SOME_ENDPOINT)))
                .andExpect(jsonPath("$.userId", is(SOME_OWNER)))
                .andExpect(jsonPath("$.active", is(true)));
    }

    @Test
    @SneakyThrows
    void shouldRejectMissingDeviceToken() {
        mockMvc.perform(post(DEVICES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "userId": "user_test_001"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title", is("Bad Request")));

        then(commandHandler).shouldHaveNoInteractions();
    }

    @Test
    @SneakyThrows
    void shouldRejectMalformedDeviceToken() {
        given(commandHandler.register("abc", null)).willThrow(InvalidDeviceTokenException.of("abc"));

        mockMvc.perform(post(DEVICES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "deviceToken": "abc"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title", is("Invalid Device Token")));
    }

    @Test
    @SneakyThrows
    void shouldReturn429WhenRegistrationLimitIsHit() {
        given(commandHandler.register(any(), any())).willThrow(RateLimitExceededException.registrationLimit(10));

        mockMvc.perform(post(DEVICES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "deviceToken": "%s"
                                }
                                """.formatted(SOME_TOKEN)))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    @SneakyThrows
    void shouldRotateToken() {
        given(commandHandler.updateToken(SOME_ENDPOINT, SOME_OTHER_TOKEN)).willReturn(someRegistration(SOME_OTHER_TOKEN));

        mockMvc.perform(put(DEVICES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "platformEndpointArn": "%s",
                                    "newDeviceToken": "%s"
                                }
                                """.formatted(SOME_ENDPOINT, SOME_OTHER_TOKEN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deviceToken", is(SOME_OTHER_TOKEN)));
    }

    @Test
    @SneakyThrows
    void shouldReturn404WhenRotatingUnknownEndpoint() {
        given(commandHandler.updateToken("arn:unknown", SOME_OTHER_TOKEN))
                .willThrow(DeviceNotFoundException.forEndpoint("arn:unknown"));

        mockMvc.perform(put(DEVICES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "platformEndpointArn": "arn:unknown",
                                    "newDeviceToken": "%s"
                                }
                                """.formatted(SOME_OTHER_TOKEN)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title", is("Device Not Found")));
    }

    @Test
    @SneakyThrows
    void shouldListDevicesOfOwner() {
        given(deviceRegistry.findByOwner(SOME_OWNER)).willReturn(List.of(someRegistration(SOME_TOKEN)));

        mockMvc.perform(get(DEVICES_PATH).param("userId", SOME_OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].userId", is(SOME_OWNER)));
    }

    @Test
    @SneakyThrows
    void shouldListActiveDevicesWithoutOwnerFilter() {
        given(deviceRegistry.activeRegistrations()).willReturn(List.of());

        mockMvc.perform(get(DEVICES_PATH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @SneakyThrows
    void shouldRemoveDeviceAndReturn204() {
        mockMvc.perform(delete(DEVICES_PATH).param("platformEndpointArn", SOME_ENDPOINT))
                .andExpect(status().isNoContent());

        then(commandHandler).should().remove(SOME_ENDPOINT);
    }

    @Test
    @SneakyThrows
    void shouldCleanUpAllEndpointsWhenNoneAreGiven() {
        given(commandHandler.cleanup(List.of())).willReturn(new InvalidTokenCleanupResult(List.of(SOME_ENDPOINT), List.of()));

        mockMvc.perform(post(DEVICES_PATH + "/cleanup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed[0]", is(SOME_ENDPOINT)))
                .andExpect(jsonPath("$.errors", hasSize(0)));
    }

    @Test
    @SneakyThrows
    void shouldReportPushHealth() {
        given(deviceRegistry.healthCheck()).willReturn(PushHealthReport.builder()
                .overall(HealthStatus.WARNING)
                .certificateDaysRemaining(12L)
                .activeEndpointCount(3)
                .invalidEndpointCount(1)
                .recommendations(List.of("APNs certificate expires in 12 days; plan its renewal"))
                .checkedAt(SOME_INSTANT)
                .build());

        mockMvc.perform(get(DEVICES_PATH + "/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallHealth", is("WARNING")))
                .andExpect(jsonPath("$.certificateDaysRemaining", is(12)))
                .andExpect(jsonPath("$.activeEndpoints", is(3)))
                .andExpect(jsonPath("$.invalidEndpoints", is(1)))
                .andExpect(jsonPath("$.recommendations", hasSize(1)));
    }

    private static DeviceRegistration someRegistration(String token) {
        return DeviceRegistration.builder()
                .deviceToken(token)
                .platformEndpointRef(SOME_ENDPOINT)
                .ownerId(SOME_OWNER)
                .registrationDate(SOME_INSTANT)
                .lastUpdated(SOME_INSTANT)
                .active(true)
                .build();
    }
}
