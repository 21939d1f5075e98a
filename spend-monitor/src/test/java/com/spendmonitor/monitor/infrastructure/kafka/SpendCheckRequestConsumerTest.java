package com.spendmonitor.monitor.infrastructure.kafka;

import static com.spendmonitor.monitor.test.fixtures.CostFixtures.SOME_INSTANT;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

import com.spendmonitor.common.event.SpendCheckRequest;
import com.spendmonitor.monitor.application.service.SpendCheckCoordinator;
import com.spendmonitor.monitor.domain.pipeline.PipelineRunResult;
import com.spendmonitor.monitor.domain.pipeline.RunStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SpendCheckRequestConsumerTest {

    @Mock
    private SpendCheckCoordinator coordinator;

    @InjectMocks
    private SpendCheckRequestConsumer consumer;

    @Test
    void shouldRunCheckForEachRequest() {
        var request = SpendCheckRequest.builder().requestId("check-1").requestedAt(SOME_INSTANT).build();
        given(coordinator.runCheck(request)).willReturn(PipelineRunResult.builder()
                .runId("01JQ0000000000000000000000")
                .status(RunStatus.NO_ALERT)
                .build());

        consumer.onSpendCheckRequest(request);

        then(coordinator).should().runCheck(request);
    }
}
