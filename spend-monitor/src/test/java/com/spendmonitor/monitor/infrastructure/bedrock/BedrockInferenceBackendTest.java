package com.spendmonitor.monitor.infrastructure.bedrock;

import static com.spendmonitor.monitor.test.fixtures.PropertiesFixtures.someProperties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

import com.spendmonitor.monitor.domain.enrichment.InferenceRequest;
import com.spendmonitor.monitor.domain.exceptions.BackendRejectedException;
import com.spendmonitor.monitor.domain.exceptions.ErrorKind;
import com.spendmonitor.monitor.domain.exceptions.RateLimitExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

@ExtendWith(MockitoExtension.class)
class BedrockInferenceBackendTest {

    private static final InferenceRequest SOME_REQUEST = new InferenceRequest("Analyze these costs", 500, 0.3, 0.9);

    @Mock
    private BedrockRuntimeClient client;

    private BedrockInferenceBackend backend;

    @BeforeEach
    void setUp() {
        backend = new BedrockInferenceBackend(client, someProperties());
    }

    @Test
    void shouldInvokeTitanAndPriceReportedTokens() {
        given(client.invokeModel(any(InvokeModelRequest.class))).willReturn(response("""
                {"inputTextTokenCount": 100,
                 "results": [{"tokenCount": 50, "outputText": "  {\\"summary\\": \\"ok\\"}\\n", "completionReason": "FINISH"}]}
                """));
        var captor = ArgumentCaptor.forClass(InvokeModelRequest.class);

        var response = backend.invoke(SOME_REQUEST);

        assertThat(response.text()).isEqualTo("{\"summary\": \"ok\"}");
        assertThat(response.inputTokens()).isEqualTo(100);
        assertThat(response.outputTokens()).isEqualTo(50);
        assertThat(response.cost()).isEqualByComparingTo("0.00005");
        assertThat(response.modelId()).isEqualTo("amazon.titan-text-express-v1");
        then(client).should().invokeModel(captor.capture());
        var body = captor.getValue().body().asUtf8String();
        assertThat(body).contains("\"inputText\":\"Analyze these costs\"", "\"maxTokenCount\":500");
        assertThat(captor.getValue().contentType()).isEqualTo("application/json");
    }

    @Test
    void shouldEstimateTokensWhenModelOmitsCounts() {
        given(client.invokeModel(any(InvokeModelRequest.class)))
                .willReturn(response("{\"results\": [{\"outputText\": \"12345678\"}]}"));

        var response = backend.invoke(SOME_REQUEST);

        assertThat(response.inputTokens()).isEqualTo(BedrockInferenceBackend.estimateTokens("Analyze these costs"));
        assertThat(response.outputTokens()).isEqualTo(2);
    }

    @Test
    void shouldRejectResponseWithoutOutput() {
        given(client.invokeModel(any(InvokeModelRequest.class))).willReturn(response("{\"results\": []}"));

        assertThatThrownBy(() -> backend.invoke(SOME_REQUEST)).isInstanceOf(BackendRejectedException.class);
    }

    @Test
    void shouldRejectUnreadableResponse() {
        given(client.invokeModel(any(InvokeModelRequest.class))).willReturn(response("not json"));

        assertThatThrownBy(() -> backend.invoke(SOME_REQUEST)).isInstanceOf(BackendRejectedException.class);
    }

    @Test
    void shouldTranslateThrottling() {
        given(client.invokeModel(any(InvokeModelRequest.class))).willThrow(bedrockError(429, "ThrottlingException"));

        assertThatThrownBy(() -> backend.invoke(SOME_REQUEST)).isInstanceOf(RateLimitExceededException.class);
    }

    @Test
    void shouldTreatModelNotReadyAsTransient() {
        assertThat(BedrockInferenceBackend.translate(bedrockError(400, "ModelNotReadyException")).kind())
                .isEqualTo(ErrorKind.TRANSIENT);
        assertThat(BedrockInferenceBackend.translate(bedrockError(408, "ModelTimeoutException")).kind())
                .isEqualTo(ErrorKind.TRANSIENT);
        assertThat(BedrockInferenceBackend.translate(bedrockError(403, "AccessDeniedException")).kind())
                .isEqualTo(ErrorKind.FATAL);
    }

    @Test
    void shouldEstimateFourCharactersPerToken() {
        assertThat(BedrockInferenceBackend.estimateTokens(null)).isZero();
        assertThat(BedrockInferenceBackend.estimateTokens("")).isZero();
        assertThat(BedrockInferenceBackend.estimateTokens("abcd")).isEqualTo(1);
        assertThat(BedrockInferenceBackend.estimateTokens("abcde")).isEqualTo(2);
    }

    private static InvokeModelResponse response(String json) {
        return InvokeModelResponse.builder().body(SdkBytes.fromUtf8String(json)).build();
    }

    private static BedrockRuntimeException bedrockError(int status, String code) {
        return (BedrockRuntimeException) BedrockRuntimeException.builder()
                .statusCode(status)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(code).build())
                .build();
    }
}
