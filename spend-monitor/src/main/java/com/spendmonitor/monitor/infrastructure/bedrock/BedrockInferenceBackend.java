package com.spendmonitor.monitor.infrastructure.bedrock;

import com.spendmonitor.common.json.JacksonConfig;
import com.spendmonitor.monitor.application.config.SpendMonitorProperties;
import com.spendmonitor.monitor.domain.enrichment.InferenceBackend;
import com.spendmonitor.monitor.domain.enrichment.InferenceRequest;
import com.spendmonitor.monitor.domain.enrichment.InferenceResponse;
import com.spendmonitor.monitor.domain.exceptions.BackendRejectedException;
import com.spendmonitor.monitor.domain.exceptions.RateLimitExceededException;
import com.spendmonitor.monitor.domain.exceptions.SpendMonitorException;
import com.spendmonitor.monitor.domain.exceptions.TransientBackendException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Titan text models on Bedrock. Token counts come from the response when the model
 * reports them and are estimated at four characters per token otherwise.
 */
@Slf4j
@Component
public class BedrockInferenceBackend implements InferenceBackend {

    static final String PROBE_PROMPT = "Test prompt for model validation";
    private static final Set<String> RETRYABLE_CODES =
            Set.of("ModelTimeoutException", "ModelNotReadyException", "ServiceUnavailableException");
    private static final BigDecimal ONE_THOUSAND = BigDecimal.valueOf(1000);

    private final ObjectMapper mapper = JacksonConfig.createObjectMapper();
    private final BedrockRuntimeClient client;
    private final String modelId;
    private final BigDecimal inputPricePer1k;
    private final BigDecimal outputPricePer1k;

    public BedrockInferenceBackend(BedrockRuntimeClient client, SpendMonitorProperties properties) {
        var enrichment = properties.enrichment();
        this.client = client;
        this.modelId = enrichment.modelId();
        this.inputPricePer1k = enrichment.inputTokenPricePer1k();
        this.outputPricePer1k = enrichment.outputTokenPricePer1k();
    }

    @Override
    public InferenceResponse invoke(InferenceRequest request) {
        var body = mapper.writeValueAsString(new TitanTextRequest(
                request.prompt(),
                new TitanTextRequest.TextGenerationConfig(request.maxTokens(), request.temperature(), request.topP())));
        String raw;
        try {
            raw = client.invokeModel(InvokeModelRequest.builder()
                            .modelId(modelId)
                            .contentType("application/json")
                            .accept("application/json")
                            .body(SdkBytes.fromUtf8String(body))
                            .build())
                    .body()
                    .asUtf8String();
        } catch (SdkException e) {
            throw translate(e);
        }

        var response = read(raw);
        if (response.results() == null || response.results().isEmpty()
                || response.results().get(0).outputText() == null) {
            throw BackendRejectedException.of("invokeModel", "response carried no output text");
        }
        var result = response.results().get(0);
        var inputTokens = response.inputTextTokenCount() != null
                ? response.inputTextTokenCount()
                : estimateTokens(request.prompt());
        var outputTokens = result.tokenCount() != null ? result.tokenCount() : estimateTokens(result.outputText());
        log.debug("Model {} used {} input and {} output tokens", modelId, inputTokens, outputTokens);
        return new InferenceResponse(
                result.outputText().trim(), inputTokens, outputTokens, cost(inputTokens, outputTokens), modelId);
    }

    @Override
    public void probe() {
        invoke(new InferenceRequest(PROBE_PROMPT, 10, 0.0, 0.9));
    }

    @Override
    public String modelId() {
        return modelId;
    }

    BigDecimal cost(int inputTokens, int outputTokens) {
        return inputPricePer1k.multiply(BigDecimal.valueOf(inputTokens))
                .add(outputPricePer1k.multiply(BigDecimal.valueOf(outputTokens)))
                .divide(ONE_THOUSAND, 6, RoundingMode.HALF_UP);
    }

    static int estimateTokens(String text) {
        return text == null ? 0 : (text.length() + 3) / 4;
    }

    private TitanTextResponse read(String raw) {
        try {
            return mapper.readValue(raw, TitanTextResponse.class);
        } catch (JacksonException e) {
            throw BackendRejectedException.of("invokeModel", e);
        }
    }

    static SpendMonitorException translate(SdkException e) {
        if (e instanceof SdkClientException) {
            return TransientBackendException.of("invokeModel", e);
        }
        if (e instanceof AwsServiceException service) {
            var code = service.awsErrorDetails() == null ? null : service.awsErrorDetails().errorCode();
            if (service.isThrottlingException()) {
                return RateLimitExceededException.throttled("invokeModel");
            }
            if (service.statusCode() >= 500 || RETRYABLE_CODES.contains(code)) {
                return TransientBackendException.of("invokeModel", e);
            }
        }
        return BackendRejectedException.of("invokeModel", e);
    }
}
