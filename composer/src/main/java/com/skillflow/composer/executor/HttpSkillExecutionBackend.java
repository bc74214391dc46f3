package com.skillflow.composer.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillflow.composer.executor.dto.ExecuteSkillRequest;
import com.skillflow.composer.executor.dto.SkillResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the skill executor service.
 *
 * One endpoint: POST /skills/{skill_id}/execute with
 * {"inputs": {...}, "agent_id": "..."}; the executor answers with
 * {"success": bool, "result": ..., "error": "..."}.
 *
 * No request timeout is set here: the per-step budget is enforced by
 * StepInvoker, which cancels the call when the step times out.
 * java.net.http.HttpClient is thread-safe, so one instance serves every
 * concurrent workflow run.
 */
@Component
public class HttpSkillExecutionBackend implements SkillExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(HttpSkillExecutionBackend.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public HttpSkillExecutionBackend(
            @Value("${composer.executor.base-url}") String baseUrl,
            @Value("${composer.executor.connect-timeout-sec:10}") int connectTimeoutSec,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(connectTimeoutSec))
                .build();
    }

    @Override
    public SkillResponse execute(String skillId, Map<String, Object> inputs, String agentId) {
        String opName = "execute skill '" + skillId + "'";
        log.debug("Calling executor: skill={} agent={} inputKeys={}", skillId, agentId, inputs.keySet());

        String body = toJson(new ExecuteSkillRequest(inputs, agentId));
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/skills/"
                            + URLEncoder.encode(skillId, StandardCharsets.UTF_8) + "/execute"))
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new SkillBackendException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return json.readValue(resp.body(), SkillResponse.class);
        } catch (SkillBackendException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new SkillBackendException("Failed to parse response for " + opName, e);
        } catch (InterruptedException e) {
            // StepInvoker interrupts us on timeout; keep the flag for the caller.
            Thread.currentThread().interrupt();
            throw new SkillBackendException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new SkillBackendException(opName + " failed", e);
        }
    }

    /** Serialize obj to JSON string; throws SkillBackendException on failure. */
    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new SkillBackendException("JSON serialization failed", e);
        }
    }
}
