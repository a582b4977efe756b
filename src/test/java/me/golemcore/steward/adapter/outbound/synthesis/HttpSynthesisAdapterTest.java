package me.golemcore.steward.adapter.outbound.synthesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.steward.domain.model.SynthesisArtifact;
import me.golemcore.steward.domain.model.SynthesisRequest;
import me.golemcore.steward.domain.model.SynthesisResult;
import me.golemcore.steward.domain.model.SynthesisTask;
import me.golemcore.steward.infrastructure.config.StewardProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HttpSynthesisAdapterTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";

    private MockWebServer mockServer;
    private StewardProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        properties = new StewardProperties();
        properties.getSynthesis().setEnabled(true);
        properties.getSynthesis().setUrl(mockServer.url("/synthesize").toString());
        properties.getSynthesis().setTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void shouldPostRequestAndParseArtifacts() throws Exception {
        properties.getSynthesis().setApiKey("secret-key");
        mockServer.enqueue(new MockResponse()
                .setBody("""
                        {"status":"success","summary":"merged","compaction_performed":true,
                         "artifacts":[{"type":"context_update","content":"# merged"},
                                      {"type":"HISTORY_ARCHIVE","content":"## Old"},
                                      {"type":"diagram","content":"ignored"}]}
                        """)
                .setHeader(CONTENT_TYPE, APPLICATION_JSON));

        SynthesisResult result = adapter().synthesize(request()).get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertTrue(result.isCompactionPerformed());
        assertEquals(2, result.getArtifacts().size());
        assertEquals("# merged", result.findArtifact(SynthesisArtifact.Type.CONTEXT_UPDATE).orElseThrow()
                .getContent());
        assertEquals("## Old", result.findArtifact(SynthesisArtifact.Type.HISTORY_ARCHIVE).orElseThrow()
                .getContent());

        RecordedRequest recorded = mockServer.takeRequest(5, TimeUnit.SECONDS);
        assertEquals("POST", recorded.getMethod());
        assertEquals("/synthesize", recorded.getPath());
        assertEquals("Bearer secret-key", recorded.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertEquals("CONTEXT_MERGE", body.path("task").asText());
        assertEquals("PROJECT-CONTEXT", body.path("target").asText());
        assertEquals("# current", body.path("current_content").asText());
        assertEquals("## New\nx", body.path("new_content").asText());
        assertEquals("main", body.path("signals").path("branch").asText());
    }

    @Test
    void shouldOmitAuthorizationWithoutApiKey() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("{\"status\":\"success\"}"));

        adapter().synthesize(request()).get(5, TimeUnit.SECONDS);

        assertNull(mockServer.takeRequest(5, TimeUnit.SECONDS).getHeader("Authorization"));
    }

    @Test
    void shouldReportDelegateErrorAsFailure() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("{\"status\":\"error\",\"error\":\"model overloaded\"}"));

        SynthesisResult result = adapter().synthesize(request()).get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertEquals("model overloaded", result.getReason());
    }

    @Test
    void shouldReportHttpErrorAsFailure() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(503));

        SynthesisResult result = adapter().synthesize(request()).get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertEquals("HTTP 503", result.getReason());
    }

    @Test
    void shouldReportUnparseableResponseAsFailure() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("<html>oops</html>"));

        SynthesisResult result = adapter().synthesize(request()).get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
    }

    @Test
    void shouldFailWhenDelegateIsSlowerThanTimeout() throws Exception {
        properties.getSynthesis().setTimeout(Duration.ofMillis(200));
        mockServer.enqueue(new MockResponse()
                .setBody("{\"status\":\"success\"}")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        SynthesisResult result = adapter().synthesize(request()).get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
    }

    @Test
    void shouldNotCallWhenDisabled() throws Exception {
        properties.getSynthesis().setEnabled(false);
        HttpSynthesisAdapter adapter = adapter();

        assertFalse(adapter.isAvailable());
        assertFalse(adapter.synthesize(request()).get(5, TimeUnit.SECONDS).isSuccess());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void shouldNotBeAvailableWithoutUrl() {
        properties.getSynthesis().setUrl(" ");

        assertFalse(adapter().isAvailable());
    }

    private HttpSynthesisAdapter adapter() {
        return new HttpSynthesisAdapter(properties, new OkHttpClient(), objectMapper);
    }

    private static SynthesisRequest request() {
        return SynthesisRequest.builder()
                .task(SynthesisTask.CONTEXT_MERGE)
                .target("PROJECT-CONTEXT")
                .intent("merge")
                .currentContent("# current")
                .newContent("## New\nx")
                .signals(Map.of("branch", "main"))
                .build();
    }
}
