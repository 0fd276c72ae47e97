package com.gateway.service.impl;

import com.gateway.config.GatewayProperties;
import com.gateway.config.ServiceConfig;
import com.gateway.model.BackendDocument;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class BackendDocumentLoaderImplTest {

    private MockWebServer mockWebServer;
    private BackendDocumentLoaderImpl loader;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        GatewayProperties properties = new GatewayProperties();
        properties.setBaseUrl(String.format("http://localhost:%s", mockWebServer.getPort()));
        loader = new BackendDocumentLoaderImpl(WebClient.builder().build(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private String fixture(String name) throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(name)) {
            assertThat(in).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private String fixturePath(String name) throws Exception {
        URL resource = getClass().getClassLoader().getResource(name);
        assertThat(resource).isNotNull();
        return Paths.get(resource.toURI()).toFile().getAbsolutePath();
    }

    @Test
    void defaultUrl_shouldFollowPlatformLayout() {
        String base = String.format("http://localhost:%s", mockWebServer.getPort());

        assertThat(loader.defaultUrl("eda")).isEqualTo(base + "/api/eda/v1/openapi.json");
        assertThat(loader.defaultUrl("gateway")).isEqualTo(base + "/api/gateway/v1/docs/schema/");
        assertThat(loader.defaultUrl("galaxy")).isEqualTo(base + "/api/galaxy/v3/openapi.json");
        assertThat(loader.defaultUrl("controller")).isEqualTo(BackendDocumentLoaderImpl.CONTROLLER_SCHEMA_URL);
        assertThat(loader.defaultUrl("billing")).isNull();
    }

    @Test
    void load_shouldFetchFromDefaultUrl() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setBody(fixture("sample-openapi.json"))
                .addHeader("Content-Type", "application/json"));

        Optional<BackendDocument> document = loader.load(new ServiceConfig("eda"));

        assertThat(document).isPresent();
        assertThat(document.get().service()).isEqualTo("eda");
        assertThat(document.get().document().getPaths()).containsKey("/things/{id}");
        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getPath()).isEqualTo("/api/eda/v1/openapi.json");
    }

    @Test
    void load_localPathShouldWinOverUrl() throws Exception {
        ServiceConfig service = new ServiceConfig("eda");
        service.setUrl(mockWebServer.url("/never").toString());
        service.setLocalPath(fixturePath("sample-openapi.json"));

        Optional<BackendDocument> document = loader.load(service);

        assertThat(document).isPresent();
        assertThat(document.get().source()).endsWith("sample-openapi.json");
        assertThat(mockWebServer.getRequestCount()).isZero();
    }

    @Test
    void load_shouldConvertSwagger2Documents() throws Exception {
        ServiceConfig service = new ServiceConfig("controller");
        service.setLocalPath(fixturePath("sample-swagger2.json"));

        Optional<BackendDocument> document = loader.load(service);

        assertThat(document).isPresent();
        assertThat(document.get().document().getPaths()).containsKey("/api/v2/ping/");
        assertThat(document.get().document().getPaths().get("/api/v2/ping/").getGet().getOperationId())
                .isEqualTo("api_ping_list");
    }

    @Test
    void load_shouldReturnEmptyOnHttpError() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        ServiceConfig service = new ServiceConfig("gateway");

        assertThat(loader.load(service)).isEmpty();
    }

    @Test
    void load_shouldReturnEmptyForMissingFile() {
        ServiceConfig service = new ServiceConfig("eda");
        service.setLocalPath("/does/not/exist/openapi.json");

        assertThat(loader.load(service)).isEmpty();
    }

    @Test
    void load_shouldReturnEmptyForEmptyBody() {
        mockWebServer.enqueue(new MockResponse().setBody("").addHeader("Content-Type", "application/json"));

        assertThat(loader.load(new ServiceConfig("galaxy"))).isEmpty();
    }
}
