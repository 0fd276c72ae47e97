package com.gateway.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gateway.model.ToolDefinition;
import com.gateway.model.ToolDiagnostic;
import com.gateway.model.ToolParameter;
import io.swagger.parser.OpenAPIParser;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.ObjectSchema;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.parser.core.models.ParseOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ToolExtractorImplTest {

    private ToolExtractorImpl extractor;

    @BeforeEach
    void setUp() {
        extractor = new ToolExtractorImpl(new SchemaTranslatorImpl());
    }

    private OpenAPI loadFixture(String name) throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(name)) {
            assertThat(in).isNotNull();
            ParseOptions options = new ParseOptions();
            options.setResolve(true);
            options.setResolveFully(true);
            return new OpenAPIParser().readContents(new String(in.readAllBytes(), StandardCharsets.UTF_8), null, options).getOpenAPI();
        }
    }

    private static Map<String, ToolDefinition> byName(List<ToolDefinition> tools) {
        return tools.stream().collect(Collectors.toMap(ToolDefinition::getName, Function.identity()));
    }

    @Test
    void extract_shouldHonorInclusionFlagsAndKeepDocumentOrder() throws IOException {
        List<ToolDefinition> tools = extractor.extract(loadFixture("sample-openapi.json"), true);

        assertThat(tools).extracting(ToolDefinition::getName).containsExactly(
                "things_list", "things_create", "getThingsById", "things_destroy", "things_upload", "internal_create");
    }

    @Test
    void extract_shouldSynthesizeMissingOperationIdWithDiagnostics() throws IOException {
        ToolDefinition tool = byName(extractor.extract(loadFixture("sample-openapi.json"), true)).get("getThingsById");

        assertThat(tool.getMethod()).isEqualTo("get");
        assertThat(tool.getPathTemplate()).isEqualTo("/things/{id}");
        assertThat(tool.getDescription()).isEqualTo("Fetch one thing");
        assertThat(tool.getDiagnostics()).contains(
                ToolDiagnostic.warn("no operationId key available"),
                ToolDiagnostic.warn("no description in OpenAPI schema"));
        assertThat(tool.getDiagnostics()).doesNotContain(ToolDiagnostic.info("no summary in OpenAPI schema"));
        // path-item level parameter is inherited
        assertThat(tool.getParameters()).containsExactly(new ToolParameter("id", "path"));
        assertThat(tool.getInputSchema().at("/properties/id/type").asText()).isEqualTo("number");
        assertThat(tool.getInputSchema().get("required")).extracting(JsonNode::asText).containsExactly("id");
    }

    @Test
    void extract_shouldBuildQueryParameterSchemas() throws IOException {
        ToolDefinition tool = byName(extractor.extract(loadFixture("sample-openapi.json"), true)).get("things_list");

        ObjectNode schema = tool.getInputSchema();
        assertThat(schema.get("type").asText()).isEqualTo("object");
        assertThat(schema.at("/properties/page/type").asText()).isEqualTo("number");
        assertThat(schema.at("/properties/page/description").asText()).isEqualTo("Page number.");
        assertThat(schema.has("required")).isFalse();
        assertThat(tool.getDescription()).startsWith("Returns every thing.");
        assertThat(tool.getParameters()).extracting(ToolParameter::name).containsExactly("page", "search");
    }

    @Test
    void extract_shouldExposeJsonRequestBody() throws IOException {
        ToolDefinition tool = byName(extractor.extract(loadFixture("sample-openapi.json"), true)).get("things_create");

        JsonNode body = tool.getInputSchema().at("/properties/requestBody");
        assertThat(body.get("type").asText()).isEqualTo("object");
        assertThat(body.get("description").asText()).isEqualTo("A thing.");
        assertThat(body.at("/properties/count/type")).extracting(JsonNode::asText).containsExactly("number", "null");
        assertThat(tool.getInputSchema().get("required")).extracting(JsonNode::asText).containsExactly("requestBody");
        assertThat(tool.getRequestBodyContentType()).isEqualTo("application/json");
    }

    @Test
    void extract_shouldExposeNonJsonRequestBodyAsString() throws IOException {
        ToolDefinition tool = byName(extractor.extract(loadFixture("sample-openapi.json"), true)).get("things_upload");

        JsonNode body = tool.getInputSchema().at("/properties/requestBody");
        assertThat(body.get("type").asText()).isEqualTo("string");
        assertThat(body.get("description").asText()).isEqualTo("Request body (content type: application/octet-stream)");
        assertThat(tool.getRequestBodyContentType()).isEqualTo("application/octet-stream");
        assertThat(tool.getDescription()).isEqualTo("Executes POST /things/{id}/upload");
    }

    @Test
    void extract_shouldTagDeprecatedOperations() throws IOException {
        Map<String, ToolDefinition> tools = byName(extractor.extract(loadFixture("sample-openapi.json"), true));

        assertThat(tools.get("things_destroy").isDeprecated()).isTrue();
        assertThat(tools.get("things_list").isDeprecated()).isFalse();
    }

    @Test
    void extract_shouldSkipEverythingWhenDefaultIsExclude() throws IOException {
        List<ToolDefinition> tools = extractor.extract(loadFixture("sample-openapi.json"), false);

        assertThat(tools).extracting(ToolDefinition::getName).containsExactly("internal_create");
    }

    @Test
    void extract_shouldSuffixCollidingNames() {
        OpenAPI document = new OpenAPI().paths(new Paths()
                .addPathItem("/a", new PathItem().get(new Operation().operationId("things.list").summary("A")))
                .addPathItem("/b", new PathItem().get(new Operation().operationId("things.list").summary("B"))));

        List<ToolDefinition> tools = extractor.extract(document, true);

        assertThat(tools).extracting(ToolDefinition::getName).containsExactly("things_list", "things_list_1");
        assertThat(tools.get(0).getDiagnostics()).contains(ToolDiagnostic.warn("name was transformed from things.list"));
        assertThat(tools.get(1).getOperationId()).isEqualTo("things.list");
    }

    @Test
    void extract_shouldKeepBooleanSchemaProperties() {
        Schema<?> anything = new Schema<>();
        anything.setBooleanSchemaValue(true);
        ObjectSchema body = new ObjectSchema();
        Map<String, Schema> properties = new LinkedHashMap<>();
        properties.put("name", new StringSchema());
        properties.put("extra_vars", anything);
        body.setProperties(properties);
        Operation create = new Operation().operationId("hosts_create").summary("Create a host")
                .requestBody(new RequestBody().content(new Content()
                        .addMediaType("application/json", new MediaType().schema(body))));
        OpenAPI document = new OpenAPI().paths(new Paths().addPathItem("/hosts/", new PathItem().post(create)));

        ToolDefinition tool = extractor.extract(document, true).get(0);

        JsonNode extraVars = tool.getInputSchema().at("/properties/requestBody/properties/extra_vars");
        assertThat(extraVars.isBoolean()).isTrue();
        assertThat(extraVars.booleanValue()).isTrue();
        assertThat(tool.getInputSchema().at("/properties/requestBody/properties/name/type").asText()).isEqualTo("string");
    }

    @Test
    void extract_shouldReturnEmptyListForDocumentWithoutPaths() {
        assertThat(extractor.extract(new OpenAPI(), true)).isEmpty();
        assertThat(extractor.extract(null, true)).isEmpty();
    }

    @Test
    void mergeParameters_operationParameterShouldOverrideInPlace() {
        Parameter id = new Parameter().name("id").in("path").schema(new StringSchema());
        Parameter pathLevelQuery = new Parameter().name("q").in("query").description("path level");
        Parameter operationQuery = new Parameter().name("q").in("query").description("operation level");
        Parameter limit = new Parameter().name("limit").in("query");
        Parameter header = new Parameter().name("q").in("header");

        List<Parameter> merged = ToolExtractorImpl.mergeParameters(
                List.of(id, pathLevelQuery), List.of(operationQuery, limit, header));

        assertThat(merged).containsExactly(id, operationQuery, limit, header);
    }

    @Test
    void mergeParameters_shouldTolerateMissingLists() {
        Parameter id = new Parameter().name("id").in("path");

        assertThat(ToolExtractorImpl.mergeParameters(null, List.of(id))).containsExactly(id);
        assertThat(ToolExtractorImpl.mergeParameters(null, null)).isEmpty();
    }
}
