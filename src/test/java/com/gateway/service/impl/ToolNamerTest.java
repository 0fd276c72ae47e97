package com.gateway.service.impl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolNamerTest {

    @Test
    void synthesize_shouldAppendTrailingPathParameter() {
        assertThat(ToolNamer.synthesize("get", "/things/{id}")).isEqualTo("getThingsById");
        assertThat(ToolNamer.synthesize("GET", "/users/{user_id}")).isEqualTo("getUsersByUserId");
    }

    @Test
    void synthesize_shouldSkipInnerPathParameters() {
        assertThat(ToolNamer.synthesize("post", "/things/{id}/upload")).isEqualTo("postThingsUpload");
    }

    @Test
    void synthesize_shouldTitleCaseSnakeAndKebabSegments() {
        assertThat(ToolNamer.synthesize("post", "/api/v2/job_templates/")).isEqualTo("postApiV2JobTemplates");
        assertThat(ToolNamer.synthesize("get", "/role-definitions")).isEqualTo("getRoleDefinitions");
    }

    @Test
    void sanitize_shouldReplaceDisallowedCharacters() {
        assertThat(ToolNamer.sanitize("things.list")).isEqualTo("things_list");
        assertThat(ToolNamer.sanitize("list things!")).isEqualTo("list_things_");
        assertThat(ToolNamer.sanitize("keep-me_1")).isEqualTo("keep-me_1");
    }

    @Test
    void claim_shouldSuffixCollisions() {
        ToolNamer namer = new ToolNamer();

        assertThat(namer.claim("a.b")).isEqualTo("a_b");
        assertThat(namer.claim("a.b")).isEqualTo("a_b_1");
        assertThat(namer.claim("a_b")).isEqualTo("a_b_2");
        assertThat(new ToolNamer().claim("a.b")).isEqualTo("a_b");
    }
}
