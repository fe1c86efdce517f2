package com.linlay.capability.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureWebTestClient
class CapabilityControllerTest {

    private static final Path ROOT;

    static {
        try {
            ROOT = Files.createTempDirectory("capability-catalog-test");
            write("skills/pdf/SKILL.md", """
                    ---
                    name: pdf
                    description: read pdf files
                    allowed-tools: bash
                    license: MIT
                    ---
                    Use pdftotext.
                    """);
            write("skills/xlsx/SKILL.md", """
                    ---
                    name: xlsx
                    description: read spreadsheets
                    ---
                    Open the workbook.
                    """);
            write("skills/broken/SKILL.md", "no frontmatter");
            write("agents/reviewer/AGENT.md", """
                    ---
                    name: reviewer
                    description: reviews changes
                    model: haiku
                    ---
                    Review the diff.
                    """);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    @DynamicPropertySource
    static void catalogRoots(DynamicPropertyRegistry registry) {
        registry.add("agent.skill.external-dir", () -> ROOT.resolve("skills").toString());
        registry.add("agent.skill.project-claude-dir", () -> ROOT.resolve(".claude/skills").toString());
        registry.add("agent.skill.include-user-dir", () -> "false");
        registry.add("agent.subagent.external-dir", () -> ROOT.resolve("agents").toString());
        registry.add("agent.subagent.project-claude-dir", () -> ROOT.resolve(".claude/agents").toString());
        registry.add("agent.subagent.include-user-dir", () -> "false");
    }

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void listSkillsShouldReturnDiscoveredMetadata() {
        webTestClient.get()
                .uri("/api/cap/skills")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.code").isEqualTo(0)
                .jsonPath("$.data.length()").isEqualTo(2)
                .jsonPath("$.data[0].name").isEqualTo("pdf")
                .jsonPath("$.data[0].sourceType").isEqualTo("project")
                .jsonPath("$.data[0].allowedTools[0]").isEqualTo("bash")
                .jsonPath("$.data[0].attributes.license").isEqualTo("MIT")
                .jsonPath("$.data[1].name").isEqualTo("xlsx");
    }

    @Test
    void skillContentShouldReturnInstructions() {
        webTestClient.get()
                .uri(uriBuilder -> uriBuilder.path("/api/cap/skill/content").queryParam("name", "pdf").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.code").isEqualTo(0)
                .jsonPath("$.data.name").isEqualTo("pdf")
                .jsonPath("$.data.instructions").isEqualTo("Use pdftotext.");
    }

    @Test
    void activateThenDeactivateShouldToggleAvailableSkills() {
        webTestClient.post()
                .uri("/api/cap/skills/activate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "xlsx"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.active").isEqualTo(true)
                .jsonPath("$.data.changed").isEqualTo(true);

        webTestClient.post()
                .uri("/api/cap/skills/activate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "xlsx"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.active").isEqualTo(true)
                .jsonPath("$.data.changed").isEqualTo(false);

        webTestClient.get()
                .uri("/api/cap/skills?active=true")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.length()").isEqualTo(1)
                .jsonPath("$.data[0].name").isEqualTo("xlsx")
                .jsonPath("$.data[0].active").isEqualTo(true);

        webTestClient.post()
                .uri("/api/cap/skills/deactivate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "xlsx"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.active").isEqualTo(false)
                .jsonPath("$.data.changed").isEqualTo(true);
    }

    @Test
    void unknownSkillShouldReturnNotFound() {
        webTestClient.get()
                .uri(uriBuilder -> uriBuilder.path("/api/cap/skill").queryParam("name", "missing").build())
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.code").isEqualTo(404)
                .jsonPath("$.msg").isEqualTo("skill not found: missing");
    }

    @Test
    void invalidNameShouldReturnBadRequestWithReason() {
        webTestClient.post()
                .uri("/api/cap/skills/activate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "../etc"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo(400)
                .jsonPath("$.data.reason").isEqualTo("INVALID_CHARACTER");
    }

    @Test
    void blankNameShouldFailRequestValidation() {
        webTestClient.post()
                .uri("/api/cap/skills/activate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", ""))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.msg").isEqualTo("Validation failed")
                .jsonPath("$.data.fields.name").exists();
    }

    @Test
    void agentEndpointsShouldExposeDiscoveredAgents() {
        webTestClient.get()
                .uri("/api/cap/agents")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.length()").isEqualTo(1)
                .jsonPath("$.data[0].name").isEqualTo("reviewer")
                .jsonPath("$.data[0].attributes.model").isEqualTo("haiku");

        webTestClient.get()
                .uri(uriBuilder -> uriBuilder.path("/api/cap/agent/content").queryParam("name", "reviewer").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.instructions").isEqualTo("Review the diff.");

        webTestClient.post()
                .uri("/api/cap/agents/unregister")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "reviewer"))
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void refreshShouldReportSearchedRoots() {
        webTestClient.post()
                .uri("/api/cap/skills/refresh")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.totalCount").isEqualTo(2)
                .jsonPath("$.data.rootsSearched.length()").isEqualTo(2);
    }

    private static void write(String relative, String content) throws IOException {
        Path file = ROOT.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
