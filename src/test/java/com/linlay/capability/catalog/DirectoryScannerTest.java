package com.linlay.capability.catalog;

import com.linlay.capability.skill.Skill;
import com.linlay.capability.skill.SkillKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class DirectoryScannerTest {

    @TempDir
    Path tempDir;

    private final DirectoryScanner<Skill> scanner = new DirectoryScanner<>(new SkillKind(), new FrontmatterCodec());

    @Test
    void shouldReturnNothingForMissingRoot() {
        Map<String, Skill> catalog = new HashMap<>();

        List<Skill> found = scanner.scan(
                new SearchRoot(tempDir.resolve("absent"), SourceType.PROJECT),
                new HashSet<>(),
                catalog
        );

        assertThat(found).isEmpty();
        assertThat(catalog).isEmpty();
    }

    @Test
    void shouldRecordSourceAndPathsWithoutBody() throws Exception {
        writeSkill(tempDir, "pdf", "pdf", "read pdf");
        Map<String, Skill> catalog = new HashMap<>();

        List<Skill> found = scanner.scan(new SearchRoot(tempDir, SourceType.PROJECT_CLAUDE), new HashSet<>(), catalog);

        assertThat(found).hasSize(1);
        Skill skill = found.get(0);
        assertThat(catalog).containsEntry("pdf", skill);
        assertThat(skill.getSourceType()).isEqualTo(SourceType.PROJECT_CLAUDE);
        assertThat(skill.getDirectoryPath()).isEqualTo(tempDir.resolve("pdf").toString());
        assertThat(Path.of(skill.getAbsolutePath()).isAbsolute()).isTrue();
        assertThat(skill.getBody()).isEmpty();
        assertThat(skill.getRawFrontmatter()).isNotEmpty();
    }

    @Test
    void shouldSkipDirectoryNameMismatch(CapturedOutput output) throws Exception {
        writeSkill(tempDir, "folder-name", "other-name", "mismatch");
        writeSkill(tempDir, "good", "good", "fine");

        List<Skill> found = scanner.scan(new SearchRoot(tempDir, SourceType.PROJECT), new HashSet<>(), new HashMap<>());

        assertThat(found).extracting(Skill::getName).containsExactly("good");
        assertThat(output.getOut() + output.getErr()).contains("does not match");
    }

    @Test
    void shouldSkipMalformedFilesAndKeepScanning(CapturedOutput output) throws Exception {
        Path broken = tempDir.resolve("broken").resolve("SKILL.md");
        Files.createDirectories(broken.getParent());
        Files.writeString(broken, "no frontmatter here");
        Path badYaml = tempDir.resolve("bad-yaml").resolve("SKILL.md");
        Files.createDirectories(badYaml.getParent());
        Files.writeString(badYaml, "---\nname: [oops\n---\n");
        Path noDescription = tempDir.resolve("no-description").resolve("SKILL.md");
        Files.createDirectories(noDescription.getParent());
        Files.writeString(noDescription, "---\nname: no-description\n---\nbody\n");
        writeSkill(tempDir, "Bad_Name", "Bad_Name", "invalid grammar");
        writeSkill(tempDir, "valid", "valid", "ok");

        List<Skill> found = scanner.scan(new SearchRoot(tempDir, SourceType.PROJECT), new HashSet<>(), new HashMap<>());

        assertThat(found).extracting(Skill::getName).containsExactly("valid");
        assertThat(output.getOut() + output.getErr()).contains("Skip invalid skill file");
    }

    @Test
    void shouldWarnAboutDefinitionFileDirectlyInRoot(CapturedOutput output) throws Exception {
        Files.writeString(tempDir.resolve("SKILL.md"), """
                ---
                name: root
                description: misplaced
                ---
                """);

        List<Skill> found = scanner.scan(new SearchRoot(tempDir, SourceType.PROJECT), new HashSet<>(), new HashMap<>());

        assertThat(found).isEmpty();
        assertThat(output.getOut() + output.getErr()).contains("Invalid skill layout entry");
    }

    @Test
    void shouldFindNestedResourceDirectories() throws Exception {
        writeSkill(tempDir.resolve("group").resolve("sub"), "deep", "deep", "nested");

        List<Skill> found = scanner.scan(new SearchRoot(tempDir, SourceType.USER), new HashSet<>(), new HashMap<>());

        assertThat(found).extracting(Skill::getName).containsExactly("deep");
    }

    @Test
    void shouldWarnAboutDuplicateNameWithinOneRoot(CapturedOutput output) throws Exception {
        writeSkill(tempDir.resolve("a"), "twin", "twin", "first copy");
        writeSkill(tempDir.resolve("b"), "twin", "twin", "second copy");

        List<Skill> found = scanner.scan(new SearchRoot(tempDir, SourceType.PROJECT), new HashSet<>(), new HashMap<>());

        assertThat(found).singleElement().extracting(Skill::getDescription).isEqualTo("first copy");
        assertThat(output.getOut() + output.getErr()).contains("Skip duplicate skill 'twin'");
    }

    @Test
    void shouldSkipNamesAlreadySeen() throws Exception {
        writeSkill(tempDir, "shared", "shared", "lower priority copy");
        Set<String> seen = new HashSet<>(Set.of("shared"));
        Map<String, Skill> catalog = new HashMap<>();

        List<Skill> found = scanner.scan(new SearchRoot(tempDir, SourceType.USER), seen, catalog);

        assertThat(found).isEmpty();
        assertThat(catalog).isEmpty();
    }

    @Test
    void shouldReplaceExistingCatalogEntry() throws Exception {
        writeSkill(tempDir, "pinned", "pinned", "fresh copy");
        Skill existing = new Skill("pinned", "old copy", List.of(), "", "", Map.of(), "", "");
        Map<String, Skill> catalog = new HashMap<>(Map.of("pinned", existing));

        List<Skill> found = scanner.scan(new SearchRoot(tempDir, SourceType.PROJECT), new HashSet<>(), catalog);

        assertThat(found).singleElement().isSameAs(catalog.get("pinned"));
        assertThat(catalog.get("pinned").getDescription()).isEqualTo("fresh copy");
        assertThat(catalog.get("pinned")).isNotSameAs(existing);
    }

    static void writeSkill(Path root, String dirName, String name, String description) throws Exception {
        Path skillFile = root.resolve(dirName).resolve("SKILL.md");
        Files.createDirectories(skillFile.getParent());
        Files.writeString(skillFile, """
                ---
                name: "%s"
                description: "%s"
                ---
                Instructions for %s
                """.formatted(name, description, name));
    }
}
