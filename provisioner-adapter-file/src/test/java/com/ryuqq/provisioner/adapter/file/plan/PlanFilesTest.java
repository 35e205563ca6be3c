package com.ryuqq.provisioner.adapter.file.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.provisioner.adapter.file.json.JsonMappers;
import com.ryuqq.provisioner.application.planner.PlanOptions;
import com.ryuqq.provisioner.application.planner.Planner;
import com.ryuqq.provisioner.core.config.EngineConfig;
import com.ryuqq.provisioner.core.error.PlanFileException;
import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.plan.Action;
import com.ryuqq.provisioner.core.plan.Plan;
import com.ryuqq.provisioner.core.plan.ResourceChange;
import com.ryuqq.provisioner.core.state.State;
import com.ryuqq.provisioner.core.state.StateEntry;
import com.ryuqq.provisioner.testkit.remote.InMemoryRemote;
import com.ryuqq.provisioner.testkit.remote.TestResourceTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.provisioner.testkit.remote.TestResourceTypes.dataset;
import static com.ryuqq.provisioner.testkit.remote.TestResourceTypes.recipe;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PlanFiles 테스트")
class PlanFilesTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

    @TempDir
    Path directory;

    private Planner planner;
    private Path planFile;

    @BeforeEach
    void setUp() {
        planner = new Planner(TestResourceTypes.registry(new InMemoryRemote()), new EngineConfig("PROJ"),
            Clock.fixed(NOW, ZoneOffset.UTC));
        planFile = directory.resolve("plans").resolve("plan.json");
    }

    private Plan mixedPlan() {
        Address existing = TestResourceTypes.datasetAddress("a");
        Address removed = TestResourceTypes.datasetAddress("old");
        State state = State.empty("PROJ")
            .withEntry(existing, StateEntry.created(
                Map.of("connection", "filesystem_managed", "format", "csv", "rows", 10), Set.of(), 100, NOW))
            .withEntry(removed, StateEntry.created(Map.of("format", "csv"), Set.of(), 100, NOW));
        return planner.plan(List.of(
            dataset("a", Map.of("connection", "filesystem_managed", "format", "parquet")),
            recipe("b", List.of("a"), List.of())), state, new PlanOptions(false, false));
    }

    @Test
    @DisplayName("저장한 계획을 다시 읽으면 동일한 계획이 된다")
    void roundTripsEveryAction() {
        // given
        Plan plan = mixedPlan();

        // when
        PlanFiles.save(plan, planFile);
        Plan loaded = PlanFiles.load(planFile);

        // then
        assertThat(loaded).isEqualTo(plan);
        assertThat(loaded.changes().stream().map(ResourceChange::action).toList())
            .containsExactly(Action.UPDATE, Action.CREATE, Action.DELETE);
        assertThat(loaded.metadata().createdAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("계획 파일은 형식 버전과 액션 이름을 기록한다")
    void writesFormatVersionAndActionNames() throws IOException {
        // when
        PlanFiles.save(mixedPlan(), planFile);
        JsonNode json = JsonMappers.mapper().readTree(planFile.toFile());

        // then
        assertThat(json.get("formatVersion").asInt()).isEqualTo(1);
        assertThat(json.get("metadata").get("targetKey").asText()).isEqualTo("PROJ");
        assertThat(json.get("changes").get(0).get("action").asText()).isEqualTo("update");
        assertThat(json.get("changes").get(0).get("diff").get(0).get("field").asText()).isEqualTo("format");
        assertThat(json.get("changes").get(2).get("action").asText()).isEqualTo("delete");
    }

    @Test
    @DisplayName("없는 파일은 PlanFileException")
    void missingFile() {
        assertThatThrownBy(() -> PlanFiles.load(directory.resolve("absent.json")))
            .isInstanceOf(PlanFileException.class)
            .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("JSON이 아닌 파일은 PlanFileException")
    void invalidJson() throws IOException {
        // given
        Files.writeString(directory.resolve("broken.json"), "[1, 2", StandardCharsets.UTF_8);

        // when & then
        assertThatThrownBy(() -> PlanFiles.load(directory.resolve("broken.json")))
            .isInstanceOf(PlanFileException.class)
            .hasMessageContaining("not valid JSON");
    }

    @Test
    @DisplayName("지원하지 않는 형식 버전은 거부한다")
    void unsupportedFormatVersion() throws IOException {
        // given
        PlanFiles.save(mixedPlan(), planFile);
        ObjectNode json = (ObjectNode) JsonMappers.mapper().readTree(planFile.toFile());
        json.put("formatVersion", 2);
        JsonMappers.mapper().writeValue(planFile.toFile(), json);

        // when & then
        assertThatThrownBy(() -> PlanFiles.load(planFile))
            .isInstanceOf(PlanFileException.class)
            .hasMessageContaining("Unsupported plan format version 2");
    }

    @Test
    @DisplayName("알 수 없는 액션이 기록된 계획은 거부한다")
    void unknownAction() throws IOException {
        // given
        PlanFiles.save(mixedPlan(), planFile);
        ObjectNode json = (ObjectNode) JsonMappers.mapper().readTree(planFile.toFile());
        ((ObjectNode) json.get("changes").get(0)).put("action", "replace");
        JsonMappers.mapper().writeValue(planFile.toFile(), json);

        // when & then
        assertThatThrownBy(() -> PlanFiles.load(planFile))
            .isInstanceOf(PlanFileException.class)
            .hasMessageContaining("Unknown action: replace");
    }
}
