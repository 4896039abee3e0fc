package io.voxeldaemon.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.voxeldaemon.core.error.EngineException;
import io.voxeldaemon.core.error.ErrorCode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link InMemoryVoxelEngine}. */
class InMemoryVoxelEngineTest {

    private static final Rgba RED = Rgba.opaque(255, 0, 0);
    private static final Rgba BLUE = Rgba.opaque(0, 0, 255);

    private InMemoryVoxelEngine engine;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        engine = new InMemoryVoxelEngine("test");
    }

    private static void assertEngineError(Runnable call, ErrorCode expected) {
        assertThatThrownBy(call::run)
                .isInstanceOfSatisfying(EngineException.class, e -> assertThat(e.errorCode()).isEqualTo(expected));
    }

    @Test
    void operationsWithoutProjectFail() {
        assertEngineError(() -> engine.addVoxel(0, 0, 0, RED, 0), ErrorCode.NO_PROJECT);
        assertEngineError(() -> engine.listLayers(), ErrorCode.NO_PROJECT);
        assertEngineError(() -> engine.saveProject(tempDir.resolve("x.json")), ErrorCode.NO_PROJECT);
    }

    @Test
    void statusWithoutProjectIsEmpty() {
        EngineStatus status = engine.status();

        assertThat(status.hasProject()).isFalse();
        assertThat(status.layerCount()).isZero();
        assertThat(status.version()).isEqualTo("test");
    }

    @Nested
    class WithProject {

        @BeforeEach
        void createProject() {
            engine.createProject("demo", 16, 8, 4);
        }

        @Test
        void newProjectHasOneLayer() {
            assertThat(engine.listLayers()).extracting(LayerInfo::id, LayerInfo::name)
                    .containsExactly(org.assertj.core.groups.Tuple.tuple(0, "Layer 0"));
            assertThat(engine.status().width()).isEqualTo(16);
        }

        @Test
        void addGetRemoveVoxel() {
            engine.addVoxel(1, 2, 3, RED, 0);

            assertThat(engine.getVoxel(1, 2, 3)).contains(RED);
            assertThat(engine.removeVoxel(1, 2, 3, 0)).isTrue();
            assertThat(engine.removeVoxel(1, 2, 3, 0)).isFalse();
            assertThat(engine.getVoxel(1, 2, 3)).isEmpty();
        }

        @Test
        void positionsOutsideBoundsAreRejected() {
            assertEngineError(() -> engine.addVoxel(16, 0, 0, RED, 0), ErrorCode.OUT_OF_BOUNDS);
            assertEngineError(() -> engine.getVoxel(0, -1, 0), ErrorCode.OUT_OF_BOUNDS);
        }

        @Test
        void unknownLayerIsRejected() {
            assertEngineError(() -> engine.addVoxel(0, 0, 0, RED, 5), ErrorCode.LAYER_NOT_FOUND);
        }

        @Test
        void topmostVisibleLayerWins() {
            LayerInfo top = engine.createLayer(null, Rgba.WHITE, true);
            LayerInfo hidden = engine.createLayer("hidden", Rgba.WHITE, false);
            engine.addVoxel(0, 0, 0, RED, 0);
            engine.addVoxel(0, 0, 0, BLUE, top.id());
            engine.addVoxel(0, 0, 0, Rgba.WHITE, hidden.id());

            assertThat(top.name()).isEqualTo("Layer 1");
            assertThat(engine.getVoxel(0, 0, 0)).contains(BLUE);
        }

        @Test
        void saveAndLoadRestoresProject() {
            LayerInfo second = engine.createLayer("detail", BLUE, true);
            engine.addVoxel(3, 3, 3, RED, second.id());
            Path file = tempDir.resolve("nested/demo.json");
            engine.saveProject(file);

            var other = new InMemoryVoxelEngine("test");
            ProjectInfo info = other.loadProject(file);

            assertThat(info).isEqualTo(new ProjectInfo("demo", 16, 8, 4));
            assertThat(other.listLayers()).extracting(LayerInfo::name).containsExactly("Layer 0", "detail");
            assertThat(other.getVoxel(3, 3, 3)).contains(RED);
        }

        @Test
        void loadingForeignFileIsUnsupportedFormat() throws Exception {
            Path file = tempDir.resolve("other.json");
            Files.writeString(file, "{\"format\":\"something-else\"}");

            assertEngineError(() -> engine.loadProject(file), ErrorCode.UNSUPPORTED_FORMAT);
            assertThat(engine.status().projectName()).isEqualTo("demo");
        }

        @Test
        void loadingMissingFileIsIoError() {
            assertEngineError(() -> engine.loadProject(tempDir.resolve("missing.json")), ErrorCode.ENGINE_IO);
        }

        @Test
        void textExportListsVisibleVoxels() throws Exception {
            engine.addVoxel(1, 0, 0, RED, 0);
            engine.addVoxel(0, 0, 0, BLUE, 0);
            Path out = tempDir.resolve("model.txt");

            assertThat(engine.exportModel(out, null)).isEqualTo("txt");

            List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
            assertThat(lines).filteredOn(l -> !l.startsWith("#")).containsExactly("0 0 0 0000ff", "1 0 0 ff0000");
        }

        @Test
        void explicitFormatOverridesExtension() throws Exception {
            engine.addVoxel(0, 0, 0, RED, 0);
            Path out = tempDir.resolve("model.bin");

            assertThat(engine.exportModel(out, "JSON")).isEqualTo("json");
            assertThat(Files.readString(out)).contains("\"voxels\"");
        }

        @Test
        void unknownExportFormatIsRejected() {
            assertEngineError(() -> engine.exportModel(tempDir.resolve("model.vox"), null),
                    ErrorCode.UNSUPPORTED_FORMAT);
        }

        @Test
        void oversizedProjectIsRejected() {
            assertEngineError(() -> engine.createProject("big", InMemoryVoxelEngine.MAX_EXTENT + 1, 1, 1),
                    ErrorCode.OUT_OF_BOUNDS);
        }
    }

    @Test
    void colorComponentsAreRangeChecked() {
        assertThatThrownBy(() -> new Rgba(256, 0, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(Rgba.opaque(1, 2, 255).hex()).isEqualTo("0102ff");
    }
}
