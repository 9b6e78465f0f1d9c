package io.github.yok.fea.out;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.fea.core.boundary.BoundaryConditions;
import io.github.yok.fea.core.mesh.ElementOrder;
import io.github.yok.fea.core.mesh.MeshConfiguration;
import io.github.yok.fea.core.mesh.MeshDimension;
import io.github.yok.fea.core.mesh.NodesCoordinates;
import io.github.yok.fea.core.solver.HeatTransferModel;
import io.github.yok.fea.core.solver.SolveResult;
import io.github.yok.fea.core.solver.SolverType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvResultWriterTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("構造格子の解と補助情報を要素数入りのファイル名で出力する")
    void write_structuredMesh_writesSolutionAndMeta() throws IOException {
        Path outDir = tempDir.resolve("nested/out");
        CsvResultWriter writer = new CsvResultWriter(outDir.toString());

        writer.write(model(MeshConfiguration.twoDimensional(ElementOrder.QUADRATIC, 3, 2, 1.0, 1.0)),
                result());

        List<String> solution =
                Files.readAllLines(outDir.resolve("fea_solution_3x2.csv"), StandardCharsets.UTF_8);
        assertThat(solution).hasSize(4);
        assertThat(solution.get(0)).isEqualTo("i,x,y,temperature");
        assertThat(solution.get(1)).isEqualTo("0,0.0,0.0,100.0");
        assertThat(solution.get(3)).isEqualTo("2,1.0,0.0,20.0");

        List<String> meta =
                Files.readAllLines(outDir.resolve("fea_meta_3x2.csv"), StandardCharsets.UTF_8);
        assertThat(meta.get(0)).isEqualTo("key,value");
        assertThat(meta).contains("solverConfig,solidHeatTransferScript", "mesh.numElementsX,3",
                "totalNodes,3", "temperature.max,100.0", "temperature.min,20.0");
        assertThat(meta).anyMatch(line -> line.startsWith("boundaryConditions,")
                && line.contains("left=constantTemp(T=100.00000)"));
    }

    @Test
    @DisplayName("メッシュファイル使用時のファイル名は custom になる")
    void write_meshFile_usesCustomLabel() {
        MeshConfiguration fromFile =
                MeshConfiguration.fromFile(MeshDimension.TWO_D, ElementOrder.QUADRATIC, "mesh.json");
        CsvResultWriter writer = new CsvResultWriter(tempDir.toString());

        writer.write(model(fromFile), result());

        assertThat(CsvResultWriter.caseLabel(fromFile)).isEqualTo("custom");
        assertThat(tempDir.resolve("fea_solution_custom.csv")).exists();
        assertThat(tempDir.resolve("fea_meta_custom.csv")).exists();
    }

    @Test
    @DisplayName("出力先を作成できない場合は IllegalStateException になる")
    void write_unwritableDirectory_isReported() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file");
        CsvResultWriter writer = new CsvResultWriter(blocker.resolve("out").toString());

        assertThatThrownBy(() -> writer.write(
                model(MeshConfiguration.twoDimensional(ElementOrder.QUADRATIC, 1, 1, 1.0, 1.0)),
                result())).isInstanceOf(IllegalStateException.class)
                        .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("出力先が空の場合は IllegalArgumentException になる")
    void constructor_emptyDirectory_isRejected() {
        assertThatThrownBy(() -> new CsvResultWriter(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static HeatTransferModel model(MeshConfiguration mesh) {
        return new HeatTransferModel(SolverType.SOLID_HEAT_TRANSFER, mesh,
                BoundaryConditions.parse(Map.of("left", List.of("constantTemp", 100))));
    }

    private static SolveResult result() {
        return new SolveResult(new double[] {100.0, 60.0, 20.0}, new NodesCoordinates(
                new double[] {0.0, 0.5, 1.0}, new double[] {0.0, 0.0, 0.0}));
    }
}
