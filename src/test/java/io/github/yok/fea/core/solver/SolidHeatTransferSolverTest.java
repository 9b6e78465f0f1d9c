package io.github.yok.fea.core.solver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.yok.fea.core.UnsupportedConfigurationException;
import io.github.yok.fea.core.assembly.SolidHeatTransferAssembler;
import io.github.yok.fea.core.boundary.BoundaryConditionException;
import io.github.yok.fea.core.boundary.BoundaryConditions;
import io.github.yok.fea.core.boundary.ThermalBoundaryConditionImposer;
import io.github.yok.fea.core.linearalgebra.EjmlLuLinearSolverBackend;
import io.github.yok.fea.core.linearalgebra.LinearSolverBackend;
import io.github.yok.fea.core.mesh.ElementOrder;
import io.github.yok.fea.core.mesh.JsonMeshFileReader;
import io.github.yok.fea.core.mesh.MeshConfiguration;
import io.github.yok.fea.core.mesh.MeshDimension;
import io.github.yok.fea.core.mesh.StructuredMeshGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SolidHeatTransferSolverTest {

    private static final double TOL = 1e-5;

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("左端 100 固定・他辺対流の 2x2 問題は既知の節点温度に一致する")
    void solve_leftFixedOthersConvection_matchesReferenceSolution() {
        SolveResult result = solver(new EjmlLuLinearSolverBackend()).solve(model(2, 2, leftHot()));
        double[] t = result.getSolutionVector();

        assertThat(t).hasSize(25);
        // 列優先 5 節点ずつ: x=0, 0.25, 0.5, 0.75, 1
        assertThat(column(t, 0)).containsExactly(100.0, 100.0, 100.0, 100.0, 100.0);
        assertThat(column(t, 1)).containsExactly(
                new double[] {32.195859, 62.039720, 66.715998, 62.039720, 32.195859}, within(TOL));
        assertThat(column(t, 2)).containsExactly(
                new double[] {31.024260, 39.747372, 45.946071, 39.747372, 31.024260}, within(TOL));
        assertThat(column(t, 3)).containsExactly(
                new double[] {22.782604, 29.347223, 31.359739, 29.347223, 22.782604}, within(TOL));
        assertThat(column(t, 4)).containsExactly(
                new double[] {21.340523, 22.218268, 23.233264, 22.218268, 21.340523}, within(TOL));
    }

    @Test
    @DisplayName("左端以外の節点は外部温度と固定温度の間にあり、x 方向に単調に減少する")
    void solve_leftFixedOthersConvection_isBoundedAndMonotonic() {
        SolveResult result = solver(new EjmlLuLinearSolverBackend()).solve(model(2, 2, leftHot()));
        double[] t = result.getSolutionVector();

        for (int j = 0; j < 5; j++) {
            for (int i = 1; i < 5; i++) {
                double v = t[i * 5 + j];
                assertThat(v).isStrictlyBetween(20.0, 100.0);
                assertThat(v).isLessThan(t[(i - 1) * 5 + j]);
            }
            // y=0.5 について対称
            assertThat(t[5 + j]).isCloseTo(t[5 + (4 - j)], within(1e-9));
        }
        assertThat(result.minTemperature()).isCloseTo(21.340523, within(TOL));
        assertThat(result.maxTemperature()).isEqualTo(100.0);
        assertThat(result.getNodesCoordinates().getNodesXCoordinates()[24]).isEqualTo(1.0);
    }

    @Test
    @DisplayName("全辺 50 固定では境界が 50、内部は一様な吸熱で 50 をわずかに下回る")
    void solve_allSidesFixed_interiorSlightlyBelowBoundary() {
        Map<String, List<?>> raw = new LinkedHashMap<>();
        for (String side : List.of("bottom", "left", "top", "right")) {
            raw.put(side, List.of("constantTemp", 50));
        }
        double[] t = solver(new EjmlLuLinearSolverBackend())
                .solve(model(2, 2, BoundaryConditions.parse(raw))).getSolutionVector();

        for (int i = 0; i < 5; i++) {
            assertThat(t[i * 5]).isEqualTo(50.0);
            assertThat(t[i * 5 + 4]).isEqualTo(50.0);
            assertThat(t[i]).isEqualTo(50.0);
            assertThat(t[20 + i]).isEqualTo(50.0);
        }
        assertThat(t[12]).isCloseTo(49.926282, within(TOL));
        assertThat(new double[] {t[7], t[11], t[13], t[17]}).containsExactly(
                new double[] {49.943109, 49.943109, 49.943109, 49.943109}, within(TOL));
        assertThat(new double[] {t[6], t[8], t[16], t[18]}).containsExactly(
                new double[] {49.954527, 49.954527, 49.954527, 49.954527}, within(TOL));
    }

    @Test
    @DisplayName("assemble は境界条件適用済みの行列と右辺を、解かずに返す")
    void assemble_returnsImposedSystemWithoutSolving() {
        LinearSolverBackend backend = mock(LinearSolverBackend.class);

        AssemblyResult assembled = solver(backend).assemble(model(2, 2, leftHot()));

        DMatrixRMaj a = assembled.getJacobianMatrix();
        assertThat(a.numRows).isEqualTo(25);
        for (int node = 0; node < 5; node++) {
            assertThat(a.get(node, node)).isEqualTo(1.0);
            assertThat(assembled.getResidualVector()[node]).isEqualTo(100.0);
        }
        assertThat(assembled.getNodesCoordinates().size()).isEqualTo(25);
        verify(backend, never()).solve(any(), any());
    }

    @Test
    @DisplayName("solve は組み立てた系を線形ソルバへ渡し、温度固定の節点だけ固定値に置き換えて返す")
    void solve_delegatesToLinearSolverBackend() {
        LinearSolverBackend backend = mock(LinearSolverBackend.class);
        double[] solved = new double[25];
        Arrays.fill(solved, 7.0);
        solved[2] = 99.99999999999999;
        when(backend.solve(any(), any())).thenReturn(solved);

        SolveResult result = solver(backend).solve(model(2, 2, leftHot()));

        double[] t = result.getSolutionVector();
        assertThat(column(t, 0)).containsExactly(100.0, 100.0, 100.0, 100.0, 100.0);
        assertThat(Arrays.copyOfRange(t, 5, 25)).containsOnly(7.0);
        assertThat(solved[2]).isEqualTo(99.99999999999999);
        verify(backend).solve(argThat(m -> m.numRows == 25 && m.numCols == 25),
                argThat(v -> v.length == 25 && v[0] == 100.0));
    }

    @Test
    @DisplayName("メッシュファイルの名前付き境界で解いた結果は構造格子の結果と一致する")
    void solve_meshFile_matchesStructuredMesh() throws Exception {
        String meshFile = Paths.get(getClass().getClassLoader()
                .getResource("mesh/unit-square-1x1.json").toURI()).toString();
        Map<String, List<?>> named = new LinkedHashMap<>();
        named.put("inlet", List.of("constantTemp", 100));
        named.put("wall", List.of("convection", 10, 20));
        named.put("outlet", List.of("convection", 10, 20));
        HeatTransferModel fromFile = new HeatTransferModel(SolverType.SOLID_HEAT_TRANSFER,
                MeshConfiguration.fromFile(MeshDimension.TWO_D, ElementOrder.QUADRATIC, meshFile),
                BoundaryConditions.parse(named));

        SolidHeatTransferSolver solver = solver(new EjmlLuLinearSolverBackend());
        double[] custom = solver.solve(fromFile).getSolutionVector();
        double[] structured = solver.solve(model(1, 1, leftHot())).getSolutionVector();

        assertThat(custom).containsExactly(structured, within(1e-9));
    }

    @Test
    @DisplayName("構造格子に存在しない境界名は BoundaryConditionException になる")
    void solve_unknownBoundaryOnStructuredMesh_isRejected() {
        BoundaryConditions bcs = BoundaryConditions.parse(Map.of("inlet", List.of("constantTemp", 1)));

        assertThatThrownBy(() -> solver(new EjmlLuLinearSolverBackend()).solve(model(2, 2, bcs)))
                .isInstanceOf(BoundaryConditionException.class);
    }

    @Test
    @DisplayName("必須項目の欠けた問題定義・未知のソルバ種別は設定エラーになる")
    void configurationErrors_areRejected() {
        assertThatThrownBy(() -> new HeatTransferModel(null,
                MeshConfiguration.twoDimensional(ElementOrder.QUADRATIC, 1, 1, 1.0, 1.0), leftHot()))
                        .isInstanceOf(IllegalArgumentException.class)
                        .hasMessageContaining("solverType");
        assertThatThrownBy(() -> new HeatTransferModel(SolverType.SOLID_HEAT_TRANSFER, null,
                leftHot())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> solver(new EjmlLuLinearSolverBackend()).solve(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(SolverType.fromLabel("solidHeatTransfer")).isEqualTo(SolverType.SOLID_HEAT_TRANSFER);
        assertThatThrownBy(() -> SolverType.fromLabel("fluidFlow"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("1 次要素のメッシュファイルは境界条件の有無によらず未対応として失敗する")
    void assemble_linearMeshFile_isUnsupported() throws IOException {
        Path file = tempDir.resolve("linear.json");
        Files.writeString(file, """
                {
                  "nodes": [{"x": 0, "y": 0}, {"x": 0, "y": 1}, {"x": 1, "y": 0}, {"x": 1, "y": 1}],
                  "elements": [[1, 2, 3, 4]],
                  "boundaryElements": {"wall": [[0, 0]]}
                }
                """);
        HeatTransferModel model = new HeatTransferModel(SolverType.SOLID_HEAT_TRANSFER,
                MeshConfiguration.fromFile(MeshDimension.TWO_D, ElementOrder.LINEAR, file.toString()),
                BoundaryConditions.parse(Map.of("wall", List.of("convection", 10, 20))));

        assertThatThrownBy(() -> solver(new EjmlLuLinearSolverBackend()).assemble(model))
                .isInstanceOf(UnsupportedConfigurationException.class);
    }

    @Test
    @DisplayName("境界条件が 1 つもない問題定義は設定エラーになる")
    void model_withoutBoundaryConditions_isRejected() {
        assertThatThrownBy(() -> model(1, 1, BoundaryConditions.parse(Map.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("boundaryConditions");
    }

    private static SolidHeatTransferSolver solver(LinearSolverBackend backend) {
        return new SolidHeatTransferSolver(
                List.of(new StructuredMeshGenerator(), new JsonMeshFileReader()),
                new SolidHeatTransferAssembler(), new ThermalBoundaryConditionImposer(), backend);
    }

    private static HeatTransferModel model(int nx, int ny, BoundaryConditions bcs) {
        return new HeatTransferModel(SolverType.SOLID_HEAT_TRANSFER,
                MeshConfiguration.twoDimensional(ElementOrder.QUADRATIC, nx, ny, 1.0, 1.0), bcs);
    }

    private static BoundaryConditions leftHot() {
        Map<String, List<?>> raw = new LinkedHashMap<>();
        raw.put("bottom", List.of("convection", 10, 20));
        raw.put("left", List.of("constantTemp", 100));
        raw.put("top", List.of("convection", 10, 20));
        raw.put("right", List.of("convection", 10, 20));
        return BoundaryConditions.parse(raw);
    }

    private static double[] column(double[] t, int i) {
        return Arrays.copyOfRange(t, i * 5, i * 5 + 5);
    }
}
