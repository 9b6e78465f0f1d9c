package io.github.yok.fea.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.fea.core.assembly.LinearSystem;
import io.github.yok.fea.core.assembly.SolidHeatTransferAssembler;
import io.github.yok.fea.core.boundary.ThermalBoundaryConditionImposer;
import io.github.yok.fea.core.linearalgebra.LinearSolverBackend;
import io.github.yok.fea.core.mesh.Mesh;
import io.github.yok.fea.core.mesh.MeshConfiguration;
import io.github.yok.fea.core.mesh.MeshGenerator;
import java.util.List;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 定常固体熱伝導問題を有限要素法で解くクラスです。
 *
 * <p>
 * メッシュ生成 → 全体系の組立 → 境界条件の適用（対流 → 温度固定）→ 線形ソルブ、を 1 回実行します。
 * 温度固定の節点は、線形ソルブ後に固定値をそのまま解へ書き戻します。
 * 状態は持たず、1 回のソルブの途中状態はすべて呼び出しの中で完結します。
 * </p>
 */
@Getter
@Slf4j
public final class SolidHeatTransferSolver {

    /**
     * メッシュ生成器です（設定を扱える最初のものを使用します）。
     */
    private final List<MeshGenerator> meshGenerators;

    /**
     * 全体系の組立器です。
     */
    private final SolidHeatTransferAssembler assembler;

    /**
     * 境界条件の適用器です。
     */
    private final ThermalBoundaryConditionImposer boundaryConditionImposer;

    /**
     * 線形ソルバです。
     */
    private final LinearSolverBackend linearSolver;

    /**
     * ソルバを生成します。
     *
     * @param meshGenerators メッシュ生成器です（1 つ以上）
     * @param assembler 全体系の組立器です
     * @param boundaryConditionImposer 境界条件の適用器です
     * @param linearSolver 線形ソルバです
     * @throws IllegalArgumentException 引数が null または空の場合に発生します
     */
    public SolidHeatTransferSolver(List<MeshGenerator> meshGenerators,
            SolidHeatTransferAssembler assembler,
            ThermalBoundaryConditionImposer boundaryConditionImposer,
            LinearSolverBackend linearSolver) {
        if (meshGenerators == null || meshGenerators.isEmpty()) {
            throw new IllegalArgumentException("meshGenerators は 1 つ以上指定してください");
        }
        if (assembler == null || boundaryConditionImposer == null || linearSolver == null) {
            throw new IllegalArgumentException(
                    "assembler/boundaryConditionImposer/linearSolver は null 不可です");
        }
        this.meshGenerators = List.copyOf(meshGenerators);
        this.assembler = assembler;
        this.boundaryConditionImposer = boundaryConditionImposer;
        this.linearSolver = linearSolver;
    }

    /**
     * 境界条件を適用した連立方程式を、解かずに返します。
     *
     * @param model 問題定義です
     * @return 組立結果です
     * @throws IllegalArgumentException 設定または境界条件が不正な場合に発生します
     * @throws UnsupportedOperationException 未対応の次元・要素次数の場合に発生します
     * @throws IllegalStateException 要素が退化している場合に発生します
     */
    public AssemblyResult assemble(HeatTransferModel model) {
        requireModel(model);

        Mesh mesh = generateMesh(model.getMeshConfiguration());
        LinearSystem system = assembleSystem(model, mesh);
        return new AssemblyResult(system.getJacobianMatrix(), system.getResidualVector(),
                mesh.nodesCoordinates());
    }

    /**
     * 問題を解き、節点温度を返します。
     *
     * @param model 問題定義です
     * @return 解ベクトルと節点座標です
     * @throws IllegalArgumentException 設定または境界条件が不正な場合に発生します
     * @throws UnsupportedOperationException 未対応の次元・要素次数の場合に発生します
     * @throws IllegalStateException 要素が退化している、または連立方程式が解けない場合に発生します
     */
    public SolveResult solve(HeatTransferModel model) {
        requireModel(model);
        long t0 = System.nanoTime();

        log.info("ソルブを開始します。solver={}、境界条件={}", model.getSolverType().getLabel(),
                model.getBoundaryConditions().describe());

        Mesh mesh = generateMesh(model.getMeshConfiguration());
        LinearSystem system = assembleSystem(model, mesh);

        long tSolve = System.nanoTime();
        double[] solution = system.restoreFixedValues(
                linearSolver.solve(system.getJacobianMatrix(), system.getResidualVector()));
        long solveMs = (System.nanoTime() - tSolve) / 1_000_000L;
        log.info("線形ソルブが完了しました。未知数={}、固定節点数={}、所要時間={}ms", solution.length,
                system.fixedValues().size(), solveMs);

        SolveResult result = new SolveResult(solution, mesh.nodesCoordinates());

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("ソルブが完了しました。節点数={}、温度 min={} max={} mean={}、所要時間={}ms", solution.length,
                fmt5(result.minTemperature()), fmt5(result.maxTemperature()),
                fmt5(result.meanTemperature()), elapsedMs);
        return result;
    }

    /**
     * 全体系を組み立て、境界条件を適用します。
     *
     * @param model 問題定義です
     * @param mesh メッシュです
     * @return 境界条件適用済みの連立方程式です
     */
    private LinearSystem assembleSystem(HeatTransferModel model, Mesh mesh) {
        LinearSystem system = assembler.assemble(mesh);
        boundaryConditionImposer.impose(system, mesh, model.getBoundaryConditions());
        return system;
    }

    /**
     * 設定を扱えるメッシュ生成器でメッシュを生成します。
     *
     * @param configuration メッシュ設定です
     * @return メッシュです
     */
    private Mesh generateMesh(MeshConfiguration configuration) {
        for (MeshGenerator generator : meshGenerators) {
            if (generator.supports(configuration)) {
                return generator.generate(configuration);
            }
        }
        throw new IllegalArgumentException("メッシュ設定を扱える生成器がありません: " + configuration);
    }

    private static void requireModel(HeatTransferModel model) {
        Preconditions.checkArgument(model != null, "model は null 不可です");
        Preconditions.checkArgument(model.getSolverType() == SolverType.SOLID_HEAT_TRANSFER,
                "未対応の solverConfig です: %s", model.getSolverType());
    }

    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
