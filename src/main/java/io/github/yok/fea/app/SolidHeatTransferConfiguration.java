package io.github.yok.fea.app;

import io.github.yok.fea.core.assembly.SolidHeatTransferAssembler;
import io.github.yok.fea.core.boundary.BoundaryConditions;
import io.github.yok.fea.core.boundary.ThermalBoundaryConditionImposer;
import io.github.yok.fea.core.linearalgebra.EjmlLuLinearSolverBackend;
import io.github.yok.fea.core.linearalgebra.LinearSolverBackend;
import io.github.yok.fea.core.mesh.ElementOrder;
import io.github.yok.fea.core.mesh.JsonMeshFileReader;
import io.github.yok.fea.core.mesh.MeshConfiguration;
import io.github.yok.fea.core.mesh.MeshDimension;
import io.github.yok.fea.core.mesh.MeshGenerator;
import io.github.yok.fea.core.mesh.StructuredMeshGenerator;
import io.github.yok.fea.core.solver.HeatTransferModel;
import io.github.yok.fea.core.solver.SolidHeatTransferSolver;
import io.github.yok.fea.core.solver.SolverType;
import io.github.yok.fea.out.CsvResultWriter;
import io.github.yok.fea.out.ResultWriter;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 定常固体熱伝導ソルバ一式の Bean 定義を行う設定クラスです。
 *
 * <p>
 * fea.* の設定値から問題定義（{@link HeatTransferModel}）を組み立て、メッシュ生成・組立・境界条件・線形ソルバを
 * つないだ {@link SolidHeatTransferSolver} を生成します。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class SolidHeatTransferConfiguration {

    /**
     * fea-solver の設定値（fea.*）です。
     */
    private final FeaProperties p;

    /**
     * 構造格子の生成器を生成します。
     *
     * @return 構造格子の生成器です
     */
    @Bean
    public StructuredMeshGenerator structuredMeshGenerator() {
        return new StructuredMeshGenerator();
    }

    /**
     * JSON メッシュファイルの読み込み器を生成します。
     *
     * @return メッシュファイルの読み込み器です
     */
    @Bean
    public JsonMeshFileReader jsonMeshFileReader() {
        return new JsonMeshFileReader();
    }

    /**
     * 全体系の組立器を生成します。
     *
     * @return 組立器です
     */
    @Bean
    public SolidHeatTransferAssembler solidHeatTransferAssembler() {
        return new SolidHeatTransferAssembler();
    }

    /**
     * 境界条件の適用器を生成します。
     *
     * @return 境界条件の適用器です
     */
    @Bean
    public ThermalBoundaryConditionImposer thermalBoundaryConditionImposer() {
        return new ThermalBoundaryConditionImposer();
    }

    /**
     * 線形ソルババックエンドを生成します。
     *
     * @return 線形ソルババックエンドです
     */
    @Bean
    public LinearSolverBackend linearSolverBackend() {
        return new EjmlLuLinearSolverBackend();
    }

    /**
     * 定常固体熱伝導ソルバを生成します。
     *
     * @param meshGenerators メッシュ生成器です
     * @param assembler 組立器です
     * @param imposer 境界条件の適用器です
     * @param linearSolver 線形ソルババックエンドです
     * @return ソルバです
     */
    @Bean
    public SolidHeatTransferSolver solidHeatTransferSolver(List<MeshGenerator> meshGenerators,
            SolidHeatTransferAssembler assembler, ThermalBoundaryConditionImposer imposer,
            LinearSolverBackend linearSolver) {
        return new SolidHeatTransferSolver(meshGenerators, assembler, imposer, linearSolver);
    }

    /**
     * 設定値から問題定義を生成します。
     *
     * @return 問題定義です
     * @throws IllegalArgumentException 設定値が不正な場合に発生します
     */
    @Bean
    public HeatTransferModel heatTransferModel() {
        return new HeatTransferModel(SolverType.fromLabel(p.getSolverConfig()),
                toMeshConfiguration(p.getMesh()), BoundaryConditions.parse(p.getBoundaryConditions()));
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }

    /**
     * メッシュ設定値を {@link MeshConfiguration} に変換します。
     *
     * @param m メッシュ設定値です
     * @return メッシュ設定です
     */
    static MeshConfiguration toMeshConfiguration(FeaProperties.Mesh m) {
        MeshDimension dimension = MeshDimension.fromLabel(m.getMeshDimension());
        ElementOrder order = ElementOrder.fromLabel(m.getElementOrder());
        if (m.getMeshFile() != null && !m.getMeshFile().isBlank()) {
            return MeshConfiguration.fromFile(dimension, order, m.getMeshFile());
        }
        if (dimension == MeshDimension.ONE_D) {
            return MeshConfiguration.oneDimensional(order, m.getNumElementsX(), m.getMaxX());
        }
        return MeshConfiguration.twoDimensional(order, m.getNumElementsX(), m.getNumElementsY(),
                m.getMaxX(), m.getMaxY());
    }
}
