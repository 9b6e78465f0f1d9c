package io.github.yok.fea.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.fea.core.boundary.BoundaryConditions;
import io.github.yok.fea.core.mesh.MeshConfiguration;
import lombok.Value;

/**
 * 1 回のソルブに必要な入力（ソルバ種別・メッシュ設定・境界条件）をまとめた不変の問題定義です。
 */
@Value
public class HeatTransferModel {

    /**
     * ソルバ種別です。
     */
    SolverType solverType;

    /**
     * メッシュ設定です。
     */
    MeshConfiguration meshConfiguration;

    /**
     * 境界条件です。
     */
    BoundaryConditions boundaryConditions;

    /**
     * 問題定義を生成します。
     *
     * @param solverType ソルバ種別です（必須）
     * @param meshConfiguration メッシュ設定です（必須）
     * @param boundaryConditions 境界条件です（必須、1 つ以上）
     * @throws IllegalArgumentException 必須項目が欠けている場合に発生します
     */
    public HeatTransferModel(SolverType solverType, MeshConfiguration meshConfiguration,
            BoundaryConditions boundaryConditions) {
        Preconditions.checkArgument(solverType != null, "solverType は必須です");
        Preconditions.checkArgument(meshConfiguration != null, "meshConfiguration は必須です");
        Preconditions.checkArgument(boundaryConditions != null, "boundaryConditions は必須です");
        Preconditions.checkArgument(!boundaryConditions.isEmpty(),
                "boundaryConditions は 1 つ以上指定してください");
        this.solverType = solverType;
        this.meshConfiguration = meshConfiguration;
        this.boundaryConditions = boundaryConditions;
    }
}
