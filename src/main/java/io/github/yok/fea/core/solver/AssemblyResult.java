package io.github.yok.fea.core.solver;

import io.github.yok.fea.core.mesh.NodesCoordinates;
import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 境界条件適用済みで、まだ解いていない連立方程式と節点座標です。
 */
@Value
public class AssemblyResult {

    /**
     * 全体ヤコビ行列です。
     */
    DMatrixRMaj jacobianMatrix;

    /**
     * 全体残差ベクトルです。
     */
    double[] residualVector;

    /**
     * 節点座標です。
     */
    NodesCoordinates nodesCoordinates;
}
