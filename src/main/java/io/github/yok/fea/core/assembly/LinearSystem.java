package io.github.yok.fea.core.assembly;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * 全体連立一次方程式 {@code jacobianMatrix * T = residualVector} の係数行列と右辺ベクトルです。
 *
 * <p>
 * 密行列で保持します。組立では加算、Dirichlet 条件の適用では行単位の上書きで変更されます。
 * 上書きした行と固定値は記録し、解ベクトルへ書き戻せるようにします。
 * </p>
 */
@Getter
public final class LinearSystem {

    /**
     * 全体ヤコビ行列（剛性行列）です（totalNodes × totalNodes）。
     */
    private final DMatrixRMaj jacobianMatrix;

    /**
     * 全体残差ベクトル（右辺）です。
     */
    private final double[] residualVector;

    /**
     * Dirichlet 条件で固定した行と固定値です（同じ行は後の値で上書きします）。
     */
    @Getter(AccessLevel.NONE)
    private final Map<Integer, Double> fixedValues = new LinkedHashMap<>();

    /**
     * ゼロ初期化された連立方程式を生成します。
     *
     * @param totalNodes 全節点数です（1 以上）
     * @throws IllegalArgumentException totalNodes が 1 未満の場合に発生します
     */
    public LinearSystem(int totalNodes) {
        if (totalNodes < 1) {
            throw new IllegalArgumentException("totalNodes は 1 以上を指定してください: " + totalNodes);
        }
        this.jacobianMatrix = new DMatrixRMaj(totalNodes, totalNodes);
        this.residualVector = new double[totalNodes];
    }

    /**
     * 未知数の数を返します。
     *
     * @return 未知数の数です
     */
    public int size() {
        return residualVector.length;
    }

    /**
     * 残差ベクトルに加算します。
     *
     * @param row 行番号です
     * @param value 加算値です
     */
    public void addResidual(int row, double value) {
        residualVector[row] += value;
    }

    /**
     * ヤコビ行列に加算します。
     *
     * @param row 行番号です
     * @param col 列番号です
     * @param value 加算値です
     */
    public void addJacobian(int row, int col, double value) {
        jacobianMatrix.add(row, col, value);
    }

    /**
     * 指定行を Dirichlet 条件の行（対角 1、他 0、右辺 value）で上書きします。
     *
     * @param row 行番号です
     * @param value 固定値です
     */
    public void fixRow(int row, double value) {
        int n = jacobianMatrix.numCols;
        for (int col = 0; col < n; col++) {
            jacobianMatrix.unsafe_set(row, col, 0.0);
        }
        jacobianMatrix.unsafe_set(row, row, 1.0);
        residualVector[row] = value;
        fixedValues.put(row, value);
    }

    /**
     * Dirichlet 条件で固定した行と固定値を返します。
     *
     * @return 行番号 → 固定値の変更不可の対応表です
     */
    public Map<Integer, Double> fixedValues() {
        return Collections.unmodifiableMap(fixedValues);
    }

    /**
     * 解ベクトルの固定行を固定値で置き換えた複製を返します。
     *
     * <p>
     * 固定行の解は、線形ソルバの丸め誤差を含まない固定値そのものになります。
     * </p>
     *
     * @param solution 線形ソルバの解です
     * @return 固定値を書き戻した解ベクトルです
     * @throws IllegalArgumentException 解ベクトルの長さが未知数の数と一致しない場合に発生します
     */
    public double[] restoreFixedValues(double[] solution) {
        if (solution == null || solution.length != size()) {
            throw new IllegalArgumentException("解ベクトルの長さが未知数の数と一致しません");
        }
        double[] restored = solution.clone();
        fixedValues.forEach((row, value) -> restored[row] = value);
        return restored;
    }
}
