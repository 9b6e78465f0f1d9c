package io.github.yok.fea.core.solver;

import io.github.yok.fea.core.mesh.NodesCoordinates;
import java.util.Arrays;
import lombok.Value;

/**
 * 解ベクトル（節点温度）と節点座標です。
 *
 * <p>
 * 解ベクトルの添字は 0 始まりの全体節点番号で、節点座標と同じ順序です。
 * </p>
 */
@Value
public class SolveResult {

    /**
     * 解ベクトル（節点温度）です。
     */
    double[] solutionVector;

    /**
     * 節点座標です。
     */
    NodesCoordinates nodesCoordinates;

    /**
     * 最小温度を返します。
     *
     * @return 最小温度です
     */
    public double minTemperature() {
        return Arrays.stream(solutionVector).min().orElse(Double.NaN);
    }

    /**
     * 最大温度を返します。
     *
     * @return 最大温度です
     */
    public double maxTemperature() {
        return Arrays.stream(solutionVector).max().orElse(Double.NaN);
    }

    /**
     * 節点平均温度を返します。
     *
     * @return 節点平均温度です
     */
    public double meanTemperature() {
        return Arrays.stream(solutionVector).average().orElse(Double.NaN);
    }
}
