package io.github.yok.fea.core.mesh;

import lombok.Value;

/**
 * 全体節点の物理座標です。
 *
 * <p>
 * 配列の添字は 0 始まりの全体節点番号（= 1 始まりの節点 ID − 1）です。1D メッシュでは y 座標はすべて 0 です。
 * </p>
 */
@Value
public class NodesCoordinates {

    /**
     * x 座標の配列です。
     */
    double[] nodesXCoordinates;

    /**
     * y 座標の配列です。
     */
    double[] nodesYCoordinates;

    /**
     * 節点数を返します。
     *
     * @return 節点数です
     */
    public int size() {
        return nodesXCoordinates.length;
    }
}
