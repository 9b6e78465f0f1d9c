package io.github.yok.fea.core.mesh;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 2 次四角形要素（9 節点）の局所節点の配置です。
 *
 * <p>
 * 参照要素 [0,1]² 上で、局所番号は {@code 3 * ksiIndex + etaIndex} です。
 * </p>
 *
 * <pre>
 *   eta
 *    1  2__5__8
 *       |     |
 *  0.5  1  4  7
 *       |__ __|
 *    0  0  3  6
 *       0 0.5 1  ksi
 * </pre>
 */
@Getter
@RequiredArgsConstructor
public enum QuadraticQuadNode {

    BOTTOM_LEFT(0, 0),
    LEFT_MID(0, 1),
    TOP_LEFT(0, 2),
    BOTTOM_MID(1, 0),
    CENTER(1, 1),
    TOP_MID(1, 2),
    BOTTOM_RIGHT(2, 0),
    RIGHT_MID(2, 1),
    TOP_RIGHT(2, 2);

    /**
     * 1 軸あたりの節点数です。
     */
    public static final int NODES_PER_AXIS = 3;

    /**
     * ksi 方向の格子位置（0, 1, 2 が ksi=0, 0.5, 1 に対応）です。
     */
    private final int ksiIndex;

    /**
     * eta 方向の格子位置（0, 1, 2 が eta=0, 0.5, 1 に対応）です。
     */
    private final int etaIndex;

    /**
     * 局所節点番号（0 始まり）を返します。
     *
     * @return 局所節点番号です
     */
    public int index() {
        return NODES_PER_AXIS * ksiIndex + etaIndex;
    }

    /**
     * 参照要素上の ksi 座標を返します。
     *
     * @return ksi 座標です
     */
    public double ksi() {
        return ksiIndex / 2.0;
    }

    /**
     * 参照要素上の eta 座標を返します。
     *
     * @return eta 座標です
     */
    public double eta() {
        return etaIndex / 2.0;
    }

    /**
     * 格子位置から局所節点を返します。
     *
     * @param ksiIndex ksi 方向の格子位置です（0〜2）
     * @param etaIndex eta 方向の格子位置です（0〜2）
     * @return 局所節点です
     * @throws IllegalArgumentException 格子位置が範囲外の場合に発生します
     */
    public static QuadraticQuadNode of(int ksiIndex, int etaIndex) {
        if (ksiIndex < 0 || ksiIndex >= NODES_PER_AXIS || etaIndex < 0
                || etaIndex >= NODES_PER_AXIS) {
            throw new IllegalArgumentException(
                    "格子位置が範囲外です: ksiIndex=" + ksiIndex + ", etaIndex=" + etaIndex);
        }
        return values()[NODES_PER_AXIS * ksiIndex + etaIndex];
    }
}
