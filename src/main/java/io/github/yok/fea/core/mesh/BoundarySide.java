package io.github.yok.fea.core.mesh;

import java.util.Locale;
import lombok.Getter;

/**
 * 矩形参照要素の辺（＝矩形領域の境界）です。
 *
 * <p>
 * 番号は bottom=0, left=1, top=2, right=3 です。各辺について、辺上に並ぶ 2 次要素の局所節点と、
 * 辺上で固定される自然座標を保持します。
 * </p>
 */
@Getter
public enum BoundarySide {

    /**
     * 下辺（eta=0）です。
     */
    BOTTOM(0, "bottom", true, 0.0, QuadraticQuadNode.BOTTOM_LEFT, QuadraticQuadNode.BOTTOM_MID,
            QuadraticQuadNode.BOTTOM_RIGHT),

    /**
     * 左辺（ksi=0）です。
     */
    LEFT(1, "left", false, 0.0, QuadraticQuadNode.BOTTOM_LEFT, QuadraticQuadNode.LEFT_MID,
            QuadraticQuadNode.TOP_LEFT),

    /**
     * 上辺（eta=1）です。
     */
    TOP(2, "top", true, 1.0, QuadraticQuadNode.TOP_LEFT, QuadraticQuadNode.TOP_MID,
            QuadraticQuadNode.TOP_RIGHT),

    /**
     * 右辺（ksi=1）です。
     */
    RIGHT(3, "right", false, 1.0, QuadraticQuadNode.BOTTOM_RIGHT, QuadraticQuadNode.RIGHT_MID,
            QuadraticQuadNode.TOP_RIGHT);

    /**
     * 辺番号です。
     */
    private final int index;

    /**
     * 境界 ID（境界条件のキー）です。
     */
    private final String id;

    /**
     * 水平な辺（ksi 方向に延びる辺）かどうかです。
     */
    private final boolean horizontal;

    /**
     * 辺上で固定される自然座標の値（水平辺なら eta、垂直辺なら ksi）です。
     */
    private final double fixedCoordinate;

    /**
     * 辺上に並ぶ 2 次要素の局所節点です。
     */
    private final QuadraticQuadNode[] quadraticEdgeNodes;

    BoundarySide(int index, String id, boolean horizontal, double fixedCoordinate,
            QuadraticQuadNode... quadraticEdgeNodes) {
        this.index = index;
        this.id = id;
        this.horizontal = horizontal;
        this.fixedCoordinate = fixedCoordinate;
        this.quadraticEdgeNodes = quadraticEdgeNodes;
    }

    /**
     * 辺上の点の自然座標 (ksi, eta) を返します。
     *
     * @param edgeCoordinate 辺に沿った自然座標です（水平辺なら ksi、垂直辺なら eta）
     * @return {ksi, eta} です
     */
    public double[] naturalCoordinatesAt(double edgeCoordinate) {
        return horizontal ? new double[] {edgeCoordinate, fixedCoordinate}
                : new double[] {fixedCoordinate, edgeCoordinate};
    }

    /**
     * 辺番号から辺を返します。
     *
     * @param index 辺番号です（0〜3）
     * @return 辺です
     * @throws IllegalArgumentException 辺番号が範囲外の場合に発生します
     */
    public static BoundarySide ofIndex(int index) {
        for (BoundarySide side : values()) {
            if (side.index == index) {
                return side;
            }
        }
        throw new IllegalArgumentException("辺番号は 0〜3 を指定してください: " + index);
    }

    /**
     * 境界条件のキーを辺として解釈します。
     *
     * <p>
     * {@code "bottom"}, {@code "0"}, {@code "bottomBoundary"} のいずれの表記も受け付けます。
     * 辺として解釈できないキー（メッシュファイルで定義された名前付き境界など）は null を返します。
     * </p>
     *
     * @param key 境界条件のキーです
     * @return 辺、解釈できない場合は null です
     */
    public static BoundarySide fromKey(String key) {
        if (key == null) {
            return null;
        }
        String k = key.trim().toLowerCase(Locale.ROOT);
        if (k.endsWith("boundary")) {
            k = k.substring(0, k.length() - "boundary".length());
        }
        for (BoundarySide side : values()) {
            if (side.id.equals(k) || String.valueOf(side.index).equals(k)) {
                return side;
            }
        }
        return null;
    }
}
