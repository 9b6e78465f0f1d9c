package io.github.yok.fea.core.quadrature;

import io.github.yok.fea.core.mesh.ElementOrder;
import lombok.Value;

/**
 * 区間 [0,1] 上の Gauss-Legendre 積分点と重みです。
 *
 * <p>
 * 1 次要素は 1 点（中点、重み 1）、2 次要素は 3 点（重み 5/18, 8/18, 5/18）で、
 * 3 点則は 5 次までの多項式を厳密に積分します。2D ではテンソル積で使用します。
 * </p>
 */
@Value
public class GaussQuadrature {

    private static final GaussQuadrature ONE_POINT =
            new GaussQuadrature(new double[] {0.5}, new double[] {1.0});

    private static final GaussQuadrature THREE_POINT = new GaussQuadrature(
            new double[] {(1.0 - Math.sqrt(3.0 / 5.0)) / 2.0, 0.5,
                    (1.0 + Math.sqrt(3.0 / 5.0)) / 2.0},
            new double[] {5.0 / 18.0, 8.0 / 18.0, 5.0 / 18.0});

    /**
     * 積分点です。
     */
    double[] points;

    /**
     * 重みです。
     */
    double[] weights;

    /**
     * 要素次数に対応する積分則を返します。
     *
     * @param elementOrder 要素次数です（null 不可）
     * @return 積分則です
     * @throws IllegalArgumentException elementOrder が null の場合に発生します
     */
    public static GaussQuadrature forOrder(ElementOrder elementOrder) {
        if (elementOrder == null) {
            throw new IllegalArgumentException("elementOrder は null 不可です");
        }
        return elementOrder == ElementOrder.LINEAR ? ONE_POINT : THREE_POINT;
    }

    /**
     * 積分点数を返します。
     *
     * @return 積分点数です
     */
    public int size() {
        return points.length;
    }
}
