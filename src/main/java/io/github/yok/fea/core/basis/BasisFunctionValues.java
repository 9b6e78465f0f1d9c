package io.github.yok.fea.core.basis;

import lombok.Value;

/**
 * 参照要素上の 1 点で評価した形状関数の値と自然座標微分です。
 *
 * <p>
 * 配列の添字は局所節点番号です。1D 要素では eta 微分はすべて 0 です。
 * </p>
 */
@Value
public class BasisFunctionValues {

    /**
     * 形状関数の値です。
     */
    double[] values;

    /**
     * ksi 方向の微分です。
     */
    double[] derivKsi;

    /**
     * eta 方向の微分です。
     */
    double[] derivEta;

    /**
     * 局所節点数を返します。
     *
     * @return 局所節点数です
     */
    public int size() {
        return values.length;
    }
}
