package io.github.yok.fea.core.basis;

/**
 * 参照要素上の形状関数を評価するインタフェースです。
 */
public interface BasisFunctions {

    /**
     * 1D 要素の形状関数を評価します。
     *
     * @param ksi 自然座標です（[0,1]）
     * @return 形状関数の値と微分です
     * @throws IllegalArgumentException 2D 要素に対して呼び出した場合に発生します
     */
    BasisFunctionValues evaluate(double ksi);

    /**
     * 2D 要素の形状関数を評価します。
     *
     * @param ksi 自然座標 ksi です（[0,1]）
     * @param eta 自然座標 eta です（[0,1]）
     * @return 形状関数の値と微分です
     * @throws IllegalArgumentException 1D 要素に対して呼び出した場合に発生します
     */
    BasisFunctionValues evaluate(double ksi, double eta);

    /**
     * 要素あたりの節点数を返します。
     *
     * @return 要素あたりの節点数です
     */
    int nodeCount();
}
