package io.github.yok.fea.core.assembly;

import io.github.yok.fea.core.basis.BasisFunctionValues;
import lombok.Value;

/**
 * 参照要素上の 1 点における等パラメトリック写像（物理座標・座標微分・ヤコビアン）です。
 *
 * <p>
 * {@code x = Σ x_n N_n}, {@code ∂x/∂ksi = Σ x_n ∂N_n/∂ksi} などを局所節点について和をとって求め、
 * ヤコビアンは {@code xKsi * yEta - xEta * yKsi} です。
 * </p>
 */
@Value
public class IsoparametricMapping {

    /**
     * 物理座標 x です。
     */
    double x;

    /**
     * 物理座標 y です。
     */
    double y;

    /**
     * ∂x/∂ksi です。
     */
    double xKsi;

    /**
     * ∂x/∂eta です。
     */
    double xEta;

    /**
     * ∂y/∂ksi です。
     */
    double yKsi;

    /**
     * ∂y/∂eta です。
     */
    double yEta;

    /**
     * ヤコビアンです。
     */
    double detJacobian;

    /**
     * 形状関数と節点座標から写像を計算します。
     *
     * @param basis 形状関数の値と微分です
     * @param nodeXCoordinates 全体節点の x 座標です
     * @param nodeYCoordinates 全体節点の y 座標です
     * @param globalNodes 局所節点に対応する 0 始まりの全体節点番号です
     * @return 写像です
     */
    public static IsoparametricMapping of(BasisFunctionValues basis, double[] nodeXCoordinates,
            double[] nodeYCoordinates, int[] globalNodes) {
        double x = 0.0;
        double y = 0.0;
        double xKsi = 0.0;
        double xEta = 0.0;
        double yKsi = 0.0;
        double yEta = 0.0;

        double[] n = basis.getValues();
        double[] dKsi = basis.getDerivKsi();
        double[] dEta = basis.getDerivEta();
        for (int local = 0; local < globalNodes.length; local++) {
            double xn = nodeXCoordinates[globalNodes[local]];
            double yn = nodeYCoordinates[globalNodes[local]];
            x += xn * n[local];
            y += yn * n[local];
            xKsi += xn * dKsi[local];
            xEta += xn * dEta[local];
            yKsi += yn * dKsi[local];
            yEta += yn * dEta[local];
        }
        return new IsoparametricMapping(x, y, xKsi, xEta, yKsi, yEta, xKsi * yEta - xEta * yKsi);
    }

    /**
     * 形状関数の x 微分 {@code (yEta·N_ksi − yKsi·N_eta) / det} を返します。
     *
     * @param basis 形状関数の値と微分です
     * @return x 微分です
     */
    public double[] derivX(BasisFunctionValues basis) {
        double[] dKsi = basis.getDerivKsi();
        double[] dEta = basis.getDerivEta();
        double[] out = new double[dKsi.length];
        for (int n = 0; n < out.length; n++) {
            out[n] = (yEta * dKsi[n] - yKsi * dEta[n]) / detJacobian;
        }
        return out;
    }

    /**
     * 形状関数の y 微分 {@code (xKsi·N_eta − xEta·N_ksi) / det} を返します。
     *
     * @param basis 形状関数の値と微分です
     * @return y 微分です
     */
    public double[] derivY(BasisFunctionValues basis) {
        double[] dKsi = basis.getDerivKsi();
        double[] dEta = basis.getDerivEta();
        double[] out = new double[dKsi.length];
        for (int n = 0; n < out.length; n++) {
            out[n] = (xKsi * dEta[n] - xEta * dKsi[n]) / detJacobian;
        }
        return out;
    }
}
