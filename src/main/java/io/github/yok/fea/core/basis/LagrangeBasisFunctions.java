package io.github.yok.fea.core.basis;

import io.github.yok.fea.core.mesh.ElementOrder;
import io.github.yok.fea.core.mesh.MeshDimension;
import lombok.Getter;

/**
 * 参照要素 [0,1]（2D では [0,1]²）上の Lagrange 形状関数を評価するクラスです。
 *
 * <p>
 * 1D の 1 次要素は {@code 1-ksi, ksi}、2 次要素は {@code 1-3ksi+2ksi², 4ksi-4ksi², -ksi+2ksi²} です。
 * 2D は 1D 関数のテンソル積 {@code N[p*a+b] = f_a(ksi) * f_b(eta)} で、p は 1 軸あたりの節点数です。
 * この並びは {@link io.github.yok.fea.core.mesh.QuadraticQuadNode} の局所番号と一致します。
 * </p>
 */
@Getter
public final class LagrangeBasisFunctions implements BasisFunctions {

    /**
     * メッシュ次元です。
     */
    private final MeshDimension meshDimension;

    /**
     * 要素次数です。
     */
    private final ElementOrder elementOrder;

    /**
     * 評価器を生成します。
     *
     * @param meshDimension メッシュ次元です（null 不可）
     * @param elementOrder 要素次数です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public LagrangeBasisFunctions(MeshDimension meshDimension, ElementOrder elementOrder) {
        if (meshDimension == null || elementOrder == null) {
            throw new IllegalArgumentException("meshDimension/elementOrder は null 不可です");
        }
        this.meshDimension = meshDimension;
        this.elementOrder = elementOrder;
    }

    @Override
    public int nodeCount() {
        return elementOrder.nodesPerElement(meshDimension);
    }

    @Override
    public BasisFunctionValues evaluate(double ksi) {
        if (meshDimension != MeshDimension.ONE_D) {
            throw new IllegalArgumentException("2D 要素の評価には eta 座標が必要です");
        }
        double[] values = shape(ksi);
        double[] derivKsi = shapeDerivative(ksi);
        return new BasisFunctionValues(values, derivKsi, new double[values.length]);
    }

    @Override
    public BasisFunctionValues evaluate(double ksi, double eta) {
        if (meshDimension != MeshDimension.TWO_D) {
            throw new IllegalArgumentException("1D 要素に eta 座標は指定できません");
        }
        double[] fKsi = shape(ksi);
        double[] dfKsi = shapeDerivative(ksi);
        double[] fEta = shape(eta);
        double[] dfEta = shapeDerivative(eta);

        int p = elementOrder.getNodesPerAxis();
        double[] values = new double[p * p];
        double[] derivKsi = new double[p * p];
        double[] derivEta = new double[p * p];
        for (int a = 0; a < p; a++) {
            for (int b = 0; b < p; b++) {
                int n = p * a + b;
                values[n] = fKsi[a] * fEta[b];
                derivKsi[n] = dfKsi[a] * fEta[b];
                derivEta[n] = fKsi[a] * dfEta[b];
            }
        }
        return new BasisFunctionValues(values, derivKsi, derivEta);
    }

    /**
     * 1 軸の形状関数値です。
     */
    private double[] shape(double c) {
        if (elementOrder == ElementOrder.LINEAR) {
            return new double[] {1.0 - c, c};
        }
        return new double[] {1.0 - 3.0 * c + 2.0 * c * c, 4.0 * c - 4.0 * c * c,
                -c + 2.0 * c * c};
    }

    /**
     * 1 軸の形状関数の微分です。
     */
    private double[] shapeDerivative(double c) {
        if (elementOrder == ElementOrder.LINEAR) {
            return new double[] {-1.0, 1.0};
        }
        return new double[] {-3.0 + 4.0 * c, 4.0 - 8.0 * c, -1.0 + 4.0 * c};
    }
}
