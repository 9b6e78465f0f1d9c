package io.github.yok.fea.core.assembly;

import io.github.yok.fea.core.UnsupportedConfigurationException;
import io.github.yok.fea.core.basis.BasisFunctionValues;
import io.github.yok.fea.core.basis.BasisFunctions;
import io.github.yok.fea.core.basis.LagrangeBasisFunctions;
import io.github.yok.fea.core.mesh.ElementOrder;
import io.github.yok.fea.core.mesh.Mesh;
import io.github.yok.fea.core.mesh.MeshDimension;
import io.github.yok.fea.core.quadrature.GaussQuadrature;
import lombok.extern.slf4j.Slf4j;

/**
 * 定常熱伝導の Galerkin 残差ベクトルとヤコビ行列を組み立てるクラスです。
 *
 * <p>
 * 要素ごとに積分点 (ksi_a, eta_b) で形状関数を評価し、等パラメトリック写像から物理微分を求めて、
 * {@code residual[m] += wa*wb*det*N_m} と
 * {@code jacobian[m][n] += -wa*wb*det*(Nx_m*Nx_n + Ny_m*Ny_n)} を全体系へ加算します。
 * 境界条件はここでは扱いません。2D の 2 次要素のみ対応しています。
 * </p>
 */
@Slf4j
public final class SolidHeatTransferAssembler {

    /**
     * 全体系を組み立てます。
     *
     * @param mesh メッシュです（null 不可）
     * @return 境界条件適用前の連立方程式です
     * @throws IllegalArgumentException mesh が null の場合に発生します
     * @throws UnsupportedConfigurationException 2D の 2 次要素以外のメッシュの場合に発生します
     * @throws DegenerateElementException ヤコビアンが正でない積分点があった場合に発生します
     */
    public LinearSystem assemble(Mesh mesh) {
        if (mesh == null) {
            throw new IllegalArgumentException("mesh は null 不可です");
        }
        if (mesh.getMeshDimension() != MeshDimension.TWO_D
                || mesh.getElementOrder() != ElementOrder.QUADRATIC) {
            throw new UnsupportedConfigurationException("assemble", mesh.getMeshDimension(),
                    mesh.getElementOrder());
        }

        long t0 = System.nanoTime();

        BasisFunctions basisFunctions =
                new LagrangeBasisFunctions(mesh.getMeshDimension(), mesh.getElementOrder());
        GaussQuadrature quadrature = GaussQuadrature.forOrder(mesh.getElementOrder());
        double[] points = quadrature.getPoints();
        double[] weights = quadrature.getWeights();

        double[] xs = mesh.getNodeXCoordinates();
        double[] ys = mesh.getNodeYCoordinates();

        LinearSystem system = new LinearSystem(mesh.totalNodes());

        for (int element = 0; element < mesh.totalElements(); element++) {
            int[] globalNodes = mesh.globalNodeIndicesOf(element);

            for (int a = 0; a < points.length; a++) {
                for (int b = 0; b < points.length; b++) {
                    BasisFunctionValues basis = basisFunctions.evaluate(points[a], points[b]);
                    IsoparametricMapping mapping = IsoparametricMapping.of(basis, xs, ys, globalNodes);

                    double det = mapping.getDetJacobian();
                    if (!(det > 0.0)) {
                        throw new DegenerateElementException(element, points[a], points[b], det);
                    }

                    double[] n = basis.getValues();
                    double[] nx = mapping.derivX(basis);
                    double[] ny = mapping.derivY(basis);
                    double w = weights[a] * weights[b] * det;

                    for (int m = 0; m < globalNodes.length; m++) {
                        int row = globalNodes[m];
                        system.addResidual(row, w * n[m]);
                        for (int k = 0; k < globalNodes.length; k++) {
                            system.addJacobian(row, globalNodes[k],
                                    -w * (nx[m] * nx[k] + ny[m] * ny[k]));
                        }
                    }
                }
            }
        }

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("全体系を組み立てました。要素数={}、節点数={}、積分点数={}x{}、所要時間={}ms",
                mesh.totalElements(), mesh.totalNodes(), points.length, points.length, elapsedMs);
        return system;
    }
}
