package io.github.yok.fea.core.boundary;

import io.github.yok.fea.core.UnsupportedConfigurationException;
import io.github.yok.fea.core.assembly.IsoparametricMapping;
import io.github.yok.fea.core.assembly.LinearSystem;
import io.github.yok.fea.core.basis.BasisFunctionValues;
import io.github.yok.fea.core.basis.BasisFunctions;
import io.github.yok.fea.core.basis.LagrangeBasisFunctions;
import io.github.yok.fea.core.mesh.BoundaryElement;
import io.github.yok.fea.core.mesh.BoundarySide;
import io.github.yok.fea.core.mesh.ElementOrder;
import io.github.yok.fea.core.mesh.Mesh;
import io.github.yok.fea.core.mesh.MeshDimension;
import io.github.yok.fea.core.mesh.QuadraticQuadNode;
import io.github.yok.fea.core.quadrature.GaussQuadrature;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * 組み立て済みの全体系へ熱的境界条件を適用するクラスです。
 *
 * <p>
 * 対流（Robin 型）の境界積分をすべて加算した後に、温度固定（Dirichlet 型）の行を上書きします。
 * このため隅の節点では常に温度固定が優先され、温度固定の境界どうしが隅を共有する場合は
 * 後に宣言された境界の値が残ります。2D の 2 次要素のみ対応しています。
 * </p>
 */
@Slf4j
public final class ThermalBoundaryConditionImposer {

    /**
     * 対流条件 → 温度固定条件の順に境界条件を適用します。
     *
     * @param system 組み立て済みの連立方程式です（直接変更されます）
     * @param mesh メッシュです
     * @param boundaryConditions 境界条件です
     * @throws BoundaryConditionException メッシュに存在しない境界 ID が指定された場合に発生します
     * @throws UnsupportedConfigurationException 2D の 2 次要素以外の場合に発生します
     */
    public void impose(LinearSystem system, Mesh mesh, BoundaryConditions boundaryConditions) {
        requireArguments(system, mesh, boundaryConditions);
        long t0 = System.nanoTime();

        // 系を変更する前にすべての境界 ID を確認します。
        for (String boundaryId : boundaryConditions.boundaryIds()) {
            boundaryElementsOf(mesh, boundaryId);
        }

        imposeConvection(system, mesh, boundaryConditions);
        imposeConstantTemperature(system, mesh, boundaryConditions);

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("境界条件を適用しました。境界数={}、所要時間={}ms", boundaryConditions.size(), elapsedMs);
    }

    /**
     * 対流（Robin 型）境界条件を適用します。
     *
     * <p>
     * 境界要素の辺上で一方の自然座標を 0 または 1 に固定し、他方を積分点で走査して 1 次元積分します。
     * 辺の線素は水平辺で ∂x/∂ksi、垂直辺で ∂y/∂eta です。辺上の 3 節点のみに
     * {@code residual[m] += -w*J*N_m*h*Text}、{@code jacobian[m][n] += -w*J*N_m*N_n*h} を加算します。
     * </p>
     *
     * @param system 連立方程式です（直接変更されます）
     * @param mesh メッシュです
     * @param boundaryConditions 境界条件です
     */
    public void imposeConvection(LinearSystem system, Mesh mesh,
            BoundaryConditions boundaryConditions) {
        requireArguments(system, mesh, boundaryConditions);

        BasisFunctions basisFunctions = null;
        GaussQuadrature quadrature = GaussQuadrature.forOrder(mesh.getElementOrder());
        double[] points = quadrature.getPoints();
        double[] weights = quadrature.getWeights();
        double[] xs = mesh.getNodeXCoordinates();
        double[] ys = mesh.getNodeYCoordinates();

        for (Map.Entry<String, BoundaryCondition> entry : boundaryConditions.asMap().entrySet()) {
            if (!(entry.getValue() instanceof ConvectionBoundaryCondition)) {
                continue;
            }
            ConvectionBoundaryCondition convection = (ConvectionBoundaryCondition) entry.getValue();
            List<BoundaryElement> elements = boundaryElementsOf(mesh, entry.getKey());
            requireQuadratic2D("imposeConvection", mesh);
            if (basisFunctions == null) {
                basisFunctions =
                        new LagrangeBasisFunctions(mesh.getMeshDimension(), mesh.getElementOrder());
            }

            double h = convection.getHeatTransferCoefficient();
            double externalTemperature = convection.getExternalTemperature();
            if (!(h > 0.0)) {
                log.warn("熱伝達係数が正ではありません。境界={}、h={}", entry.getKey(), h);
            }

            for (BoundaryElement be : elements) {
                int[] globalNodes = mesh.globalNodeIndicesOf(be.getElementIndex());
                BoundarySide side = be.getSide();
                QuadraticQuadNode[] edgeNodes = side.getQuadraticEdgeNodes();

                for (int l = 0; l < points.length; l++) {
                    double[] natural = side.naturalCoordinatesAt(points[l]);
                    BasisFunctionValues basis = basisFunctions.evaluate(natural[0], natural[1]);
                    IsoparametricMapping mapping = IsoparametricMapping.of(basis, xs, ys, globalNodes);
                    double edgeJacobian = side.isHorizontal() ? mapping.getXKsi() : mapping.getYEta();
                    double w = weights[l] * edgeJacobian;
                    double[] n = basis.getValues();

                    for (QuadraticQuadNode mNode : edgeNodes) {
                        int m = mNode.index();
                        int row = globalNodes[m];
                        system.addResidual(row, -w * n[m] * h * externalTemperature);
                        for (QuadraticQuadNode kNode : edgeNodes) {
                            int k = kNode.index();
                            system.addJacobian(row, globalNodes[k], -w * n[m] * n[k] * h);
                        }
                    }
                }
            }
            log.debug("対流境界条件を適用しました。境界={}、境界要素数={}、{}", entry.getKey(), elements.size(),
                    convection.describe());
        }
    }

    /**
     * 温度固定（Dirichlet 型）境界条件を適用します。
     *
     * <p>
     * 境界上の全体節点ごとに、行を 0 にして対角を 1、右辺を固定温度にします。
     * 対流条件の適用後に呼び出してください。
     * </p>
     *
     * @param system 連立方程式です（直接変更されます）
     * @param mesh メッシュです
     * @param boundaryConditions 境界条件です
     */
    public void imposeConstantTemperature(LinearSystem system, Mesh mesh,
            BoundaryConditions boundaryConditions) {
        requireArguments(system, mesh, boundaryConditions);

        for (Map.Entry<String, BoundaryCondition> entry : boundaryConditions.asMap().entrySet()) {
            if (!(entry.getValue() instanceof ConstantTemperatureBoundaryCondition)) {
                continue;
            }
            double temperature =
                    ((ConstantTemperatureBoundaryCondition) entry.getValue()).getTemperature();
            List<BoundaryElement> elements = boundaryElementsOf(mesh, entry.getKey());
            requireQuadratic2D("imposeConstantTemperature", mesh);

            for (BoundaryElement be : elements) {
                int[] globalNodes = mesh.globalNodeIndicesOf(be.getElementIndex());
                for (QuadraticQuadNode node : be.getSide().getQuadraticEdgeNodes()) {
                    system.fixRow(globalNodes[node.index()], temperature);
                }
            }
            log.debug("温度固定境界条件を適用しました。境界={}、境界要素数={}、T={}", entry.getKey(),
                    elements.size(), temperature);
        }
    }

    private static List<BoundaryElement> boundaryElementsOf(Mesh mesh, String boundaryId) {
        List<BoundaryElement> elements = mesh.getBoundaryElements().get(boundaryId);
        if (elements == null) {
            throw new BoundaryConditionException(boundaryId,
                    "メッシュに存在しない境界が指定されています（定義済み: " + mesh.boundaryIds() + "）");
        }
        return elements;
    }

    private static void requireQuadratic2D(String operation, Mesh mesh) {
        if (mesh.getMeshDimension() != MeshDimension.TWO_D
                || mesh.getElementOrder() != ElementOrder.QUADRATIC) {
            throw new UnsupportedConfigurationException(operation, mesh.getMeshDimension(),
                    mesh.getElementOrder());
        }
    }

    private static void requireArguments(LinearSystem system, Mesh mesh,
            BoundaryConditions boundaryConditions) {
        if (system == null || mesh == null || boundaryConditions == null) {
            throw new IllegalArgumentException("system/mesh/boundaryConditions は null 不可です");
        }
        if (system.size() != mesh.totalNodes()) {
            throw new IllegalArgumentException(
                    "連立方程式の次元と節点数が一致しません: " + system.size() + " vs " + mesh.totalNodes());
        }
    }
}
