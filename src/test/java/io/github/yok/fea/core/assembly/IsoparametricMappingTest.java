package io.github.yok.fea.core.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.fea.core.basis.BasisFunctionValues;
import io.github.yok.fea.core.basis.LagrangeBasisFunctions;
import io.github.yok.fea.core.mesh.ElementOrder;
import io.github.yok.fea.core.mesh.Mesh;
import io.github.yok.fea.core.mesh.MeshConfiguration;
import io.github.yok.fea.core.mesh.MeshDimension;
import io.github.yok.fea.core.mesh.StructuredMeshGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class IsoparametricMappingTest {

    private final LagrangeBasisFunctions basis =
            new LagrangeBasisFunctions(MeshDimension.TWO_D, ElementOrder.QUADRATIC);

    @ParameterizedTest
    @CsvSource({"0.1127, 0.1127", "0.5, 0.5", "0.8873, 0.3"})
    @DisplayName("直辺の長方形要素ではヤコビアンが一定で、要素幅×要素高さに一致する")
    void detJacobian_isElementArea(double ksi, double eta) {
        Mesh mesh = new StructuredMeshGenerator()
                .generate(MeshConfiguration.twoDimensional(ElementOrder.QUADRATIC, 2, 2, 1.0, 1.0));
        BasisFunctionValues v = basis.evaluate(ksi, eta);

        // 要素 3（右上）: [0.5,1]x[0.5,1]
        IsoparametricMapping m = IsoparametricMapping.of(v, mesh.getNodeXCoordinates(),
                mesh.getNodeYCoordinates(), mesh.globalNodeIndicesOf(3));

        assertThat(m.getDetJacobian()).isCloseTo(0.25, within(1e-12));
        assertThat(m.getXKsi()).isCloseTo(0.5, within(1e-12));
        assertThat(m.getYEta()).isCloseTo(0.5, within(1e-12));
        assertThat(m.getXEta()).isCloseTo(0.0, within(1e-12));
        assertThat(m.getX()).isCloseTo(0.5 + 0.5 * ksi, within(1e-12));
        assertThat(m.getY()).isCloseTo(0.5 + 0.5 * eta, within(1e-12));
    }

    @ParameterizedTest
    @CsvSource({"0.25, 0.75", "0.6, 0.4"})
    @DisplayName("物理微分は x, y の 1 次関数を正しく微分する")
    void physicalDerivatives_reproduceLinearField(double ksi, double eta) {
        Mesh mesh = new StructuredMeshGenerator()
                .generate(MeshConfiguration.twoDimensional(ElementOrder.QUADRATIC, 1, 1, 2.0, 3.0));
        BasisFunctionValues v = basis.evaluate(ksi, eta);
        int[] nodes = mesh.globalNodeIndicesOf(0);
        IsoparametricMapping m = IsoparametricMapping.of(v, mesh.getNodeXCoordinates(),
                mesh.getNodeYCoordinates(), nodes);

        double[] nx = m.derivX(v);
        double[] ny = m.derivY(v);

        // T = 3x - 2y の勾配は (3, -2)
        double dTdx = 0.0;
        double dTdy = 0.0;
        for (int n = 0; n < nodes.length; n++) {
            double t = 3.0 * mesh.getNodeXCoordinates()[nodes[n]]
                    - 2.0 * mesh.getNodeYCoordinates()[nodes[n]];
            dTdx += nx[n] * t;
            dTdy += ny[n] * t;
        }
        assertThat(dTdx).isCloseTo(3.0, within(1e-12));
        assertThat(dTdy).isCloseTo(-2.0, within(1e-12));
        assertThat(m.getDetJacobian()).isCloseTo(6.0, within(1e-12));
    }
}
