package io.github.yok.fea.core.mesh;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.fea.core.UnsupportedConfigurationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StructuredMeshGeneratorTest {

    private StructuredMeshGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new StructuredMeshGenerator();
    }

    @Test
    @DisplayName("1x1 の 2 次要素メッシュは 9 節点で、四隅が単位正方形の頂点になる")
    void generate_singleQuadraticElement_hasNineNodesAtExpectedCorners() {
        Mesh mesh = generator.generate(
                MeshConfiguration.twoDimensional(ElementOrder.QUADRATIC, 1, 1, 1.0, 1.0));

        assertThat(mesh.totalNodes()).isEqualTo(9);
        assertThat(mesh.totalElements()).isEqualTo(1);
        assertThat(mesh.getTotalNodesX()).isEqualTo(3);
        assertThat(mesh.getTotalNodesY()).isEqualTo(3);

        double[] xs = mesh.getNodeXCoordinates();
        double[] ys = mesh.getNodeYCoordinates();
        // 列優先: 0=(0,0), 2=(0,1), 6=(1,0), 8=(1,1)
        assertThat(new double[] {xs[0], ys[0]}).containsExactly(0.0, 0.0);
        assertThat(new double[] {xs[2], ys[2]}).containsExactly(0.0, 1.0);
        assertThat(new double[] {xs[6], ys[6]}).containsExactly(1.0, 0.0);
        assertThat(new double[] {xs[8], ys[8]}).containsExactly(1.0, 1.0);
        assertThat(mesh.getNodalNumbering()[0]).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9);
    }

    @Test
    @DisplayName("2x2 メッシュの NOP は列優先の節点番号と局所節点の並びに一致する")
    void generateNodalNumbering_twoByTwo_matchesColumnMajorLayout() {
        int[][] nop = generator.generateNodalNumbering(
                MeshConfiguration.twoDimensional(ElementOrder.QUADRATIC, 2, 2, 1.0, 1.0));

        assertThat(nop).hasNumberOfRows(4);
        assertThat(nop[0]).containsExactly(1, 2, 3, 6, 7, 8, 11, 12, 13);
        assertThat(nop[1]).containsExactly(3, 4, 5, 8, 9, 10, 13, 14, 15);
        assertThat(nop[2]).containsExactly(11, 12, 13, 16, 17, 18, 21, 22, 23);
        assertThat(nop[3]).containsExactly(13, 14, 15, 18, 19, 20, 23, 24, 25);
    }

    @Test
    @DisplayName("節点座標は要素幅の半分刻みで、最後の節点が maxX, maxY に一致する")
    void generateNodeCoordinates_rectangle_lastNodeAtDomainCorner() {
        MeshConfiguration config =
                MeshConfiguration.twoDimensional(ElementOrder.QUADRATIC, 2, 3, 2.0, 1.5);
        NodesCoordinates coords = generator.generateNodeCoordinates(config);

        // totalNodesX=5, totalNodesY=7
        assertThat(coords.size()).isEqualTo(35);
        assertThat(coords.getNodesXCoordinates()[7]).isCloseTo(0.5, within(1e-12));
        assertThat(coords.getNodesYCoordinates()[1]).isCloseTo(0.25, within(1e-12));
        assertThat(coords.getNodesXCoordinates()[34]).isCloseTo(2.0, within(1e-12));
        assertThat(coords.getNodesYCoordinates()[34]).isCloseTo(1.5, within(1e-12));
    }

    @Test
    @DisplayName("境界要素は bottom/left/top/right の順に分類され、隅の要素は 2 つの辺に現れる")
    void findBoundaryElements_twoByTwo_classifiesCornerElementsTwice() {
        Map<String, List<BoundaryElement>> boundaries = generator.findBoundaryElements(
                MeshConfiguration.twoDimensional(ElementOrder.QUADRATIC, 2, 2, 1.0, 1.0));

        assertThat(boundaries.keySet()).containsExactly("bottom", "left", "top", "right");
        assertThat(boundaries.get("bottom")).containsExactly(
                new BoundaryElement(0, BoundarySide.BOTTOM), new BoundaryElement(2, BoundarySide.BOTTOM));
        assertThat(boundaries.get("left")).containsExactly(
                new BoundaryElement(0, BoundarySide.LEFT), new BoundaryElement(1, BoundarySide.LEFT));
        assertThat(boundaries.get("top")).containsExactly(
                new BoundaryElement(1, BoundarySide.TOP), new BoundaryElement(3, BoundarySide.TOP));
        assertThat(boundaries.get("right")).containsExactly(
                new BoundaryElement(2, BoundarySide.RIGHT), new BoundaryElement(3, BoundarySide.RIGHT));
    }

    @Test
    @DisplayName("1D の節点座標は 2n+1 節点を maxX/n 刻みで並べ、NOP は生成できるが境界分類は未対応として失敗する")
    void oneDimensional_coordinatesAndNumbering_butBoundaryUnsupported() {
        MeshConfiguration config = MeshConfiguration.oneDimensional(ElementOrder.QUADRATIC, 2, 1.0);

        NodesCoordinates coords = generator.generateNodeCoordinates(config);
        assertThat(coords.getNodesXCoordinates()).containsExactly(0.0, 0.5, 1.0, 1.5, 2.0);
        assertThat(coords.getNodesYCoordinates()).containsOnly(0.0);

        NodesCoordinates linear = generator.generateNodeCoordinates(
                MeshConfiguration.oneDimensional(ElementOrder.LINEAR, 2, 1.0));
        assertThat(linear.getNodesXCoordinates()).containsExactly(0.0, 0.5, 1.0, 1.5, 2.0);

        int[][] nop = generator.generateNodalNumbering(config);
        assertThat(nop[0]).containsExactly(1, 2, 3);
        assertThat(nop[1]).containsExactly(3, 4, 5);

        UnsupportedConfigurationException ex = catchThrowableOfType(
                () -> generator.generate(config), UnsupportedConfigurationException.class);
        assertThat(ex).isNotNull();
        assertThat(ex.getMeshDimension()).isEqualTo(MeshDimension.ONE_D);
    }

    @Test
    @DisplayName("1 次要素の NOP と境界分類は未対応として失敗する")
    void linearOrder_isUnsupported() {
        MeshConfiguration config =
                MeshConfiguration.twoDimensional(ElementOrder.LINEAR, 2, 2, 1.0, 1.0);

        assertThatThrownBy(() -> generator.generateNodalNumbering(config))
                .isInstanceOf(UnsupportedConfigurationException.class)
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> generator.findBoundaryElements(config))
                .isInstanceOf(UnsupportedConfigurationException.class);
        assertThat(generator.generateNodeCoordinates(config).size()).isEqualTo(25);
    }

    @Test
    @DisplayName("メッシュファイル指定の設定は扱わない")
    void generate_meshFileConfiguration_isRejected() {
        MeshConfiguration config = MeshConfiguration.fromFile(MeshDimension.TWO_D,
                ElementOrder.QUADRATIC, "mesh.json");

        assertThat(generator.supports(config)).isFalse();
        assertThatThrownBy(() -> generator.generate(config))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
