package io.github.yok.fea.core.mesh;

import com.google.common.base.Preconditions;
import io.github.yok.fea.core.UnsupportedConfigurationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * 矩形領域 [0,maxX]×[0,maxY]（1D では [0,maxX]）上の構造格子を生成するクラスです。
 *
 * <p>
 * 節点番号は列優先（同じ x 列の節点が連続）で、節点 {@code i * totalNodesY + j} が格子位置 (i, j) に対応します。
 * 要素番号は {@code i * numElementsY + j}（i: x 方向、j: y 方向の要素位置）です。
 * 要素節点対応表（NOP）と境界要素の分類は 2 次要素のみ実装しています。
 * </p>
 */
@Slf4j
public final class StructuredMeshGenerator implements MeshGenerator {

    /**
     * 構造格子の設定を扱えるかどうかを返します。
     *
     * @param configuration メッシュ設定です
     * @return メッシュファイルを使用しない設定の場合は true です
     */
    @Override
    public boolean supports(MeshConfiguration configuration) {
        return configuration != null && !configuration.usesMeshFile();
    }

    /**
     * 節点座標・NOP・境界要素をまとめて生成します。
     *
     * @param configuration メッシュ設定です（メッシュファイル指定は不可）
     * @return メッシュです
     * @throws IllegalArgumentException 設定が null またはメッシュファイル指定の場合に発生します
     * @throws UnsupportedConfigurationException 1 次要素、または 1D の境界分類が要求された場合に発生します
     */
    @Override
    public Mesh generate(MeshConfiguration configuration) {
        Preconditions.checkArgument(supports(configuration),
                "構造格子の設定ではありません（meshFile 指定時は JsonMeshFileReader を使用してください）");

        long t0 = System.nanoTime();

        NodesCoordinates coordinates = generateNodeCoordinates(configuration);
        int[][] nop = generateNodalNumbering(configuration);
        Map<String, List<BoundaryElement>> boundaries = findBoundaryElements(configuration);

        Mesh mesh = new Mesh(configuration.getMeshDimension(), configuration.getElementOrder(),
                coordinates.getNodesXCoordinates(), coordinates.getNodesYCoordinates(),
                totalNodesX(configuration), totalNodesY(configuration), nop, boundaries);

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("メッシュを生成しました。次元={}、次数={}、要素数={}x{}、節点数={}、所要時間={}ms",
                configuration.getMeshDimension().getLabel(), configuration.getElementOrder().getLabel(),
                configuration.getNumElementsX(), configuration.getNumElementsY(), mesh.totalNodes(),
                elapsedMs);
        return mesh;
    }

    /**
     * 節点座標を生成します。
     *
     * <p>
     * 節点数は要素次数によらず各方向 {@code 2 * numElements + 1} です。2D の節点間隔は要素幅の半分
     * （{@code maxX / numElementsX / 2}）で、最後の節点は maxX（maxY）に一致します。1D の節点間隔は
     * {@code maxX / numElementsX} で、y 座標はすべて 0 です。
     * </p>
     *
     * @param configuration メッシュ設定です
     * @return 節点座標です
     */
    public NodesCoordinates generateNodeCoordinates(MeshConfiguration configuration) {
        int nx = totalNodesX(configuration);
        int ny = totalNodesY(configuration);

        double stepX;
        double stepY;
        if (configuration.getMeshDimension() == MeshDimension.TWO_D) {
            stepX = configuration.getMaxX() / configuration.getNumElementsX() / 2.0;
            stepY = configuration.getMaxY() / configuration.getNumElementsY() / 2.0;
        } else {
            stepX = configuration.getMaxX() / configuration.getNumElementsX();
            stepY = 0.0;
        }

        double[] xs = new double[nx * ny];
        double[] ys = new double[nx * ny];
        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < ny; j++) {
                int node = i * ny + j;
                xs[node] = i * stepX;
                ys[node] = j * stepY;
            }
        }
        return new NodesCoordinates(xs, ys);
    }

    /**
     * 要素節点対応表（NOP）を生成します。
     *
     * <p>
     * 2D の 2 次要素では、要素 (i, j) の局所節点 (a, b) は全体節点 ID
     * {@code totalNodesY * (2i + a) + 2j + b + 1} に対応します（a, b は {@link QuadraticQuadNode} の格子位置）。
     * 1D の 2 次要素では要素 e が ID {@code 2e+1, 2e+2, 2e+3} を参照します。
     * </p>
     *
     * @param configuration メッシュ設定です
     * @return NOP（1 始まりの全体節点 ID）です
     * @throws UnsupportedConfigurationException 1 次要素の場合に発生します
     */
    public int[][] generateNodalNumbering(MeshConfiguration configuration) {
        requireQuadratic("generateNodalNumbering", configuration);

        int numX = configuration.getNumElementsX();
        if (configuration.getMeshDimension() == MeshDimension.ONE_D) {
            int[][] nop = new int[numX][3];
            for (int e = 0; e < numX; e++) {
                nop[e][0] = 2 * e + 1;
                nop[e][1] = 2 * e + 2;
                nop[e][2] = 2 * e + 3;
            }
            return nop;
        }

        int numY = configuration.getNumElementsY();
        int ny = totalNodesY(configuration);
        QuadraticQuadNode[] layout = QuadraticQuadNode.values();

        int[][] nop = new int[numX * numY][layout.length];
        for (int i = 0; i < numX; i++) {
            for (int j = 0; j < numY; j++) {
                int element = i * numY + j;
                for (QuadraticQuadNode node : layout) {
                    nop[element][node.index()] =
                            ny * (2 * i + node.getKsiIndex()) + 2 * j + node.getEtaIndex() + 1;
                }
            }
        }
        return nop;
    }

    /**
     * 境界に接する要素を辺ごとに分類します。
     *
     * <p>
     * 返却マップのキーは bottom, left, top, right の順です。隅の要素は 2 つの辺に現れます。
     * </p>
     *
     * @param configuration メッシュ設定です
     * @return 境界 ID ごとの境界要素です
     * @throws UnsupportedConfigurationException 1D または 1 次要素の場合に発生します
     */
    public Map<String, List<BoundaryElement>> findBoundaryElements(MeshConfiguration configuration) {
        if (configuration.getMeshDimension() == MeshDimension.ONE_D) {
            throw new UnsupportedConfigurationException("findBoundaryElements",
                    configuration.getMeshDimension(), configuration.getElementOrder());
        }
        requireQuadratic("findBoundaryElements", configuration);

        int numX = configuration.getNumElementsX();
        int numY = configuration.getNumElementsY();

        Map<String, List<BoundaryElement>> boundaries = new LinkedHashMap<>();
        for (BoundarySide side : BoundarySide.values()) {
            boundaries.put(side.getId(), new ArrayList<>());
        }

        for (int i = 0; i < numX; i++) {
            for (int j = 0; j < numY; j++) {
                int element = i * numY + j;
                if (j == 0) {
                    boundaries.get(BoundarySide.BOTTOM.getId())
                            .add(new BoundaryElement(element, BoundarySide.BOTTOM));
                }
                if (i == 0) {
                    boundaries.get(BoundarySide.LEFT.getId())
                            .add(new BoundaryElement(element, BoundarySide.LEFT));
                }
                if (j == numY - 1) {
                    boundaries.get(BoundarySide.TOP.getId())
                            .add(new BoundaryElement(element, BoundarySide.TOP));
                }
                if (i == numX - 1) {
                    boundaries.get(BoundarySide.RIGHT.getId())
                            .add(new BoundaryElement(element, BoundarySide.RIGHT));
                }
            }
        }
        return boundaries;
    }

    private static int totalNodesX(MeshConfiguration configuration) {
        return 2 * configuration.getNumElementsX() + 1;
    }

    private static int totalNodesY(MeshConfiguration configuration) {
        if (configuration.getMeshDimension() == MeshDimension.ONE_D) {
            return 1;
        }
        return 2 * configuration.getNumElementsY() + 1;
    }

    private static void requireQuadratic(String operation, MeshConfiguration configuration) {
        if (configuration.getElementOrder() != ElementOrder.QUADRATIC) {
            throw new UnsupportedConfigurationException(operation, configuration.getMeshDimension(),
                    configuration.getElementOrder());
        }
    }
}
