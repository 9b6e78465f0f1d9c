package io.github.yok.fea.core.mesh;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * 有限要素メッシュ（節点座標・要素節点対応表・境界要素）を表すクラスです。
 *
 * <p>
 * 要素節点対応表（NOP）は {@code nodalNumbering[要素番号][局所節点番号]} に 1 始まりの全体節点 ID を保持します。
 * 座標配列の添字は 0 始まりの全体節点番号です。配列は生成時に複製し、取得時も複製を返すため、
 * 生成後にメッシュが変更されることはありません。
 * </p>
 */
@Getter
public final class Mesh {

    /**
     * メッシュ次元です。
     */
    private final MeshDimension meshDimension;

    /**
     * 要素次数です。
     */
    private final ElementOrder elementOrder;

    /**
     * 節点の x 座標です。
     */
    @Getter(AccessLevel.NONE)
    private final double[] nodeXCoordinates;

    /**
     * 節点の y 座標です。
     */
    @Getter(AccessLevel.NONE)
    private final double[] nodeYCoordinates;

    /**
     * x 方向の節点数です（メッシュファイルの場合は全節点数）。
     */
    private final int totalNodesX;

    /**
     * y 方向の節点数です（1D およびメッシュファイルの場合は 1）。
     */
    private final int totalNodesY;

    /**
     * 要素節点対応表（NOP）です。
     */
    @Getter(AccessLevel.NONE)
    private final int[][] nodalNumbering;

    /**
     * 境界 ID ごとの境界要素の一覧です（宣言順を保持します）。
     */
    private final Map<String, List<BoundaryElement>> boundaryElements;

    /**
     * メッシュを生成します。
     *
     * @param meshDimension メッシュ次元です（null 不可）
     * @param elementOrder 要素次数です（null 不可）
     * @param nodeXCoordinates 節点の x 座標です（null 不可）
     * @param nodeYCoordinates 節点の y 座標です（x 座標と同じ長さ）
     * @param totalNodesX x 方向の節点数です
     * @param totalNodesY y 方向の節点数です
     * @param nodalNumbering 要素節点対応表です（1 始まり）
     * @param boundaryElements 境界 ID ごとの境界要素です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public Mesh(MeshDimension meshDimension, ElementOrder elementOrder, double[] nodeXCoordinates,
            double[] nodeYCoordinates, int totalNodesX, int totalNodesY, int[][] nodalNumbering,
            Map<String, List<BoundaryElement>> boundaryElements) {
        if (meshDimension == null || elementOrder == null) {
            throw new IllegalArgumentException("meshDimension/elementOrder は null 不可です");
        }
        if (nodeXCoordinates == null || nodeYCoordinates == null) {
            throw new IllegalArgumentException("節点座標は null 不可です");
        }
        if (nodeXCoordinates.length != nodeYCoordinates.length) {
            throw new IllegalArgumentException("x 座標と y 座標の長さが一致しません: "
                    + nodeXCoordinates.length + " vs " + nodeYCoordinates.length);
        }
        if (totalNodesX * totalNodesY != nodeXCoordinates.length) {
            throw new IllegalArgumentException("totalNodesX*totalNodesY と節点数が一致しません: "
                    + totalNodesX + "x" + totalNodesY + " vs " + nodeXCoordinates.length);
        }
        if (nodalNumbering == null || nodalNumbering.length == 0) {
            throw new IllegalArgumentException("要素節点対応表が空です");
        }
        if (boundaryElements == null) {
            throw new IllegalArgumentException("boundaryElements は null 不可です");
        }

        int expectedNodes = elementOrder.nodesPerElement(meshDimension);
        int totalNodes = nodeXCoordinates.length;
        for (int e = 0; e < nodalNumbering.length; e++) {
            int[] element = nodalNumbering[e];
            if (element == null || element.length != expectedNodes) {
                throw new IllegalArgumentException("要素 " + e + " の節点数が不正です（期待値 "
                        + expectedNodes + "）");
            }
            for (int id : element) {
                if (id < 1 || id > totalNodes) {
                    throw new IllegalArgumentException(
                            "要素 " + e + " の節点 ID が範囲外です: " + id + "（節点数 " + totalNodes + "）");
                }
            }
        }
        for (Map.Entry<String, List<BoundaryElement>> entry : boundaryElements.entrySet()) {
            for (BoundaryElement be : entry.getValue()) {
                if (be.getElementIndex() < 0 || be.getElementIndex() >= nodalNumbering.length) {
                    throw new IllegalArgumentException("境界 " + entry.getKey() + " の要素番号が範囲外です: "
                            + be.getElementIndex());
                }
            }
        }

        this.meshDimension = meshDimension;
        this.elementOrder = elementOrder;
        this.nodeXCoordinates = nodeXCoordinates.clone();
        this.nodeYCoordinates = nodeYCoordinates.clone();
        this.totalNodesX = totalNodesX;
        this.totalNodesY = totalNodesY;
        this.nodalNumbering = copyOf(nodalNumbering);

        Map<String, List<BoundaryElement>> copy = new LinkedHashMap<>();
        boundaryElements.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.boundaryElements = Collections.unmodifiableMap(copy);
    }

    /**
     * 節点の x 座標の複製を返します。
     *
     * @return 節点の x 座標です
     */
    public double[] getNodeXCoordinates() {
        return nodeXCoordinates.clone();
    }

    /**
     * 節点の y 座標の複製を返します。
     *
     * @return 節点の y 座標です
     */
    public double[] getNodeYCoordinates() {
        return nodeYCoordinates.clone();
    }

    /**
     * 要素節点対応表（NOP）の複製を返します。
     *
     * @return 1 始まりの全体節点 ID の表です
     */
    public int[][] getNodalNumbering() {
        return copyOf(nodalNumbering);
    }

    /**
     * 全節点数を返します。
     *
     * @return 全節点数です
     */
    public int totalNodes() {
        return nodeXCoordinates.length;
    }

    /**
     * 全要素数を返します。
     *
     * @return 全要素数です
     */
    public int totalElements() {
        return nodalNumbering.length;
    }

    /**
     * 要素あたりの節点数を返します。
     *
     * @return 要素あたりの節点数です
     */
    public int nodesPerElement() {
        return nodalNumbering[0].length;
    }

    /**
     * 指定要素の局所節点に対応する全体節点番号（0 始まり）を返します。
     *
     * @param elementIndex 要素番号です（0 始まり）
     * @return 局所節点順に並んだ 0 始まりの全体節点番号です
     */
    public int[] globalNodeIndicesOf(int elementIndex) {
        int[] ids = nodalNumbering[elementIndex];
        int[] out = new int[ids.length];
        for (int n = 0; n < ids.length; n++) {
            out[n] = ids[n] - 1;
        }
        return out;
    }

    /**
     * 境界 ID の一覧を返します。
     *
     * @return 境界 ID の一覧です
     */
    public Set<String> boundaryIds() {
        return boundaryElements.keySet();
    }

    /**
     * 節点座標の複製を返します。
     *
     * @return 節点座標です
     */
    public NodesCoordinates nodesCoordinates() {
        return new NodesCoordinates(getNodeXCoordinates(), getNodeYCoordinates());
    }

    private static int[][] copyOf(int[][] table) {
        int[][] copy = new int[table.length][];
        for (int e = 0; e < table.length; e++) {
            copy[e] = table[e] == null ? null : table[e].clone();
        }
        return copy;
    }
}
