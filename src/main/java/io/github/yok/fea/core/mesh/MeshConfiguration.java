package io.github.yok.fea.core.mesh;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * メッシュ生成の設定値を保持する不変クラスです。
 *
 * <p>
 * 構造格子を生成する場合は要素数と領域サイズを、メッシュファイルを読み込む場合はファイルパスを保持します。
 * 生成時に値を検証するため、ソルバ内部で設定不備が発覚することはありません。
 * </p>
 */
@Value
public class MeshConfiguration {

    /**
     * メッシュ次元です。
     */
    MeshDimension meshDimension;

    /**
     * 要素次数です。
     */
    ElementOrder elementOrder;

    /**
     * x 方向の要素数です。
     */
    int numElementsX;

    /**
     * y 方向の要素数です（1D では 1）。
     */
    int numElementsY;

    /**
     * 領域の x 方向の長さです。
     */
    double maxX;

    /**
     * 領域の y 方向の長さです（1D では 0）。
     */
    double maxY;

    /**
     * メッシュファイル（JSON）のパスです。構造格子を生成する場合は null です。
     */
    String meshFile;

    private MeshConfiguration(MeshDimension meshDimension, ElementOrder elementOrder,
            int numElementsX, int numElementsY, double maxX, double maxY, String meshFile) {
        Preconditions.checkArgument(meshDimension != null, "meshDimension は必須です");
        Preconditions.checkArgument(elementOrder != null, "elementOrder は必須です");
        if (meshFile == null) {
            Preconditions.checkArgument(numElementsX > 0, "numElementsX は 1 以上を指定してください: %s",
                    numElementsX);
            Preconditions.checkArgument(maxX > 0.0, "maxX は正の値を指定してください: %s", maxX);
            if (meshDimension == MeshDimension.TWO_D) {
                Preconditions.checkArgument(numElementsY > 0,
                        "numElementsY は 1 以上を指定してください: %s", numElementsY);
                Preconditions.checkArgument(maxY > 0.0, "maxY は正の値を指定してください: %s", maxY);
            }
        } else {
            Preconditions.checkArgument(!meshFile.isBlank(), "meshFile が空です");
        }
        this.meshDimension = meshDimension;
        this.elementOrder = elementOrder;
        this.numElementsX = numElementsX;
        this.numElementsY = numElementsY;
        this.maxX = maxX;
        this.maxY = maxY;
        this.meshFile = meshFile;
    }

    /**
     * 1 次元の構造格子の設定を生成します。
     *
     * @param elementOrder 要素次数です
     * @param numElementsX 要素数です（1 以上）
     * @param maxX 領域長です（正）
     * @return 設定です
     * @throws IllegalArgumentException 値が不正な場合に発生します
     */
    public static MeshConfiguration oneDimensional(ElementOrder elementOrder, int numElementsX,
            double maxX) {
        return new MeshConfiguration(MeshDimension.ONE_D, elementOrder, numElementsX, 1, maxX, 0.0,
                null);
    }

    /**
     * 2 次元の構造格子の設定を生成します。
     *
     * @param elementOrder 要素次数です
     * @param numElementsX x 方向の要素数です（1 以上）
     * @param numElementsY y 方向の要素数です（1 以上）
     * @param maxX x 方向の領域長です（正）
     * @param maxY y 方向の領域長です（正）
     * @return 設定です
     * @throws IllegalArgumentException 値が不正な場合に発生します
     */
    public static MeshConfiguration twoDimensional(ElementOrder elementOrder, int numElementsX,
            int numElementsY, double maxX, double maxY) {
        return new MeshConfiguration(MeshDimension.TWO_D, elementOrder, numElementsX, numElementsY,
                maxX, maxY, null);
    }

    /**
     * メッシュファイルを読み込む設定を生成します。
     *
     * @param meshDimension メッシュ次元です
     * @param elementOrder 要素次数です
     * @param meshFile メッシュファイルのパスです
     * @return 設定です
     * @throws IllegalArgumentException 値が不正な場合に発生します
     */
    public static MeshConfiguration fromFile(MeshDimension meshDimension,
            ElementOrder elementOrder, String meshFile) {
        Preconditions.checkArgument(meshFile != null, "meshFile は必須です");
        return new MeshConfiguration(meshDimension, elementOrder, 0, 0, 0.0, 0.0, meshFile);
    }

    /**
     * メッシュファイルを使用する設定かどうかを返します。
     *
     * @return メッシュファイルを使用する場合は true です
     */
    public boolean usesMeshFile() {
        return meshFile != null;
    }
}
