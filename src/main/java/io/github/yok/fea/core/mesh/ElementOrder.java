package io.github.yok.fea.core.mesh;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 要素の補間次数です。
 */
@Getter
@RequiredArgsConstructor
public enum ElementOrder {

    /**
     * 1 次要素（1D: 2 節点、2D: 4 節点）です。
     */
    LINEAR("linear", 2),

    /**
     * 2 次要素（1D: 3 節点、2D: 9 節点）です。
     */
    QUADRATIC("quadratic", 3);

    /**
     * 設定ファイル上の表記です。
     */
    private final String label;

    /**
     * 1 軸あたりの節点数です。
     */
    private final int nodesPerAxis;

    /**
     * 指定次元の要素 1 個あたりの節点数を返します。
     *
     * @param dimension メッシュ次元です
     * @return 要素あたりの節点数です
     */
    public int nodesPerElement(MeshDimension dimension) {
        return dimension == MeshDimension.ONE_D ? nodesPerAxis : nodesPerAxis * nodesPerAxis;
    }

    /**
     * 設定ファイル上の表記（"linear"/"quadratic"）から次数を解決します。
     *
     * @param label 表記です（大文字小文字は区別しません）
     * @return 要素次数です
     * @throws IllegalArgumentException 表記が null または未知の場合に発生します
     */
    public static ElementOrder fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("elementOrder は必須です");
        }
        for (ElementOrder o : values()) {
            if (o.label.equalsIgnoreCase(label.trim())) {
                return o;
            }
        }
        throw new IllegalArgumentException(
                "elementOrder は linear/quadratic のいずれかを指定してください: " + label);
    }
}
