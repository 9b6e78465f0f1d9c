package io.github.yok.fea.core.mesh;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * メッシュの空間次元です。
 */
@Getter
@RequiredArgsConstructor
public enum MeshDimension {

    /**
     * 1 次元（線分 [0, maxX]）です。
     */
    ONE_D("1D"),

    /**
     * 2 次元（矩形 [0, maxX]×[0, maxY]）です。
     */
    TWO_D("2D");

    /**
     * 設定ファイル上の表記です。
     */
    private final String label;

    /**
     * 設定ファイル上の表記（"1D"/"2D"）から次元を解決します。
     *
     * @param label 表記です（大文字小文字は区別しません）
     * @return 次元です
     * @throws IllegalArgumentException 表記が null または未知の場合に発生します
     */
    public static MeshDimension fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("meshDimension は必須です");
        }
        for (MeshDimension d : values()) {
            if (d.label.equalsIgnoreCase(label.trim())) {
                return d;
            }
        }
        throw new IllegalArgumentException("meshDimension は 1D/2D のいずれかを指定してください: " + label);
    }
}
