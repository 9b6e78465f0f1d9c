package io.github.yok.fea.core.mesh;

/**
 * メッシュ設定から {@link Mesh} を生成するインタフェースです。
 *
 * <p>
 * 構造格子の生成とメッシュファイルの読み込みを同じ入口で差し替えられるようにするためのインタフェースです。
 * </p>
 */
public interface MeshGenerator {

    /**
     * メッシュを生成します。
     *
     * @param configuration メッシュ設定です
     * @return メッシュです
     * @throws IllegalArgumentException 設定が不正な場合に発生します
     * @throws io.github.yok.fea.core.UnsupportedConfigurationException 未対応の次元・次数の場合に発生します
     */
    Mesh generate(MeshConfiguration configuration);

    /**
     * この生成器が指定された設定を扱えるかどうかを返します。
     *
     * @param configuration メッシュ設定です
     * @return 扱える場合は true です
     */
    boolean supports(MeshConfiguration configuration);
}
