package io.github.yok.fea.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;

/**
 * 密な連立一次方程式 {@code A x = b} を解くバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリや分解手法を差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface LinearSolverBackend {

    /**
     * 連立一次方程式を解きます。
     *
     * @param matrix 係数行列です（正方、変更されません）
     * @param vector 右辺ベクトルです（変更されません）
     * @return 解ベクトルです
     * @throws IllegalArgumentException 次元が一致しない場合に発生します
     * @throws IllegalStateException 係数行列が特異で解けない場合に発生します
     */
    double[] solve(DMatrixRMaj matrix, double[] vector);
}
