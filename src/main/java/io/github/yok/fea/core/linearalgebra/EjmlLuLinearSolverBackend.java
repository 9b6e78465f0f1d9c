package io.github.yok.fea.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * EJML の LU 分解（部分ピボット付き）を用いて、密な連立一次方程式を解くクラスです。
 *
 * <p>
 * 分解器が入力を書き換える場合はコピーしてから渡すため、呼び出し元の行列とベクトルは変更されません。
 * </p>
 */
public final class EjmlLuLinearSolverBackend implements LinearSolverBackend {

    /**
     * 連立一次方程式を解きます。
     *
     * @param matrix 係数行列です
     * @param vector 右辺ベクトルです
     * @return 解ベクトルです
     * @throws IllegalArgumentException 引数が null または次元が一致しない場合に発生します
     * @throws IllegalStateException 分解に失敗した、または係数行列が特異な場合に発生します
     */
    @Override
    public double[] solve(DMatrixRMaj matrix, double[] vector) {
        if (matrix == null || vector == null) {
            throw new IllegalArgumentException("matrix/vector は null 不可です");
        }
        int n = matrix.numRows;
        if (matrix.numCols != n) {
            throw new IllegalArgumentException(
                    "係数行列は正方行列である必要があります: " + matrix.numRows + "x" + matrix.numCols);
        }
        if (vector.length != n) {
            throw new IllegalArgumentException(
                    "右辺ベクトルの長さが行列次元と一致しません: " + vector.length + " vs " + n);
        }

        // LU 分解器を生成します。
        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.lu(n);

        DMatrixRMaj a = solver.modifiesA() ? matrix.copy() : matrix;
        if (!solver.setA(a)) {
            throw new IllegalStateException("LU 分解に失敗しました（EJML）");
        }

        // ピボットが 0 の場合は特異とみなします。
        double quality = solver.quality();
        if (!(quality > 0.0)) {
            throw new IllegalStateException("係数行列が特異です（quality=" + quality + "）");
        }

        DMatrixRMaj b = new DMatrixRMaj(n, 1, true, vector);
        DMatrixRMaj x = new DMatrixRMaj(n, 1);
        solver.solve(b, x);

        double[] solution = new double[n];
        for (int i = 0; i < n; i++) {
            double v = x.get(i, 0);
            if (!Double.isFinite(v)) {
                throw new IllegalStateException("解が有限値ではありません: i=" + i + ", value=" + v);
            }
            solution[i] = v;
        }
        return solution;
    }
}
