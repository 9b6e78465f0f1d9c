package io.github.yok.fea.out;

import io.github.yok.fea.core.solver.HeatTransferModel;
import io.github.yok.fea.core.solver.SolveResult;

/**
 * 計算結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 問題定義と解（節点温度）を出力します。
     *
     * @param model 問題定義です
     * @param result 解ベクトルと節点座標です
     */
    void write(HeatTransferModel model, SolveResult result);
}
