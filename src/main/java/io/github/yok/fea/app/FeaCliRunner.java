package io.github.yok.fea.app;

import io.github.yok.fea.core.solver.HeatTransferModel;
import io.github.yok.fea.core.solver.SolidHeatTransferSolver;
import io.github.yok.fea.core.solver.SolveResult;
import io.github.yok.fea.out.ResultWriter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で fea-solver を実行するクラスです。
 *
 * <p>
 * 設定値から組み立てた問題定義を 1 回解き、節点温度を出力して要約を表示します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class FeaCliRunner implements CommandLineRunner {

    /**
     * fea-solver の設定値（fea.*）です。
     */
    private final FeaProperties properties;

    /**
     * 問題定義です。
     */
    private final HeatTransferModel model;

    /**
     * 定常固体熱伝導ソルバです。
     */
    private final SolidHeatTransferSolver solver;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== fea-solver start: " + model.getSolverType().getLabel() + " ===");
        System.out.print(properties.toMultilineString());

        SolveResult result = solver.solve(model);
        resultWriter.write(model, result);

        System.out.println("結果: 節点数=" + result.getSolutionVector().length + ", T_min="
                + fmt5(result.minTemperature()) + ", T_max=" + fmt5(result.maxTemperature())
                + ", T_mean=" + fmt5(result.meanTemperature()));
        System.out.println("出力先: " + properties.getOutput().getDir());
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
