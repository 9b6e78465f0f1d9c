package io.github.yok.fea.out;

import io.github.yok.fea.core.mesh.MeshConfiguration;
import io.github.yok.fea.core.mesh.NodesCoordinates;
import io.github.yok.fea.core.solver.HeatTransferModel;
import io.github.yok.fea.core.solver.SolveResult;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（nx, ny は要素数、メッシュファイル使用時は {@code custom}）。
 * </p>
 *
 * <ul>
 * <li>{@code fea_solution_4x4.csv}（i, x, y, temperature）</li>
 * <li>{@code fea_meta_4x4.csv}（メッシュ設定・温度統計・境界条件などの補助情報）</li>
 * </ul>
 */
@Slf4j
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "fea";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException outputDir が空の場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 解と補助情報を CSV に出力します。
     *
     * @param model 問題定義です
     * @param result 解ベクトルと節点座標です
     * @throws IllegalArgumentException 引数が null の場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(HeatTransferModel model, SolveResult result) {
        if (model == null || result == null) {
            throw new IllegalArgumentException("model/result は null 不可です");
        }
        String suffix = caseLabel(model.getMeshConfiguration());
        try {
            Files.createDirectories(outputDir);
            Path solution = writeSolution(result, suffix);
            Path meta = writeMeta(model, result, suffix);
            log.info("結果を出力しました: {}, {}", solution.toAbsolutePath(), meta.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 出力ファイル名の要素数部分を返します。
     *
     * @param mesh メッシュ設定です
     * @return {@code nx x ny}、メッシュファイル使用時は {@code custom} です
     */
    static String caseLabel(MeshConfiguration mesh) {
        if (mesh.usesMeshFile()) {
            return "custom";
        }
        return mesh.getNumElementsX() + "x" + mesh.getNumElementsY();
    }

    /**
     * 節点温度を出力します。
     *
     * @param result 解です
     * @param suffix ファイル名の要素数部分です
     * @return 出力したファイルです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private Path writeSolution(SolveResult result, String suffix) throws IOException {
        Path file = outputDir.resolve(FILE_HEAD + "_solution_" + suffix + ".csv");
        NodesCoordinates coords = result.getNodesCoordinates();
        double[] xs = coords.getNodesXCoordinates();
        double[] ys = coords.getNodesYCoordinates();
        double[] t = result.getSolutionVector();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("i", "x", "y", "temperature").build().print(w)) {
            for (int i = 0; i < t.length; i++) {
                pr.printRecord(i, xs[i], ys[i], t[i]);
            }
        }
        return file;
    }

    /**
     * 補助情報（key, value）を出力します。
     *
     * @param model 問題定義です
     * @param result 解です
     * @param suffix ファイル名の要素数部分です
     * @return 出力したファイルです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private Path writeMeta(HeatTransferModel model, SolveResult result, String suffix)
            throws IOException {
        Path file = outputDir.resolve(FILE_HEAD + "_meta_" + suffix + ".csv");
        MeshConfiguration mesh = model.getMeshConfiguration();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {
            pr.printRecord("solverConfig", model.getSolverType().getLabel());
            pr.printRecord("mesh.meshDimension", mesh.getMeshDimension().getLabel());
            pr.printRecord("mesh.elementOrder", mesh.getElementOrder().getLabel());
            if (mesh.usesMeshFile()) {
                pr.printRecord("mesh.meshFile", mesh.getMeshFile());
            } else {
                pr.printRecord("mesh.numElementsX", mesh.getNumElementsX());
                pr.printRecord("mesh.numElementsY", mesh.getNumElementsY());
                pr.printRecord("mesh.maxX", mesh.getMaxX());
                pr.printRecord("mesh.maxY", mesh.getMaxY());
            }
            pr.printRecord("totalNodes", result.getSolutionVector().length);
            pr.printRecord("temperature.min", result.minTemperature());
            pr.printRecord("temperature.max", result.maxTemperature());
            pr.printRecord("temperature.mean", result.meanTemperature());
            pr.printRecord("boundaryConditions", model.getBoundaryConditions().describe());
        }
        return file;
    }
}
