package io.github.yok.fea.app;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * fea-solver の設定値（fea.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の問題定義の組み立てに使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "fea")
public class FeaProperties {

    /**
     * ソルバ種別（solidHeatTransferScript / solidHeatTransfer）です。
     */
    @NotBlank
    private String solverConfig = "solidHeatTransferScript";

    /**
     * メッシュ設定です。
     */
    @Valid
    private Mesh mesh = new Mesh();

    /**
     * 境界条件です。
     *
     * <p>
     * キーは境界（bottom/left/top/right、0〜3、xxxBoundary、またはメッシュファイルの境界名）、
     * 値は {@code [convection, h, Text]} または {@code [constantTemp, T]} です。
     * </p>
     */
    @NotEmpty
    private Map<String, List<String>> boundaryConditions = new LinkedHashMap<>();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "fea")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Mesh m = getMesh();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "solver",
                // solverConfig: 解く問題の種類
                "solverConfig", getSolverConfig());

        appendSection(sb, nl, "mesh",
                // meshDimension: 1D/2D
                "meshDimension", m.getMeshDimension(),
                // elementOrder: linear/quadratic
                "elementOrder", m.getElementOrder(),
                // numElementsX, numElementsY: 各方向の要素数
                "numElementsX", m.getNumElementsX(), "numElementsY", m.getNumElementsY(),
                // maxX, maxY: 領域サイズ
                "maxX", m.getMaxX(), "maxY", m.getMaxY(),
                // meshFile: JSON メッシュファイル（指定時は構造格子を生成しません）
                "meshFile", m.getMeshFile());

        Object[] bc = new Object[getBoundaryConditions().size() * 2];
        int k = 0;
        for (Map.Entry<String, List<String>> e : getBoundaryConditions().entrySet()) {
            bc[k++] = e.getKey();
            bc[k++] = e.getValue();
        }
        appendSection(sb, nl, "boundaryConditions", bc);

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Mesh {

        /**
         * メッシュ次元（1D/2D）です。
         */
        @NotBlank
        private String meshDimension = "2D";

        /**
         * 要素次数（linear/quadratic）です。
         */
        @NotBlank
        private String elementOrder = "quadratic";

        /**
         * x 方向の要素数です。
         */
        private int numElementsX = 4;

        /**
         * y 方向の要素数です。
         */
        private int numElementsY = 4;

        /**
         * 領域の x 方向の長さです。
         */
        private double maxX = 1.0;

        /**
         * 領域の y 方向の長さです。
         */
        private double maxY = 1.0;

        /**
         * JSON メッシュファイルのパスです（未指定なら構造格子を生成します）。
         */
        private String meshFile;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";
    }
}
