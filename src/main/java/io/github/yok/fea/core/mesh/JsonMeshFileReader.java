package io.github.yok.fea.core.mesh;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON 形式のメッシュファイルを読み込み、{@link Mesh} を生成するクラスです。
 *
 * <p>
 * 形式は次のとおりです。要素の節点 ID は 1 始まり、境界要素は {@code [要素番号(0 始まり), 辺番号]} の組です。
 * </p>
 *
 * <pre>
 * {
 *   "nodes": [{"x": 0.0, "y": 0.0}, ...],
 *   "elements": [[1, 2, 3, ...], ...],
 *   "boundaryElements": {"inlet": [[0, 1], ...], ...}
 * }
 * </pre>
 *
 * <p>
 * メッシュファイルのメッシュは構造格子ではないため、totalNodesX は全節点数、totalNodesY は 1 とします。
 * </p>
 *
 * <p>
 * 境界条件のキーは辺の別名を辺の ID へ正規化するため、境界名に {@code 0〜3} や
 * {@code xxxBoundary}（xxx は bottom/left/top/right）、大文字を含む辺の名前は使えません。
 * これらを境界名に使ったファイルは拒否します。{@code bottom} などの辺の ID そのものは使用できます。
 * </p>
 */
@Slf4j
public final class JsonMeshFileReader implements MeshGenerator {

    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        // 将来の拡張項目（コメントやメタ情報など）は無視します。
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * メッシュファイルを指定した設定を扱えるかどうかを返します。
     *
     * @param configuration メッシュ設定です
     * @return メッシュファイルを使用する設定の場合は true です
     */
    @Override
    public boolean supports(MeshConfiguration configuration) {
        return configuration != null && configuration.usesMeshFile();
    }

    /**
     * 設定のメッシュファイルを読み込みます。
     *
     * @param configuration メッシュ設定です（meshFile 必須）
     * @return メッシュです
     * @throws IllegalArgumentException 設定またはファイル内容が不正な場合に発生します
     * @throws IllegalStateException ファイルの読み込みに失敗した場合に発生します
     */
    @Override
    public Mesh generate(MeshConfiguration configuration) {
        Preconditions.checkArgument(supports(configuration), "meshFile が指定されていません");
        Path path = Paths.get(configuration.getMeshFile());
        try {
            return read(path, configuration.getMeshDimension(), configuration.getElementOrder());
        } catch (IOException e) {
            throw new IllegalStateException("メッシュファイルの読み込みに失敗しました: " + path.toAbsolutePath(), e);
        }
    }

    /**
     * メッシュファイルを読み込みます。
     *
     * @param path メッシュファイルのパスです
     * @param meshDimension メッシュ次元です
     * @param elementOrder 要素次数です
     * @return メッシュです
     * @throws IOException ファイルが存在しない、または JSON として解釈できない場合に発生します
     * @throws IllegalArgumentException ファイル内容が不正な場合に発生します
     */
    public Mesh read(Path path, MeshDimension meshDimension, ElementOrder elementOrder)
            throws IOException {
        long t0 = System.nanoTime();
        log.info("メッシュファイルを読み込みます: {}", path.toAbsolutePath());

        if (!Files.exists(path)) {
            throw new IOException("メッシュファイルが存在しません: " + path.toAbsolutePath());
        }

        MeshDocument document;
        try {
            document = objectMapper.readValue(path.toFile(), MeshDocument.class);
        } catch (IOException e) {
            log.error("メッシュファイルの解析に失敗しました: {}", path.toAbsolutePath(), e);
            throw e;
        }

        Mesh mesh = toMesh(document, meshDimension, elementOrder);

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("メッシュファイルを読み込みました。節点数={}、要素数={}、境界数={}、所要時間={}ms",
                mesh.totalNodes(), mesh.totalElements(), mesh.getBoundaryElements().size(), elapsedMs);
        return mesh;
    }

    private static Mesh toMesh(MeshDocument document, MeshDimension meshDimension,
            ElementOrder elementOrder) {
        Preconditions.checkArgument(document.getNodes() != null && !document.getNodes().isEmpty(),
                "メッシュファイルに nodes がありません");
        Preconditions.checkArgument(
                document.getElements() != null && !document.getElements().isEmpty(),
                "メッシュファイルに elements がありません");

        int nodeCount = document.getNodes().size();
        double[] xs = new double[nodeCount];
        double[] ys = new double[nodeCount];
        for (int n = 0; n < nodeCount; n++) {
            NodeEntry node = document.getNodes().get(n);
            Preconditions.checkArgument(node != null, "nodes[%s] が null です", n);
            Preconditions.checkArgument(node.getX() != null && node.getY() != null,
                    "nodes[%s] に x または y がありません", n);
            xs[n] = node.getX();
            ys[n] = node.getY();
        }

        int[][] nop = document.getElements().toArray(new int[0][]);

        Map<String, List<BoundaryElement>> boundaries = new LinkedHashMap<>();
        if (document.getBoundaryElements() != null) {
            for (Map.Entry<String, List<int[]>> entry : document.getBoundaryElements().entrySet()) {
                requireUnreservedBoundaryName(entry.getKey());
                Preconditions.checkArgument(entry.getValue() != null,
                        "境界 %s の境界要素が指定されていません", entry.getKey());
                List<BoundaryElement> list = new ArrayList<>();
                for (int[] pair : entry.getValue()) {
                    Preconditions.checkArgument(pair != null && pair.length == 2,
                            "境界 %s の要素は [要素番号, 辺番号] で指定してください", entry.getKey());
                    list.add(new BoundaryElement(pair[0], BoundarySide.ofIndex(pair[1])));
                }
                boundaries.put(entry.getKey(), list);
            }
        } else {
            log.warn("メッシュファイルに boundaryElements がありません。境界条件は指定できません");
        }

        return new Mesh(meshDimension, elementOrder, xs, ys, nodeCount, 1, nop, boundaries);
    }

    /**
     * 境界名が辺の別名（{@code 0〜3}、{@code bottomBoundary} など、大文字小文字の違いを含む）でないことを確認します。
     *
     * @param name 境界名です
     * @throws IllegalArgumentException 境界名が辺の別名の場合に発生します
     */
    private static void requireUnreservedBoundaryName(String name) {
        BoundarySide side = BoundarySide.fromKey(name);
        Preconditions.checkArgument(side == null || side.getId().equals(name),
                "境界名 %s は辺 %s の別名として予約されています", name, side == null ? null : side.getId());
    }

    /**
     * メッシュファイルの JSON 文書です。
     */
    @Data
    @NoArgsConstructor
    static class MeshDocument {

        private List<NodeEntry> nodes;

        private List<int[]> elements;

        private Map<String, List<int[]>> boundaryElements;
    }

    /**
     * 節点座標の JSON 表現です。
     */
    @Data
    @NoArgsConstructor
    static class NodeEntry {

        private Double x;

        private Double y;
    }
}
