package io.github.yok.fea.core.boundary;

import io.github.yok.fea.core.mesh.BoundarySide;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 境界 ID から境界条件への、宣言順を保持する不変の対応表です。
 *
 * <p>
 * キーは {@code bottom/left/top/right}、その番号 {@code 0〜3}、{@code xxxBoundary} の別名を受け付け、
 * いずれも辺の ID（bottom など）へ正規化します。辺として解釈できないキーはメッシュファイルの名前付き境界として
 * そのまま保持します。正規化後にキーが重複した場合は {@link BoundaryConditionException} です。
 * 辺の別名はメッシュファイルの境界名に使えないため（{@link io.github.yok.fea.core.mesh.JsonMeshFileReader}
 * が拒否します）、正規化によって名前付き境界が指定できなくなることはありません。
 * </p>
 */
public final class BoundaryConditions {

    private final Map<String, BoundaryCondition> conditions;

    private BoundaryConditions(Map<String, BoundaryCondition> conditions) {
        this.conditions = Collections.unmodifiableMap(conditions);
    }

    /**
     * 境界 ID と境界条件の対応表から生成します。
     *
     * @param conditions 境界 ID → 境界条件です（反復順が宣言順になります）
     * @return 境界条件の対応表です
     * @throws BoundaryConditionException キーや値が不正な場合に発生します
     */
    public static BoundaryConditions of(Map<String, ? extends BoundaryCondition> conditions) {
        if (conditions == null) {
            throw new IllegalArgumentException("boundaryConditions は null 不可です");
        }
        Map<String, BoundaryCondition> normalized = new LinkedHashMap<>();
        conditions.forEach((key, condition) -> {
            if (condition == null) {
                throw new BoundaryConditionException(key, "境界条件が null です");
            }
            putUnique(normalized, key, condition);
        });
        return new BoundaryConditions(normalized);
    }

    /**
     * 設定ファイル形式の境界条件を解釈します。
     *
     * <p>
     * 値は {@code ["convection", h, Text]} または {@code ["constantTemp", T]} です。
     * 数値は数値型・数値文字列のどちらでも受け付けます。
     * </p>
     *
     * @param raw 境界キー → パラメータ列です
     * @return 境界条件の対応表です
     * @throws BoundaryConditionException 種別が未知、パラメータが不正、キーが重複した場合に発生します
     */
    public static BoundaryConditions parse(Map<String, ? extends List<?>> raw) {
        if (raw == null) {
            throw new IllegalArgumentException("boundaryConditions は null 不可です");
        }
        Map<String, BoundaryCondition> normalized = new LinkedHashMap<>();
        raw.forEach((key, params) -> putUnique(normalized, key, parseCondition(key, params)));
        return new BoundaryConditions(normalized);
    }

    /**
     * 境界キーを境界 ID へ正規化します。
     *
     * @param key 境界キーです
     * @return 辺として解釈できる場合は辺の ID、それ以外はトリムしたキーです
     * @throws BoundaryConditionException キーが null または空の場合に発生します
     */
    public static String normalizeKey(String key) {
        if (key == null || key.isBlank()) {
            throw new BoundaryConditionException(key, "境界キーが空です");
        }
        BoundarySide side = BoundarySide.fromKey(key);
        return side != null ? side.getId() : key.trim();
    }

    /**
     * 境界 ID の一覧（宣言順）を返します。
     *
     * @return 境界 ID の一覧です
     */
    public Set<String> boundaryIds() {
        return conditions.keySet();
    }

    /**
     * 境界 ID と境界条件の対応（宣言順）を返します。
     *
     * @return 変更不可の対応表です
     */
    public Map<String, BoundaryCondition> asMap() {
        return conditions;
    }

    /**
     * 指定境界の条件を返します。
     *
     * @param boundaryKey 境界キーです（別名可）
     * @return 境界条件、指定がない場合は null です
     */
    public BoundaryCondition get(String boundaryKey) {
        return conditions.get(normalizeKey(boundaryKey));
    }

    /**
     * 境界条件の数を返します。
     *
     * @return 境界条件の数です
     */
    public int size() {
        return conditions.size();
    }

    /**
     * 境界条件が 1 つもないかどうかを返します。
     *
     * @return 空の場合は true です
     */
    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * ログ・メタ情報用に {@code id=説明} を ; 区切りで連結した文字列を返します。
     *
     * @return 説明文字列です
     */
    public String describe() {
        return conditions.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue().describe())
                .collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        return "BoundaryConditions{" + describe() + "}";
    }

    private static void putUnique(Map<String, BoundaryCondition> target, String key,
            BoundaryCondition condition) {
        String id = normalizeKey(key);
        if (target.containsKey(id)) {
            throw new BoundaryConditionException(id, "同じ境界に複数の境界条件が指定されています（キー " + key + "）");
        }
        target.put(id, condition);
    }

    private static BoundaryCondition parseCondition(String key, List<?> params) {
        if (params == null || params.isEmpty() || params.get(0) == null) {
            throw new BoundaryConditionException(key, "境界条件の種別が指定されていません");
        }
        String kind = String.valueOf(params.get(0)).trim();
        if (ConvectionBoundaryCondition.KIND.equalsIgnoreCase(kind)) {
            requireParamCount(key, kind, params, 3);
            return new ConvectionBoundaryCondition(toDouble(key, params.get(1)),
                    toDouble(key, params.get(2)));
        }
        if (ConstantTemperatureBoundaryCondition.KIND.equalsIgnoreCase(kind)) {
            requireParamCount(key, kind, params, 2);
            return new ConstantTemperatureBoundaryCondition(toDouble(key, params.get(1)));
        }
        throw new BoundaryConditionException(key,
                "境界条件の種別は convection/constantTemp のいずれかを指定してください: " + kind);
    }

    private static void requireParamCount(String key, String kind, List<?> params, int expected) {
        if (params.size() != expected) {
            throw new BoundaryConditionException(key, kind + " のパラメータ数が不正です（期待値 "
                    + (expected - 1) + "、指定 " + (params.size() - 1) + "）");
        }
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new BoundaryConditionException(key, "数値として解釈できません: " + value, e);
            }
        }
        throw new BoundaryConditionException(key, "数値として解釈できません: " + value);
    }
}
