package io.github.yok.fea.core.boundary;

/**
 * 1 つの境界に課す熱的境界条件です。
 *
 * <p>
 * 実装は {@link ConvectionBoundaryCondition}（Robin 型）と {@link ConstantTemperatureBoundaryCondition}
 * （Dirichlet 型）です。
 * </p>
 */
public interface BoundaryCondition {

    /**
     * 設定ファイル上の種別名を返します。
     *
     * @return 種別名です（"convection" または "constantTemp"）
     */
    String kind();

    /**
     * ログ・メタ情報用の短い説明を返します。
     *
     * @return 説明です
     */
    String describe();
}
