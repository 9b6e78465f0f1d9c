package io.github.yok.fea.core.boundary;

import java.util.Locale;
import lombok.Value;

/**
 * 対流（Robin 型）境界条件です。
 *
 * <p>
 * 熱伝達係数 h と外部温度 T_ext から、境界積分 {@code -∫ h N_m (N_n T_n - T_ext) ds} を全体系へ加算します。
 * </p>
 */
@Value
public class ConvectionBoundaryCondition implements BoundaryCondition {

    /**
     * 種別名です。
     */
    public static final String KIND = "convection";

    /**
     * 熱伝達係数です。
     */
    double heatTransferCoefficient;

    /**
     * 外部温度です。
     */
    double externalTemperature;

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public String describe() {
        return String.format(Locale.ROOT, "%s(h=%.5f, Text=%.5f)", KIND, heatTransferCoefficient,
                externalTemperature);
    }
}
