package io.github.yok.fea.core.boundary;

import java.util.Locale;
import lombok.Value;

/**
 * 温度固定（Dirichlet 型）境界条件です。
 */
@Value
public class ConstantTemperatureBoundaryCondition implements BoundaryCondition {

    /**
     * 種別名です。
     */
    public static final String KIND = "constantTemp";

    /**
     * 固定温度です。
     */
    double temperature;

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public String describe() {
        return String.format(Locale.ROOT, "%s(T=%.5f)", KIND, temperature);
    }
}
