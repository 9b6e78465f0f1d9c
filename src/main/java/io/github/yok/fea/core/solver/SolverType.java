package io.github.yok.fea.core.solver;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 解く物理問題の種類です。
 */
@Getter
@RequiredArgsConstructor
public enum SolverType {

    /**
     * 定常固体熱伝導です。
     */
    SOLID_HEAT_TRANSFER("solidHeatTransferScript", "solidHeatTransfer");

    /**
     * 設定ファイル上の表記です。
     */
    private final String label;

    /**
     * 設定ファイル上の別表記です。
     */
    private final String alias;

    /**
     * 設定ファイル上の表記から種類を解決します。
     *
     * @param label 表記です（大文字小文字は区別しません）
     * @return 種類です
     * @throws IllegalArgumentException 表記が null または未知の場合に発生します
     */
    public static SolverType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("solverConfig は必須です");
        }
        String l = label.trim();
        for (SolverType t : values()) {
            if (t.label.equalsIgnoreCase(l) || t.alias.equalsIgnoreCase(l)) {
                return t;
            }
        }
        throw new IllegalArgumentException("未知の solverConfig です: " + label);
    }
}
