package io.github.yok.fea.core.boundary;

import lombok.Getter;

/**
 * 境界条件の指定が不正であることを表す例外です。
 *
 * <p>
 * 未知の種別、パラメータ数・型の誤り、別名正規化後のキー重複、メッシュに存在しない境界 ID の指定で発生します。
 * </p>
 */
@Getter
public final class BoundaryConditionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 問題のあった境界 ID（キー）です。
     */
    private final String boundaryId;

    /**
     * 例外を生成します。
     *
     * @param boundaryId 問題のあった境界 ID です
     * @param message メッセージです
     */
    public BoundaryConditionException(String boundaryId, String message) {
        super(message + ": boundary=" + boundaryId);
        this.boundaryId = boundaryId;
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param boundaryId 問題のあった境界 ID です
     * @param message メッセージです
     * @param cause 原因です
     */
    public BoundaryConditionException(String boundaryId, String message, Throwable cause) {
        super(message + ": boundary=" + boundaryId, cause);
        this.boundaryId = boundaryId;
    }
}
