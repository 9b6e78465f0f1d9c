package io.github.yok.fea.core.assembly;

import lombok.Getter;

/**
 * 等パラメトリック写像のヤコビアンが正でない（要素が潰れている・裏返っている）ことを表す例外です。
 */
@Getter
public final class DegenerateElementException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 要素番号（0 始まり）です。
     */
    private final int elementIndex;

    /**
     * 積分点の ksi 座標です。
     */
    private final double ksi;

    /**
     * 積分点の eta 座標です。
     */
    private final double eta;

    /**
     * ヤコビアンの値です。
     */
    private final double detJacobian;

    /**
     * 例外を生成します。
     *
     * @param elementIndex 要素番号です
     * @param ksi 積分点の ksi 座標です
     * @param eta 積分点の eta 座標です
     * @param detJacobian ヤコビアンの値です
     */
    public DegenerateElementException(int elementIndex, double ksi, double eta,
            double detJacobian) {
        super("要素のヤコビアンが正ではありません: element=" + elementIndex + ", ksi=" + ksi + ", eta="
                + eta + ", detJacobian=" + detJacobian);
        this.elementIndex = elementIndex;
        this.ksi = ksi;
        this.eta = eta;
        this.detJacobian = detJacobian;
    }
}
