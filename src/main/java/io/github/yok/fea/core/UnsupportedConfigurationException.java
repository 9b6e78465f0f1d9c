package io.github.yok.fea.core;

import io.github.yok.fea.core.mesh.ElementOrder;
import io.github.yok.fea.core.mesh.MeshDimension;
import lombok.Getter;

/**
 * 実装されていない次元・要素次数の組み合わせが要求されたことを表す例外です。
 *
 * <p>
 * 未対応の経路を黙って素通りさせず、呼び出し元へ明示的に失敗を返すために使用します。
 * </p>
 */
@Getter
public final class UnsupportedConfigurationException extends UnsupportedOperationException {

    private static final long serialVersionUID = 1L;

    /**
     * 要求されたメッシュ次元です。
     */
    private final MeshDimension meshDimension;

    /**
     * 要求された要素次数です。
     */
    private final ElementOrder elementOrder;

    /**
     * 例外を生成します。
     *
     * @param operation 未対応だった処理の名前です
     * @param meshDimension 要求されたメッシュ次元です
     * @param elementOrder 要求された要素次数です
     */
    public UnsupportedConfigurationException(String operation, MeshDimension meshDimension,
            ElementOrder elementOrder) {
        super("未対応の次元・要素次数です: operation=" + operation + ", dimension="
                + (meshDimension == null ? null : meshDimension.getLabel()) + ", order="
                + (elementOrder == null ? null : elementOrder.getLabel()));
        this.meshDimension = meshDimension;
        this.elementOrder = elementOrder;
    }
}
