package io.github.yok.fea.core.mesh;

import lombok.Value;

/**
 * 境界に接する要素と、その要素のどの辺が境界上にあるかの組です。
 */
@Value
public class BoundaryElement {

    /**
     * 要素番号（0 始まり）です。
     */
    int elementIndex;

    /**
     * 境界上にある要素の辺です。
     */
    BoundarySide side;
}
