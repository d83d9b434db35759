package xyz.vvrf.bimflow.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 记录在元素副本上的几何变换：平移、旋转 (度) 和缩放。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ElementTransform {

    private Vector3 translation;
    private Vector3 rotation;
    private Vector3 scale;

    public static ElementTransform identity() {
        return new ElementTransform(Vector3.zero(), Vector3.zero(), Vector3.one());
    }
}
