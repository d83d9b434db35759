package xyz.vvrf.bimflow.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 三维向量 (米 / 度 / 比例)。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Vector3 {

    private double x;
    private double y;
    private double z;

    public static Vector3 zero() {
        return new Vector3(0, 0, 0);
    }

    public static Vector3 one() {
        return new Vector3(1, 1, 1);
    }
}
