package xyz.vvrf.bimflow.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 几何提取的过滤条件。{@code elementType} 为用户友好的类别名，如 walls、slabs、all。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GeometryFilter {

    public static final String ALL = "all";

    private String elementType = ALL;
    private boolean includeOpenings = true;
}
