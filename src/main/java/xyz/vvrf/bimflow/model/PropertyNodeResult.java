package xyz.vvrf.bimflow.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 属性节点的输出：带 {@link PropertyInfo} 的元素副本，以及找到的不同属性值。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PropertyNodeResult {

    private List<BimElement> elements = new ArrayList<>();
    private List<Object> uniqueValues = new ArrayList<>();
}
