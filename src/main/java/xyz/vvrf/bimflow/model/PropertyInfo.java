package xyz.vvrf.bimflow.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 属性节点对单个元素的查询/修改结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyInfo {

    private String name;
    private boolean exists;
    private Object value;
    /** 属性所在的属性集；直接属性为空串，写入直接属性时为 "properties"。 */
    private String psetName;
}
