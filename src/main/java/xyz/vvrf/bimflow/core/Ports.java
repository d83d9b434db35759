package xyz.vvrf.bimflow.core;

/**
 * 约定的端口名称。任何其他字符串也是合法的动态端口名。
 */
public final class Ports {

    /** 默认输入端口 */
    public static final String INPUT = "input";
    /** 参考元素端口，空间查询和碰撞分析使用 */
    public static final String REFERENCE = "reference";
    /** 属性节点的取值端口 */
    public static final String VALUE_INPUT = "valueInput";
    /** 默认输出端口 */
    public static final String OUTPUT = "output";

    private Ports() {
    }

    static String orDefault(String port, String defaultPort) {
        return (port == null || port.trim().isEmpty()) ? defaultPort : port;
    }
}
