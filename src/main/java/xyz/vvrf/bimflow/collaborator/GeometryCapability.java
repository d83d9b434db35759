package xyz.vvrf.bimflow.collaborator;

import reactor.core.publisher.Mono;
import xyz.vvrf.bimflow.core.ProgressCallback;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.BimModel;
import xyz.vvrf.bimflow.model.ClashDetection;
import xyz.vvrf.bimflow.model.GeometryFilter;

import java.util.List;

/**
 * 几何提取与碰撞检测能力，通常由 3D 查看器提供。
 *
 * @author ruifeng.wen
 */
public interface GeometryCapability {

    Mono<List<BimElement>> extractGeometry(BimModel model, GeometryFilter filter, ProgressCallback progress);

    /**
     * 按 expressId 检测两组元素之间的碰撞。
     *
     * @param tolerance 容差 (毫米)
     */
    ClashDetection detectClashes(List<Integer> elementIdsA, List<Integer> elementIdsB, double tolerance);

    /**
     * 几何尚未加载完成时返回 false，此时不应调用 {@link #detectClashes}。
     */
    boolean isReady();
}
