package xyz.vvrf.bimflow.collaborator;

import reactor.core.publisher.Mono;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.QuantityResult;

import java.util.List;

/**
 * 后台数量计算服务。请求通过 messageId 与响应关联。
 *
 * @author ruifeng.wen
 */
public interface QuantityWorker {

    Mono<QuantityResult> extract(List<BimElement> elements, String quantityType, String groupBy, String messageId);
}
