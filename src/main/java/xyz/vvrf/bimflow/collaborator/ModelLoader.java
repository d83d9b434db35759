package xyz.vvrf.bimflow.collaborator;

import reactor.core.publisher.Mono;
import xyz.vvrf.bimflow.core.ProgressCallback;
import xyz.vvrf.bimflow.model.BimModel;
import xyz.vvrf.bimflow.model.ModelSource;

import java.util.Optional;

/**
 * 加载 BIM 模型的外部协作者 (IFC 解析不在引擎内实现)。
 *
 * @author ruifeng.wen
 */
public interface ModelLoader {

    /**
     * 加载模型。
     *
     * @param source   模型来源
     * @param progress 进度回调，可被多次调用
     * @return 加载完成的模型；加载失败时发出错误
     */
    Mono<BimModel> load(ModelSource source, ProgressCallback progress);

    /**
     * @return 最近一次成功加载的模型
     */
    Optional<BimModel> getLastLoadedModel();
}
