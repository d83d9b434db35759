package xyz.vvrf.bimflow.handler;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.bimflow.collaborator.ModelLoader;
import xyz.vvrf.bimflow.core.ExecutionMode;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeHandler;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.NodeStatusPatch;
import xyz.vvrf.bimflow.model.BimModel;
import xyz.vvrf.bimflow.model.ModelSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;

/**
 * 模型源节点。
 * <p>
 * 依次尝试：节点属性 {@code modelInfo} 中已有的模型、通过 {@link ModelLoader} 加载属性 {@code file}、
 * 加载器最近一次加载的模型；都没有时输出带 {@code errorMessage} 的空模型。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class IfcNodeHandler implements NodeHandler {

    public static final String NO_MODEL_MESSAGE = "No IFC file loaded. Please load an IFC file first.";

    private final ModelLoader modelLoader;

    /**
     * @param modelLoader 模型加载器 (可为 null，此时只能使用 modelInfo)
     */
    public IfcNodeHandler(ModelLoader modelLoader) {
        this.modelLoader = modelLoader;
    }

    @Override
    public Set<String> getInputPorts() {
        return Collections.emptySet();
    }

    @Override
    public ExecutionMode getExecutionMode() {
        return ExecutionMode.ASYNC;
    }

    @Override
    public String getOutputShape() {
        return "model";
    }

    @Override
    public Mono<NodeResult> execute(NodeInvocation invocation) {
        NodeDefinition node = invocation.getNode();

        Optional<BimModel> modelInfo = node.getProperty("modelInfo", BimModel.class);
        if (modelInfo.isPresent()) {
            log.debug("Node '{}' uses model '{}' from its properties", node.getId(), modelInfo.get().getId());
            return Mono.just(NodeResult.of(normalize(modelInfo.get())));
        }

        ModelSource source = resolveSource(node);
        if (source != null && modelLoader != null) {
            return loadModel(invocation, source);
        }

        Optional<BimModel> lastLoaded = modelLoader != null ? modelLoader.getLastLoadedModel() : Optional.empty();
        if (lastLoaded.isPresent()) {
            log.debug("Node '{}' uses last loaded model '{}'", node.getId(), lastLoaded.get().getId());
            return Mono.just(NodeResult.of(normalize(lastLoaded.get())));
        }

        log.warn("Node '{}': no IFC model data available", node.getId());
        return Mono.just(NodeResult.of(BimModel.empty(NO_MODEL_MESSAGE)));
    }

    private Mono<NodeResult> loadModel(NodeInvocation invocation, ModelSource source) {
        String nodeId = invocation.getNodeId();
        log.info("Node '{}' loading IFC file '{}'", nodeId, source.getFileName());
        invocation.reportProgress(0, "Loading " + source.getFileName() + "...");
        return modelLoader.load(source, invocation.progressCallback())
                .map(model -> {
                    invocation.report(NodeStatusPatch.finished());
                    log.info("Node '{}' loaded model '{}' with {} elements",
                            nodeId, model.getName(), model.getElements() != null ? model.getElements().size() : 0);
                    return NodeResult.of(normalize(model));
                })
                .doOnError(e -> invocation.report(NodeStatusPatch.failed(e.getMessage())))
                .onErrorMap(e -> new IllegalStateException("Failed to load IFC file: " + e.getMessage(), e));
    }

    private static ModelSource resolveSource(NodeDefinition node) {
        Optional<ModelSource> source = node.getProperty("file", ModelSource.class);
        if (source.isPresent()) {
            return source.get();
        }
        String fileName = node.getString("file", null);
        return fileName != null ? ModelSource.of(fileName) : null;
    }

    private static BimModel normalize(BimModel model) {
        if (model.getElements() == null) {
            return model.toBuilder().elements(new ArrayList<>()).build();
        }
        return model;
    }
}
