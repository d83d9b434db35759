package xyz.vvrf.bimflow.core;

/**
 * 外部协作者（模型加载器、几何能力）使用的进度回调。
 */
@FunctionalInterface
public interface ProgressCallback {

    ProgressCallback NOOP = (percentage, message) -> { };

    void onProgress(int percentage, String message);
}
