package xyz.firestige.engine.domain.progress;

/**
 * 进度监听器，只用于通知，不参与控制流程
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ProgressEvent event);
}
