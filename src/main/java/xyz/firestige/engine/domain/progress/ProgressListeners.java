package xyz.firestige.engine.domain.progress;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 服务上注册的监听器集合
 * <p>
 * 只持有弱引用：监听器的生命周期由注册方负责，被回收后自动移除。
 */
public class ProgressListeners {

    private final List<WeakReference<ProgressListener>> refs = new CopyOnWriteArrayList<>();

    public void add(ProgressListener listener) {
        if (listener != null) {
            refs.add(new WeakReference<>(listener));
        }
    }

    public void remove(ProgressListener listener) {
        refs.removeIf(ref -> {
            ProgressListener l = ref.get();
            return l == null || l == listener;
        });
    }

    /**
     * 返回仍存活的监听器快照，并清理已回收的引用
     */
    public List<ProgressListener> snapshot() {
        List<ProgressListener> alive = new ArrayList<>();
        for (WeakReference<ProgressListener> ref : refs) {
            ProgressListener l = ref.get();
            if (l != null) {
                alive.add(l);
            }
        }
        refs.removeIf(ref -> ref.get() == null);
        return alive;
    }

    public boolean isEmpty() {
        return snapshot().isEmpty();
    }
}
