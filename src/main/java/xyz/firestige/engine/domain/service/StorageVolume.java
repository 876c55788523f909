package xyz.firestige.engine.domain.service;

/**
 * 应用挂载的持久卷
 */
public record StorageVolume(String id, String name, int sizeGib, String mountPoint) {

    public StorageVolume {
        if (sizeGib <= 0) {
            throw new IllegalArgumentException("storage size must be > 0");
        }
    }
}
