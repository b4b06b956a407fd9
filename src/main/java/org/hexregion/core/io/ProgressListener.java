package org.hexregion.core.io;

/**
 * Прогресс долгой операции: название шага и доля 0..1.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (stage, fraction) -> { };

    void onProgress(String stage, double fraction);
}
