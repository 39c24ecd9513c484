package crm.sync.app.service.sync;

/**
 * Receives sync progress as a percentage between 0 and 100.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = percent -> { };

    void onProgress(int percent);
}
