package crm.sync.app.service.job;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Job counts by state. {@code delayed} are queued jobs whose run time is still ahead.
 */
@Getter
@ToString
@AllArgsConstructor
public class QueueStats {
    private final long waiting;
    private final long active;
    private final long completed;
    private final long failed;
    private final long delayed;
}
