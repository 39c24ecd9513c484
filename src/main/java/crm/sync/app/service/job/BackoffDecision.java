package crm.sync.app.service.job;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

@Getter
@ToString
public class BackoffDecision {
    public enum Action {
        COMPLETE,
        RETRY,
        FAIL
    }

    private final Action action;
    private final Duration delay;

    private BackoffDecision(Action action, Duration delay) {
        this.action = action;
        this.delay = delay;
    }

    public static BackoffDecision complete() {
        return new BackoffDecision(Action.COMPLETE, Duration.ZERO);
    }

    public static BackoffDecision retry(Duration delay) {
        return new BackoffDecision(Action.RETRY, delay);
    }

    public static BackoffDecision fail() {
        return new BackoffDecision(Action.FAIL, Duration.ZERO);
    }
}
