package crm.sync.app.service.provider;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * One page of a list call. {@code nextCursor} is only set on the last page.
 */
@Getter
@AllArgsConstructor
public class ProviderPage {
    private final List<ExternalItem> items;
    private final String nextPageToken;
    private final String nextCursor;

    public boolean hasMore() {
        return nextPageToken != null && !nextPageToken.isEmpty();
    }
}
