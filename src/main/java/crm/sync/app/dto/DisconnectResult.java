package crm.sync.app.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DisconnectResult {
    private boolean tokensRevoked;
    // Set when revocation did not happen; the local record is removed either way
    private String warning;
}
