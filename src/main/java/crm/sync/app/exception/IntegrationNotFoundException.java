package crm.sync.app.exception;

public class IntegrationNotFoundException extends RuntimeException {
    public IntegrationNotFoundException(String message) {
        super(message);
    }
}
