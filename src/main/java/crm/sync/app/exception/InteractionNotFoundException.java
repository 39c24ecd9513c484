package crm.sync.app.exception;

public class InteractionNotFoundException extends RuntimeException {
    public InteractionNotFoundException(String message) {
        super(message);
    }
}
