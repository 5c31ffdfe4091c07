package nexa.taskapi.store;

/**
 * Unchecked failure of a store operation. The enclosing transaction has
 * already been rolled back when this is thrown.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
