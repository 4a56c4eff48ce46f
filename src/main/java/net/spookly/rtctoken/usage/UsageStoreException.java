package net.spookly.rtctoken.usage;

/**
 * Raised when the backing usage store cannot be read or written.
 */
public class UsageStoreException extends RuntimeException {
    public UsageStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
