package in.tradefuse.application.port.output;

/**
 * Fire-and-forget operator notifications. Implementations must not throw.
 */
public interface NotificationChannel {

    void send(String title, String message);
}
