package io.jobrelay.spi;

public interface Notifier
{
    void sendNotification(Notification notification)
        throws NotificationException;
}
