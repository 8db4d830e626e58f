package io.jobrelay.spi;

public interface NotificationSender
{
    void sendNotification(Notification notification)
        throws NotificationException;
}
