package io.jobrelay.core.notification;

import io.jobrelay.spi.Notification;
import io.jobrelay.spi.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LogNotificationSender
        implements NotificationSender
{
    private static final Logger logger = LoggerFactory.getLogger(LogNotificationSender.class);

    @Override
    public void sendNotification(Notification notification)
    {
        if (notification.getSuccess()) {
            logger.info("[{}] {} (run {})", notification.getOwnerId(), notification.getMessage(), notification.getRunId());
        }
        else {
            logger.warn("[{}] {} (run {})", notification.getOwnerId(), notification.getMessage(), notification.getRunId());
        }
    }
}
