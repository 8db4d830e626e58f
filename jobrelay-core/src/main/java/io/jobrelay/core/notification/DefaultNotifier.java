package io.jobrelay.core.notification;

import java.util.Map;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import com.google.inject.Provider;
import io.jobrelay.client.config.Config;
import io.jobrelay.spi.Notification;
import io.jobrelay.spi.NotificationException;
import io.jobrelay.spi.NotificationSender;
import io.jobrelay.spi.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a notification to the sender of its channel and retries failed
 * deliveries with exponential backoff.
 * <p>
 * The channel is the part of the owner id before ':', e.g. "telegram" for
 * "telegram:1234". Owners without a prefix use notification.type.
 */
public class DefaultNotifier
        implements Notifier
{
    private static final String NOTIFICATION_TYPE = "notification.type";

    private static final String NOTIFICATION_RETRIES = "notification.retries";
    private static final String NOTIFICATION_MIN_RETRY_WAIT = "notification.min_retry_wait";
    private static final String NOTIFICATION_MAX_RETRY_WAIT = "notification.max_retry_wait";
    private static final int NOTIFICATION_RETRIES_DEFAULT = 10;
    private static final int NOTIFICATION_MIN_RETRY_WAIT_DEFAULT = 1000;
    private static final int NOTIFICATION_MAX_RETRY_WAIT_DEFAULT = 30000;

    private static final Logger logger = LoggerFactory.getLogger(DefaultNotifier.class);

    private final Map<String, Provider<NotificationSender>> senders;
    private final Optional<String> defaultType;
    private final int retries;
    private final int minRetryWait;
    private final int maxRetryWait;

    @Inject
    public DefaultNotifier(Config systemConfig, Map<String, Provider<NotificationSender>> senders)
    {
        this.senders = ImmutableMap.copyOf(senders);
        this.defaultType = systemConfig.getOptional(NOTIFICATION_TYPE, String.class);
        this.retries = systemConfig.get(NOTIFICATION_RETRIES, int.class, NOTIFICATION_RETRIES_DEFAULT);
        this.minRetryWait = systemConfig.get(NOTIFICATION_MIN_RETRY_WAIT, int.class, NOTIFICATION_MIN_RETRY_WAIT_DEFAULT);
        this.maxRetryWait = systemConfig.get(NOTIFICATION_MAX_RETRY_WAIT, int.class, NOTIFICATION_MAX_RETRY_WAIT_DEFAULT);
    }

    @VisibleForTesting
    static Optional<String> channelOf(String ownerId)
    {
        int colon = ownerId.indexOf(':');
        if (colon <= 0) {
            return Optional.absent();
        }
        return Optional.of(ownerId.substring(0, colon));
    }

    @Override
    public void sendNotification(Notification notification)
            throws NotificationException
    {
        logger.debug("Notification: {}", notification);

        Optional<String> channel = channelOf(notification.getOwnerId()).or(defaultType);
        if (!channel.isPresent()) {
            return;
        }
        Provider<NotificationSender> provider = senders.get(channel.get());
        if (provider == null) {
            logger.warn("No notification sender is registered for channel '{}'. Dropping notification of job id={}",
                    channel.get(), notification.getJobId());
            return;
        }

        NotificationSender sender = provider.get();

        int retryWait = minRetryWait;
        int retryCount = 0;
        while (true) {
            try {
                sender.sendNotification(notification);
                return;
            }
            catch (NotificationException | RuntimeException ex) {
                if (retryCount >= retries) {
                    throw new NotificationException("Sending notification failed", ex);
                }
                retryCount++;
                logger.warn("Sending notification failed: retry {} of {}", retryCount, retries, ex);
                try {
                    Thread.sleep(retryWait);
                }
                catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new NotificationException("Interrupted while retrying notification", ex);
                }
                retryWait = Math.min(retryWait * 2, maxRetryWait);
            }
        }
    }
}
