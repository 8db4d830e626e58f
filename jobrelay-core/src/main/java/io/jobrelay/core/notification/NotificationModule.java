package io.jobrelay.core.notification;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.MapBinder;
import io.jobrelay.spi.NotificationSender;
import io.jobrelay.spi.Notifier;

public class NotificationModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        MapBinder<String, NotificationSender> senders = MapBinder.newMapBinder(binder, String.class, NotificationSender.class);
        senders.addBinding("log").to(LogNotificationSender.class);
        senders.addBinding("shell").to(ShellNotificationSender.class);
        binder.bind(Notifier.class).to(DefaultNotifier.class).in(Scopes.SINGLETON);
    }
}
