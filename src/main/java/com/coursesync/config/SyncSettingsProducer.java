package com.coursesync.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

@ApplicationScoped
public class SyncSettingsProducer {

    private static final Logger LOG = Logger.getLogger(SyncSettingsProducer.class);

    @Produces
    @Singleton
    SyncSettings syncSettings(SyncConfig config) {
        SyncSettings settings = SyncSettings.from(config);
        LOG.infof("Sync settings: downloads=%s index=%s workers=%d policy=%s",
                settings.downloadDir(), settings.indexDir(), settings.workers(), settings.extensionPolicy());
        return settings;
    }
}
