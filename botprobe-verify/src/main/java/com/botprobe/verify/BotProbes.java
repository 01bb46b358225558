package com.botprobe.verify;

import com.botprobe.channel.TriggerChannel;
import com.botprobe.common.infra.Ticker;
import com.botprobe.common.logging.SubsystemLogger;
import com.botprobe.verify.config.ProbeConfigService;
import com.botprobe.verify.config.ProbeSettings;

/**
 * Factories for {@link BotProbe}.
 */
public final class BotProbes {

    private BotProbes() {
    }

    /**
     * Probe on the wall clock, logging under {@code probe/<channelIdentity>}.
     */
    public static BotProbe create(ProbeSettings settings, TriggerChannel channel) {
        return create(settings, channel, Ticker.SYSTEM);
    }

    public static BotProbe create(ProbeSettings settings, TriggerChannel channel, Ticker ticker) {
        return new BotProbe(settings, channel, ticker, loggerFor(settings));
    }

    /**
     * Probe with default timing for {@code responderIdentity}, posting to
     * {@code channel}.
     */
    public static BotProbe forResponder(String responderIdentity, TriggerChannel channel) {
        return create(ProbeSettings.builder(responderIdentity, channel.getChannelId()).build(), channel);
    }

    /**
     * Probe for a named profile of a configuration file. The file's logging
     * section is applied first.
     *
     * @throws com.botprobe.verify.config.ProbeConfigException if the profile is
     *                                                         missing or invalid
     */
    public static BotProbe fromConfig(ProbeConfigService configService, String profile, TriggerChannel channel) {
        return fromConfig(configService, profile, channel, Ticker.SYSTEM);
    }

    public static BotProbe fromConfig(ProbeConfigService configService, String profile, TriggerChannel channel,
            Ticker ticker) {
        configService.applyLogging();
        return create(configService.resolveSettings(profile), channel, ticker);
    }

    static SubsystemLogger loggerFor(ProbeSettings settings) {
        return SubsystemLogger.create("probe/" + settings.channelIdentity());
    }
}
