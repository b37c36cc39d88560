package com.trackdeck.test;

import com.trackdeck.api.ExternalPlayer;
import com.trackdeck.api.ResolutionService;
import com.trackdeck.api.SessionPlugin;
import com.trackdeck.core.Kernel;

/**
 * Registers a {@link FakePlayer} and a {@link FakeResolutionService} so a {@link Kernel}
 * can start without mpv or yt-dlp. Found through META-INF/services on the test classpath.
 */
public class FakeServicesPlugin implements SessionPlugin {
    public static final String NAME = "FakeServices";

    private Kernel kernel;
    private FakePlayer player;
    private FakeResolutionService resolution;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getVersion() {
        return "test";
    }

    @Override
    public void onEnable(Kernel kernel) {
        this.kernel = kernel;
        this.player = new FakePlayer();
        this.resolution = new FakeResolutionService()
                .onSearch("daft punk",
                        FakeResolutionService.result("d1", "One More Time", "Daft Punk"),
                        FakeResolutionService.result("d2", "Digital Love", "Daft Punk"));
        kernel.registerService(ExternalPlayer.class, player);
        kernel.registerService(ResolutionService.class, resolution);
    }

    @Override
    public void onDisable() {
        kernel.unregisterService(ExternalPlayer.class);
        kernel.unregisterService(ResolutionService.class);
        player.close();
    }
}
