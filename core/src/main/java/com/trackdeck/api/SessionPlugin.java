package com.trackdeck.api;

import com.trackdeck.core.Kernel;

public interface SessionPlugin {
    // Name des Plugins (z.B. "Mpv"), Schlüssel in der plugins-Map der Config
    String getName();

    // Version (z.B. "1.0.0")
    String getVersion();

    // Wird beim Start aufgerufen. Hier registriert das Plugin seine Services/Befehle.
    void onEnable(Kernel kernel);

    // Wird beim Beenden aufgerufen (Cleanup).
    void onDisable();
}
