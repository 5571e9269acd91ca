package com.alterante.speedtest.engine.cdn;

import java.net.URI;
import java.util.List;

/**
 * Built-in default endpoints. All of them can be overridden from the command line.
 */
public final class FallbackTargets {

    /** Upload sink accepted by every engine as the last tier. */
    public static final URI SHARED_UPLOAD = URI.create("https://speed.cloudflare.com/__up");

    public static final URI BULK_DOWNLOAD = URI.create("https://speed.cloudflare.com/__down?bytes=25000000");

    public static final List<URI> RANGE_CANDIDATES = List.of(
            URI.create("http://dl.google.com/linux/direct/google-chrome-stable_current_amd64.deb"),
            URI.create("http://dl.google.com/android/repository/platform-tools-latest-linux.zip"),
            URI.create("http://steamcdn-a.akamaihd.net/client/installer/SteamSetup.exe"));

    public static final List<URI> SOCKET_CANDIDATES = List.of(
            URI.create("https://speed.cloudflare.com/__down?bytes=10000000"),
            URI.create("https://github.com/desktop/desktop/releases/download/release-3.3.13/GitHubDesktopSetup-x64.exe"));

    public static final URI CATALOG = URI.create("https://api.fast.com/netflix/speedtest/v2?https=true&urlCount=5");

    private FallbackTargets() {}
}
