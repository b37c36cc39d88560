package com.trackdeck;

import com.trackdeck.core.Kernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.text.SimpleDateFormat;
import java.util.Date;

public class Main {
    // Logger erst initialisieren NACHDEM Streams umgebogen wurden
    private static Logger logger;

    public static void main(String[] args) {
        setupGlobalLogging();

        logger = LoggerFactory.getLogger(Main.class);
        logger.info("🚀 Starting TrackDeck...");
        logger.info("📄 Log File: logs/latest.log (und session-*.log)");

        Kernel kernel = null;
        try {
            kernel = Kernel.getInstance();
            Runtime.getRuntime().addShutdownHook(new Thread(Kernel.getInstance()::shutdown, "ShutdownHook"));
            kernel.start();
            System.out.println(kernel.executeCommand("help"));
            runConsole(kernel);
            kernel.shutdown();
        } catch (Exception e) {
            logger.error("CRITICAL FAILURE during startup", e);
            e.printStackTrace(); // Sicherheitshalber auch direkt printen
            if (kernel != null)
                kernel.shutdown();
            System.exit(1);
        }
    }

    private static void runConsole(Kernel kernel) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        System.out.print("> ");
        while ((line = in.readLine()) != null) {
            String reply = kernel.executeCommand(line);
            if (!reply.isEmpty())
                System.out.println(reply);
            if (line.trim().equalsIgnoreCase("quit"))
                break;
            drainSignals(kernel);
            System.out.print("> ");
        }
    }

    // Signale nur anzeigen, nie blockieren
    private static void drainSignals(Kernel kernel) {
        var signals = kernel.getSignals();
        for (Boolean playlist : signals.nowPlayingChanged().drain())
            logger.debug("Now playing changed (playlist={})", playlist);
        signals.playlistEnded().drain().forEach(g -> System.out.println("📜 Playlist session ended."));
        signals.addToPlaylistCompleted().drain().forEach(name -> System.out.println("✅ Saved to '" + name + "'."));
    }

    /**
     * Leitet System.out und System.err in Dateien um, BEVOR irgendwas anderes passiert.
     */
    private static void setupGlobalLogging() {
        try {
            File logDir = new File("logs");
            if (!logDir.exists()) logDir.mkdirs();

            String timeStamp = new SimpleDateFormat("yyyy-MM-dd_HH-mm-ss").format(new Date());
            File sessionLog = new File(logDir, "session-" + timeStamp + ".log");
            File latestLog = new File(logDir, "latest.log");

            FileOutputStream sessionStream = new FileOutputStream(sessionLog);
            FileOutputStream latestStream = new FileOutputStream(latestLog); // Überschreibt latest.log

            // Konsole + SessionFile + LatestFile
            MultiOutputStream multiOut = new MultiOutputStream(System.out, sessionStream, latestStream);
            MultiOutputStream multiErr = new MultiOutputStream(System.err, sessionStream, latestStream);

            System.setOut(new PrintStream(multiOut, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(multiErr, true, StandardCharsets.UTF_8));

        } catch (Exception e) {
            System.err.println("FATAL: Konnte Logging nicht initialisieren: " + e.getMessage());
        }
    }

    // Tee: Output an mehrere Ziele
    static class MultiOutputStream extends OutputStream {
        private final OutputStream[] streams;

        public MultiOutputStream(OutputStream... streams) {
            this.streams = streams;
        }

        @Override
        public void write(int b) throws IOException {
            for (OutputStream s : streams) s.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            for (OutputStream s : streams) s.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            for (OutputStream s : streams) s.flush();
        }

        @Override
        public void close() throws IOException {
            for (OutputStream s : streams) s.close();
        }
    }
}
