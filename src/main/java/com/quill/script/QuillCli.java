package com.quill.script;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.quill.debug.ConsoleDebugSink;
import com.quill.debug.Debug;
import com.quill.script.parser.ExecutionState;
import com.quill.surface.RecordingSurface;

/**
 * Runs one script file and writes the recorded drawing as JSON.
 *
 * Exit codes: 0 success, 1 script error, 2 usage / bad config, 3 file I/O failure.
 */
public final class QuillCli {
    private static final String TAG = "Cli";

    static final String USAGE = "Usage: QuillCli [--config=file.json] [--out=drawing.json] [--timeout-ms=n] <script-file>";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> flags = new LinkedHashMap<String, String>();
        List<String> positional = new ArrayList<String>();
        parseArgs(args, flags, positional);

        for (String f : flags.keySet()) {
            if (!f.equals("config") && !f.equals("out") && !f.equals("timeout-ms")) {
                err.println("Unknown option: --" + f);
                err.println(USAGE);
                return 2;
            }
        }
        if (positional.size() != 1) {
            err.println(USAGE);
            return 2;
        }

        QuillConfig loaded;
        try {
            loaded = flags.containsKey("config") ? QuillConfig.load(Path.of(flags.get("config"))) : QuillConfig.defaults();
            if (flags.containsKey("out")) loaded = loaded.withOutputPath(flags.get("out"));
            if (flags.containsKey("timeout-ms")) loaded = loaded.withTimeoutMs(Long.parseLong(flags.get("timeout-ms")));
        } catch (IOException e) {
            err.println("Failed to read config file: " + flags.get("config"));
            return 3;
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }
        final QuillConfig config = loaded;

        Debug.get().setSink(new ConsoleDebugSink(err));
        Debug.get().setLevel(config.debugLevel());
        Debug.get().d(TAG, "using " + config);

        final Path scriptPath = Path.of(positional.get(0));
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath);
            return 3;
        }

        QuillScript engine = new QuillScript(config);
        RecordingSurface surface = new RecordingSurface();
        ExecutionState state = engine.newState();

        RunResult result;
        ScheduledExecutorService timer = null;
        try {
            if (config.timeoutMs() > 0) {
                timer = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "quill-timeout");
                    t.setDaemon(true);
                    return t;
                });
                timer.schedule(() -> {
                    Debug.get().w(TAG, "timeout of " + config.timeoutMs() + " ms reached, cancelling");
                    state.cancel();
                }, config.timeoutMs(), TimeUnit.MILLISECONDS);
            }
            result = engine.run(script, surface, state);
        } finally {
            if (timer != null) timer.shutdownNow();
        }

        if (!result.isSuccess()) {
            err.println(result.error().report());
            return 1;
        }

        surface.present();
        String json = surface.toJson();
        if (config.outputPath() == null) {
            out.println(json);
        } else {
            Path outPath = Path.of(config.outputPath());
            try {
                Files.writeString(outPath, json + System.lineSeparator(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("Failed to write output file: " + outPath);
                Debug.get().e(TAG, "write failed", e);
                return 3;
            }
            Debug.get().i(TAG, "wrote " + surface.operations().size() + " operation(s) to " + outPath);
        }
        return 0;
    }

    static void parseArgs(String[] args, Map<String, String> flags, List<String> positional) {
        for (String a : args) {
            if (a.startsWith("--") && a.indexOf('=') >= 0) {
                int i = a.indexOf('=');
                flags.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                flags.put(a.substring(2), "true");
            } else {
                positional.add(a);
            }
        }
    }

    private QuillCli() {}
}
