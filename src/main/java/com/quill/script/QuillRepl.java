package com.quill.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.quill.debug.ConsoleDebugSink;
import com.quill.debug.Debug;
import com.quill.script.parser.Value;
import com.quill.surface.RecordingSurface;

/**
 * Interactive Quill Script shell over a recording surface.
 *
 * Input continues on the next line while it ends with '\' or has unclosed braces,
 * so function bodies can be typed over several lines. Values of expression
 * statements are printed; errors are printed and the session carries on.
 */
public final class QuillRepl {
    private static final String TAG = "Repl";

    static final String PROMPT = "quill> ";
    static final String CONTINUE_PROMPT = "...  ";

    private final Session session;
    private final RecordingSurface surface;
    private final PrintStream out;

    public QuillRepl(QuillScript engine, PrintStream out) {
        this.surface = new RecordingSurface();
        this.session = engine.newSession(surface);
        this.out = out;
    }

    static final String USAGE = "Usage: QuillRepl [--config=file.json]";

    public static void main(String[] args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        int code = run(args, in, System.out, System.err);
        if (code != 0) System.exit(code);
    }

    /** Same exit codes as {@link QuillCli#run}: 2 for bad usage or configuration, 3 for an unreadable file. */
    public static int run(String[] args, BufferedReader in, PrintStream out, PrintStream err) throws IOException {
        Map<String, String> flags = new LinkedHashMap<String, String>();
        List<String> positional = new ArrayList<String>();
        QuillCli.parseArgs(args, flags, positional);

        for (String f : flags.keySet()) {
            if (!f.equals("config")) {
                err.println("Unknown option: --" + f);
                err.println(USAGE);
                return 2;
            }
        }
        if (!positional.isEmpty()) {
            err.println(USAGE);
            return 2;
        }

        QuillConfig config;
        try {
            config = flags.containsKey("config")
                    ? QuillConfig.load(Path.of(flags.get("config")))
                    : QuillConfig.defaults();
        } catch (IOException e) {
            err.println("Failed to read config file: " + flags.get("config"));
            return 3;
        } catch (IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }
        Debug.get().setSink(new ConsoleDebugSink(err));
        Debug.get().setLevel(config.debugLevel());

        QuillRepl repl = new QuillRepl(new QuillScript(config), out);
        out.println("Quill Script REPL");
        out.println("Type 'help' for commands.");
        repl.loop(in);
        return 0;
    }

    public void loop(BufferedReader in) throws IOException {
        StringBuilder pending = new StringBuilder();

        while (true) {
            out.print(pending.length() == 0 ? PROMPT : CONTINUE_PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) break; // EOF

            if (pending.length() == 0) {
                String cmd = line.trim().toLowerCase(Locale.ROOT);
                if (cmd.isEmpty()) continue;
                if ("exit".equals(cmd) || "quit".equals(cmd) || "q".equals(cmd)) return;
                if (handleCommand(cmd)) continue;
            }

            pending.append(line).append('\n');
            if (needsMore(pending)) continue;

            String text = pending.toString();
            pending.setLength(0);
            evaluate(text);
        }

        if (pending.length() > 0) evaluate(pending.toString());
    }

    private boolean handleCommand(String cmd) {
        switch (cmd) {
            case "help":
                printHelp();
                return true;
            case "clear":
                surface.clear();
                out.println("surface cleared");
                return true;
            case "reset":
                session.reset();
                out.println("turtle and surface reset");
                return true;
            case "dump":
                out.println(surface.toJson());
                return true;
            default:
                return false;
        }
    }

    private void evaluate(String text) {
        RunResult r = session.evalStatement(text);
        if (!r.isSuccess()) {
            out.println(r.error().report());
            return;
        }
        Value v = r.value();
        if (!v.isUnit()) out.println(v);
        Debug.get().t(TAG, "evaluated " + text.length() + " chars");
    }

    /** True while the buffer ends with a continuation '\' or has more '{' than '}' outside strings and comments. */
    public static boolean needsMore(CharSequence buf) {
        String s = buf.toString();
        String trimmed = s.stripTrailing();
        if (trimmed.endsWith("\\")) return true;

        int depth = 0;
        boolean inString = false;
        boolean inComment = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (inComment) {
                if (c == '\n') inComment = false;
            } else if (inString) {
                if (c == '\\') i++;
                else if (c == '"' || c == '\n') inString = false;
            } else if (c == '"') {
                inString = true;
            } else if (c == '#') {
                inComment = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
        }
        return depth > 0;
    }

    private void printHelp() {
        String nl = "\n";
        out.println(
                "Commands:" + nl +
                "  help              show this text" + nl +
                "  exit | quit | q   leave the REPL" + nl +
                "  clear             clear the drawing surface" + nl +
                "  reset             turtle home, pen down, surface cleared (variables are kept)" + nl +
                "  dump              print the recorded drawing as JSON" + nl +
                nl +
                "Anything else is run as Quill Script, e.g." + nl +
                "  var size = 50" + nl +
                "  for i = 1 to 4 { forward(size); right(90) }" + nl +
                "  xpos()" + nl +
                nl +
                "End a line with '\\' to continue it; open braces continue automatically."
        );
    }
}
